package macrogate.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One linearized circuit operation.
 *
 * <p>The order of {@code qubits} is significant: for asymmetric gates such as {@code cx} the first
 * entry is the control. {@code parameters} is empty for gates without numeric arguments.
 */
public record Operation(
    int position, String gateType, List<Integer> qubits, List<Double> parameters) {

  /** Parameters are compared after rounding to this many decimal places. */
  public static final int PARAMETER_DECIMALS = 6;

  private static final double BUCKET_SCALE = 1_000_000d;

  public Operation {
    Objects.requireNonNull(gateType, "gateType");
    Objects.requireNonNull(qubits, "qubits");
    if (position < 0) {
      throw new IllegalArgumentException("Operation position must be non-negative: " + position);
    }
    if (gateType.isBlank()) {
      throw new IllegalArgumentException("Operation at position " + position + " has no gate type");
    }
    if (qubits.isEmpty()) {
      throw new IllegalArgumentException(
          "Operation " + gateType + "@" + position + " does not act on any qubit");
    }
    Set<Integer> seen = new HashSet<>();
    for (Integer qubit : qubits) {
      Objects.requireNonNull(qubit, "qubit");
      if (!seen.add(qubit)) {
        throw new IllegalArgumentException(
            "Operation " + gateType + "@" + position + " lists qubit " + qubit + " twice");
      }
    }
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
    for (Double parameter : parameters) {
      if (parameter.isNaN() || parameter.isInfinite()) {
        throw new IllegalArgumentException(
            "Operation " + gateType + "@" + position + " has non-finite parameter " + parameter);
      }
    }
    qubits = List.copyOf(qubits);
  }

  public Operation(int position, String gateType, List<Integer> qubits) {
    this(position, gateType, qubits, List.of());
  }

  public int arity() {
    return qubits.size();
  }

  public boolean isTwoQubit() {
    return qubits.size() == 2;
  }

  public boolean actsOn(int qubit) {
    return qubits.contains(qubit);
  }

  /** True when the two operations share no qubit, so their relative order is irrelevant. */
  public boolean disjointFrom(Operation other) {
    for (Integer qubit : qubits) {
      if (other.qubits.contains(qubit)) {
        return false;
      }
    }
    return true;
  }

  /** Parameter values rounded to {@link #PARAMETER_DECIMALS} decimals, as fixed-point longs. */
  public List<Long> parameterBuckets() {
    if (parameters.isEmpty()) {
      return List.of();
    }
    Long[] buckets = new Long[parameters.size()];
    for (int i = 0; i < buckets.length; i++) {
      buckets[i] = Math.round(parameters.get(i) * BUCKET_SCALE);
    }
    return List.of(buckets);
  }

  /**
   * Same gate, same wiring and same parameter buckets. Positions are ignored, so an operation and
   * its copy at another index of a rebuilt sequence compare equal.
   */
  public boolean sameAction(Operation other) {
    return gateType.equals(other.gateType)
        && qubits.equals(other.qubits)
        && parameterBuckets().equals(other.parameterBuckets());
  }

  public Operation atPosition(int newPosition) {
    return newPosition == position
        ? this
        : new Operation(newPosition, gateType, qubits, parameters);
  }

  @Override
  public String toString() {
    return gateType + qubits + (parameters.isEmpty() ? "" : parameters.toString()) + "@" + position;
  }
}
