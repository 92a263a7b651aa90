package macrogate.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, already linearized operation sequence over a fixed qubit set {@code 0..qubitCount-1}.
 *
 * <p>Positions run from 0 to N-1 without gaps or repeats and match list indices.
 */
public final class OperationSequence {
  private final int qubitCount;
  private final List<Operation> operations;

  public OperationSequence(int qubitCount, List<Operation> operations) {
    Objects.requireNonNull(operations, "operations");
    if (qubitCount < 0) {
      throw new IllegalArgumentException("qubitCount must be non-negative: " + qubitCount);
    }
    List<Operation> copy = List.copyOf(operations);
    for (int i = 0; i < copy.size(); i++) {
      Operation op = copy.get(i);
      if (op.position() != i) {
        throw new IllegalArgumentException(
            "Expected position " + i + " but found " + op.position() + " (" + op + ")");
      }
      for (int qubit : op.qubits()) {
        if (qubit < 0 || qubit >= qubitCount) {
          throw new IllegalArgumentException(
              "Qubit " + qubit + " of " + op + " is outside 0.." + (qubitCount - 1));
        }
      }
    }
    this.qubitCount = qubitCount;
    this.operations = copy;
  }

  public static OperationSequence empty(int qubitCount) {
    return new OperationSequence(qubitCount, List.of());
  }

  public static Builder builder(int qubitCount) {
    return new Builder(qubitCount);
  }

  public int qubitCount() {
    return qubitCount;
  }

  public int size() {
    return operations.size();
  }

  public boolean isEmpty() {
    return operations.isEmpty();
  }

  public Operation get(int position) {
    return operations.get(position);
  }

  public List<Operation> operations() {
    return operations;
  }

  /** The {@code length} operations starting at {@code start}. */
  public List<Operation> window(int start, int length) {
    return operations.subList(start, start + length);
  }

  /** Ordered subsequence of the operations touching {@code qubit}. */
  public List<Operation> projection(int qubit) {
    List<Operation> projected = new ArrayList<>();
    for (Operation op : operations) {
      if (op.actsOn(qubit)) {
        projected.add(op);
      }
    }
    return projected;
  }

  public QubitDependencyView dependencies() {
    return new QubitDependencyView(this);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof OperationSequence other)) {
      return false;
    }
    return qubitCount == other.qubitCount && operations.equals(other.operations);
  }

  @Override
  public int hashCode() {
    return Objects.hash(qubitCount, operations);
  }

  @Override
  public String toString() {
    return "OperationSequence[qubits=" + qubitCount + ", ops=" + operations + "]";
  }

  /** Appends operations with consecutive positions. */
  public static final class Builder {
    private final int qubitCount;
    private final List<Operation> operations = new ArrayList<>();

    private Builder(int qubitCount) {
      this.qubitCount = qubitCount;
    }

    public Builder add(String gateType, int... qubits) {
      return add(gateType, Arrays.stream(qubits).boxed().toList(), List.of());
    }

    public Builder addParameterized(String gateType, double parameter, int... qubits) {
      return add(gateType, Arrays.stream(qubits).boxed().toList(), List.of(parameter));
    }

    public Builder add(String gateType, List<Integer> qubits, List<Double> parameters) {
      operations.add(new Operation(operations.size(), gateType, qubits, parameters));
      return this;
    }

    public OperationSequence build() {
      return new OperationSequence(qubitCount, operations);
    }
  }
}
