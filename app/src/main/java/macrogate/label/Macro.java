package macrogate.label;

import java.util.List;
import java.util.Objects;
import macrogate.match.Occurrence;
import macrogate.model.Operation;
import macrogate.signature.CanonicalSignature;

/**
 * A named, retained pattern.
 *
 * <p>{@code gates} is the generic body in signature order: positions are 0..k-1 within the macro
 * and qubits are local indices, resolved per occurrence through {@link Occurrence#binding()}.
 * Occurrences are disjoint and in position order.
 */
public record Macro(
    String label,
    CanonicalSignature signature,
    int windowSize,
    List<Operation> gates,
    List<Occurrence> occurrences) {

  public Macro {
    Objects.requireNonNull(label, "label");
    Objects.requireNonNull(signature, "signature");
    gates = List.copyOf(gates);
    occurrences = List.copyOf(occurrences);
    if (gates.size() != windowSize) {
      throw new IllegalArgumentException(
          "Macro " + label + " has " + gates.size() + " gates but window size " + windowSize);
    }
  }

  public int count() {
    return occurrences.size();
  }

  public int firstStart() {
    return occurrences.get(0).start();
  }

  /** The body of {@code occurrence} with concrete qubits, positioned from the occurrence start. */
  public List<Operation> expand(Occurrence occurrence) {
    Operation[] expanded = new Operation[gates.size()];
    for (int i = 0; i < expanded.length; i++) {
      Operation gate = gates.get(i);
      expanded[i] =
          new Operation(
              occurrence.start() + i,
              gate.gateType(),
              occurrence.binding().bind(gate.qubits()),
              gate.parameters());
    }
    return List.of(expanded);
  }
}
