package macrogate.reconstruct;

import java.util.Set;
import macrogate.model.Operation;

/** Which back-to-back operation pairs a reconstructed sequence must not contain. */
public enum AdjacencyPolicy {
  /** Two two-qubit operations on the same unordered qubit pair. */
  SAME_QUBIT_PAIR {
    @Override
    public boolean violates(Operation previous, Operation next) {
      return previous.isTwoQubit()
          && next.isTwoQubit()
          && Set.copyOf(previous.qubits()).equals(Set.copyOf(next.qubits()));
    }
  },
  /** Any two two-qubit operations, whatever qubits they act on. */
  ANY_TWO_QUBIT {
    @Override
    public boolean violates(Operation previous, Operation next) {
      return previous.isTwoQubit() && next.isTwoQubit();
    }
  },
  NONE {
    @Override
    public boolean violates(Operation previous, Operation next) {
      return false;
    }
  };

  public abstract boolean violates(Operation previous, Operation next);
}
