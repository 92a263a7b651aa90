package macrogate.model;

import java.util.Arrays;

/**
 * Per-qubit dependency structure of a sequence: for every operation, the operation that last
 * touched each of its qubits, and the resulting layer (longest dependency chain ending there).
 *
 * <p>Layers are 0-based; {@link #depth()} is the number of layers.
 */
public final class QubitDependencyView {
  /** Predecessor marker for a qubit not touched before. */
  public static final int NONE = -1;

  private final OperationSequence sequence;
  private final int[][] predecessors;
  private final int[] layers;
  private final int[] lastOnQubit;
  private final int depth;

  QubitDependencyView(OperationSequence sequence) {
    this.sequence = sequence;
    int n = sequence.size();
    this.predecessors = new int[n][];
    this.layers = new int[n];
    this.lastOnQubit = new int[sequence.qubitCount()];
    Arrays.fill(lastOnQubit, NONE);
    int maxLayer = -1;
    for (int pos = 0; pos < n; pos++) {
      Operation op = sequence.get(pos);
      int[] preds = new int[op.arity()];
      int layer = 0;
      for (int i = 0; i < preds.length; i++) {
        int qubit = op.qubits().get(i);
        preds[i] = lastOnQubit[qubit];
        if (preds[i] != NONE) {
          layer = Math.max(layer, layers[preds[i]] + 1);
        }
        lastOnQubit[qubit] = pos;
      }
      predecessors[pos] = preds;
      layers[pos] = layer;
      maxLayer = Math.max(maxLayer, layer);
    }
    this.depth = maxLayer + 1;
  }

  public OperationSequence sequence() {
    return sequence;
  }

  /**
   * Position of the previous operation on the {@code index}-th qubit of the operation at {@code
   * position}, or {@link #NONE}.
   */
  public int predecessor(int position, int index) {
    return predecessors[position][index];
  }

  public int layer(int position) {
    return layers[position];
  }

  /** Last operation touching {@code qubit}, or {@link #NONE} for an idle wire. */
  public int lastOn(int qubit) {
    return lastOnQubit[qubit];
  }

  public int depth() {
    return depth;
  }
}
