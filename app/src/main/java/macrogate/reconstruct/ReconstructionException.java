package macrogate.reconstruct;

import macrogate.model.Operation;

/**
 * Raised when a reconstructed sequence cannot satisfy the adjacency policy through commuting
 * reorders, or when it fails the per-qubit equivalence check against the source sequence.
 */
public final class ReconstructionException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final int index;
  private final transient Operation previous;
  private final transient Operation next;

  public ReconstructionException(String message, int index, Operation previous, Operation next) {
    super(message);
    this.index = index;
    this.previous = previous;
    this.next = next;
  }

  static ReconstructionException adjacency(
      AdjacencyPolicy policy, int index, Operation previous, Operation next) {
    return new ReconstructionException(
        "No commuting reorder separates "
            + previous
            + " and "
            + next
            + " at flat index "
            + index
            + " under "
            + policy,
        index,
        previous,
        next);
  }

  static ReconstructionException projectionMismatch(
      int qubit, int index, Operation expected, Operation actual) {
    return new ReconstructionException(
        "Qubit "
            + qubit
            + " diverges from the source at projection index "
            + index
            + ": expected "
            + expected
            + " but found "
            + actual,
        index,
        expected,
        actual);
  }

  /** Flat index of the offending operation, or its index within a qubit projection. */
  public int index() {
    return index;
  }

  public Operation previous() {
    return previous;
  }

  public Operation next() {
    return next;
  }
}
