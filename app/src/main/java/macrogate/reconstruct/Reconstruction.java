package macrogate.reconstruct;

import java.util.List;
import java.util.Objects;
import macrogate.model.OperationSequence;

/**
 * A rebuilt flat sequence. {@code sourcePositions.get(i)} is the position, in the analyzed
 * sequence, of the operation that ended up at index i.
 */
public record Reconstruction(
    OperationSequence sequence, List<Integer> sourcePositions, int reorderCount) {

  public Reconstruction {
    Objects.requireNonNull(sequence, "sequence");
    sourcePositions = List.copyOf(sourcePositions);
  }
}
