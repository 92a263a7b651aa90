package macrogate.resolve;

import java.util.List;
import java.util.Objects;
import macrogate.match.Occurrence;
import macrogate.signature.CanonicalSignature;

/** A candidate that survived resolution, with only its accepted, pairwise-disjoint occurrences. */
public record SelectedPattern(
    CanonicalSignature signature, int windowSize, List<Occurrence> occurrences) {

  public SelectedPattern {
    Objects.requireNonNull(signature, "signature");
    occurrences = List.copyOf(occurrences);
    for (int i = 1; i < occurrences.size(); i++) {
      if (occurrences.get(i).start() <= occurrences.get(i - 1).start()) {
        throw new IllegalArgumentException(
            "Occurrences must be in increasing start order, got " + occurrences);
      }
    }
  }

  public int count() {
    return occurrences.size();
  }

  public int firstStart() {
    return occurrences.get(0).start();
  }
}
