package macrogate.match;

import java.util.List;
import java.util.Objects;
import macrogate.signature.CanonicalSignature;

/**
 * A signature repeated at least {@code minRepetitions} times. Occurrences are in position order and
 * may overlap each other; they are only made disjoint by the resolver.
 */
public record MacroCandidate(
    CanonicalSignature signature, int windowSize, List<Occurrence> occurrences) {

  public MacroCandidate {
    Objects.requireNonNull(signature, "signature");
    Objects.requireNonNull(occurrences, "occurrences");
    if (occurrences.isEmpty()) {
      throw new IllegalArgumentException("A candidate needs at least one occurrence");
    }
    if (signature.size() != windowSize) {
      throw new IllegalArgumentException(
          "Window size " + windowSize + " does not match signature size " + signature.size());
    }
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

  /** Number of operations the candidate would collapse if every occurrence were kept. */
  public long value() {
    return (long) windowSize * occurrences.size();
  }

  public int firstStart() {
    return occurrences.get(0).start();
  }
}
