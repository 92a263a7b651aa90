package macrogate.resolve;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import macrogate.match.MacroCandidate;
import macrogate.match.Occurrence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Greedy, single-pass selection of disjoint occurrences.
 *
 * <p>Candidates are visited by {@link #PRIORITY}: value ({@code windowSize * count}) descending,
 * then smaller window size, then earlier first occurrence. Each candidate claims, in position
 * order, every occurrence that does not touch an already claimed position. A candidate left with
 * fewer than {@code minRepetitions} claims is dropped and its claims are released for the
 * candidates that follow. There is no second pass, so the result is deterministic but not
 * necessarily the maximum cover.
 */
public final class OverlapResolver {
  private static final Logger LOG = LoggerFactory.getLogger(OverlapResolver.class);

  public static final Comparator<MacroCandidate> PRIORITY =
      Comparator.comparingLong(MacroCandidate::value)
          .reversed()
          .thenComparingInt(MacroCandidate::windowSize)
          .thenComparingInt(MacroCandidate::firstStart);

  private final int minRepetitions;

  public OverlapResolver(int minRepetitions) {
    if (minRepetitions < 2) {
      throw new IllegalArgumentException("minRepetitions must be at least 2: " + minRepetitions);
    }
    this.minRepetitions = minRepetitions;
  }

  public List<SelectedPattern> resolve(List<MacroCandidate> candidates) {
    Objects.requireNonNull(candidates, "candidates");
    List<MacroCandidate> ordered = new ArrayList<>(candidates);
    ordered.sort(PRIORITY);

    BitSet claimed = new BitSet();
    List<SelectedPattern> selected = new ArrayList<>();
    int discarded = 0;
    for (MacroCandidate candidate : ordered) {
      List<Occurrence> accepted = new ArrayList<>();
      for (Occurrence occurrence : candidate.occurrences()) {
        if (claimed.get(occurrence.start(), occurrence.end()).isEmpty()) {
          claimed.set(occurrence.start(), occurrence.end());
          accepted.add(occurrence);
        }
      }
      if (accepted.size() < minRepetitions) {
        for (Occurrence occurrence : accepted) {
          claimed.clear(occurrence.start(), occurrence.end());
        }
        if (!accepted.isEmpty()) {
          LOG.debug(
              "Released {} occurrence(s) of {} (size {}): below {} repetitions",
              accepted.size(),
              candidate.signature(),
              candidate.windowSize(),
              minRepetitions);
        }
        discarded++;
        continue;
      }
      selected.add(new SelectedPattern(candidate.signature(), candidate.windowSize(), accepted));
    }
    LOG.debug(
        "Resolved {} candidates into {} patterns ({} discarded), {} positions covered",
        candidates.size(),
        selected.size(),
        discarded,
        claimed.cardinality());
    return selected;
  }
}
