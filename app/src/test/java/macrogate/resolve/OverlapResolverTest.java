package macrogate.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import macrogate.match.MacroCandidate;
import macrogate.match.Occurrence;
import macrogate.match.PatternMatcher;
import macrogate.signature.CanonicalSignature;
import macrogate.signature.QubitBinding;
import macrogate.signature.SignatureElement;
import macrogate.testing.Circuits;
import org.junit.jupiter.api.Test;

final class OverlapResolverTest {
  private static final QubitBinding ONE_QUBIT = new QubitBinding(List.of(0));

  private static MacroCandidate candidate(String tag, int windowSize, int... starts) {
    List<SignatureElement> elements = new ArrayList<>();
    for (int i = 0; i < windowSize; i++) {
      elements.add(new SignatureElement(tag + i, List.of(0), List.of()));
    }
    List<Occurrence> occurrences = new ArrayList<>();
    for (int start : starts) {
      occurrences.add(new Occurrence(start, start + windowSize, ONE_QUBIT));
    }
    return new MacroCandidate(new CanonicalSignature(elements), windowSize, occurrences);
  }

  private static List<Integer> starts(SelectedPattern pattern) {
    return pattern.occurrences().stream().map(Occurrence::start).toList();
  }

  @Test
  void lowerValueCandidateKeepsNonOverlappingOccurrences() {
    MacroCandidate big = candidate("a", 4, 0, 4, 8);
    MacroCandidate small = candidate("b", 2, 10, 12, 14);

    List<SelectedPattern> selected = new OverlapResolver(2).resolve(List.of(small, big));

    assertEquals(2, selected.size());
    assertEquals(big.signature(), selected.get(0).signature(), "Value 12 goes first");
    assertEquals(List.of(0, 4, 8), starts(selected.get(0)));
    assertEquals(List.of(12, 14), starts(selected.get(1)), "Occurrence at 10 overlaps [8, 12)");
  }

  @Test
  void candidateBelowThresholdAfterOverlapIsDiscarded() {
    MacroCandidate big = candidate("a", 4, 0, 4, 8);
    MacroCandidate small = candidate("b", 2, 6, 10, 12);

    List<SelectedPattern> selected = new OverlapResolver(2).resolve(List.of(big, small));

    assertEquals(1, selected.size(), "Only [12, 14) survives, which is below two repetitions");
    assertEquals(big.signature(), selected.get(0).signature());
  }

  @Test
  void discardedCandidateReleasesItsClaims() {
    MacroCandidate first = candidate("a", 3, 0, 3, 6);
    MacroCandidate blocked = candidate("b", 4, 5, 20);
    MacroCandidate last = candidate("c", 2, 20, 22, 30);

    List<SelectedPattern> selected =
        new OverlapResolver(2).resolve(List.of(last, blocked, first));

    assertEquals(2, selected.size());
    assertEquals(last.signature(), selected.get(1).signature());
    assertEquals(
        List.of(20, 22, 30), starts(selected.get(1)), "[20, 24) was released by the 4-gate block");
  }

  @Test
  void tiesPreferSmallerWindowThenEarlierStart() {
    MacroCandidate wide = candidate("a", 3, 0, 3);
    MacroCandidate narrowLate = candidate("b", 2, 20, 22, 24);
    MacroCandidate narrowEarly = candidate("c", 2, 10, 12, 14);

    List<MacroCandidate> ordered = new ArrayList<>(List.of(wide, narrowLate, narrowEarly));
    ordered.sort(OverlapResolver.PRIORITY);

    assertEquals(List.of(narrowEarly, narrowLate, wide), ordered);
  }

  @Test
  void selectedOccurrencesArePairwiseDisjoint() {
    for (long seed = 1; seed <= 5; seed++) {
      List<MacroCandidate> candidates =
          new PatternMatcher(2, 1, 5, 1).findCandidates(Circuits.random(seed, 3, 50));
      BitSet covered = new BitSet();
      for (SelectedPattern pattern : new OverlapResolver(2).resolve(candidates)) {
        assertTrue(pattern.count() >= 2, "Selected pattern below threshold for seed " + seed);
        for (Occurrence occurrence : pattern.occurrences()) {
          assertTrue(
              covered.get(occurrence.start(), occurrence.end()).isEmpty(),
              "Overlap at " + occurrence + " for seed " + seed);
          covered.set(occurrence.start(), occurrence.end());
        }
      }
    }
  }

  @Test
  void occurrencesMustBeInPositionOrder() {
    assertThrows(IllegalArgumentException.class, () -> candidate("a", 2, 10, 0, 4));
    assertThrows(IllegalArgumentException.class, () -> candidate("a", 2, 4, 4));
  }

  @Test
  void emptyCandidateListResolvesToNothing() {
    assertTrue(new OverlapResolver(3).resolve(List.of()).isEmpty());
    assertThrows(IllegalArgumentException.class, () -> new OverlapResolver(1));
  }
}
