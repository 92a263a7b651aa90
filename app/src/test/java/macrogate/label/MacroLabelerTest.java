package macrogate.label;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import macrogate.match.Occurrence;
import macrogate.model.Operation;
import macrogate.model.OperationSequence;
import macrogate.resolve.SelectedPattern;
import macrogate.signature.SignatureCanonicalizer;
import macrogate.signature.SignatureCanonicalizer.CanonicalWindow;
import org.junit.jupiter.api.Test;

final class MacroLabelerTest {

  /** Two different CNOT pairs: reversed pairs at 0 and 2, parallel pairs at 4 and 6. */
  private static final OperationSequence PAIRS =
      OperationSequence.builder(2)
          .add("cx", 0, 1)
          .add("cx", 1, 0)
          .add("cx", 0, 1)
          .add("cx", 1, 0)
          .add("cx", 0, 1)
          .add("cx", 0, 1)
          .add("cx", 0, 1)
          .add("cx", 0, 1)
          .build();

  private static SelectedPattern pattern(OperationSequence sequence, int size, int... starts) {
    List<Occurrence> occurrences = new ArrayList<>();
    CanonicalWindow first = null;
    for (int start : starts) {
      CanonicalWindow window = SignatureCanonicalizer.canonicalize(sequence.window(start, size));
      first = first == null ? window : first;
      occurrences.add(new Occurrence(start, start + size, window.binding()));
    }
    return new SelectedPattern(first.signature(), size, occurrences);
  }

  @Test
  void collidingLabelsGetSuffixesByEarliestOccurrence() {
    SelectedPattern parallel = pattern(PAIRS, 2, 4, 6);
    SelectedPattern reversed = pattern(PAIRS, 2, 0, 2);

    List<Macro> macros =
        new MacroLabeler(new RuleTableLabelSynthesizer()).label(PAIRS, List.of(parallel, reversed));

    assertEquals("CNOT Pair B", macros.get(0).label(), "Macro order follows the input patterns");
    assertEquals("CNOT Pair A", macros.get(1).label());
  }

  @Test
  void uniqueLabelsAreLeftAlone() {
    List<Macro> macros =
        new MacroLabeler(shape -> "Block").label(PAIRS, List.of(pattern(PAIRS, 2, 4, 6)));

    assertEquals("Block", macros.get(0).label());
  }

  @Test
  void suffixesContinueAfterZ() {
    assertEquals("A", MacroLabeler.suffix(0));
    assertEquals("Z", MacroLabeler.suffix(25));
    assertEquals("AA", MacroLabeler.suffix(26));
    assertEquals("AB", MacroLabeler.suffix(27));
    assertEquals("BA", MacroLabeler.suffix(52));
  }

  @Test
  void macroBodyExpandsBackToEachOccurrence() {
    Macro macro =
        new MacroLabeler(new RuleTableLabelSynthesizer())
            .label(PAIRS, List.of(pattern(PAIRS, 2, 0, 2)))
            .get(0);

    assertEquals(List.of(1, 0), macro.gates().get(1).qubits(), "Body keeps local wiring");
    for (Occurrence occurrence : macro.occurrences()) {
      List<Operation> expanded = macro.expand(occurrence);
      List<Operation> original = PAIRS.window(occurrence.start(), occurrence.length());
      for (int i = 0; i < expanded.size(); i++) {
        assertTrue(expanded.get(i).sameAction(original.get(i)), "Mismatch at " + occurrence);
        assertEquals(original.get(i).position(), expanded.get(i).position());
      }
    }
  }

  @Test
  void blankLabelIsRejected() {
    MacroLabeler labeler = new MacroLabeler(shape -> " ");
    List<SelectedPattern> patterns = List.of(pattern(PAIRS, 2, 0, 2));
    assertThrows(IllegalStateException.class, () -> labeler.label(PAIRS, patterns));
  }
}
