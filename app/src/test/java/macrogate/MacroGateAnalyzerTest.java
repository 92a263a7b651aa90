package macrogate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import macrogate.hierarchy.CircuitStatistics;
import macrogate.label.Macro;
import macrogate.match.Occurrence;
import macrogate.model.OperationSequence;
import macrogate.report.JsonReportBuilder;
import macrogate.testing.Circuits;
import org.junit.jupiter.api.Test;

final class MacroGateAnalyzerTest {
  private final MacroGateAnalyzer analyzer = new MacroGateAnalyzer();

  @Test
  void detectsRepeatedAnsatzBlock() {
    AnalysisResult result = analyzer.analyze(Circuits.ansatzLadder(), AnalysisOptions.of(2, 3));

    assertEquals(1, result.macros().size());
    Macro macro = result.macros().get(0);
    assertEquals("RY Entangling Block", macro.label());
    assertEquals(List.of(0, 3, 6), macro.occurrences().stream().map(Occurrence::start).toList());
    assertEquals(3, result.hierarchy().size());
    assertEquals(3.0, result.statistics().compressionRatio(), 1e-9);
    assertEquals(
        List.of("match", "resolve", "label", "hierarchy"),
        List.copyOf(result.stageMillis().keySet()));
  }

  @Test
  void sequenceWithoutRepeatsHasNoMacros() {
    AnalysisResult result = analyzer.analyze(Circuits.noRepeats());

    assertTrue(result.macros().isEmpty());
    assertEquals(5, result.hierarchy().size());
    assertEquals(1.0, result.statistics().compressionRatio(), 1e-9);
  }

  @Test
  void emptySequenceIsNotAnError() {
    AnalysisResult result = analyzer.analyze(OperationSequence.empty(3));

    CircuitStatistics stats = result.statistics();
    assertEquals(0, stats.originalGateCount());
    assertEquals(0, stats.hierarchicalItemCount());
    assertEquals(0.0, stats.compressionRatio());
    assertEquals(0, stats.circuitDepth());
    assertTrue(analyzer.reconstruct(result).sequence().isEmpty());
  }

  @Test
  void invalidOptionsAreRejectedBeforeAnalysis() {
    OperationSequence sequence = Circuits.ansatzLadder();
    assertThrows(
        IllegalArgumentException.class, () -> analyzer.analyze(sequence, AnalysisOptions.of(1, 3)));
    assertThrows(
        IllegalArgumentException.class, () -> analyzer.analyze(sequence, AnalysisOptions.of(2, 0)));
  }

  @Test
  void analysisIsDeterministic() {
    JsonReportBuilder json = new JsonReportBuilder();
    OperationSequence sequence = Circuits.random(42L, 4, 80);
    AnalysisOptions options = AnalysisOptions.of(2, 6);

    String first = json.build(analyzer.analyze(sequence, options));
    String second = json.build(analyzer.analyze(sequence, options));
    String parallel = json.build(analyzer.analyze(sequence, options.withParallelism(4)));

    assertEquals(first, second);
    assertEquals(first, parallel, "Parallel window scans must not change the result");
  }

  @Test
  void everyMacroMeetsTheThreshold() {
    OperationSequence sequence = Circuits.random(9L, 3, 60);
    for (int r = 2; r <= 4; r++) {
      AnalysisResult result = analyzer.analyze(sequence, AnalysisOptions.of(r, 5));
      for (Macro macro : result.macros()) {
        assertTrue(macro.count() >= r, macro.label() + " below r=" + r);
      }
    }
  }

  @Test
  void labelStrategyIsPluggable() {
    MacroGateAnalyzer custom = new MacroGateAnalyzer(shape -> "Block of " + shape.size());

    AnalysisResult result = custom.analyze(Circuits.ansatzLadder(), AnalysisOptions.of(2, 3));

    assertEquals("Block of 3", result.macros().get(0).label());
  }
}
