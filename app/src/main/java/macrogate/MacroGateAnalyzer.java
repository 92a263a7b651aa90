package macrogate;

import java.util.List;
import java.util.Objects;
import macrogate.export.CircuitGraph;
import macrogate.export.GraphExporter;
import macrogate.hierarchy.Hierarchy;
import macrogate.hierarchy.HierarchyBuilder;
import macrogate.label.LabelSynthesizer;
import macrogate.label.Macro;
import macrogate.label.MacroLabeler;
import macrogate.label.RuleTableLabelSynthesizer;
import macrogate.match.MacroCandidate;
import macrogate.match.PatternMatcher;
import macrogate.model.OperationSequence;
import macrogate.reconstruct.CircuitReconstructor;
import macrogate.reconstruct.Reconstruction;
import macrogate.reconstruct.ReconstructionException;
import macrogate.resolve.OverlapResolver;
import macrogate.resolve.SelectedPattern;
import macrogate.util.StageTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the engine: match, resolve, label and build the hierarchy for one sequence, then
 * rebuild or export it on request.
 *
 * <p>Each call works on its own data only, so one analyzer may serve concurrent callers.
 */
public final class MacroGateAnalyzer {
  private static final Logger LOG = LoggerFactory.getLogger(MacroGateAnalyzer.class);

  private final LabelSynthesizer labelSynthesizer;
  private final HierarchyBuilder hierarchyBuilder = new HierarchyBuilder();
  private final GraphExporter graphExporter = new GraphExporter();

  public MacroGateAnalyzer() {
    this(new RuleTableLabelSynthesizer());
  }

  public MacroGateAnalyzer(LabelSynthesizer labelSynthesizer) {
    this.labelSynthesizer = Objects.requireNonNull(labelSynthesizer, "labelSynthesizer");
  }

  public AnalysisResult analyze(OperationSequence sequence) {
    return analyze(sequence, AnalysisOptions.defaults());
  }

  /**
   * @throws IllegalArgumentException if {@code options} are invalid; nothing is analyzed then
   */
  public AnalysisResult analyze(OperationSequence sequence, AnalysisOptions options) {
    Objects.requireNonNull(sequence, "sequence");
    Objects.requireNonNull(options, "options").validate();
    LOG.info(
        "Analyzing {} operations on {} qubits (r={}, windows {}..{}, parallelism {})",
        sequence.size(),
        sequence.qubitCount(),
        options.minRepetitions(),
        options.minWindowSize(),
        options.maxWindowSize(),
        options.parallelism());
    StageTimer timer = StageTimer.start();

    PatternMatcher matcher =
        new PatternMatcher(
            options.minRepetitions(),
            options.minWindowSize(),
            options.maxWindowSize(),
            options.parallelism());
    List<MacroCandidate> candidates = matcher.findCandidates(sequence);
    timer.mark("match");

    OverlapResolver resolver = new OverlapResolver(options.minRepetitions());
    List<SelectedPattern> selected = resolver.resolve(candidates);
    timer.mark("resolve");

    List<Macro> macros = new MacroLabeler(labelSynthesizer).label(sequence, selected);
    timer.mark("label");

    Hierarchy hierarchy = hierarchyBuilder.build(sequence, macros);
    timer.mark("hierarchy");

    AnalysisResult result =
        new AnalysisResult(
            sequence, options, macros, hierarchy, timer.elapsedMillis(), timer.stageMillis());
    LOG.info(
        "Found {} macro(s) from {} candidate(s): {} -> {} items (ratio {}) in {} ms",
        macros.size(),
        candidates.size(),
        sequence.size(),
        hierarchy.size(),
        String.format("%.2f", hierarchy.statistics().compressionRatio()),
        result.elapsedMillis());
    return result;
  }

  /**
   * Rebuilds a flat sequence from the result's hierarchy under its adjacency policy.
   *
   * @throws ReconstructionException if the policy cannot be met by commuting reorders
   */
  public Reconstruction reconstruct(AnalysisResult result) {
    Objects.requireNonNull(result, "result");
    CircuitReconstructor reconstructor =
        new CircuitReconstructor(result.options().adjacencyPolicy());
    try {
      return reconstructor.reconstruct(result.sequence(), result.hierarchy());
    } catch (ReconstructionException ex) {
      LOG.warn("Reconstruction failed: {}", ex.getMessage());
      throw ex;
    }
  }

  public CircuitGraph exportGraph(AnalysisResult result) {
    Objects.requireNonNull(result, "result");
    return graphExporter.export(result.sequence(), result.hierarchy());
  }
}
