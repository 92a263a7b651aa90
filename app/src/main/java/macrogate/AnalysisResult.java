package macrogate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import macrogate.hierarchy.CircuitStatistics;
import macrogate.hierarchy.Hierarchy;
import macrogate.label.Macro;
import macrogate.model.OperationSequence;

/** Outcome of one analysis call. Timing fields are informational and vary between runs. */
public record AnalysisResult(
    OperationSequence sequence,
    AnalysisOptions options,
    List<Macro> macros,
    Hierarchy hierarchy,
    long elapsedMillis,
    Map<String, Long> stageMillis) {

  public AnalysisResult {
    Objects.requireNonNull(sequence, "sequence");
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(hierarchy, "hierarchy");
    macros = List.copyOf(macros);
    stageMillis =
        stageMillis == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(stageMillis));
  }

  public CircuitStatistics statistics() {
    return hierarchy.statistics();
  }
}
