package macrogate.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.LinkedHashMap;
import java.util.Map;
import macrogate.AnalysisResult;
import macrogate.export.CircuitGraph;

/** Renders analysis results and viewer graphs as pretty-printed JSON. */
public final class JsonReportBuilder {
  private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  /** The four result views under {@code dag_flat}, {@code dag_hierarchical}, ... */
  public String build(AnalysisResult result) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("dag_flat", ResultViews.flat(result));
    root.put("dag_hierarchical", ResultViews.hierarchical(result));
    root.put("macros", ResultViews.macros(result));
    root.put("statistics", ResultViews.statistics(result));
    return gson.toJson(root);
  }

  public String build(CircuitGraph graph) {
    return gson.toJson(ResultViews.graph(graph));
  }
}
