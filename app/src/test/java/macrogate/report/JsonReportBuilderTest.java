package macrogate.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.util.List;
import java.util.Map;
import macrogate.AnalysisOptions;
import macrogate.AnalysisResult;
import macrogate.MacroGateAnalyzer;
import macrogate.model.OperationSequence;
import macrogate.testing.Circuits;
import org.junit.jupiter.api.Test;

final class JsonReportBuilderTest {
  private final MacroGateAnalyzer analyzer = new MacroGateAnalyzer();
  private final JsonReportBuilder builder = new JsonReportBuilder();

  @Test
  void reportHasFourViews() {
    AnalysisResult result = analyzer.analyze(Circuits.ansatzLadder(), AnalysisOptions.of(2, 3));

    JsonObject root = JsonParser.parseString(builder.build(result)).getAsJsonObject();

    assertEquals(
        List.of("dag_flat", "dag_hierarchical", "macros", "statistics"),
        List.copyOf(root.keySet()));
    assertEquals(9, root.getAsJsonArray("dag_flat").size());
    JsonArray hierarchical = root.getAsJsonArray("dag_hierarchical");
    assertEquals(3, hierarchical.size());
    JsonObject second = hierarchical.get(1).getAsJsonObject();
    assertEquals("macro", second.get("type").getAsString());
    assertEquals("RY Entangling Block", second.get("label").getAsString());
    assertEquals(3, second.get("start_position").getAsInt());
    assertEquals(6, second.get("end_position").getAsInt());

    JsonObject stats = root.getAsJsonObject("statistics");
    assertEquals(3.0, stats.get("compression_ratio").getAsDouble(), 1e-9);
    assertEquals(6, stats.get("circuit_depth").getAsInt());
    assertEquals(17, stats.get("dag_nodes").getAsInt());
  }

  @Test
  void flatViewOmitsEmptyParameters() {
    OperationSequence sequence =
        OperationSequence.builder(1).add("h", 0).addParameterized("rz", 0.25, 0).build();
    List<Map<String, Object>> flat = ResultViews.flat(analyzer.analyze(sequence));

    assertFalse(flat.get(0).containsKey("params"));
    assertEquals(List.of(0.25), flat.get(1).get("params"));
  }

  @Test
  void gateItemsReportTheirPosition() {
    List<Map<String, Object>> view =
        ResultViews.hierarchical(analyzer.analyze(Circuits.noRepeats()));

    assertEquals(5, view.size());
    assertEquals("gate", view.get(2).get("type"));
    assertEquals("cx", view.get(2).get("name"));
    assertEquals(2, view.get(2).get("position"));
  }

  @Test
  void macroViewListsPositionsAsRanges() {
    AnalysisResult result = analyzer.analyze(Circuits.ansatzLadder(), AnalysisOptions.of(2, 3));
    Map<String, Object> macro = ResultViews.macros(result).get(0);

    assertEquals(3, macro.get("count"));
    assertEquals(3, macro.get("window_size"));
    assertEquals(
        List.of(
            Map.of("start", 0, "end", 3),
            Map.of("start", 3, "end", 6),
            Map.of("start", 6, "end", 9)),
        macro.get("positions"));
  }

  @Test
  void graphJsonUsesViewerKeys() {
    AnalysisResult result = analyzer.analyze(Circuits.ansatzLadder(), AnalysisOptions.of(2, 3));

    JsonObject graph =
        JsonParser.parseString(builder.build(analyzer.exportGraph(result))).getAsJsonObject();

    JsonObject edge = graph.getAsJsonArray("edges").get(0).getAsJsonObject();
    assertTrue(edge.has("from-node") && edge.has("to-node"));
    JsonObject first = graph.getAsJsonArray("nodes").get(0).getAsJsonObject();
    assertEquals("q_start_0", first.get("id").getAsString());
    assertEquals("init", first.get("type").getAsString());
    JsonObject group = graph.getAsJsonArray("macros").get(0).getAsJsonObject();
    assertEquals(9, group.getAsJsonArray("gate_ids").size());
    assertEquals(3, group.getAsJsonArray("nodes").size());
  }
}
