package macrogate.report;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import macrogate.AnalysisResult;
import macrogate.export.CircuitGraph;
import macrogate.hierarchy.CircuitStatistics;
import macrogate.hierarchy.GateItem;
import macrogate.hierarchy.HierarchicalItem;
import macrogate.hierarchy.MacroInstance;
import macrogate.label.Macro;
import macrogate.match.Occurrence;
import macrogate.model.Operation;

/**
 * Plain nested maps and lists of primitives for callers: the flat, hierarchical, macro and
 * statistics views of an analysis, and the viewer graph. Keys keep insertion order.
 */
public final class ResultViews {
  private ResultViews() {}

  public static List<Map<String, Object>> flat(AnalysisResult result) {
    List<Map<String, Object>> view = new ArrayList<>(result.sequence().size());
    for (Operation op : result.sequence().operations()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("position", op.position());
      entry.put("gate", op.gateType());
      entry.put("qubits", op.qubits());
      if (!op.parameters().isEmpty()) {
        entry.put("params", op.parameters());
      }
      view.add(entry);
    }
    return view;
  }

  public static List<Map<String, Object>> hierarchical(AnalysisResult result) {
    List<Map<String, Object>> view = new ArrayList<>(result.hierarchy().size());
    for (HierarchicalItem item : result.hierarchy().items()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      if (item instanceof GateItem gate) {
        entry.put("type", "gate");
        entry.put("name", gate.operation().gateType());
        entry.put("qubits", gate.operation().qubits());
        entry.put("position", gate.start());
      } else if (item instanceof MacroInstance instance) {
        entry.put("type", "macro");
        entry.put("label", instance.macro().label());
        entry.put("size", instance.span());
        entry.put("gates", gates(instance.expand()));
        entry.put("start_position", instance.start());
        entry.put("end_position", instance.end());
      }
      view.add(entry);
    }
    return view;
  }

  public static List<Map<String, Object>> macros(AnalysisResult result) {
    List<Map<String, Object>> view = new ArrayList<>(result.macros().size());
    for (Macro macro : result.macros()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("label", macro.label());
      entry.put("count", macro.count());
      entry.put("window_size", macro.windowSize());
      entry.put("gates", gates(macro.gates()));
      List<Map<String, Object>> positions = new ArrayList<>(macro.count());
      for (Occurrence occurrence : macro.occurrences()) {
        Map<String, Object> range = new LinkedHashMap<>();
        range.put("start", occurrence.start());
        range.put("end", occurrence.end());
        positions.add(range);
      }
      entry.put("positions", positions);
      view.add(entry);
    }
    return view;
  }

  public static Map<String, Object> statistics(AnalysisResult result) {
    CircuitStatistics stats = result.statistics();
    Map<String, Object> view = new LinkedHashMap<>();
    view.put("original_gate_count", stats.originalGateCount());
    view.put("hierarchical_item_count", stats.hierarchicalItemCount());
    view.put("compression_ratio", stats.compressionRatio());
    view.put("num_macros", stats.numMacros());
    view.put("total_macro_instances", stats.totalMacroInstances());
    view.put("circuit_depth", stats.circuitDepth());
    view.put("num_qubits", stats.numQubits());
    view.put("dag_nodes", stats.dagNodes());
    view.put("dag_edges", stats.dagEdges());
    return view;
  }

  public static Map<String, Object> graph(CircuitGraph graph) {
    List<Map<String, Object>> nodes = new ArrayList<>(graph.nodes().size());
    for (CircuitGraph.Node node : graph.nodes()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("id", node.id());
      entry.put("name", node.name());
      entry.put("type", node.kind().wireName());
      entry.put("position", node.position());
      entry.put("qubits", node.qubits());
      entry.put("layer", node.layer());
      nodes.add(entry);
    }
    List<Map<String, Object>> edges = new ArrayList<>(graph.edges().size());
    for (CircuitGraph.Edge edge : graph.edges()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("name", edge.name());
      entry.put("from-node", edge.from());
      entry.put("to-node", edge.to());
      entry.put("qubit", edge.qubit());
      edges.add(entry);
    }
    List<Map<String, Object>> macros = new ArrayList<>(graph.macros().size());
    for (CircuitGraph.MacroGroup group : graph.macros()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("name", group.name());
      entry.put("gate_ids", group.gateIds());
      entry.put("instances", group.instances());
      entry.put("nodes", gates(group.body()));
      macros.add(entry);
    }
    Map<String, Object> view = new LinkedHashMap<>();
    view.put("nodes", nodes);
    view.put("edges", edges);
    view.put("macros", macros);
    return view;
  }

  private static List<Map<String, Object>> gates(List<Operation> ops) {
    List<Map<String, Object>> gates = new ArrayList<>(ops.size());
    for (Operation op : ops) {
      Map<String, Object> gate = new LinkedHashMap<>();
      gate.put("name", op.gateType());
      gate.put("qubits", op.qubits());
      gates.add(gate);
    }
    return gates;
  }
}
