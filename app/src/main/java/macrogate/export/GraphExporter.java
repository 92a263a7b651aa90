package macrogate.export;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import macrogate.export.CircuitGraph.Edge;
import macrogate.export.CircuitGraph.MacroGroup;
import macrogate.export.CircuitGraph.Node;
import macrogate.export.CircuitGraph.NodeKind;
import macrogate.hierarchy.HierarchicalItem;
import macrogate.hierarchy.Hierarchy;
import macrogate.hierarchy.MacroInstance;
import macrogate.label.Macro;
import macrogate.model.Operation;
import macrogate.model.OperationSequence;
import macrogate.model.QubitDependencyView;

/**
 * Builds the viewer graph: an init and an end node per wire, one node per operation (macro members
 * included), edges chaining the nodes of each wire in position order, and one group per macro.
 *
 * <p>Init nodes sit on layer -1, gates on their dependency layer, end nodes one past the deepest
 * gate.
 */
public final class GraphExporter {

  public static String initId(int qubit) {
    return "q_start_" + qubit;
  }

  public static String endId(int qubit) {
    return "q_end_" + qubit;
  }

  public static String gateId(int position) {
    return "gate_" + position;
  }

  public CircuitGraph export(OperationSequence sequence, Hierarchy hierarchy) {
    Objects.requireNonNull(sequence, "sequence");
    Objects.requireNonNull(hierarchy, "hierarchy");
    int qubits = sequence.qubitCount();
    QubitDependencyView view = sequence.dependencies();

    List<Node> nodes = new ArrayList<>();
    List<Edge> edges = new ArrayList<>();
    String[] lastOnWire = new String[qubits];
    for (int q = 0; q < qubits; q++) {
      lastOnWire[q] = initId(q);
      nodes.add(new Node(initId(q), NodeKind.INIT, "q" + q + "_init", -1, List.of(q), -1));
    }

    for (Operation op : sequence.operations()) {
      String id = gateId(op.position());
      int layer = view.layer(op.position());
      nodes.add(new Node(id, NodeKind.GATE, op.gateType(), op.position(), op.qubits(), layer));
      for (int q : op.qubits()) {
        edges.add(new Edge("q" + q, lastOnWire[q], id, q));
        lastOnWire[q] = id;
      }
    }

    int endLayer = view.depth();
    for (int q = 0; q < qubits; q++) {
      String name = "q" + q + "_end";
      nodes.add(new Node(endId(q), NodeKind.END, name, sequence.size(), List.of(q), endLayer));
      edges.add(new Edge("q" + q, lastOnWire[q], endId(q), q));
    }
    return new CircuitGraph(nodes, edges, groups(hierarchy));
  }

  private static List<MacroGroup> groups(Hierarchy hierarchy) {
    Map<String, Macro> macros = new LinkedHashMap<>();
    Map<String, List<List<String>>> instances = new LinkedHashMap<>();
    for (HierarchicalItem item : hierarchy.items()) {
      if (!(item instanceof MacroInstance instance)) {
        continue;
      }
      String label = instance.macro().label();
      macros.putIfAbsent(label, instance.macro());
      List<String> ids = new ArrayList<>(instance.span());
      for (int pos = instance.start(); pos < instance.end(); pos++) {
        ids.add(gateId(pos));
      }
      instances.computeIfAbsent(label, key -> new ArrayList<>()).add(ids);
    }
    List<MacroGroup> groups = new ArrayList<>(macros.size());
    for (Map.Entry<String, Macro> entry : macros.entrySet()) {
      List<List<String>> perInstance = instances.get(entry.getKey());
      List<String> all = new ArrayList<>();
      perInstance.forEach(all::addAll);
      groups.add(new MacroGroup(entry.getKey(), all, perInstance, entry.getValue().gates()));
    }
    return groups;
  }
}
