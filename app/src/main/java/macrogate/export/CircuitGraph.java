package macrogate.export;

import java.util.List;
import macrogate.model.Operation;

/** Node/edge/group description of a circuit for the external graph viewer. */
public record CircuitGraph(List<Node> nodes, List<Edge> edges, List<MacroGroup> macros) {

  public CircuitGraph {
    nodes = List.copyOf(nodes);
    edges = List.copyOf(edges);
    macros = List.copyOf(macros);
  }

  public enum NodeKind {
    INIT("init"),
    GATE("gate"),
    END("end");

    private final String wireName;

    NodeKind(String wireName) {
      this.wireName = wireName;
    }

    public String wireName() {
      return wireName;
    }
  }

  public record Node(
      String id, NodeKind kind, String name, int position, List<Integer> qubits, int layer) {
    public Node {
      qubits = List.copyOf(qubits);
    }
  }

  /** Wire segment of {@code qubit} between two consecutive nodes on that wire. */
  public record Edge(String name, String from, String to, int qubit) {}

  /**
   * All gate nodes of one macro: {@code gateIds} in position order, {@code instances} split per
   * occurrence, {@code body} the generic gates over local qubits.
   */
  public record MacroGroup(
      String name, List<String> gateIds, List<List<String>> instances, List<Operation> body) {
    public MacroGroup {
      gateIds = List.copyOf(gateIds);
      instances = instances.stream().map(List::copyOf).toList();
      body = List.copyOf(body);
    }
  }
}
