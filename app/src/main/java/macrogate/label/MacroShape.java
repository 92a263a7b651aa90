package macrogate.label;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import macrogate.signature.CanonicalSignature;
import macrogate.signature.SignatureElement;

/**
 * Structural summary of a signature used for naming: gate-type sequence and multiset, qubit roles
 * and the interaction graph between local qubits.
 */
public final class MacroShape {
  static final Set<String> ROTATIONS = Set.of("rx", "ry", "rz", "p", "u", "u1", "u2", "u3");
  static final Set<String> PHASE_FAMILY = Set.of("cp", "crz", "cu1", "cz", "p");

  private final CanonicalSignature signature;
  private final List<String> gateSequence;
  private final Map<String, Integer> gateCounts;
  private final Map<Integer, Integer> interactionDegree;
  private final Set<List<Integer>> interactions;
  private final boolean distinctTargets;
  private final boolean allSingleQubit;
  private final boolean allTwoQubit;

  private MacroShape(CanonicalSignature signature) {
    this.signature = signature;
    List<String> sequence = new ArrayList<>(signature.size());
    Map<String, Integer> counts = new LinkedHashMap<>();
    Set<List<Integer>> pairs = new LinkedHashSet<>();
    Map<Integer, Integer> degree = new LinkedHashMap<>();
    Set<Integer> singleTargets = new LinkedHashSet<>();
    boolean distinct = true;
    boolean single = true;
    boolean two = true;
    for (SignatureElement element : signature.elements()) {
      String gate = element.gateType().toLowerCase(Locale.ROOT);
      sequence.add(gate);
      counts.merge(gate, 1, Integer::sum);
      List<Integer> qubits = element.localQubits();
      single &= qubits.size() == 1;
      two &= qubits.size() == 2;
      if (qubits.size() == 1 && !singleTargets.add(qubits.get(0))) {
        distinct = false;
      }
      for (int i = 0; i < qubits.size(); i++) {
        for (int j = i + 1; j < qubits.size(); j++) {
          int a = Math.min(qubits.get(i), qubits.get(j));
          int b = Math.max(qubits.get(i), qubits.get(j));
          if (pairs.add(List.of(a, b))) {
            degree.merge(a, 1, Integer::sum);
            degree.merge(b, 1, Integer::sum);
          }
        }
      }
    }
    this.gateSequence = List.copyOf(sequence);
    this.gateCounts = Collections.unmodifiableMap(counts);
    this.interactions = Collections.unmodifiableSet(pairs);
    this.interactionDegree = Collections.unmodifiableMap(degree);
    this.distinctTargets = distinct;
    this.allSingleQubit = single;
    this.allTwoQubit = two;
  }

  public static MacroShape of(CanonicalSignature signature) {
    return new MacroShape(Objects.requireNonNull(signature, "signature"));
  }

  public CanonicalSignature signature() {
    return signature;
  }

  /** Lower-cased gate types in window order. */
  public List<String> gateSequence() {
    return gateSequence;
  }

  public int size() {
    return gateSequence.size();
  }

  public int qubitCount() {
    return signature.localQubitCount();
  }

  public int count(String gate) {
    return gateCounts.getOrDefault(gate, 0);
  }

  public int countOf(Set<String> gates) {
    int total = 0;
    for (Map.Entry<String, Integer> entry : gateCounts.entrySet()) {
      if (gates.contains(entry.getKey())) {
        total += entry.getValue();
      }
    }
    return total;
  }

  public Set<String> gateTypes() {
    return gateCounts.keySet();
  }

  public boolean uniformGate() {
    return gateCounts.size() == 1;
  }

  public boolean allSingleQubit() {
    return allSingleQubit;
  }

  public boolean allTwoQubit() {
    return allTwoQubit;
  }

  /** Every single-qubit operation acts on a different qubit. */
  public boolean distinctSingleQubitTargets() {
    return distinctTargets;
  }

  public int rotationCount() {
    return countOf(ROTATIONS);
  }

  public int multiQubitCount() {
    int total = 0;
    for (SignatureElement element : signature.elements()) {
      if (element.arity() >= 2) {
        total++;
      }
    }
    return total;
  }

  /** First rotation gate in window order, or null. */
  public String firstRotation() {
    for (String gate : gateSequence) {
      if (ROTATIONS.contains(gate)) {
        return gate;
      }
    }
    return null;
  }

  /** Distinct unordered local-qubit pairs coupled by some multi-qubit gate. */
  public Set<List<Integer>> interactions() {
    return interactions;
  }

  /**
   * The interaction graph is a simple path through more than two qubits: connected, every qubit of
   * degree at most two, exactly two endpoints.
   */
  public boolean linearChain() {
    int nodes = interactionDegree.size();
    if (nodes <= 2 || interactions.size() != nodes - 1) {
      return false;
    }
    int endpoints = 0;
    for (int degree : interactionDegree.values()) {
      if (degree > 2) {
        return false;
      }
      if (degree == 1) {
        endpoints++;
      }
    }
    return endpoints == 2 && connected();
  }

  private boolean connected() {
    Set<Integer> reached = new LinkedHashSet<>();
    List<Integer> frontier = new ArrayList<>();
    Integer first = interactionDegree.keySet().iterator().next();
    reached.add(first);
    frontier.add(first);
    while (!frontier.isEmpty()) {
      int qubit = frontier.remove(frontier.size() - 1);
      for (List<Integer> pair : interactions) {
        int other = pair.get(0) == qubit ? pair.get(1) : pair.get(1) == qubit ? pair.get(0) : -1;
        if (other >= 0 && reached.add(other)) {
          frontier.add(other);
        }
      }
    }
    return reached.size() == interactionDegree.size();
  }
}
