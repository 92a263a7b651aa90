package macrogate.reconstruct;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import macrogate.hierarchy.GateItem;
import macrogate.hierarchy.HierarchicalItem;
import macrogate.hierarchy.Hierarchy;
import macrogate.hierarchy.MacroInstance;
import macrogate.model.Operation;
import macrogate.model.OperationSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands a hierarchy back into a flat sequence.
 *
 * <p>Gate items are copied; macro instances are expanded in body order with their bound qubits and
 * the exact parameter values of the operations they stand for.
 * Pairs forbidden by the {@link AdjacencyPolicy} are then split by moving a single operation that
 * shares no qubit with anything it is moved across, which leaves every per-qubit projection
 * unchanged. Later operations are tried first (nearest first), then earlier ones. If neither
 * direction works the reconstruction fails.
 */
public final class CircuitReconstructor {
  private static final Logger LOG = LoggerFactory.getLogger(CircuitReconstructor.class);

  private final AdjacencyPolicy policy;

  public CircuitReconstructor(AdjacencyPolicy policy) {
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  public AdjacencyPolicy policy() {
    return policy;
  }

  public Reconstruction reconstruct(OperationSequence source, Hierarchy hierarchy) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(hierarchy, "hierarchy");
    List<Operation> ops = new ArrayList<>(source.size());
    List<Integer> origins = new ArrayList<>(source.size());
    for (HierarchicalItem item : hierarchy.items()) {
      if (item instanceof GateItem gate) {
        ops.add(gate.operation());
        origins.add(gate.start());
      } else if (item instanceof MacroInstance instance) {
        List<Operation> body = instance.expand();
        for (int i = 0; i < body.size(); i++) {
          Operation bound = body.get(i);
          List<Double> parameters = source.get(instance.start() + i).parameters();
          ops.add(
              new Operation(bound.position(), bound.gateType(), bound.qubits(), parameters));
          origins.add(instance.start() + i);
        }
      } else {
        throw new IllegalStateException("Unknown hierarchy item " + item);
      }
    }

    int reorders = separateForbiddenPairs(ops, origins);

    List<Operation> renumbered = new ArrayList<>(ops.size());
    for (int i = 0; i < ops.size(); i++) {
      renumbered.add(ops.get(i).atPosition(i));
    }
    OperationSequence rebuilt = new OperationSequence(source.qubitCount(), renumbered);
    verifyProjections(source, rebuilt);
    if (reorders > 0) {
      LOG.debug("Applied {} commuting reorder(s) under {}", reorders, policy);
    }
    return new Reconstruction(rebuilt, origins, reorders);
  }

  private int separateForbiddenPairs(List<Operation> ops, List<Integer> origins) {
    int reorders = 0;
    for (int i = 1; i < ops.size(); i++) {
      if (!policy.violates(ops.get(i - 1), ops.get(i))) {
        continue;
      }
      if (pullForward(ops, origins, i) || pushBackward(ops, origins, i)) {
        reorders++;
        continue;
      }
      throw ReconstructionException.adjacency(policy, i, ops.get(i - 1), ops.get(i));
    }
    return reorders;
  }

  /** Moves some later operation in between positions i-1 and i. */
  private boolean pullForward(List<Operation> ops, List<Integer> origins, int i) {
    Set<Integer> crossed = new HashSet<>();
    for (int j = i; j < ops.size(); j++) {
      Operation candidate = ops.get(j);
      if (j > i
          && disjoint(candidate, crossed)
          && !policy.violates(ops.get(i - 1), candidate)
          && !policy.violates(candidate, ops.get(i))) {
        move(ops, origins, j, i);
        return true;
      }
      crossed.addAll(candidate.qubits());
    }
    return false;
  }

  /**
   * Moves some earlier operation in between positions i-1 and i, provided the neighbours it leaves
   * behind may sit next to each other.
   */
  private boolean pushBackward(List<Operation> ops, List<Integer> origins, int i) {
    Set<Integer> crossed = new HashSet<>(ops.get(i - 1).qubits());
    for (int k = i - 2; k >= 0; k--) {
      Operation candidate = ops.get(k);
      boolean gapAllowed = k == 0 || !policy.violates(ops.get(k - 1), ops.get(k + 1));
      if (gapAllowed
          && disjoint(candidate, crossed)
          && !policy.violates(ops.get(i - 1), candidate)
          && !policy.violates(candidate, ops.get(i))) {
        move(ops, origins, k, i - 1);
        return true;
      }
      crossed.addAll(candidate.qubits());
    }
    return false;
  }

  private static boolean disjoint(Operation op, Set<Integer> qubits) {
    for (int qubit : op.qubits()) {
      if (qubits.contains(qubit)) {
        return false;
      }
    }
    return true;
  }

  private static void move(List<Operation> ops, List<Integer> origins, int from, int to) {
    ops.add(to, ops.remove(from));
    origins.add(to, origins.remove(from));
  }

  /** Same gate, wiring and exact parameter values; positions may differ. */
  private static boolean identical(Operation expected, Operation actual) {
    return expected.atPosition(actual.position()).equals(actual);
  }

  private static void verifyProjections(OperationSequence source, OperationSequence rebuilt) {
    if (source.size() != rebuilt.size()) {
      throw new ReconstructionException(
          "Rebuilt sequence has " + rebuilt.size() + " operations, source has " + source.size(),
          rebuilt.size(),
          null,
          null);
    }
    for (int qubit = 0; qubit < source.qubitCount(); qubit++) {
      List<Operation> expected = source.projection(qubit);
      List<Operation> actual = rebuilt.projection(qubit);
      int common = Math.min(expected.size(), actual.size());
      for (int idx = 0; idx < common; idx++) {
        if (!identical(expected.get(idx), actual.get(idx))) {
          throw ReconstructionException.projectionMismatch(
              qubit, idx, expected.get(idx), actual.get(idx));
        }
      }
      if (expected.size() != actual.size()) {
        throw ReconstructionException.projectionMismatch(
            qubit,
            common,
            common < expected.size() ? expected.get(common) : null,
            common < actual.size() ? actual.get(common) : null);
      }
    }
  }
}
