package macrogate.hierarchy;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import macrogate.label.Macro;
import macrogate.match.Occurrence;
import macrogate.model.Operation;
import macrogate.model.OperationSequence;

/** Collapses accepted macro occurrences into single items and computes the statistics. */
public final class HierarchyBuilder {

  public Hierarchy build(OperationSequence sequence, List<Macro> macros) {
    Objects.requireNonNull(sequence, "sequence");
    Objects.requireNonNull(macros, "macros");
    Map<Integer, MacroInstance> instancesByStart = indexOccurrences(sequence.size(), macros);

    List<HierarchicalItem> items = new ArrayList<>();
    int position = 0;
    while (position < sequence.size()) {
      MacroInstance instance = instancesByStart.get(position);
      if (instance != null) {
        items.add(instance);
        position = instance.end();
      } else {
        items.add(new GateItem(sequence.get(position)));
        position++;
      }
    }
    checkPartition(items, sequence.size());
    return new Hierarchy(items, statistics(sequence, macros, items.size()));
  }

  private static Map<Integer, MacroInstance> indexOccurrences(int length, List<Macro> macros) {
    Map<Integer, MacroInstance> byStart = new HashMap<>();
    BitSet covered = new BitSet(length);
    for (Macro macro : macros) {
      for (Occurrence occurrence : macro.occurrences()) {
        if (occurrence.end() > length) {
          throw new IllegalStateException(
              "Occurrence [" + occurrence.start() + ", " + occurrence.end() + ") of "
                  + macro.label() + " runs past the sequence end " + length);
        }
        if (!covered.get(occurrence.start(), occurrence.end()).isEmpty()) {
          throw new IllegalStateException(
              "Occurrence [" + occurrence.start() + ", " + occurrence.end() + ") of "
                  + macro.label() + " overlaps another accepted occurrence");
        }
        covered.set(occurrence.start(), occurrence.end());
        byStart.put(occurrence.start(), new MacroInstance(macro, occurrence));
      }
    }
    return byStart;
  }

  private static void checkPartition(List<HierarchicalItem> items, int length) {
    int expected = 0;
    for (HierarchicalItem item : items) {
      if (item.start() != expected || item.end() <= item.start()) {
        throw new IllegalStateException(
            "Hierarchy gap or overlap at position " + expected + ": item covers ["
                + item.start() + ", " + item.end() + ")");
      }
      expected = item.end();
    }
    if (expected != length) {
      throw new IllegalStateException(
          "Hierarchy covers " + expected + " of " + length + " positions");
    }
  }

  static CircuitStatistics statistics(
      OperationSequence sequence, List<Macro> macros, int itemCount) {
    int n = sequence.size();
    int qubits = sequence.qubitCount();
    int instances = 0;
    for (Macro macro : macros) {
      instances += macro.count();
    }
    int wireSegments = qubits;
    for (Operation op : sequence.operations()) {
      wireSegments += op.arity();
    }
    double ratio = itemCount == 0 ? 0.0 : n / (double) itemCount;
    return new CircuitStatistics(
        n,
        itemCount,
        ratio,
        macros.size(),
        instances,
        n == 0 ? 0 : sequence.dependencies().depth(),
        qubits,
        n + 2 * qubits,
        wireSegments);
  }
}
