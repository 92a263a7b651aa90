package macrogate.label;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import macrogate.match.Occurrence;
import macrogate.model.Operation;
import macrogate.model.OperationSequence;
import macrogate.resolve.SelectedPattern;
import macrogate.signature.SignatureElement;

/**
 * Turns selected patterns into {@link Macro}s: asks the {@link LabelSynthesizer} for base labels
 * and makes them unique by appending {@code " A"}, {@code " B"}, ... to labels shared by several
 * macros, in order of their earliest occurrence.
 */
public final class MacroLabeler {
  private final LabelSynthesizer synthesizer;

  public MacroLabeler(LabelSynthesizer synthesizer) {
    this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
  }

  public List<Macro> label(OperationSequence sequence, List<SelectedPattern> patterns) {
    Objects.requireNonNull(sequence, "sequence");
    Objects.requireNonNull(patterns, "patterns");
    Map<String, List<Integer>> byBase = new LinkedHashMap<>();
    String[] labels = new String[patterns.size()];
    for (int i = 0; i < patterns.size(); i++) {
      String base = synthesizer.baseLabel(MacroShape.of(patterns.get(i).signature()));
      if (base == null || base.isBlank()) {
        throw new IllegalStateException(
            "Label synthesizer returned no label for " + patterns.get(i).signature());
      }
      labels[i] = base;
      byBase.computeIfAbsent(base, key -> new ArrayList<>()).add(i);
    }
    for (Map.Entry<String, List<Integer>> entry : byBase.entrySet()) {
      List<Integer> indices = entry.getValue();
      if (indices.size() < 2) {
        continue;
      }
      indices.sort(Comparator.comparingInt(index -> patterns.get(index).firstStart()));
      for (int rank = 0; rank < indices.size(); rank++) {
        labels[indices.get(rank)] = entry.getKey() + " " + suffix(rank);
      }
    }

    List<Macro> macros = new ArrayList<>(patterns.size());
    for (int i = 0; i < patterns.size(); i++) {
      SelectedPattern pattern = patterns.get(i);
      macros.add(
          new Macro(
              labels[i],
              pattern.signature(),
              pattern.windowSize(),
              genericBody(sequence, pattern),
              pattern.occurrences()));
    }
    return macros;
  }

  /** A, B, ..., Z, AA, AB, ... */
  static String suffix(int rank) {
    StringBuilder sb = new StringBuilder();
    int n = rank;
    do {
      sb.insert(0, (char) ('A' + n % 26));
      n = n / 26 - 1;
    } while (n >= 0);
    return sb.toString();
  }

  /** Body operations over local qubits, with parameter values taken from the first occurrence. */
  private static List<Operation> genericBody(OperationSequence sequence, SelectedPattern pattern) {
    Occurrence first = pattern.occurrences().get(0);
    List<Operation> body = new ArrayList<>(pattern.windowSize());
    for (int i = 0; i < pattern.windowSize(); i++) {
      SignatureElement element = pattern.signature().element(i);
      Operation concrete = sequence.get(first.start() + i);
      body.add(new Operation(i, element.gateType(), element.localQubits(), concrete.parameters()));
    }
    return body;
  }
}
