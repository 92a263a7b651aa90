package macrogate.label;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Ordered rule table: the first rule that yields a label wins; shapes no rule recognizes get a
 * label spelled from the gate sequence, e.g. {@code "H-CX-T Block"}.
 */
public final class RuleTableLabelSynthesizer implements LabelSynthesizer {
  private static final Set<String> ENTANGLERS = Set.of("cx", "cz", "cy", "ecr", "iswap", "rzz");
  private static final Map<String, String> DISPLAY_NAMES =
      Map.of("cx", "CNOT", "cz", "CZ", "swap", "SWAP", "h", "Hadamard");

  /** A named rule; {@code labeler} returns null when the rule does not apply. */
  public record LabelRule(String name, Function<MacroShape, String> labeler) {
    public LabelRule {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(labeler, "labeler");
    }
  }

  private final List<LabelRule> rules;

  public RuleTableLabelSynthesizer() {
    this(defaultRules());
  }

  public RuleTableLabelSynthesizer(List<LabelRule> rules) {
    this.rules = List.copyOf(rules);
  }

  public static List<LabelRule> defaultRules() {
    List<LabelRule> rules = new ArrayList<>();
    rules.add(new LabelRule("qft-segment", RuleTableLabelSynthesizer::qftSegment));
    rules.add(new LabelRule("grover-block", RuleTableLabelSynthesizer::groverBlock));
    rules.add(new LabelRule("swap-network", RuleTableLabelSynthesizer::swapNetwork));
    rules.add(new LabelRule("two-qubit-ladder", RuleTableLabelSynthesizer::twoQubitLadder));
    rules.add(new LabelRule("hadamard-layer", RuleTableLabelSynthesizer::hadamardLayer));
    rules.add(new LabelRule("rotation-layer", RuleTableLabelSynthesizer::rotationLayer));
    rules.add(new LabelRule("rotation-entangling", RuleTableLabelSynthesizer::rotationEntangling));
    rules.add(new LabelRule("hadamard-entangling", RuleTableLabelSynthesizer::hadamardEntangling));
    return List.copyOf(rules);
  }

  public List<LabelRule> rules() {
    return rules;
  }

  @Override
  public String baseLabel(MacroShape shape) {
    Objects.requireNonNull(shape, "shape");
    for (LabelRule rule : rules) {
      String label = rule.labeler().apply(shape);
      if (label != null) {
        return label;
      }
    }
    return fallbackLabel(shape);
  }

  static String fallbackLabel(MacroShape shape) {
    List<String> parts = new ArrayList<>(shape.size());
    for (String gate : shape.gateSequence()) {
      parts.add(gate.toUpperCase(Locale.ROOT));
    }
    return String.join("-", parts) + " Block";
  }

  private static String qftSegment(MacroShape shape) {
    if (shape.count("h") == 0 || shape.qubitCount() < 2) {
      return null;
    }
    int phase = shape.countOf(MacroShape.PHASE_FAMILY);
    if (phase == 0 || phase / (double) shape.size() <= 0.3) {
      return null;
    }
    List<String> head = shape.gateSequence().subList(0, Math.min(3, shape.size()));
    if (!head.contains("h")) {
      return null;
    }
    return shape.count("swap") > 0 ? "QFT Segment with SWAP Layer" : "QFT Segment";
  }

  private static String groverBlock(MacroShape shape) {
    int h = shape.count("h");
    int cx = shape.count("cx");
    int cz = shape.count("cz");
    if (shape.qubitCount() < 2 || shape.size() < 3 || h < 2 || cx + cz == 0) {
      return null;
    }
    List<String> gates = shape.gateSequence();
    boolean framed = gates.get(0).equals("h") || gates.get(gates.size() - 1).equals("h");
    if (!framed || h / (double) shape.size() <= 0.2) {
      return null;
    }
    boolean phase = shape.countOf(Set.of("z", "cz", "cp", "crz")) > 0;
    return phase || cx >= shape.qubitCount() ? "Grover Diffusion Block" : null;
  }

  private static String swapNetwork(MacroShape shape) {
    return shape.uniformGate() && shape.count("swap") == shape.size() ? "Swap Network" : null;
  }

  private static String twoQubitLadder(MacroShape shape) {
    if (!shape.uniformGate() || !shape.allTwoQubit() || shape.size() < 2) {
      return null;
    }
    String gate = displayName(shape.gateSequence().get(0));
    if (shape.qubitCount() == 2) {
      return gate + " Pair";
    }
    if (shape.linearChain()) {
      return shape.qubitCount() + "-Qubit " + gate + " Ladder";
    }
    return gate + " Network";
  }

  private static String hadamardLayer(MacroShape shape) {
    if (shape.count("h") != shape.size()) {
      return null;
    }
    return shape.distinctSingleQubitTargets() ? "Hadamard Layer" : "Hadamard Ladder";
  }

  private static String rotationLayer(MacroShape shape) {
    if (!shape.allSingleQubit() || shape.rotationCount() != shape.size()) {
      return null;
    }
    if (!shape.uniformGate()) {
      return "Mixed Rotation Block";
    }
    String family = shape.firstRotation().toUpperCase(Locale.ROOT);
    return shape.distinctSingleQubitTargets() ? family + " Layer" : family + " Rotation Block";
  }

  private static String rotationEntangling(MacroShape shape) {
    int entanglers = shape.countOf(ENTANGLERS);
    String rotation = shape.firstRotation();
    if (entanglers == 0 || rotation == null) {
      return null;
    }
    String family = rotation.toUpperCase(Locale.ROOT);
    return entanglers == 1
        ? family + " Entangling Block"
        : family + " Rotation with Entangling Layer";
  }

  private static String hadamardEntangling(MacroShape shape) {
    if (shape.count("h") == 0 || shape.countOf(ENTANGLERS) == 0 || shape.rotationCount() > 0) {
      return null;
    }
    return "Hadamard-Entangling Block";
  }

  private static String displayName(String gate) {
    return DISPLAY_NAMES.getOrDefault(gate, gate.toUpperCase(Locale.ROOT));
  }
}
