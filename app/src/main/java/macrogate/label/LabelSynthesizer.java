package macrogate.label;

/**
 * Naming strategy: maps a macro's structure to a base label. Implementations must be deterministic
 * and free of side effects; uniqueness across macros is handled by {@link MacroLabeler}.
 */
@FunctionalInterface
public interface LabelSynthesizer {
  String baseLabel(MacroShape shape);
}
