package macrogate.hierarchy;

import java.util.List;
import java.util.Objects;
import macrogate.label.Macro;
import macrogate.match.Occurrence;
import macrogate.model.Operation;
import macrogate.signature.QubitBinding;

/** One accepted occurrence of a macro, collapsed into a single item. */
public record MacroInstance(Macro macro, Occurrence occurrence) implements HierarchicalItem {

  public MacroInstance {
    Objects.requireNonNull(macro, "macro");
    Objects.requireNonNull(occurrence, "occurrence");
  }

  @Override
  public int start() {
    return occurrence.start();
  }

  @Override
  public int end() {
    return occurrence.end();
  }

  public QubitBinding binding() {
    return occurrence.binding();
  }

  /** Macro body bound to this instance's qubits. */
  public List<Operation> expand() {
    return macro.expand(occurrence);
  }
}
