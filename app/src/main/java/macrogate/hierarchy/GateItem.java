package macrogate.hierarchy;

import java.util.Objects;
import macrogate.model.Operation;

/** An operation not covered by any macro occurrence. */
public record GateItem(Operation operation) implements HierarchicalItem {

  public GateItem {
    Objects.requireNonNull(operation, "operation");
  }

  @Override
  public int start() {
    return operation.position();
  }

  @Override
  public int end() {
    return operation.position() + 1;
  }
}
