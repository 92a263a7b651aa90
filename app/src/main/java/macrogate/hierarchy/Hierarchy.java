package macrogate.hierarchy;

import java.util.List;
import java.util.Objects;

/** Ordered items partitioning positions 0..N-1, with the statistics derived from them. */
public record Hierarchy(List<HierarchicalItem> items, CircuitStatistics statistics) {

  public Hierarchy {
    Objects.requireNonNull(statistics, "statistics");
    items = List.copyOf(items);
  }

  public int size() {
    return items.size();
  }

  public long gateItemCount() {
    return items.stream().filter(GateItem.class::isInstance).count();
  }

  public long macroItemCount() {
    return items.stream().filter(MacroInstance.class::isInstance).count();
  }
}
