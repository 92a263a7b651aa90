package macrogate.hierarchy;

/** Top-level unit of the compressed view, covering positions {@code [start, end)}. */
public interface HierarchicalItem {
  int start();

  int end();

  default int span() {
    return end() - start();
  }
}
