package macrogate.match;

import java.util.Objects;
import macrogate.signature.QubitBinding;

/** Half-open position range {@code [start, end)} where a signature recurs, with its qubits. */
public record Occurrence(int start, int end, QubitBinding binding) {

  public Occurrence {
    Objects.requireNonNull(binding, "binding");
    if (start < 0 || end <= start) {
      throw new IllegalArgumentException("Invalid occurrence range [" + start + ", " + end + ")");
    }
  }

  public int length() {
    return end - start;
  }

  public boolean overlaps(Occurrence other) {
    return start < other.end && other.start < end;
  }

  public boolean contains(int position) {
    return position >= start && position < end;
  }
}
