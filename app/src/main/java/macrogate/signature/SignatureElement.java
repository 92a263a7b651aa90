package macrogate.signature;

import java.util.List;
import java.util.Objects;

/** One operation of a canonical window: gate type, local qubit indices and parameter buckets. */
public record SignatureElement(
    String gateType, List<Integer> localQubits, List<Long> parameterBuckets) {

  public SignatureElement {
    Objects.requireNonNull(gateType, "gateType");
    localQubits = List.copyOf(localQubits);
    parameterBuckets = parameterBuckets == null ? List.of() : List.copyOf(parameterBuckets);
  }

  public int arity() {
    return localQubits.size();
  }

  @Override
  public String toString() {
    return gateType + localQubits + (parameterBuckets.isEmpty() ? "" : "~" + parameterBuckets);
  }
}
