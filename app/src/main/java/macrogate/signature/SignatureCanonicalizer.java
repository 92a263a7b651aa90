package macrogate.signature;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import macrogate.model.Operation;

/** Computes the canonical signature of a window together with the occurrence's qubit binding. */
public final class SignatureCanonicalizer {
  private SignatureCanonicalizer() {}

  /** Signature plus the binding that maps it back onto the window's concrete qubits. */
  public record CanonicalWindow(CanonicalSignature signature, QubitBinding binding) {}

  public static CanonicalWindow canonicalize(List<Operation> window) {
    if (window == null || window.isEmpty()) {
      throw new IllegalArgumentException("Cannot canonicalize an empty window");
    }
    Map<Integer, Integer> globalToLocal = new HashMap<>();
    List<Integer> localToGlobal = new ArrayList<>();
    List<SignatureElement> elements = new ArrayList<>(window.size());
    for (Operation op : window) {
      List<Integer> locals = new ArrayList<>(op.arity());
      for (int qubit : op.qubits()) {
        Integer local = globalToLocal.get(qubit);
        if (local == null) {
          local = localToGlobal.size();
          globalToLocal.put(qubit, local);
          localToGlobal.add(qubit);
        }
        locals.add(local);
      }
      elements.add(new SignatureElement(op.gateType(), locals, op.parameterBuckets()));
    }
    return new CanonicalWindow(new CanonicalSignature(elements), new QubitBinding(localToGlobal));
  }

  public static CanonicalSignature signatureOf(List<Operation> window) {
    return canonicalize(window).signature();
  }
}
