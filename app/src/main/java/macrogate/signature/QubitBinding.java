package macrogate.signature;

import java.util.ArrayList;
import java.util.List;

/** Concrete qubits of one occurrence: entry {@code i} is the global qubit for local index i. */
public record QubitBinding(List<Integer> localToGlobal) {

  public QubitBinding {
    localToGlobal = List.copyOf(localToGlobal);
  }

  public int global(int local) {
    if (local < 0 || local >= localToGlobal.size()) {
      throw new IllegalArgumentException(
          "Local qubit " + local + " is not bound (binding size " + localToGlobal.size() + ")");
    }
    return localToGlobal.get(local);
  }

  public List<Integer> bind(List<Integer> localQubits) {
    List<Integer> globals = new ArrayList<>(localQubits.size());
    for (int local : localQubits) {
      globals.add(global(local));
    }
    return globals;
  }

  public int size() {
    return localToGlobal.size();
  }
}
