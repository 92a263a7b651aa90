package macrogate.signature;

import java.util.List;

/**
 * Label-independent fingerprint of a window of consecutive operations.
 *
 * <p>Local qubit indices are assigned in order of first appearance across the window, so two
 * windows compare equal exactly when they apply the same gates with the same wiring up to a
 * renaming of qubits. Equality is element-wise, never via a textual key.
 */
public final class CanonicalSignature {
  private final List<SignatureElement> elements;
  private final int localQubitCount;
  private final int hash;

  public CanonicalSignature(List<SignatureElement> elements) {
    if (elements == null || elements.isEmpty()) {
      throw new IllegalArgumentException("A signature needs at least one element");
    }
    this.elements = List.copyOf(elements);
    int maxLocal = -1;
    for (SignatureElement element : this.elements) {
      for (int local : element.localQubits()) {
        maxLocal = Math.max(maxLocal, local);
      }
    }
    this.localQubitCount = maxLocal + 1;
    this.hash = this.elements.hashCode();
  }

  public List<SignatureElement> elements() {
    return elements;
  }

  public SignatureElement element(int index) {
    return elements.get(index);
  }

  /** Window size k. */
  public int size() {
    return elements.size();
  }

  /** Number of distinct qubits the window touches. */
  public int localQubitCount() {
    return localQubitCount;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof CanonicalSignature other)) {
      return false;
    }
    return hash == other.hash && elements.equals(other.elements);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return "CanonicalSignature" + elements;
  }
}
