package macrogate.signature;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import macrogate.model.OperationSequence;
import macrogate.signature.SignatureCanonicalizer.CanonicalWindow;
import org.junit.jupiter.api.Test;

final class SignatureCanonicalizerTest {

  @Test
  void signatureIsIndependentOfQubitLabels() {
    OperationSequence sequence =
        OperationSequence.builder(4)
            .add("cx", 0, 1)
            .add("h", 0)
            .add("cx", 3, 2)
            .add("h", 3)
            .build();

    CanonicalWindow first = SignatureCanonicalizer.canonicalize(sequence.window(0, 2));
    CanonicalWindow second = SignatureCanonicalizer.canonicalize(sequence.window(2, 2));

    assertEquals(first.signature(), second.signature());
    assertEquals(first.signature().hashCode(), second.signature().hashCode());
    assertEquals(List.of(0, 1), first.binding().localToGlobal());
    assertEquals(List.of(3, 2), second.binding().localToGlobal());
  }

  @Test
  void signatureDependsOnWiring() {
    OperationSequence sequence =
        OperationSequence.builder(2)
            .add("cx", 0, 1)
            .add("h", 0)
            .add("cx", 0, 1)
            .add("h", 1)
            .build();

    assertNotEquals(
        SignatureCanonicalizer.signatureOf(sequence.window(0, 2)),
        SignatureCanonicalizer.signatureOf(sequence.window(2, 2)),
        "H on the control and H on the target are different structures");
  }

  @Test
  void signatureDependsOnParameterBuckets() {
    OperationSequence sequence =
        OperationSequence.builder(1)
            .addParameterized("ry", 0.5, 0)
            .addParameterized("ry", 0.5000000004, 0)
            .addParameterized("ry", 0.75, 0)
            .build();

    CanonicalSignature a = SignatureCanonicalizer.signatureOf(sequence.window(0, 1));
    CanonicalSignature b = SignatureCanonicalizer.signatureOf(sequence.window(1, 1));
    CanonicalSignature c = SignatureCanonicalizer.signatureOf(sequence.window(2, 1));

    assertEquals(a, b);
    assertNotEquals(a, c);
  }

  @Test
  void localIndicesFollowFirstAppearance() {
    OperationSequence sequence =
        OperationSequence.builder(3).add("h", 2).add("cx", 0, 2).add("cz", 1, 0).build();

    CanonicalWindow window = SignatureCanonicalizer.canonicalize(sequence.operations());

    assertEquals(List.of(0), window.signature().element(0).localQubits());
    assertEquals(List.of(1, 0), window.signature().element(1).localQubits());
    assertEquals(List.of(2, 1), window.signature().element(2).localQubits());
    assertEquals(3, window.signature().localQubitCount());
    assertEquals(List.of(2, 0, 1), window.binding().bind(List.of(0, 1, 2)));
  }

  @Test
  void rejectsEmptyWindow() {
    assertThrows(
        IllegalArgumentException.class, () -> SignatureCanonicalizer.canonicalize(List.of()));
  }
}
