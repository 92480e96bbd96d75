package paulie.classifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import paulie.collection.PauliStrings;
import paulie.core.ClassifierOptions;
import paulie.core.model.PauliString;

final class ClassifierTest {
  private static final List<List<PauliString>> COMPONENTS =
      List.of(
          PauliStrings.of("XXI", "IXX", "ZII", "IZI", "IIZ"),
          PauliStrings.of("ZI", "IZ", "XX"),
          PauliStrings.of("X", "Y", "Z"),
          PauliStrings.of("X", "X"));

  @Test
  void parallelRunKeepsComponentOrder() {
    Classification sequential = new Classifier().classifyAll(COMPONENTS);
    Classification parallel =
        new Classifier(ClassifierOptions.defaults().withParallel(true)).classifyAll(COMPONENTS);
    assertEquals(sequential.morphs(), parallel.morphs());
    assertEquals(4, parallel.size());
  }

  @Test
  void aggregateReportsDimensionsAndDependents() {
    Classification classification = new Classifier().classifyAll(COMPONENTS);
    assertEquals(15, classification.dimensionOf(0));
    assertEquals(6, classification.dimensionOf(1));
    assertEquals(3, classification.dimensionOf(2));
    assertEquals(1, classification.dimensionOf(3));
    assertEquals(25, classification.dlaDimension());
    assertEquals(PauliStrings.of("Y", "X"), classification.dependents());
    assertEquals(5 + 3 + 2 + 1, classification.vertices().size());
    assertEquals("2*so(3)", classification.algebraOf(1));
    assertEquals("3*so(3)+so(6)+u(1)", classification.algebra());
    assertTrue(classification.isAlgebra("u(1) + su(4) + su(2) + su(2) + su(2)"));
  }

  @Test
  void singleComponentAlgebras() {
    Classifier classifier = new Classifier();
    Classification single = classifier.classifyAll(List.of(PauliStrings.of("X")));
    assertEquals("u(1)", single.algebra());
    assertEquals(1, single.dlaDimension());

    Classification pauli = classifier.classifyAll(List.of(PauliStrings.of("X", "Y", "Z")));
    assertTrue(pauli.isAlgebra("su(2)"));
    assertEquals(3, pauli.dlaDimension());

    Classification star = classifier.classifyAll(List.of(PauliStrings.of("ZI", "IZ", "XX")));
    assertEquals("2*so(3)", star.algebra());
    assertTrue(star.isAlgebra("so(4)"));
    assertEquals(6, star.dlaDimension());
  }

  @Test
  void equivalenceIgnoresComponentContents() {
    Classifier classifier = new Classifier();
    Classification a = classifier.classifyAll(List.of(PauliStrings.of("XI", "ZI")));
    Classification b = classifier.classifyAll(List.of(PauliStrings.of("IY", "IZ")));
    Classification c = classifier.classifyAll(List.of(PauliStrings.of("ZI", "IZ", "XX")));
    assertTrue(a.isEquivalent(b));
    assertFalse(a.isEquivalent(c));
  }
}
