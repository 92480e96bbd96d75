package paulie.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

final class MorphTest {

  private static PauliString p(String label) {
    return PauliString.parse(label);
  }

  @Test
  void exposesCenterLegsAndShape() {
    Morph morph =
        new Morph(
            List.of(List.of(p("IZI")), List.of(p("XXI")), List.of(p("IXX"), p("IIZ"))),
            List.of(p("YYI")));
    assertEquals(p("IZI"), morph.center());
    assertEquals(List.of(p("IXX"), p("IIZ")), morph.longLeg());
    assertEquals(4, morph.vertexCount());
    assertTrue(morph.contains(p("IIZ")));
    assertFalse(morph.contains(p("YYI")), "Dependents are not placed");
    assertEquals("4:1,2", morph.shape().signature());
    assertTrue(morph.shape().isPath());
  }

  @Test
  void equivalenceComparesShapesOnly() {
    Morph a = new Morph(List.of(List.of(p("Z")), List.of(p("X"))), List.of());
    Morph b = new Morph(List.of(List.of(p("X")), List.of(p("Y"))), List.of(p("Z")));
    Morph c = new Morph(List.of(List.of(p("X"))), List.of());
    assertTrue(a.isEquivalent(b));
    assertFalse(a.isEquivalent(c));
  }

  @Test
  void centerLegHoldsOneVertex() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new Morph(List.of(List.of(p("X"), p("Z"))), List.of()));
    assertTrue(Morph.empty().isEmpty());
    assertEquals(0, Morph.empty().shape().vertexCount());
  }
}
