package paulie.classifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import paulie.core.model.ComponentAlgebra;
import paulie.core.model.MorphShape;

final class AlgebraCatalogTest {

  private static MorphShape shape(Integer... legs) {
    int vertices = 1;
    for (int leg : legs) {
      vertices += leg;
    }
    return new MorphShape(vertices, List.of(legs));
  }

  /** Shape of the transverse-field chain {X_i, Z_i, Z_i Z_i+1}: one short leg, pairs, a tail. */
  private static MorphShape chain(int pairs) {
    List<Integer> legs = new ArrayList<>(Collections.nCopies(pairs, 2));
    legs.add(0, 1);
    legs.add(3);
    return shape(legs.toArray(new Integer[0]));
  }

  @ParameterizedTest
  @CsvSource(
      delimiter = '|',
      value = {
        "1           | so(3)    | 3",
        "2           | so(4)    | 6",
        "1,1         | 2*so(3)  | 6",
        "1,3         | so(6)    | 15",
        "2,3         | so(7)    | 21",
        "1,1,4       | 2*so(7)  | 42",
        "1,1,1,1     | 8*so(3)  | 24",
        "1,2,2       | sp(8)    | 36",
        "1,2,3       | su(8)    | 63",
        "2,2,2       | 2*sp(8)  | 72",
        "1,1,2,2     | 2*sp(8)  | 72",
        "1,2,4       | so(16)   | 120",
        "2,2,3       | sp(16)   | 136",
        "1,1,1,2,3   | 4*su(8)  | 252",
        "2,2,2,2     | su(16)   | 255",
        "2,2,2,3     | so(32)   | 496",
        "2,2,2,4     | 2*so(32) | 992",
        "1,2,2,2,3   | su(32)   | 1023"
      })
  void shapesMapToClassicalAlgebras(String legs, String name, long dimension) {
    List<Integer> lengths = new ArrayList<>();
    for (String leg : legs.split(",")) {
      lengths.add(Integer.parseInt(leg));
    }
    MorphShape shape = shape(lengths.toArray(new Integer[0]));
    ComponentAlgebra algebra = AlgebraCatalog.classify(shape);
    assertEquals(name, algebra.name(), "Algebra of " + shape.signature());
    assertEquals(dimension, algebra.dimension(), "Dimension of " + shape.signature());
  }

  @ParameterizedTest
  @ValueSource(
      strings = {"5", "1,1", "1,3", "1,1,4", "1,1,1,2", "1,2,3", "2,2,2", "1,1,2,3", "2,2,3"})
  void generatedProductsCountTheDimension(String legs) {
    List<Integer> lengths = new ArrayList<>();
    for (String leg : legs.split(",")) {
      lengths.add(Integer.parseInt(leg));
    }
    MorphShape shape = shape(lengths.toArray(new Integer[0]));
    long generated = 0;
    for (long mask = 1; mask < (1L << shape.vertexCount()); mask++) {
      if (AlgebraCatalog.generates(shape, BitSet.valueOf(new long[] {mask}))) {
        generated++;
      }
    }
    assertEquals(AlgebraCatalog.classify(shape).dimension(), generated, shape.signature());
  }

  @Test
  void runsOfAPathAreGenerated() {
    MorphShape path = shape(2, 2);
    assertTrue(AlgebraCatalog.generates(path, bits(0, 1, 3)), "2-1-0-3-4 contains the run 1,0,3");
    assertFalse(AlgebraCatalog.generates(path, bits(2, 0)), "2 and 0 are not adjacent");
    assertFalse(AlgebraCatalog.generates(path, new BitSet()));
    assertTrue(AlgebraCatalog.generates(new MorphShape(1, List.of()), bits(0)));
  }

  private static BitSet bits(int... indexes) {
    BitSet bits = new BitSet();
    for (int index : indexes) {
      bits.set(index);
    }
    return bits;
  }

  @Test
  void trivialShapes() {
    assertEquals(ComponentAlgebra.u1(), AlgebraCatalog.classify(new MorphShape(1, List.of())));
    assertEquals(0, AlgebraCatalog.classify(new MorphShape(0, List.of())).dimension());
  }

  @Test
  void largeShapesNeedNoEnumeration() {
    MorphShape eightQubits = chain(6);
    MorphShape elevenQubits = chain(9);
    assertTimeoutPreemptively(
        Duration.ofSeconds(5),
        () -> {
          ComponentAlgebra su256 = AlgebraCatalog.classify(eightQubits);
          assertEquals("su(256)", su256.name());
          assertEquals(65535, su256.dimension());
          ComponentAlgebra su2048 = AlgebraCatalog.classify(elevenQubits);
          assertEquals("su(2048)", su2048.name());
          assertEquals(4194303L, su2048.dimension());
        });
  }

  @Test
  void everyExtraSingleLegDoublesTheCopies() {
    long base = AlgebraCatalog.classify(shape(1, 2, 3)).dimension();
    assertEquals(2 * base, AlgebraCatalog.classify(shape(1, 1, 2, 3)).dimension());
    assertEquals(8 * base, AlgebraCatalog.classify(shape(1, 1, 1, 1, 2, 3)).dimension());
  }

  @ParameterizedTest
  @CsvSource(
      delimiter = '|',
      value = {
        "so(4) | su(2)+su(2)",
        "so(3) + u(1) | u(1)+su(2)",
        "su(4) | so(6)",
        "so(5) | sp(4)",
        "so(2) | u(1)",
        "so(3)+so(3) | su(2) ⊕ sp(2)",
        "2*so(3) | so(4)",
        "4*sp(8)+so(3) | sp(8)+2*sp(8)+sp(8)+su(2)"
      })
  void isomorphicNamesMatch(String left, String right) {
    assertTrue(AlgebraCatalog.matches(left, right), left + " ~ " + right);
  }

  @Test
  void differentAlgebrasDoNotMatch() {
    assertFalse(AlgebraCatalog.matches("so(5)", "so(6)"));
    assertFalse(AlgebraCatalog.matches("so(3)", "so(3)+so(3)"));
    assertFalse(AlgebraCatalog.matches("2*su(8)", "su(8)"));
  }

  @Test
  void malformedCopyCountsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> AlgebraCatalog.canonical("x*so(3)"));
    assertThrows(IllegalArgumentException.class, () -> AlgebraCatalog.canonical("0*so(3)"));
  }

  @Test
  void joinMergesAndSortsSummands() {
    assertEquals("so(3)+u(1)", AlgebraCatalog.join(Map.of("u(1)", 1L, "so(3)", 1L)));
    assertEquals("2*so(3)+su(8)", AlgebraCatalog.join(Map.of("su(8)", 1L, "so(3)", 2L)));
    assertEquals("0", AlgebraCatalog.join(Map.of()));
  }
}
