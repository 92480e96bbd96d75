package paulie.collection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import paulie.classifier.Classification;
import paulie.core.ClassifierOptions;
import paulie.core.model.PauliString;

final class PauliStringCollectionTest {

  private static PauliString p(String label) {
    return PauliString.parse(label);
  }

  @Test
  void shorterStringsArePaddedAndLongerOnesWiden() {
    PauliStringCollection collection = PauliStringCollection.of("X");
    collection.add(p("ZZ"));
    assertEquals(PauliStrings.of("XI", "ZZ"), collection.generators());
    collection.add(p("Y"));
    assertEquals(PauliStrings.of("XI", "ZZ", "YI"), collection.generators());
    assertEquals(2, collection.width());
  }

  @Test
  void addDeduplicates() {
    PauliStringCollection collection = PauliStringCollection.parse("X, X, Z");
    assertEquals(PauliStrings.of("X", "Z"), collection.generators());
    collection.insert(0, p("Y"));
    collection.insert(0, p("Z"));
    assertEquals(PauliStrings.of("Y", "X", "Z"), collection.generators());
  }

  @Test
  void mutationsInvalidateTheClassification() {
    PauliStringCollection collection = PauliStringCollection.of("X", "Z");
    Classification first = collection.classification();
    assertSame(first, collection.classification(), "Cached until a mutation");
    collection.add(p("Y"));
    Classification second = collection.classification();
    assertNotSame(first, second);
    assertEquals(PauliStrings.of("Y"), collection.dependents());
    collection.remove(p("Y"));
    assertTrue(collection.dependents().isEmpty());
  }

  @Test
  void contractMultipliesInPlace() {
    PauliStringCollection collection = PauliStringCollection.of("XI", "ZI", "IZ");
    collection.contract(p("XI"), p("ZI"));
    assertEquals(PauliStrings.of("YI", "ZI", "IZ"), collection.generators());
    collection.replace(p("IZ"), p("IX"));
    assertEquals(2, collection.indexOf(p("IX")));
    collection.replace(p("XX"), p("YY"));
    assertEquals(3, collection.size(), "Replacing an absent string does nothing");
  }

  @Test
  void graphQueries() {
    PauliStringCollection collection = PauliStringCollection.of("XI", "ZI", "IX", "IZ");
    assertEquals(2, collection.anticommutationPairs());
    assertEquals(2 / 6.0, collection.anticommutationFraction(), 1e-12);
    assertEquals(PauliStrings.of("ZI"), collection.anticommutantsOf(p("XI")));
    assertEquals(PauliStrings.of("IX", "IZ"), collection.commutantsOf(p("XI")));
    assertEquals(
        List.of(PauliStrings.of("XI", "ZI"), PauliStrings.of("IX", "IZ")),
        collection.components());
  }

  @Test
  void dimensionsAddAcrossComponents() {
    PauliStringCollection collection = PauliStringCollection.of("XI", "ZI", "IX", "IZ");
    assertEquals(6, collection.dlaDimension());
    assertEquals("2*so(3)", collection.algebra());
    assertTrue(collection.isAlgebra("so(4)"));
    assertEquals(collection.generators(), collection.independents());
  }

  @Test
  void isingChainClassifiesAsSoSix() {
    PauliStringCollection ising = PauliStringCollection.parse("XXI, IXX, ZII, IZI, IIZ");
    assertEquals(15, ising.dlaDimension());
    assertEquals("so(6)", ising.algebra());
    assertTrue(ising.isAlgebra("su(4)"));
    assertEquals(
        PauliStrings.of("IZI", "XXI", "IXX", "IIZ", "YZY"), ising.canonicVertices().generators());
  }

  @Test
  void membershipAndEquivalence() {
    PauliStringCollection xz = PauliStringCollection.of("X", "Z");
    PauliStringCollection xy = PauliStringCollection.of("X", "Y");
    assertTrue(xz.isIn(xy));
    assertTrue(xz.isEquivalent(xy));

    PauliStringCollection left = PauliStringCollection.of("XI", "ZI");
    PauliStringCollection mixed = PauliStringCollection.of("XI", "IZ");
    assertFalse(left.isIn(mixed));
    assertFalse(left.isEquivalent(mixed));
    assertFalse(new PauliStringCollection().isIn(xz), "An empty collection holds nothing");
  }

  @Test
  void selectDependentsKeepsGeneratedStrings() {
    PauliStringCollection star = PauliStringCollection.of("ZI", "IZ", "XX");
    assertEquals(
        PauliStrings.of("YY", "ZI"),
        star.selectDependents(PauliStringCollection.of("YY", "XI", "ZI")));
  }

  @Test
  void spaceOfOneQubitIsEveryPauli() {
    PauliStringCollection xz = PauliStringCollection.of("X", "Z");
    assertEquals(PauliStrings.of("Z", "X", "Y"), xz.space());
    assertEquals(3, xz.dlaDimension());
  }

  @Test
  void commutantsAreTheLinearSymmetries() {
    PauliStringCollection collection = PauliStringCollection.of("XI", "IX");
    assertEquals(PauliStrings.of("II", "IX", "XI", "XX"), collection.commutants());
  }

  @Test
  void connectionSearchIsDeterministicForASeed() {
    ClassifierOptions options = ClassifierOptions.defaults().withSeed(42L);
    PauliStringCollection collection =
        new PauliStringCollection(PauliStrings.of("XI", "ZI", "IX", "IZ"), options);

    PauliStringCollection unchanged = collection.findGeneratorsWithConnection(2);
    assertEquals(collection.canonicVertices(), unchanged);
    assertEquals(2, unchanged.anticommutationPairs());

    PauliStringCollection first = collection.findGeneratorsWithConnection(3);
    PauliStringCollection second = collection.findGeneratorsWithConnection(3);
    assertEquals(first, second);
    assertEquals(4, first.size());
  }

  @Test
  void copyIsIndependentOfTheOriginal() {
    PauliStringCollection original = PauliStringCollection.of("XI", "ZI");
    PauliStringCollection copy = original.copy();
    assertEquals(original.generators(), copy.generators());
    copy.add(p("IZ"));
    assertEquals(PauliStrings.of("XI", "ZI"), original.generators());
    assertEquals(PauliStrings.of("XI", "ZI", "IZ"), copy.generators());
  }

  @Test
  void tensorWithAStringWidensEveryGenerator() {
    PauliStringCollection collection = PauliStringCollection.of("XX", "ZI");
    PauliStringCollection widened = collection.tensor(p("Y"));
    assertEquals(PauliStrings.of("XXY", "ZIY"), widened.generators());
    assertEquals(3, widened.width());
    assertEquals(PauliStrings.of("XX", "ZI"), collection.generators(), "Original is untouched");
    assertEquals(3L, PauliStringCollection.of("X", "Z").tensor(p("I")).dlaDimension());
  }

  @Test
  void tensorOfCollectionsPairsEveryGenerator() {
    PauliStringCollection left = PauliStringCollection.of("X", "Z");
    PauliStringCollection product = left.tensor(PauliStringCollection.of("X", "Z"));
    assertEquals(PauliStrings.of("XX", "XZ", "ZX", "ZZ"), product.generators());
    assertEquals(
        PauliStrings.of("XI", "ZI"),
        left.tensor(PauliStringCollection.of("I", "I")).generators(),
        "Equal products collapse");
  }

  @Test
  void framePotentialCountsComponentsTimesIsolates() {
    assertEquals(2L, PauliStringCollection.of("X").framePotential(), "{X} and {Y, Z}");
    assertEquals(0L, PauliStringCollection.of("X", "Z").framePotential(), "Nothing is isolated");
    assertEquals(77L, PauliStringCollection.of("ZZ").framePotential());
    assertEquals(4L, PauliStringCollection.of("ZI", "IZ", "XX").framePotential());
    assertEquals(24L, PauliStringCollection.of("XX", "YY").framePotential());
    assertEquals(6L, PauliStringCollection.of("XXI", "IXX", "ZII", "IZI", "IIZ").framePotential());
    assertEquals(0L, new PauliStringCollection().framePotential());
  }
}
