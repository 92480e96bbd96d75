package paulie.classifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import paulie.collection.PauliStrings;
import paulie.core.model.Morph;
import paulie.core.model.PauliString;

final class MorphSpanTest {
  private final MorphFactory factory = new MorphFactory();

  @ParameterizedTest
  @ValueSource(
      strings = {
        "XXI IXX ZII IZI IIZ",
        "ZI IZ XX",
        "X Y Z",
        "ZY YI YZ XZ",
        "XXII IXXI IIXX ZIII IZII IIZI IIIZ",
        "YIZ ZYX IZI XYY ZIZ ZYZ",
        "IYYXZ YYZII IXYYY ZXZZI XYYZX ZYIIY ZIIYX"
      })
  void spanAgreesWithTheLieClosure(String generators) {
    List<PauliString> strings = PauliStrings.parseAll(generators);
    Morph morph = factory.build(strings);
    Set<PauliString> closure = LieClosure.basis(strings, 1 << 12);
    int members = 0;
    for (PauliString candidate : PauliStrings.all(strings.get(0).length())) {
      boolean contained = MorphSpan.contains(morph, candidate);
      assertEquals(closure.contains(candidate), contained, candidate + " in " + morph);
      members += contained ? 1 : 0;
    }
    assertEquals(closure.size(), members);
  }

  @Test
  void identityAndForeignWidthsAreNotGenerated() {
    Morph morph = factory.build(PauliStrings.of("ZI", "IZ", "XX"));
    assertFalse(MorphSpan.contains(morph, PauliString.identity(2)));
    assertFalse(MorphSpan.contains(morph, PauliString.parse("XXI")));
    assertFalse(MorphSpan.contains(Morph.empty(), PauliString.parse("X")));
    assertTrue(MorphSpan.contains(morph, PauliString.parse("YY")));
    assertFalse(MorphSpan.contains(morph, PauliString.parse("ZZ")), "Symmetry of the star");
  }
}
