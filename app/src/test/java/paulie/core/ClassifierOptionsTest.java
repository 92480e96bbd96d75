package paulie.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class ClassifierOptionsTest {

  @Test
  void normalizeFillsDefaults() {
    assertEquals(ClassifierOptions.defaults(), ClassifierOptions.normalize(null));
    ClassifierOptions normalized = ClassifierOptions.normalize(new ClassifierOptions(3, 7L, true));
    assertEquals(3, normalized.retryCap());
    assertEquals(7L, normalized.seed());
    assertTrue(normalized.parallel());
  }

  @Test
  void retryCapFollowsComponentSizeByDefault() {
    ClassifierOptions defaults = ClassifierOptions.defaults();
    assertEquals(5, defaults.retryCapFor(5));
    assertEquals(1, defaults.retryCapFor(0));
    assertEquals(2, defaults.withRetryCap(2).retryCapFor(50));
  }

  @Test
  void rejectsNegativeRetryCap() {
    assertThrows(IllegalArgumentException.class, () -> new ClassifierOptions(-1, 0L, false));
  }
}
