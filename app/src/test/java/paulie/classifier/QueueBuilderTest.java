package paulie.classifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;
import paulie.collection.PauliStrings;
import paulie.core.StructuralViolationException;
import paulie.core.model.PauliString;

final class QueueBuilderTest {
  private final QueueBuilder builder = new QueueBuilder();

  @Test
  void seedIsTheBestConnectedString() {
    List<PauliString> queue = builder.order(PauliStrings.of("ZI", "IZ", "XX"));
    assertEquals(PauliStrings.of("XX", "IZ", "ZI"), queue);
  }

  @Test
  void stringsJoinAfterTheirEarliestQueuedPartner() {
    List<PauliString> queue = builder.order(PauliStrings.of("XXI", "IXX", "ZII", "IZI", "IIZ"));
    assertEquals(PauliStrings.of("IZI", "IXX", "XXI", "IIZ", "ZII"), queue);

    List<PauliString> withFields = builder.order(PauliStrings.of("ZI", "IZ", "XX", "YY"));
    assertEquals(PauliStrings.of("IZ", "XX", "ZI", "YY"), withFields);
  }

  @Test
  void orderDependsOnlyOnTheMultiset() {
    List<PauliString> generators = PauliStrings.of("XXI", "IXX", "ZII", "IZI", "IIZ");
    List<PauliString> expected = builder.order(generators);
    Random random = new Random(11L);
    for (int i = 0; i < 10; i++) {
      List<PauliString> shuffled = new ArrayList<>(generators);
      Collections.shuffle(shuffled, random);
      assertEquals(expected, builder.order(shuffled), "Shuffle " + shuffled);
    }
  }

  @Test
  void repeatedStringsGoToTheBack() {
    assertEquals(PauliStrings.of("X", "X"), builder.order(PauliStrings.of("X", "X")));
    assertEquals(PauliStrings.of("X", "Z", "Z"), builder.order(PauliStrings.of("Z", "X", "Z")));
  }

  @Test
  void disconnectedInputIsRejected() {
    assertThrows(
        StructuralViolationException.class, () -> builder.order(PauliStrings.of("XI", "IX")));
    assertTrue(builder.order(List.of()).isEmpty());
  }
}
