package paulie.collection;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import paulie.core.model.PauliString;

/** Factory helpers for building generator lists. */
public final class PauliStrings {
  /** Largest width for which {@link #all(int)} materializes every string. */
  public static final int MAX_ENUMERATION_WIDTH = 12;

  private static final Splitter LIST_SPLITTER =
      Splitter.on(CharMatcher.anyOf(",;").or(CharMatcher.whitespace()))
          .trimResults()
          .omitEmptyStrings();

  private PauliStrings() {}

  /** Parses a list such as {@code "XX, YZ; ZI"}; commas, semicolons and whitespace separate. */
  public static List<PauliString> parseAll(String text) {
    Objects.requireNonNull(text, "text");
    List<PauliString> result = new ArrayList<>();
    for (String token : LIST_SPLITTER.split(text)) {
      result.add(PauliString.parse(token));
    }
    return result;
  }

  public static List<PauliString> of(String... texts) {
    List<PauliString> result = new ArrayList<>(texts.length);
    for (String text : texts) {
      result.add(PauliString.parse(text));
    }
    return result;
  }

  /** Every placement of every generator on a line of {@code width} qubits, without repeats. */
  public static List<PauliString> kLocal(int width, Collection<PauliString> generators) {
    Objects.requireNonNull(generators, "generators");
    Set<PauliString> placed = new LinkedHashSet<>();
    for (PauliString generator : generators) {
      int free = width - generator.length();
      if (free < 0) {
        throw new IllegalArgumentException(
            "width " + width + " is smaller than generator " + generator);
      }
      for (int left = 0; left <= free; left++) {
        PauliString padded =
            PauliString.identity(left).tensor(generator).tensor(PauliString.identity(free - left));
        placed.add(padded);
      }
    }
    return new ArrayList<>(placed);
  }

  /** All {@code 4^width} strings in ascending order, identity first. */
  public static List<PauliString> all(int width) {
    if (width < 0 || width > MAX_ENUMERATION_WIDTH) {
      throw new IllegalArgumentException(
          "width must be between 0 and " + MAX_ENUMERATION_WIDTH + ", got " + width);
    }
    int count = 1 << (2 * width);
    List<PauliString> result = new ArrayList<>(count);
    for (int code = 0; code < count; code++) {
      BitSet x = new BitSet(width);
      BitSet z = new BitSet(width);
      for (int position = 0; position < width; position++) {
        int shift = 2 * (width - 1 - position);
        if (((code >>> (shift + 1)) & 1) != 0) {
          x.set(position);
        }
        if (((code >>> shift) & 1) != 0) {
          z.set(position);
        }
      }
      result.add(PauliString.fromBits(width, x, z));
    }
    return result;
  }

  public static List<PauliString> allNonIdentity(int width) {
    List<PauliString> all = all(width);
    return new ArrayList<>(all.subList(1, all.size()));
  }
}
