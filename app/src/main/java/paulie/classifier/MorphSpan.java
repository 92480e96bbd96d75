package paulie.classifier;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import paulie.core.PaulieException;
import paulie.core.model.Morph;
import paulie.core.model.PauliString;

/**
 * Exact membership test for the algebra of a canonical morph. The candidate is written as a
 * product of the placed vertices over GF(2); each such product is then checked against the shape
 * with {@link AlgebraCatalog#generates}.
 */
final class MorphSpan {
  /** Vertex products equal to the identity only come from symmetries, of which there are few. */
  private static final int MAX_KERNEL = 20;

  private MorphSpan() {}

  static boolean contains(Morph morph, PauliString candidate) {
    Objects.requireNonNull(morph, "morph");
    Objects.requireNonNull(candidate, "candidate");
    List<PauliString> vertices = morph.vertices();
    if (vertices.isEmpty()
        || candidate.isIdentity()
        || candidate.length() != vertices.get(0).length()) {
      return false;
    }

    List<BitSet> basis = new ArrayList<>();
    List<BitSet> combinations = new ArrayList<>();
    List<BitSet> kernel = new ArrayList<>();
    for (int i = 0; i < vertices.size(); i++) {
      BitSet value = vector(vertices.get(i));
      BitSet combination = new BitSet();
      combination.set(i);
      reduce(value, combination, basis, combinations);
      if (value.isEmpty()) {
        kernel.add(combination);
      } else {
        basis.add(value);
        combinations.add(combination);
      }
    }

    BitSet remainder = vector(candidate);
    BitSet product = new BitSet();
    reduce(remainder, product, basis, combinations);
    if (!remainder.isEmpty()) {
      return false;
    }
    if (kernel.size() > MAX_KERNEL) {
      throw new PaulieException(
          "Morph " + morph.shape().signature() + " has " + kernel.size() + " vertex relations");
    }

    for (long mask = 0; mask < (1L << kernel.size()); mask++) {
      BitSet shifted = (BitSet) product.clone();
      for (int k = 0; k < kernel.size(); k++) {
        if ((mask >>> k & 1L) == 1L) {
          shifted.xor(kernel.get(k));
        }
      }
      if (AlgebraCatalog.generates(morph.shape(), shifted)) {
        return true;
      }
    }
    return false;
  }

  /** Clears the pivot of every basis row from {@code value}, tracking the rows used. */
  private static void reduce(
      BitSet value, BitSet combination, List<BitSet> basis, List<BitSet> combinations) {
    for (int k = 0; k < basis.size(); k++) {
      BitSet row = basis.get(k);
      if (value.get(row.nextSetBit(0))) {
        value.xor(row);
        combination.xor(combinations.get(k));
      }
    }
  }

  /** X bits first, then Z bits. */
  private static BitSet vector(PauliString string) {
    BitSet bits = string.xBits();
    BitSet z = string.zBits();
    for (int i = z.nextSetBit(0); i >= 0; i = z.nextSetBit(i + 1)) {
      bits.set(string.length() + i);
    }
    return bits;
  }
}
