package paulie.core.model;

import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * Isomorphism class of a canonical graph: the center plus the lengths of its legs in canonical
 * (ascending) order. Two components with equal shapes generate isomorphic algebras.
 */
public record MorphShape(int vertexCount, List<Integer> legLengths) {

  public MorphShape {
    Objects.requireNonNull(legLengths, "legLengths");
    legLengths = List.copyOf(legLengths);
    if (vertexCount < 0) {
      throw new IllegalArgumentException("vertexCount must be non-negative");
    }
  }

  public static MorphShape of(List<List<PauliString>> legs) {
    Objects.requireNonNull(legs, "legs");
    if (legs.isEmpty()) {
      return new MorphShape(0, List.of());
    }
    int vertexCount = legs.get(0).size();
    Integer[] lengths = new Integer[legs.size() - 1];
    for (int i = 1; i < legs.size(); i++) {
      lengths[i - 1] = legs.get(i).size();
      vertexCount += legs.get(i).size();
    }
    return new MorphShape(vertexCount, List.of(lengths));
  }

  public boolean isEmpty() {
    return vertexCount == 0;
  }

  /** A center with at most two legs draws a simple path. */
  public boolean isPath() {
    return legLengths.size() <= 2;
  }

  /** Legs made of a single vertex; all of them hang off the center with the same neighbourhood. */
  public int oneLegCount() {
    int count = 0;
    for (int length : legLengths) {
      if (length == 1) {
        count++;
      }
    }
    return count;
  }

  /**
   * Anticommutation graph of the caterpillar, indexed like {@link Morph#vertices()}: the center is
   * vertex 0 and every leg is a chain hanging off it, in leg order.
   */
  public BitSet[] adjacency() {
    BitSet[] rows = new BitSet[vertexCount];
    for (int i = 0; i < vertexCount; i++) {
      rows[i] = new BitSet(vertexCount);
    }
    int next = 1;
    for (int length : legLengths) {
      int previous = 0;
      for (int k = 0; k < length; k++) {
        rows[previous].set(next);
        rows[next].set(previous);
        previous = next++;
      }
    }
    return rows;
  }

  public String signature() {
    StringBuilder sb = new StringBuilder();
    sb.append(vertexCount).append(':');
    for (int i = 0; i < legLengths.size(); i++) {
      if (i > 0) {
        sb.append(',');
      }
      sb.append(legLengths.get(i));
    }
    return sb.toString();
  }
}
