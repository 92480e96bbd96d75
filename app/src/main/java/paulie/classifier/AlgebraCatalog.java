package paulie.classifier;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import paulie.core.PaulieException;
import paulie.core.model.ComponentAlgebra;
import paulie.core.model.ComponentAlgebra.Family;
import paulie.core.model.MorphShape;
import paulie.util.SymplecticForm;

/**
 * Reads the algebra of a canonical component off its shape, and compares algebra names up to the
 * low-dimensional isomorphisms.
 *
 * <p>Single-vertex legs share the center as their only neighbour, so all but one of them are
 * products of a placed vertex with a symmetry; each extra one doubles the number of copies. What
 * remains is either a path of {@code k} vertices, which generates {@code so(k+1)}, or a proper
 * caterpillar. A proper caterpillar of {@code n} vertices whose commutation form has a radical of
 * dimension {@code r} spans {@code 2N = n - r} dimensions and generates
 *
 * <ul>
 *   <li>{@code 2^(r-1)} copies of {@code su(2^N)} when the quadratic form is odd on the radical,
 *   <li>otherwise {@code 2^r} copies of {@code so(2^N)} or {@code sp(2^N)}, by the Arf invariant.
 * </ul>
 */
public final class AlgebraCatalog {
  private static final Splitter SUMMANDS =
      Splitter.on(CharMatcher.anyOf("+⊕")).trimResults().omitEmptyStrings();
  private static final Splitter COPIES = Splitter.on('*').limit(2);
  private static final CharMatcher WHITESPACE = CharMatcher.whitespace();
  private static final int MAX_COPY_EXPONENT = 62;

  private AlgebraCatalog() {}

  public static ComponentAlgebra classify(MorphShape shape) {
    Objects.requireNonNull(shape, "shape");
    int n = shape.vertexCount();
    if (n == 0) {
      return ComponentAlgebra.none();
    }
    if (n == 1) {
      return ComponentAlgebra.u1();
    }
    int twins = Math.max(0, shape.oneLegCount() - 1);
    if (shape.legLengths().size() - twins <= 2) {
      return new ComponentAlgebra(Family.SO, n - twins + 1, copies(twins));
    }

    SymplecticForm form = new SymplecticForm(shape.adjacency());
    List<BitSet> radical = form.radical();
    int half = (n - radical.size()) / 2;
    if (half > MAX_COPY_EXPONENT / 2) {
      throw new PaulieException("Shape " + shape.signature() + " is too large to classify");
    }
    long degree = 1L << half;
    for (BitSet symmetry : radical) {
      if (form.quadratic(symmetry)) {
        return new ComponentAlgebra(Family.SU, degree, copies(radical.size() - 1));
      }
    }
    Family family = form.arf() ? Family.SP : Family.SO;
    return new ComponentAlgebra(family, degree, copies(radical.size()));
  }

  /**
   * Whether the product of the vertices in {@code product}, indexed like {@link
   * MorphShape#adjacency()}, belongs to the algebra of a faithful realization of {@code shape}.
   * On a proper caterpillar these are the products with {@code q = 1} outside the radical; on a
   * path they are the unbroken runs of vertices, with twin single-vertex legs folded onto the
   * first one.
   */
  public static boolean generates(MorphShape shape, BitSet product) {
    Objects.requireNonNull(shape, "shape");
    Objects.requireNonNull(product, "product");
    int n = shape.vertexCount();
    if (product.isEmpty() || product.length() > n) {
      return false;
    }
    if (n == 1) {
      return true;
    }
    int twins = Math.max(0, shape.oneLegCount() - 1);
    if (shape.legLengths().size() - twins <= 2) {
      return isRun(shape, product);
    }
    SymplecticForm form = new SymplecticForm(shape.adjacency());
    return form.quadratic(product) && !form.isCentral(product);
  }

  private static boolean isRun(MorphShape shape, BitSet product) {
    BitSet folded = (BitSet) product.clone();
    int ones = shape.oneLegCount();
    if (ones > 1) {
      boolean parity = false;
      for (int i = 1; i <= ones; i++) {
        parity ^= folded.get(i);
        folded.clear(i);
      }
      folded.set(1, parity);
    }

    List<Integer> before = new ArrayList<>();
    List<Integer> after = new ArrayList<>();
    int next = 1;
    for (int leg = 0; leg < shape.legLengths().size(); leg++) {
      int length = shape.legLengths().get(leg);
      boolean twin = ones > 1 && leg > 0 && leg < ones;
      if (!twin) {
        List<Integer> chain = before.isEmpty() ? before : after;
        for (int k = 0; k < length; k++) {
          chain.add(next + k);
        }
      }
      next += length;
    }
    List<Integer> path = new ArrayList<>(before.size() + after.size() + 1);
    for (int k = before.size() - 1; k >= 0; k--) {
      path.add(before.get(k));
    }
    path.add(0);
    path.addAll(after);

    int start = -1;
    int end = -1;
    for (int k = 0; k < path.size(); k++) {
      if (folded.get(path.get(k))) {
        start = start < 0 ? k : start;
        end = k;
      }
    }
    if (start < 0) {
      return false;
    }
    for (int k = start; k <= end; k++) {
      if (!folded.get(path.get(k))) {
        return false;
      }
    }
    return true;
  }

  private static long copies(int exponent) {
    if (exponent > MAX_COPY_EXPONENT) {
      throw new PaulieException("2^" + exponent + " copies exceed the range of long");
    }
    return 1L << exponent;
  }

  /** Whether two algebra names, possibly direct sums, denote isomorphic algebras. */
  public static boolean matches(String left, String right) {
    return canonical(left).equals(canonical(right));
  }

  /**
   * Simple summands with their multiplicities, small-rank aliases folded onto one representative.
   * Summands are separated by {@code +} or {@code ⊕}; {@code k*g} stands for {@code k} copies.
   */
  public static SortedMap<String, Long> canonical(String algebra) {
    Objects.requireNonNull(algebra, "algebra");
    SortedMap<String, Long> summands = new TreeMap<>();
    String normalized = WHITESPACE.removeFrom(algebra).toLowerCase(Locale.ROOT);
    for (String term : SUMMANDS.split(normalized)) {
      List<String> parts = COPIES.splitToList(term);
      long count = 1;
      String summand = parts.get(parts.size() - 1);
      if (parts.size() == 2) {
        count = parseCount(parts.get(0), term);
      }
      switch (summand) {
        case "0" -> {}
        case "so(2)", "u(1)" -> summands.merge("u(1)", count, Long::sum);
        case "su(2)", "sp(2)", "so(3)" -> summands.merge("so(3)", count, Long::sum);
        case "so(4)" -> summands.merge("so(3)", 2 * count, Long::sum);
        case "sp(4)" -> summands.merge("so(5)", count, Long::sum);
        case "su(4)" -> summands.merge("so(6)", count, Long::sum);
        default -> summands.merge(summand, count, Long::sum);
      }
    }
    return summands;
  }

  private static long parseCount(String text, String term) {
    try {
      long count = Long.parseLong(text);
      if (count < 1) {
        throw new IllegalArgumentException("Copy count must be positive in '" + term + "'");
      }
      return count;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Malformed copy count in '" + term + "'", e);
    }
  }

  /** Renders summands in name order as {@code k*g} terms joined with {@code +}. */
  public static String join(Map<String, Long> summands) {
    List<String> terms = new ArrayList<>(summands.size());
    for (Map.Entry<String, Long> entry : new TreeMap<>(summands).entrySet()) {
      long count = entry.getValue();
      if (count > 0) {
        terms.add(count == 1 ? entry.getKey() : count + "*" + entry.getKey());
      }
    }
    return terms.isEmpty() ? "0" : Joiner.on('+').join(terms);
  }
}
