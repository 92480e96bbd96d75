package paulie.collection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import paulie.classifier.Classification;
import paulie.classifier.Classifier;
import paulie.classifier.MorphFactory;
import paulie.core.ClassifierOptions;
import paulie.core.model.Morph;
import paulie.core.model.PauliString;
import paulie.util.AnticommutationGraph;

/**
 * Ordered set of generators sharing one width. Strings shorter than the collection are padded
 * with identities on the right; a longer string widens every generator.
 *
 * <p>The classification is computed on demand and cached until the next mutation.
 */
public final class PauliStringCollection implements Iterable<PauliString> {
  private static final Logger LOG = LoggerFactory.getLogger(PauliStringCollection.class);

  private final List<PauliString> generators = new ArrayList<>();
  private final ClassifierOptions options;
  private final Classifier classifier;
  private Classification classification;

  public PauliStringCollection() {
    this(List.of(), ClassifierOptions.defaults());
  }

  public PauliStringCollection(Collection<PauliString> generators) {
    this(generators, ClassifierOptions.defaults());
  }

  public PauliStringCollection(Collection<PauliString> generators, ClassifierOptions options) {
    Objects.requireNonNull(generators, "generators");
    this.options = ClassifierOptions.normalize(options);
    this.classifier = new Classifier(this.options);
    for (PauliString generator : generators) {
      add(generator);
    }
  }

  /** Parses a separated list of labels such as {@code "XX, YZ"}. */
  public static PauliStringCollection parse(String text) {
    return new PauliStringCollection(PauliStrings.parseAll(text));
  }

  public static PauliStringCollection of(String... labels) {
    return new PauliStringCollection(PauliStrings.of(labels));
  }

  public ClassifierOptions options() {
    return options;
  }

  public int size() {
    return generators.size();
  }

  public boolean isEmpty() {
    return generators.isEmpty();
  }

  /** Qubit count shared by every generator; {@code 0} when empty. */
  public int width() {
    return generators.isEmpty() ? 0 : generators.get(0).length();
  }

  public PauliString get(int index) {
    return generators.get(index);
  }

  public List<PauliString> generators() {
    return List.copyOf(generators);
  }

  public int indexOf(PauliString generator) {
    return generators.indexOf(pad(generator));
  }

  public boolean contains(PauliString generator) {
    return generators.contains(pad(generator));
  }

  @Override
  public Iterator<PauliString> iterator() {
    return generators().iterator();
  }

  // ----- Mutations -----

  /** Appends a generator unless an equal one is already present. */
  public void add(PauliString generator) {
    insert(generators.size(), generator);
  }

  public void insert(int index, PauliString generator) {
    Objects.requireNonNull(generator, "generator");
    PauliString fitted = fit(generator);
    invalidate();
    if (!generators.contains(fitted)) {
      generators.add(index, fitted);
    }
  }

  public void remove(PauliString generator) {
    invalidate();
    generators.remove(pad(generator));
  }

  /** Puts {@code replacement} in the slot of {@code generator}; nothing happens if it is absent. */
  public void replace(PauliString generator, PauliString replacement) {
    Objects.requireNonNull(replacement, "replacement");
    int index = indexOf(generator);
    if (index < 0) {
      return;
    }
    invalidate();
    generators.set(index, fit(replacement));
  }

  /** Replaces {@code generator} by {@code generator · other}. */
  public void contract(PauliString generator, PauliString other) {
    replace(generator, pad(generator).multiply(pad(other)));
  }

  public PauliStringCollection copy() {
    return new PauliStringCollection(generators, options);
  }

  /** Every generator tensored with {@code p} on the right; this collection is left as is. */
  public PauliStringCollection tensor(PauliString p) {
    Objects.requireNonNull(p, "p");
    List<PauliString> result = new ArrayList<>(generators.size());
    for (PauliString generator : generators) {
      result.add(generator.tensor(p));
    }
    return new PauliStringCollection(result, options);
  }

  /** Every generator of this collection tensored with every generator of {@code other}. */
  public PauliStringCollection tensor(PauliStringCollection other) {
    Objects.requireNonNull(other, "other");
    List<PauliString> result = new ArrayList<>(generators.size() * other.size());
    for (PauliString left : generators) {
      for (PauliString right : other.generators) {
        result.add(left.tensor(right));
      }
    }
    return new PauliStringCollection(result, options);
  }

  /** Pads a shorter string to the collection width, widening the collection for a longer one. */
  private PauliString fit(PauliString generator) {
    PauliString padded = pad(generator);
    if (padded.length() > width() && !generators.isEmpty()) {
      generators.replaceAll(g -> g.expand(padded.length()));
    }
    return padded;
  }

  private PauliString pad(PauliString generator) {
    Objects.requireNonNull(generator, "generator");
    return generator.length() < width() ? generator.expand(width()) : generator;
  }

  private void invalidate() {
    classification = null;
  }

  // ----- Graph queries -----

  public AnticommutationGraph graph() {
    return AnticommutationGraph.of(generators);
  }

  public int anticommutationPairs() {
    return graph().edgeCount();
  }

  /** Share of generator pairs that anticommute; {@code 0} with fewer than two generators. */
  public double anticommutationFraction() {
    int n = generators.size();
    if (n < 2) {
      return 0.0;
    }
    return anticommutationPairs() / (n * (n - 1) / 2.0);
  }

  /** Generators that anticommute with {@code p}. */
  public List<PauliString> anticommutantsOf(PauliString p) {
    PauliString padded = pad(p);
    List<PauliString> result = new ArrayList<>();
    for (PauliString generator : generators) {
      if (generator.anticommutesWith(padded)) {
        result.add(generator);
      }
    }
    return result;
  }

  /** Generators other than {@code p} that commute with it. */
  public List<PauliString> commutantsOf(PauliString p) {
    PauliString padded = pad(p);
    List<PauliString> result = new ArrayList<>();
    for (PauliString generator : generators) {
      if (!generator.equals(padded) && generator.commutesWith(padded)) {
        result.add(generator);
      }
    }
    return result;
  }

  /** Connected components of the anticommutation graph, largest first. */
  public List<List<PauliString>> components() {
    return graph().components();
  }

  // ----- Classification -----

  /** Recomputes the classification, replacing the cached one. */
  public Classification classify() {
    classification = classifier.classifyAll(components());
    LOG.debug("{} -> {}", generators, classification);
    return classification;
  }

  public Classification classification() {
    if (classification == null) {
      return classify();
    }
    return classification;
  }

  public String algebra() {
    return classification().algebra();
  }

  public boolean isAlgebra(String name) {
    return classification().isAlgebra(name);
  }

  public long dlaDimension() {
    return classification().dlaDimension();
  }

  public List<PauliString> dependents() {
    return classification().dependents();
  }

  /** Generators that are not dependent, in collection order. */
  public List<PauliString> independents() {
    List<PauliString> dependents = dependents();
    List<PauliString> result = new ArrayList<>();
    for (PauliString generator : generators) {
      if (!dependents.contains(generator)) {
        result.add(generator);
      }
    }
    return result;
  }

  public PauliStringCollection canonicVertices() {
    return new PauliStringCollection(classification().vertices(), options);
  }

  // ----- Membership -----

  /** Whether every generator of {@code other} lies in the algebra generated by this collection. */
  public boolean isIn(PauliStringCollection other) {
    Objects.requireNonNull(other, "other");
    if (isEmpty()) {
      return false;
    }
    MorphFactory factory = classifier.factory();
    List<Morph> morphs = classification().morphs();
    for (List<PauliString> component : other.components()) {
      boolean covered = false;
      for (Morph morph : morphs) {
        if (factory.isEq(morph, component)) {
          covered = true;
          break;
        }
      }
      if (!covered) {
        return false;
      }
    }
    return true;
  }

  /** Both collections generate the same algebra. */
  public boolean isEquivalent(PauliStringCollection other) {
    return isIn(other) && other.isIn(this);
  }

  /** Generators of {@code other} already generated by this collection, without repeats. */
  public List<PauliString> selectDependents(PauliStringCollection other) {
    Objects.requireNonNull(other, "other");
    return selectDependents(other.components());
  }

  private List<PauliString> selectDependents(List<List<PauliString>> components) {
    if (isEmpty()) {
      return List.of();
    }
    MorphFactory factory = classifier.factory();
    LinkedHashSet<PauliString> dependents = new LinkedHashSet<>();
    for (List<PauliString> component : components) {
      for (Morph morph : classification().morphs()) {
        dependents.addAll(factory.selectDependents(morph, component));
      }
    }
    return new ArrayList<>(dependents);
  }

  /** Every non-identity string of the collection width that lies in the generated algebra. */
  public List<PauliString> space() {
    if (isEmpty()) {
      return List.of();
    }
    List<PauliString> candidates = PauliStrings.allNonIdentity(width());
    return selectDependents(AnticommutationGraph.of(candidates).components());
  }

  /** Strings, identity included, that commute with every generator. */
  public List<PauliString> commutants() {
    if (isEmpty()) {
      return List.of();
    }
    List<PauliString> result = new ArrayList<>();
    for (PauliString candidate : PauliStrings.all(width())) {
      if (anticommutantsOf(candidate).isEmpty()) {
        result.add(candidate);
      }
    }
    return result;
  }

  /**
   * Frame potential of the generated dynamics: the number of connected components of the
   * commutator graph times the number of its isolated strings. The commutator graph joins two
   * non-identity strings when one is the commutator of the other with a generator.
   */
  public long framePotential() {
    int width = width();
    if (width > PauliStrings.MAX_ENUMERATION_WIDTH) {
      throw new IllegalStateException(
          "Frame potential needs all strings of width " + width + "; the limit is "
              + PauliStrings.MAX_ENUMERATION_WIDTH);
    }
    int count = 1 << (2 * width);
    int[] codes = new int[generators.size()];
    for (int i = 0; i < codes.length; i++) {
      codes[i] = code(generators.get(i));
    }
    int[] parent = new int[count];
    for (int c = 0; c < count; c++) {
      parent[c] = c;
    }
    long isolated = 0;
    for (int c = 1; c < count; c++) {
      boolean touched = false;
      for (int g : codes) {
        if (anticommute(c, g)) {
          touched = true;
          union(parent, c, c ^ g);
        }
      }
      if (!touched) {
        isolated++;
      }
    }
    long components = 0;
    for (int c = 1; c < count; c++) {
      if (root(parent, c) == c) {
        components++;
      }
    }
    LOG.debug("Commutator graph of {}: {} components, {} isolated", this, components, isolated);
    return components * isolated;
  }

  /** Index of {@code p} in {@link PauliStrings#all}: two bits per qubit, X above Z. */
  private static int code(PauliString p) {
    int code = 0;
    for (int position = 0; position < p.length(); position++) {
      int shift = 2 * (p.length() - 1 - position);
      char label = p.labelAt(position);
      if (label == 'X' || label == 'Y') {
        code |= 1 << (shift + 1);
      }
      if (label == 'Z' || label == 'Y') {
        code |= 1 << shift;
      }
    }
    return code;
  }

  private static boolean anticommute(int a, int b) {
    int low = 0x55555555;
    int crossed = ((a >>> 1) & low & b) ^ (a & low & (b >>> 1));
    return (Integer.bitCount(crossed) & 1) == 1;
  }

  private static int root(int[] parent, int c) {
    while (parent[c] != c) {
      parent[c] = parent[parent[c]];
      c = parent[c];
    }
    return c;
  }

  private static void union(int[] parent, int a, int b) {
    int ra = root(parent, a);
    int rb = root(parent, b);
    if (ra != rb) {
      parent[Math.max(ra, rb)] = Math.min(ra, rb);
    }
  }

  // ----- Search -----

  /**
   * Starting from the canonic vertices, contracts anticommuting pairs until the number of
   * anticommuting pairs reaches {@code target}. Each round keeps the contraction that gets closest
   * without overshooting; when no contraction helps, a random pair drawn from {@link
   * ClassifierOptions#seed()} is tried instead, and the search stops if that fails too.
   */
  public PauliStringCollection findGeneratorsWithConnection(int target) {
    if (target < 0) {
      throw new IllegalArgumentException("target must be non-negative");
    }
    Random random = new Random(options.seed());
    List<PauliString> current = canonicVertices().generators();
    int rounds = target / 2;
    for (int round = 0; round < rounds; round++) {
      int delta = target - pairs(current);
      if (delta == 0) {
        break;
      }
      List<int[]> connections = AnticommutationGraph.of(current).edges();
      List<PauliString> best = current;
      int bestDelta = Math.abs(delta);
      for (int[] connection : connections) {
        List<PauliString> gx = contracted(current, connection[0], connection[1]);
        List<PauliString> gy = contracted(current, connection[1], connection[0]);
        int deltaX = target - pairs(gx);
        int deltaY = target - pairs(gy);
        List<PauliString> pick = Math.abs(deltaX) < Math.abs(deltaY) ? gx : gy;
        int pickDelta = Math.abs(deltaX) < Math.abs(deltaY) ? deltaX : deltaY;
        if (pickDelta >= 0 && pickDelta < bestDelta) {
          best = pick;
          bestDelta = pickDelta;
        }
      }
      if (best == current) {
        if (connections.isEmpty()) {
          break;
        }
        int[] connection = connections.get(random.nextInt(connections.size()));
        List<PauliString> gx = contracted(current, connection[0], connection[1]);
        List<PauliString> gy = contracted(current, connection[1], connection[0]);
        if (target - pairs(gx) > 0) {
          best = gx;
        } else if (target - pairs(gy) > 0) {
          best = gy;
        } else {
          LOG.debug("Connection search stalled at {} pairs (target {})", pairs(current), target);
          break;
        }
      }
      current = best;
    }
    return new PauliStringCollection(current, options);
  }

  private static int pairs(List<PauliString> strings) {
    return AnticommutationGraph.of(strings).edgeCount();
  }

  private static List<PauliString> contracted(List<PauliString> strings, int target, int by) {
    List<PauliString> result = new ArrayList<>(strings);
    result.set(target, strings.get(target).multiply(strings.get(by)));
    return result;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PauliStringCollection other)) {
      return false;
    }
    return generators.equals(other.generators);
  }

  @Override
  public int hashCode() {
    return generators.hashCode();
  }

  @Override
  public String toString() {
    return generators.toString();
  }
}
