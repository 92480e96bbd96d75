package paulie.classifier;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import paulie.core.model.ComponentAlgebra;
import paulie.core.model.Morph;
import paulie.core.model.PauliString;

/**
 * Canonical form of a whole generator collection: one {@link Morph} per connected component of
 * the anticommutation graph, largest component first. The algebra is the direct sum of the
 * per-component algebras.
 */
public final class Classification {
  private final List<Morph> morphs;
  private final Supplier<List<ComponentAlgebra>> algebras;

  public Classification(List<Morph> morphs) {
    this.morphs = List.copyOf(Objects.requireNonNull(morphs, "morphs"));
    this.algebras = Suppliers.memoize(this::computeAlgebras);
  }

  public List<Morph> morphs() {
    return morphs;
  }

  public Morph morph(int index) {
    return morphs.get(index);
  }

  public int size() {
    return morphs.size();
  }

  public boolean isEmpty() {
    return morphs.isEmpty();
  }

  /** Generators found redundant, component by component. */
  public List<PauliString> dependents() {
    List<PauliString> dependents = new ArrayList<>();
    for (Morph morph : morphs) {
      dependents.addAll(morph.dependents());
    }
    return dependents;
  }

  /** Canonic representatives: the placed vertices of every component. */
  public List<PauliString> vertices() {
    List<PauliString> vertices = new ArrayList<>();
    for (Morph morph : morphs) {
      vertices.addAll(morph.vertices());
    }
    return vertices;
  }

  public ComponentAlgebra componentAlgebra(int index) {
    return algebras.get().get(index);
  }

  public long dimensionOf(int index) {
    return componentAlgebra(index).dimension();
  }

  /** Sum of the component dimensions. */
  public long dlaDimension() {
    long total = 0;
    for (ComponentAlgebra algebra : algebras.get()) {
      total = Math.addExact(total, algebra.dimension());
    }
    return total;
  }

  public String algebraOf(int index) {
    return componentAlgebra(index).name();
  }

  /** Direct sum of the component algebras, equal summands merged, e.g. {@code 2*so(3)+su(8)}. */
  public String algebra() {
    SortedMap<String, Long> summands = new TreeMap<>();
    for (ComponentAlgebra algebra : algebras.get()) {
      if (algebra.copies() > 0) {
        summands.merge(algebra.summand(), algebra.copies(), Long::sum);
      }
    }
    return AlgebraCatalog.join(summands);
  }

  public boolean isAlgebra(String name) {
    return AlgebraCatalog.matches(algebra(), Objects.requireNonNull(name, "name"));
  }

  /** Same multiset of component shapes, hence isomorphic algebras. */
  public boolean isEquivalent(Classification other) {
    Objects.requireNonNull(other, "other");
    return signatures().equals(other.signatures());
  }

  private List<String> signatures() {
    List<String> signatures = new ArrayList<>(morphs.size());
    for (Morph morph : morphs) {
      signatures.add(morph.shape().signature());
    }
    signatures.sort(null);
    return signatures;
  }

  private List<ComponentAlgebra> computeAlgebras() {
    List<ComponentAlgebra> result = new ArrayList<>(morphs.size());
    for (Morph morph : morphs) {
      result.add(AlgebraCatalog.classify(morph.shape()));
    }
    return List.copyOf(result);
  }

  @Override
  public String toString() {
    return "Classification" + morphs;
  }
}
