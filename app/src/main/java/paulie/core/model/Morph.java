package paulie.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Canonical structure of one connected component: the legs of the caterpillar (leg 0 holds the
 * center) together with the generators found to be redundant while building it.
 */
public record Morph(List<List<PauliString>> legs, List<PauliString> dependents) {

  public Morph {
    Objects.requireNonNull(legs, "legs");
    Objects.requireNonNull(dependents, "dependents");
    List<List<PauliString>> copy = new ArrayList<>(legs.size());
    for (List<PauliString> leg : legs) {
      copy.add(List.copyOf(leg));
    }
    legs = List.copyOf(copy);
    dependents = List.copyOf(dependents);
    if (!legs.isEmpty() && legs.get(0).size() != 1) {
      throw new IllegalArgumentException("The center leg must hold exactly one vertex");
    }
  }

  public static Morph empty() {
    return new Morph(List.of(), List.of());
  }

  public boolean isEmpty() {
    return legs.isEmpty();
  }

  /** Returns the center vertex, or {@code null} for an empty morph. */
  public PauliString center() {
    return legs.isEmpty() ? null : legs.get(0).get(0);
  }

  /** Legs hanging off the center, shortest first. */
  public List<List<PauliString>> outerLegs() {
    return legs.isEmpty() ? List.of() : legs.subList(1, legs.size());
  }

  public List<PauliString> longLeg() {
    return legs.size() < 2 ? List.of() : legs.get(legs.size() - 1);
  }

  /** All placed vertices, center first, then leg by leg. */
  public List<PauliString> vertices() {
    List<PauliString> vertices = new ArrayList<>();
    for (List<PauliString> leg : legs) {
      vertices.addAll(leg);
    }
    return vertices;
  }

  public int vertexCount() {
    int count = 0;
    for (List<PauliString> leg : legs) {
      count += leg.size();
    }
    return count;
  }

  public boolean contains(PauliString vertex) {
    for (List<PauliString> leg : legs) {
      if (leg.contains(vertex)) {
        return true;
      }
    }
    return false;
  }

  public MorphShape shape() {
    return MorphShape.of(legs);
  }

  /** Graph isomorphism between two canonical structures. */
  public boolean isEquivalent(Morph other) {
    Objects.requireNonNull(other, "other");
    return shape().equals(other.shape());
  }

  @Override
  public String toString() {
    return "Morph" + legs + (dependents.isEmpty() ? "" : " dependents=" + dependents);
  }
}
