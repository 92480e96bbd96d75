package paulie.classifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import paulie.core.StructuralViolationException;
import paulie.core.model.Morph;
import paulie.core.model.PauliString;

/**
 * Mutable caterpillar under construction. Leg 0 holds the center; the remaining legs are kept in
 * non-decreasing length order so the last leg is always the long leg.
 *
 * <p>Only the operations the insertion rules need are exposed. Every query returns a snapshot, so
 * callers must re-query after a mutation.
 */
public final class LegStructure {
  private final List<List<PauliString>> legs;

  public LegStructure() {
    this.legs = new ArrayList<>();
  }

  private LegStructure(List<List<PauliString>> legs) {
    this.legs = legs;
  }

  /** Mutable copy of a finished morph, for trying candidates without touching the original. */
  public static LegStructure fromMorph(Morph morph) {
    Objects.requireNonNull(morph, "morph");
    List<List<PauliString>> legs = new ArrayList<>();
    for (List<PauliString> leg : morph.legs()) {
      legs.add(new ArrayList<>(leg));
    }
    return new LegStructure(legs);
  }

  public LegStructure copy() {
    List<List<PauliString>> copy = new ArrayList<>(legs.size());
    for (List<PauliString> leg : legs) {
      copy.add(new ArrayList<>(leg));
    }
    return new LegStructure(copy);
  }

  public Morph toMorph(List<PauliString> dependents) {
    return new Morph(legs, dependents);
  }

  // ----- Queries -----

  public boolean isEmpty() {
    return legs.isEmpty();
  }

  /** Number of legs, the center leg included. */
  public int legCount() {
    return legs.size();
  }

  /** True once the center carries at least two legs. */
  public boolean hasCore() {
    return legs.size() >= 3;
  }

  public int vertexCount() {
    int count = 0;
    for (List<PauliString> leg : legs) {
      count += leg.size();
    }
    return count;
  }

  public List<PauliString> vertices() {
    List<PauliString> vertices = new ArrayList<>(vertexCount());
    for (List<PauliString> leg : legs) {
      vertices.addAll(leg);
    }
    return vertices;
  }

  public boolean contains(PauliString vertex) {
    return find(vertex) != null;
  }

  /** Locates a vertex, or returns {@code null} when it is not placed. */
  public Position find(PauliString vertex) {
    for (int i = 0; i < legs.size(); i++) {
      int index = legs.get(i).indexOf(vertex);
      if (index > -1) {
        return new Position(i, index);
      }
    }
    return null;
  }

  public PauliString center() {
    return legs.isEmpty() ? null : legs.get(0).get(0);
  }

  public List<PauliString> leg(int index) {
    return List.copyOf(legs.get(index));
  }

  public List<PauliString> longLeg() {
    requireCore();
    return List.copyOf(legs.get(legs.size() - 1));
  }

  /** First vertex of the shortest leg; the reference vertex of several rewrites. */
  public PauliString omega() {
    requireCore();
    return legs.get(1).get(0);
  }

  /** Vertices of the leading legs of length one (the long leg included when it has length one). */
  public List<PauliString> oneLegVertices() {
    requireCore();
    List<PauliString> vertices = new ArrayList<>();
    for (int i = 1; i < legs.size(); i++) {
      if (legs.get(i).size() != 1) {
        break;
      }
      vertices.add(legs.get(i).get(0));
    }
    return vertices;
  }

  /** Legs of length two, in order (the long leg included when it has length two). */
  public List<List<PauliString>> twoLegs() {
    requireCore();
    List<List<PauliString>> result = new ArrayList<>();
    for (int i = 1; i < legs.size(); i++) {
      int size = legs.get(i).size();
      if (size == 2) {
        result.add(List.copyOf(legs.get(i)));
      } else if (size > 2) {
        break;
      }
    }
    return result;
  }

  /** True when a leg of length two exists besides a long leg of length two. */
  public boolean hasTwoLeg() {
    int count = twoLegs().size();
    if (count == 0) {
      return false;
    }
    if (longLeg().size() != 2) {
      return true;
    }
    return count > 1;
  }

  // ----- Mutations -----

  public void setCenter(PauliString vertex) {
    Objects.requireNonNull(vertex, "vertex");
    if (!legs.isEmpty()) {
      throw new StructuralViolationException("Center is already set");
    }
    List<PauliString> center = new ArrayList<>(1);
    center.add(vertex);
    legs.add(center);
  }

  /**
   * Attaches {@code vertex} after {@code anchor}. Anchoring at the center opens a new leg of
   * length one; anchoring anywhere else requires {@code anchor} to be the tail of its leg.
   */
  public void append(PauliString vertex, PauliString anchor) {
    Objects.requireNonNull(vertex, "vertex");
    Position position = find(anchor);
    if (position == null) {
      throw new StructuralViolationException("Anchor " + anchor + " is not placed");
    }
    if (position.leg() == 0) {
      List<PauliString> leg = new ArrayList<>();
      leg.add(vertex);
      legs.add(1, leg);
      return;
    }
    List<PauliString> leg = legs.get(position.leg());
    if (position.index() != leg.size() - 1) {
      throw new StructuralViolationException("Anchor " + anchor + " is not the tail of its leg");
    }
    legs.remove(position.leg());
    List<PauliString> grown = new ArrayList<>(leg);
    grown.add(vertex);
    insertOrdered(grown);
  }

  /** Cuts the leg holding {@code vertex} just before it; the tail is discarded. */
  public void remove(PauliString vertex) {
    Position position = find(vertex);
    if (position == null) {
      throw new StructuralViolationException("Vertex " + vertex + " is not placed");
    }
    if (position.leg() == 0) {
      throw new StructuralViolationException("The center cannot be removed");
    }
    List<PauliString> kept = new ArrayList<>(legs.get(position.leg()).subList(0, position.index()));
    legs.remove(position.leg());
    if (kept.isEmpty()) {
      return;
    }
    if (kept.size() == 1) {
      legs.add(1, kept);
      return;
    }
    insertOrdered(kept);
  }

  /** Swaps a placed vertex for an equivalent one in the same slot. */
  public void replace(PauliString vertex, PauliString replacement) {
    Objects.requireNonNull(replacement, "replacement");
    Position position = find(vertex);
    if (position == null) {
      throw new StructuralViolationException("Vertex " + vertex + " is not placed");
    }
    legs.get(position.leg()).set(position.index(), replacement);
  }

  private void insertOrdered(List<PauliString> leg) {
    if (leg.size() >= legs.get(legs.size() - 1).size()) {
      legs.add(leg);
      return;
    }
    for (int i = legs.size() - 1; i > 0; i--) {
      if (legs.get(i).size() <= leg.size()) {
        legs.add(i + 1, leg);
        return;
      }
    }
    legs.add(1, leg);
  }

  private void requireCore() {
    if (!hasCore()) {
      throw new StructuralViolationException("Structure has no legs yet");
    }
  }

  @Override
  public String toString() {
    return legs.toString();
  }

  /** Leg index and offset of a placed vertex. */
  public record Position(int leg, int index) {}
}
