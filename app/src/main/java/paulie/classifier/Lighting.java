package paulie.classifier;

import java.util.Objects;
import paulie.core.model.PauliString;

/**
 * Cursor over the candidate vertex while a rule rewrites it. Each step multiplies the current
 * value by a placed vertex; landing on a vertex that is already placed proves the candidate
 * redundant.
 */
public final class Lighting {
  private final LegStructure structure;
  private PauliString value;

  public Lighting(LegStructure structure, PauliString value) {
    this.structure = Objects.requireNonNull(structure, "structure");
    this.value = Objects.requireNonNull(value, "value");
  }

  public PauliString value() {
    return value;
  }

  /** Whether {@code vertex} anticommutes with the current value. */
  public boolean lights(PauliString vertex) {
    return value.anticommutesWith(vertex);
  }

  /**
   * Multiplies the value by each vertex in turn.
   *
   * @return {@code false} as soon as an intermediate value is already part of the structure
   */
  public boolean through(PauliString... vertices) {
    for (PauliString vertex : vertices) {
      value = value.multiply(vertex);
      if (structure.contains(value)) {
        return false;
      }
    }
    return true;
  }
}
