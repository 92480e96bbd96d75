package paulie.classifier;

import java.util.Objects;
import paulie.core.model.PauliString;

/**
 * Mutable state shared by the insertion rules while one vertex runs through the pipeline. The
 * lighting advances each time a rule proceeds; the structure and the queue are owned by the
 * surrounding build.
 */
public final class InsertionContext {
  private final LegStructure structure;
  private final WorkQueue queue;
  private final PauliString vertex;
  private final MorphTrace trace;
  private PauliString lighting;

  public InsertionContext(
      LegStructure structure, WorkQueue queue, PauliString vertex, MorphTrace trace) {
    this.structure = Objects.requireNonNull(structure, "structure");
    this.queue = Objects.requireNonNull(queue, "queue");
    this.vertex = Objects.requireNonNull(vertex, "vertex");
    this.trace = (trace == null) ? MorphTrace.NOOP : trace;
    this.lighting = vertex;
  }

  public LegStructure structure() {
    return structure;
  }

  /** The vertex being inserted, as it was polled from the queue. */
  public PauliString vertex() {
    return vertex;
  }

  public PauliString lighting() {
    return lighting;
  }

  /** Fresh cursor starting at the current lighting. */
  public Lighting light() {
    return new Lighting(structure, lighting);
  }

  void advance(PauliString next) {
    this.lighting = Objects.requireNonNull(next, "next");
  }

  /** Defers a vertex cut from the long leg until the current insertion settles. */
  public void delay(PauliString cut) {
    queue.delay(cut);
    trace.onDelayed(cut);
  }
}
