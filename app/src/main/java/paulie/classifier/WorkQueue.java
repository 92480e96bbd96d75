package paulie.classifier;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import paulie.core.model.PauliString;

/**
 * Vertices still waiting for insertion. Vertices cut off the long leg go to a delayed lane and
 * are moved back to the front, in the order they were delayed, once the current insertion settles.
 */
public final class WorkQueue {
  private final Deque<PauliString> ready;
  private final List<PauliString> delayed = new ArrayList<>();

  public WorkQueue(Collection<PauliString> vertices) {
    this.ready = new ArrayDeque<>(Objects.requireNonNull(vertices, "vertices"));
  }

  public boolean hasNext() {
    return !ready.isEmpty();
  }

  public PauliString poll() {
    return ready.pollFirst();
  }

  public int size() {
    return ready.size();
  }

  /** Puts a vertex that could not be connected yet at the back of the queue. */
  public void requeue(PauliString vertex) {
    ready.addLast(Objects.requireNonNull(vertex, "vertex"));
  }

  public void delay(PauliString vertex) {
    delayed.add(Objects.requireNonNull(vertex, "vertex"));
  }

  public List<PauliString> delayed() {
    return List.copyOf(delayed);
  }

  public void restoreDelayed() {
    for (int i = delayed.size() - 1; i >= 0; i--) {
      ready.addFirst(delayed.get(i));
    }
    delayed.clear();
  }

  public List<PauliString> snapshot() {
    return List.copyOf(ready);
  }
}
