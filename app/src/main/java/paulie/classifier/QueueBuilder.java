package paulie.classifier;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import paulie.core.StructuralViolationException;
import paulie.core.model.PauliString;

/**
 * Orders the generators of one connected component so that every vertex after the first
 * anticommutes with something queued before it.
 *
 * <p>The order depends only on the multiset of generators: they are sorted first, the seed is
 * the first string with the most anticommuting partners, and the rest is placed greedily. Copies
 * of an already queued string go to the back so the engine can report them as dependent.
 */
public final class QueueBuilder {

  public List<PauliString> order(Collection<PauliString> generators) {
    Objects.requireNonNull(generators, "generators");
    List<PauliString> pool = new ArrayList<>(generators);
    if (pool.isEmpty()) {
      return List.of();
    }
    Collections.sort(pool);

    PauliString seed = pool.get(0);
    List<PauliString> seedPartners = partners(seed, pool);
    for (PauliString candidate : pool) {
      List<PauliString> candidatePartners = partners(candidate, pool);
      if (candidatePartners.size() > seedPartners.size()) {
        seed = candidate;
        seedPartners = candidatePartners;
      }
    }

    List<PauliString> queue = new ArrayList<>(pool.size());
    queue.add(seed);
    pool.remove(seed);
    for (PauliString partner : seedPartners) {
      queue.add(partner);
      pool.remove(partner);
    }

    while (!pool.isEmpty()) {
      if (!placeNext(queue, pool)) {
        throw new StructuralViolationException(
            "Generators " + pool + " do not anticommute with any of " + queue);
      }
    }
    return queue;
  }

  /** Moves the first pool vertex that touches the queue; returns false when none does. */
  private static boolean placeNext(List<PauliString> queue, List<PauliString> pool) {
    for (int i = 0; i < pool.size(); i++) {
      PauliString candidate = pool.get(i);
      if (queue.contains(candidate)) {
        queue.add(candidate);
        pool.remove(i);
        return true;
      }
      List<PauliString> anchors = partners(candidate, queue);
      if (anchors.isEmpty()) {
        continue;
      }
      if (anchors.size() == 1) {
        queue.add(candidate);
      } else {
        int earliest = queue.size();
        for (PauliString anchor : anchors) {
          earliest = Math.min(earliest, queue.indexOf(anchor));
        }
        queue.add(earliest + 1, candidate);
      }
      pool.remove(i);
      return true;
    }
    return false;
  }

  static List<PauliString> partners(PauliString vertex, List<PauliString> candidates) {
    List<PauliString> partners = new ArrayList<>();
    for (PauliString candidate : candidates) {
      if (candidate.anticommutesWith(vertex)) {
        partners.add(candidate);
      }
    }
    return partners;
  }
}
