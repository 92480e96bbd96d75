package paulie.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import paulie.core.model.PauliString;

/**
 * Anticommutation graph over an indexed list of Pauli strings: vertices are list positions, and
 * two positions are adjacent when their strings anticommute.
 */
public final class AnticommutationGraph {
  private final List<PauliString> vertices;
  private final BitSet[] adjacency;

  private AnticommutationGraph(List<PauliString> vertices, BitSet[] adjacency) {
    this.vertices = vertices;
    this.adjacency = adjacency;
  }

  public static AnticommutationGraph of(List<PauliString> vertices) {
    Objects.requireNonNull(vertices, "vertices");
    List<PauliString> copy = List.copyOf(vertices);
    BitSet[] adjacency = new BitSet[copy.size()];
    for (int i = 0; i < copy.size(); i++) {
      adjacency[i] = new BitSet(copy.size());
    }
    for (int i = 0; i < copy.size(); i++) {
      for (int j = i + 1; j < copy.size(); j++) {
        if (copy.get(i).anticommutesWith(copy.get(j))) {
          adjacency[i].set(j);
          adjacency[j].set(i);
        }
      }
    }
    return new AnticommutationGraph(copy, adjacency);
  }

  public int size() {
    return vertices.size();
  }

  public BitSet neighbors(int index) {
    return (BitSet) adjacency[index].clone();
  }

  public int degree(int index) {
    return adjacency[index].cardinality();
  }

  public int edgeCount() {
    int twice = 0;
    for (BitSet row : adjacency) {
      twice += row.cardinality();
    }
    return twice / 2;
  }

  /** Edges as index pairs {@code (i, j)} with {@code i < j}, in row order. */
  public List<int[]> edges() {
    List<int[]> edges = new ArrayList<>();
    for (int i = 0; i < adjacency.length; i++) {
      for (int j = adjacency[i].nextSetBit(i + 1); j >= 0; j = adjacency[i].nextSetBit(j + 1)) {
        edges.add(new int[] {i, j});
      }
    }
    return edges;
  }

  public boolean isConnected() {
    return componentMasks().size() <= 1;
  }

  /**
   * Connected components, largest first; ties keep the order of their first member. Members keep
   * their list order. Copies of the same string always share a component, so repeated generators
   * are classified together.
   */
  public List<List<PauliString>> components() {
    List<List<PauliString>> components = new ArrayList<>();
    for (BitSet mask : componentMasks()) {
      List<PauliString> members = new ArrayList<>(mask.cardinality());
      for (int i = mask.nextSetBit(0); i >= 0; i = mask.nextSetBit(i + 1)) {
        members.add(vertices.get(i));
      }
      components.add(members);
    }
    return components;
  }

  private List<BitSet> componentMasks() {
    List<BitSet> masks = new ArrayList<>();
    BitSet visited = new BitSet(vertices.size());
    for (int start = 0; start < vertices.size(); start++) {
      if (visited.get(start)) {
        continue;
      }
      BitSet mask = new BitSet(vertices.size());
      Deque<Integer> stack = new ArrayDeque<>();
      stack.push(start);
      while (!stack.isEmpty()) {
        int current = stack.pop();
        if (visited.get(current)) {
          continue;
        }
        visited.set(current);
        mask.set(current);
        BitSet next = linked(current);
        next.andNot(visited);
        for (int i = next.nextSetBit(0); i >= 0; i = next.nextSetBit(i + 1)) {
          stack.push(i);
        }
      }
      masks.add(mask);
    }
    masks.sort(Comparator.comparingInt(BitSet::cardinality).reversed());
    return masks;
  }

  private BitSet linked(int index) {
    BitSet linked = neighbors(index);
    PauliString vertex = vertices.get(index);
    for (int i = 0; i < vertices.size(); i++) {
      if (i != index && vertices.get(i).equals(vertex)) {
        linked.set(i);
      }
    }
    return linked;
  }
}
