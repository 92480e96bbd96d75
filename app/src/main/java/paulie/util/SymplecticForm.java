package paulie.util;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * Commutation form of independent Pauli strings over GF(2). A vector is a subset of the strings,
 * read as their product; two products anticommute when {@link #pairing} is {@code true}.
 *
 * <p>The form carries the quadratic refinement that is {@code 1} on every single string:
 * {@code q(u + v) = q(u) + q(v) + <u, v>}. Every nested commutator of the strings has
 * {@code q = 1}, which is what pins down the real or quaternionic type of the generated algebra.
 */
public final class SymplecticForm {
  private final int size;
  private final BitSet[] rows;

  /** @param adjacency symmetric anticommutation adjacency with an empty diagonal */
  public SymplecticForm(BitSet[] adjacency) {
    Objects.requireNonNull(adjacency, "adjacency");
    this.size = adjacency.length;
    this.rows = new BitSet[size];
    for (int i = 0; i < size; i++) {
      rows[i] = (BitSet) adjacency[i].clone();
      if (rows[i].get(i)) {
        throw new IllegalArgumentException("A string always commutes with itself (row " + i + ")");
      }
      if (rows[i].length() > size) {
        throw new IllegalArgumentException("Row " + i + " refers past " + size + " strings");
      }
    }
    for (int i = 0; i < size; i++) {
      for (int j = rows[i].nextSetBit(0); j >= 0; j = rows[i].nextSetBit(j + 1)) {
        if (!rows[j].get(i)) {
          throw new IllegalArgumentException("Adjacency is not symmetric at " + i + "," + j);
        }
      }
    }
  }

  public int size() {
    return size;
  }

  public static BitSet unit(int index) {
    BitSet unit = new BitSet();
    unit.set(index);
    return unit;
  }

  public boolean pairing(BitSet u, BitSet v) {
    int parity = 0;
    for (int i = u.nextSetBit(0); i >= 0; i = u.nextSetBit(i + 1)) {
      BitSet hit = (BitSet) rows[i].clone();
      hit.and(v);
      parity ^= hit.cardinality() & 1;
    }
    return parity == 1;
  }

  public boolean quadratic(BitSet x) {
    int parity = x.cardinality() & 1;
    for (int i = x.nextSetBit(0); i >= 0; i = x.nextSetBit(i + 1)) {
      BitSet later = (BitSet) rows[i].clone();
      later.and(x);
      later.clear(0, i + 1);
      parity ^= later.cardinality() & 1;
    }
    return parity == 1;
  }

  /** Whether the product {@code x} commutes with every string. */
  public boolean isCentral(BitSet x) {
    for (int i = 0; i < size; i++) {
      BitSet hit = (BitSet) rows[i].clone();
      hit.and(x);
      if ((hit.cardinality() & 1) == 1) {
        return false;
      }
    }
    return true;
  }

  /** Basis of the radical: products that commute with every string. */
  public List<BitSet> radical() {
    BitSet[] reduced = new BitSet[size];
    for (int i = 0; i < size; i++) {
      reduced[i] = (BitSet) rows[i].clone();
    }
    int[] pivotRow = new int[size];
    List<Integer> pivots = new ArrayList<>();
    int rank = 0;
    for (int column = 0; column < size; column++) {
      pivotRow[column] = -1;
      int found = -1;
      for (int r = rank; r < size; r++) {
        if (reduced[r].get(column)) {
          found = r;
          break;
        }
      }
      if (found < 0) {
        continue;
      }
      BitSet swap = reduced[rank];
      reduced[rank] = reduced[found];
      reduced[found] = swap;
      for (int r = 0; r < size; r++) {
        if (r != rank && reduced[r].get(column)) {
          reduced[r].xor(reduced[rank]);
        }
      }
      pivotRow[column] = rank;
      pivots.add(column);
      rank++;
    }
    List<BitSet> kernel = new ArrayList<>();
    for (int free = 0; free < size; free++) {
      if (pivotRow[free] >= 0) {
        continue;
      }
      BitSet vector = unit(free);
      for (int column : pivots) {
        if (reduced[pivotRow[column]].get(free)) {
          vector.set(column);
        }
      }
      kernel.add(vector);
    }
    return kernel;
  }

  public int rank() {
    return size - radical().size();
  }

  /**
   * Arf invariant of the quadratic form on a complement of the radical, found by splitting off
   * hyperbolic pairs. Only meaningful when the form vanishes on the radical.
   */
  public boolean arf() {
    List<BitSet> pool = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      pool.add(unit(i));
    }
    boolean arf = false;
    while (true) {
      int first = -1;
      int second = -1;
      for (int i = 0; i < pool.size() && first < 0; i++) {
        for (int j = i + 1; j < pool.size(); j++) {
          if (pairing(pool.get(i), pool.get(j))) {
            first = i;
            second = j;
            break;
          }
        }
      }
      if (first < 0) {
        return arf;
      }
      BitSet e = pool.get(first);
      BitSet f = pool.get(second);
      arf ^= quadratic(e) && quadratic(f);
      List<BitSet> rest = new ArrayList<>(pool.size() - 2);
      for (int k = 0; k < pool.size(); k++) {
        if (k == first || k == second) {
          continue;
        }
        BitSet c = (BitSet) pool.get(k).clone();
        boolean withF = pairing(pool.get(k), f);
        boolean withE = pairing(pool.get(k), e);
        if (withF) {
          c.xor(e);
        }
        if (withE) {
          c.xor(f);
        }
        rest.add(c);
      }
      pool = rest;
    }
  }
}
