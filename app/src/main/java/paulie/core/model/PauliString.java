package paulie.core.model;

import java.util.BitSet;
import java.util.Objects;
import paulie.core.InputMismatchException;
import paulie.core.PauliParseException;

/**
 * Immutable, phase-free Pauli string over {@code I, X, Y, Z}.
 *
 * <p>Each qubit is stored as an {@code (x, z)} bit pair: {@code I = (0,0)}, {@code X = (1,0)},
 * {@code Y = (1,1)}, {@code Z = (0,1)}. Products and commutators are computed on the bit pairs
 * and drop the phase, which is all the classifier needs.
 */
public final class PauliString implements Comparable<PauliString> {
  private static final char[] LABELS = {'I', 'Z', 'X', 'Y'};

  private final int length;
  private final BitSet x;
  private final BitSet z;

  private PauliString(int length, BitSet x, BitSet z) {
    this.length = length;
    this.x = x;
    this.z = z;
  }

  public static PauliString identity(int length) {
    if (length < 0) {
      throw new IllegalArgumentException("length must be non-negative");
    }
    return new PauliString(length, new BitSet(length), new BitSet(length));
  }

  /** Identity of the given length carrying {@code label} at {@code position}. */
  public static PauliString single(int length, int position, char label) {
    if (position < 0 || position >= length) {
      throw new IllegalArgumentException(
          "position " + position + " out of range for length " + length);
    }
    BitSet x = new BitSet(length);
    BitSet z = new BitSet(length);
    setLabel(x, z, position, label);
    return new PauliString(length, x, z);
  }

  public static PauliString parse(String text) {
    Objects.requireNonNull(text, "text");
    BitSet x = new BitSet();
    BitSet z = new BitSet();
    int position = 0;
    for (int i = 0; i < text.length(); i++) {
      char ch = text.charAt(i);
      if (Character.isWhitespace(ch)) {
        continue;
      }
      setLabel(x, z, position++, ch);
    }
    return new PauliString(position, x, z);
  }

  /** Builds a string from explicit bit vectors; bits at or beyond {@code length} are ignored. */
  public static PauliString fromBits(int length, BitSet x, BitSet z) {
    Objects.requireNonNull(x, "x");
    Objects.requireNonNull(z, "z");
    BitSet xs = x.get(0, length);
    BitSet zs = z.get(0, length);
    return new PauliString(length, xs, zs);
  }

  private static void setLabel(BitSet x, BitSet z, int position, char label) {
    switch (Character.toUpperCase(label)) {
      case 'I' -> {
        x.clear(position);
        z.clear(position);
      }
      case 'X' -> {
        x.set(position);
        z.clear(position);
      }
      case 'Y' -> {
        x.set(position);
        z.set(position);
      }
      case 'Z' -> {
        x.clear(position);
        z.set(position);
      }
      default -> throw new PauliParseException("Unknown Pauli label '" + label + "'");
    }
  }

  public int length() {
    return length;
  }

  public BitSet xBits() {
    return (BitSet) x.clone();
  }

  public BitSet zBits() {
    return (BitSet) z.clone();
  }

  /** Label at {@code position}: one of {@code I, X, Y, Z}. */
  public char labelAt(int position) {
    if (position < 0 || position >= length) {
      throw new IndexOutOfBoundsException(position);
    }
    return LABELS[code(position)];
  }

  private int code(int position) {
    return (x.get(position) ? 2 : 0) | (z.get(position) ? 1 : 0);
  }

  public boolean isIdentity() {
    return x.isEmpty() && z.isEmpty();
  }

  /** Number of qubits acted on non-trivially. */
  public int weight() {
    BitSet support = (BitSet) x.clone();
    support.or(z);
    return support.cardinality();
  }

  /** Symplectic commutation test. */
  public boolean commutesWith(PauliString other) {
    requireSameLength(other);
    BitSet left = (BitSet) x.clone();
    left.and(other.z);
    BitSet right = (BitSet) other.x.clone();
    right.and(z);
    return (left.cardinality() & 1) == (right.cardinality() & 1);
  }

  public boolean anticommutesWith(PauliString other) {
    return !commutesWith(other);
  }

  /** Phase-free product {@code this · other}. */
  public PauliString multiply(PauliString other) {
    requireSameLength(other);
    BitSet xs = (BitSet) x.clone();
    xs.xor(other.x);
    BitSet zs = (BitSet) z.clone();
    zs.xor(other.z);
    return new PauliString(length, xs, zs);
  }

  /**
   * Phase-free representative of {@code [this, other]}, or {@code null} when the two strings
   * commute.
   */
  public PauliString adjointMap(PauliString other) {
    if (commutesWith(other)) {
      return null;
    }
    return multiply(other);
  }

  /** Tensor product {@code this ⊗ other}. */
  public PauliString tensor(PauliString other) {
    Objects.requireNonNull(other, "other");
    BitSet xs = (BitSet) x.clone();
    BitSet zs = (BitSet) z.clone();
    for (int i = other.x.nextSetBit(0); i >= 0; i = other.x.nextSetBit(i + 1)) {
      xs.set(length + i);
    }
    for (int i = other.z.nextSetBit(0); i >= 0; i = other.z.nextSetBit(i + 1)) {
      zs.set(length + i);
    }
    return new PauliString(length + other.length, xs, zs);
  }

  /** Pads the string with identities on the right up to {@code newLength}. */
  public PauliString expand(int newLength) {
    if (newLength < length) {
      throw new IllegalArgumentException(
          "Cannot shrink a Pauli string of length " + length + " to " + newLength);
    }
    if (newLength == length) {
      return this;
    }
    return tensor(identity(newLength - length));
  }

  private void requireSameLength(PauliString other) {
    Objects.requireNonNull(other, "other");
    if (other.length != length) {
      throw new InputMismatchException(length, other.length);
    }
  }

  /**
   * Orders by the interleaved bit sequence {@code x0 z0 x1 z1 ...}, which puts {@code I < Z < X <
   * Y} on every qubit. A proper prefix sorts first.
   */
  @Override
  public int compareTo(PauliString other) {
    int shared = Math.min(length, other.length);
    for (int i = 0; i < shared; i++) {
      int cmp = Integer.compare(code(i), other.code(i));
      if (cmp != 0) {
        return cmp;
      }
    }
    return Integer.compare(length, other.length);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PauliString other)) {
      return false;
    }
    return length == other.length && x.equals(other.x) && z.equals(other.z);
  }

  @Override
  public int hashCode() {
    return Objects.hash(length, x, z);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      sb.append(LABELS[code(i)]);
    }
    return sb.toString();
  }
}
