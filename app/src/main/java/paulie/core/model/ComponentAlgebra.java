package paulie.core.model;

import java.util.Objects;
import paulie.core.PaulieException;

/**
 * Algebra generated by one connected component: {@code copies} identical copies of a classical
 * algebra of the given family and degree.
 */
public record ComponentAlgebra(Family family, long degree, long copies) {

  /** Classical families; {@link #U} only occurs as {@code u(1)}. */
  public enum Family {
    U("u"),
    SO("so"),
    SU("su"),
    SP("sp");

    private final String label;

    Family(String label) {
      this.label = label;
    }

    public String label() {
      return label;
    }
  }

  public ComponentAlgebra {
    Objects.requireNonNull(family, "family");
    if (degree < 1) {
      throw new IllegalArgumentException("degree must be positive");
    }
    if (copies < 0) {
      throw new IllegalArgumentException("copies must be non-negative");
    }
  }

  public static ComponentAlgebra none() {
    return new ComponentAlgebra(Family.U, 1, 0);
  }

  public static ComponentAlgebra u1() {
    return new ComponentAlgebra(Family.U, 1, 1);
  }

  /** Dimension of a single copy. */
  public long summandDimension() {
    try {
      return switch (family) {
        case U -> 1;
        case SO -> Math.multiplyExact(degree, degree - 1) / 2;
        case SP -> Math.multiplyExact(degree, degree + 1) / 2;
        case SU -> Math.multiplyExact(degree, degree) - 1;
      };
    } catch (ArithmeticException e) {
      throw new PaulieException("Dimension of " + summand() + " exceeds the range of long", e);
    }
  }

  public long dimension() {
    try {
      return Math.multiplyExact(copies, summandDimension());
    } catch (ArithmeticException e) {
      throw new PaulieException("Dimension of " + name() + " exceeds the range of long", e);
    }
  }

  /** Name of a single copy, e.g. {@code su(8)}. */
  public String summand() {
    return family.label() + "(" + degree + ")";
  }

  /** {@code so(6)}, {@code 4*sp(8)}, or {@code 0} when there are no copies. */
  public String name() {
    if (copies == 0) {
      return "0";
    }
    return copies == 1 ? summand() : copies + "*" + summand();
  }

  @Override
  public String toString() {
    return name();
  }
}
