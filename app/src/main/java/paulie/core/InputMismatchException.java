package paulie.core;

/** Raised when two Pauli strings of different length meet in a binary operation. */
public final class InputMismatchException extends PaulieException {
  private static final long serialVersionUID = 1L;

  public InputMismatchException(int leftLength, int rightLength) {
    super("Pauli strings must have equal length: " + leftLength + " != " + rightLength);
  }
}
