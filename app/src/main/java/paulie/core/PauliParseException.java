package paulie.core;

/** Raised for text that does not describe a Pauli string. */
public final class PauliParseException extends PaulieException {
  private static final long serialVersionUID = 1L;

  public PauliParseException(String message) {
    super(message);
  }
}
