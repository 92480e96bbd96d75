package paulie.core;

/** Base type for failures raised by the classifier. */
public class PaulieException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public PaulieException(String message) {
    super(message);
  }

  public PaulieException(String message, Throwable cause) {
    super(message, cause);
  }
}
