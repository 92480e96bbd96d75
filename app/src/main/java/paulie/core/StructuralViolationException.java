package paulie.core;

/**
 * Raised when the canonical leg structure is asked to do something its contract forbids, or when
 * a component cannot be folded into a structure at all (for example a vertex that stays
 * unconnected after exhausting its retries).
 */
public final class StructuralViolationException extends PaulieException {
  private static final long serialVersionUID = 1L;

  public StructuralViolationException(String message) {
    super(message);
  }
}
