package paulie.classifier;

import java.util.Objects;
import paulie.core.model.PauliString;

/**
 * Result of running one insertion rule against the current lighting. Only {@link Kind#PROCEED}
 * carries a lighting: the transformed string the next rule starts from.
 */
public record RuleOutcome(Kind kind, PauliString lighting) {

  public enum Kind {
    APPENDED,
    DEPENDENT,
    NOT_CONNECTED,
    PROCEED
  }

  private static final RuleOutcome APPENDED = new RuleOutcome(Kind.APPENDED, null);
  private static final RuleOutcome DEPENDENT = new RuleOutcome(Kind.DEPENDENT, null);
  private static final RuleOutcome NOT_CONNECTED = new RuleOutcome(Kind.NOT_CONNECTED, null);

  public RuleOutcome {
    Objects.requireNonNull(kind, "kind");
    if (kind == Kind.PROCEED && lighting == null) {
      throw new IllegalArgumentException("A proceeding outcome needs a lighting");
    }
  }

  public static RuleOutcome appended() {
    return APPENDED;
  }

  public static RuleOutcome dependent() {
    return DEPENDENT;
  }

  public static RuleOutcome notConnected() {
    return NOT_CONNECTED;
  }

  public static RuleOutcome proceed(PauliString lighting) {
    return new RuleOutcome(Kind.PROCEED, lighting);
  }

  public boolean isTerminal() {
    return kind != Kind.PROCEED;
  }
}
