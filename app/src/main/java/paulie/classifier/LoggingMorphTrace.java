package paulie.classifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import paulie.core.model.PauliString;

/** Writes every step of a canonicalization run to the debug log. */
public final class LoggingMorphTrace implements MorphTrace {
  private static final Logger LOG = LoggerFactory.getLogger(LoggingMorphTrace.class);

  @Override
  public void onRule(String rule, PauliString lighting) {
    LOG.debug("{} <- {}", rule, lighting);
  }

  @Override
  public void onOutcome(PauliString vertex, RuleOutcome outcome, LegStructure structure) {
    if (LOG.isDebugEnabled()) {
      LOG.debug("{} {}: {}", vertex, outcome.kind(), structure);
    }
  }

  @Override
  public void onDelayed(PauliString vertex) {
    LOG.debug("delayed {}", vertex);
  }
}
