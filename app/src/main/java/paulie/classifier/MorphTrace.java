package paulie.classifier;

import paulie.core.model.PauliString;

/** Observer of a canonicalization run; every callback defaults to doing nothing. */
public interface MorphTrace {
  MorphTrace NOOP = new MorphTrace() {};

  default void onRule(String rule, PauliString lighting) {}

  default void onOutcome(PauliString vertex, RuleOutcome outcome, LegStructure structure) {}

  default void onDelayed(PauliString vertex) {}
}
