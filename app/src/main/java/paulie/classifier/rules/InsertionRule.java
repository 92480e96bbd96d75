package paulie.classifier.rules;

import paulie.classifier.InsertionContext;
import paulie.classifier.RuleOutcome;

/**
 * One step of the insertion pipeline. A rule either settles the candidate (appended, dependent or
 * not connected) or proceeds with a rewritten lighting for the next rule.
 */
public interface InsertionRule {
  String name();

  RuleOutcome apply(InsertionContext context);
}
