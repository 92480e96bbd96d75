package paulie.classifier.rules;

import paulie.classifier.InsertionContext;
import paulie.classifier.LegStructure;
import paulie.classifier.RuleOutcome;
import paulie.core.model.PauliString;

/**
 * Grows an empty structure up to a center with two legs, and rejects candidates that are already
 * placed.
 */
public final class ThreeVertexBootstrapRule implements InsertionRule {

  @Override
  public String name() {
    return "three-vertex bootstrap";
  }

  @Override
  public RuleOutcome apply(InsertionContext context) {
    LegStructure structure = context.structure();
    PauliString lighting = context.lighting();
    if (structure.isEmpty()) {
      structure.setCenter(lighting);
      return RuleOutcome.appended();
    }
    if (structure.contains(lighting)) {
      return RuleOutcome.dependent();
    }
    if (!structure.hasCore()) {
      return RuleSupport.appendToTwoCenter(context, lighting);
    }
    return RuleOutcome.proceed(lighting);
  }
}
