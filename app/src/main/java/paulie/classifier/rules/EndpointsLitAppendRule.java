package paulie.classifier.rules;

import java.util.List;
import paulie.classifier.InsertionContext;
import paulie.classifier.LegStructure;
import paulie.classifier.Lighting;
import paulie.classifier.RuleOutcome;
import paulie.core.model.PauliString;

/** Last rule: first and last long-leg vertices lit. Always settles the candidate. */
public final class EndpointsLitAppendRule implements InsertionRule {

  @Override
  public String name() {
    return "endpoints-lit append";
  }

  @Override
  public RuleOutcome apply(InsertionContext context) {
    LegStructure structure = context.structure();
    PauliString center = structure.center();
    List<PauliString> longLeg = structure.longLeg();
    Lighting light = context.light();
    for (int i = longLeg.size() - 1; i > 0; i--) {
      if (!light.through(longLeg.get(i))) {
        return RuleOutcome.dependent();
      }
    }
    if (!light.through(center, structure.omega(), longLeg.get(0), center)) {
      return RuleOutcome.dependent();
    }
    return RuleSupport.appendToCenter(context, light.value());
  }
}
