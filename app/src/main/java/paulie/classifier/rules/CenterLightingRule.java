package paulie.classifier.rules;

import java.util.List;
import paulie.classifier.InsertionContext;
import paulie.classifier.LegStructure;
import paulie.classifier.Lighting;
import paulie.classifier.RuleOutcome;
import paulie.core.model.PauliString;

/** Walks a dark-center lighting down the long leg until the center is lit. */
public final class CenterLightingRule implements InsertionRule {

  @Override
  public String name() {
    return "center lighting";
  }

  @Override
  public RuleOutcome apply(InsertionContext context) {
    LegStructure structure = context.structure();
    Lighting light = context.light();
    if (light.lights(structure.center())) {
      return RuleOutcome.proceed(light.value());
    }
    List<PauliString> longLeg = structure.longLeg();
    List<Integer> litIndexes = RuleSupport.litIndexes(light.value(), longLeg);
    if (litIndexes.isEmpty()) {
      return RuleOutcome.notConnected();
    }
    for (int i = litIndexes.get(0); i >= 0; i--) {
      if (!light.through(longLeg.get(i))) {
        return RuleOutcome.dependent();
      }
    }
    return RuleOutcome.proceed(light.value());
  }
}
