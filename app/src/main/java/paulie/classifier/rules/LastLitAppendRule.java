package paulie.classifier.rules;

import java.util.List;
import paulie.classifier.InsertionContext;
import paulie.classifier.LegStructure;
import paulie.classifier.Lighting;
import paulie.classifier.RuleOutcome;
import paulie.core.model.PauliString;

/**
 * Terminal case where the long leg has a single lit vertex, its tail. The candidate becomes a new
 * leg carrying the old tail, and the vertex before the tail is rewritten to stay consistent.
 */
public final class LastLitAppendRule implements InsertionRule {

  @Override
  public String name() {
    return "last-lit append";
  }

  @Override
  public RuleOutcome apply(InsertionContext context) {
    LegStructure structure = context.structure();
    PauliString center = structure.center();
    Lighting light = context.light();
    List<PauliString> longLeg = structure.longLeg();
    if (RuleSupport.lits(light.value(), longLeg).size() != 1) {
      return RuleOutcome.proceed(light.value());
    }
    if (RuleSupport.isDependentOnOneLegs(structure, light.value())) {
      return RuleOutcome.dependent();
    }

    PauliString tail = longLeg.get(longLeg.size() - 1);
    if (longLeg.size() == 1) {
      if (!light.through(tail)) {
        return RuleOutcome.dependent();
      }
      structure.append(light.value(), tail);
      return RuleOutcome.appended();
    }

    PauliString lighting = light.value();
    PauliString beforeTail = longLeg.get(longLeg.size() - 2);
    PauliString rewritten = structure.omega().multiply(lighting).multiply(beforeTail);
    if (structure.contains(rewritten)) {
      return RuleOutcome.dependent();
    }
    structure.remove(tail);
    structure.append(lighting, center);
    structure.replace(beforeTail, rewritten);
    structure.append(tail, lighting);
    RuleSupport.truncateLongLeg(context);
    return RuleOutcome.appended();
  }
}
