package paulie.classifier.rules;

import java.util.List;
import paulie.classifier.InsertionContext;
import paulie.classifier.LegStructure;
import paulie.classifier.Lighting;
import paulie.classifier.RuleOutcome;
import paulie.core.model.PauliString;

/**
 * Terminal case where the center and the first long-leg vertex are lit. Short structures take
 * the candidate at the end of the long leg; when a two-leg blocks that, a fixed rewrap through
 * the two-leg, the reference vertex and the first four long-leg vertices clears the long leg and
 * the candidate hangs off the center.
 */
public final class FirstLitAppendRule implements InsertionRule {

  @Override
  public String name() {
    return "first-lit append";
  }

  @Override
  public RuleOutcome apply(InsertionContext context) {
    LegStructure structure = context.structure();
    PauliString omega = structure.omega();
    PauliString center = structure.center();
    Lighting light = context.light();
    boolean centerLit = light.lights(center);

    List<PauliString> longLeg = structure.longLeg();
    List<Integer> lit = RuleSupport.litIndexes(light.value(), longLeg);
    if (centerLit && lit.isEmpty()) {
      return RuleSupport.appendToCenter(context, light.value());
    }
    if (lit.size() != 1 || lit.get(0) != 0) {
      return RuleOutcome.proceed(light.value());
    }

    PauliString tail = longLeg.get(longLeg.size() - 1);
    if (!structure.hasTwoLeg() || longLeg.size() <= 3) {
      if (!light.through(longLeg.toArray(new PauliString[0]))) {
        return RuleOutcome.dependent();
      }
      structure.append(light.value(), tail);
      return RuleOutcome.appended();
    }

    List<PauliString> twoLeg = structure.twoLegs().get(0);
    PauliString v0 = twoLeg.get(0);
    PauliString v1 = twoLeg.get(1);
    PauliString l0 = longLeg.get(0);
    PauliString l1 = longLeg.get(1);
    PauliString l2 = longLeg.get(2);
    PauliString l3 = longLeg.get(3);
    boolean rewrapped =
        light.through(center, v0, omega, center, l0, v1, v0, center)
            && light.through(l1, l0, l2, l1, l3, l2, omega, center)
            && light.through(l0, l1, v0, v1, center, l0, v0, center);
    if (!rewrapped) {
      return RuleOutcome.dependent();
    }
    return RuleSupport.appendToCenter(context, light.value());
  }
}
