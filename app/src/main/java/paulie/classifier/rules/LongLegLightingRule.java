package paulie.classifier.rules;

import java.util.ArrayList;
import java.util.List;
import paulie.classifier.InsertionContext;
import paulie.classifier.LegStructure;
import paulie.classifier.Lighting;
import paulie.classifier.RuleOutcome;
import paulie.core.model.PauliString;

/**
 * Rewrites the lighting so that it no longer touches the reference vertex or any short leg of
 * length two, and so that the second vertex of the long leg ends up lit.
 */
public final class LongLegLightingRule implements InsertionRule {

  @Override
  public String name() {
    return "long-leg lighting";
  }

  @Override
  public RuleOutcome apply(InsertionContext context) {
    LegStructure structure = context.structure();
    PauliString omega = structure.omega();
    PauliString center = structure.center();
    Lighting light = context.light();

    if (light.lights(omega)) {
      if (!light.lights(center) && !light.through(omega)) {
        return RuleOutcome.dependent();
      }
      if (!light.through(center)) {
        return RuleOutcome.dependent();
      }
    }

    List<List<PauliString>> twoLegs = new ArrayList<>(structure.twoLegs());
    List<PauliString> longLeg = structure.longLeg();
    if (longLeg.size() == 2) {
      twoLegs.remove(twoLegs.size() - 1);
    } else if (longLeg.size() == 1) {
      return RuleOutcome.proceed(light.value());
    }
    if (twoLegs.isEmpty()) {
      return RuleOutcome.proceed(light.value());
    }

    if (RuleSupport.lits(light.value(), longLeg).isEmpty()
        && !moveOntoLongLeg(light, twoLegs, longLeg, center, omega)) {
      return RuleOutcome.dependent();
    }

    List<Integer> litIndexes = RuleSupport.litIndexes(light.value(), longLeg);
    if (!litIndexes.contains(1)) {
      if (litIndexes.contains(0)) {
        if (!light.through(longLeg.get(0))) {
          return RuleOutcome.dependent();
        }
      } else {
        if (litIndexes.isEmpty()) {
          return RuleOutcome.notConnected();
        }
        for (int i = litIndexes.get(0); i > 1; i--) {
          if (!light.through(longLeg.get(i))) {
            return RuleOutcome.dependent();
          }
        }
      }
    }

    PauliString longV0 = longLeg.get(0);
    PauliString longV1 = longLeg.get(1);
    for (List<PauliString> leg : twoLegs) {
      PauliString v0 = leg.get(0);
      PauliString v1 = leg.get(1);
      boolean lit0 = light.lights(v0);
      boolean lit1 = light.lights(v1);
      if (!lit0 && !lit1) {
        continue;
      }
      if (lit0 && !lit1) {
        if (!light.through(v0)) {
          return RuleOutcome.dependent();
        }
      } else if (!lit0) {
        if (!light.through(v1)) {
          return RuleOutcome.dependent();
        }
      }
      boolean moved;
      if (light.lights(center)) {
        moved = light.through(center, v1, v0, omega, center);
      } else {
        moved =
            (light.lights(longV0) || light.through(longV1))
                && light.through(longV0, center, omega, v1, v0, center);
      }
      if (!moved) {
        return RuleOutcome.dependent();
      }
    }
    return RuleOutcome.proceed(light.value());
  }

  /** Shifts a lighting that misses the long leg onto it through the center or a two-leg. */
  private static boolean moveOntoLongLeg(
      Lighting light,
      List<List<PauliString>> twoLegs,
      List<PauliString> longLeg,
      PauliString center,
      PauliString omega) {
    if (light.lights(center)) {
      return light.through(center, longLeg.get(0), omega, center);
    }
    for (List<PauliString> leg : twoLegs) {
      PauliString v0 = leg.get(0);
      PauliString v1 = leg.get(1);
      boolean lit0 = light.lights(v0);
      if (light.lights(v1) && !lit0) {
        if (!light.through(v1)) {
          return false;
        }
        lit0 = true;
      }
      if (lit0) {
        return light.through(v0, center, longLeg.get(0), omega, center);
      }
    }
    return true;
  }
}
