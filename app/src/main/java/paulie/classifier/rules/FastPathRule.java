package paulie.classifier.rules;

import java.util.List;
import paulie.classifier.InsertionContext;
import paulie.classifier.LegStructure;
import paulie.classifier.RuleOutcome;
import paulie.core.model.PauliString;

/**
 * Obvious attachments: when no short leg of length two exists and the candidate lights exactly
 * one vertex, which is either the center or the tail of the long leg.
 */
public final class FastPathRule implements InsertionRule {

  @Override
  public String name() {
    return "fast path";
  }

  @Override
  public RuleOutcome apply(InsertionContext context) {
    LegStructure structure = context.structure();
    PauliString lighting = context.lighting();
    if (structure.hasTwoLeg()) {
      return RuleOutcome.proceed(lighting);
    }
    List<PauliString> lits = RuleSupport.lits(lighting, structure.vertices());
    if (lits.size() != 1) {
      return RuleOutcome.proceed(lighting);
    }
    PauliString lit = lits.get(0);
    if (lit.equals(structure.center())) {
      return RuleSupport.appendToCenter(context, lighting);
    }
    List<PauliString> longLeg = structure.longLeg();
    PauliString tail = longLeg.get(longLeg.size() - 1);
    if (lit.equals(tail)) {
      structure.append(lighting, tail);
      return RuleOutcome.appended();
    }
    return RuleOutcome.proceed(lighting);
  }
}
