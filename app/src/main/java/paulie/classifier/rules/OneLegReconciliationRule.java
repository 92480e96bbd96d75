package paulie.classifier.rules;

import java.util.List;
import paulie.classifier.InsertionContext;
import paulie.classifier.LegStructure;
import paulie.classifier.RuleOutcome;
import paulie.core.model.PauliString;

/**
 * Handles a candidate that lights some single-vertex legs but not others. With {@code p} lit and
 * {@code q} dark, every other lit vertex {@code v} is replaced by {@code p·q·v}, which leaves only
 * {@code p} lit, and the candidate is hung off {@code p}.
 */
public final class OneLegReconciliationRule implements InsertionRule {

  @Override
  public String name() {
    return "one-leg reconciliation";
  }

  @Override
  public RuleOutcome apply(InsertionContext context) {
    LegStructure structure = context.structure();
    PauliString lighting = context.lighting();

    PauliString p = null;
    PauliString q = null;
    for (PauliString one : structure.oneLegVertices()) {
      if (one.anticommutesWith(lighting)) {
        p = one;
      } else {
        q = one;
      }
      if (p != null && q != null) {
        break;
      }
    }
    if (p == null || q == null) {
      return RuleOutcome.proceed(lighting);
    }

    PauliString pq = p.multiply(q);
    List<PauliString> lits = RuleSupport.lits(lighting, structure.vertices());
    for (PauliString lit : lits) {
      if (!lit.equals(p) && structure.contains(pq.multiply(lit))) {
        return RuleOutcome.dependent();
      }
    }
    for (PauliString lit : lits) {
      if (!lit.equals(p)) {
        structure.replace(lit, pq.multiply(lit));
      }
    }
    structure.append(lighting, p);
    RuleSupport.truncateLongLeg(context);
    return RuleOutcome.appended();
  }
}
