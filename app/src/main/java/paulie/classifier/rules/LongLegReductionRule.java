package paulie.classifier.rules;

import java.util.List;
import paulie.classifier.InsertionContext;
import paulie.classifier.LegStructure;
import paulie.classifier.Lighting;
import paulie.classifier.RuleOutcome;
import paulie.core.StructuralViolationException;
import paulie.core.model.PauliString;

/**
 * Reduces the lit positions on the long leg to one of the terminal patterns: only the first
 * vertex, only the last vertex, or exactly the first and the last. A single lit vertex in the
 * middle cuts the leg right after it and defers the cut tail.
 */
public final class LongLegReductionRule implements InsertionRule {

  @Override
  public String name() {
    return "long-leg reduction";
  }

  @Override
  public RuleOutcome apply(InsertionContext context) {
    LegStructure structure = context.structure();
    List<PauliString> longLeg = structure.longLeg();
    int last = longLeg.size() - 1;
    int guard = (structure.vertexCount() + 1) * (structure.vertexCount() + 1);
    Lighting light = context.light();

    for (int iteration = 0; ; iteration++) {
      if (iteration > guard) {
        throw new StructuralViolationException(
            "Long-leg reduction of " + context.vertex() + " did not converge on " + structure);
      }
      List<Integer> lit = RuleSupport.litIndexes(light.value(), longLeg);
      if (lit.isEmpty()) {
        return RuleSupport.appendToCenter(context, light.value());
      }
      if (lit.size() == 2 && lit.get(0) == 0 && lit.get(1) == last) {
        break;
      }
      if (lit.size() == 1) {
        int index = lit.get(0);
        if (index > 0 && index < last) {
          for (int i = index + 1; i <= last; i++) {
            context.delay(longLeg.get(i));
          }
          structure.remove(longLeg.get(index + 1));
        }
        break;
      }
      int first = lit.get(0);
      int second = lit.get(1);
      boolean shifted;
      if (first > 0 && first + 1 != second) {
        shifted = true;
        for (int i = second; i > first && shifted; i--) {
          shifted = light.through(longLeg.get(i));
        }
      } else {
        shifted = light.through(longLeg.get(second));
      }
      if (!shifted) {
        return RuleOutcome.dependent();
      }
    }
    return RuleOutcome.proceed(light.value());
  }
}
