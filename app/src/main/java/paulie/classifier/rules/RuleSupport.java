package paulie.classifier.rules;

import java.util.ArrayList;
import java.util.List;
import paulie.classifier.InsertionContext;
import paulie.classifier.LegStructure;
import paulie.classifier.Lighting;
import paulie.classifier.RuleOutcome;
import paulie.core.model.PauliString;

/** Lit queries and the append moves shared by several rules. */
final class RuleSupport {
  /** Longest long leg kept after an insertion; the tail beyond it is re-inserted later. */
  static final int MAX_LONG_LEG = 4;

  private RuleSupport() {}

  /** Vertices among {@code vertices} that anticommute with {@code lighting}, in order. */
  static List<PauliString> lits(PauliString lighting, List<PauliString> vertices) {
    List<PauliString> lits = new ArrayList<>();
    for (PauliString vertex : vertices) {
      if (vertex.anticommutesWith(lighting)) {
        lits.add(vertex);
      }
    }
    return lits;
  }

  static List<Integer> litIndexes(PauliString lighting, List<PauliString> vertices) {
    List<Integer> indexes = new ArrayList<>();
    for (int i = 0; i < vertices.size(); i++) {
      if (vertices.get(i).anticommutesWith(lighting)) {
        indexes.add(i);
      }
    }
    return indexes;
  }

  /** Grows a structure that has a center and at most one leg. */
  static RuleOutcome appendToTwoCenter(InsertionContext context, PauliString lighting) {
    LegStructure structure = context.structure();
    PauliString center = structure.center();
    if (structure.legCount() == 1) {
      structure.append(lighting, center);
      return RuleOutcome.appended();
    }
    List<PauliString> lits = lits(lighting, structure.vertices());
    Lighting light = new Lighting(structure, lighting);
    if (lits.size() == 1) {
      if (lits.get(0).equals(center)) {
        structure.append(lighting, center);
        return RuleOutcome.appended();
      }
      if (!light.through(lits.get(0), center)) {
        return RuleOutcome.dependent();
      }
      structure.append(light.value(), center);
      return RuleOutcome.appended();
    }
    if (lits.size() == 2) {
      if (!light.through(center)) {
        return RuleOutcome.dependent();
      }
      structure.append(light.value(), center);
      return RuleOutcome.appended();
    }
    return RuleOutcome.notConnected();
  }

  /**
   * Whether hanging {@code lighting} off the center would duplicate what a single-vertex leg
   * already generates.
   */
  static boolean isDependentOnOneLegs(LegStructure structure, PauliString lighting) {
    List<PauliString> vertices = structure.vertices();
    for (PauliString one : structure.oneLegVertices()) {
      PauliString pq = one.multiply(lighting);
      for (PauliString vertex : vertices) {
        if (vertex.equals(one)) {
          continue;
        }
        PauliString image = pq.multiply(vertex);
        if (image.equals(lighting) || structure.contains(image)) {
          return true;
        }
      }
    }
    return false;
  }

  static RuleOutcome appendToCenter(InsertionContext context, PauliString lighting) {
    LegStructure structure = context.structure();
    if (isDependentOnOneLegs(structure, lighting)) {
      return RuleOutcome.dependent();
    }
    structure.append(lighting, structure.center());
    return RuleOutcome.appended();
  }

  /** Cuts the long leg back to {@link #MAX_LONG_LEG} vertices, delaying the cut tail. */
  static void truncateLongLeg(InsertionContext context) {
    LegStructure structure = context.structure();
    List<PauliString> longLeg = structure.longLeg();
    if (longLeg.size() <= MAX_LONG_LEG) {
      return;
    }
    for (int i = MAX_LONG_LEG; i < longLeg.size(); i++) {
      context.delay(longLeg.get(i));
    }
    structure.remove(longLeg.get(MAX_LONG_LEG));
  }
}
