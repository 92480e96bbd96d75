package paulie.classifier;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import paulie.classifier.RuleOutcome.Kind;
import paulie.classifier.rules.CenterLightingRule;
import paulie.classifier.rules.EndpointsLitAppendRule;
import paulie.classifier.rules.FastPathRule;
import paulie.classifier.rules.FirstLitAppendRule;
import paulie.classifier.rules.InsertionRule;
import paulie.classifier.rules.LastLitAppendRule;
import paulie.classifier.rules.LongLegLightingRule;
import paulie.classifier.rules.LongLegReductionRule;
import paulie.classifier.rules.OneLegReconciliationRule;
import paulie.classifier.rules.ThreeVertexBootstrapRule;
import paulie.core.ClassifierOptions;
import paulie.core.StructuralViolationException;
import paulie.core.model.Morph;
import paulie.core.model.PauliString;

/**
 * Folds the generators of one connected component into its canonical caterpillar.
 *
 * <p>Each build owns its own leg structure and work queue, so a single factory may serve several
 * threads as long as its {@link MorphTrace} is thread-safe.
 */
public final class MorphFactory {
  private static final Logger LOG = LoggerFactory.getLogger(MorphFactory.class);

  private static final List<InsertionRule> PIPELINE =
      List.of(
          new ThreeVertexBootstrapRule(),
          new OneLegReconciliationRule(),
          new FastPathRule(),
          new LongLegLightingRule(),
          new CenterLightingRule(),
          new LongLegReductionRule(),
          new FirstLitAppendRule(),
          new LastLitAppendRule(),
          new EndpointsLitAppendRule());

  private final ClassifierOptions options;
  private final MorphTrace trace;
  private final List<InsertionRule> rules;
  private final QueueBuilder queueBuilder = new QueueBuilder();

  public MorphFactory() {
    this(ClassifierOptions.defaults(), MorphTrace.NOOP);
  }

  public MorphFactory(ClassifierOptions options, MorphTrace trace) {
    this(options, trace, PIPELINE);
  }

  MorphFactory(ClassifierOptions options, MorphTrace trace, List<InsertionRule> rules) {
    this.options = ClassifierOptions.normalize(options);
    this.trace = (trace == null) ? MorphTrace.NOOP : trace;
    this.rules = List.copyOf(rules);
  }

  /**
   * Builds the canonical structure of a connected set of generators.
   *
   * @throws StructuralViolationException if the generators are not connected or a vertex cannot
   *     be placed within the retry cap
   */
  public Morph build(List<PauliString> generators) {
    Objects.requireNonNull(generators, "generators");
    if (generators.isEmpty()) {
      return Morph.empty();
    }
    WorkQueue queue = new WorkQueue(queueBuilder.order(generators));
    LegStructure structure = new LegStructure();
    List<PauliString> dependents = new ArrayList<>();
    Map<PauliString, Integer> retries = new HashMap<>();
    int retryCap = options.retryCapFor(generators.size());

    while (queue.hasNext()) {
      PauliString vertex = queue.poll();
      RuleOutcome outcome = insert(structure, queue, vertex);
      queue.restoreDelayed();
      switch (outcome.kind()) {
        case APPENDED -> retries.remove(vertex);
        case DEPENDENT -> dependents.add(vertex);
        case NOT_CONNECTED -> {
          int attempts = retries.merge(vertex, 1, Integer::sum);
          if (attempts > retryCap) {
            throw new StructuralViolationException(
                "Vertex " + vertex + " stayed unconnected after " + retryCap + " retries");
          }
          queue.requeue(vertex);
        }
        default -> throw new IllegalStateException("Unexpected outcome " + outcome.kind());
      }
    }

    Morph morph = structure.toMorph(dependents);
    LOG.debug(
        "Built {} from {} generators ({} dependent)",
        morph.shape().signature(),
        generators.size(),
        dependents.size());
    return morph;
  }

  /** Whether {@code morph} already generates every one of {@code candidates}. */
  public boolean isEq(Morph morph, List<PauliString> candidates) {
    Objects.requireNonNull(morph, "morph");
    Objects.requireNonNull(candidates, "candidates");
    for (PauliString candidate : candidates) {
      if (!generates(morph, candidate)) {
        return false;
      }
    }
    return true;
  }

  /** The candidates that {@code morph} already generates, in input order. */
  public List<PauliString> selectDependents(Morph morph, List<PauliString> candidates) {
    Objects.requireNonNull(morph, "morph");
    Objects.requireNonNull(candidates, "candidates");
    List<PauliString> dependents = new ArrayList<>();
    for (PauliString candidate : candidates) {
      if (generates(morph, candidate)) {
        dependents.add(candidate);
      }
    }
    return dependents;
  }

  /**
   * Whether {@code morph} generates {@code candidate}. A dependent verdict of the rules is final;
   * the rules can miss a dependency on a finished morph, so any other verdict is settled by the
   * exact span test.
   */
  public boolean generates(Morph morph, PauliString candidate) {
    if (tryInsert(morph, candidate).kind() == Kind.DEPENDENT) {
      return true;
    }
    return MorphSpan.contains(morph, candidate);
  }

  /**
   * Runs a single candidate through the rules against a scratch copy of {@code morph}. The verdict
   * is the one the rules reach; use {@link #generates} for an exact answer.
   */
  public RuleOutcome tryInsert(Morph morph, PauliString candidate) {
    Objects.requireNonNull(candidate, "candidate");
    LegStructure scratch = LegStructure.fromMorph(morph);
    try {
      return insert(scratch, new WorkQueue(List.of()), candidate);
    } catch (StructuralViolationException e) {
      LOG.debug("Candidate {} could not be placed on {}: {}", candidate, morph, e.getMessage());
      return RuleOutcome.notConnected();
    }
  }

  private RuleOutcome insert(LegStructure structure, WorkQueue queue, PauliString vertex) {
    InsertionContext context = new InsertionContext(structure, queue, vertex, trace);
    for (InsertionRule rule : rules) {
      trace.onRule(rule.name(), context.lighting());
      RuleOutcome outcome = rule.apply(context);
      if (outcome.isTerminal()) {
        trace.onOutcome(vertex, outcome, structure);
        return outcome;
      }
      context.advance(outcome.lighting());
    }
    throw new StructuralViolationException("No insertion rule settled " + vertex);
  }
}
