package paulie.classifier;

import com.google.common.base.Stopwatch;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import paulie.core.ClassifierOptions;
import paulie.core.model.Morph;
import paulie.core.model.PauliString;

/**
 * Classifies connected components, one {@link MorphFactory} build each. Components are
 * independent, so they may run on the common fork-join pool; the result keeps the input order
 * either way.
 */
public final class Classifier {
  private static final Logger LOG = LoggerFactory.getLogger(Classifier.class);

  private final ClassifierOptions options;
  private final MorphFactory factory;

  public Classifier() {
    this(ClassifierOptions.defaults());
  }

  public Classifier(ClassifierOptions options) {
    this(options, MorphTrace.NOOP);
  }

  public Classifier(ClassifierOptions options, MorphTrace trace) {
    this.options = ClassifierOptions.normalize(options);
    this.factory = new MorphFactory(this.options, trace);
  }

  public ClassifierOptions options() {
    return options;
  }

  public MorphFactory factory() {
    return factory;
  }

  public Morph classify(List<PauliString> component) {
    return factory.build(component);
  }

  /** Classifies every component; the i-th morph of the result belongs to the i-th component. */
  public Classification classifyAll(List<List<PauliString>> components) {
    Objects.requireNonNull(components, "components");
    Stopwatch stopwatch = Stopwatch.createStarted();
    Morph[] morphs = new Morph[components.size()];
    IntStream indexes = IntStream.range(0, components.size());
    if (options.parallel()) {
      indexes = indexes.parallel();
    }
    indexes.forEach(i -> morphs[i] = factory.build(components.get(i)));
    LOG.debug(
        "Classified {} components in {} ms (parallel={})",
        morphs.length,
        stopwatch.elapsed(TimeUnit.MILLISECONDS),
        options.parallel());
    return new Classification(Arrays.asList(morphs));
  }
}
