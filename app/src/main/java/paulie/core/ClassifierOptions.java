package paulie.core;

/**
 * Configuration for classifying a generator collection.
 *
 * @param retryCap how often a single vertex may be requeued as not connected before the component
 *     is rejected; {@code 0} means "use the component size"
 * @param seed seed for the randomized tie-breaks of the generator search
 * @param parallel classify connected components concurrently
 */
public record ClassifierOptions(int retryCap, long seed, boolean parallel) {

  public ClassifierOptions {
    if (retryCap < 0) {
      throw new IllegalArgumentException("retryCap must be non-negative");
    }
  }

  public static ClassifierOptions defaults() {
    return new ClassifierOptions(0, 0L, false);
  }

  public static ClassifierOptions normalize(ClassifierOptions options) {
    return options == null ? defaults() : options;
  }

  /** Retry cap that applies to a component of the given size. */
  public int retryCapFor(int componentSize) {
    return retryCap > 0 ? retryCap : Math.max(1, componentSize);
  }

  public ClassifierOptions withRetryCap(int retryCap) {
    return new ClassifierOptions(retryCap, seed, parallel);
  }

  public ClassifierOptions withSeed(long seed) {
    return new ClassifierOptions(retryCap, seed, parallel);
  }

  public ClassifierOptions withParallel(boolean parallel) {
    return new ClassifierOptions(retryCap, seed, parallel);
  }
}
