package macrogate;

import java.util.Locale;
import java.util.Properties;
import macrogate.reconstruct.AdjacencyPolicy;

/**
 * Configuration of one analysis.
 *
 * <p>{@code minRepetitions} is the threshold r, {@code maxWindowSize} the largest window w. Windows
 * from {@code minWindowSize} to w are scanned; {@code parallelism > 1} scans window sizes
 * concurrently.
 */
public record AnalysisOptions(
    int minRepetitions,
    int minWindowSize,
    int maxWindowSize,
    int parallelism,
    AdjacencyPolicy adjacencyPolicy) {

  public static final String PROPERTY_PREFIX = "macrogate.";
  public static final String MIN_REPETITIONS = PROPERTY_PREFIX + "minRepetitions";
  public static final String MIN_WINDOW_SIZE = PROPERTY_PREFIX + "minWindowSize";
  public static final String MAX_WINDOW_SIZE = PROPERTY_PREFIX + "maxWindowSize";
  public static final String PARALLELISM = PROPERTY_PREFIX + "parallelism";
  public static final String ADJACENCY_POLICY = PROPERTY_PREFIX + "adjacencyPolicy";

  public static AnalysisOptions defaults() {
    return new AnalysisOptions(2, 1, 8, 1, AdjacencyPolicy.SAME_QUBIT_PAIR);
  }

  /** Defaults with the given repetition threshold and maximum window size. */
  public static AnalysisOptions of(int minRepetitions, int maxWindowSize) {
    return defaults().withMinRepetitions(minRepetitions).withMaxWindowSize(maxWindowSize);
  }

  /** Defaults overlaid with the {@code macrogate.*} JVM system properties. */
  public static AnalysisOptions fromSystemProperties() {
    return fromProperties(System.getProperties());
  }

  public static AnalysisOptions fromProperties(Properties properties) {
    AnalysisOptions defaults = defaults();
    return new AnalysisOptions(
        intProperty(properties, MIN_REPETITIONS, defaults.minRepetitions()),
        intProperty(properties, MIN_WINDOW_SIZE, defaults.minWindowSize()),
        intProperty(properties, MAX_WINDOW_SIZE, defaults.maxWindowSize()),
        intProperty(properties, PARALLELISM, defaults.parallelism()),
        policyProperty(properties, defaults.adjacencyPolicy()));
  }

  /**
   * Rejects settings the engine cannot run with.
   *
   * @throws IllegalArgumentException naming the first invalid setting
   */
  public AnalysisOptions validate() {
    if (minRepetitions < 2) {
      throw new IllegalArgumentException(
          "minRepetitions must be at least 2, got " + minRepetitions);
    }
    if (maxWindowSize < 1) {
      throw new IllegalArgumentException("maxWindowSize must be at least 1, got " + maxWindowSize);
    }
    if (minWindowSize < 1 || minWindowSize > maxWindowSize) {
      throw new IllegalArgumentException(
          "minWindowSize must be within 1.." + maxWindowSize + ", got " + minWindowSize);
    }
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
    }
    if (adjacencyPolicy == null) {
      throw new IllegalArgumentException("adjacencyPolicy must be set");
    }
    return this;
  }

  public AnalysisOptions withMinRepetitions(int value) {
    return new AnalysisOptions(value, minWindowSize, maxWindowSize, parallelism, adjacencyPolicy);
  }

  public AnalysisOptions withMinWindowSize(int value) {
    return new AnalysisOptions(minRepetitions, value, maxWindowSize, parallelism, adjacencyPolicy);
  }

  public AnalysisOptions withMaxWindowSize(int value) {
    return new AnalysisOptions(minRepetitions, minWindowSize, value, parallelism, adjacencyPolicy);
  }

  public AnalysisOptions withParallelism(int value) {
    return new AnalysisOptions(
        minRepetitions, minWindowSize, maxWindowSize, value, adjacencyPolicy);
  }

  public AnalysisOptions withAdjacencyPolicy(AdjacencyPolicy value) {
    return new AnalysisOptions(minRepetitions, minWindowSize, maxWindowSize, parallelism, value);
  }

  private static int intProperty(Properties properties, String key, int fallback) {
    String raw = properties.getProperty(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Property " + key + " is not an integer: " + raw, ex);
    }
  }

  private static AdjacencyPolicy policyProperty(Properties properties, AdjacencyPolicy fallback) {
    String raw = properties.getProperty(ADJACENCY_POLICY);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    try {
      return AdjacencyPolicy.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "Property " + ADJACENCY_POLICY + " is not an adjacency policy: " + raw, ex);
    }
  }
}
