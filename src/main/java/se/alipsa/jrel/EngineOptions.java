package se.alipsa.jrel;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jrel.value.Collation;

/**
 * Immutable engine settings.
 *
 * <p>
 * {@link #load()} layers three sources, later ones winning: built-in defaults,
 * the classpath resource {@code /jrel.properties} and JVM system properties
 * with the same keys. Values read from those sources that cannot be parsed are
 * logged and replaced by the default; values passed to the {@link Builder} are
 * rejected with {@link ErrorKind#INVALID_ARGUMENT}.
 * </p>
 */
public final class EngineOptions {

  private static final Logger log = LoggerFactory.getLogger(EngineOptions.class);

  public static final String MAX_ITERATIONS_KEY = "jrel.recursion.maxIterations";
  public static final String DEFAULT_COLLATION_KEY = "jrel.collation.default";
  public static final String MEMOIZE_CORRELATED_KEY = "jrel.join.memoizeCorrelated";

  public static final int DEFAULT_MAX_ITERATIONS = 500;

  private static final String RESOURCE = "/jrel.properties";

  private final int maxRecursionIterations;
  private final String defaultCollation;
  private final boolean memoizeCorrelated;

  private EngineOptions(Builder builder) {
    this.maxRecursionIterations = builder.maxRecursionIterations;
    this.defaultCollation = builder.defaultCollation;
    this.memoizeCorrelated = builder.memoizeCorrelated;
  }

  /**
   * Built-in defaults only.
   *
   * @return the default options
   */
  public static EngineOptions defaults() {
    return builder().build();
  }

  /**
   * Create a builder initialised with the built-in defaults.
   *
   * @return a fresh {@link Builder}
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Defaults overlaid with {@code /jrel.properties} and then system properties.
   *
   * @return the resolved options
   */
  public static EngineOptions load() {
    Properties merged = new Properties();
    try (InputStream in = EngineOptions.class.getResourceAsStream(RESOURCE)) {
      if (in != null) {
        merged.load(in);
      }
    } catch (IOException e) {
      log.warn("Failed to read {}, using defaults: {}", RESOURCE, e.toString());
    }
    for (String key : new String[] {
        MAX_ITERATIONS_KEY, DEFAULT_COLLATION_KEY, MEMOIZE_CORRELATED_KEY
    }) {
      String value = System.getProperty(key);
      if (value != null) {
        merged.setProperty(key, value);
      }
    }
    return fromProperties(merged);
  }

  /**
   * Read options from an explicit property map. Missing or unparsable entries
   * fall back to the defaults.
   *
   * @param props
   *          the properties
   * @return the options
   */
  public static EngineOptions fromProperties(Properties props) {
    Builder builder = builder();
    String iterations = props.getProperty(MAX_ITERATIONS_KEY);
    if (iterations != null && !iterations.isBlank()) {
      try {
        builder.maxRecursionIterations(Integer.parseInt(iterations.trim()));
      } catch (NumberFormatException | EvaluationException e) {
        log.warn("Ignoring {}={}: {}", MAX_ITERATIONS_KEY, iterations, e.getMessage());
      }
    }
    String collation = props.getProperty(DEFAULT_COLLATION_KEY);
    if (collation != null) {
      try {
        builder.defaultCollation(collation);
      } catch (EvaluationException e) {
        log.warn("Ignoring {}={}: {}", DEFAULT_COLLATION_KEY, collation, e.getMessage());
      }
    }
    String memoize = props.getProperty(MEMOIZE_CORRELATED_KEY);
    if (memoize != null && !memoize.isBlank()) {
      String normalized = memoize.trim();
      if ("true".equalsIgnoreCase(normalized) || "false".equalsIgnoreCase(normalized)) {
        builder.memoizeCorrelated(Boolean.parseBoolean(normalized));
      } else {
        log.warn("Ignoring {}={}: expected true or false", MEMOIZE_CORRELATED_KEY, memoize);
      }
    }
    return builder.build();
  }

  /**
   * Upper bound on recursive term evaluations that still produce rows.
   *
   * @return the iteration cap
   */
  public int maxRecursionIterations() {
    return maxRecursionIterations;
  }

  /**
   * Collation applied when no string operand carries one.
   *
   * @return the specification, empty for binary
   */
  public String defaultCollation() {
    return defaultCollation;
  }

  /**
   * Whether correlated join inputs are cached per distinct outer row.
   *
   * @return {@code true} when memoisation is enabled
   */
  public boolean memoizeCorrelated() {
    return memoizeCorrelated;
  }

  @Override
  public String toString() {
    return "EngineOptions{maxRecursionIterations=" + maxRecursionIterations + ", defaultCollation='"
        + defaultCollation + "', memoizeCorrelated=" + memoizeCorrelated + "}";
  }

  /** Builder for {@link EngineOptions}. */
  public static final class Builder {

    private int maxRecursionIterations = DEFAULT_MAX_ITERATIONS;
    private String defaultCollation = "";
    private boolean memoizeCorrelated = true;

    private Builder() {
      // use EngineOptions.builder()
    }

    /**
     * Set the recursion iteration cap.
     *
     * @param maxRecursionIterations
     *          a positive cap
     * @return {@code this} for chaining
     */
    public Builder maxRecursionIterations(int maxRecursionIterations) {
      if (maxRecursionIterations <= 0) {
        throw new EvaluationException(ErrorKind.INVALID_ARGUMENT, null,
            MAX_ITERATIONS_KEY + " must be positive but was " + maxRecursionIterations);
      }
      this.maxRecursionIterations = maxRecursionIterations;
      return this;
    }

    /**
     * Set the default collation.
     *
     * @param defaultCollation
     *          a collation specification such as {@code und:ci}, blank for
     *          binary
     * @return {@code this} for chaining
     */
    public Builder defaultCollation(String defaultCollation) {
      String spec = defaultCollation == null ? "" : defaultCollation.trim();
      Collation.parse(spec);
      this.defaultCollation = spec;
      return this;
    }

    /**
     * Enable or disable caching of correlated join inputs.
     *
     * @param memoizeCorrelated
     *          whether to cache
     * @return {@code this} for chaining
     */
    public Builder memoizeCorrelated(boolean memoizeCorrelated) {
      this.memoizeCorrelated = memoizeCorrelated;
      return this;
    }

    /**
     * Create the options.
     *
     * @return the immutable options
     */
    public EngineOptions build() {
      return new EngineOptions(this);
    }
  }
}
