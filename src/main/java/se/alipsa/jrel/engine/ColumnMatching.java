package se.alipsa.jrel.engine;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * How the columns of the two inputs of a set operation are paired.
 *
 * @param mode
 *          positional or one of the by-name modes
 * @param on
 *          for by-name modes, the output columns in output order; empty to
 *          derive them from the mode
 */
public record ColumnMatching(Mode mode, List<String> on) {

  /** Column pairing modes. */
  public enum Mode {
    /** Pair columns by position; the inputs must have the same width. */
    POSITIONAL,
    /** {@code BY NAME} / {@code STRICT CORRESPONDING}: identical name sets. */
    STRICT,
    /** {@code INNER BY NAME} / {@code CORRESPONDING}: the common names. */
    INNER,
    /** {@code FULL BY NAME}: all names, left columns first. */
    FULL,
    /** {@code LEFT BY NAME}: the names of the left input. */
    LEFT
  }

  /** Positional matching. */
  public static final ColumnMatching POSITIONAL = new ColumnMatching(Mode.POSITIONAL, List.of());

  /**
   * Validates the matching.
   */
  public ColumnMatching {
    Objects.requireNonNull(mode, "mode");
    on = List.copyOf(on);
    if (mode == Mode.POSITIONAL && !on.isEmpty()) {
      throw new IllegalArgumentException("An ON column list requires matching by name");
    }
  }

  public static ColumnMatching byName() {
    return new ColumnMatching(Mode.STRICT, List.of());
  }

  public static ColumnMatching byName(Mode mode) {
    return new ColumnMatching(mode, List.of());
  }

  /**
   * Matching by name restricted to the listed columns.
   *
   * @param mode
   *          the by-name mode
   * @param columns
   *          the output columns in output order
   * @return the matching
   */
  public static ColumnMatching byName(Mode mode, String... columns) {
    return new ColumnMatching(mode, Arrays.asList(columns));
  }

  public boolean isPositional() {
    return mode == Mode.POSITIONAL;
  }
}
