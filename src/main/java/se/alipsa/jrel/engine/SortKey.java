package se.alipsa.jrel.engine;

import java.util.Objects;

/**
 * An ORDER BY key.
 *
 * @param expression
 *          the key expression
 * @param ascending
 *          sort direction
 * @param nullOrdering
 *          placement of NULLs
 */
public record SortKey(Expression expression, boolean ascending, NullOrdering nullOrdering) {

  /** Placement of NULL keys. */
  public enum NullOrdering {
    /** NULLS FIRST for ascending keys, NULLS LAST for descending keys. */
    DEFAULT,
    NULLS_FIRST,
    NULLS_LAST
  }

  /**
   * Validates the key.
   */
  public SortKey {
    Objects.requireNonNull(expression, "expression");
    nullOrdering = nullOrdering == null ? NullOrdering.DEFAULT : nullOrdering;
  }

  public static SortKey asc(Expression expression) {
    return new SortKey(expression, true, NullOrdering.DEFAULT);
  }

  public static SortKey desc(Expression expression) {
    return new SortKey(expression, false, NullOrdering.DEFAULT);
  }

  /**
   * Copy with explicit NULL placement.
   *
   * @param ordering
   *          the placement
   * @return the key
   */
  public SortKey nulls(NullOrdering ordering) {
    return new SortKey(expression, ascending, ordering);
  }

  /**
   * Whether NULLs sort before non-NULL values for this key.
   *
   * @return {@code true} for NULLS FIRST
   */
  public boolean nullsFirst() {
    return switch (nullOrdering) {
      case NULLS_FIRST -> true;
      case NULLS_LAST -> false;
      case DEFAULT -> ascending;
    };
  }

  @Override
  public String toString() {
    return expression + (ascending ? " ASC" : " DESC")
        + (nullOrdering == NullOrdering.DEFAULT ? "" : " " + nullOrdering.name().replace('_', ' '));
  }
}
