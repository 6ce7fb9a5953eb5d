package se.alipsa.jrel.engine;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * How rows of a join are matched.
 */
public interface JoinCondition {

  /** No condition: every pair matches. */
  JoinCondition NONE = new None();

  /**
   * {@code ON predicate}.
   *
   * @param predicate
   *          evaluated over the concatenated left and right row
   * @return the condition
   */
  static JoinCondition on(Expression predicate) {
    return new On(predicate);
  }

  /**
   * {@code USING (columns)}.
   *
   * @param columns
   *          column names present on both sides
   * @return the condition
   */
  static JoinCondition using(String... columns) {
    return new Using(Arrays.asList(columns));
  }

  /**
   * {@code NATURAL}: USING over every column name both sides share.
   *
   * @return the condition
   */
  static JoinCondition natural() {
    return new Natural();
  }

  /** Absent condition. */
  record None() implements JoinCondition {
  }

  /**
   * Predicate condition.
   *
   * @param predicate
   *          the predicate; UNKNOWN excludes the pair
   */
  record On(Expression predicate) implements JoinCondition {
    /**
     * Validates the predicate.
     */
    public On {
      Objects.requireNonNull(predicate, "predicate");
    }
  }

  /**
   * Equality on named columns with merged output columns.
   *
   * @param columns
   *          the column names
   */
  record Using(List<String> columns) implements JoinCondition {
    /**
     * Validates the columns.
     */
    public Using {
      columns = List.copyOf(columns);
      if (columns.isEmpty()) {
        throw new IllegalArgumentException("USING requires at least one column");
      }
    }
  }

  /** Natural join. */
  record Natural() implements JoinCondition {
  }
}
