package se.alipsa.jrel.engine;

import java.util.Objects;

/**
 * One join applied to the rows accumulated so far in a FROM clause.
 *
 * @param kind
 *          the join kind
 * @param right
 *          the producer on the right side
 * @param condition
 *          the match condition
 * @param lateral
 *          whether the right producer may reference left columns
 * @param comma
 *          whether the join was written as a comma
 */
public record JoinStep(JoinKind kind, RowProducer right, JoinCondition condition, boolean lateral,
    boolean comma) {

  /**
   * Validates the step.
   */
  public JoinStep {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(right, "right");
    condition = condition == null ? JoinCondition.NONE : condition;
    if (comma && kind != JoinKind.CROSS) {
      throw new IllegalArgumentException("A comma join is always a cross join");
    }
  }

  public static JoinStep comma(RowProducer right) {
    return new JoinStep(JoinKind.CROSS, right, JoinCondition.NONE, false, true);
  }

  public static JoinStep cross(RowProducer right) {
    return new JoinStep(JoinKind.CROSS, right, JoinCondition.NONE, false, false);
  }

  public static JoinStep inner(RowProducer right, JoinCondition condition) {
    return new JoinStep(JoinKind.INNER, right, condition, false, false);
  }

  public static JoinStep left(RowProducer right, JoinCondition condition) {
    return new JoinStep(JoinKind.LEFT, right, condition, false, false);
  }

  public static JoinStep right(RowProducer right, JoinCondition condition) {
    return new JoinStep(JoinKind.RIGHT, right, condition, false, false);
  }

  public static JoinStep full(RowProducer right, JoinCondition condition) {
    return new JoinStep(JoinKind.FULL, right, condition, false, false);
  }

  /**
   * Join of any kind.
   *
   * @param kind
   *          the join kind
   * @param right
   *          the right producer
   * @param condition
   *          the match condition
   * @return the step
   */
  public static JoinStep of(JoinKind kind, RowProducer right, JoinCondition condition) {
    return new JoinStep(kind, right, condition, false, false);
  }

  /**
   * Copy marked {@code LATERAL}.
   *
   * @return the lateral step
   */
  public JoinStep asLateral() {
    return new JoinStep(kind, right, condition, true, comma);
  }

  /**
   * Whether the right producer depends on the left row.
   *
   * @return {@code true} for LATERAL steps and correlated producers
   */
  public boolean isCorrelated() {
    return lateral || right.isCorrelated();
  }
}
