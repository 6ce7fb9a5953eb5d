package se.alipsa.jrel.engine;

import se.alipsa.jrel.model.Table;

/**
 * Source of rows in a FROM clause. A correlated producer reads the enclosing
 * row from {@link EvaluationContext#outer()} and is evaluated once per left row
 * of the join that consumes it.
 */
@FunctionalInterface
public interface RowProducer {

  /**
   * Produce the rows.
   *
   * @param ctx
   *          the evaluation context, carrying the left row for correlated
   *          producers
   * @return the rows; the schema is meaningful even when there are none
   */
  Table produce(EvaluationContext ctx);

  /**
   * Whether the producer references columns of the rows to its left.
   *
   * @return {@code true} when the output depends on the enclosing row
   */
  default boolean isCorrelated() {
    return false;
  }
}
