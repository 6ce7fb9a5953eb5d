package se.alipsa.jrel.engine;

import se.alipsa.jrel.model.Table;

/**
 * A resolved query: a {@link SelectQuery}, a {@link SetOperationQuery} or a
 * {@link WithQuery}. Plans are immutable and can be evaluated any number of
 * times.
 */
public interface QueryPlan {

  /**
   * Evaluate the query.
   *
   * @param ctx
   *          the evaluation context
   * @return the result rows
   */
  Table evaluate(EvaluationContext ctx);
}
