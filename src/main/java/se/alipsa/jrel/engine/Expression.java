package se.alipsa.jrel.engine;

import java.util.List;
import se.alipsa.jrel.value.Value;

/**
 * A resolved scalar expression. Implementations are immutable and compare by
 * structure, so that a grouping key in the select list can be matched against
 * the same expression in GROUP BY.
 *
 * <p>
 * Composite expressions evaluate their operands through
 * {@link Expressions#evaluate(Expression, Bindings, EvaluationContext)} so
 * that values precomputed by grouping are picked up.
 * </p>
 */
public interface Expression {

  /**
   * Evaluate against a bound row.
   *
   * @param bindings
   *          the row and its enclosing rows
   * @param ctx
   *          the evaluation context
   * @return the value, never {@code null}
   */
  Value evaluate(Bindings bindings, EvaluationContext ctx);

  /**
   * Direct operands, used to inspect the expression tree.
   *
   * @return the operands
   */
  default List<Expression> children() {
    return List.of();
  }
}
