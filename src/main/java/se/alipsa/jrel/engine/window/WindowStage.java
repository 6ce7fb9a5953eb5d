package se.alipsa.jrel.engine.window;

import java.util.List;
import se.alipsa.jrel.engine.EvaluationContext;
import se.alipsa.jrel.engine.Expression;
import se.alipsa.jrel.engine.Scope;
import se.alipsa.jrel.model.Table;

/**
 * A window computation. It receives all rows of the stage at once and appends
 * one column, named {@link #name()}, without changing the number or order of
 * rows. Later stages reference the column with
 * {@code Expressions.window(name)}.
 */
public interface WindowStage {

  /**
   * Name of the appended column.
   *
   * @return the column name
   */
  String name();

  /**
   * Expressions the window evaluates per row. Aggregate calls among them are
   * computed by the grouping stage.
   *
   * @return partition and ordering expressions
   */
  List<Expression> expressions();

  /**
   * Compute the window column.
   *
   * @param input
   *          rows after grouping and HAVING
   * @param scope
   *          layout of {@code input}
   * @param ctx
   *          the evaluation context
   * @return {@code input} with one more column
   */
  Table apply(Table input, Scope scope, EvaluationContext ctx);
}
