package se.alipsa.jrel.engine;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import se.alipsa.jrel.model.Table;

/**
 * {@code WITH [RECURSIVE] name AS (...), ... body}. Every binding is
 * materialised once and shared by all references in later bindings and in the
 * body.
 *
 * @param recursive
 *          whether bindings may reference themselves and later bindings
 * @param bindings
 *          the named queries in declaration order
 * @param body
 *          the main query
 */
public record WithQuery(boolean recursive, List<CteBinding> bindings, QueryPlan body) implements QueryPlan {

  /**
   * Validates the query.
   */
  public WithQuery {
    bindings = List.copyOf(bindings);
    Objects.requireNonNull(body, "body");
    RecursiveCteEvaluator.evaluationOrder(recursive, bindings);
  }

  public static WithQuery with(QueryPlan body, CteBinding... bindings) {
    return new WithQuery(false, Arrays.asList(bindings), body);
  }

  public static WithQuery withRecursive(QueryPlan body, CteBinding... bindings) {
    return new WithQuery(true, Arrays.asList(bindings), body);
  }

  @Override
  public Table evaluate(EvaluationContext ctx) {
    return RecursiveCteEvaluator.evaluate(this, ctx);
  }
}
