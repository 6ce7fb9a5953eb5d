package se.alipsa.jrel.engine;

import java.util.List;
import java.util.Objects;
import se.alipsa.jrel.model.Table;

/**
 * {@code left <op> [ALL | DISTINCT] [matching] right [ORDER BY ...] [LIMIT ...]}.
 * Chains of three or more inputs are nested left-deep, which combines them
 * strictly left to right.
 *
 * @param left
 *          the left input
 * @param operator
 *          the set operator
 * @param quantifier
 *          ALL or DISTINCT
 * @param matching
 *          how the columns are paired
 * @param right
 *          the right input
 * @param orderBy
 *          ordering over the combined columns, may be empty
 * @param limit
 *          maximum number of rows, {@code null} for no limit
 * @param offset
 *          rows to skip
 */
public record SetOperationQuery(QueryPlan left, SetOperator operator, SetQuantifier quantifier,
    ColumnMatching matching, QueryPlan right, List<SortKey> orderBy, Long limit, long offset)
    implements QueryPlan {

  /**
   * Validates the query.
   */
  public SetOperationQuery {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(quantifier, "quantifier");
    Objects.requireNonNull(right, "right");
    matching = matching == null ? ColumnMatching.POSITIONAL : matching;
    orderBy = List.copyOf(orderBy);
    if (limit != null && limit < 0 || offset < 0) {
      throw new IllegalArgumentException("LIMIT and OFFSET must not be negative");
    }
  }

  public static SetOperationQuery of(QueryPlan left, SetOperator operator, SetQuantifier quantifier,
      QueryPlan right) {
    return new SetOperationQuery(left, operator, quantifier, ColumnMatching.POSITIONAL, right, List.of(), null, 0);
  }

  public static SetOperationQuery of(QueryPlan left, SetOperator operator, SetQuantifier quantifier,
      ColumnMatching matching, QueryPlan right) {
    return new SetOperationQuery(left, operator, quantifier, matching, right, List.of(), null, 0);
  }

  /**
   * Copy with ORDER BY and LIMIT/OFFSET.
   *
   * @param keys
   *          the ordering
   * @param rowLimit
   *          maximum rows or {@code null}
   * @param rowOffset
   *          rows to skip
   * @return the query
   */
  public SetOperationQuery orderedBy(List<SortKey> keys, Long rowLimit, long rowOffset) {
    return new SetOperationQuery(left, operator, quantifier, matching, right, keys, rowLimit, rowOffset);
  }

  @Override
  public Table evaluate(EvaluationContext ctx) {
    Table leftTable = QueryEvaluator.evaluate(left, ctx);
    Table rightTable = QueryEvaluator.evaluate(right, ctx);
    ctx.checkCancelled(operator.name());
    Table combined = SetOperationCombinator.combine(leftTable, rightTable, operator, quantifier, matching, ctx);
    return QueryEvaluator.orderAndLimit(combined, Scope.of(combined.schema()), orderBy, limit, offset, ctx);
  }

  @Override
  public String toString() {
    return "(" + left + ") " + operator + " " + quantifier
        + (matching.isPositional() ? "" : " " + matching.mode() + " BY NAME" + (matching.on().isEmpty() ? ""
            : " ON " + matching.on()))
        + " (" + right + ")";
  }
}
