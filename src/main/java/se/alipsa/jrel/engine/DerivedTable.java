package se.alipsa.jrel.engine;

import java.util.Objects;
import se.alipsa.jrel.model.Table;

/**
 * A subquery in FROM. Joined with {@link JoinStep#lateral()} set it may
 * reference columns of the rows to its left.
 *
 * @param query
 *          the subquery
 * @param alias
 *          column qualifier, may be {@code null}
 */
public record DerivedTable(QueryPlan query, String alias) implements RowProducer {

  /**
   * Validates the subquery.
   */
  public DerivedTable {
    Objects.requireNonNull(query, "query");
  }

  @Override
  public Table produce(EvaluationContext ctx) {
    Table table = QueryEvaluator.evaluate(query, ctx);
    return alias == null ? table : new Table(table.schema().withQualifier(alias), table.rows());
  }
}
