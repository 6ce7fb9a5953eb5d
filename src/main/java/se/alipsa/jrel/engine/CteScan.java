package se.alipsa.jrel.engine;

import java.util.Objects;
import se.alipsa.jrel.model.Table;

/**
 * Reference to a common table expression, resolved against the tables
 * materialised in the {@link EvaluationContext}. Inside a recursive CTE the
 * self reference reads the previous iteration's working set.
 *
 * @param name
 *          the CTE name
 * @param alias
 *          column qualifier, defaults to the CTE name
 */
public record CteScan(String name, String alias) implements RowProducer {

  /**
   * Validates the reference.
   */
  public CteScan {
    Objects.requireNonNull(name, "name");
    alias = alias == null ? name : alias;
  }

  /**
   * Reference a CTE under its own name.
   *
   * @param name
   *          the CTE name
   * @return the scan
   */
  public static CteScan of(String name) {
    return new CteScan(name, null);
  }

  @Override
  public Table produce(EvaluationContext ctx) {
    Table table = ctx.cte(name);
    return new Table(table.schema().withQualifier(alias), table.rows());
  }
}
