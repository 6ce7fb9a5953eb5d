package se.alipsa.jrel.engine;

import java.util.Objects;
import se.alipsa.jrel.model.Table;

/**
 * A base relation supplied by the caller.
 *
 * @param table
 *          the rows
 * @param alias
 *          qualifier given to every column, may be {@code null}
 */
public record TableScan(Table table, String alias) implements RowProducer {

  /**
   * Validates the scan.
   */
  public TableScan {
    Objects.requireNonNull(table, "table");
  }

  @Override
  public Table produce(EvaluationContext ctx) {
    return alias == null ? table : new Table(table.schema().withQualifier(alias), table.rows());
  }
}
