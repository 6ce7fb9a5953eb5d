package se.alipsa.jrel.model;

import java.util.List;
import java.util.Objects;
import se.alipsa.jrel.value.Value;

/**
 * A schema plus a sequence of rows. Row order carries meaning only after an
 * ORDER BY.
 *
 * @param schema
 *          the column layout
 * @param rows
 *          the rows, each as wide as the schema
 */
public record Table(Schema schema, List<Row> rows) {

  /**
   * Validates the table.
   */
  public Table {
    Objects.requireNonNull(schema, "schema");
    rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
    for (Row row : rows) {
      if (row.size() != schema.size()) {
        throw new IllegalArgumentException(
            "Row width " + row.size() + " does not match schema width " + schema.size() + ": " + row);
      }
    }
  }

  /**
   * An empty table with the supplied layout.
   *
   * @param schema
   *          the column layout
   * @return the table
   */
  public static Table empty(Schema schema) {
    return new Table(schema, List.of());
  }

  public int size() {
    return rows.size();
  }

  /**
   * Value of a column in a row, looked up by name.
   *
   * @param rowIndex
   *          the row position
   * @param column
   *          the column reference
   * @return the value
   */
  public Value value(int rowIndex, String column) {
    return rows.get(rowIndex).get(schema.resolve(column));
  }
}
