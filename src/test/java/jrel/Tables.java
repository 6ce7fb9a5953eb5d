package jrel;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import se.alipsa.jrel.engine.TableScan;
import se.alipsa.jrel.model.Column;
import se.alipsa.jrel.model.Row;
import se.alipsa.jrel.model.Schema;
import se.alipsa.jrel.model.Table;
import se.alipsa.jrel.value.SqlType;
import se.alipsa.jrel.value.Value;

/**
 * Small fixtures for building input tables and reading results back as plain
 * Java objects.
 */
public final class Tables {

  private Tables() {
  }

  /**
   * Build a table from column names and rows of Java values. Column types are
   * taken from the first non-null value in each column.
   *
   * @param names
   *          comma separated column names
   * @param rows
   *          the rows
   * @return the table
   */
  public static Table table(String names, Object[]... rows) {
    String[] columnNames = names.split("\\s*,\\s*");
    List<Row> converted = new ArrayList<>();
    SqlType[] types = new SqlType[columnNames.length];
    for (Object[] row : rows) {
      if (row.length != columnNames.length) {
        throw new IllegalArgumentException("Row " + Arrays.toString(row) + " does not match " + names);
      }
      List<Value> values = new ArrayList<>();
      for (int i = 0; i < row.length; i++) {
        Value value = value(row[i]);
        if (types[i] == null && !value.isNull()) {
          types[i] = SqlType.typeOf(value);
        }
        values.add(value);
      }
      converted.add(new Row(values));
    }
    List<Column> columns = new ArrayList<>();
    for (int i = 0; i < columnNames.length; i++) {
      columns.add(Column.of(columnNames[i], types[i] == null ? SqlType.INT64 : types[i]));
    }
    return new Table(new Schema(columns), converted);
  }

  /**
   * Single INT64 column table.
   *
   * @param name
   *          the column name
   * @param values
   *          the values, {@code null} for NULL
   * @return the table
   */
  public static Table ints(String name, Long... values) {
    Object[][] rows = new Object[values.length][];
    for (int i = 0; i < values.length; i++) {
      rows[i] = new Object[] {values[i]};
    }
    return table(name, rows);
  }

  public static TableScan scan(Table table, String alias) {
    return new TableScan(table, alias);
  }

  public static Object[] row(Object... values) {
    return values;
  }

  /**
   * Convert a Java object to a value.
   *
   * @param o
   *          the object
   * @return the value
   */
  public static Value value(Object o) {
    if (o == null) {
      return Value.NULL;
    }
    if (o instanceof Value v) {
      return v;
    }
    if (o instanceof Integer i) {
      return Value.of(i.longValue());
    }
    if (o instanceof Long l) {
      return Value.of(l);
    }
    if (o instanceof Double d) {
      return Value.of(d);
    }
    if (o instanceof BigDecimal bd) {
      return Value.of(bd);
    }
    if (o instanceof Boolean b) {
      return Value.of(b);
    }
    if (o instanceof String s) {
      return Value.of(s);
    }
    throw new IllegalArgumentException("Unsupported fixture value " + o.getClass());
  }

  /**
   * Convert a scalar value back to a Java object.
   *
   * @param value
   *          the value
   * @return Long, Double, BigDecimal, Boolean, String or {@code null}; other
   *         values are returned as they are
   */
  public static Object java(Value value) {
    if (value.isNull()) {
      return null;
    }
    if (value instanceof Value.Int64 v) {
      return v.value();
    }
    if (value instanceof Value.Float64 v) {
      return v.value();
    }
    if (value instanceof Value.Numeric v) {
      return v.value();
    }
    if (value instanceof Value.Bool v) {
      return v.value();
    }
    if (value instanceof Value.Str v) {
      return v.value();
    }
    return value;
  }

  /**
   * Rows of a table as lists of Java objects.
   *
   * @param table
   *          the table
   * @return the rows
   */
  public static List<List<Object>> rows(Table table) {
    List<List<Object>> result = new ArrayList<>();
    for (Row row : table.rows()) {
      List<Object> values = new ArrayList<>();
      for (Value value : row.values()) {
        values.add(java(value));
      }
      result.add(values);
    }
    return result;
  }

  /**
   * Values of one column.
   *
   * @param table
   *          the table
   * @param column
   *          the column reference
   * @return the values
   */
  public static List<Object> column(Table table, String column) {
    int idx = table.schema().resolve(column);
    List<Object> result = new ArrayList<>();
    for (Row row : table.rows()) {
      result.add(java(row.get(idx)));
    }
    return result;
  }
}
