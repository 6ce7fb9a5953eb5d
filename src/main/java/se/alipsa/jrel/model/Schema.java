package se.alipsa.jrel.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;

/**
 * Ordered list of columns. Names need not be unique; lookups that hit more than
 * one column are reported as ambiguous.
 */
public final class Schema {

  /** Schema without columns, the shape of a FROM-less SELECT. */
  public static final Schema EMPTY = new Schema(List.of());

  private final List<Column> columns;

  /**
   * Create a schema.
   *
   * @param columns
   *          the ordered columns
   */
  public Schema(List<Column> columns) {
    this.columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
  }

  /**
   * Create a schema from columns.
   *
   * @param columns
   *          the ordered columns
   * @return the schema
   */
  public static Schema of(Column... columns) {
    return new Schema(List.of(columns));
  }

  public List<Column> columns() {
    return columns;
  }

  public int size() {
    return columns.size();
  }

  /**
   * Column at a position.
   *
   * @param index
   *          zero based position
   * @return the column
   */
  public Column column(int index) {
    return columns.get(index);
  }

  /**
   * Column names in order.
   *
   * @return the names
   */
  public List<String> names() {
    return columns.stream().map(Column::name).collect(Collectors.toUnmodifiableList());
  }

  /**
   * Find a column by reference, {@code name} or {@code qualifier.name}.
   *
   * @param reference
   *          the reference
   * @return the position or {@code -1} when absent
   * @throws EvaluationException
   *           ({@link ErrorKind#INVALID_PLAN}) when the reference is ambiguous
   */
  public int indexOf(String reference) {
    String qualifier = null;
    String name = reference;
    int dot = reference.lastIndexOf('.');
    if (dot > 0) {
      qualifier = reference.substring(0, dot);
      name = reference.substring(dot + 1);
    }
    return indexOf(qualifier, name);
  }

  /**
   * Find a column by qualifier and name.
   *
   * @param qualifier
   *          table alias, may be {@code null}
   * @param name
   *          column name
   * @return the position or {@code -1} when absent
   * @throws EvaluationException
   *           ({@link ErrorKind#INVALID_PLAN}) when the reference is ambiguous
   */
  public int indexOf(String qualifier, String name) {
    int found = -1;
    for (int i = 0; i < columns.size(); i++) {
      if (columns.get(i).matches(qualifier, name)) {
        if (found >= 0) {
          throw new EvaluationException(ErrorKind.INVALID_PLAN, null,
              "Ambiguous column reference '" + (qualifier == null ? name : qualifier + "." + name) + "'");
        }
        found = i;
      }
    }
    return found;
  }

  /**
   * Resolve a column reference that must exist.
   *
   * @param reference
   *          {@code name} or {@code qualifier.name}
   * @return the position
   * @throws EvaluationException
   *           ({@link ErrorKind#INVALID_PLAN}) when absent or ambiguous
   */
  public int resolve(String reference) {
    int idx = indexOf(reference);
    if (idx < 0) {
      throw new EvaluationException(ErrorKind.INVALID_PLAN, null,
          "Unknown column '" + reference + "'; available: " + names());
    }
    return idx;
  }

  /**
   * Concatenate two schemas, left columns first.
   *
   * @param other
   *          the right schema
   * @return the combined schema
   */
  public Schema concat(Schema other) {
    List<Column> combined = new ArrayList<>(columns.size() + other.columns.size());
    combined.addAll(columns);
    combined.addAll(other.columns);
    return new Schema(combined);
  }

  /**
   * Requalify every column with a table alias.
   *
   * @param alias
   *          the alias, {@code null} keeps the existing qualifiers
   * @return the requalified schema
   */
  public Schema withQualifier(String alias) {
    if (alias == null) {
      return this;
    }
    List<Column> requalified = new ArrayList<>(columns.size());
    for (Column column : columns) {
      requalified.add(column.withQualifier(alias));
    }
    return new Schema(requalified);
  }

  /**
   * Mark every column nullable.
   *
   * @return the nullable schema
   */
  public Schema asNullable() {
    List<Column> nullable = new ArrayList<>(columns.size());
    for (Column column : columns) {
      nullable.add(column.asNullable());
    }
    return new Schema(nullable);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Schema other && columns.equals(other.columns);
  }

  @Override
  public int hashCode() {
    return columns.hashCode();
  }

  @Override
  public String toString() {
    return columns.isEmpty() ? "()" : columns.toString();
  }
}
