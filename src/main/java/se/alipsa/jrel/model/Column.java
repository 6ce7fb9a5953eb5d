package se.alipsa.jrel.model;

import java.util.Objects;
import se.alipsa.jrel.value.SqlType;

/**
 * A column of a {@link Schema}.
 *
 * @param name
 *          the column name
 * @param type
 *          the column type
 * @param nullable
 *          whether the column may hold NULL
 * @param qualifier
 *          the table alias the column is reachable through, may be
 *          {@code null}
 */
public record Column(String name, SqlType type, boolean nullable, String qualifier) {

  /**
   * Validates the column.
   */
  public Column {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }

  /**
   * Create a nullable, unqualified column.
   *
   * @param name
   *          the column name
   * @param type
   *          the column type
   * @return the column
   */
  public static Column of(String name, SqlType type) {
    return new Column(name, type, true, null);
  }

  /**
   * Copy this column under another qualifier.
   *
   * @param alias
   *          the new qualifier, may be {@code null}
   * @return the requalified column
   */
  public Column withQualifier(String alias) {
    return new Column(name, type, nullable, alias);
  }

  /**
   * Copy this column with a different type.
   *
   * @param newType
   *          the new type
   * @return the retyped column
   */
  public Column withType(SqlType newType) {
    return new Column(name, newType, nullable, qualifier);
  }

  /**
   * Copy this column as nullable, used for the padded side of an outer join.
   *
   * @return the nullable column
   */
  public Column asNullable() {
    return nullable ? this : new Column(name, type, true, qualifier);
  }

  /**
   * Whether this column answers to the (optionally qualified) reference.
   *
   * @param refQualifier
   *          the qualifier of the reference, may be {@code null}
   * @param refName
   *          the column name of the reference
   * @return {@code true} on a case-insensitive match
   */
  public boolean matches(String refQualifier, String refName) {
    if (!name.equalsIgnoreCase(refName)) {
      return false;
    }
    return refQualifier == null || (qualifier != null && qualifier.equalsIgnoreCase(refQualifier));
  }

  @Override
  public String toString() {
    return (qualifier == null ? "" : qualifier + ".") + name + " " + type;
  }
}
