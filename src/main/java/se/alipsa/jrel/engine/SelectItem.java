package se.alipsa.jrel.engine;

import java.util.Objects;

/**
 * An element of a SELECT list: either an expression with an optional alias or
 * a star, optionally qualified ({@code t.*}), that expands to the columns of
 * the FROM clause.
 *
 * @param expression
 *          the projected expression, {@code null} for a star
 * @param alias
 *          output column name, may be {@code null}
 * @param starQualifier
 *          qualifier of a qualified star, may be {@code null}
 * @param star
 *          whether this item is a star
 */
public record SelectItem(Expression expression, String alias, String starQualifier, boolean star) {

  /**
   * Validates the item.
   */
  public SelectItem {
    if (!star) {
      Objects.requireNonNull(expression, "expression");
    }
  }

  public static SelectItem of(Expression expression) {
    return new SelectItem(expression, null, null, false);
  }

  public static SelectItem as(Expression expression, String alias) {
    return new SelectItem(expression, alias, null, false);
  }

  public static SelectItem allColumns() {
    return new SelectItem(null, null, null, true);
  }

  public static SelectItem allColumns(String qualifier) {
    return new SelectItem(null, null, qualifier, true);
  }

  /**
   * Name of the output column.
   *
   * @return the alias or a label derived from the expression
   */
  public String name() {
    if (star) {
      throw new IllegalStateException("A star item has no single name");
    }
    return alias != null ? alias : Expressions.label(expression);
  }

  @Override
  public String toString() {
    if (star) {
      return starQualifier == null ? "*" : starQualifier + ".*";
    }
    return alias == null ? expression.toString() : expression + " AS " + alias;
  }
}
