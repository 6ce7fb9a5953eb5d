package se.alipsa.jrel.model;

import java.util.ArrayList;
import java.util.List;
import se.alipsa.jrel.value.CollationContext;
import se.alipsa.jrel.value.Value;
import se.alipsa.jrel.value.ValueComparator;

/**
 * Hashable identity of a row, or of a subset of its values, under grouping
 * equivalence: NULLs are equal to each other, {@code NaN}s are equal to each
 * other, numbers compare by value across types and strings by collation.
 */
public final class RowKey {

  private final List<Object> parts;

  private RowKey(List<Object> parts) {
    this.parts = parts;
  }

  /**
   * Key over every value of a row.
   *
   * @param row
   *          the row
   * @param collations
   *          collation context for strings
   * @return the key
   */
  public static RowKey of(Row row, CollationContext collations) {
    return of(row.values(), collations);
  }

  /**
   * Key over a list of values.
   *
   * @param values
   *          the values
   * @param collations
   *          collation context for strings
   * @return the key
   */
  public static RowKey of(List<Value> values, CollationContext collations) {
    List<Object> parts = new ArrayList<>(values.size());
    for (Value value : values) {
      parts.add(ValueComparator.groupingKey(value, collations));
    }
    return new RowKey(parts);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof RowKey other && parts.equals(other.parts);
  }

  @Override
  public int hashCode() {
    return parts.hashCode();
  }

  @Override
  public String toString() {
    return parts.toString();
  }
}
