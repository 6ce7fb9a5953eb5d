package se.alipsa.jrel.engine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import se.alipsa.jrel.model.Row;
import se.alipsa.jrel.value.CollationContext;
import se.alipsa.jrel.value.Value;
import se.alipsa.jrel.value.ValueComparator;

/**
 * Utility methods for ORDER BY related comparisons.
 */
public final class OrderingUtil {

  private OrderingUtil() {
  }

  /**
   * Compare two values with SQL-style null ordering semantics.
   *
   * @param left
   *          the left-hand value
   * @param right
   *          the right-hand value
   * @param key
   *          the sort key supplying direction and null placement
   * @return negative if {@code left} sorts first, zero if both or neither are
   *         NULL, positive otherwise
   */
  public static int compareNulls(Value left, Value right, SortKey key) {
    if (left.isNull() == right.isNull()) {
      return 0;
    }
    if (key.nullsFirst()) {
      return left.isNull() ? -1 : 1;
    }
    return left.isNull() ? 1 : -1;
  }

  /**
   * Compare two lists of evaluated sort key values.
   *
   * @param left
   *          key values of the first row
   * @param right
   *          key values of the second row
   * @param keys
   *          the sort keys
   * @param collations
   *          collation context for string keys
   * @return the comparison result
   */
  public static int compareKeys(List<Value> left, List<Value> right, List<SortKey> keys,
      CollationContext collations) {
    for (int i = 0; i < keys.size(); i++) {
      Value l = left.get(i);
      Value r = right.get(i);
      int cmp;
      if (l.isNull() || r.isNull()) {
        cmp = compareNulls(l, r, keys.get(i));
      } else {
        cmp = ValueComparator.orderingCompare(l, r, collations);
        if (!keys.get(i).ascending()) {
          cmp = -cmp;
        }
      }
      if (cmp != 0) {
        return cmp;
      }
    }
    return 0;
  }

  /**
   * Stable sort of rows by keys evaluated in a scope; rows with equal keys keep
   * their input order. The keys of each row are evaluated once before sorting.
   *
   * @param rows
   *          the rows to sort
   * @param scope
   *          layout the keys are evaluated against
   * @param keys
   *          the sort keys
   * @param ctx
   *          the evaluation context
   * @return the indexes of {@code rows} in sorted order
   */
  public static List<Integer> sortedOrder(List<Row> rows, Scope scope, List<SortKey> keys, EvaluationContext ctx) {
    List<List<Value>> keyValues = new ArrayList<>(rows.size());
    for (Row row : rows) {
      Bindings bindings = scope.bind(row, ctx.outer());
      List<Value> values = new ArrayList<>(keys.size());
      for (SortKey key : keys) {
        values.add(Expressions.evaluate(key.expression(), bindings, ctx));
      }
      keyValues.add(values);
    }
    List<Integer> order = new ArrayList<>(rows.size());
    for (int i = 0; i < rows.size(); i++) {
      order.add(i);
    }
    Comparator<Integer> comparator = (a, b) -> compareKeys(keyValues.get(a), keyValues.get(b), keys,
        ctx.collations());
    order.sort(comparator);
    return order;
  }
}
