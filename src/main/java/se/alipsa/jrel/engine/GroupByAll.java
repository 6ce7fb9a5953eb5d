package se.alipsa.jrel.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import se.alipsa.jrel.model.Schema;

/**
 * Key inference for {@code GROUP BY ALL}.
 *
 * <p>
 * A select item becomes a grouping key when it contains no aggregate or window
 * reference and references at least one column of the FROM clause. An item is
 * skipped when a key already inferred is the same input column or field path
 * as the item or a prefix of it, so {@code SELECT s, s.x} groups by {@code s}
 * only. Paths start at the resolved column, so {@code a.x} and {@code b.x} are
 * different keys.
 * Without any inferred key the block groups by {@code ()}.
 * </p>
 */
final class GroupByAll {

  private GroupByAll() {
  }

  /**
   * Infer the grouping items.
   *
   * @param select
   *          the select list with stars already expanded
   * @param input
   *          schema of the FROM clause
   * @return the inferred items, a single empty tuple when none qualifies
   */
  static List<GroupingElement> infer(List<SelectItem> select, Schema input) {
    List<GroupingElement> keys = new ArrayList<>();
    List<List<String>> paths = new ArrayList<>();
    for (SelectItem item : select) {
      Expression expression = item.expression();
      if (Expressions.containsAggregate(expression) || Expressions.containsWindow(expression)
          || !referencesInput(expression, input)) {
        continue;
      }
      List<String> path = path(expression, input);
      if (path != null && coveredBy(path, paths)) {
        continue;
      }
      if (path != null) {
        paths.add(path);
      }
      keys.add(GroupingElement.of(expression));
    }
    if (keys.isEmpty()) {
      keys.add(GroupingElement.tuple());
    }
    return keys;
  }

  private static boolean referencesInput(Expression expression, Schema input) {
    for (Expressions.ColumnRef ref : Expressions.columnRefs(expression)) {
      if (input.indexOf(ref.qualifier(), ref.name()) >= 0) {
        return true;
      }
    }
    return false;
  }

  /**
   * Path of a column or nested field reference: the position of the input
   * column followed by the lower-cased field names, e.g. {@code [2, s, x]}.
   */
  private static List<String> path(Expression expression, Schema input) {
    if (expression instanceof Expressions.ColumnRef ref) {
      int idx = input.indexOf(ref.qualifier(), ref.name());
      if (idx < 0) {
        return null;
      }
      List<String> path = new ArrayList<>();
      path.add(Integer.toString(idx));
      return path;
    }
    if (expression instanceof Expressions.FieldAccess access) {
      List<String> path = path(access.base(), input);
      if (path != null) {
        path.add(access.field().toLowerCase(Locale.ROOT));
      }
      return path;
    }
    return null;
  }

  private static boolean coveredBy(List<String> path, List<List<String>> keys) {
    for (List<String> key : keys) {
      if (key.size() <= path.size() && path.subList(0, key.size()).equals(key)) {
        return true;
      }
    }
    return false;
  }
}
