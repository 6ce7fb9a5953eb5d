package se.alipsa.jrel.engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One item of a GROUP BY clause. Each item denotes a list of grouping sets;
 * the items of a clause combine by cartesian product, so
 * {@code GROUP BY a, ROLLUP(b, c)} groups by {@code (a, b, c)}, {@code (a, b)}
 * and {@code (a)}.
 */
public interface GroupingElement {

  /**
   * The grouping sets this item denotes, each a list of key expressions.
   *
   * @return the sets in output order
   */
  List<List<Expression>> sets();

  static GroupingElement of(Expression expression) {
    return new Single(expression);
  }

  static GroupingElement tuple(Expression... expressions) {
    return new Tuple(Arrays.asList(expressions));
  }

  static GroupingElement rollup(Expression... expressions) {
    return new Rollup(Arrays.asList(expressions));
  }

  static GroupingElement cube(Expression... expressions) {
    return new Cube(Arrays.asList(expressions));
  }

  static GroupingElement groupingSets(GroupingElement... elements) {
    return new Sets(Arrays.asList(elements));
  }

  /**
   * A plain grouping expression.
   *
   * @param expression
   *          the key
   */
  record Single(Expression expression) implements GroupingElement {

    @Override
    public List<List<Expression>> sets() {
      return List.of(List.of(expression));
    }

    @Override
    public String toString() {
      return expression.toString();
    }
  }

  /**
   * A parenthesised key list; {@code ()} is the empty grouping set.
   *
   * @param expressions
   *          the keys
   */
  record Tuple(List<Expression> expressions) implements GroupingElement {

    /**
     * Copies the keys.
     */
    public Tuple {
      expressions = List.copyOf(expressions);
    }

    @Override
    public List<List<Expression>> sets() {
      return List.of(expressions);
    }

    @Override
    public String toString() {
      return expressions.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
    }
  }

  /**
   * {@code ROLLUP(c1, ..., cn)}: every prefix from the full list down to the
   * empty set, n + 1 sets in total.
   *
   * @param expressions
   *          the keys
   */
  record Rollup(List<Expression> expressions) implements GroupingElement {

    /**
     * Copies the keys.
     */
    public Rollup {
      expressions = List.copyOf(expressions);
    }

    @Override
    public List<List<Expression>> sets() {
      List<List<Expression>> sets = new ArrayList<>(expressions.size() + 1);
      for (int len = expressions.size(); len >= 0; len--) {
        sets.add(expressions.subList(0, len));
      }
      return sets;
    }

    @Override
    public String toString() {
      return "ROLLUP" + new Tuple(expressions);
    }
  }

  /**
   * {@code CUBE(c1, ..., cn)}: all 2^n subsets, largest first. The first key is
   * the most significant bit of the enumeration, so {@code CUBE(a, b)} yields
   * {@code (a, b), (a), (b), ()}.
   *
   * @param expressions
   *          the keys
   */
  record Cube(List<Expression> expressions) implements GroupingElement {

    /**
     * Copies the keys.
     */
    public Cube {
      expressions = List.copyOf(expressions);
      if (expressions.size() > 30) {
        throw new IllegalArgumentException("CUBE supports at most 30 expressions, got " + expressions.size());
      }
    }

    @Override
    public List<List<Expression>> sets() {
      int n = expressions.size();
      List<List<Expression>> sets = new ArrayList<>(1 << n);
      for (int mask = (1 << n) - 1; mask >= 0; mask--) {
        List<Expression> set = new ArrayList<>();
        for (int i = 0; i < n; i++) {
          if ((mask & (1 << (n - 1 - i))) != 0) {
            set.add(expressions.get(i));
          }
        }
        sets.add(List.copyOf(set));
      }
      return sets;
    }

    @Override
    public String toString() {
      return "CUBE" + new Tuple(expressions);
    }
  }

  /**
   * {@code GROUPING SETS (...)}: the concatenation of the sets of its members.
   * Duplicate sets are kept and produce duplicate groups.
   *
   * @param elements
   *          the members
   */
  record Sets(List<GroupingElement> elements) implements GroupingElement {

    /**
     * Copies the members.
     */
    public Sets {
      elements = List.copyOf(elements);
    }

    @Override
    public List<List<Expression>> sets() {
      List<List<Expression>> sets = new ArrayList<>();
      for (GroupingElement element : elements) {
        sets.addAll(element.sets());
      }
      return sets;
    }

    @Override
    public String toString() {
      return "GROUPING SETS" + elements.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
    }
  }
}
