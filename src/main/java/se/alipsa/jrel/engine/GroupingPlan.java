package se.alipsa.jrel.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A GROUP BY clause expanded into its distinct key expressions and the
 * concrete grouping sets over them.
 *
 * @param keys
 *          distinct key expressions in first-seen order
 * @param sets
 *          grouping sets in output order, duplicates preserved
 */
public record GroupingPlan(List<Expression> keys, List<GroupingSet> sets) {

  /**
   * Copies the lists.
   */
  public GroupingPlan {
    keys = List.copyOf(keys);
    sets = List.copyOf(sets);
    if (keys.size() > 63) {
      throw new IllegalArgumentException("At most 63 grouping keys are supported, got " + keys.size());
    }
  }

  /**
   * Expand GROUP BY items. The items combine by cartesian product of their sets
   * and an empty item list yields the single empty grouping set.
   *
   * @param elements
   *          the GROUP BY items
   * @return the plan
   */
  public static GroupingPlan expand(List<GroupingElement> elements) {
    List<List<Expression>> product = new ArrayList<>();
    product.add(List.of());
    for (GroupingElement element : elements) {
      List<List<Expression>> next = new ArrayList<>();
      for (List<Expression> prefix : product) {
        for (List<Expression> set : element.sets()) {
          List<Expression> combined = new ArrayList<>(prefix);
          combined.addAll(set);
          next.add(combined);
        }
      }
      product = next;
    }
    List<Expression> keys = new ArrayList<>();
    List<GroupingSet> sets = new ArrayList<>(product.size());
    for (List<Expression> set : product) {
      List<Integer> indexes = new ArrayList<>();
      for (Expression expression : set) {
        int idx = keys.indexOf(expression);
        if (idx < 0) {
          idx = keys.size();
          keys.add(expression);
        }
        if (!indexes.contains(idx)) {
          indexes.add(idx);
        }
      }
      indexes.sort(null);
      sets.add(new GroupingSet(indexes));
    }
    return new GroupingPlan(keys, sets);
  }

  /**
   * Render the sets with their key expressions, e.g. {@code [(a, b), (a), ()]}.
   *
   * @return the description
   */
  public String describe() {
    return sets.stream()
        .map(s -> s.indexes().stream().map(i -> keys.get(i).toString()).collect(Collectors.joining(", ", "(", ")")))
        .collect(Collectors.joining(", ", "[", "]"));
  }
}
