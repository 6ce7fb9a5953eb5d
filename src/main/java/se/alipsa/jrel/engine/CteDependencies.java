package se.alipsa.jrel.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;

/**
 * Reference analysis of WITH clauses: which CTE names a plan reads and in
 * which order the bindings of a {@code WITH RECURSIVE} clause must be
 * materialised.
 */
final class CteDependencies {

  private CteDependencies() {
  }

  /**
   * Every {@link CteScan} in a plan, including those in derived tables, set
   * operation inputs and nested WITH clauses.
   *
   * @param plan
   *          the plan
   * @return the scans in plan order
   */
  static List<CteScan> scans(QueryPlan plan) {
    List<CteScan> scans = new ArrayList<>();
    collect(plan, scans);
    return scans;
  }

  /**
   * Every {@link CteScan} reachable from a row producer.
   *
   * @param producer
   *          the producer
   * @return the scans in plan order
   */
  static List<CteScan> scans(RowProducer producer) {
    List<CteScan> scans = new ArrayList<>();
    collect(producer, scans);
    return scans;
  }

  /**
   * Number of references to {@code name} in a plan.
   *
   * @param plan
   *          the plan
   * @param name
   *          the CTE name, case-insensitive
   * @return the count
   */
  static int countReferences(QueryPlan plan, String name) {
    return (int) scans(plan).stream().filter(s -> s.name().equalsIgnoreCase(name)).count();
  }

  static int countReferences(RowProducer producer, String name) {
    return (int) scans(producer).stream().filter(s -> s.name().equalsIgnoreCase(name)).count();
  }

  private static void collect(QueryPlan plan, List<CteScan> into) {
    if (plan instanceof SelectQuery select) {
      if (select.from() != null) {
        collect(select.from(), into);
      }
    } else if (plan instanceof SetOperationQuery setOp) {
      collect(setOp.left(), into);
      collect(setOp.right(), into);
    } else if (plan instanceof WithQuery with) {
      for (CteBinding binding : with.bindings()) {
        collect(binding.query(), into);
      }
      collect(with.body(), into);
    }
  }

  private static void collect(RowProducer producer, List<CteScan> into) {
    if (producer instanceof CteScan scan) {
      into.add(scan);
    } else if (producer instanceof DerivedTable derived) {
      collect(derived.query(), into);
    } else if (producer instanceof FromClause from) {
      collect(from.first(), into);
      for (JoinStep step : from.steps()) {
        collect(step.right(), into);
      }
    }
  }

  /**
   * Order the bindings so that every binding comes after the bindings it
   * references. Self references are ignored and independent bindings keep
   * their declaration order.
   *
   * @param bindings
   *          the bindings of one WITH clause
   * @return the evaluation order
   * @throws EvaluationException
   *           ({@link ErrorKind#INVALID_RECURSIVE_SHAPE}) when the references
   *           form a cycle
   */
  static List<CteBinding> topologicalOrder(List<CteBinding> bindings) {
    Map<String, CteBinding> byName = new LinkedHashMap<>();
    for (CteBinding binding : bindings) {
      byName.put(key(binding.name()), binding);
    }
    Map<String, Set<String>> dependsOn = new LinkedHashMap<>();
    Map<String, Integer> inDegree = new LinkedHashMap<>();
    for (CteBinding binding : bindings) {
      String name = key(binding.name());
      Set<String> deps = new LinkedHashSet<>();
      for (CteScan scan : scans(binding.query())) {
        String target = key(scan.name());
        if (!target.equals(name) && byName.containsKey(target)) {
          deps.add(target);
        }
      }
      dependsOn.put(name, deps);
      inDegree.put(name, deps.size());
    }
    List<CteBinding> ordered = new ArrayList<>(bindings.size());
    Deque<String> ready = new ArrayDeque<>();
    inDegree.forEach((name, degree) -> {
      if (degree == 0) {
        ready.add(name);
      }
    });
    while (!ready.isEmpty()) {
      String name = ready.poll();
      ordered.add(byName.get(name));
      for (Map.Entry<String, Set<String>> entry : dependsOn.entrySet()) {
        if (entry.getValue().contains(name) && inDegree.merge(entry.getKey(), -1, Integer::sum) == 0) {
          ready.add(entry.getKey());
        }
      }
    }
    if (ordered.size() < bindings.size()) {
      String cycle = inDegree.entrySet().stream().filter(e -> e.getValue() > 0).map(e -> byName.get(e.getKey()).name())
          .collect(Collectors.joining(", "));
      throw new EvaluationException(ErrorKind.INVALID_RECURSIVE_SHAPE, "WITH RECURSIVE",
          "Cyclic references between common table expressions: " + cycle);
    }
    return ordered;
  }

  private static String key(String name) {
    return name.toLowerCase(Locale.ROOT);
  }
}
