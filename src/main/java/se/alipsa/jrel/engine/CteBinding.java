package se.alipsa.jrel.engine;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A named query of a WITH clause.
 *
 * @param name
 *          the CTE name
 * @param columnAliases
 *          optional output column names, empty to keep the query's names
 * @param query
 *          the defining query
 */
public record CteBinding(String name, List<String> columnAliases, QueryPlan query) {

  /**
   * Validates the binding.
   */
  public CteBinding {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(query, "query");
    columnAliases = List.copyOf(columnAliases);
  }

  public static CteBinding of(String name, QueryPlan query) {
    return new CteBinding(name, List.of(), query);
  }

  public static CteBinding of(String name, QueryPlan query, String... columnAliases) {
    return new CteBinding(name, Arrays.asList(columnAliases), query);
  }
}
