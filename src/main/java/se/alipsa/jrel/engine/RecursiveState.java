package se.alipsa.jrel.engine;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import se.alipsa.jrel.model.Row;
import se.alipsa.jrel.model.RowKey;
import se.alipsa.jrel.model.Schema;
import se.alipsa.jrel.model.Table;
import se.alipsa.jrel.value.CollationContext;

/**
 * Progress of one recursive CTE: the accumulated result, the working set fed
 * to the next iteration and, for UNION DISTINCT, the keys already emitted.
 */
final class RecursiveState {

  private final boolean distinct;
  private final CollationContext collations;
  private final List<Row> accumulated = new ArrayList<>();
  private final Set<RowKey> seen = new HashSet<>();
  private Schema schema;
  private List<Row> working = List.of();
  private int iteration;

  RecursiveState(boolean distinct, CollationContext collations) {
    this.distinct = distinct;
    this.collations = collations;
  }

  int iteration() {
    return iteration;
  }

  Schema schema() {
    return schema;
  }

  /**
   * Seed the result with the base term.
   *
   * @param base
   *          the base rows with the CTE's output schema
   */
  void seed(Table base) {
    schema = base.schema();
    working = admit(base.rows());
    accumulated.addAll(working);
  }

  /**
   * Replace the output schema once a column typed only by NULLs in the base
   * term receives a type from the recursive term.
   *
   * @param typed
   *          the schema with the same columns
   */
  void retype(Schema typed) {
    schema = typed;
  }

  /**
   * The previous iteration's new rows, substituted for the self reference.
   *
   * @return the working table
   */
  Table workingTable() {
    return new Table(schema, working);
  }

  /**
   * Begin the next iteration.
   *
   * @return the 1-based number of the iteration
   */
  int nextIteration() {
    return ++iteration;
  }

  /**
   * Filter the rows of a recursive step down to the new ones: all rows under
   * UNION ALL, rows not emitted before under UNION DISTINCT.
   *
   * @param produced
   *          rows of the recursive term
   * @return the new rows
   */
  List<Row> admit(List<Row> produced) {
    if (!distinct) {
      return List.copyOf(produced);
    }
    List<Row> fresh = new ArrayList<>();
    for (Row row : produced) {
      if (seen.add(RowKey.of(row, collations))) {
        fresh.add(row);
      }
    }
    return fresh;
  }

  /**
   * Record the new rows of an iteration.
   *
   * @param fresh
   *          rows returned by {@link #admit(List)}
   */
  void append(List<Row> fresh) {
    accumulated.addAll(fresh);
    working = fresh;
  }

  /**
   * Finish and return the result.
   *
   * @return the CTE's table
   */
  Table terminate() {
    working = List.of();
    return new Table(schema, List.copyOf(accumulated));
  }
}
