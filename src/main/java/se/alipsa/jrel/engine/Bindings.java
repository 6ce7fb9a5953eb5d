package se.alipsa.jrel.engine;

import java.util.Objects;
import se.alipsa.jrel.model.Row;
import se.alipsa.jrel.value.Value;

/**
 * A row bound to its {@link Scope}, chained to the bindings of the enclosing
 * row for correlated and lateral evaluation. Correlated producers receive the
 * left row explicitly through this chain.
 */
public final class Bindings {

  private final Scope scope;
  private final Row row;
  private final Bindings outer;

  /**
   * Create bindings.
   *
   * @param scope
   *          layout of {@code row}
   * @param row
   *          the current row
   * @param outer
   *          bindings of the enclosing row, may be {@code null}
   */
  public Bindings(Scope scope, Row row, Bindings outer) {
    this.scope = Objects.requireNonNull(scope, "scope");
    this.row = Objects.requireNonNull(row, "row");
    this.outer = outer;
    if (row.size() != scope.schema().size()) {
      throw new IllegalArgumentException("Row width " + row.size() + " does not match " + scope.schema());
    }
  }

  public Scope scope() {
    return scope;
  }

  public Row row() {
    return row;
  }

  public Bindings outer() {
    return outer;
  }

  /**
   * Resolve a column by qualifier and name, searching enclosing rows when the
   * current scope does not have it.
   *
   * @param qualifier
   *          table alias, may be {@code null}
   * @param name
   *          column name
   * @return the value or {@code null} when no scope in the chain has the column
   */
  public Value lookup(String qualifier, String name) {
    for (Bindings b = this; b != null; b = b.outer) {
      int idx = b.scope.schema().indexOf(qualifier, name);
      if (idx >= 0) {
        return b.row.get(idx);
      }
    }
    return null;
  }
}
