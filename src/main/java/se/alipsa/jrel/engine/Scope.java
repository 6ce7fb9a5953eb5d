package se.alipsa.jrel.engine;

import java.util.Map;
import java.util.Objects;
import se.alipsa.jrel.model.Row;
import se.alipsa.jrel.model.Schema;

/**
 * Name resolution layout of the rows flowing through one query stage. After
 * grouping, a scope also maps grouping key expressions and aggregate calls to
 * the output columns that hold their values.
 */
public final class Scope {

  private final Schema schema;
  private final Map<Expression, Integer> slots;
  private final int groupKeyCount;
  private final int groupingIdIndex;

  private Scope(Schema schema, Map<Expression, Integer> slots, int groupKeyCount, int groupingIdIndex) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.slots = Map.copyOf(slots);
    this.groupKeyCount = groupKeyCount;
    this.groupingIdIndex = groupingIdIndex;
  }

  /**
   * Scope of ungrouped rows.
   *
   * @param schema
   *          the row layout
   * @return the scope
   */
  public static Scope of(Schema schema) {
    return new Scope(schema, Map.of(), -1, -1);
  }

  /**
   * Scope of grouped rows.
   *
   * @param schema
   *          the grouped row layout
   * @param slots
   *          positions of grouping keys and aggregate calls
   * @param groupKeyCount
   *          number of grouping key columns, which come first
   * @param groupingIdIndex
   *          position of the GROUPING_ID column
   * @return the scope
   */
  public static Scope grouped(Schema schema, Map<Expression, Integer> slots, int groupKeyCount,
      int groupingIdIndex) {
    return new Scope(schema, slots, groupKeyCount, groupingIdIndex);
  }

  /**
   * Scope of projected rows, where select expressions are read from their
   * output columns.
   *
   * @param schema
   *          the projected layout
   * @param slots
   *          positions of the select expressions
   * @return the scope
   */
  public static Scope projected(Schema schema, Map<Expression, Integer> slots) {
    return new Scope(schema, slots, -1, -1);
  }

  /**
   * Same substitutions over a wider schema, used when a stage appends columns.
   *
   * @param widened
   *          the new schema, which extends the current one
   * @return the scope
   */
  public Scope withSchema(Schema widened) {
    return new Scope(widened, slots, groupKeyCount, groupingIdIndex);
  }

  public Schema schema() {
    return schema;
  }

  /**
   * Column holding the precomputed value of an expression.
   *
   * @param expression
   *          the expression
   * @return the position or {@code null} when the expression must be evaluated
   */
  public Integer slotOf(Expression expression) {
    return slots.isEmpty() ? null : slots.get(expression);
  }

  public boolean isGrouped() {
    return groupKeyCount >= 0;
  }

  public int groupKeyCount() {
    return groupKeyCount;
  }

  public int groupingIdIndex() {
    return groupingIdIndex;
  }

  /**
   * Bind a row of this scope.
   *
   * @param row
   *          the row
   * @param outer
   *          bindings of the enclosing query, may be {@code null}
   * @return the bindings
   */
  public Bindings bind(Row row, Bindings outer) {
    return new Bindings(this, row, outer);
  }
}
