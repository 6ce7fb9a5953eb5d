package se.alipsa.jrel.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import se.alipsa.jrel.value.Value;

/**
 * Immutable, fixed length sequence of values aligned to a {@link Schema}.
 */
public final class Row {

  /** The row without values, produced once for a FROM-less SELECT. */
  public static final Row EMPTY = new Row(List.of());

  private final List<Value> values;

  /**
   * Create a row.
   *
   * @param values
   *          the values; {@code null} entries are stored as NULL
   */
  public Row(List<Value> values) {
    List<Value> copy = new ArrayList<>(values.size());
    for (Value value : values) {
      copy.add(value == null ? Value.NULL : value);
    }
    this.values = Collections.unmodifiableList(copy);
  }

  /**
   * Create a row from values.
   *
   * @param values
   *          the values
   * @return the row
   */
  public static Row of(Value... values) {
    return new Row(Arrays.asList(values));
  }

  /**
   * A row holding {@code width} NULLs, used to pad outer joins.
   *
   * @param width
   *          number of columns
   * @return the padding row
   */
  public static Row nulls(int width) {
    return new Row(Collections.nCopies(width, Value.NULL));
  }

  public List<Value> values() {
    return values;
  }

  public int size() {
    return values.size();
  }

  /**
   * Value at a position.
   *
   * @param index
   *          zero based position
   * @return the value, never {@code null}
   */
  public Value get(int index) {
    return values.get(index);
  }

  /**
   * Append another row's values.
   *
   * @param other
   *          the right row
   * @return the joined row
   */
  public Row concat(Row other) {
    List<Value> joined = new ArrayList<>(values.size() + other.values.size());
    joined.addAll(values);
    joined.addAll(other.values);
    return new Row(joined);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Row other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(values);
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
