package se.alipsa.jrel.value;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An immutable SQL value. The set of implementations is closed: every value is
 * one of the records nested in this interface and {@link #kind()} identifies
 * which one, so dispatchers switch over {@link TypeKind} rather than inspecting
 * classes reflectively.
 *
 * <p>
 * Record equality is structural (e.g. two {@code NaN} doubles are equal and a
 * string's collation takes part in equality). SQL equality, ordering and
 * grouping equivalence are defined by {@link ValueComparator}.
 * </p>
 */
public interface Value {

  /** The shared NULL value. */
  Value NULL = new Null();

  /**
   * The variant of this value.
   *
   * @return the kind, never {@code null}
   */
  TypeKind kind();

  /**
   * Determine whether this is the SQL NULL value.
   *
   * @return {@code true} for {@link Null}
   */
  default boolean isNull() {
    return false;
  }

  /**
   * Create a BOOL value.
   *
   * @param value
   *          the boolean
   * @return the value
   */
  static Value of(boolean value) {
    return new Bool(value);
  }

  /**
   * Create an INT64 value.
   *
   * @param value
   *          the integer
   * @return the value
   */
  static Value of(long value) {
    return new Int64(value);
  }

  /**
   * Create a FLOAT64 value.
   *
   * @param value
   *          the double
   * @return the value
   */
  static Value of(double value) {
    return new Float64(value);
  }

  /**
   * Create a NUMERIC value, or NULL when {@code value} is {@code null}.
   *
   * @param value
   *          the decimal
   * @return the value
   */
  static Value of(BigDecimal value) {
    return value == null ? NULL : new Numeric(value);
  }

  /**
   * Create a STRING value without an explicit collation, or NULL when
   * {@code value} is {@code null}.
   *
   * @param value
   *          the text
   * @return the value
   */
  static Value of(String value) {
    return value == null ? NULL : new Str(value, null);
  }

  /**
   * Create a STRING value that carries an explicit collation.
   *
   * @param value
   *          the text
   * @param collation
   *          the collation, may be {@code null}
   * @return the value
   */
  static Value string(String value, Collation collation) {
    return value == null ? NULL : new Str(value, collation);
  }

  /**
   * Create an ARRAY value.
   *
   * @param elements
   *          the elements; {@code null} entries become NULL
   * @return the value
   */
  static Value array(Value... elements) {
    List<Value> list = new ArrayList<>(elements.length);
    for (Value element : elements) {
      list.add(element == null ? NULL : element);
    }
    return new Array(list);
  }

  /**
   * Create a STRUCT value.
   *
   * @param fields
   *          the ordered fields
   * @return the value
   */
  static Value struct(Field... fields) {
    return new Struct(Arrays.asList(fields));
  }

  /**
   * Create a STRUCT field.
   *
   * @param name
   *          field name
   * @param value
   *          field value
   * @return the field
   */
  static Field field(String name, Value value) {
    return new Field(name, value);
  }

  /** SQL NULL. */
  record Null() implements Value {
    @Override
    public TypeKind kind() {
      return TypeKind.NULL;
    }

    @Override
    public boolean isNull() {
      return true;
    }

    @Override
    public String toString() {
      return "NULL";
    }
  }

  /**
   * BOOL value.
   *
   * @param value
   *          the boolean
   */
  record Bool(boolean value) implements Value {
    @Override
    public TypeKind kind() {
      return TypeKind.BOOL;
    }

    @Override
    public String toString() {
      return value ? "TRUE" : "FALSE";
    }
  }

  /**
   * INT64 value.
   *
   * @param value
   *          the integer
   */
  record Int64(long value) implements Value {
    @Override
    public TypeKind kind() {
      return TypeKind.INT64;
    }

    @Override
    public String toString() {
      return Long.toString(value);
    }
  }

  /**
   * FLOAT64 value.
   *
   * @param value
   *          the double, including {@code NaN} and the infinities
   */
  record Float64(double value) implements Value {
    @Override
    public TypeKind kind() {
      return TypeKind.FLOAT64;
    }

    @Override
    public String toString() {
      return Double.toString(value);
    }
  }

  /**
   * NUMERIC (decimal) value.
   *
   * @param value
   *          the decimal
   */
  record Numeric(BigDecimal value) implements Value {
    /**
     * Validates the decimal.
     */
    public Numeric {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public TypeKind kind() {
      return TypeKind.NUMERIC;
    }

    @Override
    public String toString() {
      return value.toPlainString();
    }
  }

  /**
   * STRING value with an optional collation.
   *
   * @param value
   *          the text
   * @param collation
   *          explicit collation, {@code null} when none was assigned
   */
  record Str(String value, Collation collation) implements Value {
    /**
     * Validates the text.
     */
    public Str {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public TypeKind kind() {
      return TypeKind.STRING;
    }

    @Override
    public String toString() {
      return value;
    }
  }

  /**
   * BYTES value.
   *
   * @param value
   *          the bytes, copied on construction and access
   */
  record Bytes(byte[] value) implements Value {
    /**
     * Copies the bytes.
     */
    public Bytes {
      value = Objects.requireNonNull(value, "value").clone();
    }

    @Override
    public byte[] value() {
      return value.clone();
    }

    @Override
    public TypeKind kind() {
      return TypeKind.BYTES;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Bytes other && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
      return "b'" + Arrays.toString(value) + "'";
    }
  }

  /**
   * DATE value.
   *
   * @param value
   *          the calendar date
   */
  record Date(LocalDate value) implements Value {
    /**
     * Validates the date.
     */
    public Date {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public TypeKind kind() {
      return TypeKind.DATE;
    }

    @Override
    public String toString() {
      return value.toString();
    }
  }

  /**
   * TIME value.
   *
   * @param value
   *          the time of day
   */
  record Time(LocalTime value) implements Value {
    /**
     * Validates the time.
     */
    public Time {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public TypeKind kind() {
      return TypeKind.TIME;
    }

    @Override
    public String toString() {
      return value.toString();
    }
  }

  /**
   * DATETIME value, a civil date-time without time zone.
   *
   * @param value
   *          the date-time
   */
  record Datetime(LocalDateTime value) implements Value {
    /**
     * Validates the date-time.
     */
    public Datetime {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public TypeKind kind() {
      return TypeKind.DATETIME;
    }

    @Override
    public String toString() {
      return value.toString();
    }
  }

  /**
   * TIMESTAMP value, an absolute instant.
   *
   * @param value
   *          the instant
   */
  record Timestamp(Instant value) implements Value {
    /**
     * Validates the instant.
     */
    public Timestamp {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public TypeKind kind() {
      return TypeKind.TIMESTAMP;
    }

    @Override
    public String toString() {
      return value.toString();
    }
  }

  /**
   * INTERVAL value.
   *
   * @param months
   *          month component
   * @param days
   *          day component
   * @param micros
   *          sub-day component in microseconds
   */
  record Interval(int months, int days, long micros) implements Value {
    @Override
    public TypeKind kind() {
      return TypeKind.INTERVAL;
    }

    @Override
    public String toString() {
      return "INTERVAL " + months + "-" + days + " " + micros + "us";
    }
  }

  /**
   * ARRAY value.
   *
   * @param elements
   *          ordered elements, NULL elements are represented by {@link #NULL}
   */
  record Array(List<Value> elements) implements Value {
    /**
     * Copies the elements.
     */
    public Array {
      elements = List.copyOf(elements);
    }

    @Override
    public TypeKind kind() {
      return TypeKind.ARRAY;
    }

    @Override
    public String toString() {
      return elements.stream().map(Object::toString).collect(Collectors.joining(", ", "[", "]"));
    }
  }

  /**
   * A named member of a {@link Struct}.
   *
   * @param name
   *          field name, empty for anonymous fields
   * @param value
   *          field value
   */
  record Field(String name, Value value) {
    /**
     * Normalises the field.
     */
    public Field {
      name = name == null ? "" : name;
      value = value == null ? NULL : value;
    }
  }

  /**
   * STRUCT value.
   *
   * @param fields
   *          ordered fields
   */
  record Struct(List<Field> fields) implements Value {
    /**
     * Copies the fields.
     */
    public Struct {
      fields = List.copyOf(fields);
    }

    /**
     * Retrieve a field value by name, ignoring case.
     *
     * @param name
     *          the field name
     * @return the value or {@code null} when no such field exists
     */
    public Value get(String name) {
      for (Field field : fields) {
        if (field.name().equalsIgnoreCase(name)) {
          return field.value();
        }
      }
      return null;
    }

    @Override
    public TypeKind kind() {
      return TypeKind.STRUCT;
    }

    @Override
    public String toString() {
      return fields.stream().map(f -> f.name().isEmpty() ? f.value().toString() : f.name() + ": " + f.value())
          .collect(Collectors.joining(", ", "{", "}"));
    }
  }

  /**
   * JSON value.
   *
   * @param node
   *          the parsed document
   */
  record Json(JsonNode node) implements Value {
    /**
     * Validates the document.
     */
    public Json {
      Objects.requireNonNull(node, "node");
    }

    @Override
    public TypeKind kind() {
      return TypeKind.JSON;
    }

    @Override
    public String toString() {
      return node.toString();
    }
  }
}
