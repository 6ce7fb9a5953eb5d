package se.alipsa.jrel.value;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A resolved SQL type: a {@link TypeKind} plus the element type of an ARRAY or
 * the field types of a STRUCT.
 */
public final class SqlType {

  public static final SqlType UNKNOWN = new SqlType(TypeKind.NULL, null, List.of());
  public static final SqlType BOOL = new SqlType(TypeKind.BOOL, null, List.of());
  public static final SqlType INT64 = new SqlType(TypeKind.INT64, null, List.of());
  public static final SqlType FLOAT64 = new SqlType(TypeKind.FLOAT64, null, List.of());
  public static final SqlType NUMERIC = new SqlType(TypeKind.NUMERIC, null, List.of());
  public static final SqlType STRING = new SqlType(TypeKind.STRING, null, List.of());
  public static final SqlType BYTES = new SqlType(TypeKind.BYTES, null, List.of());
  public static final SqlType DATE = new SqlType(TypeKind.DATE, null, List.of());
  public static final SqlType TIME = new SqlType(TypeKind.TIME, null, List.of());
  public static final SqlType DATETIME = new SqlType(TypeKind.DATETIME, null, List.of());
  public static final SqlType TIMESTAMP = new SqlType(TypeKind.TIMESTAMP, null, List.of());
  public static final SqlType INTERVAL = new SqlType(TypeKind.INTERVAL, null, List.of());
  public static final SqlType JSON = new SqlType(TypeKind.JSON, null, List.of());

  /**
   * A named field of a STRUCT type.
   *
   * @param name
   *          field name (may be empty for anonymous fields)
   * @param type
   *          field type
   */
  public record StructField(String name, SqlType type) {
    /**
     * Validates the field.
     */
    public StructField {
      name = name == null ? "" : name;
      Objects.requireNonNull(type, "type");
    }
  }

  private final TypeKind kind;
  private final SqlType elementType;
  private final List<StructField> fields;

  private SqlType(TypeKind kind, SqlType elementType, List<StructField> fields) {
    this.kind = kind;
    this.elementType = elementType;
    this.fields = List.copyOf(fields);
  }

  /**
   * Return the scalar type for the supplied kind.
   *
   * @param kind
   *          a scalar kind (not ARRAY or STRUCT)
   * @return the shared type instance
   */
  public static SqlType of(TypeKind kind) {
    return switch (Objects.requireNonNull(kind, "kind")) {
      case NULL -> UNKNOWN;
      case BOOL -> BOOL;
      case INT64 -> INT64;
      case FLOAT64 -> FLOAT64;
      case NUMERIC -> NUMERIC;
      case STRING -> STRING;
      case BYTES -> BYTES;
      case DATE -> DATE;
      case TIME -> TIME;
      case DATETIME -> DATETIME;
      case TIMESTAMP -> TIMESTAMP;
      case INTERVAL -> INTERVAL;
      case JSON -> JSON;
      case ARRAY -> array(UNKNOWN);
      case STRUCT -> struct(List.of());
    };
  }

  /**
   * Create an ARRAY type.
   *
   * @param elementType
   *          type of the elements
   * @return the array type
   */
  public static SqlType array(SqlType elementType) {
    return new SqlType(TypeKind.ARRAY, Objects.requireNonNull(elementType, "elementType"), List.of());
  }

  /**
   * Create a STRUCT type.
   *
   * @param fields
   *          ordered fields
   * @return the struct type
   */
  public static SqlType struct(List<StructField> fields) {
    return new SqlType(TypeKind.STRUCT, null, Objects.requireNonNull(fields, "fields"));
  }

  /**
   * Infer the type of a value. Arrays take the type of their first non-null
   * element.
   *
   * @param value
   *          the value to inspect
   * @return the inferred type
   */
  public static SqlType typeOf(Value value) {
    if (value == null || value.isNull()) {
      return UNKNOWN;
    }
    if (value instanceof Value.Array array) {
      SqlType element = UNKNOWN;
      for (Value v : array.elements()) {
        if (!v.isNull()) {
          element = typeOf(v);
          break;
        }
      }
      return array(element);
    }
    if (value instanceof Value.Struct struct) {
      List<StructField> structFields = new ArrayList<>(struct.fields().size());
      for (Value.Field field : struct.fields()) {
        structFields.add(new StructField(field.name(), typeOf(field.value())));
      }
      return struct(structFields);
    }
    return of(value.kind());
  }

  public TypeKind kind() {
    return kind;
  }

  /**
   * Element type of an ARRAY.
   *
   * @return the element type, or {@code null} when this is not an ARRAY
   */
  public SqlType elementType() {
    return elementType;
  }

  /**
   * Fields of a STRUCT.
   *
   * @return immutable list of fields, empty for non-struct types
   */
  public List<StructField> fields() {
    return fields;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof SqlType other)) {
      return false;
    }
    return kind == other.kind && Objects.equals(elementType, other.elementType) && fields.equals(other.fields);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, elementType, fields);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case ARRAY -> "ARRAY<" + elementType + ">";
      case STRUCT -> fields.stream().map(f -> f.name().isEmpty() ? f.type().toString() : f.name() + " " + f.type())
          .collect(Collectors.joining(", ", "STRUCT<", ">"));
      case NULL -> "UNKNOWN";
      default -> kind.name();
    };
  }
}
