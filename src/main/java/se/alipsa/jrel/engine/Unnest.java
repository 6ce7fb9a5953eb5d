package se.alipsa.jrel.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;
import se.alipsa.jrel.model.Column;
import se.alipsa.jrel.model.Row;
import se.alipsa.jrel.model.Schema;
import se.alipsa.jrel.model.Table;
import se.alipsa.jrel.value.SqlType;
import se.alipsa.jrel.value.TypeKind;
import se.alipsa.jrel.value.Value;

/**
 * {@code UNNEST(array) [AS alias] [WITH OFFSET [AS name]]}. Produces one row per
 * element; an array of STRUCTs expands to one column per field. A NULL or empty
 * array produces no rows. When the array expression references columns it is
 * correlated and is re-evaluated for every left row.
 *
 * @param array
 *          ARRAY valued expression
 * @param alias
 *          name of the element column and qualifier of the output, may be
 *          {@code null}
 * @param offsetName
 *          name of the zero based position column, {@code null} for no
 *          {@code WITH OFFSET}
 */
public record Unnest(Expression array, String alias, String offsetName) implements RowProducer {

  /**
   * Validates the definition.
   */
  public Unnest {
    Objects.requireNonNull(array, "array");
  }

  /**
   * {@code UNNEST(array) AS alias}.
   *
   * @param array
   *          the array expression
   * @param alias
   *          the element column name
   * @return the producer
   */
  public static Unnest of(Expression array, String alias) {
    return new Unnest(array, alias, null);
  }

  /**
   * Copy with a {@code WITH OFFSET AS name} column.
   *
   * @param name
   *          the offset column name, {@code offset} when {@code null}
   * @return the producer
   */
  public Unnest withOffset(String name) {
    return new Unnest(array, alias, name == null ? "offset" : name);
  }

  @Override
  public boolean isCorrelated() {
    return !Expressions.columnRefs(array).isEmpty();
  }

  @Override
  public Table produce(EvaluationContext ctx) {
    Bindings bindings = Scope.of(Schema.EMPTY).bind(Row.EMPTY, ctx.outer());
    Value value = Expressions.evaluate(array, bindings, ctx);
    List<Value> elements = List.of();
    if (!value.isNull()) {
      if (!(value instanceof Value.Array arr)) {
        throw new EvaluationException(ErrorKind.TYPE_MISMATCH, "UNNEST", "UNNEST requires an ARRAY but got "
            + value.kind());
      }
      elements = arr.elements();
    }
    SqlType elementType = declaredElementType(bindings);
    List<String> fieldNames = structFieldNames(elementType, elements);
    List<Column> columns = new ArrayList<>();
    if (fieldNames != null) {
      for (String field : fieldNames) {
        columns.add(new Column(field, fieldType(elementType, elements, field), true, alias));
      }
    } else {
      String name = alias == null ? Expressions.label(array) : alias;
      SqlType type = elementType != null && elementType.kind() != TypeKind.NULL ? elementType
          : elementType(elements);
      columns.add(new Column(name, type, true, alias));
    }
    if (offsetName != null) {
      columns.add(new Column(offsetName, SqlType.INT64, false, alias));
    }
    Schema schema = new Schema(columns);
    List<Row> rows = new ArrayList<>(elements.size());
    for (int i = 0; i < elements.size(); i++) {
      Value element = elements.get(i);
      List<Value> values = new ArrayList<>(columns.size());
      if (fieldNames != null) {
        for (String field : fieldNames) {
          values.add(element instanceof Value.Struct s ? nonNull(s.get(field)) : Value.NULL);
        }
      } else {
        values.add(element);
      }
      if (offsetName != null) {
        values.add(Value.of((long) i));
      }
      rows.add(new Row(values));
    }
    return new Table(schema, rows);
  }

  /**
   * Element type of the array when it is a column, or a field path into one,
   * of a declared ARRAY type. The declared type keeps the output shape stable
   * for rows whose array is NULL or empty.
   */
  private SqlType declaredElementType(Bindings bindings) {
    Expression base = array;
    List<String> path = new ArrayList<>();
    while (base instanceof Expressions.FieldAccess access) {
      path.add(0, access.field());
      base = access.base();
    }
    if (!(base instanceof Expressions.ColumnRef ref)) {
      return null;
    }
    SqlType type = null;
    for (Bindings b = bindings; b != null && type == null; b = b.outer()) {
      Schema schema = b.scope().schema();
      int idx = schema.indexOf(ref.qualifier(), ref.name());
      if (idx >= 0) {
        type = schema.column(idx).type();
      }
    }
    for (String field : path) {
      type = type == null ? null : structField(type, field);
    }
    return type != null && type.kind() == TypeKind.ARRAY ? type.elementType() : null;
  }

  private static SqlType structField(SqlType type, String field) {
    if (type.kind() != TypeKind.STRUCT) {
      return null;
    }
    for (SqlType.StructField member : type.fields()) {
      if (member.name().equalsIgnoreCase(field)) {
        return member.type();
      }
    }
    return null;
  }

  private static List<String> structFieldNames(SqlType elementType, List<Value> elements) {
    if (elementType != null && elementType.kind() == TypeKind.STRUCT && !elementType.fields().isEmpty()) {
      List<String> names = new ArrayList<>(elementType.fields().size());
      for (SqlType.StructField field : elementType.fields()) {
        names.add(field.name());
      }
      return names;
    }
    for (Value element : elements) {
      if (element instanceof Value.Struct struct) {
        List<String> names = new ArrayList<>(struct.fields().size());
        for (Value.Field field : struct.fields()) {
          names.add(field.name());
        }
        return names;
      }
      if (!element.isNull()) {
        return null;
      }
    }
    return null;
  }

  private static SqlType elementType(List<Value> elements) {
    for (Value element : elements) {
      if (!element.isNull()) {
        return SqlType.typeOf(element);
      }
    }
    return SqlType.UNKNOWN;
  }

  private static SqlType fieldType(SqlType elementType, List<Value> elements, String field) {
    SqlType declared = elementType == null ? null : structField(elementType, field);
    if (declared != null && declared.kind() != TypeKind.NULL) {
      return declared;
    }
    for (Value element : elements) {
      if (element instanceof Value.Struct s) {
        Value member = s.get(field);
        if (member != null && !member.isNull()) {
          return SqlType.typeOf(member);
        }
      }
    }
    return SqlType.UNKNOWN;
  }

  private static Value nonNull(Value value) {
    return value == null ? Value.NULL : value;
  }
}
