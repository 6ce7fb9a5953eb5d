package se.alipsa.jrel.value;

import java.math.BigDecimal;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;

/**
 * Widening lattice: INT64 to FLOAT64, any number to NUMERIC, DATE to DATETIME
 * to TIMESTAMP. The type of a bare NULL resolves to the other side and ARRAY and
 * STRUCT types reconcile member-wise.
 */
public class DefaultTypeCoercion implements TypeCoercion {

  /** Shared instance. */
  public static final DefaultTypeCoercion INSTANCE = new DefaultTypeCoercion();

  @Override
  public SqlType commonSupertype(SqlType left, SqlType right) {
    if (left.equals(right)) {
      return left;
    }
    TypeKind lk = left.kind();
    TypeKind rk = right.kind();
    if (lk == TypeKind.NULL) {
      return right;
    }
    if (rk == TypeKind.NULL) {
      return left;
    }
    if (lk.isNumeric() && rk.isNumeric()) {
      if (lk == TypeKind.NUMERIC || rk == TypeKind.NUMERIC) {
        return SqlType.NUMERIC;
      }
      return SqlType.FLOAT64;
    }
    if (lk.isDateBearing() && rk.isDateBearing()) {
      if (lk == TypeKind.TIMESTAMP || rk == TypeKind.TIMESTAMP) {
        return SqlType.TIMESTAMP;
      }
      return SqlType.DATETIME;
    }
    if (lk == TypeKind.ARRAY && rk == TypeKind.ARRAY) {
      return SqlType.array(commonSupertype(left.elementType(), right.elementType()));
    }
    if (lk == TypeKind.STRUCT && rk == TypeKind.STRUCT && left.fields().size() == right.fields().size()) {
      List<SqlType.StructField> fields = new ArrayList<>(left.fields().size());
      for (int i = 0; i < left.fields().size(); i++) {
        SqlType.StructField lf = left.fields().get(i);
        fields.add(new SqlType.StructField(lf.name(), commonSupertype(lf.type(), right.fields().get(i).type())));
      }
      return SqlType.struct(fields);
    }
    throw new EvaluationException(ErrorKind.TYPE_MISMATCH, null,
        "No common supertype for " + left + " and " + right);
  }

  @Override
  public Value coerce(Value value, SqlType target) {
    if (value.isNull() || target.kind() == TypeKind.NULL) {
      return value;
    }
    TypeKind from = value.kind();
    TypeKind to = target.kind();
    if (from == to && to != TypeKind.ARRAY && to != TypeKind.STRUCT) {
      return value;
    }
    switch (to) {
      case FLOAT64:
        if (value instanceof Value.Int64 i) {
          return Value.of((double) i.value());
        }
        break;
      case NUMERIC:
        if (value instanceof Value.Int64 i) {
          return Value.of(BigDecimal.valueOf(i.value()));
        }
        if (value instanceof Value.Float64 f && Double.isFinite(f.value())) {
          return Value.of(BigDecimal.valueOf(f.value()));
        }
        break;
      case DATETIME:
        if (value instanceof Value.Date d) {
          return new Value.Datetime(d.value().atStartOfDay());
        }
        break;
      case TIMESTAMP:
        if (value instanceof Value.Date d) {
          return new Value.Timestamp(d.value().atStartOfDay().toInstant(ZoneOffset.UTC));
        }
        if (value instanceof Value.Datetime dt) {
          return new Value.Timestamp(dt.value().toInstant(ZoneOffset.UTC));
        }
        break;
      case ARRAY:
        if (value instanceof Value.Array array) {
          List<Value> elements = new ArrayList<>(array.elements().size());
          for (Value element : array.elements()) {
            elements.add(coerce(element, target.elementType()));
          }
          return new Value.Array(elements);
        }
        break;
      case STRUCT:
        if (value instanceof Value.Struct struct && struct.fields().size() == target.fields().size()) {
          List<Value.Field> fields = new ArrayList<>(struct.fields().size());
          for (int i = 0; i < struct.fields().size(); i++) {
            Value.Field field = struct.fields().get(i);
            fields.add(new Value.Field(field.name(), coerce(field.value(), target.fields().get(i).type())));
          }
          return new Value.Struct(fields);
        }
        break;
      default:
        break;
    }
    throw new EvaluationException(ErrorKind.TYPE_MISMATCH, null, "Cannot coerce " + from + " to " + target);
  }
}
