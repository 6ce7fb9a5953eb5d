package se.alipsa.jrel.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;

/**
 * Comparison semantics for {@link Value}s.
 *
 * <p>
 * Two rule sets are kept apart: predicate comparison
 * ({@link #comparison(ComparisonOperator, Value, Value, CollationContext)}),
 * where NULL yields UNKNOWN and {@code NaN} is unequal to everything, and the
 * total ordering used by ORDER BY and ranking
 * ({@link #orderingCompare(Value, Value, CollationContext)}), where
 * {@code NULL < NaN < -Inf < ... < +Inf}. Grouping, DISTINCT and set operations
 * use {@link #groupingKey(Value, CollationContext)}, under which all NULLs are
 * equal and all {@code NaN}s are equal.
 * </p>
 */
public final class ValueComparator {

  private static final BigInteger MICROS_PER_DAY = BigInteger.valueOf(86_400_000_000L);

  /** Key markers for values without a natural key. */
  private enum Marker {
    NULL, NAN, POSITIVE_INFINITY, NEGATIVE_INFINITY
  }

  private ValueComparator() {
  }

  /**
   * Compare two non-null scalar values.
   *
   * @param left
   *          left value
   * @param right
   *          right value
   * @param collations
   *          collation context for strings
   * @return the comparison outcome, {@link CompareResult#INCOMPARABLE} when
   *         either side is {@code NaN}
   * @throws EvaluationException
   *           ({@link ErrorKind#TYPE_MISMATCH}) when the values are not
   *           comparable
   */
  public static CompareResult compare(Value left, Value right, CollationContext collations) {
    if (left.isNull() || right.isNull()) {
      throw new IllegalArgumentException("NULL operands have no comparison result");
    }
    TypeKind lk = left.kind();
    TypeKind rk = right.kind();
    if (lk.isNumeric() && rk.isNumeric()) {
      return compareNumbers(left, right);
    }
    if (lk.isDateBearing() && rk.isDateBearing()) {
      return CompareResult.of(toDateTime(left).compareTo(toDateTime(right)));
    }
    if (lk != rk) {
      throw mismatch(left, right);
    }
    return switch (lk) {
      case BOOL -> CompareResult.of(Boolean.compare(((Value.Bool) left).value(), ((Value.Bool) right).value()));
      case STRING -> {
        Value.Str ls = (Value.Str) left;
        Value.Str rs = (Value.Str) right;
        Collation collation = collations.resolve(ls.collation(), rs.collation());
        yield CompareResult.of(collation.compare(ls.value(), rs.value()));
      }
      case BYTES -> CompareResult
          .of(Arrays.compareUnsigned(((Value.Bytes) left).value(), ((Value.Bytes) right).value()));
      case TIME -> CompareResult.of(((Value.Time) left).value().compareTo(((Value.Time) right).value()));
      case INTERVAL -> CompareResult.of(intervalMicros((Value.Interval) left)
          .compareTo(intervalMicros((Value.Interval) right)));
      default -> throw mismatch(left, right);
    };
  }

  /**
   * Evaluate a comparison predicate under three-valued logic.
   *
   * @param op
   *          the operator
   * @param left
   *          left operand
   * @param right
   *          right operand
   * @param collations
   *          collation context for strings
   * @return UNKNOWN when either operand is NULL, otherwise the definite result
   */
  public static TriBool comparison(ComparisonOperator op, Value left, Value right, CollationContext collations) {
    if (left.isNull() || right.isNull()) {
      return TriBool.UNKNOWN;
    }
    if (isComposite(left) || isComposite(right)) {
      if (!op.isEquality()) {
        throw new EvaluationException(ErrorKind.TYPE_MISMATCH, op.symbol(),
            left.kind() + " only supports equality comparison");
      }
      TriBool equal = compositeEquals(left, right, collations);
      return op == ComparisonOperator.EQ ? equal : equal.not();
    }
    return TriBool.of(op.test(compare(left, right, collations)));
  }

  /**
   * Three-valued equality.
   *
   * @param left
   *          left operand
   * @param right
   *          right operand
   * @param collations
   *          collation context for strings
   * @return the truth value of {@code left = right}
   */
  public static TriBool equals3vl(Value left, Value right, CollationContext collations) {
    return comparison(ComparisonOperator.EQ, left, right, collations);
  }

  /**
   * Evaluate {@code value IN (candidates)}.
   *
   * @param value
   *          the probe
   * @param candidates
   *          the list members
   * @param collations
   *          collation context for strings
   * @return TRUE on a match, UNKNOWN if no match but a comparison was UNKNOWN,
   *         FALSE otherwise
   */
  public static TriBool in(Value value, List<Value> candidates, CollationContext collations) {
    if (candidates.isEmpty()) {
      return TriBool.FALSE;
    }
    TriBool result = TriBool.FALSE;
    for (Value candidate : candidates) {
      result = result.or(equals3vl(value, candidate, collations));
      if (result == TriBool.TRUE) {
        return result;
      }
    }
    return result;
  }

  /**
   * Evaluate {@code value BETWEEN low AND high}.
   *
   * @param value
   *          the probe
   * @param low
   *          inclusive lower bound
   * @param high
   *          inclusive upper bound
   * @param collations
   *          collation context for strings
   * @return the truth value
   */
  public static TriBool between(Value value, Value low, Value high, CollationContext collations) {
    return comparison(ComparisonOperator.GE, value, low, collations)
        .and(comparison(ComparisonOperator.LE, value, high, collations));
  }

  /**
   * Evaluate {@code left IS DISTINCT FROM right}. Never UNKNOWN: two NULLs are
   * not distinct, NULL is distinct from any non-null value and {@code NaN} is
   * not distinct from {@code NaN}.
   *
   * @param left
   *          left operand
   * @param right
   *          right operand
   * @param collations
   *          collation context for strings
   * @return {@code true} when the operands are distinct
   */
  public static boolean isDistinctFrom(Value left, Value right, CollationContext collations) {
    if (left.isNull() || right.isNull()) {
      return left.isNull() != right.isNull();
    }
    if (isComposite(left) || isComposite(right)) {
      List<Value> ls = members(left, right);
      List<Value> rs = members(right, left);
      if (ls.size() != rs.size()) {
        return true;
      }
      for (int i = 0; i < ls.size(); i++) {
        if (isDistinctFrom(ls.get(i), rs.get(i), collations)) {
          return true;
        }
      }
      return false;
    }
    if (isNaN(left) || isNaN(right)) {
      return isNaN(left) != isNaN(right);
    }
    return compare(left, right, collations) != CompareResult.EQUAL;
  }

  /**
   * Total order used by ORDER BY and ranking windows. NULL sorts before
   * everything, {@code NaN} before every other number.
   *
   * @param left
   *          left value
   * @param right
   *          right value
   * @param collations
   *          collation context for strings
   * @return negative, zero or positive
   */
  public static int orderingCompare(Value left, Value right, CollationContext collations) {
    if (left.isNull() || right.isNull()) {
      return Boolean.compare(!left.isNull(), !right.isNull());
    }
    if (isNaN(left) || isNaN(right)) {
      if (left.kind().isNumeric() && right.kind().isNumeric()) {
        return Boolean.compare(!isNaN(left), !isNaN(right));
      }
      throw mismatch(left, right);
    }
    if (isComposite(left) || isComposite(right)) {
      throw new EvaluationException(ErrorKind.TYPE_MISMATCH, "ORDER BY", left.kind() + " is not orderable");
    }
    return switch (compare(left, right, collations)) {
      case LESS -> -1;
      case GREATER -> 1;
      default -> 0;
    };
  }

  /**
   * Normalise a value into a key for hashing. Two values have equal keys
   * exactly when they are not distinct from each other, so NULLs group
   * together, {@code NaN}s group together, {@code 1}, {@code 1.0} and
   * {@code NUMERIC '1.00'} group together, a DATE groups with the DATETIME at
   * its midnight and strings group by their collation.
   *
   * @param value
   *          the value
   * @param collations
   *          collation context for strings without explicit collation
   * @return a key with value based {@code equals}/{@code hashCode}
   */
  public static Object groupingKey(Value value, CollationContext collations) {
    return switch (value.kind()) {
      case NULL -> Marker.NULL;
      case BOOL -> ((Value.Bool) value).value();
      case INT64 -> BigDecimal.valueOf(((Value.Int64) value).value()).stripTrailingZeros();
      case FLOAT64 -> doubleKey(((Value.Float64) value).value());
      case NUMERIC -> ((Value.Numeric) value).value().stripTrailingZeros();
      case STRING -> collations.collationOf((Value.Str) value).key(((Value.Str) value).value());
      case DATE, DATETIME, TIMESTAMP -> toDateTime(value);
      case INTERVAL -> intervalMicros((Value.Interval) value);
      case ARRAY -> compositeKey(((Value.Array) value).elements(), collations);
      case STRUCT -> {
        List<Value> values = new ArrayList<>();
        for (Value.Field field : ((Value.Struct) value).fields()) {
          values.add(field.value());
        }
        yield compositeKey(values, collations);
      }
      case JSON -> throw new EvaluationException(ErrorKind.TYPE_MISMATCH, null,
          "JSON values cannot be grouped or compared");
      default -> value;
    };
  }

  /**
   * Determine whether the value is a FLOAT64 {@code NaN}.
   *
   * @param value
   *          the value
   * @return {@code true} for {@code NaN}
   */
  public static boolean isNaN(Value value) {
    return value instanceof Value.Float64 f && Double.isNaN(f.value());
  }

  private static Object doubleKey(double d) {
    if (Double.isNaN(d)) {
      return Marker.NAN;
    }
    if (Double.isInfinite(d)) {
      return d > 0 ? Marker.POSITIVE_INFINITY : Marker.NEGATIVE_INFINITY;
    }
    return new BigDecimal(d).stripTrailingZeros();
  }

  private static List<Object> compositeKey(List<Value> values, CollationContext collations) {
    List<Object> key = new ArrayList<>(values.size());
    for (Value v : values) {
      key.add(groupingKey(v, collations));
    }
    return key;
  }

  private static boolean isComposite(Value value) {
    return value.kind() == TypeKind.STRUCT || value.kind() == TypeKind.ARRAY;
  }

  private static List<Value> members(Value value, Value other) {
    if (value.kind() != other.kind()) {
      throw mismatch(value, other);
    }
    if (value instanceof Value.Array array) {
      return array.elements();
    }
    List<Value> values = new ArrayList<>();
    for (Value.Field field : ((Value.Struct) value).fields()) {
      values.add(field.value());
    }
    return values;
  }

  private static TriBool compositeEquals(Value left, Value right, CollationContext collations) {
    List<Value> ls = members(left, right);
    List<Value> rs = members(right, left);
    if (ls.size() != rs.size()) {
      if (left.kind() == TypeKind.STRUCT) {
        throw new EvaluationException(ErrorKind.TYPE_MISMATCH, "=",
            "STRUCTs with " + ls.size() + " and " + rs.size() + " fields are not comparable");
      }
      return TriBool.FALSE;
    }
    boolean unknown = false;
    for (int i = 0; i < ls.size(); i++) {
      TriBool fieldResult = equals3vl(ls.get(i), rs.get(i), collations);
      if (fieldResult == TriBool.FALSE) {
        return TriBool.FALSE;
      }
      unknown |= fieldResult == TriBool.UNKNOWN;
    }
    return unknown ? TriBool.UNKNOWN : TriBool.TRUE;
  }

  private static CompareResult compareNumbers(Value left, Value right) {
    if (isNaN(left) || isNaN(right)) {
      return CompareResult.INCOMPARABLE;
    }
    if (left instanceof Value.Int64 l && right instanceof Value.Int64 r) {
      return CompareResult.of(Long.compare(l.value(), r.value()));
    }
    if (left instanceof Value.Float64 l && right instanceof Value.Float64 r) {
      double a = l.value();
      double b = r.value();
      return a < b ? CompareResult.LESS : a > b ? CompareResult.GREATER : CompareResult.EQUAL;
    }
    int leftInfinity = infinitySign(left);
    int rightInfinity = infinitySign(right);
    if (leftInfinity != 0 || rightInfinity != 0) {
      return CompareResult.of(Integer.compare(leftInfinity, rightInfinity));
    }
    return CompareResult.of(toBigDecimal(left).compareTo(toBigDecimal(right)));
  }

  private static int infinitySign(Value value) {
    if (value instanceof Value.Float64 f && Double.isInfinite(f.value())) {
      return f.value() > 0 ? 1 : -1;
    }
    return 0;
  }

  /**
   * Exact decimal form of a finite numeric value.
   *
   * @param value
   *          an INT64, FLOAT64 or NUMERIC value
   * @return the decimal
   */
  static BigDecimal toBigDecimal(Value value) {
    return switch (value.kind()) {
      case INT64 -> BigDecimal.valueOf(((Value.Int64) value).value());
      case FLOAT64 -> new BigDecimal(((Value.Float64) value).value());
      case NUMERIC -> ((Value.Numeric) value).value();
      default -> throw new IllegalArgumentException("Not a number: " + value.kind());
    };
  }

  private static LocalDateTime toDateTime(Value value) {
    return switch (value.kind()) {
      case DATE -> ((Value.Date) value).value().atStartOfDay();
      case DATETIME -> ((Value.Datetime) value).value();
      case TIMESTAMP -> LocalDateTime.ofInstant(((Value.Timestamp) value).value(), ZoneOffset.UTC);
      default -> throw new IllegalArgumentException("Not a date: " + value.kind());
    };
  }

  private static BigInteger intervalMicros(Value.Interval interval) {
    long days = interval.months() * 30L + interval.days();
    return BigInteger.valueOf(days).multiply(MICROS_PER_DAY).add(BigInteger.valueOf(interval.micros()));
  }

  private static EvaluationException mismatch(Value left, Value right) {
    return new EvaluationException(ErrorKind.TYPE_MISMATCH, null,
        "Cannot compare " + left.kind() + " with " + right.kind());
  }
}
