package se.alipsa.jrel.engine.function;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;
import se.alipsa.jrel.helper.JsonValues;
import se.alipsa.jrel.value.CollationContext;
import se.alipsa.jrel.value.TypeKind;
import se.alipsa.jrel.value.Value;
import se.alipsa.jrel.value.ValueComparator;

/**
 * Default {@link FunctionLibrary}: arithmetic ({@code ADD}, {@code SUBTRACT},
 * {@code MULTIPLY}, {@code DIVIDE}), {@code COALESCE}, {@code CONCAT},
 * {@code OFFSET} (zero based array access), {@code PARSE_JSON},
 * {@code JSON_VALUE} and the aggregates {@code COUNT},
 * {@code SUM}, {@code AVG}, {@code MIN}, {@code MAX} and {@code STRING_AGG}.
 * Further functions are added with {@link #withScalar(String, ScalarFunction)}
 * and {@link #withAggregate(String, AggregateFunction)}.
 */
public final class BuiltinFunctions implements FunctionLibrary {

  private static final BuiltinFunctions DEFAULT = new BuiltinFunctions(defaultScalars(), defaultAggregates());

  private final Map<String, ScalarFunction> scalars;
  private final Map<String, AggregateFunction> aggregates;

  private BuiltinFunctions(Map<String, ScalarFunction> scalars, Map<String, AggregateFunction> aggregates) {
    this.scalars = Map.copyOf(scalars);
    this.aggregates = Map.copyOf(aggregates);
  }

  /**
   * The shared default library.
   *
   * @return the library
   */
  public static BuiltinFunctions defaults() {
    return DEFAULT;
  }

  /**
   * Copy of this library with an additional scalar function.
   *
   * @param name
   *          the function name
   * @param function
   *          the implementation
   * @return a new library
   */
  public BuiltinFunctions withScalar(String name, ScalarFunction function) {
    Map<String, ScalarFunction> copy = new HashMap<>(scalars);
    copy.put(normalize(name), function);
    return new BuiltinFunctions(copy, aggregates);
  }

  /**
   * Copy of this library with an additional aggregate function.
   *
   * @param name
   *          the function name
   * @param function
   *          the implementation
   * @return a new library
   */
  public BuiltinFunctions withAggregate(String name, AggregateFunction function) {
    Map<String, AggregateFunction> copy = new HashMap<>(aggregates);
    copy.put(normalize(name), function);
    return new BuiltinFunctions(scalars, copy);
  }

  @Override
  public ScalarFunction scalar(String name) {
    ScalarFunction function = scalars.get(normalize(name));
    if (function == null) {
      throw new EvaluationException(ErrorKind.INVALID_PLAN, name, "Unknown scalar function " + name);
    }
    return function;
  }

  @Override
  public AggregateFunction aggregate(String name) {
    AggregateFunction function = aggregates.get(normalize(name));
    if (function == null) {
      throw new EvaluationException(ErrorKind.INVALID_PLAN, name, "Unknown aggregate function " + name);
    }
    return function;
  }

  private static String normalize(String name) {
    return name.toUpperCase(Locale.ROOT);
  }

  private static Map<String, ScalarFunction> defaultScalars() {
    Map<String, ScalarFunction> map = new HashMap<>();
    map.put("ADD", args -> arithmetic("ADD", args.get(0), args.get(1)));
    map.put("SUBTRACT", args -> arithmetic("SUBTRACT", args.get(0), args.get(1)));
    map.put("MULTIPLY", args -> arithmetic("MULTIPLY", args.get(0), args.get(1)));
    map.put("DIVIDE", args -> divide(args.get(0), args.get(1)));
    map.put("PARSE_JSON", args -> JsonValues.parse(args.get(0)));
    map.put("JSON_VALUE", args -> JsonValues.jsonValue(args.get(0), args.get(1)));
    map.put("COALESCE", args -> {
      for (Value v : args) {
        if (!v.isNull()) {
          return v;
        }
      }
      return Value.NULL;
    });
    map.put("CONCAT", args -> {
      StringBuilder sb = new StringBuilder();
      for (Value v : args) {
        if (v.isNull()) {
          return Value.NULL;
        }
        sb.append(v);
      }
      return Value.of(sb.toString());
    });
    map.put("OFFSET", BuiltinFunctions::offset);
    return map;
  }

  private static Map<String, AggregateFunction> defaultAggregates() {
    Map<String, AggregateFunction> map = new HashMap<>();
    map.put("COUNT", collations -> new CountAccumulator());
    map.put("SUM", collations -> new SumAccumulator(false));
    map.put("AVG", collations -> new SumAccumulator(true));
    map.put("MIN", collations -> new ExtremeAccumulator(collations, true));
    map.put("MAX", collations -> new ExtremeAccumulator(collations, false));
    map.put("STRING_AGG", collations -> new StringAggAccumulator());
    return map;
  }

  static Value arithmetic(String op, Value left, Value right) {
    if (left.isNull() || right.isNull()) {
      return Value.NULL;
    }
    requireNumber(op, left);
    requireNumber(op, right);
    try {
      if (left instanceof Value.Int64 l && right instanceof Value.Int64 r) {
        return Value.of(switch (op) {
          case "ADD" -> Math.addExact(l.value(), r.value());
          case "SUBTRACT" -> Math.subtractExact(l.value(), r.value());
          default -> Math.multiplyExact(l.value(), r.value());
        });
      }
    } catch (ArithmeticException e) {
      throw new EvaluationException(ErrorKind.INVALID_ARGUMENT, op, "INT64 overflow", e);
    }
    if (left.kind() == TypeKind.FLOAT64 || right.kind() == TypeKind.FLOAT64) {
      double a = toDouble(left);
      double b = toDouble(right);
      return Value.of(switch (op) {
        case "ADD" -> a + b;
        case "SUBTRACT" -> a - b;
        default -> a * b;
      });
    }
    BigDecimal a = toDecimal(left);
    BigDecimal b = toDecimal(right);
    return Value.of(switch (op) {
      case "ADD" -> a.add(b);
      case "SUBTRACT" -> a.subtract(b);
      default -> a.multiply(b);
    });
  }

  static Value divide(Value left, Value right) {
    if (left.isNull() || right.isNull()) {
      return Value.NULL;
    }
    requireNumber("DIVIDE", left);
    requireNumber("DIVIDE", right);
    if (left.kind() == TypeKind.NUMERIC || right.kind() == TypeKind.NUMERIC) {
      BigDecimal divisor = toDecimal(right);
      if (divisor.signum() == 0) {
        throw new EvaluationException(ErrorKind.DIVISION_BY_ZERO, "DIVIDE", "division by zero: " + left + " / 0");
      }
      return Value.of(toDecimal(left).divide(divisor, MathContext.DECIMAL128));
    }
    double divisor = toDouble(right);
    if (divisor == 0.0) {
      throw new EvaluationException(ErrorKind.DIVISION_BY_ZERO, "DIVIDE", "division by zero: " + left + " / 0");
    }
    return Value.of(toDouble(left) / divisor);
  }

  private static Value offset(List<Value> args) {
    Value array = args.get(0);
    Value index = args.get(1);
    if (array.isNull() || index.isNull()) {
      return Value.NULL;
    }
    if (!(array instanceof Value.Array a) || !(index instanceof Value.Int64 i)) {
      throw new EvaluationException(ErrorKind.TYPE_MISMATCH, "OFFSET", "OFFSET expects ARRAY and INT64 arguments");
    }
    if (i.value() < 0 || i.value() >= a.elements().size()) {
      throw new EvaluationException(ErrorKind.INDEX_OUT_OF_RANGE, "OFFSET",
          "Array index " + i.value() + " is out of bounds (array length " + a.elements().size() + ")");
    }
    return a.elements().get((int) i.value());
  }

  private static void requireNumber(String op, Value v) {
    if (!v.kind().isNumeric()) {
      throw new EvaluationException(ErrorKind.TYPE_MISMATCH, op, "Expected a number but got " + v.kind());
    }
  }

  static double toDouble(Value v) {
    return switch (v.kind()) {
      case INT64 -> ((Value.Int64) v).value();
      case FLOAT64 -> ((Value.Float64) v).value();
      case NUMERIC -> ((Value.Numeric) v).value().doubleValue();
      default -> throw new EvaluationException(ErrorKind.TYPE_MISMATCH, null, "Not a number: " + v.kind());
    };
  }

  static BigDecimal toDecimal(Value v) {
    return switch (v.kind()) {
      case INT64 -> BigDecimal.valueOf(((Value.Int64) v).value());
      case FLOAT64 -> BigDecimal.valueOf(((Value.Float64) v).value());
      case NUMERIC -> ((Value.Numeric) v).value();
      default -> throw new EvaluationException(ErrorKind.TYPE_MISMATCH, null, "Not a number: " + v.kind());
    };
  }

  /** COUNT(x) skips NULL, COUNT(*) counts every row. */
  private static final class CountAccumulator implements Accumulator {
    private long count;

    @Override
    public void accumulate(List<Value> arguments) {
      if (arguments.isEmpty() || !arguments.get(0).isNull()) {
        count++;
      }
    }

    @Override
    public Value result() {
      return Value.of(count);
    }
  }

  private static final class SumAccumulator implements Accumulator {
    private final boolean average;
    private Value sum = Value.NULL;
    private long count;

    SumAccumulator(boolean average) {
      this.average = average;
    }

    @Override
    public void accumulate(List<Value> arguments) {
      Value v = arguments.get(0);
      if (v.isNull()) {
        return;
      }
      sum = sum.isNull() ? v : arithmetic("ADD", sum, v);
      count++;
    }

    @Override
    public Value result() {
      if (!average || sum.isNull()) {
        return sum;
      }
      if (sum.kind() == TypeKind.NUMERIC) {
        return divide(sum, Value.of(BigDecimal.valueOf(count)));
      }
      return Value.of(toDouble(sum) / count);
    }
  }

  private static final class ExtremeAccumulator implements Accumulator {
    private final CollationContext collations;
    private final boolean min;
    private Value current = Value.NULL;

    ExtremeAccumulator(CollationContext collations, boolean min) {
      this.collations = collations;
      this.min = min;
    }

    @Override
    public void accumulate(List<Value> arguments) {
      Value v = arguments.get(0);
      if (v.isNull()) {
        return;
      }
      if (current.isNull()) {
        current = v;
        return;
      }
      int cmp = ValueComparator.orderingCompare(v, current, collations);
      if (min ? cmp < 0 : cmp > 0) {
        current = v;
      }
    }

    @Override
    public Value result() {
      return current;
    }
  }

  private static final class StringAggAccumulator implements Accumulator {
    private StringBuilder text;

    @Override
    public void accumulate(List<Value> arguments) {
      Value v = arguments.get(0);
      if (v.isNull()) {
        return;
      }
      String separator = arguments.size() > 1 && !arguments.get(1).isNull() ? arguments.get(1).toString() : ",";
      if (text == null) {
        text = new StringBuilder();
      } else {
        text.append(separator);
      }
      text.append(v);
    }

    @Override
    public Value result() {
      return text == null ? Value.NULL : Value.of(text.toString());
    }
  }
}
