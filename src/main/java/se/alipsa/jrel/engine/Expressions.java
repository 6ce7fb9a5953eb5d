package se.alipsa.jrel.engine;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;
import se.alipsa.jrel.value.ComparisonOperator;
import se.alipsa.jrel.value.LikeMatcher;
import se.alipsa.jrel.value.TriBool;
import se.alipsa.jrel.value.TypeKind;
import se.alipsa.jrel.value.Value;
import se.alipsa.jrel.value.ValueComparator;

/**
 * Factory and implementations of the built-in expression nodes, plus helpers
 * to evaluate and inspect expression trees.
 */
public final class Expressions {

  private Expressions() {
  }

  /**
   * Evaluate an expression, reading precomputed grouping values from the scope
   * when available.
   *
   * @param expression
   *          the expression
   * @param bindings
   *          the bound row
   * @param ctx
   *          the evaluation context
   * @return the value
   */
  public static Value evaluate(Expression expression, Bindings bindings, EvaluationContext ctx) {
    Integer slot = bindings.scope().slotOf(expression);
    if (slot != null) {
      return bindings.row().get(slot);
    }
    Value value = expression.evaluate(bindings, ctx);
    return value == null ? Value.NULL : value;
  }

  /**
   * Evaluate a predicate.
   *
   * @param expression
   *          a BOOL valued expression
   * @param bindings
   *          the bound row
   * @param ctx
   *          the evaluation context
   * @return the truth value, NULL maps to UNKNOWN
   */
  public static TriBool test(Expression expression, Bindings bindings, EvaluationContext ctx) {
    return TriBool.fromValue(evaluate(expression, bindings, ctx));
  }

  /**
   * Column reference, {@code name} or {@code qualifier.name}. A reference that
   * the current row does not have is resolved against the enclosing rows.
   *
   * @param reference
   *          the reference
   * @return the expression
   */
  public static Expression col(String reference) {
    int dot = reference.lastIndexOf('.');
    if (dot > 0) {
      return new ColumnRef(reference.substring(0, dot), reference.substring(dot + 1));
    }
    return new ColumnRef(null, reference);
  }

  public static Expression lit(long value) {
    return new Literal(Value.of(value));
  }

  public static Expression lit(double value) {
    return new Literal(Value.of(value));
  }

  public static Expression lit(boolean value) {
    return new Literal(Value.of(value));
  }

  public static Expression lit(String value) {
    return new Literal(Value.of(value));
  }

  public static Expression lit(BigDecimal value) {
    return new Literal(Value.of(value));
  }

  /**
   * Literal of an arbitrary value.
   *
   * @param value
   *          the value
   * @return the expression
   */
  public static Expression lit(Value value) {
    return new Literal(value);
  }

  /**
   * The NULL literal.
   *
   * @return the expression
   */
  public static Expression nullLiteral() {
    return new Literal(Value.NULL);
  }

  public static Expression compare(ComparisonOperator op, Expression left, Expression right) {
    return new Comparison(op, left, right);
  }

  public static Expression eq(Expression left, Expression right) {
    return new Comparison(ComparisonOperator.EQ, left, right);
  }

  public static Expression ne(Expression left, Expression right) {
    return new Comparison(ComparisonOperator.NE, left, right);
  }

  public static Expression lt(Expression left, Expression right) {
    return new Comparison(ComparisonOperator.LT, left, right);
  }

  public static Expression le(Expression left, Expression right) {
    return new Comparison(ComparisonOperator.LE, left, right);
  }

  public static Expression gt(Expression left, Expression right) {
    return new Comparison(ComparisonOperator.GT, left, right);
  }

  public static Expression ge(Expression left, Expression right) {
    return new Comparison(ComparisonOperator.GE, left, right);
  }

  public static Expression and(Expression left, Expression right) {
    return new And(left, right);
  }

  public static Expression or(Expression left, Expression right) {
    return new Or(left, right);
  }

  public static Expression not(Expression operand) {
    return new Not(operand);
  }

  public static Expression isNull(Expression operand) {
    return new IsNull(operand);
  }

  public static Expression isNotNull(Expression operand) {
    return new Not(new IsNull(operand));
  }

  public static Expression isTrue(Expression operand) {
    return new IsTruth(operand, TriBool.TRUE);
  }

  public static Expression isFalse(Expression operand) {
    return new IsTruth(operand, TriBool.FALSE);
  }

  public static Expression isUnknown(Expression operand) {
    return new IsTruth(operand, TriBool.UNKNOWN);
  }

  public static Expression isDistinctFrom(Expression left, Expression right) {
    return new DistinctFrom(left, right);
  }

  public static Expression isNotDistinctFrom(Expression left, Expression right) {
    return new Not(new DistinctFrom(left, right));
  }

  public static Expression like(Expression input, Expression pattern) {
    return new Like(input, pattern);
  }

  public static Expression in(Expression probe, Expression... candidates) {
    return new In(probe, Arrays.asList(candidates));
  }

  public static Expression between(Expression operand, Expression low, Expression high) {
    return new Between(operand, low, high);
  }

  /**
   * Scalar function call resolved through the function library.
   *
   * @param function
   *          the function name
   * @param arguments
   *          the arguments
   * @return the expression
   */
  public static Expression call(String function, Expression... arguments) {
    return new Call(function, Arrays.asList(arguments));
  }

  public static Expression add(Expression left, Expression right) {
    return new Call("ADD", List.of(left, right));
  }

  public static Expression subtract(Expression left, Expression right) {
    return new Call("SUBTRACT", List.of(left, right));
  }

  public static Expression multiply(Expression left, Expression right) {
    return new Call("MULTIPLY", List.of(left, right));
  }

  public static Expression divide(Expression left, Expression right) {
    return new Call("DIVIDE", List.of(left, right));
  }

  /**
   * STRUCT field access, {@code base.field}.
   *
   * @param base
   *          a STRUCT valued expression
   * @param field
   *          the field name
   * @return the expression
   */
  public static Expression field(Expression base, String field) {
    return new FieldAccess(base, field);
  }

  /**
   * {@code operand COLLATE spec}. The specification may name a collation
   * registered on the engine.
   *
   * @param operand
   *          a STRING valued expression
   * @param spec
   *          collation specification or registered name
   * @return the expression
   */
  public static Expression collate(Expression operand, String spec) {
    return new Collate(operand, spec);
  }

  /**
   * {@code GROUPING(keys...)}: a bitmask with one bit per argument, most
   * significant first, set when that key is a grouping placeholder in the
   * current row.
   *
   * @param keys
   *          grouping key expressions
   * @return the expression
   */
  public static Expression grouping(Expression... keys) {
    return new Grouping(Arrays.asList(keys));
  }

  /**
   * Reference to a column appended by a window stage.
   *
   * @param name
   *          the window output column
   * @return the expression
   */
  public static Expression window(String name) {
    return new WindowColumn(name);
  }

  /**
   * Aggregate call.
   *
   * @param function
   *          the aggregate name
   * @param arguments
   *          the arguments
   * @return the call
   */
  public static AggregateCall aggregate(String function, Expression... arguments) {
    return new AggregateCall(function, Arrays.asList(arguments), false, null);
  }

  public static AggregateCall countStar() {
    return new AggregateCall("COUNT", List.of(), false, null);
  }

  public static AggregateCall count(Expression argument) {
    return aggregate("COUNT", argument);
  }

  public static AggregateCall sum(Expression argument) {
    return aggregate("SUM", argument);
  }

  public static AggregateCall avg(Expression argument) {
    return aggregate("AVG", argument);
  }

  public static AggregateCall min(Expression argument) {
    return aggregate("MIN", argument);
  }

  public static AggregateCall max(Expression argument) {
    return aggregate("MAX", argument);
  }

  /**
   * Whether the tree contains an aggregate call.
   *
   * @param expression
   *          the root
   * @return {@code true} if any node is an {@link AggregateCall}
   */
  public static boolean containsAggregate(Expression expression) {
    if (expression instanceof AggregateCall) {
      return true;
    }
    for (Expression child : expression.children()) {
      if (containsAggregate(child)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Whether the tree references a window result.
   *
   * @param expression
   *          the root
   * @return {@code true} if any node is a window reference
   */
  public static boolean containsWindow(Expression expression) {
    if (expression instanceof WindowColumn) {
      return true;
    }
    for (Expression child : expression.children()) {
      if (containsWindow(child)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Collect aggregate calls in evaluation order, without duplicates.
   *
   * @param expression
   *          the root
   * @param into
   *          receives the calls
   */
  public static void collectAggregates(Expression expression, List<AggregateCall> into) {
    if (expression instanceof AggregateCall call) {
      if (!into.contains(call)) {
        into.add(call);
      }
      return;
    }
    for (Expression child : expression.children()) {
      collectAggregates(child, into);
    }
  }

  /**
   * Collect column references.
   *
   * @param expression
   *          the root
   * @return the references in the tree
   */
  public static List<ColumnRef> columnRefs(Expression expression) {
    List<ColumnRef> refs = new ArrayList<>();
    collectColumnRefs(expression, refs);
    return refs;
  }

  private static void collectColumnRefs(Expression expression, List<ColumnRef> into) {
    if (expression instanceof ColumnRef ref) {
      into.add(ref);
    }
    for (Expression child : expression.children()) {
      collectColumnRefs(child, into);
    }
  }

  /**
   * Name given to an expression when it becomes an output column without an
   * alias.
   *
   * @param expression
   *          the expression
   * @return the column name
   */
  public static String label(Expression expression) {
    if (expression instanceof ColumnRef ref) {
      return ref.name();
    }
    if (expression instanceof FieldAccess access) {
      return access.field();
    }
    if (expression instanceof WindowColumn window) {
      return window.name();
    }
    if (expression instanceof Collate collate) {
      return label(collate.operand());
    }
    return expression.toString();
  }

  /**
   * Column reference.
   *
   * @param qualifier
   *          table alias, may be {@code null}
   * @param name
   *          column name
   */
  public record ColumnRef(String qualifier, String name) implements Expression {

    /**
     * Validates the reference.
     */
    public ColumnRef {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public Value evaluate(Bindings bindings, EvaluationContext ctx) {
      Value value = bindings.lookup(qualifier, name);
      if (value == null) {
        throw new EvaluationException(ErrorKind.INVALID_PLAN, null,
            "Unknown column '" + this + "'; available: " + bindings.scope().schema().names());
      }
      return value;
    }

    @Override
    public String toString() {
      return qualifier == null ? name : qualifier + "." + name;
    }
  }

  /**
   * Constant.
   *
   * @param value
   *          the value
   */
  public record Literal(Value value) implements Expression {

    /**
     * Normalises the value.
     */
    public Literal {
      value = value == null ? Value.NULL : value;
    }

    @Override
    public Value evaluate(Bindings bindings, EvaluationContext ctx) {
      return value;
    }

    @Override
    public String toString() {
      return value.kind() == TypeKind.STRING ? "'" + value + "'" : value.toString();
    }
  }

  /**
   * Binary comparison.
   *
   * @param op
   *          the operator
   * @param left
   *          left operand
   * @param right
   *          right operand
   */
  public record Comparison(ComparisonOperator op, Expression left, Expression right) implements Expression {

    @Override
    public Value evaluate(Bindings bindings, EvaluationContext ctx) {
      return ValueComparator.comparison(op, Expressions.evaluate(left, bindings, ctx),
          Expressions.evaluate(right, bindings, ctx), ctx.collations()).toValue();
    }

    @Override
    public List<Expression> children() {
      return List.of(left, right);
    }

    @Override
    public String toString() {
      return "(" + left + " " + op.symbol() + " " + right + ")";
    }
  }

  /**
   * Kleene AND; the right operand is skipped when the left one is FALSE.
   *
   * @param left
   *          left operand
   * @param right
   *          right operand
   */
  public record And(Expression left, Expression right) implements Expression {

    @Override
    public Value evaluate(Bindings bindings, EvaluationContext ctx) {
      TriBool l = test(left, bindings, ctx);
      if (l == TriBool.FALSE) {
        return l.toValue();
      }
      return l.and(test(right, bindings, ctx)).toValue();
    }

    @Override
    public List<Expression> children() {
      return List.of(left, right);
    }

    @Override
    public String toString() {
      return "(" + left + " AND " + right + ")";
    }
  }

  /**
   * Kleene OR; the right operand is skipped when the left one is TRUE.
   *
   * @param left
   *          left operand
   * @param right
   *          right operand
   */
  public record Or(Expression left, Expression right) implements Expression {

    @Override
    public Value evaluate(Bindings bindings, EvaluationContext ctx) {
      TriBool l = test(left, bindings, ctx);
      if (l == TriBool.TRUE) {
        return l.toValue();
      }
      return l.or(test(right, bindings, ctx)).toValue();
    }

    @Override
    public List<Expression> children() {
      return List.of(left, right);
    }

    @Override
    public String toString() {
      return "(" + left + " OR " + right + ")";
    }
  }

  /**
   * Kleene NOT.
   *
   * @param operand
   *          the operand
   */
  public record Not(Expression operand) implements Expression {

    @Override
    public Value evaluate(Bindings bindings, EvaluationContext ctx) {
      return test(operand, bindings, ctx).not().toValue();
    }

    @Override
    public List<Expression> children() {
      return List.of(operand);
    }

    @Override
    public String toString() {
      return "NOT " + operand;
    }
  }

  /**
   * {@code IS NULL}, never UNKNOWN.
   *
   * @param operand
   *          the operand
   */
  public record IsNull(Expression operand) implements Expression {

    @Override
    public Value evaluate(Bindings bindings, EvaluationContext ctx) {
      return Value.of(Expressions.evaluate(operand, bindings, ctx).isNull());
    }

    @Override
    public List<Expression> children() {
      return List.of(operand);
    }

    @Override
    public String toString() {
      return operand + " IS NULL";
    }
  }

  /**
   * {@code IS TRUE}, {@code IS FALSE} or {@code IS UNKNOWN}, never UNKNOWN.
   *
   * @param operand
   *          a BOOL valued operand
   * @param expected
   *          the truth value tested for
   */
  public record IsTruth(Expression operand, TriBool expected) implements Expression {

    @Override
    public Value evaluate(Bindings bindings, EvaluationContext ctx) {
      return Value.of(test(operand, bindings, ctx) == expected);
    }

    @Override
    public List<Expression> children() {
      return List.of(operand);
    }

    @Override
    public String toString() {
      return operand + " IS " + expected;
    }
  }

  /**
   * {@code IS DISTINCT FROM}, never UNKNOWN.
   *
   * @param left
   *          left operand
   * @param right
   *          right operand
   */
  public record DistinctFrom(Expression left, Expression right) implements Expression {

    @Override
    public Value evaluate(Bindings bindings, EvaluationContext ctx) {
      return Value.of(ValueComparator.isDistinctFrom(Expressions.evaluate(left, bindings, ctx),
          Expressions.evaluate(right, bindings, ctx), ctx.collations()));
    }

    @Override
    public List<Expression> children() {
      return List.of(left, right);
    }

    @Override
    public String toString() {
      return left + " IS DISTINCT FROM " + right;
    }
  }

  /**
   * {@code LIKE}.
   *
   * @param input
   *          the matched value
   * @param pattern
   *          the pattern
   */
  public record Like(Expression input, Expression pattern) implements Expression {

    @Override
    public Value evaluate(Bindings bindings, EvaluationContext ctx) {
      return LikeMatcher.like(Expressions.evaluate(input, bindings, ctx), Expressions.evaluate(pattern, bindings, ctx),
          ctx.collations()).toValue();
    }

    @Override
    public List<Expression> children() {
      return List.of(input, pattern);
    }

    @Override
    public String toString() {
      return input + " LIKE " + pattern;
    }
  }

  /**
   * {@code IN (list)}.
   *
   * @param probe
   *          the tested value
   * @param candidates
   *          the list
   */
  public record In(Expression probe, List<Expression> candidates) implements Expression {

    /**
     * Copies the list.
     */
    public In {
      candidates = List.copyOf(candidates);
    }

    @Override
    public Value evaluate(Bindings bindings, EvaluationContext ctx) {
      List<Value> values = new ArrayList<>(candidates.size());
      for (Expression candidate : candidates) {
        values.add(Expressions.evaluate(candidate, bindings, ctx));
      }
      return ValueComparator.in(Expressions.evaluate(probe, bindings, ctx), values, ctx.collations()).toValue();
    }

    @Override
    public List<Expression> children() {
      List<Expression> all = new ArrayList<>(candidates.size() + 1);
      all.add(probe);
      all.addAll(candidates);
      return all;
    }

    @Override
    public String toString() {
      return probe + " IN " + candidates.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
    }
  }

  /**
   * {@code BETWEEN low AND high}.
   *
   * @param operand
   *          the tested value
   * @param low
   *          inclusive lower bound
   * @param high
   *          inclusive upper bound
   */
  public record Between(Expression operand, Expression low, Expression high) implements Expression {

    @Override
    public Value evaluate(Bindings bindings, EvaluationContext ctx) {
      return ValueComparator.between(Expressions.evaluate(operand, bindings, ctx),
          Expressions.evaluate(low, bindings, ctx), Expressions.evaluate(high, bindings, ctx), ctx.collations())
          .toValue();
    }

    @Override
    public List<Expression> children() {
      return List.of(operand, low, high);
    }

    @Override
    public String toString() {
      return operand + " BETWEEN " + low + " AND " + high;
    }
  }

  /**
   * Scalar function call.
   *
   * @param function
   *          the function name
   * @param arguments
   *          the arguments
   */
  public record Call(String function, List<Expression> arguments) implements Expression {

    /**
     * Validates the call.
     */
    public Call {
      function = Objects.requireNonNull(function, "function").toUpperCase(Locale.ROOT);
      arguments = List.copyOf(arguments);
    }

    @Override
    public Value evaluate(Bindings bindings, EvaluationContext ctx) {
      List<Value> values = new ArrayList<>(arguments.size());
      for (Expression argument : arguments) {
        values.add(Expressions.evaluate(argument, bindings, ctx));
      }
      return ctx.functions().scalar(function).apply(values);
    }

    @Override
    public List<Expression> children() {
      return arguments;
    }

    @Override
    public String toString() {
      String symbol = switch (function) {
        case "ADD" -> "+";
        case "SUBTRACT" -> "-";
        case "MULTIPLY" -> "*";
        case "DIVIDE" -> "/";
        default -> null;
      };
      if (symbol != null && arguments.size() == 2) {
        return "(" + arguments.get(0) + " " + symbol + " " + arguments.get(1) + ")";
      }
      return function + arguments.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
    }
  }

  /**
   * STRUCT field access.
   *
   * @param base
   *          STRUCT valued expression
   * @param field
   *          field name
   */
  public record FieldAccess(Expression base, String field) implements Expression {

    @Override
    public Value evaluate(Bindings bindings, EvaluationContext ctx) {
      Value value = Expressions.evaluate(base, bindings, ctx);
      if (value.isNull()) {
        return Value.NULL;
      }
      if (!(value instanceof Value.Struct struct)) {
        throw new EvaluationException(ErrorKind.TYPE_MISMATCH, null,
            "Field access ." + field + " on " + value.kind());
      }
      Value member = struct.get(field);
      if (member == null) {
        throw new EvaluationException(ErrorKind.INVALID_PLAN, null, "STRUCT has no field '" + field + "'");
      }
      return member;
    }

    @Override
    public List<Expression> children() {
      return List.of(base);
    }

    @Override
    public String toString() {
      return base + "." + field;
    }
  }

  /**
   * {@code operand COLLATE spec}.
   *
   * @param operand
   *          STRING valued expression
   * @param spec
   *          collation specification or registered name
   */
  public record Collate(Expression operand, String spec) implements Expression {

    /**
     * Validates the collation.
     */
    public Collate {
      Objects.requireNonNull(operand, "operand");
      Objects.requireNonNull(spec, "spec");
    }

    @Override
    public Value evaluate(Bindings bindings, EvaluationContext ctx) {
      Value value = Expressions.evaluate(operand, bindings, ctx);
      if (value.isNull()) {
        return Value.NULL;
      }
      if (!(value instanceof Value.Str str)) {
        throw new EvaluationException(ErrorKind.TYPE_MISMATCH, "COLLATE", "COLLATE requires a STRING but got "
            + value.kind());
      }
      return Value.string(str.value(), ctx.collations().lookup(spec));
    }

    @Override
    public List<Expression> children() {
      return List.of(operand);
    }

    @Override
    public String toString() {
      return operand + " COLLATE '" + spec + "'";
    }
  }

  /**
   * {@code GROUPING(keys...)}.
   *
   * @param keys
   *          grouping key expressions
   */
  public record Grouping(List<Expression> keys) implements Expression {

    /**
     * Copies the keys.
     */
    public Grouping {
      keys = List.copyOf(keys);
    }

    @Override
    public Value evaluate(Bindings bindings, EvaluationContext ctx) {
      Scope scope = bindings.scope();
      if (!scope.isGrouped()) {
        throw new EvaluationException(ErrorKind.INVALID_PLAN, "GROUPING", "GROUPING() requires GROUP BY");
      }
      long groupingId = ((Value.Int64) bindings.row().get(scope.groupingIdIndex())).value();
      long result = 0L;
      for (Expression key : keys) {
        Integer slot = scope.slotOf(key);
        if (slot == null || slot >= scope.groupKeyCount()) {
          throw new EvaluationException(ErrorKind.INVALID_PLAN, "GROUPING",
              "GROUPING argument " + key + " is not a grouping key");
        }
        long bit = (groupingId >> (scope.groupKeyCount() - 1 - slot)) & 1L;
        result = (result << 1) | bit;
      }
      return Value.of(result);
    }

    @Override
    public List<Expression> children() {
      return List.of();
    }

    @Override
    public String toString() {
      return "GROUPING" + keys.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
    }
  }

  /**
   * Reference to a window stage output column.
   *
   * @param name
   *          the column name
   */
  public record WindowColumn(String name) implements Expression {

    @Override
    public Value evaluate(Bindings bindings, EvaluationContext ctx) {
      int idx = bindings.scope().schema().indexOf(null, name);
      if (idx < 0) {
        throw new EvaluationException(ErrorKind.INVALID_PLAN, "WINDOW", "Unknown window column '" + name + "'");
      }
      return bindings.row().get(idx);
    }

    @Override
    public String toString() {
      return name;
    }
  }
}
