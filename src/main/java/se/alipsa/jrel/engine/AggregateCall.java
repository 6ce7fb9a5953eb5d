package se.alipsa.jrel.engine;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;
import se.alipsa.jrel.value.Value;

/**
 * An aggregate function invocation such as {@code SUM(DISTINCT x) FILTER (WHERE
 * y > 0)}. Its value is computed by the grouping stage; evaluating it anywhere
 * else is a plan error.
 *
 * @param function
 *          aggregate name, resolved through the function library
 * @param arguments
 *          argument expressions, empty for {@code COUNT(*)}
 * @param distinct
 *          whether duplicate argument tuples are fed once
 * @param filter
 *          optional row filter, may be {@code null}
 */
public record AggregateCall(String function, List<Expression> arguments, boolean distinct, Expression filter)
    implements Expression {

  /**
   * Validates the call.
   */
  public AggregateCall {
    function = Objects.requireNonNull(function, "function").toUpperCase(Locale.ROOT);
    arguments = List.copyOf(arguments);
  }

  /**
   * Copy with DISTINCT.
   *
   * @return the distinct call
   */
  public AggregateCall distinctValues() {
    return new AggregateCall(function, arguments, true, filter);
  }

  /**
   * Copy with a FILTER clause.
   *
   * @param condition
   *          rows for which the condition is not TRUE are skipped
   * @return the filtered call
   */
  public AggregateCall filterWhere(Expression condition) {
    return new AggregateCall(function, arguments, distinct, condition);
  }

  @Override
  public Value evaluate(Bindings bindings, EvaluationContext ctx) {
    throw new EvaluationException(ErrorKind.INVALID_PLAN, function,
        "Aggregate " + this + " used outside of a grouping context");
  }

  @Override
  public List<Expression> children() {
    return arguments;
  }

  @Override
  public String toString() {
    String args = arguments.isEmpty() ? "*"
        : arguments.stream().map(Object::toString).collect(Collectors.joining(", "));
    return function + "(" + (distinct ? "DISTINCT " : "") + args + ")"
        + (filter == null ? "" : " FILTER (WHERE " + filter + ")");
  }
}
