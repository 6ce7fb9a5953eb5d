package jrel.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static se.alipsa.jrel.engine.Expressions.and;
import static se.alipsa.jrel.engine.Expressions.between;
import static se.alipsa.jrel.engine.Expressions.call;
import static se.alipsa.jrel.engine.Expressions.divide;
import static se.alipsa.jrel.engine.Expressions.eq;
import static se.alipsa.jrel.engine.Expressions.in;
import static se.alipsa.jrel.engine.Expressions.isDistinctFrom;
import static se.alipsa.jrel.engine.Expressions.isNotDistinctFrom;
import static se.alipsa.jrel.engine.Expressions.isNull;
import static se.alipsa.jrel.engine.Expressions.isUnknown;
import static se.alipsa.jrel.engine.Expressions.lit;
import static se.alipsa.jrel.engine.Expressions.not;
import static se.alipsa.jrel.engine.Expressions.nullLiteral;
import static se.alipsa.jrel.engine.Expressions.or;

import org.junit.jupiter.api.Test;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;
import se.alipsa.jrel.engine.Bindings;
import se.alipsa.jrel.engine.EvaluationContext;
import se.alipsa.jrel.engine.Expression;
import se.alipsa.jrel.engine.Expressions;
import se.alipsa.jrel.engine.Scope;
import se.alipsa.jrel.model.Row;
import se.alipsa.jrel.model.Schema;
import se.alipsa.jrel.value.Value;

class ExpressionsTest {

  private final EvaluationContext ctx = EvaluationContext.defaults();
  private final Bindings empty = Scope.of(Schema.EMPTY).bind(Row.EMPTY, null);

  private Value eval(Expression expression) {
    return Expressions.evaluate(expression, empty, ctx);
  }

  @Test
  void nullPropagatesThroughComparisons() {
    assertEquals(Value.NULL, eval(eq(nullLiteral(), lit(1))));
    assertEquals(Value.NULL, eval(eq(nullLiteral(), nullLiteral())));
    assertEquals(Value.NULL, eval(not(eq(nullLiteral(), lit(1)))));
  }

  @Test
  void predicatesThatNeverReturnNull() {
    assertEquals(Value.of(true), eval(isNull(nullLiteral())));
    assertEquals(Value.of(false), eval(isNull(lit(1))));
    assertEquals(Value.of(true), eval(isUnknown(eq(nullLiteral(), lit(1)))));
    assertEquals(Value.of(false), eval(isDistinctFrom(nullLiteral(), nullLiteral())));
    assertEquals(Value.of(true), eval(isDistinctFrom(nullLiteral(), lit(1))));
    assertEquals(Value.of(false), eval(isDistinctFrom(lit("a"), lit("a"))));
    assertEquals(Value.of(true), eval(isNotDistinctFrom(nullLiteral(), nullLiteral())));
  }

  @Test
  void kleeneLogic() {
    assertEquals(Value.of(false), eval(and(nullLiteral(), lit(false))));
    assertEquals(Value.NULL, eval(and(nullLiteral(), lit(true))));
    assertEquals(Value.of(true), eval(or(nullLiteral(), lit(true))));
    assertEquals(Value.NULL, eval(or(nullLiteral(), lit(false))));
  }

  @Test
  void inAndBetweenWithNulls() {
    assertEquals(Value.NULL, eval(in(lit(3), lit(1), nullLiteral())));
    assertEquals(Value.of(true), eval(in(lit(1), lit(1), nullLiteral())));
    assertEquals(Value.NULL, eval(between(lit(2), nullLiteral(), lit(3))));
    assertEquals(Value.of(true), eval(between(lit(2), lit(1), lit(3))));
  }

  @Test
  void divisionByZeroFails() {
    EvaluationException e = assertThrows(EvaluationException.class, () -> eval(divide(lit(1), lit(0))));
    assertEquals(ErrorKind.DIVISION_BY_ZERO, e.kind());
  }

  @Test
  void coalesceReturnsFirstNonNull() {
    assertEquals(Value.of(2L), eval(call("COALESCE", nullLiteral(), lit(2), lit(3))));
  }

  @Test
  void unknownColumnIsAPlanError() {
    EvaluationException e = assertThrows(EvaluationException.class, () -> eval(Expressions.col("nope")));
    assertEquals(ErrorKind.INVALID_PLAN, e.kind());
  }
}
