package jrel.helper;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static se.alipsa.jrel.engine.Expressions.call;
import static se.alipsa.jrel.engine.Expressions.lit;

import org.junit.jupiter.api.Test;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;
import se.alipsa.jrel.engine.EvaluationContext;
import se.alipsa.jrel.engine.Expressions;
import se.alipsa.jrel.engine.Scope;
import se.alipsa.jrel.helper.JsonValues;
import se.alipsa.jrel.model.Row;
import se.alipsa.jrel.model.Schema;
import se.alipsa.jrel.value.TypeKind;
import se.alipsa.jrel.value.Value;

class JsonValuesTest {

  private static final Value DOC = JsonValues.parse(Value.of(
      "{\"name\":\"ann\",\"age\":41,\"ratio\":0.5,\"ok\":true,\"tags\":[\"x\",\"y\"],\"addr\":{\"city\":\"Lund\"},"
          + "\"gone\":null}"));

  private static Value at(String path) {
    return JsonValues.jsonValue(DOC, Value.of(path));
  }

  @Test
  void parseProducesAJsonValue() {
    assertEquals(TypeKind.JSON, DOC.kind());
    assertEquals(Value.NULL, JsonValues.parse(Value.NULL));
  }

  @Test
  void scalarsAreConvertedToSqlValues() {
    assertEquals(Value.of("ann"), at("$.name"));
    assertEquals(Value.of(41L), at("$.age"));
    assertEquals(Value.of(0.5), at("$.ratio"));
    assertEquals(Value.of(true), at("$.ok"));
    assertEquals(Value.of("y"), at("$.tags[1]"));
    assertEquals(Value.of("Lund"), at("$.addr.city"));
    assertEquals(Value.of("Lund"), at("$['addr'].city"));
  }

  @Test
  void missingNullAndContainerNodesAreNull() {
    assertTrue(at("$.nope").isNull());
    assertTrue(at("$.gone").isNull());
    assertTrue(at("$.tags").isNull());
    assertTrue(at("$.addr").isNull());
  }

  @Test
  void stringDocumentsAreParsedOnTheFly() {
    assertEquals(Value.of(2L), JsonValues.jsonValue(Value.of("[1,2,3]"), Value.of("$[1]")));
  }

  @Test
  void malformedJsonIsAnInvalidArgument() {
    EvaluationException e = assertThrows(EvaluationException.class, () -> JsonValues.parse(Value.of("{oops")));
    assertEquals(ErrorKind.INVALID_ARGUMENT, e.kind());
  }

  @Test
  void pathMustStartWithDollar() {
    EvaluationException e = assertThrows(EvaluationException.class, () -> at("name"));
    assertEquals(ErrorKind.INVALID_ARGUMENT, e.kind());
  }

  @Test
  void parseRejectsNonStrings() {
    EvaluationException e = assertThrows(EvaluationException.class, () -> JsonValues.parse(Value.of(1L)));
    assertEquals(ErrorKind.TYPE_MISMATCH, e.kind());
  }

  @Test
  void functionsAreAvailableToExpressions() {
    Value city = Expressions.evaluate(
        call("JSON_VALUE", call("PARSE_JSON", lit("{\"addr\":{\"city\":\"Lund\"}}")), lit("$.addr.city")),
        Scope.of(Schema.EMPTY).bind(Row.EMPTY, null), EvaluationContext.defaults());
    assertEquals(Value.of("Lund"), city);
  }
}
