package jrel.join;

import static jrel.Tables.column;
import static jrel.Tables.row;
import static jrel.Tables.rows;
import static jrel.Tables.scan;
import static jrel.Tables.table;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static se.alipsa.jrel.engine.Expressions.col;
import static se.alipsa.jrel.engine.Expressions.eq;
import static se.alipsa.jrel.engine.Expressions.lit;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import se.alipsa.jrel.EngineOptions;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;
import se.alipsa.jrel.engine.DerivedTable;
import se.alipsa.jrel.engine.EvaluationContext;
import se.alipsa.jrel.engine.FromClause;
import se.alipsa.jrel.engine.JoinCondition;
import se.alipsa.jrel.engine.JoinStep;
import se.alipsa.jrel.engine.QueryEvaluator;
import se.alipsa.jrel.engine.SelectQuery;
import se.alipsa.jrel.engine.Unnest;
import se.alipsa.jrel.engine.function.BuiltinFunctions;
import se.alipsa.jrel.model.Column;
import se.alipsa.jrel.model.Row;
import se.alipsa.jrel.model.Schema;
import se.alipsa.jrel.model.Table;
import se.alipsa.jrel.value.Collation;
import se.alipsa.jrel.value.CollationContext;
import se.alipsa.jrel.value.DefaultTypeCoercion;
import se.alipsa.jrel.value.SqlType;
import se.alipsa.jrel.value.Value;

class LateralJoinTest {

  private static final Table EMP = table("id, dept",
      row(1L, 10L),
      row(2L, 20L));
  private static final Table DEPT = table("dept, title",
      row(10L, "sales"),
      row(10L, "support"));
  private static final Table TAGGED = table("id, tags",
      row(1L, Value.array(Value.of("a"), Value.of("b"))),
      row(2L, Value.array()),
      row(3L, null));

  private static final SqlType ITEM = SqlType.struct(List.of(new SqlType.StructField("n", SqlType.STRING),
      new SqlType.StructField("v", SqlType.INT64)));

  private final EvaluationContext ctx = EvaluationContext.defaults();

  private static Value item(String n, long v) {
    return Value.struct(Value.field("n", Value.of(n)), Value.field("v", Value.of(v)));
  }

  private DerivedTable titlesOfOuterDept() {
    SelectQuery inner = SelectQuery.builder()
        .from(scan(DEPT, "dd"))
        .where(eq(col("dd.dept"), col("e.dept")))
        .select(col("title"))
        .build();
    return new DerivedTable(inner, "t");
  }

  @Test
  void lateralSubqueryIsEvaluatedPerLeftRow() {
    Table result = FromClause.of(scan(EMP, "e"), JoinStep.comma(titlesOfOuterDept()).asLateral()).produce(ctx);
    assertEquals(List.of(List.of(1L, 10L, "sales"), List.of(1L, 10L, "support")), rows(result));
  }

  @Test
  void leftJoinLateralKeepsRowsWithEmptyCorrelatedResult() {
    Table result = FromClause.of(scan(EMP, "e"),
        JoinStep.left(titlesOfOuterDept(), JoinCondition.on(lit(true))).asLateral()).produce(ctx);
    assertEquals(Arrays.asList("sales", "support", null), column(result, "t.title"));
  }

  @Test
  void leftJoinLateralWithoutConditionMatchesEveryRow() {
    Table result = FromClause.of(scan(EMP, "e"),
        JoinStep.left(titlesOfOuterDept(), JoinCondition.NONE).asLateral()).produce(ctx);
    assertEquals(List.of(List.of(1L, 10L, "sales"), List.of(1L, 10L, "support"), Arrays.asList(2L, 20L, null)),
        rows(result));
  }

  @Test
  void correlatedResultsAreNotSharedBetweenCaseVariants() {
    EvaluationContext caseInsensitive = EvaluationContext.create(
        CollationContext.withDefault(Collation.parse("und:ci")), BuiltinFunctions.defaults(),
        DefaultTypeCoercion.INSTANCE, EngineOptions.defaults(), new AtomicBoolean());
    Table people = table("name", row("A"), row("a"));
    SelectQuery echo = SelectQuery.builder()
        .from(scan(table("n", row(1L)), "o"))
        .selectAs(col("p.name"), "echo")
        .build();
    Table result = FromClause.of(scan(people, "p"),
        JoinStep.comma(new DerivedTable(echo, "x")).asLateral()).produce(caseInsensitive);
    assertEquals(List.of(List.of("A", "A"), List.of("a", "a")), rows(result));
  }

  @Test
  void leftJoinUnnestOfStructsPadsEmptyAndNullArrays() {
    Table items = table("id, items",
        row(1L, Value.array(item("x", 1L))),
        row(2L, Value.array()),
        row(3L, null));
    Table result = FromClause.of(scan(items, "t"),
        JoinStep.left(Unnest.of(col("t.items"), "i"), JoinCondition.on(lit(true)))).produce(ctx);
    assertEquals(List.of(1L, 2L, 3L), column(result, "t.id"));
    assertEquals(Arrays.asList("x", null, null), column(result, "i.n"));
    assertEquals(Arrays.asList(1L, null, null), column(result, "i.v"));
  }

  @Test
  void unnestOfStructsTakesColumnsFromTheDeclaredType() {
    Schema schema = new Schema(List.of(Column.of("id", SqlType.INT64), Column.of("items", SqlType.array(ITEM))));
    Table items = new Table(schema, List.of(
        new Row(List.of(Value.of(1L), Value.array())),
        new Row(List.of(Value.of(2L), Value.array(item("y", 2L), item("z", 3L))))));
    Table result = FromClause.of(scan(items, "t"),
        JoinStep.left(Unnest.of(col("t.items"), "i"), JoinCondition.on(lit(true)))).produce(ctx);
    assertEquals(List.of(1L, 2L, 2L), column(result, "t.id"));
    assertEquals(Arrays.asList(null, "y", "z"), column(result, "i.n"));
    assertEquals(Arrays.asList(null, 2L, 3L), column(result, "i.v"));
  }

  @Test
  void correlatedUnnestExpandsEachArray() {
    Table result = FromClause.of(scan(TAGGED, "t"),
        JoinStep.comma(Unnest.of(col("t.tags"), "tag").withOffset("pos"))).produce(ctx);
    assertEquals(List.of(1L, 1L), column(result, "t.id"));
    assertEquals(List.of("a", "b"), column(result, "tag"));
    assertEquals(List.of(0L, 1L), column(result, "pos"));
  }

  @Test
  void leftJoinUnnestKeepsEmptyAndNullArrays() {
    Table result = FromClause.of(scan(TAGGED, "t"),
        JoinStep.left(Unnest.of(col("t.tags"), "tag"), JoinCondition.on(lit(true)))).produce(ctx);
    assertEquals(List.of(1L, 1L, 2L, 3L), column(result, "t.id"));
    assertEquals(Arrays.asList("a", "b", null, null), column(result, "tag"));
  }

  @Test
  void unnestOfStructsExpandsFields() {
    Value people = Value.array(
        new Value.Struct(List.of(new Value.Field("name", Value.of("x")), new Value.Field("age", Value.of(3L)))),
        new Value.Struct(List.of(new Value.Field("name", Value.of("y")), new Value.Field("age", Value.of(4L)))));
    SelectQuery query = SelectQuery.builder()
        .from(Unnest.of(lit(people), "p"))
        .select(col("p.name"), col("p.age"))
        .build();
    Table result = QueryEvaluator.evaluate(query, ctx);
    assertEquals(List.of(List.of("x", 3L), List.of("y", 4L)), rows(result));
  }

  @Test
  void correlatedUnnestCannotBeRightJoined() {
    EvaluationException e = assertThrows(EvaluationException.class, () -> FromClause.of(scan(TAGGED, "t"),
        JoinStep.right(Unnest.of(col("t.tags"), "tag"), JoinCondition.on(lit(true)))));
    assertEquals(ErrorKind.INVALID_JOIN_SHAPE, e.kind());
  }

  @Test
  void unnestOfNonArrayFails() {
    SelectQuery query = SelectQuery.builder()
        .from(FromClause.of(scan(EMP, "e"), JoinStep.comma(Unnest.of(col("e.dept"), "x"))))
        .select(col("x"))
        .build();
    EvaluationException e = assertThrows(EvaluationException.class, () -> QueryEvaluator.evaluate(query, ctx));
    assertEquals(ErrorKind.TYPE_MISMATCH, e.kind());
  }
}
