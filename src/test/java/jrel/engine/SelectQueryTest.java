package jrel.engine;

import static jrel.Tables.column;
import static jrel.Tables.ints;
import static jrel.Tables.row;
import static jrel.Tables.scan;
import static jrel.Tables.table;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static se.alipsa.jrel.engine.Expressions.add;
import static se.alipsa.jrel.engine.Expressions.col;
import static se.alipsa.jrel.engine.Expressions.countStar;
import static se.alipsa.jrel.engine.Expressions.gt;
import static se.alipsa.jrel.engine.Expressions.lit;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;
import se.alipsa.jrel.engine.ColumnMatching;
import se.alipsa.jrel.engine.EvaluationContext;
import se.alipsa.jrel.engine.QueryEvaluator;
import se.alipsa.jrel.engine.QueryPlan;
import se.alipsa.jrel.engine.SelectItem;
import se.alipsa.jrel.engine.SelectQuery;
import se.alipsa.jrel.engine.SetOperationQuery;
import se.alipsa.jrel.engine.SetOperator;
import se.alipsa.jrel.engine.SetQuantifier;
import se.alipsa.jrel.engine.SortKey;
import se.alipsa.jrel.model.Table;

class SelectQueryTest {

  private static final Table DATA = table("k, v",
      row(1L, "b"),
      row(2L, null),
      row(3L, "a"),
      row(4L, "b"));

  private final EvaluationContext ctx = EvaluationContext.defaults();

  private Table run(QueryPlan plan) {
    return QueryEvaluator.evaluate(plan, ctx);
  }

  private SelectQuery.Builder fromData() {
    return SelectQuery.builder().from(scan(DATA, "d"));
  }

  @Test
  void ascendingPutsNullsFirstAndIsStable() {
    Table result = run(fromData().select(col("k"), col("v")).orderBy(SortKey.asc(col("v"))).build());
    assertEquals(List.of(2L, 3L, 1L, 4L), column(result, "k"));
  }

  @Test
  void descendingPutsNullsLast() {
    Table result = run(fromData().select(col("k"), col("v")).orderBy(SortKey.desc(col("v"))).build());
    assertEquals(List.of(1L, 4L, 3L, 2L), column(result, "k"));
  }

  @Test
  void explicitNullOrderingOverridesTheDefault() {
    Table result = run(fromData().select(col("k"), col("v"))
        .orderBy(SortKey.asc(col("v")).nulls(SortKey.NullOrdering.NULLS_LAST)).build());
    assertEquals(List.of(3L, 1L, 4L, 2L), column(result, "k"));
  }

  @Test
  void secondaryKeysBreakTies() {
    Table result = run(fromData().select(col("k"), col("v"))
        .orderBy(SortKey.asc(col("v")), SortKey.desc(col("k"))).build());
    assertEquals(List.of(2L, 3L, 4L, 1L), column(result, "k"));
  }

  @Test
  void outputOrderCanUseAliases() {
    Table result = run(fromData().selectAs(add(col("k"), lit(10)), "shifted")
        .orderBy(SortKey.desc(col("shifted"))).build());
    assertEquals(List.of(14L, 13L, 12L, 11L), column(result, "shifted"));
  }

  @Test
  void outputOrderCannotSeeUnselectedColumns() {
    SelectQuery query = fromData().select(col("v")).orderBy(SortKey.asc(col("k"))).build();
    EvaluationException e = assertThrows(EvaluationException.class, () -> run(query));
    assertEquals(ErrorKind.INVALID_PLAN, e.kind());
  }

  @Test
  void inputOrderSortsBeforeProjection() {
    Table result = run(fromData().select(col("v")).orderBy(SortKey.desc(col("k")))
        .orderScope(SelectQuery.OrderScope.INPUT).build());
    assertEquals(Arrays.asList("b", "a", null, "b"), column(result, "v"));
  }

  @Test
  void inputOrderWithDistinctIsRejected() {
    EvaluationException e = assertThrows(EvaluationException.class, () -> fromData().select(col("v")).distinct()
        .orderBy(SortKey.asc(col("k"))).orderScope(SelectQuery.OrderScope.INPUT).build());
    assertEquals(ErrorKind.INVALID_PLAN, e.kind());
  }

  @Test
  void orderByAggregate() {
    Table result = run(fromData().groupBy(col("v")).select(col("v")).selectAs(countStar(), "n")
        .orderBy(SortKey.desc(countStar()), SortKey.asc(col("v"))).build());
    assertEquals(Arrays.asList("b", null, "a"), column(result, "v"));
  }

  @Test
  void limitAndOffset() {
    Table result = run(fromData().select(col("k")).orderBy(SortKey.asc(col("k"))).limit(2).offset(1).build());
    assertEquals(List.of(2L, 3L), column(result, "k"));
    Table past = run(fromData().select(col("k")).offset(10).build());
    assertEquals(0, past.size());
  }

  @Test
  void limitLargerThanTheInputKeepsTheRest() {
    Table result = run(fromData().select(col("k")).limit(Long.MAX_VALUE).offset(1).build());
    assertEquals(List.of(2L, 3L, 4L), column(result, "k"));
    Table exact = run(fromData().select(col("k")).limit(3).offset(1).build());
    assertEquals(List.of(2L, 3L, 4L), column(exact, "k"));
    Table none = run(fromData().select(col("k")).limit(0).build());
    assertEquals(0, none.size());
  }

  @Test
  void distinctKeepsFirstOccurrences() {
    Table result = run(fromData().select(col("v")).distinct().build());
    assertEquals(Arrays.asList("b", null, "a"), column(result, "v"));
  }

  @Test
  void whereDropsUnknownRows() {
    Table result = run(fromData().where(gt(col("v"), lit("a"))).select(col("k")).build());
    assertEquals(List.of(1L, 4L), column(result, "k"));
  }

  @Test
  void starExpandsAllColumns() {
    Table result = run(fromData().select(SelectItem.allColumns("d")).build());
    assertEquals(List.of("k", "v"), result.schema().names());
    assertEquals(4, result.size());
  }

  @Test
  void starWithUnknownQualifierFails() {
    EvaluationException e = assertThrows(EvaluationException.class,
        () -> run(fromData().select(SelectItem.allColumns("x")).build()));
    assertEquals(ErrorKind.INVALID_PLAN, e.kind());
  }

  @Test
  void selectWithoutFromProducesOneRow() {
    Table result = run(SelectQuery.builder().selectAs(add(lit(1), lit(2)), "three").build());
    assertEquals(List.of(3L), column(result, "three"));
  }

  @Test
  void emptySelectListIsRejected() {
    EvaluationException e = assertThrows(EvaluationException.class, () -> fromData().build());
    assertEquals(ErrorKind.INVALID_PLAN, e.kind());
  }

  @Test
  void setOperationWithOrderAndLimit() {
    SetOperationQuery union = SetOperationQuery.of(
        SelectQuery.builder().from(scan(ints("x", 1L, 5L), "a")).select(col("x")).build(),
        SetOperator.UNION, SetQuantifier.ALL,
        SelectQuery.builder().from(scan(ints("x", 3L, 4L), "b")).select(col("x")).build())
        .orderedBy(List.of(SortKey.desc(col("x"))), 3L, 0);
    assertEquals(List.of(5L, 4L, 3L), column(run(union), "x"));
  }

  @Test
  void unionAllByNameThroughThePlan() {
    SelectQuery left = SelectQuery.builder().selectAs(lit(1), "one_digit").selectAs(lit(10), "two_digit").build();
    SelectQuery right = SelectQuery.builder().selectAs(lit(20), "two_digit").selectAs(lit(2), "one_digit").build();
    Table result = run(SetOperationQuery.of(left, SetOperator.UNION, SetQuantifier.ALL,
        ColumnMatching.byName(), right));
    assertEquals(List.of(1L, 2L), column(result, "one_digit"));
    assertEquals(List.of(10L, 20L), column(result, "two_digit"));
  }
}
