package jrel.group;

import static jrel.Tables.column;
import static jrel.Tables.row;
import static jrel.Tables.rows;
import static jrel.Tables.scan;
import static jrel.Tables.table;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static se.alipsa.jrel.engine.Expressions.col;
import static se.alipsa.jrel.engine.Expressions.count;
import static se.alipsa.jrel.engine.Expressions.countStar;
import static se.alipsa.jrel.engine.Expressions.gt;
import static se.alipsa.jrel.engine.Expressions.grouping;
import static se.alipsa.jrel.engine.Expressions.lit;
import static se.alipsa.jrel.engine.Expressions.sum;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;
import se.alipsa.jrel.engine.EvaluationContext;
import se.alipsa.jrel.engine.FromClause;
import se.alipsa.jrel.engine.JoinCondition;
import se.alipsa.jrel.engine.JoinStep;
import se.alipsa.jrel.engine.GroupingElement;
import se.alipsa.jrel.engine.QueryEvaluator;
import se.alipsa.jrel.engine.SelectQuery;
import se.alipsa.jrel.model.Table;

class GroupByTest {

  private static final Table SALES = table("region, product, amount",
      row("N", "x", 10L),
      row("N", "y", 20L),
      row("S", "x", 5L),
      row("S", null, 7L));

  private final EvaluationContext ctx = EvaluationContext.defaults();

  private Table run(SelectQuery query) {
    return QueryEvaluator.evaluate(query, ctx);
  }

  @Test
  void groupByKeepsFirstAppearanceOrder() {
    Table result = run(SelectQuery.builder()
        .from(scan(SALES, "s"))
        .groupBy(col("region"))
        .select(col("region"))
        .selectAs(sum(col("amount")), "total")
        .selectAs(countStar(), "n")
        .build());
    assertEquals(List.of(List.of("N", 30L, 2L), List.of("S", 12L, 2L)), rows(result));
    assertEquals(List.of("region", "total", "n"), result.schema().names());
  }

  @Test
  void nullKeysFormTheirOwnGroup() {
    Table result = run(SelectQuery.builder()
        .from(scan(SALES, "s"))
        .groupBy(col("product"))
        .select(col("product"))
        .selectAs(countStar(), "n")
        .build());
    assertEquals(Arrays.asList("x", "y", null), column(result, "product"));
    assertEquals(List.of(2L, 1L, 1L), column(result, "n"));
  }

  @Test
  void rollupAddsSubtotalsWithGroupingBits() {
    Table result = run(SelectQuery.builder()
        .from(scan(SALES, "s"))
        .groupBy(GroupingElement.rollup(col("region"), col("product")))
        .select(col("region"), col("product"))
        .selectAs(sum(col("amount")), "total")
        .selectAs(grouping(col("region"), col("product")), "g")
        .selectAs(grouping(col("product")), "gp")
        .build());
    assertEquals(List.of(
        List.of("N", "x", 10L, 0L, 0L),
        List.of("N", "y", 20L, 0L, 0L),
        List.of("S", "x", 5L, 0L, 0L),
        Arrays.asList("S", null, 7L, 0L, 0L),
        Arrays.asList("N", null, 30L, 1L, 1L),
        Arrays.asList("S", null, 12L, 1L, 1L),
        Arrays.asList(null, null, 42L, 3L, 1L)), rows(result));
  }

  @Test
  void cubeProducesAllCombinations() {
    Table result = run(SelectQuery.builder()
        .from(scan(SALES, "s"))
        .groupBy(GroupingElement.cube(col("region"), col("product")))
        .selectAs(grouping(col("region"), col("product")), "g")
        .selectAs(sum(col("amount")), "total")
        .build());
    assertEquals(List.of(0L, 0L, 0L, 0L, 1L, 1L, 2L, 2L, 2L, 3L), column(result, "g"));
    assertEquals(List.of(10L, 20L, 5L, 7L, 30L, 12L, 15L, 20L, 7L, 42L), column(result, "total"));
  }

  @Test
  void emptyGroupingSetProducesARowForEmptyInput() {
    Table empty = Table.empty(SALES.schema());
    Table result = run(SelectQuery.builder()
        .from(scan(empty, "s"))
        .selectAs(countStar(), "n")
        .selectAs(sum(col("amount")), "total")
        .build());
    assertEquals(List.of(Arrays.asList(0L, null)), rows(result));
  }

  @Test
  void groupByOnEmptyInputProducesNoRows() {
    Table empty = Table.empty(SALES.schema());
    Table result = run(SelectQuery.builder()
        .from(scan(empty, "s"))
        .groupBy(col("region"))
        .selectAs(countStar(), "n")
        .build());
    assertEquals(0, result.size());
  }

  @Test
  void rollupOnEmptyInputStillEmitsTheGrandTotal() {
    Table empty = Table.empty(SALES.schema());
    Table result = run(SelectQuery.builder()
        .from(scan(empty, "s"))
        .groupBy(GroupingElement.rollup(col("region")))
        .select(col("region"))
        .selectAs(countStar(), "n")
        .build());
    assertEquals(List.of(Arrays.asList(null, 0L)), rows(result));
  }

  @Test
  void havingFiltersGroups() {
    Table result = run(SelectQuery.builder()
        .from(scan(SALES, "s"))
        .groupBy(col("region"))
        .having(gt(sum(col("amount")), lit(20)))
        .select(col("region"))
        .build());
    assertEquals(List.of("N"), column(result, "region"));
  }

  @Test
  void distinctAndFilteredAggregates() {
    Table result = run(SelectQuery.builder()
        .from(scan(SALES, "s"))
        .selectAs(count(col("region")).distinctValues(), "regions")
        .selectAs(count(col("product")), "products")
        .selectAs(sum(col("amount")).filterWhere(gt(col("amount"), lit(8))), "big")
        .build());
    assertEquals(List.of(List.of(2L, 3L, 30L)), rows(result));
  }

  @Test
  void groupByAllInfersNonAggregateColumns() {
    Table result = run(SelectQuery.builder()
        .from(scan(SALES, "s"))
        .groupByAll()
        .select(col("region"))
        .selectAs(sum(col("amount")), "total")
        .build());
    assertEquals(List.of(List.of("N", 30L), List.of("S", 12L)), rows(result));
  }

  @Test
  void groupByAllWithOnlyAggregatesIsAGrandTotal() {
    Table result = run(SelectQuery.builder()
        .from(scan(SALES, "s"))
        .groupByAll()
        .selectAs(sum(col("amount")), "total")
        .build());
    assertEquals(List.of(List.of(42L)), rows(result));
  }

  @Test
  void groupByAllKeepsSameNamedColumnsOfDifferentTables() {
    Table a = table("k, x", row(1L, "p"), row(2L, "p"));
    Table b = table("k, x", row(1L, "q"), row(2L, "r"));
    Table result = run(SelectQuery.builder()
        .from(FromClause.of(scan(a, "a"), JoinStep.inner(scan(b, "b"), JoinCondition.using("k"))))
        .groupByAll()
        .selectAs(col("a.x"), "ax")
        .selectAs(col("b.x"), "bx")
        .selectAs(countStar(), "n")
        .build());
    assertEquals(List.of(List.of("p", "q", 1L), List.of("p", "r", 1L)), rows(result));
  }

  @Test
  void groupByAllCannotBeCombinedWithGroupBy() {
    EvaluationException e = assertThrows(EvaluationException.class, () -> SelectQuery.builder()
        .from(scan(SALES, "s"))
        .groupByAll()
        .groupBy(col("region"))
        .select(col("region"))
        .build());
    assertEquals(ErrorKind.INVALID_PLAN, e.kind());
  }

  @Test
  void groupingOfANonKeyFails() {
    SelectQuery query = SelectQuery.builder()
        .from(scan(SALES, "s"))
        .groupBy(col("region"))
        .selectAs(grouping(col("product")), "g")
        .build();
    EvaluationException e = assertThrows(EvaluationException.class, () -> run(query));
    assertEquals(ErrorKind.INVALID_PLAN, e.kind());
  }
}
