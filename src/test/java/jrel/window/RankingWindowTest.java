package jrel.window;

import static jrel.Tables.column;
import static jrel.Tables.row;
import static jrel.Tables.rows;
import static jrel.Tables.scan;
import static jrel.Tables.table;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static se.alipsa.jrel.engine.Expressions.col;
import static se.alipsa.jrel.engine.Expressions.eq;
import static se.alipsa.jrel.engine.Expressions.lit;
import static se.alipsa.jrel.engine.Expressions.sum;
import static se.alipsa.jrel.engine.Expressions.window;

import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.jrel.engine.EvaluationContext;
import se.alipsa.jrel.engine.Expression;
import se.alipsa.jrel.engine.QueryEvaluator;
import se.alipsa.jrel.engine.SelectQuery;
import se.alipsa.jrel.engine.SortKey;
import se.alipsa.jrel.engine.window.RankingWindow;
import se.alipsa.jrel.model.Table;

class RankingWindowTest {

  private static final Table SCORES = table("player, team, pts",
      row("a", "red", 10L),
      row("b", "red", 20L),
      row("c", "red", 20L),
      row("d", "blue", 5L),
      row("e", "red", 5L));

  private final EvaluationContext ctx = EvaluationContext.defaults();

  private static RankingWindow byTeam(RankingWindow.Function function, String name) {
    return new RankingWindow(function, name, List.<Expression>of(col("team")),
        List.of(SortKey.desc(col("pts"))));
  }

  @Test
  void rankingFunctionsWithinPartitions() {
    Table result = QueryEvaluator.evaluate(SelectQuery.builder()
        .from(scan(SCORES, "s"))
        .window(byTeam(RankingWindow.Function.ROW_NUMBER, "rn"))
        .window(byTeam(RankingWindow.Function.RANK, "rk"))
        .window(byTeam(RankingWindow.Function.DENSE_RANK, "dr"))
        .select(col("player"), window("rn"), window("rk"), window("dr"))
        .build(), ctx);
    assertEquals(List.of(
        List.of("a", 3L, 3L, 2L),
        List.of("b", 1L, 1L, 1L),
        List.of("c", 2L, 1L, 1L),
        List.of("d", 1L, 1L, 1L),
        List.of("e", 4L, 4L, 3L)), rows(result));
  }

  @Test
  void qualifyFiltersOnWindowResults() {
    Table result = QueryEvaluator.evaluate(SelectQuery.builder()
        .from(scan(SCORES, "s"))
        .window(byTeam(RankingWindow.Function.RANK, "rk"))
        .qualify(eq(window("rk"), lit(1)))
        .select(col("player"))
        .build(), ctx);
    assertEquals(List.of("b", "c", "d"), column(result, "player"));
  }

  @Test
  void windowsRunAfterGrouping() {
    Table result = QueryEvaluator.evaluate(SelectQuery.builder()
        .from(scan(SCORES, "s"))
        .groupBy(col("team"))
        .window(new RankingWindow(RankingWindow.Function.ROW_NUMBER, "pos", List.of(),
            List.of(SortKey.desc(sum(col("pts"))))))
        .select(col("team"), window("pos"))
        .build(), ctx);
    assertEquals(List.of(List.of("red", 1L), List.of("blue", 2L)), rows(result));
  }
}
