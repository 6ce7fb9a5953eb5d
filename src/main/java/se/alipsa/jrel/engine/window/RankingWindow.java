package se.alipsa.jrel.engine.window;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import se.alipsa.jrel.engine.Bindings;
import se.alipsa.jrel.engine.EvaluationContext;
import se.alipsa.jrel.engine.Expression;
import se.alipsa.jrel.engine.Expressions;
import se.alipsa.jrel.engine.OrderingUtil;
import se.alipsa.jrel.engine.Scope;
import se.alipsa.jrel.engine.SortKey;
import se.alipsa.jrel.model.Column;
import se.alipsa.jrel.model.Row;
import se.alipsa.jrel.model.RowKey;
import se.alipsa.jrel.model.Schema;
import se.alipsa.jrel.model.Table;
import se.alipsa.jrel.value.SqlType;
import se.alipsa.jrel.value.Value;

/**
 * {@code ROW_NUMBER()}, {@code RANK()} and {@code DENSE_RANK()} over a
 * partitioned and ordered window. Partitions are formed with grouping
 * equivalence and rows that compare equal on every ORDER BY key are peers.
 *
 * @param function
 *          the ranking function
 * @param name
 *          output column name
 * @param partitionBy
 *          partition expressions, may be empty
 * @param orderBy
 *          ordering within a partition, may be empty
 */
public record RankingWindow(Function function, String name, List<Expression> partitionBy, List<SortKey> orderBy)
    implements WindowStage {

  /** Supported ranking functions. */
  public enum Function {
    ROW_NUMBER, RANK, DENSE_RANK
  }

  /**
   * Validates the window.
   */
  public RankingWindow {
    Objects.requireNonNull(function, "function");
    Objects.requireNonNull(name, "name");
    partitionBy = List.copyOf(partitionBy);
    orderBy = List.copyOf(orderBy);
  }

  @Override
  public Table apply(Table input, Scope scope, EvaluationContext ctx) {
    Map<RowKey, List<Integer>> partitions = new LinkedHashMap<>();
    for (int i = 0; i < input.size(); i++) {
      Bindings bindings = scope.bind(input.rows().get(i), ctx.outer());
      List<Value> partitionValues = new ArrayList<>(partitionBy.size());
      for (Expression expression : partitionBy) {
        partitionValues.add(Expressions.evaluate(expression, bindings, ctx));
      }
      partitions.computeIfAbsent(RowKey.of(partitionValues, ctx.collations()), k -> new ArrayList<>()).add(i);
    }

    long[] ranks = new long[input.size()];
    for (List<Integer> members : partitions.values()) {
      List<Row> rows = new ArrayList<>(members.size());
      members.forEach(i -> rows.add(input.rows().get(i)));
      List<Integer> order = OrderingUtil.sortedOrder(rows, scope, orderBy, ctx);
      List<Value> previousOrder = null;
      long processedInPartition = 0L;
      long currentRank = 0L;
      for (int position : order) {
        List<Value> orderValues = orderValues(rows.get(position), scope, ctx);
        processedInPartition++;
        if (previousOrder == null) {
          currentRank = 1L;
        } else if (function == Function.ROW_NUMBER) {
          currentRank++;
        } else if (OrderingUtil.compareKeys(previousOrder, orderValues, orderBy, ctx.collations()) != 0) {
          currentRank = function == Function.RANK ? processedInPartition : currentRank + 1;
        }
        ranks[members.get(position)] = currentRank;
        previousOrder = orderValues;
      }
    }

    List<Row> result = new ArrayList<>(input.size());
    for (int i = 0; i < input.size(); i++) {
      result.add(input.rows().get(i).concat(Row.of(Value.of(ranks[i]))));
    }
    Schema schema = input.schema().concat(Schema.of(new Column(name, SqlType.INT64, false, null)));
    return new Table(schema, result);
  }

  @Override
  public List<Expression> expressions() {
    List<Expression> expressions = new ArrayList<>(partitionBy);
    orderBy.forEach(key -> expressions.add(key.expression()));
    return expressions;
  }

  private List<Value> orderValues(Row row, Scope scope, EvaluationContext ctx) {
    Bindings bindings = scope.bind(row, ctx.outer());
    List<Value> values = new ArrayList<>(orderBy.size());
    for (SortKey key : orderBy) {
      values.add(Expressions.evaluate(key.expression(), bindings, ctx));
    }
    return values;
  }

  @Override
  public String toString() {
    return function + "() OVER (PARTITION BY " + partitionBy + " ORDER BY " + orderBy + ") AS " + name;
  }
}
