package se.alipsa.jrel.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;
import se.alipsa.jrel.engine.window.WindowStage;
import se.alipsa.jrel.model.Column;
import se.alipsa.jrel.model.Row;
import se.alipsa.jrel.model.RowKey;
import se.alipsa.jrel.model.Schema;
import se.alipsa.jrel.model.Table;
import se.alipsa.jrel.value.SqlType;
import se.alipsa.jrel.value.TypeKind;
import se.alipsa.jrel.value.Value;

/**
 * Runs query plans. A SELECT block is evaluated in the fixed stage order FROM,
 * WHERE, GROUP BY, HAVING, WINDOW, QUALIFY, projection, DISTINCT, ORDER BY and
 * LIMIT/OFFSET. Every stage materialises a new table; cancellation is checked
 * before each stage.
 */
public final class QueryEvaluator {

  private static final Logger log = LoggerFactory.getLogger(QueryEvaluator.class);

  private QueryEvaluator() {
  }

  /**
   * Evaluate any query plan.
   *
   * @param plan
   *          the plan
   * @param ctx
   *          the evaluation context
   * @return the result
   */
  public static Table evaluate(QueryPlan plan, EvaluationContext ctx) {
    ctx.checkCancelled("QUERY");
    return plan.evaluate(ctx);
  }

  /**
   * Evaluate a SELECT block.
   *
   * @param query
   *          the block
   * @param ctx
   *          the evaluation context
   * @return the result
   */
  static Table evaluateSelect(SelectQuery query, EvaluationContext ctx) {
    ctx.checkCancelled("FROM");
    Table current = query.from() == null ? new Table(Schema.EMPTY, List.of(Row.EMPTY)) : query.from().produce(ctx);
    log.debug("FROM produced {} rows", current.size());
    Schema fromSchema = current.schema();
    List<SelectItem> items = expandStars(query.select(), fromSchema);
    Scope scope = Scope.of(fromSchema);

    if (query.where() != null) {
      ctx.checkCancelled("WHERE");
      current = filter(current, scope, query.where(), ctx);
      log.debug("WHERE kept {} rows", current.size());
    }

    if (query.isAggregating()) {
      ctx.checkCancelled("GROUP BY");
      List<GroupingElement> elements = query.groupByAll() ? GroupByAll.infer(items, fromSchema) : query.groupBy();
      GroupingEngine.Grouped grouped = GroupingEngine.group(current, GroupingPlan.expand(elements),
          query.aggregateCalls(), ctx);
      current = grouped.table();
      scope = grouped.scope();
    }

    if (query.having() != null) {
      ctx.checkCancelled("HAVING");
      current = filter(current, scope, query.having(), ctx);
      log.debug("HAVING kept {} rows", current.size());
    }

    for (WindowStage window : query.windows()) {
      ctx.checkCancelled("WINDOW");
      current = window.apply(current, scope, ctx);
      scope = scope.withSchema(current.schema());
      log.debug("WINDOW {} applied", window.name());
    }

    if (query.qualify() != null) {
      ctx.checkCancelled("QUALIFY");
      current = filter(current, scope, query.qualify(), ctx);
      log.debug("QUALIFY kept {} rows", current.size());
    }

    ctx.checkCancelled("SELECT");
    List<Integer> inputOrder = null;
    if (query.orderScope() == SelectQuery.OrderScope.INPUT && !query.orderBy().isEmpty()) {
      inputOrder = OrderingUtil.sortedOrder(current.rows(), scope, query.orderBy(), ctx);
    }
    Projection projection = project(current, scope, items, ctx);
    Table result = projection.table();

    if (query.distinct()) {
      ctx.checkCancelled("DISTINCT");
      result = distinct(result, ctx);
      log.debug("DISTINCT kept {} rows", result.size());
    }

    if (inputOrder != null) {
      List<Row> ordered = new ArrayList<>(result.size());
      for (int index : inputOrder) {
        ordered.add(result.rows().get(index));
      }
      result = new Table(result.schema(), ordered);
      return orderAndLimit(result, projection.scope(), List.of(), query.limit(), query.offset(), ctx);
    }
    return orderAndLimit(result, projection.scope(), query.orderBy(), query.limit(), query.offset(), ctx);
  }

  /**
   * Apply ORDER BY and LIMIT/OFFSET.
   *
   * @param table
   *          the rows
   * @param scope
   *          layout the sort keys are evaluated against
   * @param orderBy
   *          the keys, may be empty
   * @param limit
   *          maximum rows or {@code null}
   * @param offset
   *          rows to skip
   * @param ctx
   *          the evaluation context
   * @return the ordered and sliced rows
   */
  static Table orderAndLimit(Table table, Scope scope, List<SortKey> orderBy, Long limit, long offset,
      EvaluationContext ctx) {
    Table result = table;
    if (!orderBy.isEmpty()) {
      ctx.checkCancelled("ORDER BY");
      List<Integer> order = OrderingUtil.sortedOrder(table.rows(), scope, orderBy, ctx);
      List<Row> sorted = new ArrayList<>(order.size());
      for (int index : order) {
        sorted.add(table.rows().get(index));
      }
      result = new Table(table.schema(), sorted);
    }
    if (limit == null && offset == 0) {
      return result;
    }
    ctx.checkCancelled("LIMIT");
    int size = result.size();
    int start = (int) Math.min(size, offset);
    int end = limit == null ? size : start + (int) Math.min(size - start, limit);
    return new Table(result.schema(), new ArrayList<>(result.rows().subList(start, end)));
  }

  private static List<SelectItem> expandStars(List<SelectItem> items, Schema fromSchema) {
    List<SelectItem> expanded = new ArrayList<>(items.size());
    for (SelectItem item : items) {
      if (!item.star()) {
        expanded.add(item);
        continue;
      }
      boolean matched = false;
      for (Column column : fromSchema.columns()) {
        if (item.starQualifier() == null || item.starQualifier().equalsIgnoreCase(column.qualifier())) {
          expanded.add(SelectItem.of(new Expressions.ColumnRef(column.qualifier(), column.name())));
          matched = true;
        }
      }
      if (!matched && item.starQualifier() != null) {
        throw new EvaluationException(ErrorKind.INVALID_PLAN, "SELECT",
            "Unknown table '" + item.starQualifier() + "' in " + item);
      }
    }
    return expanded;
  }

  private static Table filter(Table table, Scope scope, Expression condition, EvaluationContext ctx) {
    List<Row> kept = new ArrayList<>();
    for (Row row : table.rows()) {
      if (Expressions.test(condition, scope.bind(row, ctx.outer()), ctx).isTrue()) {
        kept.add(row);
      }
    }
    return new Table(table.schema(), kept);
  }

  private record Projection(Table table, Scope scope) {
  }

  private static Projection project(Table input, Scope scope, List<SelectItem> items, EvaluationContext ctx) {
    List<Row> rows = new ArrayList<>(input.size());
    SqlType[] observed = new SqlType[items.size()];
    for (Row row : input.rows()) {
      Bindings bindings = scope.bind(row, ctx.outer());
      List<Value> values = new ArrayList<>(items.size());
      for (int i = 0; i < items.size(); i++) {
        Value value = Expressions.evaluate(items.get(i).expression(), bindings, ctx);
        if (observed[i] == null && !value.isNull()) {
          observed[i] = SqlType.typeOf(value);
        }
        values.add(value);
      }
      rows.add(new Row(values));
    }
    List<Column> columns = new ArrayList<>(items.size());
    Map<Expression, Integer> slots = new HashMap<>();
    for (int i = 0; i < items.size(); i++) {
      SelectItem item = items.get(i);
      Column source = sourceColumn(item.expression(), scope);
      SqlType type = source != null && source.type().kind() != TypeKind.NULL ? source.type()
          : observed[i] != null ? observed[i] : SqlType.UNKNOWN;
      if (source != null && item.alias() == null) {
        columns.add(new Column(source.name(), type, source.nullable(), source.qualifier()));
      } else {
        columns.add(new Column(item.name(), type, source == null || source.nullable(), null));
      }
      slots.putIfAbsent(item.expression(), i);
    }
    Schema schema = new Schema(columns);
    return new Projection(new Table(schema, rows), Scope.projected(schema, slots));
  }

  private static Column sourceColumn(Expression expression, Scope scope) {
    Integer slot = scope.slotOf(expression);
    if (slot != null) {
      return scope.schema().column(slot);
    }
    if (expression instanceof Expressions.ColumnRef ref) {
      int idx = scope.schema().indexOf(ref.qualifier(), ref.name());
      return idx < 0 ? null : scope.schema().column(idx);
    }
    return null;
  }

  private static Table distinct(Table table, EvaluationContext ctx) {
    Set<RowKey> seen = new HashSet<>();
    List<Row> kept = new ArrayList<>();
    for (Row row : table.rows()) {
      if (seen.add(RowKey.of(row, ctx.collations()))) {
        kept.add(row);
      }
    }
    return new Table(table.schema(), kept);
  }
}
