package se.alipsa.jrel.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jrel.engine.function.Accumulator;
import se.alipsa.jrel.engine.function.AggregateFunction;
import se.alipsa.jrel.model.Column;
import se.alipsa.jrel.model.Row;
import se.alipsa.jrel.model.RowKey;
import se.alipsa.jrel.model.Schema;
import se.alipsa.jrel.model.Table;
import se.alipsa.jrel.value.SqlType;
import se.alipsa.jrel.value.TypeKind;
import se.alipsa.jrel.value.Value;

/**
 * Hash grouping over one or more grouping sets.
 *
 * <p>
 * Each input row is assigned to one group per grouping set. Key values are
 * compared with grouping equivalence, so all NULLs fall into the same group.
 * Keys excluded from a set are emitted as NULL placeholders; the trailing
 * {@code GROUPING_ID} column tells them apart from NULL data. Groups are
 * emitted per set in order of first appearance, and a set without keys
 * produces a row even when the input is empty.
 * </p>
 *
 * <p>
 * Output layout: the key columns, one column per aggregate call, then
 * {@code GROUPING_ID}. The returned {@link Scope} maps every key expression
 * and aggregate call to its column so that HAVING, SELECT and ORDER BY read the
 * precomputed values.
 * </p>
 */
public final class GroupingEngine {

  /** Name of the grouping bitmask column. */
  public static final String GROUPING_ID = "GROUPING_ID";

  private static final Logger log = LoggerFactory.getLogger(GroupingEngine.class);

  private GroupingEngine() {
  }

  /**
   * Result of grouping.
   *
   * @param table
   *          one row per group
   * @param scope
   *          scope resolving keys and aggregates against {@code table}
   */
  public record Grouped(Table table, Scope scope) {

    /**
     * Validates the result.
     */
    public Grouped {
      Objects.requireNonNull(table, "table");
      Objects.requireNonNull(scope, "scope");
    }
  }

  /**
   * Group rows.
   *
   * @param input
   *          the rows to group
   * @param plan
   *          the expanded GROUP BY clause
   * @param aggregates
   *          the distinct aggregate calls to compute per group
   * @param ctx
   *          the evaluation context
   * @return the grouped rows and their scope
   */
  public static Grouped group(Table input, GroupingPlan plan, List<AggregateCall> aggregates,
      EvaluationContext ctx) {
    List<Expression> keys = plan.keys();
    List<GroupingSet> sets = plan.sets();
    log.debug("Grouping {} rows by {} with {} aggregate(s)", input.size(), plan.describe(), aggregates.size());
    List<AggregateFunction> functions = new ArrayList<>(aggregates.size());
    for (AggregateCall call : aggregates) {
      functions.add(ctx.functions().aggregate(call.function()));
    }

    Scope inputScope = Scope.of(input.schema());
    Map<GroupKey, GroupState> states = new LinkedHashMap<>();
    SqlType[] keyTypes = new SqlType[keys.size()];
    int processed = 0;
    for (Row row : input.rows()) {
      if (++processed % 10_000 == 0) {
        ctx.checkCancelled("GROUP BY");
      }
      Bindings bindings = inputScope.bind(row, ctx.outer());
      List<Value> keyValues = new ArrayList<>(keys.size());
      for (int i = 0; i < keys.size(); i++) {
        Value value = Expressions.evaluate(keys.get(i), bindings, ctx);
        keyValues.add(value);
        if (keyTypes[i] == null && !value.isNull()) {
          keyTypes[i] = SqlType.typeOf(value);
        }
      }
      for (int setIndex = 0; setIndex < sets.size(); setIndex++) {
        List<Value> projected = projectForSet(keyValues, sets.get(setIndex));
        GroupKey key = new GroupKey(setIndex, RowKey.of(projected, ctx.collations()));
        GroupState state = states.get(key);
        if (state == null) {
          state = new GroupState(projected, setIndex, functions, ctx);
          states.put(key, state);
        }
        state.add(aggregates, bindings, ctx);
      }
    }
    for (int setIndex = 0; setIndex < sets.size(); setIndex++) {
      if (sets.get(setIndex).indexes().isEmpty()) {
        GroupKey key = new GroupKey(setIndex, RowKey.of(Row.nulls(keys.size()), ctx.collations()));
        if (!states.containsKey(key)) {
          states.put(key, new GroupState(Row.nulls(keys.size()).values(), setIndex, functions, ctx));
        }
      }
    }

    List<Row> rows = new ArrayList<>(states.size());
    SqlType[] aggregateTypes = new SqlType[aggregates.size()];
    for (GroupState state : groupsBySet(states, sets.size())) {
      List<Value> values = new ArrayList<>(state.keyValues);
      for (int i = 0; i < state.accumulators.length; i++) {
        Value result = state.accumulators[i].result();
        if (aggregateTypes[i] == null && !result.isNull()) {
          aggregateTypes[i] = SqlType.typeOf(result);
        }
        values.add(result);
      }
      values.add(Value.of(sets.get(state.setIndex).groupingId(keys.size())));
      rows.add(new Row(values));
    }

    Schema schema = outputSchema(input.schema(), plan, keyTypes, aggregates, aggregateTypes);
    Map<Expression, Integer> slots = new HashMap<>();
    for (int i = 0; i < keys.size(); i++) {
      slots.putIfAbsent(keys.get(i), i);
    }
    for (int i = 0; i < aggregates.size(); i++) {
      slots.putIfAbsent(aggregates.get(i), keys.size() + i);
    }
    int groupingIdIndex = keys.size() + aggregates.size();
    log.debug("Grouping produced {} group(s) over {} grouping set(s)", rows.size(), sets.size());
    return new Grouped(new Table(schema, rows), Scope.grouped(schema, slots, keys.size(), groupingIdIndex));
  }

  private static List<GroupState> groupsBySet(Map<GroupKey, GroupState> states, int setCount) {
    List<List<GroupState>> bySet = new ArrayList<>(setCount);
    for (int i = 0; i < setCount; i++) {
      bySet.add(new ArrayList<>());
    }
    for (GroupState state : states.values()) {
      bySet.get(state.setIndex).add(state);
    }
    List<GroupState> ordered = new ArrayList<>(states.size());
    bySet.forEach(ordered::addAll);
    return ordered;
  }

  private static List<Value> projectForSet(List<Value> keyValues, GroupingSet set) {
    List<Value> projected = new ArrayList<>(keyValues.size());
    for (int i = 0; i < keyValues.size(); i++) {
      projected.add(set.contains(i) ? keyValues.get(i) : Value.NULL);
    }
    return projected;
  }

  private static Schema outputSchema(Schema input, GroupingPlan plan, SqlType[] keyTypes,
      List<AggregateCall> aggregates, SqlType[] aggregateTypes) {
    List<Column> columns = new ArrayList<>();
    List<Expression> keys = plan.keys();
    for (int i = 0; i < keys.size(); i++) {
      Expression key = keys.get(i);
      boolean placeholder = false;
      for (GroupingSet set : plan.sets()) {
        placeholder |= !set.contains(i);
      }
      Column column = null;
      if (key instanceof Expressions.ColumnRef ref) {
        int idx = input.indexOf(ref.qualifier(), ref.name());
        if (idx >= 0) {
          column = input.column(idx);
        }
      }
      if (column == null) {
        column = Column.of(Expressions.label(key), keyTypes[i] == null ? SqlType.UNKNOWN : keyTypes[i]);
      } else if (column.type().kind() == TypeKind.NULL && keyTypes[i] != null) {
        column = column.withType(keyTypes[i]);
      }
      columns.add(placeholder ? column.asNullable() : column);
    }
    for (int i = 0; i < aggregates.size(); i++) {
      columns.add(Column.of(aggregates.get(i).toString(),
          aggregateTypes[i] == null ? SqlType.UNKNOWN : aggregateTypes[i]));
    }
    columns.add(new Column(GROUPING_ID, SqlType.INT64, false, null));
    return new Schema(columns);
  }

  private record GroupKey(int setIndex, RowKey values) {
  }

  private static final class GroupState {
    private final List<Value> keyValues;
    private final int setIndex;
    private final Accumulator[] accumulators;
    private final List<Set<RowKey>> distinctSeen;

    GroupState(List<Value> keyValues, int setIndex, List<AggregateFunction> functions, EvaluationContext ctx) {
      this.keyValues = List.copyOf(keyValues);
      this.setIndex = setIndex;
      this.accumulators = new Accumulator[functions.size()];
      this.distinctSeen = new ArrayList<>(functions.size());
      for (int i = 0; i < functions.size(); i++) {
        accumulators[i] = functions.get(i).init(ctx.collations());
        distinctSeen.add(null);
      }
    }

    void add(List<AggregateCall> aggregates, Bindings bindings, EvaluationContext ctx) {
      for (int i = 0; i < accumulators.length; i++) {
        AggregateCall call = aggregates.get(i);
        if (call.filter() != null && !Expressions.test(call.filter(), bindings, ctx).isTrue()) {
          continue;
        }
        List<Value> arguments = new ArrayList<>(call.arguments().size());
        for (Expression argument : call.arguments()) {
          arguments.add(Expressions.evaluate(argument, bindings, ctx));
        }
        if (call.distinct()) {
          Set<RowKey> seen = distinctSeen.get(i);
          if (seen == null) {
            seen = new HashSet<>();
            distinctSeen.set(i, seen);
          }
          if (!seen.add(RowKey.of(arguments, ctx.collations()))) {
            continue;
          }
        }
        accumulators[i].accumulate(arguments);
      }
    }
  }
}
