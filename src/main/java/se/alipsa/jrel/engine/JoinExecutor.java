package se.alipsa.jrel.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;
import se.alipsa.jrel.model.Column;
import se.alipsa.jrel.model.Row;
import se.alipsa.jrel.model.Schema;
import se.alipsa.jrel.model.Table;
import se.alipsa.jrel.value.SqlType;
import se.alipsa.jrel.value.TriBool;
import se.alipsa.jrel.value.TypeKind;
import se.alipsa.jrel.value.Value;
import se.alipsa.jrel.value.ValueComparator;

/**
 * Eager, in-memory evaluation of the joins of a {@link FromClause}.
 *
 * <p>
 * Each step combines the rows accumulated so far with the rows of the next
 * producer. INNER, CROSS, LEFT and the left semi and anti joins are driven by
 * the left rows, which also lets the right producer be re-evaluated per left
 * row when it is correlated. RIGHT and the right semi and anti joins are driven
 * by the right rows and FULL keeps match flags for both sides. A condition that
 * evaluates to UNKNOWN does not match.
 * </p>
 *
 * <p>
 * {@code USING} columns come first in the output, followed by the remaining
 * left and right columns. Their value is taken from the left row for INNER and
 * LEFT joins, from the right row for RIGHT joins and from the first non-null
 * side for FULL joins.
 * </p>
 */
public final class JoinExecutor {

  private static final Logger log = LoggerFactory.getLogger(JoinExecutor.class);

  private JoinExecutor() {
  }

  /**
   * Evaluate a FROM clause.
   *
   * @param from
   *          the clause
   * @param ctx
   *          the evaluation context
   * @return the joined rows
   */
  public static Table execute(FromClause from, EvaluationContext ctx) {
    Table current = from.first().produce(ctx);
    for (JoinStep step : from.steps()) {
      ctx.checkCancelled(step.kind().sql());
      int leftSize = current.size();
      current = join(current, step, ctx);
      log.debug("{} ({}): {} left rows -> {} rows", step.kind().sql(), step.isCorrelated() ? "correlated"
          : "independent", leftSize, current.size());
    }
    return current;
  }

  /**
   * Apply one join step.
   *
   * @param left
   *          the rows accumulated so far
   * @param step
   *          the join
   * @param ctx
   *          the evaluation context
   * @return the combined rows
   */
  public static Table join(Table left, JoinStep step, EvaluationContext ctx) {
    RightSide right = step.isCorrelated() ? new CorrelatedRight(step.right(), left.schema(), ctx)
        : new IndependentRight(step.right().produce(ctx));
    Schema rightSchema = right.schema(left);
    Matcher matcher = matcher(step, left.schema(), rightSchema, ctx);
    return switch (step.kind()) {
      case RIGHT, RIGHT_SEMI, RIGHT_ANTI -> rightDriven(left, right.rows(null), step.kind(), matcher);
      case FULL -> fullOuter(left, right.rows(null), matcher);
      default -> leftDriven(left, right, step.kind(), matcher);
    };
  }

  private static Table leftDriven(Table left, RightSide right, JoinKind kind, Matcher matcher) {
    List<Row> results = new ArrayList<>();
    for (Row leftRow : left.rows()) {
      boolean matched = false;
      for (Row rightRow : right.rows(leftRow)) {
        if (matcher.matches(leftRow, rightRow)) {
          matched = true;
          if (kind == JoinKind.LEFT_SEMI) {
            break;
          }
          if (kind != JoinKind.LEFT_ANTI) {
            results.add(matcher.combine(leftRow, rightRow));
          }
        }
      }
      if (kind == JoinKind.LEFT_SEMI && matched || kind == JoinKind.LEFT_ANTI && !matched) {
        results.add(leftRow);
      } else if (kind == JoinKind.LEFT && !matched) {
        results.add(matcher.combine(leftRow, null));
      }
    }
    return new Table(matcher.output(), results);
  }

  private static Table rightDriven(Table left, List<Row> rightRows, JoinKind kind, Matcher matcher) {
    List<Row> results = new ArrayList<>();
    for (Row rightRow : rightRows) {
      boolean matched = false;
      for (Row leftRow : left.rows()) {
        if (matcher.matches(leftRow, rightRow)) {
          matched = true;
          if (kind == JoinKind.RIGHT_SEMI) {
            break;
          }
          if (kind == JoinKind.RIGHT) {
            results.add(matcher.combine(leftRow, rightRow));
          }
        }
      }
      if (kind == JoinKind.RIGHT_SEMI && matched || kind == JoinKind.RIGHT_ANTI && !matched) {
        results.add(rightRow);
      } else if (kind == JoinKind.RIGHT && !matched) {
        results.add(matcher.combine(null, rightRow));
      }
    }
    return new Table(matcher.output(), results);
  }

  private static Table fullOuter(Table left, List<Row> rightRows, Matcher matcher) {
    List<Row> results = new ArrayList<>();
    List<Row> leftRows = left.rows();
    boolean[] leftMatched = new boolean[leftRows.size()];
    boolean[] rightMatched = new boolean[rightRows.size()];
    for (int li = 0; li < leftRows.size(); li++) {
      for (int ri = 0; ri < rightRows.size(); ri++) {
        if (matcher.matches(leftRows.get(li), rightRows.get(ri))) {
          results.add(matcher.combine(leftRows.get(li), rightRows.get(ri)));
          leftMatched[li] = true;
          rightMatched[ri] = true;
        }
      }
    }
    for (int li = 0; li < leftRows.size(); li++) {
      if (!leftMatched[li]) {
        results.add(matcher.combine(leftRows.get(li), null));
      }
    }
    for (int ri = 0; ri < rightRows.size(); ri++) {
      if (!rightMatched[ri]) {
        results.add(matcher.combine(null, rightRows.get(ri)));
      }
    }
    return new Table(matcher.output(), results);
  }

  private static Matcher matcher(JoinStep step, Schema leftSchema, Schema rightSchema, EvaluationContext ctx) {
    JoinCondition condition = step.condition();
    if (condition instanceof JoinCondition.Natural) {
      List<String> common = new ArrayList<>();
      for (Column column : leftSchema.columns()) {
        boolean seen = common.stream().anyMatch(c -> c.equalsIgnoreCase(column.name()));
        if (!seen && rightSchema.indexOf(null, column.name()) >= 0) {
          common.add(column.name());
        }
      }
      condition = common.isEmpty() ? JoinCondition.NONE : new JoinCondition.Using(common);
    }
    if (condition instanceof JoinCondition.Using using) {
      int[] leftIdx = new int[using.columns().size()];
      int[] rightIdx = new int[using.columns().size()];
      for (int i = 0; i < leftIdx.length; i++) {
        String name = using.columns().get(i);
        leftIdx[i] = usingIndex(leftSchema, name, "left");
        rightIdx[i] = usingIndex(rightSchema, name, "right");
      }
      return new Matcher(step.kind(), leftSchema, rightSchema, null, leftIdx, rightIdx, ctx);
    }
    Expression predicate = condition instanceof JoinCondition.On on ? on.predicate() : null;
    return new Matcher(step.kind(), leftSchema, rightSchema, predicate, null, null, ctx);
  }

  private static int usingIndex(Schema schema, String name, String side) {
    int idx = schema.indexOf(null, name);
    if (idx < 0) {
      throw new EvaluationException(ErrorKind.INVALID_PLAN, "USING",
          "USING column '" + name + "' is missing on the " + side + " side; available: " + schema.names());
    }
    return idx;
  }

  /** Right input of a join step. */
  private interface RightSide {

    List<Row> rows(Row leftRow);

    Schema schema(Table left);
  }

  private record IndependentRight(Table table) implements RightSide {

    @Override
    public List<Row> rows(Row leftRow) {
      return table.rows();
    }

    @Override
    public Schema schema(Table left) {
      return table.schema();
    }
  }

  /** Re-evaluates the producer with the left row bound as the enclosing row. */
  private static final class CorrelatedRight implements RightSide {

    private final RowProducer producer;
    private final Scope leftScope;
    private final EvaluationContext ctx;
    private final Map<Row, Table> memo;
    private Schema schema;

    CorrelatedRight(RowProducer producer, Schema leftSchema, EvaluationContext ctx) {
      this.producer = producer;
      this.leftScope = Scope.of(leftSchema);
      this.ctx = ctx;
      this.memo = ctx.options().memoizeCorrelated() ? new HashMap<>() : null;
    }

    @Override
    public List<Row> rows(Row leftRow) {
      return evaluate(leftRow).rows();
    }

    @Override
    public Schema schema(Table left) {
      if (schema == null) {
        Row probe = left.rows().isEmpty() ? Row.nulls(left.schema().size()) : left.rows().get(0);
        schema = evaluate(probe).schema();
      }
      return schema;
    }

    private Table evaluate(Row leftRow) {
      if (memo == null) {
        return produce(leftRow);
      }
      // exact values: 'A' and 'a' are different inputs under a ci collation
      Table cached = memo.get(leftRow);
      if (cached == null) {
        cached = produce(leftRow);
        memo.put(leftRow, cached);
      }
      return cached;
    }

    private Table produce(Row leftRow) {
      Table table = producer.produce(ctx.withOuter(leftScope.bind(leftRow, ctx.outer())));
      if (schema != null && table.schema().size() != schema.size()) {
        if (table.rows().isEmpty()) {
          return new Table(schema, List.of());
        }
        throw new EvaluationException(ErrorKind.INVALID_PLAN, "LATERAL",
            "Correlated join input changed shape from " + schema + " to " + table.schema());
      }
      return table;
    }
  }

  /** Match test and output layout of one join step. */
  private static final class Matcher {

    private final JoinKind kind;
    private final Expression predicate;
    private final int[] leftUsing;
    private final int[] rightUsing;
    private final EvaluationContext ctx;
    private final Scope conditionScope;
    private final int leftWidth;
    private final int rightWidth;
    private final Schema output;

    Matcher(JoinKind kind, Schema leftSchema, Schema rightSchema, Expression predicate, int[] leftUsing,
        int[] rightUsing, EvaluationContext ctx) {
      this.kind = kind;
      this.predicate = predicate;
      this.leftUsing = leftUsing;
      this.rightUsing = rightUsing;
      this.ctx = ctx;
      this.leftWidth = leftSchema.size();
      this.rightWidth = rightSchema.size();
      this.conditionScope = Scope.of(leftSchema.concat(rightSchema));
      this.output = outputSchema(leftSchema, rightSchema);
    }

    Schema output() {
      return output;
    }

    boolean matches(Row leftRow, Row rightRow) {
      if (leftUsing != null) {
        for (int i = 0; i < leftUsing.length; i++) {
          TriBool equal = ValueComparator.equals3vl(leftRow.get(leftUsing[i]), rightRow.get(rightUsing[i]),
              ctx.collations());
          if (!equal.isTrue()) {
            return false;
          }
        }
        return true;
      }
      if (predicate == null) {
        return true;
      }
      Bindings bindings = conditionScope.bind(leftRow.concat(rightRow), ctx.outer());
      return Expressions.test(predicate, bindings, ctx).isTrue();
    }

    Row combine(Row leftRow, Row rightRow) {
      Row l = leftRow == null ? Row.nulls(leftWidth) : leftRow;
      Row r = rightRow == null ? Row.nulls(rightWidth) : rightRow;
      if (leftUsing == null) {
        return l.concat(r);
      }
      List<Value> values = new ArrayList<>(output.size());
      for (int i = 0; i < leftUsing.length; i++) {
        Value lv = l.get(leftUsing[i]);
        Value rv = r.get(rightUsing[i]);
        values.add(switch (kind) {
          case RIGHT -> rv;
          case FULL -> lv.isNull() ? rv : lv;
          default -> lv;
        });
      }
      appendExcept(values, l, leftUsing);
      appendExcept(values, r, rightUsing);
      return new Row(values);
    }

    private static void appendExcept(List<Value> values, Row row, int[] excluded) {
      for (int i = 0; i < row.size(); i++) {
        if (!contains(excluded, i)) {
          values.add(row.get(i));
        }
      }
    }

    private Schema outputSchema(Schema leftSchema, Schema rightSchema) {
      if (kind == JoinKind.LEFT_SEMI || kind == JoinKind.LEFT_ANTI) {
        return leftSchema;
      }
      if (kind == JoinKind.RIGHT_SEMI || kind == JoinKind.RIGHT_ANTI) {
        return rightSchema;
      }
      Schema left = kind == JoinKind.RIGHT || kind == JoinKind.FULL ? leftSchema.asNullable() : leftSchema;
      Schema right = kind == JoinKind.LEFT || kind == JoinKind.FULL ? rightSchema.asNullable() : rightSchema;
      if (leftUsing == null) {
        return left.concat(right);
      }
      List<Column> columns = new ArrayList<>();
      for (int i = 0; i < leftUsing.length; i++) {
        Column lc = leftSchema.column(leftUsing[i]);
        Column rc = rightSchema.column(rightUsing[i]);
        Column owner = kind == JoinKind.RIGHT ? rc : lc;
        SqlType type = owner.type().kind() == TypeKind.NULL ? (owner == lc ? rc : lc).type() : owner.type();
        boolean nullable = kind == JoinKind.FULL ? lc.nullable() && rc.nullable() : owner.nullable();
        columns.add(new Column(owner.name(), type, nullable, null));
      }
      addExcept(columns, left, leftUsing);
      addExcept(columns, right, rightUsing);
      return new Schema(columns);
    }

    private static void addExcept(List<Column> columns, Schema schema, int[] excluded) {
      for (int i = 0; i < schema.size(); i++) {
        if (!contains(excluded, i)) {
          columns.add(schema.column(i));
        }
      }
    }

    private static boolean contains(int[] values, int candidate) {
      for (int v : values) {
        if (v == candidate) {
          return true;
        }
      }
      return false;
    }
  }
}
