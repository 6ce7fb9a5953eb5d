package se.alipsa.jrel.engine;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;
import se.alipsa.jrel.model.Column;
import se.alipsa.jrel.model.Row;
import se.alipsa.jrel.model.Schema;
import se.alipsa.jrel.model.Table;
import se.alipsa.jrel.value.SqlType;
import se.alipsa.jrel.value.TypeKind;
import se.alipsa.jrel.value.Value;

/**
 * Materialises the bindings of a WITH clause and evaluates its body.
 *
 * <p>
 * A recursive binding must have the form {@code base UNION [ALL | DISTINCT]
 * recursive}, where only the recursive term references the binding, exactly
 * once and directly in its FROM clause. The recursive term may not aggregate,
 * use windows, DISTINCT, ORDER BY or LIMIT, and the reference may not be on
 * the NULL-padded side of an outer join or the filtered side of a semi or anti
 * join. Evaluation is a loop: the base term seeds the result, then the
 * recursive term is evaluated against the previous iteration's new rows until
 * an iteration adds nothing. An iteration beyond
 * {@code jrel.recursion.maxIterations} that still adds rows aborts with
 * {@link ErrorKind#NON_TERMINATING_RECURSION}.
 * </p>
 */
public final class RecursiveCteEvaluator {

  private static final Logger log = LoggerFactory.getLogger(RecursiveCteEvaluator.class);
  private static final String OPERATOR = "WITH RECURSIVE";

  private RecursiveCteEvaluator() {
  }

  /**
   * Evaluate a WITH query.
   *
   * @param query
   *          the query
   * @param ctx
   *          the evaluation context
   * @return the result of the body
   */
  public static Table evaluate(WithQuery query, EvaluationContext ctx) {
    List<CteBinding> order = evaluationOrder(query.recursive(), query.bindings());
    EvaluationContext scoped = ctx;
    for (CteBinding binding : order) {
      scoped.checkCancelled("WITH");
      Table table;
      if (query.recursive() && CteDependencies.countReferences(binding.query(), binding.name()) > 0) {
        table = iterate(binding, scoped);
      } else {
        table = rename(QueryEvaluator.evaluate(binding.query(), scoped), binding);
      }
      log.debug("CTE {} materialised with {} rows", binding.name(), table.size());
      scoped = scoped.withCte(binding.name(), table);
    }
    return QueryEvaluator.evaluate(query.body(), scoped);
  }

  /**
   * Validate the bindings of a WITH clause and order them for evaluation.
   * Plain WITH keeps declaration order; WITH RECURSIVE orders bindings after
   * the bindings they reference.
   *
   * @param recursive
   *          whether the clause is WITH RECURSIVE
   * @param bindings
   *          the bindings in declaration order
   * @return the evaluation order
   * @throws EvaluationException
   *           ({@link ErrorKind#INVALID_PLAN}) for duplicate names,
   *           ({@link ErrorKind#INVALID_RECURSIVE_SHAPE}) for an invalid
   *           recursive binding or cyclic references
   */
  public static List<CteBinding> evaluationOrder(boolean recursive, List<CteBinding> bindings) {
    Set<String> names = new HashSet<>();
    for (CteBinding binding : bindings) {
      if (!names.add(binding.name().toLowerCase(Locale.ROOT))) {
        throw new EvaluationException(ErrorKind.INVALID_PLAN, "WITH",
            "Duplicate common table expression name '" + binding.name() + "'");
      }
    }
    if (!recursive) {
      return bindings;
    }
    for (CteBinding binding : bindings) {
      validate(binding);
    }
    return CteDependencies.topologicalOrder(bindings);
  }

  /**
   * Check the shape of a binding of a WITH RECURSIVE clause. Bindings without a
   * self reference are accepted as they are.
   *
   * @param binding
   *          the binding
   * @throws EvaluationException
   *           ({@link ErrorKind#INVALID_RECURSIVE_SHAPE}) for a misplaced or
   *           repeated self reference
   */
  public static void validate(CteBinding binding) {
    String name = binding.name();
    if (CteDependencies.countReferences(binding.query(), name) == 0) {
      return;
    }
    if (!(binding.query() instanceof SetOperationQuery union) || union.operator() != SetOperator.UNION
        || !union.matching().isPositional()) {
      throw shape(name, "a recursive query must be 'base UNION [ALL | DISTINCT] recursive term'");
    }
    if (!union.orderBy().isEmpty() || union.limit() != null || union.offset() > 0) {
      throw shape(name, "ORDER BY and LIMIT are not allowed on a recursive union");
    }
    if (CteDependencies.countReferences(union.left(), name) > 0) {
      throw shape(name, "the base term may not reference the recursive query");
    }
    if (!(union.right() instanceof SelectQuery term)) {
      throw shape(name, "the recursive term must be a single SELECT");
    }
    int references = CteDependencies.countReferences(term, name);
    if (references > 1) {
      throw shape(name, "the recursive term references the recursive query " + references + " times");
    }
    if (term.isAggregating()) {
      throw shape(name, "aggregation is not allowed in the recursive term");
    }
    if (!term.windows().isEmpty()) {
      throw shape(name, "window functions are not allowed in the recursive term");
    }
    if (term.distinct()) {
      throw shape(name, "SELECT DISTINCT is not allowed in the recursive term");
    }
    if (!term.orderBy().isEmpty() || term.limit() != null || term.offset() > 0) {
      throw shape(name, "ORDER BY and LIMIT are not allowed in the recursive term");
    }
    if (!inFromPosition(term.from(), name)) {
      throw shape(name, "the recursive reference must appear directly in the FROM clause of the recursive term");
    }
  }

  private static boolean inFromPosition(RowProducer producer, String name) {
    if (producer == null) {
      return false;
    }
    if (producer instanceof CteScan scan) {
      return scan.name().equalsIgnoreCase(name);
    }
    if (!(producer instanceof FromClause from)) {
      return false;
    }
    boolean leftHasSelf = inFromPosition(from.first(), name);
    if (!leftHasSelf && CteDependencies.countReferences(from.first(), name) > 0) {
      return false;
    }
    for (JoinStep step : from.steps()) {
      boolean rightHasSelf = inFromPosition(step.right(), name);
      if (!rightHasSelf && CteDependencies.countReferences(step.right(), name) > 0) {
        return false;
      }
      boolean forbidden = switch (step.kind()) {
        case FULL -> leftHasSelf || rightHasSelf;
        case LEFT, LEFT_SEMI, LEFT_ANTI -> rightHasSelf;
        case RIGHT, RIGHT_SEMI, RIGHT_ANTI -> leftHasSelf;
        default -> false;
      };
      if (forbidden) {
        throw shape(name, "the recursive reference is not allowed on this side of " + step.kind().sql());
      }
      leftHasSelf |= rightHasSelf;
    }
    return leftHasSelf;
  }

  private static Table iterate(CteBinding binding, EvaluationContext ctx) {
    SetOperationQuery union = (SetOperationQuery) binding.query();
    int maxIterations = ctx.options().maxRecursionIterations();
    RecursiveState state = new RecursiveState(union.quantifier() == SetQuantifier.DISTINCT, ctx.collations());
    Table base = rename(QueryEvaluator.evaluate(union.left(), ctx), binding);
    state.seed(new Table(base.schema().asNullable(), base.rows()));
    log.debug("{}: base term produced {} rows", binding.name(), base.size());
    while (!state.workingTable().rows().isEmpty()) {
      int iteration = state.nextIteration();
      ctx.checkCancelled(OPERATOR);
      Table produced = QueryEvaluator.evaluate(union.right(), ctx.withCte(binding.name(), state.workingTable()));
      List<Row> fresh = state.admit(conform(produced, state, binding.name(), ctx));
      if (fresh.isEmpty()) {
        break;
      }
      if (iteration > maxIterations) {
        throw new EvaluationException(ErrorKind.NON_TERMINATING_RECURSION, OPERATOR,
            "Recursive query '" + binding.name() + "' still produced rows after " + maxIterations
                + " iterations");
      }
      state.append(fresh);
      log.debug("{}: iteration {} added {} rows", binding.name(), iteration, fresh.size());
    }
    log.debug("{}: fixpoint reached after {} iteration(s)", binding.name(), state.iteration());
    return state.terminate();
  }

  private static List<Row> conform(Table produced, RecursiveState state, String name, EvaluationContext ctx) {
    Schema schema = state.schema();
    if (produced.schema().size() != schema.size()) {
      throw new EvaluationException(ErrorKind.COLUMN_SET_MISMATCH, OPERATOR, "Recursive term of '" + name
          + "' produces " + produced.schema().size() + " columns but the base term has " + schema.size());
    }
    List<Column> columns = new ArrayList<>(schema.columns());
    boolean retyped = false;
    for (int i = 0; i < columns.size(); i++) {
      SqlType producedType = produced.schema().column(i).type();
      if (columns.get(i).type().kind() == TypeKind.NULL && producedType.kind() != TypeKind.NULL) {
        columns.set(i, columns.get(i).withType(producedType));
        retyped = true;
      }
    }
    if (retyped) {
      state.retype(new Schema(columns));
    }
    List<Row> rows = new ArrayList<>(produced.size());
    for (Row row : produced.rows()) {
      List<Value> values = new ArrayList<>(row.size());
      for (int i = 0; i < row.size(); i++) {
        values.add(ctx.coercion().coerce(row.get(i), columns.get(i).type()));
      }
      rows.add(new Row(values));
    }
    return rows;
  }

  private static Table rename(Table table, CteBinding binding) {
    List<String> aliases = binding.columnAliases();
    List<Column> columns = new ArrayList<>(table.schema().size());
    if (!aliases.isEmpty() && aliases.size() != table.schema().size()) {
      throw new EvaluationException(ErrorKind.INVALID_PLAN, "WITH", "'" + binding.name() + "' declares "
          + aliases.size() + " column names but its query produces " + table.schema().size() + " columns");
    }
    for (int i = 0; i < table.schema().size(); i++) {
      Column column = table.schema().column(i);
      String columnName = aliases.isEmpty() ? column.name() : aliases.get(i);
      columns.add(new Column(columnName, column.type(), column.nullable(), null));
    }
    return new Table(new Schema(columns), table.rows());
  }

  private static EvaluationException shape(String name, String message) {
    return new EvaluationException(ErrorKind.INVALID_RECURSIVE_SHAPE, OPERATOR,
        "Invalid recursive query '" + name + "': " + message);
  }
}
