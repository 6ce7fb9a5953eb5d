package se.alipsa.jrel.engine;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import se.alipsa.jrel.EngineOptions;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;
import se.alipsa.jrel.engine.function.BuiltinFunctions;
import se.alipsa.jrel.engine.function.FunctionLibrary;
import se.alipsa.jrel.model.Table;
import se.alipsa.jrel.value.CollationContext;
import se.alipsa.jrel.value.DefaultTypeCoercion;
import se.alipsa.jrel.value.TypeCoercion;

/**
 * Everything an operator needs besides its input rows: collations, the
 * function library, type coercion, options, the enclosing row for correlated
 * evaluation, materialised CTEs and the cancellation flag. Instances are
 * immutable; the {@code with*} methods return modified copies sharing the
 * cancellation flag.
 */
public final class EvaluationContext {

  private final CollationContext collations;
  private final FunctionLibrary functions;
  private final TypeCoercion coercion;
  private final EngineOptions options;
  private final Bindings outer;
  private final Map<String, Table> ctes;
  private final AtomicBoolean cancelled;

  private EvaluationContext(CollationContext collations, FunctionLibrary functions, TypeCoercion coercion,
      EngineOptions options, Bindings outer, Map<String, Table> ctes, AtomicBoolean cancelled) {
    this.collations = Objects.requireNonNull(collations, "collations");
    this.functions = Objects.requireNonNull(functions, "functions");
    this.coercion = Objects.requireNonNull(coercion, "coercion");
    this.options = Objects.requireNonNull(options, "options");
    this.outer = outer;
    this.ctes = ctes;
    this.cancelled = cancelled;
  }

  /**
   * Create a root context.
   *
   * @param collations
   *          collation context
   * @param functions
   *          function library
   * @param coercion
   *          type coercion service
   * @param options
   *          engine options
   * @param cancelled
   *          flag checked between stages
   * @return the context
   */
  public static EvaluationContext create(CollationContext collations, FunctionLibrary functions,
      TypeCoercion coercion, EngineOptions options, AtomicBoolean cancelled) {
    return new EvaluationContext(collations, functions, coercion, options, null, Map.of(), cancelled);
  }

  /**
   * Root context with binary collation, the built-in functions and default
   * options.
   *
   * @return the context
   */
  public static EvaluationContext defaults() {
    return create(CollationContext.BINARY, BuiltinFunctions.defaults(), DefaultTypeCoercion.INSTANCE,
        EngineOptions.defaults(), new AtomicBoolean());
  }

  public CollationContext collations() {
    return collations;
  }

  public FunctionLibrary functions() {
    return functions;
  }

  public TypeCoercion coercion() {
    return coercion;
  }

  public EngineOptions options() {
    return options;
  }

  /**
   * Bindings of the enclosing row.
   *
   * @return the outer bindings or {@code null} at top level
   */
  public Bindings outer() {
    return outer;
  }

  /**
   * Copy with different enclosing bindings.
   *
   * @param bindings
   *          the enclosing row
   * @return the context
   */
  public EvaluationContext withOuter(Bindings bindings) {
    return new EvaluationContext(collations, functions, coercion, options, bindings, ctes, cancelled);
  }

  /**
   * Copy with a CTE bound to a materialised table.
   *
   * @param name
   *          CTE name, case-insensitive
   * @param table
   *          the rows
   * @return the context
   */
  public EvaluationContext withCte(String name, Table table) {
    Map<String, Table> copy = new HashMap<>(ctes);
    copy.put(name.toLowerCase(Locale.ROOT), table);
    return new EvaluationContext(collations, functions, coercion, options, outer, Map.copyOf(copy), cancelled);
  }

  /**
   * Look up a materialised CTE.
   *
   * @param name
   *          the CTE name
   * @return the table
   * @throws EvaluationException
   *           ({@link ErrorKind#INVALID_PLAN}) when no such CTE is in scope
   */
  public Table cte(String name) {
    Table table = ctes.get(name.toLowerCase(Locale.ROOT));
    if (table == null) {
      throw new EvaluationException(ErrorKind.INVALID_PLAN, "WITH", "Unknown table '" + name + "'");
    }
    return table;
  }

  /**
   * Abort when cancellation was requested.
   *
   * @param stage
   *          the stage about to run
   * @throws EvaluationException
   *           ({@link ErrorKind#CANCELLED}) when cancelled
   */
  public void checkCancelled(String stage) {
    if (cancelled.get()) {
      throw new EvaluationException(ErrorKind.CANCELLED, stage, "Query evaluation was cancelled");
    }
  }
}
