package se.alipsa.jrel;

import java.text.Collator;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jrel.engine.EvaluationContext;
import se.alipsa.jrel.engine.QueryEvaluator;
import se.alipsa.jrel.engine.QueryPlan;
import se.alipsa.jrel.engine.function.BuiltinFunctions;
import se.alipsa.jrel.engine.function.FunctionLibrary;
import se.alipsa.jrel.model.Table;
import se.alipsa.jrel.value.Collation;
import se.alipsa.jrel.value.CollationContext;
import se.alipsa.jrel.value.DefaultTypeCoercion;

/**
 * Entry point for evaluating query plans.
 *
 * <p>
 * An engine holds the options, function library and collations shared by all
 * queries it runs. Each call to {@link #execute(QueryPlan)} evaluates the plan
 * to a fully materialised {@link Table}; {@link #cancel()} aborts every query
 * currently running on this engine at its next stage boundary.
 * </p>
 */
public class QueryEngine {

  private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);

  private final EngineOptions options;
  private final FunctionLibrary functions;
  private volatile CollationContext collations;
  private final Set<AtomicBoolean> running = ConcurrentHashMap.newKeySet();

  /** Engine configured from {@code jrel.properties} and system properties. */
  public QueryEngine() {
    this(EngineOptions.load());
  }

  /**
   * Engine with the built-in functions.
   *
   * @param options
   *          the options
   */
  public QueryEngine(EngineOptions options) {
    this(options, BuiltinFunctions.defaults(),
        CollationContext.withDefault(Collation.parse(Objects.requireNonNull(options, "options").defaultCollation())));
  }

  /**
   * Fully configured engine.
   *
   * @param options
   *          the options
   * @param functions
   *          scalar and aggregate functions
   * @param collations
   *          default and named collations
   */
  public QueryEngine(EngineOptions options, FunctionLibrary functions, CollationContext collations) {
    this.options = Objects.requireNonNull(options, "options");
    this.functions = Objects.requireNonNull(functions, "functions");
    this.collations = Objects.requireNonNull(collations, "collations");
  }

  public EngineOptions options() {
    return options;
  }

  public CollationContext collations() {
    return collations;
  }

  /**
   * Make a named collator available to
   * {@link se.alipsa.jrel.engine.Expressions#collate(se.alipsa.jrel.engine.Expression, String) COLLATE}
   * in subsequent queries.
   *
   * @param name
   *          the collation name
   * @param collator
   *          the comparison rules
   */
  public synchronized void registerCollation(String name, Collator collator) {
    collations = collations.register(name, collator);
  }

  /**
   * Evaluate a plan.
   *
   * @param plan
   *          the plan
   * @return the result rows
   * @throws EvaluationException
   *           when evaluation fails or is cancelled
   */
  public Table execute(QueryPlan plan) {
    Objects.requireNonNull(plan, "plan");
    AtomicBoolean cancelled = new AtomicBoolean();
    running.add(cancelled);
    try {
      EvaluationContext ctx = EvaluationContext.create(collations, functions, DefaultTypeCoercion.INSTANCE, options,
          cancelled);
      long start = System.nanoTime();
      Table result = QueryEvaluator.evaluate(plan, ctx);
      log.debug("Query produced {} rows in {} ms", result.size(), (System.nanoTime() - start) / 1_000_000);
      return result;
    } catch (EvaluationException e) {
      log.debug("Query failed: {}", e.getMessage());
      throw e;
    } finally {
      running.remove(cancelled);
    }
  }

  /**
   * Request cancellation of every query currently executing on this engine.
   * The queries fail with {@link ErrorKind#CANCELLED} before their next stage.
   */
  public void cancel() {
    log.debug("Cancelling {} running queries", running.size());
    running.forEach(flag -> flag.set(true));
  }
}
