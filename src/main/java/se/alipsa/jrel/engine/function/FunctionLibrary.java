package se.alipsa.jrel.engine.function;

/**
 * Lookup of scalar and aggregate functions by name. Errors raised by the
 * returned functions propagate to the caller unchanged.
 */
public interface FunctionLibrary {

  /**
   * Resolve a scalar function.
   *
   * @param name
   *          the function name, case-insensitive
   * @return the function
   * @throws se.alipsa.jrel.EvaluationException
   *           ({@link se.alipsa.jrel.ErrorKind#INVALID_PLAN}) when unknown
   */
  ScalarFunction scalar(String name);

  /**
   * Resolve an aggregate function.
   *
   * @param name
   *          the function name, case-insensitive
   * @return the function
   * @throws se.alipsa.jrel.EvaluationException
   *           ({@link se.alipsa.jrel.ErrorKind#INVALID_PLAN}) when unknown
   */
  AggregateFunction aggregate(String name);
}
