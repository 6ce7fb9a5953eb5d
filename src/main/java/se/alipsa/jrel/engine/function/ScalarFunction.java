package se.alipsa.jrel.engine.function;

import java.util.List;
import se.alipsa.jrel.value.Value;

/**
 * A scalar function over already evaluated arguments.
 */
@FunctionalInterface
public interface ScalarFunction {

  /**
   * Apply the function.
   *
   * @param arguments
   *          the argument values
   * @return the result
   */
  Value apply(List<Value> arguments);
}
