package se.alipsa.jrel.engine.function;

import java.util.List;
import se.alipsa.jrel.value.Value;

/**
 * Running state of one aggregate over one group.
 */
public interface Accumulator {

  /**
   * Feed the evaluated arguments of one input row.
   *
   * @param arguments
   *          the argument values, empty for {@code COUNT(*)}
   */
  void accumulate(List<Value> arguments);

  /**
   * Produce the aggregate value for the rows seen so far.
   *
   * @return the result, NULL when the aggregate is undefined for the input
   */
  Value result();
}
