package se.alipsa.jrel.engine.function;

import se.alipsa.jrel.value.CollationContext;

/**
 * Factory of {@link Accumulator}s for an aggregate function.
 */
@FunctionalInterface
public interface AggregateFunction {

  /**
   * Create a fresh accumulator for one group.
   *
   * @param collations
   *          collation context for aggregates that compare strings
   * @return the accumulator
   */
  Accumulator init(CollationContext collations);
}
