package se.alipsa.jrel.engine;

/**
 * Set operators.
 */
public enum SetOperator {
  UNION, INTERSECT, EXCEPT
}
