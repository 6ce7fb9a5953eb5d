package se.alipsa.jrel.engine;

/**
 * Duplicate handling of a set operation. {@code ALL} keeps multiplicities,
 * {@code DISTINCT} caps each row at one occurrence.
 */
public enum SetQuantifier {
  ALL, DISTINCT
}
