package se.alipsa.jrel.engine;

/**
 * Kinds of join between the accumulated left input and the next producer.
 * Semi and anti joins emit only the columns of the preserved side.
 */
public enum JoinKind {
  CROSS, INNER, LEFT, RIGHT, FULL, LEFT_SEMI, LEFT_ANTI, RIGHT_SEMI, RIGHT_ANTI;

  /**
   * Whether the join is driven by the right input, so that the right producer
   * must be evaluated independently of any left row.
   *
   * @return {@code true} for RIGHT, FULL and the right semi and anti joins
   */
  public boolean needsIndependentRight() {
    return this == RIGHT || this == FULL || this == RIGHT_SEMI || this == RIGHT_ANTI;
  }

  /**
   * SQL spelling used in messages.
   *
   * @return the keyword form
   */
  public String sql() {
    return name().replace('_', ' ') + " JOIN";
  }
}
