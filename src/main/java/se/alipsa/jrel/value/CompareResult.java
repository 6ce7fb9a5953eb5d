package se.alipsa.jrel.value;

/**
 * Outcome of comparing two non-null values. {@link #INCOMPARABLE} arises when
 * one side is {@code NaN}.
 */
public enum CompareResult {
  LESS, EQUAL, GREATER, INCOMPARABLE;

  /**
   * Map an integer comparison result.
   *
   * @param cmp
   *          negative, zero or positive
   * @return the corresponding result
   */
  public static CompareResult of(int cmp) {
    if (cmp < 0) {
      return LESS;
    }
    return cmp == 0 ? EQUAL : GREATER;
  }
}
