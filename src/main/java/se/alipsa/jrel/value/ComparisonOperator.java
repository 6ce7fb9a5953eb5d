package se.alipsa.jrel.value;

/**
 * Binary comparison operators.
 */
public enum ComparisonOperator {
  EQ("="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">=");

  private final String symbol;

  ComparisonOperator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  /**
   * Whether the operator only tests equality and is therefore defined for STRUCT
   * and ARRAY operands.
   *
   * @return {@code true} for {@code =} and {@code !=}
   */
  public boolean isEquality() {
    return this == EQ || this == NE;
  }

  /**
   * Apply the operator to a comparison outcome. An incomparable pair (NaN) is
   * only unequal.
   *
   * @param result
   *          the comparison outcome
   * @return the truth value
   */
  public boolean test(CompareResult result) {
    if (result == CompareResult.INCOMPARABLE) {
      return this == NE;
    }
    return switch (this) {
      case EQ -> result == CompareResult.EQUAL;
      case NE -> result != CompareResult.EQUAL;
      case LT -> result == CompareResult.LESS;
      case LE -> result != CompareResult.GREATER;
      case GT -> result == CompareResult.GREATER;
      case GE -> result != CompareResult.LESS;
    };
  }
}
