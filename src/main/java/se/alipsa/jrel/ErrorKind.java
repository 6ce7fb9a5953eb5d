package se.alipsa.jrel;

/**
 * Classification of the failures an evaluation can surface to its caller.
 */
public enum ErrorKind {
  /** Operands or columns have no common type, or an operator does not apply to a type. */
  TYPE_MISMATCH("42804"),
  /** Two strings carry different explicit collations. */
  COLLATION_CONFLICT("42P21"),
  /** A join sequence violates a structural rule (LATERAL placement, comma join before RIGHT/FULL). */
  INVALID_JOIN_SHAPE("42601"),
  /** A recursive common table expression is malformed or CTEs reference each other cyclically. */
  INVALID_RECURSIVE_SHAPE("42P19"),
  /** Name based set operation inputs cannot be reconciled. */
  COLUMN_SET_MISMATCH("42601"),
  /** Raised by the scalar function library. */
  DIVISION_BY_ZERO("22012"),
  /** Raised by the scalar function library. */
  INDEX_OUT_OF_RANGE("2202E"),
  /** The recursive CTE iteration cap was exceeded. */
  NON_TERMINATING_RECURSION("54001"),
  /** A malformed argument such as a LIKE pattern, a collation specification or a configuration value. */
  INVALID_ARGUMENT("22023"),
  /** The plan references something that does not exist or combines clauses in an unsupported way. */
  INVALID_PLAN("42000"),
  /** The caller aborted the evaluation. */
  CANCELLED("57014");

  private final String sqlState;

  ErrorKind(String sqlState) {
    this.sqlState = sqlState;
  }

  /**
   * The SQLSTATE code reported when this error is translated into a
   * {@link java.sql.SQLException}.
   *
   * @return five character SQLSTATE
   */
  public String sqlState() {
    return sqlState;
  }
}
