package se.alipsa.jrel;

import java.sql.SQLException;
import java.util.Objects;

/**
 * Structured failure raised while validating or evaluating a query plan. The
 * evaluation that raised it is aborted and no partial output is returned.
 */
public class EvaluationException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;
  private final String operator;

  /**
   * Create a new exception.
   *
   * @param kind
   *          the error classification
   * @param operator
   *          the operator that raised the error (e.g. {@code JOIN}), may be
   *          {@code null} when not attributable
   * @param message
   *          human readable description
   */
  public EvaluationException(ErrorKind kind, String operator, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.operator = operator;
  }

  /**
   * Create a new exception with a cause.
   *
   * @param kind
   *          the error classification
   * @param operator
   *          the operator that raised the error, may be {@code null}
   * @param message
   *          human readable description
   * @param cause
   *          the underlying failure
   */
  public EvaluationException(ErrorKind kind, String operator, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.operator = operator;
  }

  /**
   * The error classification.
   *
   * @return the kind of failure
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Name of the offending operator.
   *
   * @return operator name or {@code null}
   */
  public String operator() {
    return operator;
  }

  /**
   * Translate this failure for JDBC style callers.
   *
   * @return an equivalent {@link SQLException} carrying the SQLSTATE of the kind
   */
  public SQLException toSqlException() {
    return new SQLException(getMessage(), kind.sqlState(), this);
  }

  @Override
  public String getMessage() {
    String message = super.getMessage();
    return operator == null ? kind + ": " + message : kind + " in " + operator + ": " + message;
  }
}
