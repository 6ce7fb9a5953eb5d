package se.alipsa.jrel.value;

import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;

/**
 * Three-valued truth value used by predicates. {@link #UNKNOWN} is the truth
 * value of a comparison involving NULL.
 */
public enum TriBool {
  TRUE, FALSE, UNKNOWN;

  /**
   * Convert a boolean to a definite truth value.
   *
   * @param value
   *          the boolean
   * @return {@link #TRUE} or {@link #FALSE}
   */
  public static TriBool of(boolean value) {
    return value ? TRUE : FALSE;
  }

  /**
   * Interpret a value as a truth value. NULL maps to {@link #UNKNOWN}.
   *
   * @param value
   *          a BOOL or NULL value
   * @return the truth value
   * @throws EvaluationException
   *           if the value is neither BOOL nor NULL
   */
  public static TriBool fromValue(Value value) {
    if (value == null || value.isNull()) {
      return UNKNOWN;
    }
    if (value instanceof Value.Bool b) {
      return of(b.value());
    }
    throw new EvaluationException(ErrorKind.TYPE_MISMATCH, null,
        "Expected BOOL but got " + value.kind());
  }

  /**
   * Kleene conjunction.
   *
   * @param other
   *          the right operand
   * @return the conjunction
   */
  public TriBool and(TriBool other) {
    if (this == FALSE || other == FALSE) {
      return FALSE;
    }
    if (this == UNKNOWN || other == UNKNOWN) {
      return UNKNOWN;
    }
    return TRUE;
  }

  /**
   * Kleene disjunction.
   *
   * @param other
   *          the right operand
   * @return the disjunction
   */
  public TriBool or(TriBool other) {
    if (this == TRUE || other == TRUE) {
      return TRUE;
    }
    if (this == UNKNOWN || other == UNKNOWN) {
      return UNKNOWN;
    }
    return FALSE;
  }

  /**
   * Kleene negation.
   *
   * @return the negation, {@link #UNKNOWN} stays unknown
   */
  public TriBool not() {
    return switch (this) {
      case TRUE -> FALSE;
      case FALSE -> TRUE;
      case UNKNOWN -> UNKNOWN;
    };
  }

  /**
   * Whether this is exactly {@link #TRUE}. Filters keep a row only in that case.
   *
   * @return {@code true} for TRUE
   */
  public boolean isTrue() {
    return this == TRUE;
  }

  /**
   * Convert to a BOOL value, {@link #UNKNOWN} becomes NULL.
   *
   * @return the value
   */
  public Value toValue() {
    return switch (this) {
      case TRUE -> Value.of(true);
      case FALSE -> Value.of(false);
      case UNKNOWN -> Value.NULL;
    };
  }
}
