package se.alipsa.jrel.value;

/**
 * Type reconciliation used where two inputs must share a column type, such as
 * the paired columns of a set operation.
 */
public interface TypeCoercion {

  /**
   * Find the narrowest type both arguments widen to.
   *
   * @param left
   *          left type
   * @param right
   *          right type
   * @return the common supertype
   * @throws se.alipsa.jrel.EvaluationException
   *           ({@link se.alipsa.jrel.ErrorKind#TYPE_MISMATCH}) when none exists
   */
  SqlType commonSupertype(SqlType left, SqlType right);

  /**
   * Convert a value to the target type.
   *
   * @param value
   *          the value, NULL stays NULL
   * @param target
   *          a type the value's type widens to
   * @return the converted value
   * @throws se.alipsa.jrel.EvaluationException
   *           ({@link se.alipsa.jrel.ErrorKind#TYPE_MISMATCH}) when no
   *           conversion exists
   */
  Value coerce(Value value, SqlType target);
}
