package se.alipsa.jrel.value;

/**
 * The closed set of value and type variants understood by the engine.
 */
public enum TypeKind {
  /** The type of a bare NULL; resolves to any other type during coercion. */
  NULL,
  BOOL,
  INT64,
  FLOAT64,
  NUMERIC,
  STRING,
  BYTES,
  DATE,
  TIME,
  DATETIME,
  TIMESTAMP,
  INTERVAL,
  ARRAY,
  STRUCT,
  JSON;

  /**
   * Determine whether the kind is one of the numeric kinds.
   *
   * @return {@code true} for INT64, FLOAT64 and NUMERIC
   */
  public boolean isNumeric() {
    return this == INT64 || this == FLOAT64 || this == NUMERIC;
  }

  /**
   * Determine whether the kind denotes a point in time (DATE, DATETIME or
   * TIMESTAMP). TIME has no date component.
   *
   * @return {@code true} for date-bearing temporal kinds
   */
  public boolean isDateBearing() {
    return this == DATE || this == DATETIME || this == TIMESTAMP;
  }
}
