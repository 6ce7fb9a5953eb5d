package jrel.value;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;
import se.alipsa.jrel.value.CollationContext;
import se.alipsa.jrel.value.ComparisonOperator;
import se.alipsa.jrel.value.TriBool;
import se.alipsa.jrel.value.Value;
import se.alipsa.jrel.value.ValueComparator;

class ValueComparatorTest {

  private static final CollationContext BINARY = CollationContext.BINARY;

  @Test
  void everyComparisonWithNullIsUnknown() {
    for (ComparisonOperator op : ComparisonOperator.values()) {
      assertEquals(TriBool.UNKNOWN, ValueComparator.comparison(op, Value.NULL, Value.of(1L), BINARY), op.symbol());
      assertEquals(TriBool.UNKNOWN, ValueComparator.comparison(op, Value.of(1L), Value.NULL, BINARY), op.symbol());
      assertEquals(TriBool.UNKNOWN, ValueComparator.comparison(op, Value.NULL, Value.NULL, BINARY), op.symbol());
    }
  }

  @Test
  void isDistinctFromTreatsNullAsAValue() {
    assertFalse(ValueComparator.isDistinctFrom(Value.NULL, Value.NULL, BINARY));
    assertTrue(ValueComparator.isDistinctFrom(Value.NULL, Value.of(1L), BINARY));
    assertTrue(ValueComparator.isDistinctFrom(Value.of("a"), Value.NULL, BINARY));
    assertFalse(ValueComparator.isDistinctFrom(Value.of("a"), Value.of("a"), BINARY));
    assertTrue(ValueComparator.isDistinctFrom(Value.of("a"), Value.of("b"), BINARY));
  }

  @Test
  void dateGroupsWithTheDatetimeAtItsMidnight() {
    Value date = new Value.Date(LocalDate.of(2020, 1, 1));
    Value midnight = new Value.Datetime(LocalDateTime.of(2020, 1, 1, 0, 0));
    Value noon = new Value.Datetime(LocalDateTime.of(2020, 1, 1, 12, 0));
    assertFalse(ValueComparator.isDistinctFrom(date, midnight, BINARY));
    assertEquals(ValueComparator.groupingKey(date, BINARY), ValueComparator.groupingKey(midnight, BINARY));
    assertNotEquals(ValueComparator.groupingKey(date, BINARY), ValueComparator.groupingKey(noon, BINARY));
  }

  @Test
  void numericKindsCompareAcrossTypes() {
    assertEquals(TriBool.TRUE, ValueComparator.equals3vl(Value.of(2L), Value.of(2.0), BINARY));
    assertEquals(TriBool.TRUE, ValueComparator.equals3vl(Value.of(new BigDecimal("2.50")), Value.of(2.5), BINARY));
    assertEquals(TriBool.TRUE, ValueComparator.comparison(ComparisonOperator.LT, Value.of(1L),
        Value.of(new BigDecimal("1.1")), BINARY));
  }

  @Test
  void nanIsUnequalToEverythingButNotDistinctFromItself() {
    Value nan = Value.of(Double.NaN);
    assertEquals(TriBool.FALSE, ValueComparator.equals3vl(nan, nan, BINARY));
    assertEquals(TriBool.TRUE, ValueComparator.comparison(ComparisonOperator.NE, nan, nan, BINARY));
    assertEquals(TriBool.FALSE, ValueComparator.comparison(ComparisonOperator.LT, nan, Value.of(1.0), BINARY));
    assertFalse(ValueComparator.isDistinctFrom(nan, nan, BINARY));
    assertTrue(ValueComparator.isDistinctFrom(nan, Value.of(1.0), BINARY));
  }

  @Test
  void nanSortsBeforeOtherNumbersAndNullBeforeNan() {
    Value nan = Value.of(Double.NaN);
    assertTrue(ValueComparator.orderingCompare(nan, Value.of(Double.NEGATIVE_INFINITY), BINARY) < 0);
    assertTrue(ValueComparator.orderingCompare(Value.NULL, nan, BINARY) < 0);
    assertEquals(0, ValueComparator.orderingCompare(nan, nan, BINARY));
  }

  @Test
  void structEqualityIsFieldwiseThreeValued() {
    Value a = Value.struct(Value.field("x", Value.of(1L)), Value.field("y", Value.of("b")));
    Value same = Value.struct(Value.field("p", Value.of(1L)), Value.field("q", Value.of("b")));
    Value other = Value.struct(Value.field("x", Value.of(2L)), Value.field("y", Value.NULL));
    Value withNull = Value.struct(Value.field("x", Value.of(1L)), Value.field("y", Value.NULL));
    assertEquals(TriBool.TRUE, ValueComparator.equals3vl(a, same, BINARY), "field names do not matter");
    assertEquals(TriBool.FALSE, ValueComparator.equals3vl(a, other, BINARY), "a definite mismatch wins");
    assertEquals(TriBool.UNKNOWN, ValueComparator.equals3vl(a, withNull, BINARY));
    assertTrue(ValueComparator.isDistinctFrom(a, withNull, BINARY));
    assertFalse(ValueComparator.isDistinctFrom(withNull, withNull, BINARY));
  }

  @Test
  void structsOfDifferentArityAreNotComparable() {
    Value one = Value.struct(Value.field("x", Value.of(1L)));
    Value two = Value.struct(Value.field("x", Value.of(1L)), Value.field("y", Value.of(2L)));
    EvaluationException e = assertThrows(EvaluationException.class, () -> ValueComparator.equals3vl(one, two, BINARY));
    assertEquals(ErrorKind.TYPE_MISMATCH, e.kind());
  }

  @Test
  void orderingOperatorsRejectStructs() {
    Value s = Value.struct(Value.field("x", Value.of(1L)));
    EvaluationException e = assertThrows(EvaluationException.class,
        () -> ValueComparator.comparison(ComparisonOperator.LT, s, s, BINARY));
    assertEquals(ErrorKind.TYPE_MISMATCH, e.kind());
  }

  @Test
  void incompatibleKindsAreATypeMismatch() {
    EvaluationException e = assertThrows(EvaluationException.class,
        () -> ValueComparator.equals3vl(Value.of("1"), Value.of(1L), BINARY));
    assertEquals(ErrorKind.TYPE_MISMATCH, e.kind());
  }

  @Test
  void inIsUnknownWhenNoMatchButANullCandidate() {
    assertEquals(TriBool.TRUE, ValueComparator.in(Value.of(2L), List.of(Value.NULL, Value.of(2L)), BINARY));
    assertEquals(TriBool.UNKNOWN, ValueComparator.in(Value.of(3L), List.of(Value.NULL, Value.of(2L)), BINARY));
    assertEquals(TriBool.FALSE, ValueComparator.in(Value.of(3L), List.of(Value.of(2L)), BINARY));
  }
}
