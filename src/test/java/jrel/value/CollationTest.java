package jrel.value;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.text.Collator;
import java.util.Locale;
import org.junit.jupiter.api.Test;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;
import se.alipsa.jrel.value.Collation;
import se.alipsa.jrel.value.CollationContext;
import se.alipsa.jrel.value.TriBool;
import se.alipsa.jrel.value.Value;
import se.alipsa.jrel.value.ValueComparator;

class CollationTest {

  @Test
  void blankAndBinarySpecsAreBinary() {
    assertSame(Collation.BINARY, Collation.parse(null));
    assertSame(Collation.BINARY, Collation.parse(" "));
    assertSame(Collation.BINARY, Collation.parse("BINARY"));
  }

  @Test
  void unknownAttributeIsRejected() {
    EvaluationException e = assertThrows(EvaluationException.class, () -> Collation.parse("en:xx"));
    assertEquals(ErrorKind.INVALID_ARGUMENT, e.kind());
  }

  @Test
  void defaultCollationAppliesToUncollatedStrings() {
    CollationContext ci = CollationContext.withDefault(Collation.parse("und:ci"));
    assertEquals(TriBool.TRUE, ValueComparator.equals3vl(Value.of("Hello"), Value.of("hello"), ci));
    assertEquals(TriBool.FALSE,
        ValueComparator.equals3vl(Value.of("Hello"), Value.of("hello"), CollationContext.BINARY));
  }

  @Test
  void explicitCollationWinsOverBinaryOperand() {
    Collation ci = Collation.parse("und:ci");
    assertEquals(TriBool.TRUE,
        ValueComparator.equals3vl(Value.string("A", ci), Value.of("a"), CollationContext.BINARY));
  }

  @Test
  void conflictingExplicitCollationsFail() {
    Value en = Value.string("a", Collation.parse("en:ci"));
    Value sv = Value.string("a", Collation.parse("sv:cs"));
    EvaluationException e = assertThrows(EvaluationException.class,
        () -> ValueComparator.equals3vl(en, sv, CollationContext.BINARY));
    assertEquals(ErrorKind.COLLATION_CONFLICT, e.kind());
  }

  @Test
  void registeredCollatorsAreFoundByName() {
    Collator collator = Collator.getInstance(Locale.ROOT);
    collator.setStrength(Collator.PRIMARY);
    CollationContext ctx = CollationContext.BINARY.register("loose", collator);
    Collation loose = ctx.lookup("LOOSE");
    assertEquals("loose", loose.name());
    assertTrue(loose.equal("é", "E"));
  }
}
