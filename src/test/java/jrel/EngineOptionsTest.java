package jrel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Properties;
import org.junit.jupiter.api.Test;
import se.alipsa.jrel.EngineOptions;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;

class EngineOptionsTest {

  @Test
  void defaults() {
    EngineOptions options = EngineOptions.defaults();
    assertEquals(EngineOptions.DEFAULT_MAX_ITERATIONS, options.maxRecursionIterations());
    assertEquals("", options.defaultCollation());
    assertTrue(options.memoizeCorrelated());
  }

  @Test
  void loadReadsTheBundledProperties() {
    EngineOptions options = EngineOptions.load();
    assertEquals(500, options.maxRecursionIterations());
  }

  @Test
  void propertiesOverrideDefaults() {
    Properties props = new Properties();
    props.setProperty(EngineOptions.MAX_ITERATIONS_KEY, " 42 ");
    props.setProperty(EngineOptions.DEFAULT_COLLATION_KEY, "und:ci");
    props.setProperty(EngineOptions.MEMOIZE_CORRELATED_KEY, "FALSE");
    EngineOptions options = EngineOptions.fromProperties(props);
    assertEquals(42, options.maxRecursionIterations());
    assertEquals("und:ci", options.defaultCollation());
    assertFalse(options.memoizeCorrelated());
  }

  @Test
  void invalidPropertiesFallBackToDefaults() {
    Properties props = new Properties();
    props.setProperty(EngineOptions.MAX_ITERATIONS_KEY, "-1");
    props.setProperty(EngineOptions.DEFAULT_COLLATION_KEY, "en:weird");
    props.setProperty(EngineOptions.MEMOIZE_CORRELATED_KEY, "maybe");
    EngineOptions options = EngineOptions.fromProperties(props);
    assertEquals(EngineOptions.defaults().toString(), options.toString());
  }

  @Test
  void builderRejectsNonPositiveCap() {
    EvaluationException e = assertThrows(EvaluationException.class,
        () -> EngineOptions.builder().maxRecursionIterations(0));
    assertEquals(ErrorKind.INVALID_ARGUMENT, e.kind());
  }
}
