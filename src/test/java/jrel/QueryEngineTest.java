package jrel;

import static jrel.Tables.column;
import static jrel.Tables.row;
import static jrel.Tables.scan;
import static jrel.Tables.table;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static se.alipsa.jrel.engine.Expressions.call;
import static se.alipsa.jrel.engine.Expressions.col;
import static se.alipsa.jrel.engine.Expressions.collate;
import static se.alipsa.jrel.engine.Expressions.eq;
import static se.alipsa.jrel.engine.Expressions.lit;

import java.sql.SQLException;
import java.text.Collator;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Test;
import se.alipsa.jrel.EngineOptions;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;
import se.alipsa.jrel.QueryEngine;
import se.alipsa.jrel.engine.SelectQuery;
import se.alipsa.jrel.engine.function.BuiltinFunctions;
import se.alipsa.jrel.model.Table;
import se.alipsa.jrel.value.CollationContext;
import se.alipsa.jrel.value.Value;

class QueryEngineTest {

  private static final Table NAMES = table("name", row("Anna"), row("anna"), row("Bo"));

  @Test
  void defaultCollationComesFromTheOptions() {
    SelectQuery query = SelectQuery.builder()
        .from(scan(NAMES, "n"))
        .where(eq(col("name"), lit("ANNA")))
        .select(col("name"))
        .build();
    assertEquals(List.of(), column(new QueryEngine(EngineOptions.defaults()).execute(query), "name"));
    QueryEngine ci = new QueryEngine(EngineOptions.builder().defaultCollation("und:ci").build());
    assertEquals(List.of("Anna", "anna"), column(ci.execute(query), "name"));
  }

  @Test
  void distinctUnderACaseInsensitiveCollation() {
    QueryEngine ci = new QueryEngine(EngineOptions.builder().defaultCollation("und:ci").build());
    Table result = ci.execute(SelectQuery.builder().from(scan(NAMES, "n")).select(col("name")).distinct().build());
    assertEquals(List.of("Anna", "Bo"), column(result, "name"));
  }

  @Test
  void registeredCollationsAreUsable() {
    QueryEngine engine = new QueryEngine(EngineOptions.defaults());
    Collator collator = Collator.getInstance(Locale.ROOT);
    collator.setStrength(Collator.PRIMARY);
    engine.registerCollation("loose", collator);
    Value loose = Value.string("ANNA", engine.collations().lookup("loose"));
    Table result = engine.execute(SelectQuery.builder()
        .from(scan(NAMES, "n"))
        .where(eq(col("name"), lit(loose)))
        .select(col("name"))
        .build());
    assertEquals(List.of("Anna", "anna"), column(result, "name"));
  }

  @Test
  void collateResolvesRegisteredCollations() {
    QueryEngine engine = new QueryEngine(EngineOptions.defaults());
    Collator collator = Collator.getInstance(Locale.ROOT);
    collator.setStrength(Collator.PRIMARY);
    engine.registerCollation("loose", collator);
    Table result = engine.execute(SelectQuery.builder()
        .from(scan(NAMES, "n"))
        .where(eq(collate(col("name"), "loose"), lit("ANNA")))
        .selectAs(collate(col("name"), "und:ci"), "name")
        .build());
    assertEquals(List.of("Anna", "anna"), column(result, "name"));
  }

  @Test
  void concurrentRegistrationsAreAllKept() throws InterruptedException {
    QueryEngine engine = new QueryEngine(EngineOptions.defaults());
    Collator collator = Collator.getInstance(Locale.ROOT);
    collator.setStrength(Collator.PRIMARY);
    Thread[] threads = new Thread[8];
    for (int t = 0; t < threads.length; t++) {
      int id = t;
      threads[t] = new Thread(() -> {
        for (int i = 0; i < 50; i++) {
          engine.registerCollation("loose_" + id + "_" + i, collator);
        }
      });
      threads[t].start();
    }
    for (Thread thread : threads) {
      thread.join();
    }
    for (int t = 0; t < threads.length; t++) {
      for (int i = 0; i < 50; i++) {
        assertTrue(engine.collations().lookup("loose_" + t + "_" + i).equal("e", "\u00e9"));
      }
    }
  }

  @Test
  void collateRejectsNonStrings() {
    QueryEngine engine = new QueryEngine(EngineOptions.defaults());
    EvaluationException e = assertThrows(EvaluationException.class, () -> engine.execute(SelectQuery.builder()
        .from(scan(NAMES, "n"))
        .select(collate(lit(1L), "und:ci"))
        .build()));
    assertEquals(ErrorKind.TYPE_MISMATCH, e.kind());
  }

  @Test
  void cancelAbortsARunningQuery() {
    QueryEngine[] holder = new QueryEngine[1];
    BuiltinFunctions functions = BuiltinFunctions.defaults().withScalar("STOP", args -> {
      holder[0].cancel();
      return Value.of(true);
    });
    QueryEngine engine = new QueryEngine(EngineOptions.defaults(), functions, CollationContext.BINARY);
    holder[0] = engine;
    SelectQuery stopping = SelectQuery.builder()
        .from(scan(NAMES, "n"))
        .where(call("STOP"))
        .select(col("name"))
        .build();
    EvaluationException e = assertThrows(EvaluationException.class, () -> engine.execute(stopping));
    assertEquals(ErrorKind.CANCELLED, e.kind());
    SQLException sql = e.toSqlException();
    assertEquals(ErrorKind.CANCELLED.sqlState(), sql.getSQLState());

    Table next = engine.execute(SelectQuery.builder().from(scan(NAMES, "n")).select(col("name")).build());
    assertEquals(3, next.size());
  }
}
