package jrel.helper;

import static jrel.Tables.column;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static se.alipsa.jrel.engine.Expressions.col;
import static se.alipsa.jrel.engine.Expressions.field;

import java.io.File;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import org.apache.avro.Schema;
import org.apache.avro.file.DataFileWriter;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;
import se.alipsa.jrel.engine.EvaluationContext;
import se.alipsa.jrel.engine.QueryEvaluator;
import se.alipsa.jrel.engine.SelectQuery;
import se.alipsa.jrel.engine.TableScan;
import se.alipsa.jrel.helper.AvroTables;
import se.alipsa.jrel.model.Table;
import se.alipsa.jrel.value.SqlType;
import se.alipsa.jrel.value.TypeKind;
import se.alipsa.jrel.value.Value;

class AvroTablesTest {

  private static final Schema PERSON = new Schema.Parser().parse("{"
      + "\"type\":\"record\",\"name\":\"Person\",\"fields\":["
      + "{\"name\":\"id\",\"type\":\"long\"},"
      + "{\"name\":\"name\",\"type\":\"string\"},"
      + "{\"name\":\"nickname\",\"type\":[\"null\",\"string\"],\"default\":null},"
      + "{\"name\":\"born\",\"type\":{\"type\":\"int\",\"logicalType\":\"date\"}},"
      + "{\"name\":\"created\",\"type\":{\"type\":\"long\",\"logicalType\":\"timestamp-millis\"}},"
      + "{\"name\":\"salary\",\"type\":{\"type\":\"bytes\",\"logicalType\":\"decimal\",\"precision\":10,"
      + "\"scale\":2}},"
      + "{\"name\":\"tags\",\"type\":{\"type\":\"array\",\"items\":\"string\"}},"
      + "{\"name\":\"mood\",\"type\":{\"type\":\"enum\",\"name\":\"Mood\",\"symbols\":[\"HAPPY\",\"SAD\"]}},"
      + "{\"name\":\"address\",\"type\":{\"type\":\"record\",\"name\":\"Address\",\"fields\":["
      + "{\"name\":\"city\",\"type\":\"string\"}]}}"
      + "]}");

  @TempDir
  File tempDir;

  private static GenericRecord person(long id, String name, String nickname, String city) {
    GenericRecord address = new GenericData.Record(PERSON.getField("address").schema());
    address.put("city", city);
    GenericRecord record = new GenericData.Record(PERSON);
    record.put("id", id);
    record.put("name", name);
    record.put("nickname", nickname);
    record.put("born", (int) LocalDate.of(1990, 5, 17).toEpochDay());
    record.put("created", 1_700_000_000_000L);
    record.put("salary", ByteBuffer.wrap(new BigDecimal("1234.50").unscaledValue().toByteArray()));
    record.put("tags", new GenericData.Array<>(PERSON.getField("tags").schema(), List.of("a", "b")));
    record.put("mood", new GenericData.EnumSymbol(PERSON.getField("mood").schema(), "HAPPY"));
    record.put("address", address);
    return record;
  }

  @Test
  void schemaMapsAvroTypes() {
    se.alipsa.jrel.model.Schema schema = AvroTables.toSchema(PERSON);
    assertEquals(List.of("id", "name", "nickname", "born", "created", "salary", "tags", "mood", "address"),
        schema.names());
    assertEquals(SqlType.INT64, schema.column(0).type());
    assertFalse(schema.column(1).nullable());
    assertTrue(schema.column(2).nullable());
    assertEquals(SqlType.DATE, schema.column(3).type());
    assertEquals(SqlType.TIMESTAMP, schema.column(4).type());
    assertEquals(SqlType.NUMERIC, schema.column(5).type());
    assertEquals(SqlType.array(SqlType.STRING), schema.column(6).type());
    assertEquals(SqlType.STRING, schema.column(7).type());
    assertEquals(TypeKind.STRUCT, schema.column(8).type().kind());
  }

  @Test
  void recordsBecomeRows() {
    Table table = AvroTables.toTable(PERSON, List.of(person(1L, "ann", null, "Lund")), "p");
    assertEquals(Value.of(1L), table.value(0, "p.id"));
    assertTrue(table.value(0, "nickname").isNull());
    assertEquals(new Value.Date(LocalDate.of(1990, 5, 17)), table.value(0, "born"));
    assertEquals(new Value.Timestamp(Instant.ofEpochMilli(1_700_000_000_000L)), table.value(0, "created"));
    assertEquals(Value.of(new BigDecimal("1234.50")), table.value(0, "salary"));
    assertEquals(Value.array(Value.of("a"), Value.of("b")), table.value(0, "tags"));
    assertEquals(Value.of("HAPPY"), table.value(0, "mood"));
  }

  @Test
  void containerFilesCanBeQueried() throws IOException {
    File file = new File(tempDir, "people.avro");
    try (DataFileWriter<GenericRecord> writer = new DataFileWriter<>(new GenericDatumWriter<>(PERSON))) {
      writer.create(PERSON, file);
      writer.append(person(1L, "ann", "annie", "Lund"));
      writer.append(person(2L, "bo", null, "Malmö"));
    }
    Table people = AvroTables.read(file, "p");
    assertEquals(2, people.size());
    Table result = QueryEvaluator.evaluate(SelectQuery.builder()
        .from(new TableScan(people, null))
        .select(col("name"), col("nickname"))
        .selectAs(field(col("address"), "city"), "city")
        .build(), EvaluationContext.defaults());
    assertEquals(List.of("ann", "bo"), column(result, "name"));
    assertEquals(Arrays.asList("annie", null), column(result, "nickname"));
    assertEquals(List.of("Lund", "Malmö"), column(result, "city"));
  }

  @Test
  void generalUnionsAreNotSupported() {
    Schema union = new Schema.Parser().parse("{\"type\":\"record\",\"name\":\"U\",\"fields\":["
        + "{\"name\":\"v\",\"type\":[\"int\",\"string\"]}]}");
    EvaluationException e = assertThrows(EvaluationException.class, () -> AvroTables.toSchema(union));
    assertEquals(ErrorKind.TYPE_MISMATCH, e.kind());
  }
}
