package se.alipsa.jrel.helper;

import java.io.File;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.file.DataFileReader;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.io.DatumReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;
import se.alipsa.jrel.model.Column;
import se.alipsa.jrel.model.Row;
import se.alipsa.jrel.model.Table;
import se.alipsa.jrel.value.SqlType;
import se.alipsa.jrel.value.Value;

/**
 * Base relations from Avro records. A record schema becomes a table schema with
 * one column per field; nullable unions become nullable columns, the date,
 * time, timestamp and decimal logical types map to the corresponding SQL types,
 * arrays to ARRAY and nested records to STRUCT.
 */
public final class AvroTables {

  private static final Logger log = LoggerFactory.getLogger(AvroTables.class);

  private AvroTables() {
  }

  /**
   * Read an Avro container file.
   *
   * @param file
   *          the file
   * @param alias
   *          column qualifier, may be {@code null}
   * @return the table
   * @throws IOException
   *           if the file cannot be read
   */
  public static Table read(File file, String alias) throws IOException {
    DatumReader<GenericRecord> datumReader = new GenericDatumReader<>();
    List<GenericRecord> records = new ArrayList<>();
    Schema schema;
    try (DataFileReader<GenericRecord> reader = new DataFileReader<>(file, datumReader)) {
      schema = reader.getSchema();
      for (GenericRecord record : reader) {
        records.add(record);
      }
    }
    log.debug("Read {} records from {}", records.size(), file);
    return toTable(schema, records, alias);
  }

  /**
   * Convert records sharing a schema into a table.
   *
   * @param schema
   *          the record schema
   * @param records
   *          the records
   * @param alias
   *          column qualifier, may be {@code null}
   * @return the table
   */
  public static Table toTable(Schema schema, Collection<GenericRecord> records, String alias) {
    se.alipsa.jrel.model.Schema tableSchema = toSchema(schema).withQualifier(alias);
    List<Row> rows = new ArrayList<>(records.size());
    for (GenericRecord record : records) {
      rows.add(toRow(record));
    }
    return new Table(tableSchema, rows);
  }

  /**
   * Convert a record schema to a table schema.
   *
   * @param schema
   *          an Avro RECORD schema
   * @return the columns
   */
  public static se.alipsa.jrel.model.Schema toSchema(Schema schema) {
    if (schema.getType() != Schema.Type.RECORD) {
      throw new EvaluationException(ErrorKind.TYPE_MISMATCH, "AVRO", "Expected a RECORD schema but got "
          + schema.getType());
    }
    List<Column> columns = new ArrayList<>(schema.getFields().size());
    for (Schema.Field field : schema.getFields()) {
      boolean nullable = isNullable(field.schema());
      columns.add(new Column(field.name(), toType(field.schema()), nullable, null));
    }
    return new se.alipsa.jrel.model.Schema(columns);
  }

  /**
   * Map an Avro schema to a SQL type.
   *
   * @param schema
   *          the schema
   * @return the type
   */
  public static SqlType toType(Schema schema) {
    Schema effective = effectiveSchema(schema);
    LogicalType logical = effective.getLogicalType();
    switch (effective.getType()) {
      case NULL:
        return SqlType.UNKNOWN;
      case BOOLEAN:
        return SqlType.BOOL;
      case INT:
        if (logical instanceof LogicalTypes.Date) {
          return SqlType.DATE;
        }
        if (logical instanceof LogicalTypes.TimeMillis) {
          return SqlType.TIME;
        }
        return SqlType.INT64;
      case LONG:
        if (logical instanceof LogicalTypes.TimeMicros) {
          return SqlType.TIME;
        }
        if (logical instanceof LogicalTypes.TimestampMillis || logical instanceof LogicalTypes.TimestampMicros) {
          return SqlType.TIMESTAMP;
        }
        if (logical instanceof LogicalTypes.LocalTimestampMillis
            || logical instanceof LogicalTypes.LocalTimestampMicros) {
          return SqlType.DATETIME;
        }
        return SqlType.INT64;
      case FLOAT:
      case DOUBLE:
        return SqlType.FLOAT64;
      case STRING:
      case ENUM:
        return SqlType.STRING;
      case BYTES:
      case FIXED:
        return logical instanceof LogicalTypes.Decimal ? SqlType.NUMERIC : SqlType.BYTES;
      case ARRAY:
        return SqlType.array(toType(effective.getElementType()));
      case RECORD:
        List<SqlType.StructField> fields = new ArrayList<>();
        for (Schema.Field field : effective.getFields()) {
          fields.add(new SqlType.StructField(field.name(), toType(field.schema())));
        }
        return SqlType.struct(fields);
      default:
        throw new EvaluationException(ErrorKind.TYPE_MISMATCH, "AVRO", "Unsupported Avro type " + effective);
    }
  }

  /**
   * Convert a record to a row.
   *
   * @param record
   *          the record
   * @return one value per field
   */
  public static Row toRow(GenericRecord record) {
    List<Schema.Field> fields = record.getSchema().getFields();
    List<Value> values = new ArrayList<>(fields.size());
    for (Schema.Field field : fields) {
      values.add(toValue(record.get(field.pos()), field.schema()));
    }
    return new Row(values);
  }

  /**
   * Unwrap an Avro datum to a SQL value.
   *
   * @param datum
   *          the datum, may be {@code null}
   * @param schema
   *          its schema
   * @return the value
   */
  public static Value toValue(Object datum, Schema schema) {
    if (datum == null) {
      return Value.NULL;
    }
    Schema effective = effectiveSchema(schema);
    LogicalType logical = effective.getLogicalType();
    switch (effective.getType()) {
      case NULL:
        return Value.NULL;
      case BOOLEAN:
        return Value.of((Boolean) datum);
      case INT:
        int i = ((Number) datum).intValue();
        if (logical instanceof LogicalTypes.Date) {
          return new Value.Date(LocalDate.ofEpochDay(i));
        }
        if (logical instanceof LogicalTypes.TimeMillis) {
          return new Value.Time(LocalTime.ofNanoOfDay(i * 1_000_000L));
        }
        return Value.of((long) i);
      case LONG:
        long l = ((Number) datum).longValue();
        if (logical instanceof LogicalTypes.TimeMicros) {
          return new Value.Time(LocalTime.ofNanoOfDay(l * 1_000L));
        }
        if (logical instanceof LogicalTypes.TimestampMillis) {
          return new Value.Timestamp(Instant.ofEpochMilli(l));
        }
        if (logical instanceof LogicalTypes.TimestampMicros) {
          return new Value.Timestamp(micros(l));
        }
        if (logical instanceof LogicalTypes.LocalTimestampMillis) {
          return new Value.Datetime(LocalDateTime.ofInstant(Instant.ofEpochMilli(l), ZoneOffset.UTC));
        }
        if (logical instanceof LogicalTypes.LocalTimestampMicros) {
          return new Value.Datetime(LocalDateTime.ofInstant(micros(l), ZoneOffset.UTC));
        }
        return Value.of(l);
      case FLOAT:
      case DOUBLE:
        return Value.of(((Number) datum).doubleValue());
      case STRING:
      case ENUM:
        return Value.of(datum.toString());
      case BYTES:
      case FIXED:
        byte[] bytes = datum instanceof GenericData.Fixed fixed ? fixed.bytes().clone()
            : copyBytes((ByteBuffer) datum);
        if (logical instanceof LogicalTypes.Decimal dec) {
          return Value.of(new BigDecimal(new BigInteger(bytes), dec.getScale()));
        }
        return new Value.Bytes(bytes);
      case ARRAY:
        List<Value> elements = new ArrayList<>();
        for (Object element : (Collection<?>) datum) {
          elements.add(toValue(element, effective.getElementType()));
        }
        return new Value.Array(elements);
      case RECORD:
        GenericRecord record = (GenericRecord) datum;
        List<Value.Field> members = new ArrayList<>();
        for (Schema.Field field : effective.getFields()) {
          members.add(new Value.Field(field.name(), toValue(record.get(field.pos()), field.schema())));
        }
        return new Value.Struct(members);
      default:
        throw new EvaluationException(ErrorKind.TYPE_MISMATCH, "AVRO", "Unsupported Avro type " + effective);
    }
  }

  /**
   * Collapse nullable unions to their non-null branch, else return input.
   *
   * @param schema
   *          the schema
   * @return effective schema
   */
  static Schema effectiveSchema(Schema schema) {
    if (schema.getType() != Schema.Type.UNION) {
      return schema;
    }
    List<Schema> branches = new ArrayList<>();
    for (Schema branch : schema.getTypes()) {
      if (branch.getType() != Schema.Type.NULL) {
        branches.add(branch);
      }
    }
    if (branches.size() != 1) {
      throw new EvaluationException(ErrorKind.TYPE_MISMATCH, "AVRO",
          "Only nullable unions of a single type are supported: " + schema);
    }
    return branches.get(0);
  }

  private static boolean isNullable(Schema schema) {
    if (schema.getType() == Schema.Type.NULL) {
      return true;
    }
    return schema.getType() == Schema.Type.UNION
        && schema.getTypes().stream().anyMatch(s -> s.getType() == Schema.Type.NULL);
  }

  private static Instant micros(long micros) {
    return Instant.ofEpochSecond(Math.floorDiv(micros, 1_000_000L), Math.floorMod(micros, 1_000_000L) * 1_000L);
  }

  private static byte[] copyBytes(ByteBuffer buffer) {
    ByteBuffer duplicate = buffer.duplicate();
    byte[] bytes = new byte[duplicate.remaining()];
    duplicate.get(bytes);
    return bytes;
  }
}
