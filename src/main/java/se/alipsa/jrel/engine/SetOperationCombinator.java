package se.alipsa.jrel.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;
import se.alipsa.jrel.model.Column;
import se.alipsa.jrel.model.Row;
import se.alipsa.jrel.model.RowKey;
import se.alipsa.jrel.model.Schema;
import se.alipsa.jrel.model.Table;
import se.alipsa.jrel.value.SqlType;
import se.alipsa.jrel.value.TypeCoercion;
import se.alipsa.jrel.value.Value;

/**
 * Combines two tables with UNION, INTERSECT or EXCEPT.
 *
 * <p>
 * The columns of both inputs are first aligned according to the
 * {@link ColumnMatching}, then each output column is coerced to the common
 * supertype of its pair. For a row with multiplicity {@code m} on the left and
 * {@code n} on the right, {@code UNION ALL} keeps {@code m + n} copies,
 * {@code INTERSECT ALL} {@code min(m, n)} and {@code EXCEPT ALL}
 * {@code max(m - n, 0)}; the DISTINCT variants keep at most one. Rows are
 * compared with grouping equivalence and emitted in encounter order, left
 * input first.
 * </p>
 */
public final class SetOperationCombinator {

  private static final Logger log = LoggerFactory.getLogger(SetOperationCombinator.class);

  private SetOperationCombinator() {
  }

  /**
   * Combine two tables.
   *
   * @param left
   *          the left input
   * @param right
   *          the right input
   * @param operator
   *          the set operator
   * @param quantifier
   *          ALL or DISTINCT
   * @param matching
   *          the column matching
   * @param ctx
   *          the evaluation context
   * @return the combined table
   * @throws EvaluationException
   *           ({@link ErrorKind#COLUMN_SET_MISMATCH}) when the columns cannot
   *           be aligned, ({@link ErrorKind#TYPE_MISMATCH}) when a column pair
   *           has no common supertype
   */
  public static Table combine(Table left, Table right, SetOperator operator, SetQuantifier quantifier,
      ColumnMatching matching, EvaluationContext ctx) {
    String op = operator + " " + quantifier;
    Alignment alignment = align(left.schema(), right.schema(), matching, op);
    Schema schema = outputSchema(left.schema(), right.schema(), alignment, ctx.coercion());
    List<Row> leftRows = project(left.rows(), alignment.leftIndexes(), schema, ctx.coercion());
    List<Row> rightRows = project(right.rows(), alignment.rightIndexes(), schema, ctx.coercion());
    List<Row> rows = switch (operator) {
      case UNION -> quantifier == SetQuantifier.ALL ? unionAll(leftRows, rightRows)
          : unionDistinct(leftRows, rightRows, ctx);
      case INTERSECT -> quantifier == SetQuantifier.ALL ? intersectAll(leftRows, rightRows, ctx)
          : intersectDistinct(leftRows, rightRows, ctx);
      case EXCEPT -> quantifier == SetQuantifier.ALL ? exceptAll(leftRows, rightRows, ctx)
          : exceptDistinct(leftRows, rightRows, ctx);
    };
    log.debug("{} ({}): {} + {} rows -> {} rows", op, matching.mode(), left.size(), right.size(), rows.size());
    return new Table(schema, rows);
  }

  /**
   * Output column names and, per output column, the source position in each
   * input or -1 when the input lacks the column.
   */
  record Alignment(List<String> names, int[] leftIndexes, int[] rightIndexes) {
  }

  static Alignment align(Schema left, Schema right, ColumnMatching matching, String op) {
    if (matching.isPositional()) {
      if (left.size() != right.size()) {
        throw new EvaluationException(ErrorKind.COLUMN_SET_MISMATCH, op,
            "Inputs have " + left.size() + " and " + right.size() + " columns");
      }
      int[] indexes = new int[left.size()];
      for (int i = 0; i < indexes.length; i++) {
        indexes[i] = i;
      }
      return new Alignment(left.names(), indexes, indexes.clone());
    }
    Map<String, Integer> leftByName = namePositions(left, "left", op);
    Map<String, Integer> rightByName = namePositions(right, "right", op);
    List<String> names = new ArrayList<>();
    if (!matching.on().isEmpty()) {
      Set<String> listed = new LinkedHashSet<>();
      for (String name : matching.on()) {
        String key = key(name);
        if (!listed.add(key)) {
          throw new EvaluationException(ErrorKind.COLUMN_SET_MISMATCH, op, "Column '" + name + "' listed twice");
        }
        boolean inLeft = leftByName.containsKey(key);
        boolean inRight = rightByName.containsKey(key);
        boolean present = switch (matching.mode()) {
          case STRICT, INNER -> inLeft && inRight;
          case LEFT -> inLeft;
          case FULL -> inLeft || inRight;
          case POSITIONAL -> throw new IllegalStateException("positional matching has no ON list");
        };
        if (!present) {
          throw new EvaluationException(ErrorKind.COLUMN_SET_MISMATCH, op,
              "Column '" + name + "' is not available for " + matching.mode() + " matching; left has "
                  + left.names() + ", right has " + right.names());
        }
        names.add(name);
      }
    } else {
      switch (matching.mode()) {
        case STRICT -> {
          if (!leftByName.keySet().equals(rightByName.keySet())) {
            throw new EvaluationException(ErrorKind.COLUMN_SET_MISMATCH, op,
                "BY NAME requires the same columns on both sides; left has " + left.names() + ", right has "
                    + right.names());
          }
          names.addAll(left.names());
        }
        case INNER -> {
          for (String name : left.names()) {
            if (rightByName.containsKey(key(name))) {
              names.add(name);
            }
          }
          if (names.isEmpty()) {
            throw new EvaluationException(ErrorKind.COLUMN_SET_MISMATCH, op,
                "No common columns between " + left.names() + " and " + right.names());
          }
        }
        case FULL -> {
          names.addAll(left.names());
          for (String name : right.names()) {
            if (!leftByName.containsKey(key(name))) {
              names.add(name);
            }
          }
        }
        case LEFT -> names.addAll(left.names());
        case POSITIONAL -> throw new IllegalStateException("handled above");
      }
    }
    int[] leftIndexes = new int[names.size()];
    int[] rightIndexes = new int[names.size()];
    for (int i = 0; i < names.size(); i++) {
      leftIndexes[i] = leftByName.getOrDefault(key(names.get(i)), -1);
      rightIndexes[i] = rightByName.getOrDefault(key(names.get(i)), -1);
    }
    return new Alignment(names, leftIndexes, rightIndexes);
  }

  private static Map<String, Integer> namePositions(Schema schema, String side, String op) {
    Map<String, Integer> positions = new HashMap<>();
    for (int i = 0; i < schema.size(); i++) {
      if (positions.putIfAbsent(key(schema.column(i).name()), i) != null) {
        throw new EvaluationException(ErrorKind.COLUMN_SET_MISMATCH, op,
            "Duplicate column '" + schema.column(i).name() + "' in the " + side + " input of a BY NAME operation");
      }
    }
    return positions;
  }

  private static String key(String name) {
    return name.toLowerCase(Locale.ROOT);
  }

  private static Schema outputSchema(Schema left, Schema right, Alignment alignment, TypeCoercion coercion) {
    List<Column> columns = new ArrayList<>(alignment.names().size());
    for (int i = 0; i < alignment.names().size(); i++) {
      int li = alignment.leftIndexes()[i];
      int ri = alignment.rightIndexes()[i];
      Column lc = li < 0 ? null : left.column(li);
      Column rc = ri < 0 ? null : right.column(ri);
      SqlType type;
      if (lc == null) {
        type = rc.type();
      } else if (rc == null) {
        type = lc.type();
      } else {
        type = coercion.commonSupertype(lc.type(), rc.type());
      }
      boolean nullable = lc == null || rc == null || lc.nullable() || rc.nullable();
      String name = lc != null ? lc.name() : rc.name();
      columns.add(new Column(name, type, nullable, null));
    }
    return new Schema(columns);
  }

  private static List<Row> project(List<Row> rows, int[] indexes, Schema schema, TypeCoercion coercion) {
    List<Row> projected = new ArrayList<>(rows.size());
    for (Row row : rows) {
      List<Value> values = new ArrayList<>(indexes.length);
      for (int i = 0; i < indexes.length; i++) {
        Value value = indexes[i] < 0 ? Value.NULL : row.get(indexes[i]);
        values.add(coercion.coerce(value, schema.column(i).type()));
      }
      projected.add(new Row(values));
    }
    return projected;
  }

  private static List<Row> unionAll(List<Row> left, List<Row> right) {
    List<Row> combined = new ArrayList<>(left.size() + right.size());
    combined.addAll(left);
    combined.addAll(right);
    return combined;
  }

  private static List<Row> unionDistinct(List<Row> left, List<Row> right, EvaluationContext ctx) {
    Set<RowKey> unique = new LinkedHashSet<>();
    List<Row> result = new ArrayList<>();
    for (Row row : left) {
      if (unique.add(RowKey.of(row, ctx.collations()))) {
        result.add(row);
      }
    }
    for (Row row : right) {
      if (unique.add(RowKey.of(row, ctx.collations()))) {
        result.add(row);
      }
    }
    return result;
  }

  private static List<Row> intersectDistinct(List<Row> left, List<Row> right, EvaluationContext ctx) {
    Set<RowKey> rightKeys = keys(right, ctx);
    Set<RowKey> emitted = new LinkedHashSet<>();
    List<Row> result = new ArrayList<>();
    for (Row row : left) {
      RowKey key = RowKey.of(row, ctx.collations());
      if (rightKeys.contains(key) && emitted.add(key)) {
        result.add(row);
      }
    }
    return result;
  }

  private static List<Row> intersectAll(List<Row> left, List<Row> right, EvaluationContext ctx) {
    Map<RowKey, Integer> remaining = counts(right, ctx);
    List<Row> result = new ArrayList<>();
    for (Row row : left) {
      RowKey key = RowKey.of(row, ctx.collations());
      Integer count = remaining.get(key);
      if (count != null) {
        result.add(row);
        if (count == 1) {
          remaining.remove(key);
        } else {
          remaining.put(key, count - 1);
        }
      }
    }
    return result;
  }

  private static List<Row> exceptDistinct(List<Row> left, List<Row> right, EvaluationContext ctx) {
    Set<RowKey> rightKeys = keys(right, ctx);
    Set<RowKey> emitted = new LinkedHashSet<>();
    List<Row> result = new ArrayList<>();
    for (Row row : left) {
      RowKey key = RowKey.of(row, ctx.collations());
      if (!rightKeys.contains(key) && emitted.add(key)) {
        result.add(row);
      }
    }
    return result;
  }

  private static List<Row> exceptAll(List<Row> left, List<Row> right, EvaluationContext ctx) {
    Map<RowKey, Integer> remaining = counts(right, ctx);
    List<Row> result = new ArrayList<>();
    for (Row row : left) {
      RowKey key = RowKey.of(row, ctx.collations());
      Integer count = remaining.get(key);
      if (count == null) {
        result.add(row);
      } else if (count == 1) {
        remaining.remove(key);
      } else {
        remaining.put(key, count - 1);
      }
    }
    return result;
  }

  private static Set<RowKey> keys(List<Row> rows, EvaluationContext ctx) {
    Set<RowKey> keys = new LinkedHashSet<>();
    for (Row row : rows) {
      keys.add(RowKey.of(row, ctx.collations()));
    }
    return keys;
  }

  private static Map<RowKey, Integer> counts(List<Row> rows, EvaluationContext ctx) {
    Map<RowKey, Integer> counts = new HashMap<>();
    for (Row row : rows) {
      counts.merge(RowKey.of(row, ctx.collations()), 1, Integer::sum);
    }
    return counts;
  }
}
