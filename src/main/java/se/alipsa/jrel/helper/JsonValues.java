package se.alipsa.jrel.helper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;
import se.alipsa.jrel.value.Value;

/** JSON values backed by Jackson: {@code PARSE_JSON} and {@code JSON_VALUE}. */
public final class JsonValues {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private JsonValues() {
  }

  /**
   * Parse a JSON document.
   *
   * @param text
   *          STRING value holding the document, or NULL
   * @return the JSON value, NULL for NULL input
   * @throws EvaluationException
   *           ({@link ErrorKind#INVALID_ARGUMENT}) for malformed JSON,
   *           ({@link ErrorKind#TYPE_MISMATCH}) for a non-string argument
   */
  public static Value parse(Value text) {
    if (text.isNull()) {
      return Value.NULL;
    }
    if (!(text instanceof Value.Str str)) {
      throw new EvaluationException(ErrorKind.TYPE_MISMATCH, "PARSE_JSON", "Expected STRING but got " + text.kind());
    }
    try {
      return new Value.Json(MAPPER.readTree(str.value()));
    } catch (JsonProcessingException e) {
      throw new EvaluationException(ErrorKind.INVALID_ARGUMENT, "PARSE_JSON",
          "Invalid JSON: " + e.getOriginalMessage(), e);
    }
  }

  /**
   * Evaluate {@code JSON_VALUE(document, path)} and return a scalar value.
   *
   * @param document
   *          JSON or STRING value
   * @param path
   *          STRING path such as {@code $.a.b[0]}
   * @return the scalar at the path, NULL when the path does not resolve to a
   *         scalar
   */
  public static Value jsonValue(Value document, Value path) {
    if (document.isNull() || path.isNull()) {
      return Value.NULL;
    }
    JsonNode root = document instanceof Value.Json json ? json.node() : ((Value.Json) parse(document)).node();
    JsonNode node = root.at(toPointer(path.toString()));
    if (node.isMissingNode() || node.isNull() || node.isContainerNode()) {
      return Value.NULL;
    }
    if (node.isBoolean()) {
      return Value.of(node.booleanValue());
    }
    if (node.isIntegralNumber() && node.canConvertToLong()) {
      return Value.of(node.longValue());
    }
    if (node.isBigDecimal()) {
      return Value.of(node.decimalValue());
    }
    if (node.isNumber()) {
      return Value.of(node.doubleValue());
    }
    return Value.of(node.asText());
  }

  private static String toPointer(String path) {
    String trimmed = path.trim();
    if (!trimmed.startsWith("$")) {
      throw new EvaluationException(ErrorKind.INVALID_ARGUMENT, "JSON_VALUE",
          "JSON path must start with '$': " + path);
    }
    StringBuilder pointer = new StringBuilder();
    int i = 1;
    while (i < trimmed.length()) {
      char c = trimmed.charAt(i);
      if (c == '.') {
        int end = i + 1;
        while (end < trimmed.length() && trimmed.charAt(end) != '.' && trimmed.charAt(end) != '[') {
          end++;
        }
        pointer.append('/').append(escape(trimmed.substring(i + 1, end)));
        i = end;
      } else if (c == '[') {
        int end = trimmed.indexOf(']', i);
        if (end < 0) {
          throw new EvaluationException(ErrorKind.INVALID_ARGUMENT, "JSON_VALUE", "Unclosed '[' in JSON path " + path);
        }
        String index = trimmed.substring(i + 1, end).trim();
        if (index.length() > 1 && (index.startsWith("\"") || index.startsWith("'"))) {
          index = index.substring(1, index.length() - 1);
        }
        pointer.append('/').append(escape(index));
        i = end + 1;
      } else {
        throw new EvaluationException(ErrorKind.INVALID_ARGUMENT, "JSON_VALUE",
            "Unexpected '" + c + "' in JSON path " + path);
      }
    }
    return pointer.toString();
  }

  private static String escape(String segment) {
    return segment.replace("~", "~0").replace("/", "~1");
  }
}
