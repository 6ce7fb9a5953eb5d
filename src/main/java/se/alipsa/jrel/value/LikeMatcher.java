package se.alipsa.jrel.value;

import java.nio.charset.StandardCharsets;
import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;

/**
 * SQL {@code LIKE} matching. {@code %} matches any sequence, {@code _} a single
 * character and a backslash makes the following character literal.
 *
 * <p>
 * Under binary collation the pattern is translated to an anchored regular
 * expression and {@code _} matches one code point. Under a named collation the
 * input is split into grapheme clusters, {@code _} matches one grapheme and
 * literal runs of the pattern are compared with the collator so that case or
 * accent folding applies.
 * </p>
 */
public final class LikeMatcher {

  private static final char ESCAPE = '\\';
  private static final Map<String, Pattern> REGEX_CACHE = new ConcurrentHashMap<>();

  private LikeMatcher() {
  }

  private enum TokenType {
    LITERAL, ONE, ANY
  }

  private record Token(TokenType type, String text) {
  }

  /**
   * Evaluate {@code input LIKE pattern}.
   *
   * @param input
   *          STRING, BYTES or NULL
   * @param pattern
   *          STRING, BYTES or NULL of the same kind as {@code input}
   * @param collations
   *          collation context for strings
   * @return UNKNOWN when either side is NULL, otherwise the match result
   */
  public static TriBool like(Value input, Value pattern, CollationContext collations) {
    if (input.isNull() || pattern.isNull()) {
      return TriBool.UNKNOWN;
    }
    if (input instanceof Value.Str text && pattern instanceof Value.Str pat) {
      Collation collation = collations.resolve(text.collation(), pat.collation());
      return TriBool.of(matches(text.value(), pat.value(), collation));
    }
    if (input instanceof Value.Bytes bytes && pattern instanceof Value.Bytes pat) {
      // Latin-1 maps every byte to exactly one char
      String text = new String(bytes.value(), StandardCharsets.ISO_8859_1);
      return TriBool.of(matches(text, new String(pat.value(), StandardCharsets.ISO_8859_1), Collation.BINARY));
    }
    throw new EvaluationException(ErrorKind.TYPE_MISMATCH, "LIKE",
        "LIKE requires STRING or BYTES operands of the same type, got " + input.kind() + " and " + pattern.kind());
  }

  /**
   * Match a string against a LIKE pattern.
   *
   * @param input
   *          the text
   * @param pattern
   *          the LIKE pattern
   * @param collation
   *          the collation to match under
   * @return {@code true} on a match
   * @throws EvaluationException
   *           ({@link ErrorKind#INVALID_ARGUMENT}) if the pattern ends with an
   *           escape character
   */
  public static boolean matches(String input, String pattern, Collation collation) {
    if (collation.isBinary()) {
      Pattern compiled = REGEX_CACHE.computeIfAbsent(pattern,
          p -> Pattern.compile(toLikeRegex(p), Pattern.DOTALL));
      return compiled.matcher(input).matches();
    }
    List<Token> tokens = tokenize(pattern);
    List<String> graphemes = graphemes(input);
    Boolean[][] memo = new Boolean[tokens.size() + 1][graphemes.size() + 1];
    return matchFrom(tokens, 0, graphemes, 0, collation, memo);
  }

  /**
   * Translate a LIKE pattern into an anchored Java regular expression.
   *
   * @param pattern
   *          the LIKE pattern
   * @return the regular expression
   */
  static String toLikeRegex(String pattern) {
    StringBuilder regex = new StringBuilder();
    regex.append('^');
    for (Token token : tokenize(pattern)) {
      switch (token.type()) {
        case ANY -> regex.append(".*");
        case ONE -> regex.append('.');
        case LITERAL -> regex.append(Pattern.quote(token.text()));
        default -> throw new IllegalStateException(token.type().name());
      }
    }
    regex.append('$');
    return regex.toString();
  }

  private static List<Token> tokenize(String pattern) {
    List<Token> tokens = new ArrayList<>();
    StringBuilder literal = new StringBuilder();
    int i = 0;
    while (i < pattern.length()) {
      int cp = pattern.codePointAt(i);
      i += Character.charCount(cp);
      if (cp == ESCAPE) {
        if (i >= pattern.length()) {
          throw new EvaluationException(ErrorKind.INVALID_ARGUMENT, "LIKE",
              "Invalid LIKE pattern: escape at end of pattern '" + pattern + "'");
        }
        int next = pattern.codePointAt(i);
        i += Character.charCount(next);
        literal.appendCodePoint(next);
      } else if (cp == '%' || cp == '_') {
        if (literal.length() > 0) {
          tokens.add(new Token(TokenType.LITERAL, literal.toString()));
          literal.setLength(0);
        }
        tokens.add(new Token(cp == '%' ? TokenType.ANY : TokenType.ONE, null));
      } else {
        literal.appendCodePoint(cp);
      }
    }
    if (literal.length() > 0) {
      tokens.add(new Token(TokenType.LITERAL, literal.toString()));
    }
    return tokens;
  }

  private static List<String> graphemes(String input) {
    List<String> result = new ArrayList<>();
    BreakIterator it = BreakIterator.getCharacterInstance();
    it.setText(input);
    int start = it.first();
    for (int end = it.next(); end != BreakIterator.DONE; start = end, end = it.next()) {
      result.add(input.substring(start, end));
    }
    return result;
  }

  private static boolean matchFrom(List<Token> tokens, int t, List<String> input, int pos, Collation collation,
      Boolean[][] memo) {
    if (memo[t][pos] != null) {
      return memo[t][pos];
    }
    boolean result;
    if (t == tokens.size()) {
      result = pos == input.size();
    } else {
      Token token = tokens.get(t);
      result = switch (token.type()) {
        case ONE -> pos < input.size() && matchFrom(tokens, t + 1, input, pos + 1, collation, memo);
        case ANY -> {
          boolean any = false;
          for (int next = pos; next <= input.size() && !any; next++) {
            any = matchFrom(tokens, t + 1, input, next, collation, memo);
          }
          yield any;
        }
        case LITERAL -> {
          boolean literal = false;
          StringBuilder candidate = new StringBuilder();
          for (int end = pos; end <= input.size() && !literal; end++) {
            if (end > pos) {
              candidate.append(input.get(end - 1));
            }
            literal = collation.equal(candidate.toString(), token.text())
                && matchFrom(tokens, t + 1, input, end, collation, memo);
          }
          yield literal;
        }
      };
    }
    memo[t][pos] = result;
    return result;
  }
}
