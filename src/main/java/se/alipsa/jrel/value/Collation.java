package se.alipsa.jrel.value;

import java.nio.ByteBuffer;
import java.text.Collator;
import java.util.Locale;
import java.util.Objects;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;

/**
 * A named string comparison rule. The binary collation orders strings by
 * Unicode code point; every other collation delegates to a
 * {@link java.text.Collator}.
 *
 * <p>
 * Specifications follow the {@code language_tag[:attribute]} form:
 * {@code und:ci} is the case-insensitive root locale, {@code en} and
 * {@code en:cs} compare at tertiary strength (case and accent sensitive) and
 * {@code en:ci} compares at secondary strength (accent sensitive, case
 * insensitive). {@code binary} selects code point order.
 * </p>
 */
public final class Collation {

  /** Code point order, used whenever no collation has been assigned. */
  public static final Collation BINARY = new Collation("binary", null);

  private final String name;
  private final Collator collator;

  private Collation(String name, Collator collator) {
    this.name = name;
    this.collator = collator;
  }

  /**
   * Create a collation backed by a caller supplied collator.
   *
   * @param name
   *          the name used to refer to the collation
   * @param collator
   *          the comparison rules
   * @return the collation
   */
  public static Collation of(String name, Collator collator) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(collator, "collator");
    return new Collation(name.toLowerCase(Locale.ROOT), (Collator) collator.clone());
  }

  /**
   * Parse a collation specification.
   *
   * @param spec
   *          the specification, e.g. {@code und:ci}; {@code null}, blank and
   *          {@code binary} yield {@link #BINARY}
   * @return the collation
   * @throws EvaluationException
   *           ({@link ErrorKind#INVALID_ARGUMENT}) for an unknown attribute or
   *           language tag
   */
  public static Collation parse(String spec) {
    if (spec == null || spec.isBlank() || "binary".equalsIgnoreCase(spec.trim())) {
      return BINARY;
    }
    String normalized = spec.trim().toLowerCase(Locale.ROOT);
    String tag = normalized;
    String attribute = "cs";
    int colon = normalized.indexOf(':');
    if (colon >= 0) {
      tag = normalized.substring(0, colon);
      attribute = normalized.substring(colon + 1);
    }
    int strength;
    if ("ci".equals(attribute)) {
      strength = Collator.SECONDARY;
    } else if ("cs".equals(attribute)) {
      strength = Collator.TERTIARY;
    } else {
      throw new EvaluationException(ErrorKind.INVALID_ARGUMENT, "COLLATE",
          "Unsupported collation attribute '" + attribute + "' in '" + spec + "'");
    }
    Locale locale = Locale.forLanguageTag(tag);
    if (!"und".equals(tag) && locale.getLanguage().isEmpty()) {
      throw new EvaluationException(ErrorKind.INVALID_ARGUMENT, "COLLATE",
          "Invalid language tag '" + tag + "' in '" + spec + "'");
    }
    Collator collator = Collator.getInstance("und".equals(tag) ? Locale.ROOT : locale);
    collator.setStrength(strength);
    collator.setDecomposition(Collator.CANONICAL_DECOMPOSITION);
    return new Collation(normalized, collator);
  }

  public String name() {
    return name;
  }

  /**
   * Whether this is code point order.
   *
   * @return {@code true} for {@link #BINARY}
   */
  public boolean isBinary() {
    return collator == null;
  }

  /**
   * Compare two strings.
   *
   * @param left
   *          left string
   * @param right
   *          right string
   * @return negative, zero or positive
   */
  public int compare(String left, String right) {
    if (collator == null) {
      return compareCodePoints(left, right);
    }
    return collator.compare(left, right);
  }

  /**
   * Test two strings for equality under this collation.
   *
   * @param left
   *          left string
   * @param right
   *          right string
   * @return {@code true} when the strings collate equal
   */
  public boolean equal(String left, String right) {
    return compare(left, right) == 0;
  }

  /**
   * Produce a key whose {@code equals}/{@code hashCode} agree with
   * {@link #equal(String, String)}.
   *
   * @param text
   *          the string
   * @return the key
   */
  public Object key(String text) {
    if (collator == null) {
      return text;
    }
    return ByteBuffer.wrap(collator.getCollationKey(text).toByteArray());
  }

  static int compareCodePoints(String left, String right) {
    int i = 0;
    int j = 0;
    while (i < left.length() && j < right.length()) {
      int a = left.codePointAt(i);
      int b = right.codePointAt(j);
      if (a != b) {
        return Integer.compare(a, b);
      }
      i += Character.charCount(a);
      j += Character.charCount(b);
    }
    return Integer.compare(left.length() - i, right.length() - j);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Collation other && name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
