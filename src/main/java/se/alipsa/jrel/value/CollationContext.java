package se.alipsa.jrel.value;

import java.text.Collator;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;

/**
 * Collation state threaded explicitly through every string comparison: the
 * default collation applied when neither operand carries one, and named
 * collators registered by the caller.
 */
public final class CollationContext {

  /** Binary default, no registered collators. */
  public static final CollationContext BINARY = new CollationContext(Collation.BINARY, Map.of());

  private final Collation defaultCollation;
  private final Map<String, Collation> registry;

  private CollationContext(Collation defaultCollation, Map<String, Collation> registry) {
    this.defaultCollation = Objects.requireNonNull(defaultCollation, "defaultCollation");
    this.registry = Map.copyOf(registry);
  }

  /**
   * Create a context with the supplied default collation.
   *
   * @param defaultCollation
   *          collation used when no operand carries one
   * @return the context
   */
  public static CollationContext withDefault(Collation defaultCollation) {
    return new CollationContext(defaultCollation, Map.of());
  }

  /**
   * Return a copy of this context with an additional named collator.
   *
   * @param name
   *          the collation name
   * @param collator
   *          the comparison rules
   * @return a new context
   */
  public CollationContext register(String name, Collator collator) {
    Map<String, Collation> copy = new HashMap<>(registry);
    Collation collation = Collation.of(name, collator);
    copy.put(collation.name(), collation);
    return new CollationContext(defaultCollation, copy);
  }

  public Collation defaultCollation() {
    return defaultCollation;
  }

  /**
   * Look up a collation by specification, consulting registered collators
   * first.
   *
   * @param spec
   *          the specification or registered name
   * @return the collation
   */
  public Collation lookup(String spec) {
    if (spec != null) {
      Collation registered = registry.get(spec.trim().toLowerCase(Locale.ROOT));
      if (registered != null) {
        return registered;
      }
    }
    return Collation.parse(spec);
  }

  /**
   * Determine the collation governing a comparison of two strings.
   *
   * @param left
   *          explicit collation of the left operand, may be {@code null}
   * @param right
   *          explicit collation of the right operand, may be {@code null}
   * @return the collation to use for both operands
   * @throws EvaluationException
   *           ({@link ErrorKind#COLLATION_CONFLICT}) when both operands carry
   *           different explicit collations
   */
  public Collation resolve(Collation left, Collation right) {
    boolean leftExplicit = left != null && !left.isBinary();
    boolean rightExplicit = right != null && !right.isBinary();
    if (leftExplicit && rightExplicit) {
      if (!left.equals(right)) {
        throw new EvaluationException(ErrorKind.COLLATION_CONFLICT, null,
            "Collation mismatch: '" + left + "' vs '" + right + "'");
      }
      return left;
    }
    if (leftExplicit) {
      return left;
    }
    if (rightExplicit) {
      return right;
    }
    return defaultCollation;
  }

  /**
   * Collation of a single string operand.
   *
   * @param value
   *          the string
   * @return its explicit collation or the default
   */
  public Collation collationOf(Value.Str value) {
    return resolve(value.collation(), null);
  }
}
