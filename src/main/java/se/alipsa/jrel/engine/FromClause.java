package se.alipsa.jrel.engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;
import se.alipsa.jrel.model.Table;

/**
 * A FROM clause: a first producer followed by joins applied strictly left to
 * right. A nested {@code FromClause} used as a producer is a parenthesised
 * join.
 *
 * <p>
 * The shape is validated on construction: a correlated or LATERAL right side
 * only combines with CROSS, INNER, LEFT and the left semi and anti joins, a
 * comma join cannot be followed directly by a RIGHT or FULL join and a CROSS
 * join takes no condition.
 * </p>
 */
public final class FromClause implements RowProducer {

  private final RowProducer first;
  private final List<JoinStep> steps;

  /**
   * Create and validate a FROM clause.
   *
   * @param first
   *          the leftmost producer
   * @param steps
   *          the joins in source order
   * @throws EvaluationException
   *           ({@link ErrorKind#INVALID_JOIN_SHAPE}) for an invalid sequence
   */
  public FromClause(RowProducer first, List<JoinStep> steps) {
    this.first = Objects.requireNonNull(first, "first");
    this.steps = List.copyOf(steps);
    validate();
  }

  /**
   * Create a FROM clause.
   *
   * @param first
   *          the leftmost producer
   * @param steps
   *          the joins
   * @return the clause
   */
  public static FromClause of(RowProducer first, JoinStep... steps) {
    return new FromClause(first, Arrays.asList(steps));
  }

  /**
   * Copy with an additional join.
   *
   * @param step
   *          the join
   * @return the clause
   */
  public FromClause join(JoinStep step) {
    List<JoinStep> extended = new ArrayList<>(steps);
    extended.add(step);
    return new FromClause(first, extended);
  }

  public RowProducer first() {
    return first;
  }

  public List<JoinStep> steps() {
    return steps;
  }

  @Override
  public Table produce(EvaluationContext ctx) {
    return JoinExecutor.execute(this, ctx);
  }

  @Override
  public boolean isCorrelated() {
    return first.isCorrelated();
  }

  private void validate() {
    for (int i = 0; i < steps.size(); i++) {
      JoinStep step = steps.get(i);
      if (step.kind() == JoinKind.CROSS && !(step.condition() instanceof JoinCondition.None)) {
        throw new EvaluationException(ErrorKind.INVALID_JOIN_SHAPE, "CROSS JOIN",
            "CROSS JOIN cannot have a join condition");
      }
      if (step.isCorrelated() && step.kind().needsIndependentRight()) {
        throw new EvaluationException(ErrorKind.INVALID_JOIN_SHAPE, step.kind().sql(),
            (step.lateral() ? "LATERAL" : "A correlated") + " join input cannot be used with " + step.kind().sql());
      }
      if (step.comma() && i + 1 < steps.size()) {
        JoinKind next = steps.get(i + 1).kind();
        if (next == JoinKind.RIGHT || next == JoinKind.FULL) {
          throw new EvaluationException(ErrorKind.INVALID_JOIN_SHAPE, next.sql(),
              "A comma join cannot be followed by " + next.sql() + " without parentheses");
        }
      }
    }
  }
}
