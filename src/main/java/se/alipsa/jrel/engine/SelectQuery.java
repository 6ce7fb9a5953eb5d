package se.alipsa.jrel.engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import se.alipsa.jrel.ErrorKind;
import se.alipsa.jrel.EvaluationException;
import se.alipsa.jrel.engine.window.WindowStage;
import se.alipsa.jrel.model.Table;

/**
 * A single SELECT block. Instances are created with {@link #builder()}.
 */
public final class SelectQuery implements QueryPlan {

  /** Rows an ORDER BY of a SELECT block is evaluated against. */
  public enum OrderScope {
    /** The projected rows; select aliases and select expressions resolve. */
    OUTPUT,
    /** The rows before projection; FROM columns resolve. */
    INPUT
  }

  private final RowProducer from;
  private final Expression where;
  private final List<GroupingElement> groupBy;
  private final boolean groupByAll;
  private final Expression having;
  private final List<WindowStage> windows;
  private final Expression qualify;
  private final List<SelectItem> select;
  private final boolean distinct;
  private final List<SortKey> orderBy;
  private final OrderScope orderScope;
  private final Long limit;
  private final long offset;

  private SelectQuery(Builder builder) {
    this.from = builder.from;
    this.where = builder.where;
    this.groupBy = List.copyOf(builder.groupBy);
    this.groupByAll = builder.groupByAll;
    this.having = builder.having;
    this.windows = List.copyOf(builder.windows);
    this.qualify = builder.qualify;
    this.select = List.copyOf(builder.select);
    this.distinct = builder.distinct;
    this.orderBy = List.copyOf(builder.orderBy);
    this.orderScope = builder.orderScope;
    this.limit = builder.limit;
    this.offset = builder.offset;
  }

  /**
   * Create a builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * The FROM clause.
   *
   * @return the producer or {@code null} when the query has no FROM clause
   */
  public RowProducer from() {
    return from;
  }

  public Expression where() {
    return where;
  }

  public List<GroupingElement> groupBy() {
    return groupBy;
  }

  public boolean groupByAll() {
    return groupByAll;
  }

  public Expression having() {
    return having;
  }

  public List<WindowStage> windows() {
    return windows;
  }

  public Expression qualify() {
    return qualify;
  }

  public List<SelectItem> select() {
    return select;
  }

  public boolean distinct() {
    return distinct;
  }

  public List<SortKey> orderBy() {
    return orderBy;
  }

  public OrderScope orderScope() {
    return orderScope;
  }

  public Long limit() {
    return limit;
  }

  public long offset() {
    return offset;
  }

  /**
   * Whether the block aggregates: it has a GROUP BY clause or an aggregate call
   * in SELECT, HAVING, a window, QUALIFY or ORDER BY.
   *
   * @return {@code true} when the grouping stage runs
   */
  public boolean isAggregating() {
    return !aggregateCalls().isEmpty() || !groupBy.isEmpty() || groupByAll || having != null;
  }

  /**
   * The distinct aggregate calls of the block in encounter order.
   *
   * @return the calls
   */
  public List<AggregateCall> aggregateCalls() {
    List<AggregateCall> calls = new ArrayList<>();
    for (SelectItem item : select) {
      if (!item.star()) {
        Expressions.collectAggregates(item.expression(), calls);
      }
    }
    if (having != null) {
      Expressions.collectAggregates(having, calls);
    }
    for (WindowStage window : windows) {
      window.expressions().forEach(e -> Expressions.collectAggregates(e, calls));
    }
    if (qualify != null) {
      Expressions.collectAggregates(qualify, calls);
    }
    for (SortKey key : orderBy) {
      Expressions.collectAggregates(key.expression(), calls);
    }
    return calls;
  }

  @Override
  public Table evaluate(EvaluationContext ctx) {
    return QueryEvaluator.evaluateSelect(this, ctx);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("SELECT ");
    if (distinct) {
      sb.append("DISTINCT ");
    }
    sb.append(select.stream().map(Object::toString).reduce((a, b) -> a + ", " + b).orElse(""));
    if (from != null) {
      sb.append(" FROM ").append(from);
    }
    if (where != null) {
      sb.append(" WHERE ").append(where);
    }
    if (groupByAll) {
      sb.append(" GROUP BY ALL");
    } else if (!groupBy.isEmpty()) {
      sb.append(" GROUP BY ").append(groupBy);
    }
    if (having != null) {
      sb.append(" HAVING ").append(having);
    }
    if (qualify != null) {
      sb.append(" QUALIFY ").append(qualify);
    }
    if (!orderBy.isEmpty()) {
      sb.append(" ORDER BY ").append(orderBy);
    }
    if (limit != null) {
      sb.append(" LIMIT ").append(limit);
    }
    if (offset > 0) {
      sb.append(" OFFSET ").append(offset);
    }
    return sb.toString();
  }

  /**
   * Builder for {@link SelectQuery}.
   */
  public static final class Builder {

    private RowProducer from;
    private Expression where;
    private final List<GroupingElement> groupBy = new ArrayList<>();
    private boolean groupByAll;
    private Expression having;
    private final List<WindowStage> windows = new ArrayList<>();
    private Expression qualify;
    private final List<SelectItem> select = new ArrayList<>();
    private boolean distinct;
    private final List<SortKey> orderBy = new ArrayList<>();
    private OrderScope orderScope = OrderScope.OUTPUT;
    private Long limit;
    private long offset;

    private Builder() {
      // use SelectQuery.builder()
    }

    /**
     * Set the FROM clause.
     *
     * @param producer
     *          a table, a FROM clause with joins or any other producer
     * @return {@code this} for chaining
     */
    public Builder from(RowProducer producer) {
      this.from = producer;
      return this;
    }

    /**
     * Set the WHERE condition.
     *
     * @param condition
     *          rows for which it is not TRUE are dropped
     * @return {@code this} for chaining
     */
    public Builder where(Expression condition) {
      this.where = condition;
      return this;
    }

    /**
     * Add GROUP BY items.
     *
     * @param elements
     *          the items
     * @return {@code this} for chaining
     */
    public Builder groupBy(GroupingElement... elements) {
      groupBy.addAll(Arrays.asList(elements));
      return this;
    }

    /**
     * Add plain GROUP BY expressions.
     *
     * @param expressions
     *          the keys
     * @return {@code this} for chaining
     */
    public Builder groupBy(Expression... expressions) {
      for (Expression expression : expressions) {
        groupBy.add(GroupingElement.of(expression));
      }
      return this;
    }

    /**
     * Use {@code GROUP BY ALL}: the keys are inferred from the select list.
     *
     * @return {@code this} for chaining
     */
    public Builder groupByAll() {
      this.groupByAll = true;
      return this;
    }

    public Builder having(Expression condition) {
      this.having = condition;
      return this;
    }

    /**
     * Add a window computation.
     *
     * @param window
     *          the window
     * @return {@code this} for chaining
     */
    public Builder window(WindowStage window) {
      windows.add(window);
      return this;
    }

    public Builder qualify(Expression condition) {
      this.qualify = condition;
      return this;
    }

    /**
     * Add select items.
     *
     * @param items
     *          the items
     * @return {@code this} for chaining
     */
    public Builder select(SelectItem... items) {
      select.addAll(Arrays.asList(items));
      return this;
    }

    /**
     * Add unaliased select expressions.
     *
     * @param expressions
     *          the expressions
     * @return {@code this} for chaining
     */
    public Builder select(Expression... expressions) {
      for (Expression expression : expressions) {
        select.add(SelectItem.of(expression));
      }
      return this;
    }

    public Builder selectAs(Expression expression, String alias) {
      select.add(SelectItem.as(expression, alias));
      return this;
    }

    public Builder distinct() {
      this.distinct = true;
      return this;
    }

    /**
     * Add ORDER BY keys.
     *
     * @param keys
     *          the keys
     * @return {@code this} for chaining
     */
    public Builder orderBy(SortKey... keys) {
      orderBy.addAll(Arrays.asList(keys));
      return this;
    }

    /**
     * Choose the rows ORDER BY is evaluated against.
     *
     * @param scope
     *          the scope, {@link OrderScope#OUTPUT} by default
     * @return {@code this} for chaining
     */
    public Builder orderScope(OrderScope scope) {
      this.orderScope = scope == null ? OrderScope.OUTPUT : scope;
      return this;
    }

    /**
     * Set LIMIT.
     *
     * @param rows
     *          maximum number of rows, not negative
     * @return {@code this} for chaining
     */
    public Builder limit(long rows) {
      if (rows < 0) {
        throw new IllegalArgumentException("LIMIT must not be negative: " + rows);
      }
      this.limit = rows;
      return this;
    }

    /**
     * Set OFFSET.
     *
     * @param rows
     *          rows to skip, not negative
     * @return {@code this} for chaining
     */
    public Builder offset(long rows) {
      if (rows < 0) {
        throw new IllegalArgumentException("OFFSET must not be negative: " + rows);
      }
      this.offset = rows;
      return this;
    }

    /**
     * Create the query.
     *
     * @return the immutable query
     * @throws EvaluationException
     *           ({@link ErrorKind#INVALID_PLAN}) for an empty select list or
     *           for ORDER BY over input rows combined with DISTINCT
     */
    public SelectQuery build() {
      if (select.isEmpty()) {
        throw new EvaluationException(ErrorKind.INVALID_PLAN, "SELECT", "The select list is empty");
      }
      if (distinct && orderScope == OrderScope.INPUT && !orderBy.isEmpty()) {
        throw new EvaluationException(ErrorKind.INVALID_PLAN, "ORDER BY",
            "ORDER BY over input columns cannot be combined with SELECT DISTINCT");
      }
      if (groupByAll && !groupBy.isEmpty()) {
        throw new EvaluationException(ErrorKind.INVALID_PLAN, "GROUP BY",
            "GROUP BY ALL cannot be combined with explicit grouping items");
      }
      for (SelectItem item : select) {
        if (item.star() && from == null) {
          throw new EvaluationException(ErrorKind.INVALID_PLAN, "SELECT", "SELECT * requires a FROM clause");
        }
      }
      return new SelectQuery(this);
    }
  }
}
