package io.intellixity.quire.persistence.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Incremental SELECT statement builder.
 *
 * Holds raw SQL fragments per clause and renders them in a fixed order:
 * {@code SELECT [DISTINCT [ON(..)]] select FROM from joins WHERE where GROUP BY group HAVING having ORDER BY order trail}.
 * Fragments are concatenated verbatim, so callers include their own separators.
 *
 * Not thread-safe. Use {@link #clone()} to branch a query before diverging.
 */
public class SqlBuilder {
  public static final String SELECT = "SELECT";

  private static final int INITIAL_CAPACITY = 1024;

  protected final SqlDialect dialect;
  protected final String tablePrefix;

  private String clause;

  private List<String> select;
  private List<String> from;
  private List<String> join;
  private List<String> where;
  private List<String> group;
  private List<String> having;
  private List<String> order;
  private List<String> trail;
  private boolean distinct;
  private String skip;
  private String count;

  private Map<String, Object> parameters = new LinkedHashMap<>();

  public SqlBuilder(String tablePrefix, SqlDialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.tablePrefix = tablePrefix == null ? "" : tablePrefix;
  }

  public SqlDialect dialect() { return dialect; }
  public String tablePrefix() { return tablePrefix; }
  public String clause() { return clause; }

  /** Bound values keyed by parameter name, in insertion order. Mutable. */
  public Map<String, Object> parameters() { return parameters; }

  private List<String> selectSegments() { if (select == null) select = new ArrayList<>(); return select; }
  private List<String> fromSegments() { if (from == null) from = new ArrayList<>(); return from; }
  private List<String> joinSegments() { if (join == null) join = new ArrayList<>(); return join; }
  private List<String> whereSegments() { if (where == null) where = new ArrayList<>(); return where; }
  private List<String> groupSegments() { if (group == null) group = new ArrayList<>(); return group; }
  private List<String> havingSegments() { if (having == null) having = new ArrayList<>(); return having; }
  private List<String> orderSegments() { if (order == null) order = new ArrayList<>(); return order; }
  private List<String> trailSegments() { if (trail == null) trail = new ArrayList<>(); return trail; }

  /** Resets the FROM clause to a single prefixed, quoted table, optionally aliased. */
  public void table(String table, String alias, String schema) {
    List<String> segments = fromSegments();
    segments.clear();
    segments.add(formatTable(table, schema));

    if (!isNullOrEmpty(alias)) {
      segments.add(" AS ");
      segments.add(dialect.quoteForAliasName(alias));
    }
  }

  /** Appends a raw FROM fragment, e.g. a derived table. */
  public void from(String from) {
    fromSegments().add(from);
  }

  public boolean hasPaging() {
    return skip != null || count != null;
  }

  public void skip(String skip) {
    this.skip = skip;
  }

  public void take(String take) {
    this.count = take;
  }

  public String skipValue() { return skip; }
  public String takeValue() { return count; }

  /**
   * Appends {@code INNER JOIN table [AS alias] ON onTable.onColumn = toTable.toColumn}.
   *
   * The left side is referenced through the join alias when {@code onTable} equals {@code alias},
   * otherwise through its prefixed table name. The right side is referenced through
   * {@code toAlias} when one is given, otherwise through its prefixed table name.
   */
  public void innerJoin(String table, String onTable, String onColumn, String toTable, String toColumn,
                        String schema, String alias, String toAlias) {
    String left = Objects.equals(alias, onTable)
        ? dialect.quoteForAliasName(onTable)
        : formatTable(onTable, schema);

    String right = isNullOrEmpty(toAlias)
        ? formatTable(toTable, schema)
        : dialect.quoteForAliasName(toAlias);

    List<String> segments = joinSegments();
    segments.add(" INNER JOIN ");
    segments.add(formatTable(table, schema));

    if (!isNullOrEmpty(alias)) {
      segments.add(" AS ");
      segments.add(dialect.quoteForAliasName(alias));
    }

    segments.add(" ON ");
    segments.add(left);
    segments.add(".");
    segments.add(dialect.quoteForColumnName(onColumn));
    segments.add(" = ");
    segments.add(right);
    segments.add(".");
    segments.add(dialect.quoteForColumnName(toColumn));
  }

  public void innerJoin(String table, String onTable, String onColumn, String toTable, String toColumn, String schema) {
    innerJoin(table, onTable, onColumn, toTable, toColumn, schema, null, null);
  }

  public void select() {
    clause = SELECT;
  }

  public List<String> selectors() {
    return select == null ? List.of() : Collections.unmodifiableList(select);
  }

  public List<String> orders() {
    return order == null ? List.of() : Collections.unmodifiableList(order);
  }

  /** Replaces the whole projection. */
  public void selector(String selector) {
    List<String> segments = selectSegments();
    segments.clear();
    segments.add(selector);
  }

  public void selector(String table, String column, String schema) {
    selector(formatColumn(table, column, schema, false));
  }

  public void addSelector(String selector) {
    selectSegments().add(selector);
  }

  public void insertSelector(String selector) {
    selectSegments().add(0, selector);
  }

  public String selectorText() {
    if (select == null || select.isEmpty()) return "";
    if (select.size() == 1) return select.get(0);
    return String.join("", select);
  }

  public void distinct() {
    distinct = true;
  }

  public boolean isDistinct() {
    return distinct;
  }

  /** Never quotes {@code *}. Prefixes the table unless it is an alias. */
  public String formatColumn(String table, String column, String schema, boolean isAlias) {
    String c = "*".equals(column) ? column : dialect.quoteForColumnName(column);
    if (isAlias) {
      return dialect.quoteForAliasName(table) + "." + c;
    }
    return formatTable(table, schema) + "." + c;
  }

  public String formatColumn(String table, String column, String schema) {
    return formatColumn(table, column, schema, false);
  }

  public String formatTable(String table, String schema) {
    return dialect.quoteForTableName(tablePrefix + table, schema);
  }

  public void andAlso(String predicate) {
    appendWhere(predicate, " AND ");
  }

  public void whereAnd(String predicate) {
    appendWhere(predicate, " AND ");
  }

  public void whereOr(String predicate) {
    appendWhere(predicate, " OR ");
  }

  private void appendWhere(String predicate, String connective) {
    if (predicate == null || predicate.isBlank()) return;
    List<String> segments = whereSegments();
    if (!segments.isEmpty()) segments.add(connective);
    segments.add(predicate);
  }

  public boolean hasJoin() {
    return join != null && !join.isEmpty();
  }

  public boolean hasOrder() {
    return order != null && !order.isEmpty();
  }

  public void clearOrder() {
    order = null;
  }

  /** Clears GROUP BY and HAVING together. */
  public void clearGroupBy() {
    group = null;
    having = null;
  }

  public void orderBy(String orderBy) {
    List<String> segments = orderSegments();
    segments.clear();
    segments.add(orderBy);
  }

  public void orderByDescending(String orderBy) {
    List<String> segments = orderSegments();
    segments.clear();
    segments.add(orderBy);
    segments.add(" DESC");
  }

  public void orderByRandom() {
    List<String> segments = orderSegments();
    segments.clear();
    segments.add(dialect.randomOrderByClause());
  }

  public void thenOrderBy(String orderBy) {
    boolean had = hasOrder();
    List<String> segments = orderSegments();
    if (had) segments.add(", ");
    segments.add(orderBy);
  }

  public void thenOrderByDescending(String orderBy) {
    boolean had = hasOrder();
    List<String> segments = orderSegments();
    if (had) segments.add(", ");
    segments.add(orderBy);
    segments.add(" DESC");
  }

  public void thenOrderByRandom() {
    boolean had = hasOrder();
    List<String> segments = orderSegments();
    if (had) segments.add(", ");
    segments.add(dialect.randomOrderByClause());
  }

  public void groupBy(String groupBy) {
    groupSegments().add(groupBy);
  }

  public void having(String having) {
    havingSegments().add(having);
  }

  /** Appends a raw fragment emitted after ORDER BY. */
  public void trail(String segment) {
    trailSegments().add(segment);
  }

  public void clearTrail() {
    if (trail != null) trail.clear();
  }

  /**
   * Renders the accumulated statement; empty when {@link #select()} was never called.
   * Paging is applied by the dialect to a working copy, so rendering does not mutate this builder.
   */
  public String toSqlString() {
    if (!SELECT.equalsIgnoreCase(clause)) return "";

    StringBuilder sb = new StringBuilder(INITIAL_CAPACITY);
    sb.append("SELECT ");

    if (distinct) {
      sb.append("DISTINCT ");
      if (hasOrder() && dialect.supportsDistinctOn()) {
        sb.append("ON(").append(order.get(0)).append(") ");
      }
    }

    SqlBuilder target = this;
    if (hasPaging()) {
      target = copy();
      dialect.page(target, skip, count);
    }

    if (target.select == null || target.select.isEmpty()) {
      sb.append('*');
    } else {
      appendAll(sb, target.select);
    }

    if (target.from != null) {
      sb.append(" FROM ");
      appendAll(sb, target.from);
    }

    if (target.join != null) appendAll(sb, target.join);

    if (target.where != null && !target.where.isEmpty()) {
      sb.append(" WHERE ");
      appendAll(sb, target.where);
    }

    if (target.group != null && !target.group.isEmpty()) {
      sb.append(" GROUP BY ");
      appendAll(sb, target.group);
    }

    if (target.having != null && !target.having.isEmpty()) {
      sb.append(" HAVING ");
      appendAll(sb, target.having);
    }

    if (target.hasOrder()) {
      sb.append(" ORDER BY ");
      appendAll(sb, target.order);
    }

    if (target.trail != null) appendAll(sb, target.trail);

    return sb.toString();
  }

  private static void appendAll(StringBuilder sb, List<String> segments) {
    for (String s : segments) sb.append(s);
  }

  /** Independent copy: fragment lists and parameters are copied, dialect and prefix are shared. */
  @Override
  public SqlBuilder clone() {
    return copy();
  }

  protected SqlBuilder copy() {
    SqlBuilder c = new SqlBuilder(tablePrefix, dialect);
    c.clause = clause;
    c.select = copyOf(select);
    c.from = copyOf(from);
    c.join = copyOf(join);
    c.where = copyOf(where);
    c.group = copyOf(group);
    c.having = copyOf(having);
    c.order = copyOf(order);
    c.trail = copyOf(trail);
    c.distinct = distinct;
    c.skip = skip;
    c.count = count;
    c.parameters = new LinkedHashMap<>(parameters);
    return c;
  }

  private static List<String> copyOf(List<String> segments) {
    return segments == null ? null : new ArrayList<>(segments);
  }

  private static boolean isNullOrEmpty(String s) {
    return s == null || s.isEmpty();
  }

  @Override
  public String toString() {
    return toSqlString();
  }
}
