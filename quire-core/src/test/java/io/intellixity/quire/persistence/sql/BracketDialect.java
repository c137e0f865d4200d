package io.intellixity.quire.persistence.sql;

import io.intellixity.quire.persistence.schema.IdentityColumnSize;

import java.sql.JDBCType;
import java.sql.SQLException;

/** Bracket-quoting dialect for tests: {@code LIMIT/OFFSET} paging, configurable cascade and DISTINCT ON. */
public final class BracketDialect implements SqlDialect {
  private final boolean cascades;
  private final boolean distinctOn;

  public BracketDialect() {
    this(false, false);
  }

  public BracketDialect(boolean cascades, boolean distinctOn) {
    this.cascades = cascades;
    this.distinctOn = distinctOn;
  }

  @Override public String id() { return "bracket"; }

  @Override
  public String quoteForTableName(String name, String schema) {
    return schema == null ? "[" + name + "]" : "[" + schema + "].[" + name + "]";
  }

  @Override public String quoteForColumnName(String name) { return "[" + name + "]"; }
  @Override public String quoteForAliasName(String name) { return "[" + name + "]"; }
  @Override public String formatKeyName(String name) { return name; }
  @Override public String formatIndexName(String name) { return name; }
  @Override public String cascadeConstraintsString() { return cascades ? " CASCADE" : ""; }
  @Override public String randomOrderByClause() { return "RANDOM()"; }
  @Override public boolean supportsDistinctOn() { return distinctOn; }

  @Override
  public void page(SqlBuilder builder, String offset, String limit) {
    if (limit != null) builder.trail(" LIMIT " + limit);
    if (offset != null) builder.trail(" OFFSET " + offset);
  }

  @Override public boolean supportsIdentityColumns() { return true; }
  @Override public String identityColumnString(IdentityColumnSize size) { return "IDENTITY"; }

  @Override
  public String typeName(JDBCType type, Integer length, Integer precision, Integer scale) {
    return type.getName();
  }

  @Override
  public String sqlValue(Object value) {
    return String.valueOf(value);
  }

  @Override
  public boolean isDuplicateObject(SQLException e) {
    return "42S01".equals(e.getSQLState());
  }
}
