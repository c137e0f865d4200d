package io.intellixity.quire.persistence.sql;

import io.intellixity.quire.persistence.schema.IdentityColumnSize;

import java.sql.JDBCType;
import java.sql.SQLException;

/**
 * Per-database rules consumed by {@link SqlBuilder} and the schema command interpreters.
 *
 * One implementation per supported database; a builder binds exactly one dialect for its lifetime.
 * Implementations are stateless.
 */
public interface SqlDialect {
  /** Stable identifier used by configuration ({@code postgres}, {@code sqlite}, ...). */
  String id();

  /** Quotes a (possibly schema-qualified) table name. {@code schema} may be null. */
  String quoteForTableName(String name, String schema);

  String quoteForColumnName(String name);

  String quoteForAliasName(String name);

  /** Applies the database's identifier rules to a constraint name. */
  String formatKeyName(String name);

  /** Applies the database's identifier rules to an index name. */
  String formatIndexName(String name);

  /**
   * Suffix appended to {@code DROP TABLE} to drop dependent constraints.
   * Empty when the database cannot cascade, in which case foreign keys are dropped explicitly first.
   */
  String cascadeConstraintsString();

  String randomOrderByClause();

  boolean supportsDistinctOn();

  /**
   * Rewrites {@code builder} into this database's paging idiom.
   * Either bound may be null; both are raw SQL text so they may be parameter placeholders.
   */
  void page(SqlBuilder builder, String offset, String limit);

  boolean supportsIdentityColumns();

  /** Column definition used in place of the type for identity columns (implies primary key). */
  String identityColumnString(IdentityColumnSize size);

  /** DDL type name. {@code length}, {@code precision} and {@code scale} may be null. */
  String typeName(JDBCType type, Integer length, Integer precision, Integer scale);

  /** Literal rendering used by {@code DEFAULT} clauses. */
  String sqlValue(Object value);

  /** True when {@code e} reports that the object being created already exists. */
  default boolean isDuplicateObject(SQLException e) {
    return false;
  }
}
