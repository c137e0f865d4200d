package io.intellixity.quire.persistence.jdbc.postgres;

import io.intellixity.quire.persistence.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.quire.persistence.schema.IdentityColumnSize;

import java.sql.SQLException;
import java.util.Set;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Keeps only Postgres-specific overrides.
 * Generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect {
  // duplicate_table, duplicate_object, duplicate_schema, duplicate_column
  private static final Set<String> DUPLICATE_STATES = Set.of("42P07", "42710", "42P06", "42701");

  @Override public String id() { return "postgres"; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  /** NAMEDATALEN - 1. */
  @Override
  protected int maxIdentifierLength() {
    return 63;
  }

  @Override
  protected int maxVarcharLength() {
    return 10485760;
  }

  @Override
  public String cascadeConstraintsString() {
    return " CASCADE";
  }

  @Override
  public boolean supportsDistinctOn() {
    return true;
  }

  @Override
  public String identityColumnString(IdentityColumnSize size) {
    return orDefault(size) == IdentityColumnSize.INT32 ? "SERIAL PRIMARY KEY" : "BIGSERIAL PRIMARY KEY";
  }

  @Override
  protected String binaryType(Integer length) {
    return "BYTEA";
  }

  @Override
  public boolean isDuplicateObject(SQLException e) {
    return e != null && e.getSQLState() != null && DUPLICATE_STATES.contains(e.getSQLState());
  }
}
