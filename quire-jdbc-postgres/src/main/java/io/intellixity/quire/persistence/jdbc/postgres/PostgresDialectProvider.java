package io.intellixity.quire.persistence.jdbc.postgres;

import io.intellixity.quire.persistence.schema.CommandInterpreter;
import io.intellixity.quire.persistence.sql.SqlDialect;
import io.intellixity.quire.persistence.sql.SqlDialectProvider;

/** Postgres dialect entry (id="postgres"). */
public final class PostgresDialectProvider implements SqlDialectProvider {
  @Override
  public String id() {
    return "postgres";
  }

  @Override
  public SqlDialect dialect() {
    return new PostgresDialect();
  }

  @Override
  public CommandInterpreter commandInterpreter(SqlDialect dialect, String schema) {
    return new PostgresCommandInterpreter(dialect, schema);
  }
}
