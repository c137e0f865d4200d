package io.intellixity.quire.persistence.jdbc.postgres;

import io.intellixity.quire.persistence.jdbc.ddl.BaseCommandInterpreter;
import io.intellixity.quire.persistence.sql.SqlDialect;

/** Postgres accepts the ANSI forms rendered by {@link BaseCommandInterpreter} as they are. */
public final class PostgresCommandInterpreter extends BaseCommandInterpreter {
  public PostgresCommandInterpreter(SqlDialect dialect, String schema) {
    super(dialect, schema);
  }
}
