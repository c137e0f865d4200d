package io.intellixity.quire.persistence.jdbc.sqlite;

import io.intellixity.quire.persistence.schema.CommandInterpreter;
import io.intellixity.quire.persistence.sql.SqlDialect;
import io.intellixity.quire.persistence.sql.SqlDialectProvider;

/** SQLite dialect entry (id="sqlite"). */
public final class SqliteDialectProvider implements SqlDialectProvider {
  @Override
  public String id() {
    return "sqlite";
  }

  @Override
  public SqlDialect dialect() {
    return new SqliteDialect();
  }

  @Override
  public CommandInterpreter commandInterpreter(SqlDialect dialect, String schema) {
    return new SqliteCommandInterpreter(dialect, schema);
  }
}
