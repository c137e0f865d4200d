package io.intellixity.quire.persistence.jdbc.sqlserver;

import io.intellixity.quire.persistence.schema.CommandInterpreter;
import io.intellixity.quire.persistence.sql.SqlDialect;
import io.intellixity.quire.persistence.sql.SqlDialectProvider;

/** SQL Server dialect entry (id="sqlserver"). */
public final class SqlServerDialectProvider implements SqlDialectProvider {
  @Override
  public String id() {
    return "sqlserver";
  }

  @Override
  public SqlDialect dialect() {
    return new SqlServerDialect();
  }

  @Override
  public CommandInterpreter commandInterpreter(SqlDialect dialect, String schema) {
    return new SqlServerCommandInterpreter(dialect, schema);
  }
}
