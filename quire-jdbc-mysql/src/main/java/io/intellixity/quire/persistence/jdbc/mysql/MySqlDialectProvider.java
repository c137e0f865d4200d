package io.intellixity.quire.persistence.jdbc.mysql;

import io.intellixity.quire.persistence.schema.CommandInterpreter;
import io.intellixity.quire.persistence.sql.SqlDialect;
import io.intellixity.quire.persistence.sql.SqlDialectProvider;

/** MySQL dialect entry (id="mysql"). */
public final class MySqlDialectProvider implements SqlDialectProvider {
  @Override
  public String id() {
    return "mysql";
  }

  @Override
  public SqlDialect dialect() {
    return new MySqlDialect();
  }

  @Override
  public CommandInterpreter commandInterpreter(SqlDialect dialect, String schema) {
    return new MySqlCommandInterpreter(dialect, schema);
  }
}
