package io.intellixity.quire.persistence.jdbc.sqlite;

import io.intellixity.quire.persistence.jdbc.ddl.BaseCommandInterpreter;
import io.intellixity.quire.persistence.schema.AlterColumnCommand;
import io.intellixity.quire.persistence.schema.CreateForeignKeyCommand;
import io.intellixity.quire.persistence.schema.CreateSchemaCommand;
import io.intellixity.quire.persistence.schema.DropForeignKeyCommand;
import io.intellixity.quire.persistence.sql.SqlDialect;

import java.util.List;

/**
 * SQLite DDL.
 *
 * SQLite cannot add or drop constraints on an existing table, so foreign-key commands render no
 * statements. Schemas are attached databases rather than DDL objects.
 */
public final class SqliteCommandInterpreter extends BaseCommandInterpreter {
  public SqliteCommandInterpreter(SqlDialect dialect, String schema) {
    super(dialect, null);
  }

  @Override
  protected List<String> renderCreateForeignKey(CreateForeignKeyCommand c) {
    return List.of();
  }

  @Override
  protected List<String> renderDropForeignKey(DropForeignKeyCommand c) {
    return List.of();
  }

  @Override
  protected List<String> renderCreateSchema(CreateSchemaCommand c) {
    return List.of();
  }

  @Override
  protected List<String> renderAlterColumn(String tableName, AlterColumnCommand c) {
    throw new UnsupportedOperationException("SQLite cannot alter column " + c.columnName() + " of table " + tableName);
  }
}
