package io.intellixity.quire.persistence.jdbc.mysql;

import io.intellixity.quire.persistence.jdbc.ddl.BaseCommandInterpreter;
import io.intellixity.quire.persistence.schema.AlterColumnCommand;
import io.intellixity.quire.persistence.schema.DropForeignKeyCommand;
import io.intellixity.quire.persistence.schema.DropIndexCommand;
import io.intellixity.quire.persistence.sql.SqlDialect;

import java.util.ArrayList;
import java.util.List;

/** MySQL DDL: {@code MODIFY COLUMN}, {@code DROP FOREIGN KEY} and table-scoped index drops. */
public final class MySqlCommandInterpreter extends BaseCommandInterpreter {
  public MySqlCommandInterpreter(SqlDialect dialect, String schema) {
    super(dialect, schema);
  }

  @Override
  protected List<String> renderAlterColumn(String tableName, AlterColumnCommand c) {
    List<String> out = new ArrayList<>();
    if (c.type() != null) {
      out.add("ALTER TABLE " + table(tableName) + " MODIFY COLUMN " + column(c.columnName()) + " " + type(c));
    }
    if (c.hasDefault()) {
      out.add("ALTER TABLE " + table(tableName) + " ALTER COLUMN " + column(c.columnName())
          + " SET DEFAULT " + dialect.sqlValue(c.defaultValue()));
    }
    return out;
  }

  @Override
  protected List<String> renderDropForeignKey(DropForeignKeyCommand c) {
    return List.of("ALTER TABLE " + table(c.srcTable()) + " DROP FOREIGN KEY " + column(c.name()));
  }

  @Override
  protected String renderDropIndex(String tableName, DropIndexCommand c) {
    return "DROP INDEX " + column(c.indexName()) + " ON " + table(tableName);
  }
}
