package io.intellixity.quire.persistence.jdbc.sqlserver;

import io.intellixity.quire.persistence.jdbc.ddl.BaseCommandInterpreter;
import io.intellixity.quire.persistence.schema.AlterColumnCommand;
import io.intellixity.quire.persistence.schema.DropIndexCommand;
import io.intellixity.quire.persistence.schema.RenameColumnCommand;
import io.intellixity.quire.persistence.sql.SqlDialect;

import java.util.ArrayList;
import java.util.List;

/** SQL Server DDL: T-SQL column alteration, {@code sp_rename} and table-scoped index drops. */
public final class SqlServerCommandInterpreter extends BaseCommandInterpreter {
  public SqlServerCommandInterpreter(SqlDialect dialect, String schema) {
    super(dialect, schema);
  }

  @Override
  protected String addColumnString() {
    return "ADD ";
  }

  @Override
  protected List<String> renderRenameColumn(String tableName, RenameColumnCommand c) {
    String target = (schema == null ? "" : schema + ".") + tableName + "." + c.columnName();
    return List.of("EXEC sp_rename '" + escape(target) + "', '" + escape(c.newColumnName()) + "', 'COLUMN'");
  }

  @Override
  protected List<String> renderAlterColumn(String tableName, AlterColumnCommand c) {
    List<String> out = new ArrayList<>();
    if (c.type() != null) {
      out.add("ALTER TABLE " + table(tableName) + " ALTER COLUMN " + column(c.columnName()) + " " + type(c));
    }
    if (c.hasDefault()) {
      String constraint = dialect.formatKeyName("DF_" + tableName + "_" + c.columnName());
      out.add("ALTER TABLE " + table(tableName) + " ADD CONSTRAINT " + column(constraint)
          + " DEFAULT " + dialect.sqlValue(c.defaultValue()) + " FOR " + column(c.columnName()));
    }
    return out;
  }

  @Override
  protected String renderDropIndex(String tableName, DropIndexCommand c) {
    return "DROP INDEX " + column(c.indexName()) + " ON " + table(tableName);
  }

  private static String escape(String s) {
    return s.replace("'", "''");
  }
}
