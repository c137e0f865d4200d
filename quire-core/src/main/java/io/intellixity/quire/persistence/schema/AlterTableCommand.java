package io.intellixity.quire.persistence.schema;

import io.intellixity.quire.persistence.sql.SqlDialect;

import java.sql.JDBCType;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Ordered column and index changes on an existing table.
 * Index names are prefixed with the table prefix and formatted by the dialect.
 */
public final class AlterTableCommand extends TableCommand {
  private final SqlDialect dialect;
  private final String tablePrefix;

  public AlterTableCommand(String name, SqlDialect dialect, String tablePrefix) {
    super(name);
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.tablePrefix = tablePrefix == null ? "" : tablePrefix;
  }

  public AlterTableCommand addColumn(String columnName, JDBCType type) {
    return addColumn(columnName, type, c -> {});
  }

  public AlterTableCommand addColumn(String columnName, JDBCType type, Consumer<AddColumnCommand> configure) {
    AddColumnCommand column = new AddColumnCommand(name(), columnName);
    column.withType(type);
    configure.accept(column);
    add(column);
    return this;
  }

  public AlterTableCommand dropColumn(String columnName) {
    add(new DropColumnCommand(name(), columnName));
    return this;
  }

  public AlterTableCommand renameColumn(String columnName, String newName) {
    add(new RenameColumnCommand(name(), columnName, newName));
    return this;
  }

  public AlterTableCommand alterColumn(String columnName, Consumer<AlterColumnCommand> configure) {
    AlterColumnCommand column = new AlterColumnCommand(name(), columnName);
    configure.accept(column);
    add(column);
    return this;
  }

  public AlterTableCommand createIndex(String indexName, String... columnNames) {
    if (columnNames == null || columnNames.length == 0) {
      throw new IllegalArgumentException("index " + indexName + " has no columns");
    }
    add(new AddIndexCommand(name(), dialect.formatIndexName(tablePrefix + indexName), List.of(columnNames)));
    return this;
  }

  public AlterTableCommand dropIndex(String indexName) {
    add(new DropIndexCommand(name(), dialect.formatIndexName(tablePrefix + indexName)));
    return this;
  }
}
