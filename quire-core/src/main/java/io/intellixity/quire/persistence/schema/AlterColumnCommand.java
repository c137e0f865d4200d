package io.intellixity.quire.persistence.schema;

public final class AlterColumnCommand extends ColumnCommand {
  public AlterColumnCommand(String tableName, String columnName) {
    super(tableName, columnName);
  }
}
