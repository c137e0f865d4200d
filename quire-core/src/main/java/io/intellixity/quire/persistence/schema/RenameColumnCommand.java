package io.intellixity.quire.persistence.schema;

public record RenameColumnCommand(String tableName, String columnName, String newColumnName) implements SchemaCommand {
  public RenameColumnCommand {
    if (newColumnName == null || newColumnName.isBlank()) throw new IllegalArgumentException("new column name is blank");
  }
}
