package io.intellixity.quire.persistence.schema;

/** Column added by {@code ALTER TABLE}; supports the same modifiers as a created column. */
public final class AddColumnCommand extends ColumnCommand {
  private boolean notNull;
  private boolean unique;

  public AddColumnCommand(String tableName, String columnName) {
    super(tableName, columnName);
  }

  public boolean isNotNull() { return notNull; }
  public boolean isUnique() { return unique; }

  public AddColumnCommand notNull() {
    notNull = true;
    return this;
  }

  public AddColumnCommand nullable() {
    notNull = false;
    return this;
  }

  public AddColumnCommand unique() {
    unique = true;
    return this;
  }
}
