package io.intellixity.quire.persistence.schema;

import java.sql.JDBCType;

public final class CreateColumnCommand extends ColumnCommand {
  private boolean primaryKey;
  private boolean identity;
  private boolean notNull;
  private boolean unique;

  public CreateColumnCommand(String tableName, String columnName) {
    super(tableName, columnName);
  }

  public boolean isPrimaryKey() { return primaryKey; }
  public boolean isIdentity() { return identity; }
  public boolean isNotNull() { return notNull; }
  public boolean isUnique() { return unique; }

  public CreateColumnCommand primaryKey() {
    primaryKey = true;
    notNull = true;
    return this;
  }

  /** Identity implies primary key. */
  public CreateColumnCommand identity() {
    identity = true;
    return primaryKey();
  }

  public CreateColumnCommand notNull() {
    notNull = true;
    return this;
  }

  public CreateColumnCommand nullable() {
    notNull = false;
    return this;
  }

  public CreateColumnCommand unique() {
    unique = true;
    return this;
  }

  @Override
  public CreateColumnCommand withType(JDBCType type) {
    super.withType(type);
    return this;
  }

  @Override
  public CreateColumnCommand withLength(int length) {
    super.withLength(length);
    return this;
  }

  @Override
  public CreateColumnCommand withPrecision(int precision, int scale) {
    super.withPrecision(precision, scale);
    return this;
  }

  @Override
  public CreateColumnCommand withDefault(Object value) {
    super.withDefault(value);
    return this;
  }
}
