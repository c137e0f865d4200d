package io.intellixity.quire.persistence.schema;

import java.sql.JDBCType;

/** Column attributes shared by column creation and alteration. */
public abstract class ColumnCommand implements SchemaCommand {
  private final String tableName;
  private final String columnName;
  private JDBCType type;
  private Integer length;
  private Integer precision;
  private Integer scale;
  private Object defaultValue;
  private boolean hasDefault;

  protected ColumnCommand(String tableName, String columnName) {
    if (columnName == null || columnName.isBlank()) throw new IllegalArgumentException("column name is blank");
    this.tableName = tableName;
    this.columnName = columnName;
  }

  public String tableName() { return tableName; }
  public String columnName() { return columnName; }
  public JDBCType type() { return type; }
  public Integer length() { return length; }
  public Integer precision() { return precision; }
  public Integer scale() { return scale; }
  public Object defaultValue() { return defaultValue; }
  public boolean hasDefault() { return hasDefault; }

  public ColumnCommand withType(JDBCType type) {
    this.type = type;
    return this;
  }

  public ColumnCommand withLength(int length) {
    if (length <= 0) throw new IllegalArgumentException("length must be > 0");
    this.length = length;
    return this;
  }

  public ColumnCommand withPrecision(int precision, int scale) {
    if (precision <= 0) throw new IllegalArgumentException("precision must be > 0");
    if (scale < 0 || scale > precision) throw new IllegalArgumentException("scale must be in [0, precision]");
    this.precision = precision;
    this.scale = scale;
    return this;
  }

  /** {@code null} renders as {@code DEFAULT NULL}. */
  public ColumnCommand withDefault(Object value) {
    this.defaultValue = value;
    this.hasDefault = true;
    return this;
  }
}
