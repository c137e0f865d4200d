package io.intellixity.quire.persistence.jdbc.dialect;

import io.intellixity.quire.persistence.schema.IdentityColumnSize;
import io.intellixity.quire.persistence.sql.SqlBuilder;
import io.intellixity.quire.persistence.sql.SqlDialect;

import java.sql.JDBCType;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.UUID;

/**
 * JDBC-generic SQL dialect base.
 *
 * Provides ANSI defaults for quoting, identifier-length limits, type names, literals and
 * LIMIT/OFFSET paging. Database-specific dialects override the hooks that differ.
 */
public abstract class AbstractJdbcSqlDialect implements SqlDialect {
  public static final int DEFAULT_STRING_LENGTH = 255;
  public static final int DEFAULT_DECIMAL_PRECISION = 19;
  public static final int DEFAULT_DECIMAL_SCALE = 5;

  private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

  /** Quotes one identifier part. */
  protected abstract String quoteIdent(String ident);

  /** Longest identifier the database accepts; 0 means no limit. */
  protected int maxIdentifierLength() {
    return 0;
  }

  /** Longest VARCHAR before {@link #textType()} is used instead. */
  protected int maxVarcharLength() {
    return 4000;
  }

  @Override
  public String quoteForTableName(String name, String schema) {
    if (schema == null || schema.isBlank()) return quoteIdent(name);
    return quoteIdent(schema) + "." + quoteIdent(name);
  }

  @Override
  public String quoteForColumnName(String name) {
    return quoteIdent(name);
  }

  @Override
  public String quoteForAliasName(String name) {
    return quoteIdent(name);
  }

  @Override
  public String formatKeyName(String name) {
    return truncate(name);
  }

  @Override
  public String formatIndexName(String name) {
    return truncate(name);
  }

  private String truncate(String name) {
    Objects.requireNonNull(name, "name");
    int max = maxIdentifierLength();
    return (max > 0 && name.length() > max) ? name.substring(0, max) : name;
  }

  @Override
  public String cascadeConstraintsString() {
    return "";
  }

  @Override
  public String randomOrderByClause() {
    return "random()";
  }

  @Override
  public boolean supportsDistinctOn() {
    return false;
  }

  /** {@code LIMIT n OFFSET m}; either part is omitted when absent. */
  @Override
  public void page(SqlBuilder builder, String offset, String limit) {
    if (limit != null) builder.trail(" LIMIT " + limit);
    if (offset != null) builder.trail(" OFFSET " + offset);
  }

  @Override
  public boolean supportsIdentityColumns() {
    return true;
  }

  @Override
  public String typeName(JDBCType type, Integer length, Integer precision, Integer scale) {
    if (type == null) throw new IllegalArgumentException("Column type is required");
    return switch (type) {
      case BOOLEAN, BIT -> booleanType();
      case TINYINT, SMALLINT -> "SMALLINT";
      case INTEGER -> "INT";
      case BIGINT -> "BIGINT";
      case REAL, FLOAT -> "REAL";
      case DOUBLE -> doubleType();
      case DECIMAL, NUMERIC -> "DECIMAL("
          + (precision == null ? DEFAULT_DECIMAL_PRECISION : precision) + ", "
          + (scale == null ? DEFAULT_DECIMAL_SCALE : scale) + ")";
      case CHAR, NCHAR -> "CHAR(" + (length == null ? 1 : length) + ")";
      case VARCHAR, NVARCHAR -> {
        int len = length == null ? DEFAULT_STRING_LENGTH : length;
        yield len > maxVarcharLength() ? textType() : varcharType(len);
      }
      case LONGVARCHAR, LONGNVARCHAR, CLOB, NCLOB -> textType();
      case DATE -> "DATE";
      case TIME -> "TIME";
      case TIMESTAMP -> timestampType();
      case TIMESTAMP_WITH_TIMEZONE -> timestampWithZoneType();
      case BINARY, VARBINARY, LONGVARBINARY, BLOB -> binaryType(length);
      default -> throw new UnsupportedOperationException("Column type " + type + " is not supported by dialect " + id());
    };
  }

  protected String booleanType() { return "BOOLEAN"; }
  protected String doubleType() { return "DOUBLE PRECISION"; }
  protected String varcharType(int length) { return "VARCHAR(" + length + ")"; }
  protected String textType() { return "TEXT"; }
  protected String timestampType() { return "TIMESTAMP"; }
  protected String timestampWithZoneType() { return "TIMESTAMP WITH TIME ZONE"; }
  protected String binaryType(Integer length) { return "BLOB"; }

  @Override
  public String sqlValue(Object value) {
    if (value == null) return "NULL";
    if (value instanceof Boolean b) return booleanLiteral(b);
    if (value instanceof Number n) return n.toString();
    if (value instanceof CharSequence || value instanceof Character || value instanceof UUID || value instanceof Enum<?>) {
      return quoteString(String.valueOf(value));
    }
    if (value instanceof LocalDateTime ldt) return quoteString(TIMESTAMP.format(ldt));
    if (value instanceof LocalDate || value instanceof LocalTime) return quoteString(value.toString());
    if (value instanceof Instant || value instanceof OffsetDateTime) return quoteString(value.toString());
    throw new IllegalArgumentException("Cannot render a " + value.getClass().getName() + " literal for dialect " + id());
  }

  protected String booleanLiteral(boolean b) {
    return b ? "TRUE" : "FALSE";
  }

  protected static String quoteString(String s) {
    return "'" + s.replace("'", "''") + "'";
  }

  protected static IdentityColumnSize orDefault(IdentityColumnSize size) {
    return size == null ? IdentityColumnSize.INT64 : size;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + id() + "]";
  }
}
