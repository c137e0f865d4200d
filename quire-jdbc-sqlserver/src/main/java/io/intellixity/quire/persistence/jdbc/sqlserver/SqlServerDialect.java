package io.intellixity.quire.persistence.jdbc.sqlserver;

import io.intellixity.quire.persistence.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.quire.persistence.schema.IdentityColumnSize;
import io.intellixity.quire.persistence.sql.SqlBuilder;

import java.sql.SQLException;
import java.util.Set;

/**
 * SQL Server dialect implementation for JDBC.
 *
 * Paging uses {@code TOP (n)} when only a limit is set, and {@code OFFSET .. FETCH} otherwise,
 * which SQL Server only accepts after an ORDER BY.
 */
public final class SqlServerDialect extends AbstractJdbcSqlDialect {
  // 2714: object exists, 1913: index exists, 2705: duplicate column, 1801: database exists
  private static final Set<Integer> DUPLICATE_ERRORS = Set.of(2714, 1913, 2705, 1801);

  @Override public String id() { return "sqlserver"; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "[" + ident.replace("]", "]]") + "]";
  }

  @Override
  protected int maxIdentifierLength() {
    return 128;
  }

  @Override
  public String randomOrderByClause() {
    return "newid()";
  }

  @Override
  public void page(SqlBuilder builder, String offset, String limit) {
    if (offset == null) {
      if (limit == null) return;
      if (builder.selectors().isEmpty()) builder.selector("*");
      builder.insertSelector("TOP (" + limit + ") ");
      return;
    }
    if (!builder.hasOrder()) builder.orderBy("(SELECT NULL)");
    builder.trail(" OFFSET " + offset + " ROWS");
    if (limit != null) builder.trail(" FETCH NEXT " + limit + " ROWS ONLY");
  }

  @Override
  public String identityColumnString(IdentityColumnSize size) {
    return orDefault(size) == IdentityColumnSize.INT32
        ? "int IDENTITY(1,1) PRIMARY KEY"
        : "bigint IDENTITY(1,1) PRIMARY KEY";
  }

  @Override protected String booleanType() { return "BIT"; }
  @Override protected String doubleType() { return "FLOAT"; }
  @Override protected String varcharType(int length) { return "NVARCHAR(" + length + ")"; }
  @Override protected String textType() { return "NVARCHAR(MAX)"; }
  @Override protected String timestampType() { return "DATETIME2"; }
  @Override protected String timestampWithZoneType() { return "DATETIMEOFFSET"; }

  @Override
  protected String binaryType(Integer length) {
    return length == null || length > 8000 ? "VARBINARY(MAX)" : "VARBINARY(" + length + ")";
  }

  @Override
  protected String booleanLiteral(boolean b) {
    return b ? "1" : "0";
  }

  @Override
  public boolean isDuplicateObject(SQLException e) {
    return e != null && DUPLICATE_ERRORS.contains(e.getErrorCode());
  }
}
