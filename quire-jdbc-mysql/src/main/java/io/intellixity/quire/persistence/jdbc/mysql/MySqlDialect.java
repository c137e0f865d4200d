package io.intellixity.quire.persistence.jdbc.mysql;

import io.intellixity.quire.persistence.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.quire.persistence.schema.IdentityColumnSize;
import io.intellixity.quire.persistence.sql.SqlBuilder;

import java.sql.SQLException;
import java.util.Set;

/** MySQL dialect implementation for JDBC. */
public final class MySqlDialect extends AbstractJdbcSqlDialect {
  /** MySQL has no unbounded LIMIT; the documented idiom is the largest BIGINT UNSIGNED. */
  static final String MAX_ROWS = "18446744073709551615";

  // 1050: table exists, 1060: duplicate column, 1061: duplicate key name, 1826: duplicate foreign key, 1007: database exists
  private static final Set<Integer> DUPLICATE_ERRORS = Set.of(1050, 1060, 1061, 1826, 1007);

  @Override public String id() { return "mysql"; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "`" + ident.replace("`", "``") + "`";
  }

  @Override
  protected int maxIdentifierLength() {
    return 64;
  }

  @Override
  public String cascadeConstraintsString() {
    return " CASCADE";
  }

  @Override
  public String randomOrderByClause() {
    return "RAND()";
  }

  /** {@code LIMIT offset, count}. */
  @Override
  public void page(SqlBuilder builder, String offset, String limit) {
    if (offset == null) {
      if (limit != null) builder.trail(" LIMIT " + limit);
      return;
    }
    builder.trail(" LIMIT " + offset + ", " + (limit == null ? MAX_ROWS : limit));
  }

  @Override
  public String identityColumnString(IdentityColumnSize size) {
    return orDefault(size) == IdentityColumnSize.INT32
        ? "int AUTO_INCREMENT PRIMARY KEY"
        : "bigint AUTO_INCREMENT PRIMARY KEY";
  }

  @Override protected String booleanType() { return "BIT"; }
  @Override protected String doubleType() { return "DOUBLE"; }
  @Override protected String textType() { return "LONGTEXT"; }
  @Override protected String timestampType() { return "DATETIME(6)"; }
  @Override protected String timestampWithZoneType() { return "DATETIME(6)"; }
  @Override protected String binaryType(Integer length) { return "LONGBLOB"; }

  @Override
  public boolean isDuplicateObject(SQLException e) {
    return e != null && (DUPLICATE_ERRORS.contains(e.getErrorCode()) || "42S01".equals(e.getSQLState()));
  }
}
