package io.intellixity.quire.persistence.jdbc.sqlite;

import io.intellixity.quire.persistence.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.quire.persistence.schema.IdentityColumnSize;
import io.intellixity.quire.persistence.sql.SqlBuilder;

import java.sql.SQLException;

/**
 * SQLite dialect. A database file has a single schema, so schema names are ignored.
 */
public final class SqliteDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "sqlite"; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  public String quoteForTableName(String name, String schema) {
    return quoteIdent(name);
  }

  /** SQLite requires LIMIT before OFFSET; -1 means unbounded. */
  @Override
  public void page(SqlBuilder builder, String offset, String limit) {
    if (limit != null) {
      builder.trail(" LIMIT " + limit);
    } else if (offset != null) {
      builder.trail(" LIMIT -1");
    }
    if (offset != null) builder.trail(" OFFSET " + offset);
  }

  /** Only an INTEGER PRIMARY KEY aliases the rowid, whatever the requested size. */
  @Override
  public String identityColumnString(IdentityColumnSize size) {
    return "INTEGER PRIMARY KEY AUTOINCREMENT";
  }

  @Override
  protected String doubleType() {
    return "DOUBLE";
  }

  @Override
  protected String booleanLiteral(boolean b) {
    return b ? "1" : "0";
  }

  @Override
  public boolean isDuplicateObject(SQLException e) {
    return e != null && e.getMessage() != null && e.getMessage().contains("already exists");
  }
}
