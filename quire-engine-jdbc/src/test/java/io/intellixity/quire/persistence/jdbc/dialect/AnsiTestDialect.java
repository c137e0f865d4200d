package io.intellixity.quire.persistence.jdbc.dialect;

import io.intellixity.quire.persistence.schema.IdentityColumnSize;

/** Double-quoting dialect with a short identifier limit. */
public final class AnsiTestDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "ansi"; }

  @Override
  protected String quoteIdent(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected int maxIdentifierLength() {
    return 16;
  }

  @Override
  protected int maxVarcharLength() {
    return 1000;
  }

  @Override
  public String identityColumnString(IdentityColumnSize size) {
    return orDefault(size) == IdentityColumnSize.INT32 ? "INT IDENTITY" : "BIGINT IDENTITY";
  }
}
