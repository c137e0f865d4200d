package io.intellixity.quire.persistence.schema;

import java.sql.JDBCType;

/** Width of identity columns ({@code Id}, {@code DocumentId}, bridge keys). */
public enum IdentityColumnSize {
  INT32(JDBCType.INTEGER),
  INT64(JDBCType.BIGINT);

  private final JDBCType jdbcType;

  IdentityColumnSize(JDBCType jdbcType) {
    this.jdbcType = jdbcType;
  }

  public JDBCType jdbcType() {
    return jdbcType;
  }
}
