package io.intellixity.quire.persistence.jdbc;

import io.intellixity.quire.persistence.exec.StatementExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Statement;

/**
 * Executes DDL through a fresh {@link Statement} per call.
 *
 * Inside a transaction each statement runs under its own savepoint, so a rejected statement leaves the
 * transaction usable for the statements after it.
 */
public final class JdbcStatementExecutor implements StatementExecutor {
  private static final Logger log = LoggerFactory.getLogger(JdbcStatementExecutor.class);

  @Override
  public void execute(Connection connection, String sql) throws SQLException {
    long start = System.nanoTime();
    Savepoint savepoint = connection.getAutoCommit() ? null : connection.setSavepoint();
    try (Statement st = connection.createStatement()) {
      st.execute(sql);
    } catch (SQLException e) {
      if (savepoint != null) {
        try {
          connection.rollback(savepoint);
        } catch (SQLException re) {
          e.addSuppressed(re);
        }
        log.debug("quire.jdbc_savepoint_rolled_back sqlState={}", e.getSQLState());
      }
      throw e;
    }
    if (savepoint != null) connection.releaseSavepoint(savepoint);
    if (log.isDebugEnabled()) {
      log.debug("quire.jdbc_done op=DDL durationMs={} sqlLen={}", (System.nanoTime() - start) / 1_000_000.0, sql.length());
    }
  }
}
