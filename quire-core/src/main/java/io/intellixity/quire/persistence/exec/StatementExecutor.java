package io.intellixity.quire.persistence.exec;

import java.sql.Connection;
import java.sql.SQLException;

/** Executes one literal, parameterless statement on a connection and discards any result. */
@FunctionalInterface
public interface StatementExecutor {
  void execute(Connection connection, String sql) throws SQLException;
}
