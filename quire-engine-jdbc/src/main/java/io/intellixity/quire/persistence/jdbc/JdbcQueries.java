package io.intellixity.quire.persistence.jdbc;

import io.intellixity.quire.persistence.sql.SqlBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/** Executes a built SELECT on a connection and maps each row. */
public final class JdbcQueries {
  private static final Logger log = LoggerFactory.getLogger(JdbcQueries.class);

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  private JdbcQueries() {}

  public static <T> List<T> query(Connection connection, SqlBuilder builder, RowMapper<T> mapper) throws SQLException {
    SqlStatement ss = NamedParameterCompiler.compile(builder);
    long start = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug("quire.jdbc op=SELECT bindCount={} sql={}", ss.values().size(), ss.sql());
    }
    try (PreparedStatement ps = connection.prepareStatement(ss.sql())) {
      for (int i = 0; i < ss.values().size(); i++) {
        ps.setObject(i + 1, ss.values().get(i));
      }
      try (ResultSet rs = ps.executeQuery()) {
        List<T> out = new ArrayList<>();
        while (rs.next()) out.add(mapper.map(rs));
        if (log.isDebugEnabled()) {
          log.debug("quire.jdbc_done op=SELECT durationMs={} result={}", (System.nanoTime() - start) / 1_000_000.0, out.size());
        }
        return out;
      }
    }
  }
}
