package io.intellixity.quire.persistence.jdbc;

import io.intellixity.quire.persistence.config.QuireConfiguration;
import io.intellixity.quire.persistence.schema.SchemaBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Runs a schema migration in its own transaction: commit on success, rollback and rethrow on failure.
 */
public final class JdbcMigrationRunner {
  private static final Logger log = LoggerFactory.getLogger(JdbcMigrationRunner.class);

  private final JdbcHandle handle;
  private final QuireConfiguration configuration;

  public JdbcMigrationRunner(JdbcHandle handle, QuireConfiguration configuration) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.configuration = Objects.requireNonNull(configuration, "configuration");
  }

  public void run(Consumer<SchemaBuilder> migration) {
    run(true, migration);
  }

  public void run(boolean throwOnError, Consumer<SchemaBuilder> migration) {
    Objects.requireNonNull(migration, "migration");
    long start = System.nanoTime();
    try (Connection c = handle.client().getConnection()) {
      boolean autoCommit = c.getAutoCommit();
      c.setAutoCommit(false);
      try {
        migration.accept(new SchemaBuilder(configuration, c, throwOnError));
        c.commit();
      } catch (RuntimeException | SQLException e) {
        try {
          c.rollback();
        } catch (SQLException re) {
          e.addSuppressed(re);
        }
        try {
          c.setAutoCommit(autoCommit);
        } catch (SQLException ae) {
          e.addSuppressed(ae);
        }
        log.debug("quire.migration_rolled_back handleId={} error={}", handle.id(), e.toString());
        throw e;
      }
      c.setAutoCommit(autoCommit);
    } catch (SQLException e) {
      throw new RuntimeException("Migration on handle " + handle.id() + " failed", e);
    }
    log.debug("quire.migration_done handleId={} dialect={} throwOnError={} durationMs={}",
        handle.id(), configuration.dialect().id(), throwOnError, (System.nanoTime() - start) / 1_000_000.0);
  }
}
