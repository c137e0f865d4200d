package io.intellixity.quire.persistence.sql;

import io.intellixity.quire.persistence.schema.CommandInterpreter;

/**
 * Discoverable entry point of a dialect module.
 * Implementations are listed in {@code META-INF/quire.factories} and need a public no-arg constructor.
 */
public interface SqlDialectProvider {
  String id();

  SqlDialect dialect();

  /** {@code schema} may be null. */
  CommandInterpreter commandInterpreter(SqlDialect dialect, String schema);
}
