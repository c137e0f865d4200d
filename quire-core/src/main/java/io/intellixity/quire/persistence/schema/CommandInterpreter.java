package io.intellixity.quire.persistence.schema;

import java.util.List;

/** Translates schema commands to literal SQL statements for one dialect. */
public interface CommandInterpreter {
  /**
   * Statements to execute in order. Entries may be empty when the database has no equivalent
   * (they are skipped by the executor).
   *
   * @throws UnsupportedOperationException when the command cannot be expressed for this dialect
   */
  List<String> createSql(SchemaCommand command);
}
