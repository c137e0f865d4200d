package io.intellixity.quire.persistence.schema;

import java.util.Objects;

/** Why a schema step failed, with the original cause. */
public record SchemaFailure(Kind kind, String operation, Throwable cause) {
  public enum Kind {
    /** The naming convention could not produce a table name. */
    NAME_RESOLUTION,
    /** The table, constraint or index already exists. */
    DUPLICATE_OBJECT,
    /** The command cannot be translated for the active dialect. */
    INTERPRETER,
    /** The database rejected the statement. */
    EXECUTION
  }

  public SchemaFailure {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(cause, "cause");
  }
}
