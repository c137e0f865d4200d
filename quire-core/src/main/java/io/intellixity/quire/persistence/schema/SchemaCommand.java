package io.intellixity.quire.persistence.schema;

/** A single DDL intent, translated to SQL text by a {@link CommandInterpreter}. */
public interface SchemaCommand {
}
