package io.intellixity.quire.persistence.schema;

public record CreateSchemaCommand(String schema) implements SchemaCommand {
  public CreateSchemaCommand {
    if (schema == null || schema.isBlank()) throw new IllegalArgumentException("schema is blank");
  }
}
