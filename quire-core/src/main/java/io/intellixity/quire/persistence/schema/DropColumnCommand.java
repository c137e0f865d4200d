package io.intellixity.quire.persistence.schema;

public record DropColumnCommand(String tableName, String columnName) implements SchemaCommand {
}
