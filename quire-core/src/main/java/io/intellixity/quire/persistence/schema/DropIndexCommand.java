package io.intellixity.quire.persistence.schema;

public record DropIndexCommand(String tableName, String indexName) implements SchemaCommand {
}
