package io.intellixity.quire.persistence.schema;

public record DropForeignKeyCommand(String srcTable, String name) implements SchemaCommand {
}
