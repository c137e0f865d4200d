package io.intellixity.quire.persistence.schema;

import java.util.List;

public record AddIndexCommand(String tableName, String indexName, List<String> columnNames) implements SchemaCommand {
  public AddIndexCommand {
    columnNames = List.copyOf(columnNames);
  }
}
