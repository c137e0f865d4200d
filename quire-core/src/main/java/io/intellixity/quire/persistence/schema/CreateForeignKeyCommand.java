package io.intellixity.quire.persistence.schema;

import java.util.List;

/** Named constraint binding {@code srcColumns} of {@code srcTable} to {@code destColumns} of {@code destTable}, in order. */
public record CreateForeignKeyCommand(String name, String srcTable, List<String> srcColumns,
                                      String destTable, List<String> destColumns) implements SchemaCommand {
  public CreateForeignKeyCommand {
    srcColumns = List.copyOf(srcColumns);
    destColumns = List.copyOf(destColumns);
    if (srcColumns.isEmpty()) throw new IllegalArgumentException("foreign key " + name + " has no source columns");
    if (srcColumns.size() != destColumns.size()) {
      throw new IllegalArgumentException("foreign key " + name + " column counts differ: "
          + srcColumns.size() + " vs " + destColumns.size());
    }
  }
}
