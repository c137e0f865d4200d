package io.intellixity.quire.persistence.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Base for commands addressing one table and carrying an ordered list of sub-commands. */
public abstract class TableCommand implements SchemaCommand {
  private final String name;
  private final List<SchemaCommand> tableCommands = new ArrayList<>();

  protected TableCommand(String name) {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("table name is blank");
    this.name = name;
  }

  public String name() { return name; }

  public List<SchemaCommand> tableCommands() {
    return Collections.unmodifiableList(tableCommands);
  }

  protected <C extends SchemaCommand> C add(C command) {
    tableCommands.add(Objects.requireNonNull(command, "command"));
    return command;
  }
}
