package io.intellixity.quire.persistence.schema;

public final class DropTableCommand extends TableCommand {
  public DropTableCommand(String name) {
    super(name);
  }
}
