package io.intellixity.quire.persistence.schema;

import java.sql.JDBCType;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

public final class CreateTableCommand extends TableCommand {
  public CreateTableCommand(String name) {
    super(name);
  }

  public CreateTableCommand column(String columnName, JDBCType type) {
    return column(columnName, type, c -> {});
  }

  public CreateTableCommand column(String columnName, JDBCType type, Consumer<CreateColumnCommand> configure) {
    CreateColumnCommand column = new CreateColumnCommand(name(), columnName).withType(type);
    configure.accept(column);
    add(column);
    return this;
  }

  public CreateTableCommand column(IdentityColumnSize size, String columnName) {
    return column(columnName, size.jdbcType());
  }

  public CreateTableCommand column(IdentityColumnSize size, String columnName, Consumer<CreateColumnCommand> configure) {
    return column(columnName, size.jdbcType(), configure);
  }

  public List<CreateColumnCommand> columns() {
    List<CreateColumnCommand> out = new ArrayList<>();
    for (SchemaCommand c : tableCommands()) {
      if (c instanceof CreateColumnCommand cc) out.add(cc);
    }
    return out;
  }
}
