package io.intellixity.quire.persistence.jdbc.ddl;

import io.intellixity.quire.persistence.schema.AddColumnCommand;
import io.intellixity.quire.persistence.schema.AddIndexCommand;
import io.intellixity.quire.persistence.schema.AlterColumnCommand;
import io.intellixity.quire.persistence.schema.AlterTableCommand;
import io.intellixity.quire.persistence.schema.ColumnCommand;
import io.intellixity.quire.persistence.schema.CommandInterpreter;
import io.intellixity.quire.persistence.schema.CreateColumnCommand;
import io.intellixity.quire.persistence.schema.CreateForeignKeyCommand;
import io.intellixity.quire.persistence.schema.CreateSchemaCommand;
import io.intellixity.quire.persistence.schema.CreateTableCommand;
import io.intellixity.quire.persistence.schema.DropColumnCommand;
import io.intellixity.quire.persistence.schema.DropForeignKeyCommand;
import io.intellixity.quire.persistence.schema.DropIndexCommand;
import io.intellixity.quire.persistence.schema.DropTableCommand;
import io.intellixity.quire.persistence.schema.IdentityColumnSize;
import io.intellixity.quire.persistence.schema.RenameColumnCommand;
import io.intellixity.quire.persistence.schema.SchemaCommand;
import io.intellixity.quire.persistence.sql.SqlDialect;

import java.sql.JDBCType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ANSI DDL rendering for schema commands.
 *
 * Dialect interpreters override the hooks whose syntax differs (column alteration, renames,
 * index and constraint drops) and return empty statements for commands the database has no
 * equivalent for.
 */
public class BaseCommandInterpreter implements CommandInterpreter {
  protected final SqlDialect dialect;
  protected final String schema;

  public BaseCommandInterpreter(SqlDialect dialect, String schema) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.schema = (schema == null || schema.isBlank()) ? null : schema;
  }

  @Override
  public final List<String> createSql(SchemaCommand command) {
    Objects.requireNonNull(command, "command");
    if (command instanceof CreateTableCommand c) return renderCreateTable(c);
    if (command instanceof AlterTableCommand c) return renderAlterTable(c);
    if (command instanceof DropTableCommand c) return renderDropTable(c);
    if (command instanceof CreateForeignKeyCommand c) return renderCreateForeignKey(c);
    if (command instanceof DropForeignKeyCommand c) return renderDropForeignKey(c);
    if (command instanceof CreateSchemaCommand c) return renderCreateSchema(c);
    throw new IllegalArgumentException("Unknown schema command: " + command.getClass().getName());
  }

  protected List<String> renderCreateTable(CreateTableCommand command) {
    List<CreateColumnCommand> columns = command.columns();
    if (columns.isEmpty()) throw new IllegalArgumentException("Table " + command.name() + " has no columns");

    List<String> definitions = new ArrayList<>();
    List<String> primaryKeys = new ArrayList<>();
    for (CreateColumnCommand c : columns) {
      definitions.add(columnDefinition(c));
      boolean identityKey = c.isIdentity() && dialect.supportsIdentityColumns();
      if (c.isPrimaryKey() && !identityKey) primaryKeys.add(column(c.columnName()));
    }
    if (!primaryKeys.isEmpty()) {
      definitions.add("PRIMARY KEY (" + String.join(", ", primaryKeys) + ")");
    }

    return List.of("CREATE TABLE " + table(command.name()) + " (" + String.join(", ", definitions) + ")");
  }

  protected String columnDefinition(CreateColumnCommand c) {
    StringBuilder sb = new StringBuilder(column(c.columnName())).append(' ');
    boolean identity = c.isIdentity() && dialect.supportsIdentityColumns();
    if (identity) {
      sb.append(dialect.identityColumnString(identitySize(c.type())));
    } else {
      sb.append(type(c));
    }
    if (c.hasDefault()) sb.append(" DEFAULT ").append(dialect.sqlValue(c.defaultValue()));
    sb.append(identity || c.isNotNull() ? " NOT NULL" : " NULL");
    if (c.isUnique() && !c.isPrimaryKey()) sb.append(" UNIQUE");
    return sb.toString();
  }

  protected String columnDefinition(AddColumnCommand c) {
    StringBuilder sb = new StringBuilder(column(c.columnName())).append(' ').append(type(c));
    if (c.hasDefault()) sb.append(" DEFAULT ").append(dialect.sqlValue(c.defaultValue()));
    sb.append(c.isNotNull() ? " NOT NULL" : " NULL");
    if (c.isUnique()) sb.append(" UNIQUE");
    return sb.toString();
  }

  protected List<String> renderAlterTable(AlterTableCommand command) {
    List<String> out = new ArrayList<>();
    for (SchemaCommand sub : command.tableCommands()) {
      if (sub instanceof AddColumnCommand c) {
        out.add("ALTER TABLE " + table(command.name()) + " " + addColumnString() + columnDefinition(c));
      } else if (sub instanceof DropColumnCommand c) {
        out.add("ALTER TABLE " + table(command.name()) + " DROP COLUMN " + column(c.columnName()));
      } else if (sub instanceof RenameColumnCommand c) {
        out.addAll(renderRenameColumn(command.name(), c));
      } else if (sub instanceof AlterColumnCommand c) {
        if (c.type() == null && !c.hasDefault()) {
          throw new IllegalArgumentException("ALTER COLUMN " + c.columnName() + " changes neither type nor default");
        }
        out.addAll(renderAlterColumn(command.name(), c));
      } else if (sub instanceof AddIndexCommand c) {
        out.add(renderAddIndex(command.name(), c));
      } else if (sub instanceof DropIndexCommand c) {
        out.add(renderDropIndex(command.name(), c));
      } else {
        throw new IllegalArgumentException("Unknown ALTER TABLE command: " + sub.getClass().getName());
      }
    }
    return out;
  }

  protected String addColumnString() {
    return "ADD COLUMN ";
  }

  protected List<String> renderRenameColumn(String tableName, RenameColumnCommand c) {
    return List.of("ALTER TABLE " + table(tableName) + " RENAME COLUMN " + column(c.columnName())
        + " TO " + column(c.newColumnName()));
  }

  protected List<String> renderAlterColumn(String tableName, AlterColumnCommand c) {
    List<String> out = new ArrayList<>();
    String prefix = "ALTER TABLE " + table(tableName) + " ALTER COLUMN " + column(c.columnName());
    if (c.type() != null) out.add(prefix + " TYPE " + type(c));
    if (c.hasDefault()) out.add(prefix + " SET DEFAULT " + dialect.sqlValue(c.defaultValue()));
    return out;
  }

  protected String renderAddIndex(String tableName, AddIndexCommand c) {
    List<String> cols = new ArrayList<>();
    for (String name : c.columnNames()) cols.add(column(name));
    return "CREATE INDEX " + column(c.indexName()) + " ON " + table(tableName) + " (" + String.join(", ", cols) + ")";
  }

  protected String renderDropIndex(String tableName, DropIndexCommand c) {
    return "DROP INDEX " + qualified(c.indexName());
  }

  protected List<String> renderDropTable(DropTableCommand command) {
    return List.of("DROP TABLE " + table(command.name()) + dialect.cascadeConstraintsString());
  }

  protected List<String> renderCreateForeignKey(CreateForeignKeyCommand c) {
    return List.of("ALTER TABLE " + table(c.srcTable())
        + " ADD CONSTRAINT " + column(c.name())
        + " FOREIGN KEY (" + columns(c.srcColumns()) + ")"
        + " REFERENCES " + table(c.destTable()) + " (" + columns(c.destColumns()) + ")");
  }

  protected List<String> renderDropForeignKey(DropForeignKeyCommand c) {
    return List.of("ALTER TABLE " + table(c.srcTable()) + " DROP CONSTRAINT " + column(c.name()));
  }

  protected List<String> renderCreateSchema(CreateSchemaCommand c) {
    return List.of("CREATE SCHEMA " + column(c.schema()));
  }

  protected final String table(String name) {
    return dialect.quoteForTableName(name, schema);
  }

  protected final String column(String name) {
    return dialect.quoteForColumnName(name);
  }

  /** Schema-qualified identifier for objects that live beside tables (e.g. indexes). */
  protected final String qualified(String name) {
    return schema == null ? column(name) : column(schema) + "." + column(name);
  }

  protected final String columns(List<String> names) {
    List<String> out = new ArrayList<>(names.size());
    for (String n : names) out.add(column(n));
    return String.join(", ", out);
  }

  protected final String type(ColumnCommand c) {
    return dialect.typeName(c.type(), c.length(), c.precision(), c.scale());
  }

  private static IdentityColumnSize identitySize(JDBCType type) {
    return type == JDBCType.INTEGER || type == JDBCType.SMALLINT || type == JDBCType.TINYINT
        ? IdentityColumnSize.INT32
        : IdentityColumnSize.INT64;
  }
}
