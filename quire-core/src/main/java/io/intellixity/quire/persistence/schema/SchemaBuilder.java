package io.intellixity.quire.persistence.schema;

import io.intellixity.quire.persistence.config.QuireConfiguration;
import io.intellixity.quire.persistence.exec.StatementExecutor;
import io.intellixity.quire.persistence.naming.TableNameConvention;
import io.intellixity.quire.persistence.sql.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static io.intellixity.quire.persistence.schema.SchemaNames.DOCUMENT_ID_COLUMN;
import static io.intellixity.quire.persistence.schema.SchemaNames.ID_COLUMN;

/**
 * Fluent DDL surface for documents and index tables, bound to one connection/transaction.
 *
 * Each public operation runs its statements sequentially on the transaction and stops at the first
 * failing statement. With {@code throwOnError} the failure surfaces as {@link SchemaBuilderException};
 * otherwise it is logged and swallowed so "ensure schema" runs can be repeated. Statements already
 * executed are not rolled back here; that belongs to the transaction owner.
 *
 * Table, foreign-key and index names are prefixed with the configured table prefix.
 * Not thread-safe.
 */
public final class SchemaBuilder {
  private static final Logger log = LoggerFactory.getLogger(SchemaBuilder.class);

  private final Connection connection;
  private final boolean throwOnError;
  private final String tablePrefix;
  private final SqlDialect dialect;
  private final CommandInterpreter interpreter;
  private final TableNameConvention tableNameConvention;
  private final StatementExecutor executor;
  private IdentityColumnSize identityColumnSize;

  public SchemaBuilder(QuireConfiguration configuration, Connection transaction) {
    this(configuration, transaction, true);
  }

  public SchemaBuilder(QuireConfiguration configuration, Connection transaction, boolean throwOnError) {
    Objects.requireNonNull(configuration, "configuration");
    this.connection = Objects.requireNonNull(transaction, "transaction");
    this.throwOnError = throwOnError;
    this.tablePrefix = configuration.tablePrefix();
    this.dialect = configuration.dialect();
    this.interpreter = configuration.commandInterpreter();
    this.tableNameConvention = configuration.tableNameConvention();
    this.executor = configuration.statementExecutor();
    this.identityColumnSize = configuration.identityColumnSize();
  }

  public Connection connection() { return connection; }
  public boolean throwOnError() { return throwOnError; }
  public String tablePrefix() { return tablePrefix; }
  public SqlDialect dialect() { return dialect; }
  public TableNameConvention tableNameConvention() { return tableNameConvention; }
  public IdentityColumnSize identityColumnSize() { return identityColumnSize; }

  public SchemaBuilder identityColumnSize(IdentityColumnSize size) {
    this.identityColumnSize = Objects.requireNonNull(size, "size");
    return this;
  }

  // ---------------------------------------------------------------------------------------------
  // Index tables
  // ---------------------------------------------------------------------------------------------

  /**
   * Creates {@code {collection}_{Index}} with {@code Id} (identity) and {@code DocumentId}, then the
   * {@code DocumentId -> Document.Id} foreign key, then an index on {@code DocumentId}.
   */
  public SchemaBuilder createMapIndexTable(Class<?> indexType, Consumer<CreateTableCommand> table, String collection) {
    return apply(mapIndexTable(indexType, table, collection));
  }

  /**
   * Creates {@code {collection}_{Index}} with {@code Id} (identity), the bridge table
   * {@code {IndexTable}_{DocumentTable}} with both foreign keys, and a composite index on the bridge.
   */
  public SchemaBuilder createReduceIndexTable(Class<?> indexType, Consumer<CreateTableCommand> table, String collection) {
    return apply(reduceIndexTable(indexType, table, collection));
  }

  public SchemaBuilder dropMapIndexTable(Class<?> indexType, String collection) {
    return apply(dropMapIndex(indexType, collection));
  }

  public SchemaBuilder dropReduceIndexTable(Class<?> indexType, String collection) {
    return apply(dropReduceIndex(indexType, collection));
  }

  public SchemaBuilder alterIndexTable(Class<?> indexType, Consumer<AlterTableCommand> table, String collection) {
    return apply(alterIndex(indexType, table, collection));
  }

  // ---------------------------------------------------------------------------------------------
  // Single commands
  // ---------------------------------------------------------------------------------------------

  public SchemaBuilder createTable(String name, Consumer<CreateTableCommand> table) {
    return apply(create("createTable", name, table));
  }

  public SchemaBuilder alterTable(String name, Consumer<AlterTableCommand> table) {
    return apply(alter("alterTable", name, table));
  }

  public SchemaBuilder dropTable(String name) {
    return apply(drop("dropTable", name));
  }

  public SchemaBuilder createForeignKey(String name, String srcTable, String[] srcColumns,
                                        String destTable, String[] destColumns) {
    return apply(foreignKey("createForeignKey", name, srcTable, srcColumns, destTable, destColumns));
  }

  public SchemaBuilder dropForeignKey(String srcTable, String name) {
    return apply(dropForeignKey("dropForeignKey", srcTable, name));
  }

  public SchemaBuilder createSchema(String schema) {
    return apply(run("createSchema", () -> new CreateSchemaCommand(schema)));
  }

  // ---------------------------------------------------------------------------------------------
  // Steps
  // ---------------------------------------------------------------------------------------------

  private SchemaResult mapIndexTable(Class<?> indexType, Consumer<CreateTableCommand> table, String collection) {
    String op = "createMapIndexTable";
    IndexTables names;
    try {
      names = IndexTables.resolve(tableNameConvention, indexType, collection);
    } catch (RuntimeException e) {
      return failed(SchemaFailure.Kind.NAME_RESOLUTION, op, e);
    }

    return create(op, names.indexTable(), t -> {
          t.column(identityColumnSize, ID_COLUMN, c -> c.identity().notNull())
              .column(identityColumnSize, DOCUMENT_ID_COLUMN);
          if (table != null) table.accept(t);
        })
        .then(() -> foreignKey(op, SchemaNames.mapIndexForeignKey(collection, names.indexName()),
            names.indexTable(), new String[]{DOCUMENT_ID_COLUMN},
            names.documentTable(), new String[]{ID_COLUMN}))
        .then(() -> alter(op, names.indexTable(),
            a -> a.createIndex(SchemaNames.foreignKeyIndex(names.indexTable()), DOCUMENT_ID_COLUMN)));
  }

  private SchemaResult reduceIndexTable(Class<?> indexType, Consumer<CreateTableCommand> table, String collection) {
    String op = "createReduceIndexTable";
    IndexTables names;
    try {
      names = IndexTables.resolve(tableNameConvention, indexType, collection);
    } catch (RuntimeException e) {
      return failed(SchemaFailure.Kind.NAME_RESOLUTION, op, e);
    }
    String bridge = names.bridgeTable();
    String indexColumn = SchemaNames.bridgeIndexColumn(names.indexName());

    return create(op, names.indexTable(), t -> {
          t.column(identityColumnSize, ID_COLUMN, c -> c.identity().notNull());
          if (table != null) table.accept(t);
        })
        .then(() -> create(op, bridge, b -> b
            .column(identityColumnSize, indexColumn, CreateColumnCommand::notNull)
            .column(identityColumnSize, DOCUMENT_ID_COLUMN, CreateColumnCommand::notNull)))
        .then(() -> foreignKey(op, SchemaNames.bridgeIndexForeignKey(bridge),
            bridge, new String[]{indexColumn}, names.indexTable(), new String[]{ID_COLUMN}))
        .then(() -> foreignKey(op, SchemaNames.bridgeDocumentForeignKey(bridge),
            bridge, new String[]{DOCUMENT_ID_COLUMN}, names.documentTable(), new String[]{ID_COLUMN}))
        .then(() -> alter(op, bridge,
            a -> a.createIndex(SchemaNames.foreignKeyIndex(bridge), indexColumn, DOCUMENT_ID_COLUMN)));
  }

  private SchemaResult alterIndex(Class<?> indexType, Consumer<AlterTableCommand> table, String collection) {
    String op = "alterIndexTable";
    IndexTables names;
    try {
      names = IndexTables.resolve(tableNameConvention, indexType, collection);
    } catch (RuntimeException e) {
      return failed(SchemaFailure.Kind.NAME_RESOLUTION, op, e);
    }
    return alter(op, names.indexTable(), table);
  }

  private SchemaResult dropMapIndex(Class<?> indexType, String collection) {
    String op = "dropMapIndexTable";
    IndexTables names;
    try {
      names = IndexTables.resolve(tableNameConvention, indexType, collection);
    } catch (RuntimeException e) {
      return failed(SchemaFailure.Kind.NAME_RESOLUTION, op, e);
    }

    SchemaResult r = SchemaResult.ok();
    if (!cascadesConstraints()) {
      r = dropForeignKey(op, names.indexTable(), SchemaNames.mapIndexForeignKey(collection, names.indexName()));
    }
    return r.then(() -> drop(op, names.indexTable()));
  }

  private SchemaResult dropReduceIndex(Class<?> indexType, String collection) {
    String op = "dropReduceIndexTable";
    IndexTables names;
    try {
      names = IndexTables.resolve(tableNameConvention, indexType, collection);
    } catch (RuntimeException e) {
      return failed(SchemaFailure.Kind.NAME_RESOLUTION, op, e);
    }
    String bridge = names.bridgeTable();

    SchemaResult r = SchemaResult.ok();
    if (!cascadesConstraints()) {
      r = dropForeignKey(op, bridge, SchemaNames.bridgeIndexForeignKey(bridge))
          .then(() -> dropForeignKey(op, bridge, SchemaNames.bridgeDocumentForeignKey(bridge)));
    }
    return r.then(() -> drop(op, bridge))
        .then(() -> drop(op, names.indexTable()));
  }

  private boolean cascadesConstraints() {
    String cascade = dialect.cascadeConstraintsString();
    return cascade != null && !cascade.isEmpty();
  }

  private SchemaResult create(String op, String name, Consumer<CreateTableCommand> table) {
    return run(op, () -> {
      CreateTableCommand command = new CreateTableCommand(prefix(name));
      if (table != null) table.accept(command);
      return command;
    });
  }

  private SchemaResult alter(String op, String name, Consumer<AlterTableCommand> table) {
    return run(op, () -> {
      AlterTableCommand command = new AlterTableCommand(prefix(name), dialect, tablePrefix);
      if (table != null) table.accept(command);
      return command;
    });
  }

  private SchemaResult drop(String op, String name) {
    return run(op, () -> new DropTableCommand(prefix(name)));
  }

  private SchemaResult foreignKey(String op, String name, String srcTable, String[] srcColumns,
                                  String destTable, String[] destColumns) {
    return run(op, () -> new CreateForeignKeyCommand(
        dialect.formatKeyName(prefix(name)),
        prefix(srcTable), List.of(srcColumns),
        prefix(destTable), List.of(destColumns)));
  }

  private SchemaResult dropForeignKey(String op, String srcTable, String name) {
    return run(op, () -> new DropForeignKeyCommand(prefix(srcTable), dialect.formatKeyName(prefix(name))));
  }

  /** Builds the command, translates it, and executes each non-blank statement in order. */
  private SchemaResult run(String op, Supplier<? extends SchemaCommand> commandFactory) {
    List<String> statements;
    try {
      statements = interpreter.createSql(commandFactory.get());
    } catch (RuntimeException e) {
      return failed(SchemaFailure.Kind.INTERPRETER, op, e);
    }

    for (String statement : statements) {
      if (statement == null || statement.isBlank()) continue;
      log.trace("quire.schema op={} sql={}", op, statement);
      try {
        executor.execute(connection, statement);
      } catch (SQLException e) {
        SchemaFailure.Kind kind = dialect.isDuplicateObject(e)
            ? SchemaFailure.Kind.DUPLICATE_OBJECT
            : SchemaFailure.Kind.EXECUTION;
        return failed(kind, op, e);
      } catch (RuntimeException e) {
        return failed(SchemaFailure.Kind.EXECUTION, op, e);
      }
    }
    return SchemaResult.ok();
  }

  private static SchemaResult failed(SchemaFailure.Kind kind, String op, Throwable cause) {
    return SchemaResult.failed(new SchemaFailure(kind, op, cause));
  }

  private SchemaBuilder apply(SchemaResult result) {
    if (result.isOk()) return this;
    SchemaFailure f = result.failure();
    if (throwOnError) throw new SchemaBuilderException(f);
    log.debug("quire.schema_skipped op={} kind={} error={}", f.operation(), f.kind(), f.cause().toString());
    return this;
  }

  private String prefix(String table) {
    return tablePrefix + table;
  }

  /** Logical names of an index type's tables for one collection. */
  private record IndexTables(String indexName, String indexTable, String documentTable) {
    static IndexTables resolve(TableNameConvention convention, Class<?> indexType, String collection) {
      Objects.requireNonNull(indexType, "indexType");
      String indexTable = requireName(convention.indexTable(indexType, collection), "index table");
      String documentTable = requireName(convention.documentTable(collection), "document table");
      return new IndexTables(indexType.getSimpleName(), indexTable, documentTable);
    }

    String bridgeTable() {
      return SchemaNames.bridgeTable(indexTable, documentTable);
    }

    private static String requireName(String name, String what) {
      if (name == null || name.isBlank()) throw new IllegalStateException("Naming convention returned a blank " + what);
      return name;
    }
  }
}
