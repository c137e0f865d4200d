package io.intellixity.quire.persistence.config;

import io.intellixity.quire.persistence.exec.StatementExecutor;
import io.intellixity.quire.persistence.naming.DefaultTableNameConvention;
import io.intellixity.quire.persistence.naming.TableNameConvention;
import io.intellixity.quire.persistence.schema.CommandInterpreter;
import io.intellixity.quire.persistence.schema.IdentityColumnSize;
import io.intellixity.quire.persistence.sql.SqlBuilder;
import io.intellixity.quire.persistence.sql.SqlDialect;
import io.intellixity.quire.persistence.sql.SqlDialectProvider;
import io.intellixity.quire.persistence.util.QuireFactoriesLoader;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** Immutable wiring shared by schema and SQL builders of one store. */
public final class QuireConfiguration {
  private final String tablePrefix;
  private final String schema;
  private final SqlDialect dialect;
  private final CommandInterpreter commandInterpreter;
  private final TableNameConvention tableNameConvention;
  private final IdentityColumnSize identityColumnSize;
  private final StatementExecutor statementExecutor;

  private QuireConfiguration(Builder b) {
    this.tablePrefix = b.tablePrefix == null ? "" : b.tablePrefix;
    this.schema = (b.schema == null || b.schema.isBlank()) ? null : b.schema;
    this.dialect = Objects.requireNonNull(b.dialect, "dialect");
    this.commandInterpreter = Objects.requireNonNull(b.commandInterpreter, "commandInterpreter");
    this.tableNameConvention = b.tableNameConvention == null ? new DefaultTableNameConvention() : b.tableNameConvention;
    this.identityColumnSize = b.identityColumnSize == null ? IdentityColumnSize.INT64 : b.identityColumnSize;
    this.statementExecutor = Objects.requireNonNull(b.statementExecutor, "statementExecutor");
  }

  public String tablePrefix() { return tablePrefix; }
  /** Null when tables live in the connection's default schema. */
  public String schema() { return schema; }
  public SqlDialect dialect() { return dialect; }
  public CommandInterpreter commandInterpreter() { return commandInterpreter; }
  public TableNameConvention tableNameConvention() { return tableNameConvention; }
  public IdentityColumnSize identityColumnSize() { return identityColumnSize; }
  public StatementExecutor statementExecutor() { return statementExecutor; }

  /** New, empty SQL builder bound to this configuration's prefix and dialect. */
  public SqlBuilder sqlBuilder() {
    return new SqlBuilder(tablePrefix, dialect);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Resolves the dialect named by {@code settings} among the providers on the classpath. */
  public static QuireConfiguration fromSettings(QuireSettings settings, StatementExecutor executor) {
    return fromSettings(settings, executor, QuireFactoriesLoader.load(SqlDialectProvider.class));
  }

  public static QuireConfiguration fromSettings(QuireSettings settings, StatementExecutor executor,
                                                List<SqlDialectProvider> providers) {
    Objects.requireNonNull(settings, "settings");
    SqlDialectProvider provider = providers.stream()
        .filter(p -> settings.dialect().equalsIgnoreCase(p.id()))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("No dialect provider for '" + settings.dialect()
            + "'; available: " + providers.stream().map(SqlDialectProvider::id).collect(Collectors.joining(", "))));

    SqlDialect dialect = provider.dialect();
    return builder()
        .dialect(dialect)
        .commandInterpreter(provider.commandInterpreter(dialect, settings.schema()))
        .tablePrefix(settings.tablePrefix())
        .schema(settings.schema())
        .identityColumnSize(settings.identityColumnSize())
        .statementExecutor(executor)
        .build();
  }

  public static final class Builder {
    private String tablePrefix;
    private String schema;
    private SqlDialect dialect;
    private CommandInterpreter commandInterpreter;
    private TableNameConvention tableNameConvention;
    private IdentityColumnSize identityColumnSize;
    private StatementExecutor statementExecutor;

    private Builder() {}

    public Builder tablePrefix(String v) { this.tablePrefix = v; return this; }
    public Builder schema(String v) { this.schema = v; return this; }
    public Builder dialect(SqlDialect v) { this.dialect = v; return this; }
    public Builder commandInterpreter(CommandInterpreter v) { this.commandInterpreter = v; return this; }
    public Builder tableNameConvention(TableNameConvention v) { this.tableNameConvention = v; return this; }
    public Builder identityColumnSize(IdentityColumnSize v) { this.identityColumnSize = v; return this; }
    public Builder statementExecutor(StatementExecutor v) { this.statementExecutor = v; return this; }

    public QuireConfiguration build() {
      return new QuireConfiguration(this);
    }
  }
}
