package io.intellixity.quire.persistence.jdbc.sqlite;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.quire.persistence.config.QuireConfiguration;
import io.intellixity.quire.persistence.config.QuireSettings;
import io.intellixity.quire.persistence.jdbc.JdbcHandle;
import io.intellixity.quire.persistence.jdbc.JdbcMigrationRunner;
import io.intellixity.quire.persistence.jdbc.JdbcQueries;
import io.intellixity.quire.persistence.jdbc.JdbcStatementExecutor;
import io.intellixity.quire.persistence.schema.CreateColumnCommand;
import io.intellixity.quire.persistence.schema.IdentityColumnSize;
import io.intellixity.quire.persistence.schema.SchemaBuilder;
import io.intellixity.quire.persistence.schema.SchemaBuilderException;
import io.intellixity.quire.persistence.schema.SchemaFailure;
import io.intellixity.quire.persistence.sql.SqlBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.JDBCType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

final class SqliteSchemaIntegrationTest {
  static final class TitleIndex {}
  static final class CountIndex {}
  static final class TagIndex {}

  @TempDir
  Path dir;

  private HikariDataSource ds;
  private QuireConfiguration configuration;
  private JdbcMigrationRunner runner;

  @BeforeEach
  void setUp() {
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl("jdbc:sqlite:" + dir.resolve("quire.db"));
    hc.setMaximumPoolSize(1);
    ds = new HikariDataSource(hc);

    configuration = QuireConfiguration.fromSettings(
        new QuireSettings("sqlite", "yx_", null, IdentityColumnSize.INT64), new JdbcStatementExecutor());
    runner = new JdbcMigrationRunner(new JdbcHandle("sqlite-test", ds, null), configuration);
  }

  @AfterEach
  void tearDown() {
    ds.close();
  }

  private static final Consumer<SchemaBuilder> BLOG_SCHEMA = sb -> sb
      .createTable("Blog_Document", t -> t
          .column(IdentityColumnSize.INT64, "Id", CreateColumnCommand::identity)
          .column("Type", JDBCType.VARCHAR, c -> c.withLength(255).notNull())
          .column("Content", JDBCType.CLOB))
      .createMapIndexTable(TitleIndex.class, t -> t.column("Title", JDBCType.VARCHAR), "Blog")
      .createReduceIndexTable(CountIndex.class, t -> t.column("Count", JDBCType.INTEGER, c -> c.withDefault(0)), "Blog");

  @Test
  void createsDocumentAndIndexTables() throws SQLException {
    runner.run(BLOG_SCHEMA);

    assertEquals(List.of(
        "index:yx_IDX_FK_Blog_CountIndex_Blog_Document",
        "index:yx_IDX_FK_Blog_TitleIndex",
        "table:yx_Blog_CountIndex",
        "table:yx_Blog_CountIndex_Blog_Document",
        "table:yx_Blog_Document",
        "table:yx_Blog_TitleIndex"
    ), objects());
  }

  @Test
  void repeatedRunsAreIdempotentWhenErrorsAreSwallowed() throws SQLException {
    runner.run(false, BLOG_SCHEMA);
    List<String> first = objects();

    assertDoesNotThrow(() -> runner.run(false, BLOG_SCHEMA));
    assertEquals(first, objects());
  }

  @Test
  void rerunThatSwallowsDuplicatesStillCreatesNewIndexTables() throws SQLException {
    runner.run(false, BLOG_SCHEMA);

    runner.run(false, BLOG_SCHEMA.andThen(sb -> sb
        .createMapIndexTable(TagIndex.class, t -> t.column("Tag", JDBCType.VARCHAR), "Blog")));

    assertTrue(objects().contains("table:yx_Blog_TagIndex"));
    assertTrue(objects().contains("index:yx_IDX_FK_Blog_TagIndex"));
  }

  @Test
  void repeatedRunFailsWithDuplicateObjectWhenThrowing() throws SQLException {
    runner.run(BLOG_SCHEMA);

    SchemaBuilderException ex = assertThrows(SchemaBuilderException.class, () -> runner.run(true, BLOG_SCHEMA));
    assertEquals(SchemaFailure.Kind.DUPLICATE_OBJECT, ex.kind());
    assertInstanceOf(SQLException.class, ex.getCause());
  }

  @Test
  void dropsReverseCreates() throws SQLException {
    runner.run(BLOG_SCHEMA);

    runner.run(sb -> sb
        .dropReduceIndexTable(CountIndex.class, "Blog")
        .dropMapIndexTable(TitleIndex.class, "Blog"));

    assertEquals(List.of("table:yx_Blog_Document"), objects());
  }

  @Test
  void failedMigrationIsRolledBack() throws SQLException {
    IllegalStateException ex = assertThrows(IllegalStateException.class, () -> runner.run(sb -> {
      sb.createTable("Scratch", t -> t.column("Id", JDBCType.BIGINT));
      throw new IllegalStateException("boom");
    }));

    assertEquals("boom", ex.getMessage());
    assertEquals(List.of(), objects());
  }

  @Test
  void alterIndexTableAddsRenamesAndIndexesColumns() throws SQLException {
    runner.run(BLOG_SCHEMA);

    runner.run(sb -> sb.alterIndexTable(TitleIndex.class, t -> t
        .addColumn("Slug", JDBCType.VARCHAR, c -> c.withLength(100))
        .renameColumn("Title", "Heading")
        .createIndex("IDX_Heading", "Heading"), "Blog"));

    assertTrue(objects().contains("index:yx_IDX_Heading"));
    assertEquals(List.of("Id", "DocumentId", "Heading", "Slug"), columns("yx_Blog_TitleIndex"));

    runner.run(sb -> sb.alterIndexTable(TitleIndex.class, t -> t.dropIndex("IDX_Heading").dropColumn("Slug"), "Blog"));
    assertFalse(objects().contains("index:yx_IDX_Heading"));
    assertEquals(List.of("Id", "DocumentId", "Heading"), columns("yx_Blog_TitleIndex"));
  }

  @Test
  void alterColumnIsAnInterpreterFailure() {
    runner.run(BLOG_SCHEMA);

    SchemaBuilderException ex = assertThrows(SchemaBuilderException.class, () -> runner.run(sb -> sb
        .alterTable("Blog_Document", t -> t.alterColumn("Type", c -> c.withType(JDBCType.CLOB)))));
    assertEquals(SchemaFailure.Kind.INTERPRETER, ex.kind());
    assertInstanceOf(UnsupportedOperationException.class, ex.getCause());
  }

  @Test
  void queriesBuiltSqlWithNamedParameters() throws SQLException {
    runner.run(BLOG_SCHEMA);
    try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
      st.executeUpdate("INSERT INTO \"yx_Blog_Document\" (\"Type\") VALUES ('Blog'), ('Blog'), ('Page'), ('Blog')");
    }

    SqlBuilder b = configuration.sqlBuilder();
    b.select();
    b.selector("Blog_Document", "Id", null);
    b.table("Blog_Document", null, null);
    b.andAlso("\"Type\" = :type");
    b.parameters().put("type", "Blog");
    b.orderBy("\"Id\"");
    b.skip("1");

    List<Long> ids;
    try (Connection c = ds.getConnection()) {
      ids = JdbcQueries.query(c, b, rs -> rs.getLong(1));
    }
    assertEquals(List.of(2L, 4L), ids);

    b.skip(null);
    b.take("1");
    try (Connection c = ds.getConnection()) {
      assertEquals(List.of(1L), JdbcQueries.query(c, b, rs -> rs.getLong(1)));
    }
  }

  private List<String> objects() throws SQLException {
    List<String> out = new ArrayList<>();
    try (Connection c = ds.getConnection();
         Statement st = c.createStatement();
         ResultSet rs = st.executeQuery("SELECT type, name FROM sqlite_master "
             + "WHERE type IN ('table', 'index') AND name NOT LIKE 'sqlite_%' ORDER BY type, name")) {
      while (rs.next()) out.add(rs.getString(1) + ":" + rs.getString(2));
    }
    return out;
  }

  private List<String> columns(String table) throws SQLException {
    List<String> out = new ArrayList<>();
    try (Connection c = ds.getConnection();
         Statement st = c.createStatement();
         ResultSet rs = st.executeQuery("PRAGMA table_info(\"" + table + "\")")) {
      while (rs.next()) out.add(rs.getString("name"));
    }
    return out;
  }
}
