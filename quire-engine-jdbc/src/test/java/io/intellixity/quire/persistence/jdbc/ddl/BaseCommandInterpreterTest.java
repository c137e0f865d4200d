package io.intellixity.quire.persistence.jdbc.ddl;

import io.intellixity.quire.persistence.jdbc.dialect.AnsiTestDialect;
import io.intellixity.quire.persistence.schema.AlterTableCommand;
import io.intellixity.quire.persistence.schema.CreateForeignKeyCommand;
import io.intellixity.quire.persistence.schema.CreateSchemaCommand;
import io.intellixity.quire.persistence.schema.CreateTableCommand;
import io.intellixity.quire.persistence.schema.DropForeignKeyCommand;
import io.intellixity.quire.persistence.schema.DropTableCommand;
import io.intellixity.quire.persistence.schema.IdentityColumnSize;
import io.intellixity.quire.persistence.schema.SchemaCommand;
import org.junit.jupiter.api.Test;

import java.sql.JDBCType;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class BaseCommandInterpreterTest {
  private final AnsiTestDialect dialect = new AnsiTestDialect();
  private final BaseCommandInterpreter interpreter = new BaseCommandInterpreter(dialect, null);

  @Test
  void createTableRendersColumnsInOrder() {
    CreateTableCommand t = new CreateTableCommand("yx_Blog")
        .column(IdentityColumnSize.INT64, "Id", c -> c.identity())
        .column("Title", JDBCType.VARCHAR, c -> c.withLength(100).notNull().unique())
        .column("Rating", JDBCType.DECIMAL, c -> c.withPrecision(5, 2).withDefault(0))
        .column("Draft", JDBCType.BOOLEAN, c -> c.withDefault(false));

    assertEquals(List.of("CREATE TABLE \"yx_Blog\" ("
        + "\"Id\" BIGINT IDENTITY NOT NULL, "
        + "\"Title\" VARCHAR(100) NOT NULL UNIQUE, "
        + "\"Rating\" DECIMAL(5, 2) DEFAULT 0 NULL, "
        + "\"Draft\" BOOLEAN DEFAULT FALSE NULL)"), interpreter.createSql(t));
  }

  @Test
  void nonIdentityPrimaryKeysBecomeATableConstraint() {
    CreateTableCommand t = new CreateTableCommand("Bridge")
        .column("AId", JDBCType.BIGINT, c -> c.primaryKey())
        .column("BId", JDBCType.BIGINT, c -> c.primaryKey());

    assertEquals(List.of("CREATE TABLE \"Bridge\" (\"AId\" BIGINT NOT NULL, \"BId\" BIGINT NOT NULL, "
        + "PRIMARY KEY (\"AId\", \"BId\"))"), interpreter.createSql(t));
  }

  @Test
  void identitySizeFollowsColumnType() {
    CreateTableCommand t = new CreateTableCommand("T").column(IdentityColumnSize.INT32, "Id", c -> c.identity());

    assertEquals(List.of("CREATE TABLE \"T\" (\"Id\" INT IDENTITY NOT NULL)"), interpreter.createSql(t));
  }

  @Test
  void createTableWithoutColumnsIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> interpreter.createSql(new CreateTableCommand("Empty")));
  }

  @Test
  void alterTableRendersOneStatementPerChange() {
    AlterTableCommand a = new AlterTableCommand("yx_Blog", dialect, "yx_")
        .addColumn("Slug", JDBCType.VARCHAR, c -> c.notNull().withDefault(""))
        .dropColumn("Old")
        .renameColumn("Name", "Title")
        .alterColumn("Rating", c -> c.withType(JDBCType.INTEGER).withDefault(1))
        .createIndex("IDX_Slug", "Slug", "Title")
        .dropIndex("IDX_Old");

    assertEquals(List.of(
        "ALTER TABLE \"yx_Blog\" ADD COLUMN \"Slug\" VARCHAR(255) DEFAULT '' NOT NULL",
        "ALTER TABLE \"yx_Blog\" DROP COLUMN \"Old\"",
        "ALTER TABLE \"yx_Blog\" RENAME COLUMN \"Name\" TO \"Title\"",
        "ALTER TABLE \"yx_Blog\" ALTER COLUMN \"Rating\" TYPE INT",
        "ALTER TABLE \"yx_Blog\" ALTER COLUMN \"Rating\" SET DEFAULT 1",
        "CREATE INDEX \"yx_IDX_Slug\" ON \"yx_Blog\" (\"Slug\", \"Title\")",
        "DROP INDEX \"yx_IDX_Old\""
    ), interpreter.createSql(a));
  }

  @Test
  void alterColumnWithoutChangesIsRejected() {
    AlterTableCommand a = new AlterTableCommand("T", dialect, "").alterColumn("C", c -> {});

    assertThrows(IllegalArgumentException.class, () -> interpreter.createSql(a));
  }

  @Test
  void indexNamesAreFormattedByTheDialect() {
    AlterTableCommand a = new AlterTableCommand("T", dialect, "yx_").createIndex("IDX_FK_Blog_TitleIndex", "DocumentId");

    assertEquals(List.of("CREATE INDEX \"yx_IDX_FK_Blog_T\" ON \"T\" (\"DocumentId\")"), interpreter.createSql(a));
  }

  @Test
  void rendersDropsConstraintsAndSchemas() {
    assertEquals(List.of("DROP TABLE \"T\""), interpreter.createSql(new DropTableCommand("T")));
    assertEquals(List.of("ALTER TABLE \"Idx\" ADD CONSTRAINT \"FK_Idx\" FOREIGN KEY (\"DocumentId\") "
            + "REFERENCES \"Document\" (\"Id\")"),
        interpreter.createSql(new CreateForeignKeyCommand("FK_Idx", "Idx", List.of("DocumentId"), "Document", List.of("Id"))));
    assertEquals(List.of("ALTER TABLE \"Idx\" DROP CONSTRAINT \"FK_Idx\""),
        interpreter.createSql(new DropForeignKeyCommand("Idx", "FK_Idx")));
    assertEquals(List.of("CREATE SCHEMA \"store\""), interpreter.createSql(new CreateSchemaCommand("store")));
  }

  @Test
  void schemaQualifiesTablesAndIndexes() {
    BaseCommandInterpreter scoped = new BaseCommandInterpreter(dialect, "store");
    AlterTableCommand a = new AlterTableCommand("T", dialect, "").dropIndex("IDX");

    assertEquals(List.of("DROP TABLE \"store\".\"T\""), scoped.createSql(new DropTableCommand("T")));
    assertEquals(List.of("DROP INDEX \"store\".\"IDX\""), scoped.createSql(a));
  }

  @Test
  void unknownCommandsAreRejected() {
    SchemaCommand unknown = new SchemaCommand() {};

    assertThrows(IllegalArgumentException.class, () -> interpreter.createSql(unknown));
  }
}
