package io.intellixity.quire.persistence.jdbc;

import io.intellixity.quire.persistence.jdbc.dialect.AnsiTestDialect;
import io.intellixity.quire.persistence.sql.SqlBuilder;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class NamedParameterCompilerTest {
  @Test
  void rewritesPlaceholdersInAppearanceOrder() {
    SqlStatement ss = NamedParameterCompiler.compile(
        "SELECT * FROM t WHERE a = :a AND b = :b OR a = :a", Map.of("a", 1, "b", "x"));

    assertEquals("SELECT * FROM t WHERE a = ? AND b = ? OR a = ?", ss.sql());
    assertEquals(List.of(1, "x", 1), ss.values());
  }

  @Test
  void ignoresQuotedTextAndCasts() {
    SqlStatement ss = NamedParameterCompiler.compile(
        "SELECT 'it''s :not' , x::text FROM t WHERE y = :y", Map.of("y", 2));

    assertEquals("SELECT 'it''s :not' , x::text FROM t WHERE y = ?", ss.sql());
    assertEquals(List.of(2), ss.values());
  }

  @Test
  void ignoresColonsInQuotedIdentifiersAndComments() {
    String sql = "SELECT \"a:b\", [c:d], \"x\"\":y\" FROM t -- :commented\n"
        + "WHERE /* :blocked */ v = :v";

    SqlStatement ss = NamedParameterCompiler.compile(sql, Map.of("v", 3));

    assertEquals("SELECT \"a:b\", [c:d], \"x\"\":y\" FROM t -- :commented\n"
        + "WHERE /* :blocked */ v = ?", ss.sql());
    assertEquals(List.of(3), ss.values());
  }

  @Test
  void lineCommentWithoutNewlineRunsToTheEnd() {
    SqlStatement ss = NamedParameterCompiler.compile("SELECT :a -- trailing :b", Map.of("a", 1));

    assertEquals("SELECT ? -- trailing :b", ss.sql());
    assertEquals(List.of(1), ss.values());
  }

  @Test
  void keepsNullValues() {
    Map<String, Object> params = new HashMap<>();
    params.put("v", null);

    SqlStatement ss = NamedParameterCompiler.compile("UPDATE t SET v = :v", params);

    assertEquals(Arrays.asList((Object) null), ss.values());
  }

  @Test
  void missingParameterIsReported() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> NamedParameterCompiler.compile("SELECT :missing", Map.of()));
    assertTrue(ex.getMessage().contains("missing"));
  }

  @Test
  void compilesABuilderWithItsParameters() {
    SqlBuilder b = new SqlBuilder("yx_", new AnsiTestDialect());
    b.select();
    b.table("Document", null, null);
    b.andAlso("\"Type\" = :type");
    b.parameters().put("type", "Blog");
    b.take("10");

    SqlStatement ss = NamedParameterCompiler.compile(b);

    assertEquals("SELECT * FROM \"yx_Document\" WHERE \"Type\" = ? LIMIT 10", ss.sql());
    assertEquals(List.of("Blog"), ss.values());
  }

  @Test
  void builderWithoutSelectIsRejected() {
    assertThrows(IllegalStateException.class,
        () -> NamedParameterCompiler.compile(new SqlBuilder("", new AnsiTestDialect())));
  }
}
