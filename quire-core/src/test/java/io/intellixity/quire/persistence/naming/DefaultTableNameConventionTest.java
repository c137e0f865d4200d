package io.intellixity.quire.persistence.naming;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultTableNameConventionTest {
  static final class TitleIndex {}

  private final TableNameConvention convention = new DefaultTableNameConvention();

  @Test
  void documentTableIsScopedByCollection() {
    assertEquals("Document", convention.documentTable(null));
    assertEquals("Document", convention.documentTable(""));
    assertEquals("Blog_Document", convention.documentTable("Blog"));
  }

  @Test
  void indexTableUsesSimpleName() {
    assertEquals("TitleIndex", convention.indexTable(TitleIndex.class, null));
    assertEquals("Blog_TitleIndex", convention.indexTable(TitleIndex.class, "Blog"));
  }

  @Test
  void anonymousIndexTypesAreRejected() {
    Object anonymous = new Object() {};
    assertThrows(IllegalArgumentException.class, () -> convention.indexTable(anonymous.getClass(), "Blog"));
    assertThrows(NullPointerException.class, () -> convention.indexTable(null, "Blog"));
  }
}
