package io.intellixity.quire.persistence.naming;

import java.util.Objects;

/** {@code Document} / {@code {collection}_Document}, and {@code {Index}} / {@code {collection}_{Index}}. */
public final class DefaultTableNameConvention implements TableNameConvention {
  public static final String DOCUMENT_TABLE = "Document";

  @Override
  public String documentTable(String collection) {
    return isNullOrEmpty(collection) ? DOCUMENT_TABLE : collection + "_" + DOCUMENT_TABLE;
  }

  @Override
  public String indexTable(Class<?> indexType, String collection) {
    Objects.requireNonNull(indexType, "indexType");
    String name = indexType.getSimpleName();
    if (name.isEmpty()) throw new IllegalArgumentException("Index type has no simple name: " + indexType.getName());
    return isNullOrEmpty(collection) ? name : collection + "_" + name;
  }

  private static boolean isNullOrEmpty(String s) {
    return s == null || s.isEmpty();
  }
}
