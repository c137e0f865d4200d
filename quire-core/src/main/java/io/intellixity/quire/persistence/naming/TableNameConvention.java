package io.intellixity.quire.persistence.naming;

/**
 * Maps collections and index types to logical (unprefixed) table names.
 * Results must depend only on the arguments so repeated schema runs address the same tables.
 */
public interface TableNameConvention {
  /** {@code collection} may be null for the default collection. */
  String documentTable(String collection);

  String indexTable(Class<?> indexType, String collection);
}
