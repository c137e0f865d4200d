package io.intellixity.quire.persistence.schema;

/**
 * Derived names of index tables, bridge tables, foreign keys and lookup indexes.
 *
 * All results are plain concatenations of the (unprefixed) inputs, so the same index type and
 * collection always yield the same names across runs and processes.
 */
public final class SchemaNames {
  public static final String ID_COLUMN = "Id";
  public static final String DOCUMENT_ID_COLUMN = "DocumentId";

  private SchemaNames() {}

  /** {@code FK_{collection}{IndexName}} */
  public static String mapIndexForeignKey(String collection, String indexName) {
    return "FK_" + (collection == null ? "" : collection) + indexName;
  }

  /** {@code {IndexTable}_{DocumentTable}} */
  public static String bridgeTable(String indexTable, String documentTable) {
    return indexTable + "_" + documentTable;
  }

  /** {@code FK_{bridge}_Id} */
  public static String bridgeIndexForeignKey(String bridgeTable) {
    return "FK_" + bridgeTable + "_" + ID_COLUMN;
  }

  /** {@code FK_{bridge}_DocumentId} */
  public static String bridgeDocumentForeignKey(String bridgeTable) {
    return "FK_" + bridgeTable + "_" + DOCUMENT_ID_COLUMN;
  }

  /** {@code {IndexName}Id}: the bridge column pointing at the reduce index row. */
  public static String bridgeIndexColumn(String indexName) {
    return indexName + ID_COLUMN;
  }

  /** {@code IDX_FK_{table}} */
  public static String foreignKeyIndex(String table) {
    return "IDX_FK_" + table;
  }
}
