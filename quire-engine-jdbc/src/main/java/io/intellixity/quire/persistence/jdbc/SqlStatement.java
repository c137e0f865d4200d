package io.intellixity.quire.persistence.jdbc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** JDBC SQL with {@code ?} placeholders and the values to bind, in placeholder order. */
public record SqlStatement(String sql, List<Object> values) {
  public SqlStatement {
    // values may hold nulls, so List.copyOf is not an option
    values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
  }
}
