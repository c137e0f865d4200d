package io.intellixity.quire.persistence.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.intellixity.quire.persistence.schema.IdentityColumnSize;

/** Externalized settings, typically read from {@code quire.json}. Only {@code dialect} is required. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QuireSettings(String dialect, String tablePrefix, String schema, IdentityColumnSize identityColumnSize) {
  public QuireSettings {
    if (dialect == null || dialect.isBlank()) throw new IllegalArgumentException("settings.dialect is required");
    tablePrefix = tablePrefix == null ? "" : tablePrefix;
    schema = (schema == null || schema.isBlank()) ? null : schema;
    identityColumnSize = identityColumnSize == null ? IdentityColumnSize.INT64 : identityColumnSize;
  }
}
