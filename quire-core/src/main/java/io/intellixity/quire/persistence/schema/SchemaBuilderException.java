package io.intellixity.quire.persistence.schema;

/**
 * Raised by {@link SchemaBuilder} when a step fails and the builder was created with {@code throwOnError}.
 * The original error is available as {@link #getCause()}.
 */
public final class SchemaBuilderException extends RuntimeException {
  private final SchemaFailure.Kind kind;

  public SchemaBuilderException(SchemaFailure failure) {
    super(failure.kind() + " in " + failure.operation() + ": " + failure.cause().getMessage(), failure.cause());
    this.kind = failure.kind();
  }

  public SchemaFailure.Kind kind() {
    return kind;
  }
}
