package io.intellixity.quire.persistence.schema;

import java.util.Objects;
import java.util.function.Supplier;

/** Outcome of one schema step: success, or a {@link SchemaFailure}. */
public final class SchemaResult {
  private static final SchemaResult OK = new SchemaResult(null);

  private final SchemaFailure failure;

  private SchemaResult(SchemaFailure failure) {
    this.failure = failure;
  }

  public static SchemaResult ok() {
    return OK;
  }

  public static SchemaResult failed(SchemaFailure failure) {
    return new SchemaResult(Objects.requireNonNull(failure, "failure"));
  }

  public boolean isOk() {
    return failure == null;
  }

  /** Null on success. */
  public SchemaFailure failure() {
    return failure;
  }

  /** Runs {@code next} only if this step succeeded. */
  public SchemaResult then(Supplier<SchemaResult> next) {
    return isOk() ? next.get() : this;
  }

  @Override
  public String toString() {
    return isOk() ? "SchemaResult[ok]" : "SchemaResult[" + failure.kind() + " in " + failure.operation() + "]";
  }
}
