package io.intellixity.polystage.error;

public enum FailureReason {
  UNRESOLVED_REFERENCE,
  COERCION,
  SCHEMA,
  BACKEND_TRANSIENT,
  BACKEND_PERMANENT,
  CANCELLED
}
