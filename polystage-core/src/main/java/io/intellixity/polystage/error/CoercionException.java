package io.intellixity.polystage.error;

/**
 * A placeholder value cannot be converted losslessly to the declared target type, or the target
 * field is not declared in the target backend's schema.
 */
public final class CoercionException extends PolystageException {
  public CoercionException(String message) {
    super(message);
  }

  public CoercionException(String message, Throwable cause) {
    super(message, cause);
  }
}
