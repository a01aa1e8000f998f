package io.intellixity.polystage.error;

/**
 * Structural plan defect detected before anything runs.\n
 *
 * Never retried; surfaced to the caller as is.\n
 */
public final class InvalidPlanException extends PolystageException {
  public InvalidPlanException(String message) {
    super(message);
  }

  public InvalidPlanException(String message, Throwable cause) {
    super(message, cause);
  }
}
