package io.intellixity.polystage.error;

/** Root of the pipeline error taxonomy. All subclasses are unchecked. */
public abstract class PolystageException extends RuntimeException {
  protected PolystageException(String message) {
    super(message);
  }

  protected PolystageException(String message, Throwable cause) {
    super(message, cause);
  }
}
