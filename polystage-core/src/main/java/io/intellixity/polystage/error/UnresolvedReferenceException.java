package io.intellixity.polystage.error;

/** A placeholder references a stage (or a field of it) that has not produced output. */
public final class UnresolvedReferenceException extends PolystageException {
  private final int stageIndex;
  private final String reference;

  public UnresolvedReferenceException(int stageIndex, String reference, String message) {
    super("Stage " + stageIndex + ": unresolved reference " + reference + ": " + message);
    this.stageIndex = stageIndex;
    this.reference = reference;
  }

  public int stageIndex() { return stageIndex; }

  public String reference() { return reference; }
}
