package de.ialistannen.glancesync.sync;

/**
 * Replacing a stale image failed. The slave's remaining images are not synced anymore in this run.
 */
public class ReplaceSequenceException extends RuntimeException {

  private final String imageName;
  private final ReplaceStep lastCompletedStep;

  public ReplaceSequenceException(String imageName, ReplaceStep lastCompletedStep, String message, Throwable cause) {
    super(message, cause);
    this.imageName = imageName;
    this.lastCompletedStep = lastCompletedStep;
  }

  public String imageName() {
    return imageName;
  }

  public ReplaceStep lastCompletedStep() {
    return lastCompletedStep;
  }
}
