package de.ialistannen.glancesync.sync;

public class CreateFailedException extends RuntimeException {

  private final String imageName;

  public CreateFailedException(String imageName, String message, Throwable cause) {
    super(message, cause);
    this.imageName = imageName;
  }

  public String imageName() {
    return imageName;
  }
}
