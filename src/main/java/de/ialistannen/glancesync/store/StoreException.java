package de.ialistannen.glancesync.store;

/**
 * A store call did not succeed.
 */
public class StoreException extends RuntimeException {

  private final int statusCode;

  public StoreException(String message) {
    this(message, -1);
  }

  public StoreException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
  }

  /**
   * @return the HTTP status the store answered with or -1 if it did not answer
   */
  public int statusCode() {
    return statusCode;
  }
}
