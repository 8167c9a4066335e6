package de.ialistannen.glancesync.store;

/**
 * The store could not be listed or we could not authenticate against it.
 */
public class StoreUnavailableException extends StoreException {

  public StoreUnavailableException(String message) {
    super(message);
  }

  public StoreUnavailableException(String message, int statusCode) {
    super(message, statusCode);
  }

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
