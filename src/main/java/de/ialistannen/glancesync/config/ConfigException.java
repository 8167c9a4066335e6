package de.ialistannen.glancesync.config;

/**
 * The configuration is incomplete or contradicts itself.
 */
public class ConfigException extends RuntimeException {

  public ConfigException(String message) {
    super(message);
  }

  public ConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
