package io.fullerstack.eseries.core.config;

/**
 * Thrown when a configuration key is missing or holds an invalid value.
 * <p>
 * Configuration errors are only raised at startup and terminate the process.
 */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
