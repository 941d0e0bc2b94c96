package io.govlog.spi;

/**
 * Unchecked exception for storage failures that retrying will not fix: corruption,
 * I/O errors, constraint violations.
 *
 * @see TransientStorageException
 */
public class EventLogException extends RuntimeException {

  public EventLogException(String message) {
    super(message);
  }

  public EventLogException(String message, Throwable cause) {
    super(message, cause);
  }
}
