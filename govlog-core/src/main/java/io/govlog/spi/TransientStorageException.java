package io.govlog.spi;

/**
 * Storage failure caused by lock contention or a timeout; the same write may succeed
 * if attempted again.
 */
public class TransientStorageException extends EventLogException {

  public TransientStorageException(String message) {
    super(message);
  }

  public TransientStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
