package io.govlog.retry;

/**
 * A single storage step that may be attempted more than once.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface StorageOperation<T> {

  T run() throws Exception;
}
