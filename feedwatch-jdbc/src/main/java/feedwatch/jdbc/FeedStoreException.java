package feedwatch.jdbc;

import feedwatch.PersistenceException;

/**
 * Unchecked exception wrapping JDBC errors raised by the registry and history store.
 */
public final class FeedStoreException extends PersistenceException {
  public FeedStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
