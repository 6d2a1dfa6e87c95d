package io.intellixity.frugal.access.exec;

/** Store-side failure (driver error, unreadable row). Wraps checked driver exceptions. */
public class DataStoreException extends RuntimeException {
  public DataStoreException(String message) {
    super(message);
  }

  public DataStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
