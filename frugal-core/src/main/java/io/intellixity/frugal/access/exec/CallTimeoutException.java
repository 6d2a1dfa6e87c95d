package io.intellixity.frugal.access.exec;

public final class CallTimeoutException extends DataStoreException {
  public CallTimeoutException(String message) {
    super(message);
  }

  public CallTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
