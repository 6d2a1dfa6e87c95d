package io.intellixity.frugal.access.query;

/**
 * Raised when an {@link EntityQuery} references unknown fields/relations, omits its projection list,
 * or otherwise fails validation against the entity schema.
 */
public final class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
