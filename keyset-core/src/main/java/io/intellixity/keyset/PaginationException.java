package io.intellixity.keyset;

/**
 * Root of the errors raised by keyset pagination.
 * <p>
 * Failures of the underlying document store are never wrapped in this type; they reach the caller unchanged.
 */
public class PaginationException extends RuntimeException {
  public PaginationException(String message) {
    super(message);
  }

  public PaginationException(String message, Throwable cause) {
    super(message, cause);
  }
}
