package io.intellixity.keyset;

/**
 * Raised when an {@code after}/{@code before} token cannot be decoded, or decodes to a position that does not
 * line up with the active sort specification.
 */
public final class InvalidCursorException extends PaginationException {
  public InvalidCursorException(String message) {
    super(message);
  }

  public InvalidCursorException(String message, Throwable cause) {
    super(message, cause);
  }
}
