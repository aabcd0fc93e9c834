package io.intellixity.keyset;

/**
 * Raised for requests that cannot be paginated: conflicting counts, an invalid sort, or a sort field whose value on
 * a returned document cannot be written to a cursor.
 */
public final class InvalidPaginationParametersException extends PaginationException {
  public InvalidPaginationParametersException(String message) {
    super(message);
  }

  public InvalidPaginationParametersException(String message, Throwable cause) {
    super(message, cause);
  }
}
