package io.intellixity.keyset.paging;

/** What to do with a {@code first}/{@code last} of zero or less. */
public enum CountPolicy {
  /** Use the default limit, as if no count was given. */
  FALLBACK_TO_DEFAULT,
  /** Fail with {@link io.intellixity.keyset.InvalidPaginationParametersException}. */
  REJECT
}
