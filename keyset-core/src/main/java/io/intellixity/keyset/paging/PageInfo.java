package io.intellixity.keyset.paging;

/**
 * Relay page info.\n
 *
 * {@code startCursor}/{@code endCursor} come from the first/last returned edge (null on an empty page).
 * In forward mode {@code hasNextPage} is measured and {@code hasPreviousPage} only says whether an {@code after}
 * cursor was given; backward mode is the mirror image.\n
 */
public record PageInfo(String startCursor, String endCursor, boolean hasPreviousPage, boolean hasNextPage) {
}
