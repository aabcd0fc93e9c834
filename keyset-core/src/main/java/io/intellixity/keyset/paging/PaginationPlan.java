package io.intellixity.keyset.paging;

import io.intellixity.keyset.cursor.Position;
import io.intellixity.keyset.query.SortSpec;

import java.util.Objects;

/**
 * Canonical form of a {@link PaginationRequest}.
 *
 * @param limit               resolved page size (at least 1)
 * @param cursor              decoded boundary position, or null to start at the edge of the ordered set
 * @param declaredSort        requested sort completed with the tie-breaker; the order pages are presented in
 * @param executionSort       order sent to the store: {@code declaredSort}, inverted when paging backwards
 * @param paginatingBackwards true for {@code last}/{@code before}
 * @param afterSupplied       an {@code after} cursor drove a forward request
 * @param beforeSupplied      a {@code before} cursor drove a backward request
 */
public record PaginationPlan(int limit,
                             Position cursor,
                             SortSpec declaredSort,
                             SortSpec executionSort,
                             boolean paginatingBackwards,
                             boolean afterSupplied,
                             boolean beforeSupplied) {
  public PaginationPlan {
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
    Objects.requireNonNull(declaredSort, "declaredSort");
    Objects.requireNonNull(executionSort, "executionSort");
  }
}
