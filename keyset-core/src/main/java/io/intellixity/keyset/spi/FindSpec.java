package io.intellixity.keyset.spi;

import io.intellixity.keyset.query.QueryElement;
import io.intellixity.keyset.query.SortSpec;

import java.util.List;
import java.util.Objects;

/**
 * One store read.
 *
 * @param filter           predicate to apply, or null for "all documents"
 * @param sort             physical sort order
 * @param limit            maximum number of documents to return
 * @param projection       fields to return; empty means the whole document
 * @param nativeProjection store-native projection (e.g. a BSON document), or null; a store binding must keep the
 *                         sort fields in its result
 */
public record FindSpec(QueryElement filter, SortSpec sort, int limit, List<String> projection, Object nativeProjection) {
  public FindSpec {
    Objects.requireNonNull(sort, "sort");
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
    projection = (projection == null) ? List.of() : List.copyOf(projection);
  }

  public FindSpec(QueryElement filter, SortSpec sort, int limit, List<String> projection) {
    this(filter, sort, limit, projection, null);
  }
}
