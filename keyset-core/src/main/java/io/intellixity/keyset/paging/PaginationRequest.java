package io.intellixity.keyset.paging;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.keyset.query.QueryElement;
import io.intellixity.keyset.query.SortField;

import java.util.ArrayList;
import java.util.List;

/**
 * Relay-style pagination request.
 *
 * <p>{@code first}/{@code after} page forwards, {@code last}/{@code before} page backwards. A null or empty sort
 * means the configured default (the unique key, ascending). The query is handed to the store as given; a
 * projection is widened to keep the sort fields, which edge cursors are read from.</p>
 */
@JsonSerialize(using = PaginationRequestJsonSerializer.class)
@JsonDeserialize(using = PaginationRequestJsonDeserializer.class)
public final class PaginationRequest {
  private Integer first;
  private String after;
  private Integer last;
  private String before;
  private QueryElement query;
  private List<SortField> sort;
  private List<String> projection = new ArrayList<>();
  private Object nativeProjection;

  public PaginationRequest() {}

  public static PaginationRequest forward(Integer first, String after) {
    return new PaginationRequest().withFirst(first).withAfter(after);
  }

  public static PaginationRequest backward(Integer last, String before) {
    return new PaginationRequest().withLast(last).withBefore(before);
  }

  public Integer first() { return first; }
  public String after() { return after; }
  public Integer last() { return last; }
  public String before() { return before; }
  public QueryElement query() { return query; }
  /** Requested sort; null or empty selects the default. */
  public List<SortField> sort() { return sort; }
  public List<String> projection() { return projection; }
  /** Store-native projection (e.g. a BSON document), or null; bindings that understand it prefer it to {@link #projection()}. */
  public Object nativeProjection() { return nativeProjection; }

  public PaginationRequest withFirst(Integer first) { this.first = first; return this; }
  public PaginationRequest withAfter(String after) { this.after = after; return this; }
  public PaginationRequest withLast(Integer last) { this.last = last; return this; }
  public PaginationRequest withBefore(String before) { this.before = before; return this; }
  public PaginationRequest withQuery(QueryElement query) { this.query = query; return this; }
  public PaginationRequest withSort(List<SortField> sort) { this.sort = (sort == null) ? null : new ArrayList<>(sort); return this; }
  public PaginationRequest withSort(SortField... sort) { return withSort(sort == null ? null : List.of(sort)); }
  public PaginationRequest withNativeProjection(Object nativeProjection) { this.nativeProjection = nativeProjection; return this; }
  public PaginationRequest withProjection(List<String> projection) { this.projection = new ArrayList<>(projection == null ? List.of() : projection); return this; }

  @Override
  public String toString() {
    return "PaginationRequest{first=" + first + ", after=" + after + ", last=" + last + ", before=" + before
        + ", query=" + query + ", sort=" + sort + ", projection=" + projection
        + (nativeProjection == null ? "" : ", nativeProjection=" + nativeProjection) + "}";
  }
}
