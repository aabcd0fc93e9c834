package io.intellixity.keyset.paging;

import io.intellixity.keyset.InvalidPaginationParametersException;
import io.intellixity.keyset.cursor.CursorCodec;
import io.intellixity.keyset.cursor.JsonCursorCodec;
import io.intellixity.keyset.cursor.Position;
import io.intellixity.keyset.query.QueryElement;
import io.intellixity.keyset.query.SortField;
import io.intellixity.keyset.spi.DocumentStore;
import io.intellixity.keyset.spi.FieldReader;
import io.intellixity.keyset.spi.FindSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Runs one pagination request against a {@link DocumentStore}.\n
 *
 * normalize -&gt; seek predicate -&gt; find(limit + 1) -&gt; trim overflow -&gt; re-orient -&gt; edges + page info.\n
 *
 * Holds no per-request state; safe to share between threads. Store failures propagate unchanged.\n
 */
public final class PaginationExecutor<D> {
  private static final Logger log = LoggerFactory.getLogger(PaginationExecutor.class);

  private final DocumentStore<D> store;
  private final FieldReader<D> fields;
  private final DirectionNormalizer normalizer;
  private final KeysetQueryBuilder queries;
  private final CursorCodec codec;

  public PaginationExecutor(DocumentStore<D> store, FieldReader<D> fields) {
    this(store, fields, PaginationSettings.DEFAULTS, new JsonCursorCodec());
  }

  public PaginationExecutor(DocumentStore<D> store, FieldReader<D> fields, PaginationSettings settings, CursorCodec codec) {
    this(store, fields, new DirectionNormalizer(settings, codec), new KeysetQueryBuilder(), codec);
  }

  public PaginationExecutor(DocumentStore<D> store,
                            FieldReader<D> fields,
                            DirectionNormalizer normalizer,
                            KeysetQueryBuilder queries,
                            CursorCodec codec) {
    this.store = Objects.requireNonNull(store, "store");
    this.fields = Objects.requireNonNull(fields, "fields");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    this.queries = Objects.requireNonNull(queries, "queries");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  public Connection<D> execute(PaginationRequest request) {
    PaginationPlan plan = normalizer.normalize(request);
    QueryElement filter = queries.augment(request.query(), plan.executionSort(), plan.cursor());
    FindSpec spec = new FindSpec(filter, plan.executionSort(), fetchSize(plan.limit()),
        projectionOf(request, plan), request.nativeProjection());
    logPlan(plan, spec);

    List<D> fetched = store.find(spec);
    if (fetched == null) fetched = List.of();

    // One extra document was requested to learn whether more exist past this page.
    boolean hasMore = fetched.size() > plan.limit();
    List<D> page = new ArrayList<>(hasMore ? fetched.subList(0, plan.limit()) : fetched);

    // Fetched in inverted order; present in the declared one.
    if (plan.paginatingBackwards()) Collections.reverse(page);

    List<Edge<D>> edges = new ArrayList<>(page.size());
    for (D doc : page) {
      edges.add(new Edge<>(codec.encode(positionOf(doc, plan)), doc));
    }

    boolean hasPreviousPage = plan.paginatingBackwards() ? hasMore : plan.afterSupplied();
    boolean hasNextPage = plan.paginatingBackwards() ? plan.beforeSupplied() : hasMore;
    PageInfo info = new PageInfo(
        edges.isEmpty() ? null : edges.get(0).cursor(),
        edges.isEmpty() ? null : edges.get(edges.size() - 1).cursor(),
        hasPreviousPage,
        hasNextPage);

    if (log.isDebugEnabled()) {
      log.debug("keyset.page_done fetched={} returned={} hasMore={} hasPreviousPage={} hasNextPage={}",
          fetched.size(), edges.size(), hasMore, hasPreviousPage, hasNextPage);
    }
    return new Connection<>(edges, info);
  }

  // Integer.MAX_VALUE leaves no room for the extra document; such a page is never trimmed.
  static int fetchSize(int limit) {
    return (limit == Integer.MAX_VALUE) ? limit : limit + 1;
  }

  // Edge cursors are read from the returned documents, so a field list must keep every sort field.
  static List<String> projectionOf(PaginationRequest request, PaginationPlan plan) {
    if (request.projection().isEmpty()) return List.of();
    Set<String> fields = new LinkedHashSet<>(request.projection());
    fields.addAll(plan.declaredSort().fieldNames());
    return new ArrayList<>(fields);
  }

  Position positionOf(D doc, PaginationPlan plan) {
    Position.Builder b = Position.builder();
    for (SortField sf : plan.declaredSort().fields()) {
      Object v = fields.read(doc, sf.field());
      if (v == null) {
        throw new InvalidPaginationParametersException("Sort field '" + sf.field() + "' does not resolve on document " + doc);
      }
      if (!(v instanceof Comparable<?>)) {
        throw new InvalidPaginationParametersException("Sort field '" + sf.field() + "' resolves to a non-comparable "
            + v.getClass().getName());
      }
      b.add(sf.field(), v);
    }
    return b.build();
  }

  private void logPlan(PaginationPlan plan, FindSpec spec) {
    if (!log.isDebugEnabled()) return;
    log.debug("keyset.page mode={} limit={} cursor={} sort={} fetchLimit={} filter={}",
        plan.paginatingBackwards() ? "backward" : "forward",
        plan.limit(),
        plan.cursor() != null,
        spec.sort(),
        spec.limit(),
        spec.filter());
  }
}
