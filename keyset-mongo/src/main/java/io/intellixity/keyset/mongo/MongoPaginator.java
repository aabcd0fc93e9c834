package io.intellixity.keyset.mongo;

import com.mongodb.client.ClientSession;
import com.mongodb.client.MongoCollection;
import io.intellixity.keyset.cursor.CursorCodec;
import io.intellixity.keyset.cursor.JsonCursorCodec;
import io.intellixity.keyset.paging.Connection;
import io.intellixity.keyset.paging.PaginationExecutor;
import io.intellixity.keyset.paging.PaginationRequest;
import io.intellixity.keyset.paging.PaginationSettings;
import io.intellixity.keyset.query.QueryFilters;
import io.intellixity.keyset.spi.MapFieldReader;
import org.bson.Document;
import org.bson.conversions.Bson;

import java.util.Objects;

/**
 * Relay-style keyset pagination over a MongoDB collection.
 *
 * <pre>
 * Connection&lt;Document&gt; page = MongoPaginator.findPaginated(orders,
 *     PaginationRequest.forward(20, after).withSort(SortField.desc("createdAt")));
 * </pre>
 *
 * Documents are compared on their stored values; the unique key defaults to {@code _id}.
 */
public final class MongoPaginator {
  private final PaginationExecutor<Document> executor;

  public MongoPaginator(MongoCollection<Document> collection) {
    this(collection, PaginationSettings.DEFAULTS);
  }

  public MongoPaginator(MongoCollection<Document> collection, PaginationSettings settings) {
    this(new MongoDocumentStore(collection), settings, new JsonCursorCodec());
  }

  public MongoPaginator(MongoCollection<Document> collection, ClientSession session, PaginationSettings settings) {
    this(new MongoDocumentStore(collection, session), settings, new JsonCursorCodec());
  }

  public MongoPaginator(MongoDocumentStore store, PaginationSettings settings, CursorCodec codec) {
    Objects.requireNonNull(store, "store");
    this.executor = new PaginationExecutor<>(store, MapFieldReader.<Document>instance(), settings, codec);
  }

  public Connection<Document> find(PaginationRequest request) {
    return executor.execute(request);
  }

  /** Same as {@link #find(PaginationRequest)} with a driver-native filter as the base query. */
  public Connection<Document> find(Bson query, PaginationRequest request) {
    Objects.requireNonNull(request, "request");
    return executor.execute(request.withQuery(query == null ? null : QueryFilters.nativeFilter(query)));
  }

  /** Driver-native filter and projection. The projection is widened to keep the sort fields. */
  public Connection<Document> find(Bson query, Bson projection, PaginationRequest request) {
    Objects.requireNonNull(request, "request");
    return find(query, request.withNativeProjection(projection));
  }

  public static Connection<Document> findPaginated(MongoCollection<Document> collection, PaginationRequest request) {
    return new MongoPaginator(collection).find(request);
  }
}
