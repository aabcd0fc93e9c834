package io.intellixity.keyset.mongo;

import com.mongodb.client.ClientSession;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import io.intellixity.keyset.spi.DocumentStore;
import io.intellixity.keyset.spi.FindSpec;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link DocumentStore} over one collection using the official MongoDB Java sync driver.\n
 *
 * Runs inside the given {@link ClientSession} when one is supplied. Driver exceptions propagate unchanged.\n
 */
public final class MongoDocumentStore implements DocumentStore<Document> {
  private static final Logger log = LoggerFactory.getLogger(MongoDocumentStore.class);

  private final MongoCollection<Document> collection;
  private final ClientSession session;

  public MongoDocumentStore(MongoCollection<Document> collection) {
    this(collection, null);
  }

  public MongoDocumentStore(MongoCollection<Document> collection, ClientSession session) {
    this.collection = Objects.requireNonNull(collection, "collection");
    this.session = session;
  }

  public MongoCollection<Document> collection() { return collection; }

  @Override
  public List<Document> find(FindSpec spec) {
    MongoFindStatement st = MongoStatementRenderer.render(spec);
    debugFind(st);
    long start = System.nanoTime();

    FindIterable<Document> find = (session == null) ? collection.find(st.filter()) : collection.find(session, st.filter());
    if (st.sort() != null && !st.sort().isEmpty()) find = find.sort(st.sort());
    if (st.projection() != null) find = find.projection(st.projection());
    find = find.limit(st.limit());

    List<Document> out = find.into(new ArrayList<>());
    if (log.isDebugEnabled()) {
      log.debug("keyset.mongo_done op=find collection={} durationMs={} result=size={}",
          namespace(), (System.nanoTime() - start) / 1_000_000.0, out.size());
    }
    return out;
  }

  private void debugFind(MongoFindStatement st) {
    if (!log.isDebugEnabled()) return;
    log.debug("keyset.mongo op=find collection={} session={} sort={} limit={} projection={} filter={}",
        namespace(), session != null, st.sort(), st.limit(), st.projection(), st.filter());
  }

  private String namespace() {
    return String.valueOf(collection.getNamespace());
  }
}
