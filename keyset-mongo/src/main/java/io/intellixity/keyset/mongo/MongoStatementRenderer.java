package io.intellixity.keyset.mongo;

import io.intellixity.keyset.query.SortField;
import io.intellixity.keyset.query.SortSpec;
import io.intellixity.keyset.spi.FindSpec;
import org.bson.Document;

import java.util.List;
import java.util.Objects;

/** Turns a store-neutral {@link FindSpec} into a {@link MongoFindStatement}. */
public final class MongoStatementRenderer {
  private MongoStatementRenderer() {}

  public static MongoFindStatement render(FindSpec spec) {
    Objects.requireNonNull(spec, "spec");
    return new MongoFindStatement(
        MongoFilterRenderer.toBson(spec.filter()),
        sortDoc(spec.sort()),
        spec.limit(),
        projectionDoc(spec));
  }

  static Document projectionDoc(FindSpec spec) {
    if (spec.nativeProjection() == null) return projectionDoc(spec.projection());
    Document d = new Document(MongoFilterRenderer.nativeDocument(spec.nativeProjection()));
    if (d.isEmpty()) return null;

    // Sort fields must survive the projection: edge cursors are read from them.
    List<String> sortFields = spec.sort().fieldNames();
    if (isExclusion(d)) {
      for (String f : sortFields) d.remove(f);
      return d.isEmpty() ? null : d;
    }
    for (String f : sortFields) d.put(f, 1);
    return d;
  }

  // {a: 0, b: false} excludes; anything else (including {a: 1, _id: 0}) is an inclusion projection.
  private static boolean isExclusion(Document projection) {
    for (Object v : projection.values()) {
      boolean excluded = (v instanceof Boolean b && !b) || (v instanceof Number n && n.doubleValue() == 0d);
      if (!excluded) return false;
    }
    return true;
  }

  static Document sortDoc(SortSpec sort) {
    Document d = new Document();
    for (SortField sf : sort.fields()) {
      d.append(sf.field(), sf.direction() == SortField.Direction.DESC ? -1 : 1);
    }
    return d;
  }

  static Document projectionDoc(List<String> projection) {
    if (projection == null || projection.isEmpty()) return null;
    Document d = new Document();
    for (String p : projection) d.append(p, 1);
    return d;
  }
}
