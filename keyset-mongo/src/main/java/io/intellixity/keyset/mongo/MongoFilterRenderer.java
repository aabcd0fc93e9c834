package io.intellixity.keyset.mongo;

import com.mongodb.MongoClientSettings;
import io.intellixity.keyset.query.*;
import org.bson.BsonDocument;
import org.bson.BsonDocumentReader;
import org.bson.Document;
import org.bson.codecs.DecoderContext;
import org.bson.codecs.configuration.CodecRegistry;
import org.bson.conversions.Bson;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Renders filter trees ({@link QueryElement}) to MongoDB BSON ({@link Document}),
 * applying De Morgan for NOT groups and rewriting EQ/NE null to "missing or null" semantics.\n
 *
 * {@link NativeFilter}s holding a {@link Bson} or a {@link Map} are embedded as-is.\n
 */
public final class MongoFilterRenderer {
  private MongoFilterRenderer() {}

  public static Document toBson(QueryElement filter) {
    if (filter == null) return new Document();
    return render(filter, false);
  }

  private static Document render(QueryElement el, boolean negate) {
    if (el == null) return new Document();

    if (el instanceof NotElement n) {
      return render(n.element(), !negate);
    }

    if (el instanceof NativeFilter nf) {
      Document d = nativeDocument(nf.nativeFilter());
      return (negate && !d.isEmpty()) ? new Document("$nor", List.of(d)) : d;
    }

    if (el instanceof LogicalGroup g) {
      Clause clause = g.clause();
      if (negate) clause = (clause == Clause.OR) ? Clause.AND : Clause.OR;

      List<Document> parts = new ArrayList<>();
      for (QueryElement child : g.elements()) {
        Document d = render(child, negate);
        if (d != null && !d.isEmpty()) parts.add(d);
      }
      if (parts.isEmpty()) return new Document();
      if (parts.size() == 1) return parts.get(0);
      return new Document((clause == Clause.OR) ? "$or" : "$and", parts);
    }

    if (!(el instanceof Condition c)) {
      throw new IllegalArgumentException("Unsupported QueryElement in filter: " + el.getClass().getName());
    }

    String path = c.property();
    boolean not = c.not() ^ negate;
    Operator op = c.operator();

    Document positive = switch (op) {
      case EQ -> new Document(path, c.value());
      case NE -> new Document(path, new Document("$ne", c.value()));
      case GT -> new Document(path, new Document("$gt", requireNonNull(op, c.value())));
      case GE -> new Document(path, new Document("$gte", requireNonNull(op, c.value())));
      case LT -> new Document(path, new Document("$lt", requireNonNull(op, c.value())));
      case LE -> new Document(path, new Document("$lte", requireNonNull(op, c.value())));
      case IN -> new Document(path, new Document("$in", toList(c.value())));
      case NIN -> new Document(path, new Document("$nin", toList(c.value())));
      case RANGE -> new Document(path,
          new Document("$gte", requireNonNull("RANGE.lower", c.lower()))
              .append("$lte", requireNonNull("RANGE.upper", c.upper())));
      case LIKE -> likePositive(path, String.valueOf(requireNonNull(op, c.value())));
      case EXISTS -> new Document(path, new Document("$exists", !Boolean.FALSE.equals(c.value())));
    };

    return not ? new Document("$nor", List.of(positive)) : positive;
  }

  private static Object requireNonNull(Object op, Object v) {
    if (v == null) throw new IllegalArgumentException(op + " requires non-null value");
    return v;
  }

  private static Document likePositive(String path, String likePattern) {
    // '%' -> '.*', '_' -> '.'
    StringBuilder re = new StringBuilder();
    re.append("^");
    for (int i = 0; i < likePattern.length(); i++) {
      char ch = likePattern.charAt(i);
      if (ch == '%') re.append(".*");
      else if (ch == '_') re.append(".");
      else re.append(Pattern.quote(String.valueOf(ch)));
    }
    re.append("$");
    return new Document(path, new Document("$regex", re.toString()));
  }

  @SuppressWarnings("unchecked")
  static Document nativeDocument(Object o) {
    if (o == null) return new Document();
    if (o instanceof Document d) return d;
    if (o instanceof Bson b) {
      // decoded back to Java values so callers can inspect it like any Document
      CodecRegistry registry = MongoClientSettings.getDefaultCodecRegistry();
      BsonDocument bd = b.toBsonDocument(BsonDocument.class, registry);
      return registry.get(Document.class).decode(new BsonDocumentReader(bd), DecoderContext.builder().build());
    }
    if (o instanceof Map<?, ?> m) return new Document((Map<String, Object>) m);
    throw new IllegalArgumentException("Mongo cannot use native value of type " + o.getClass().getName());
  }

  private static List<Object> toList(Object v) {
    if (v == null) return List.of();
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    if (v instanceof Object[] arr) return Arrays.asList(arr);
    return List.of(v);
  }
}
