package io.intellixity.keyset.paging;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.keyset.query.QueryElementJson;
import io.intellixity.keyset.query.SortField;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Canonical JSON deserializer for {@link PaginationRequest}. */
public final class PaginationRequestJsonDeserializer extends JsonDeserializer<PaginationRequest> {
  @Override
  public PaginationRequest deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Pagination request JSON must be an object");

    PaginationRequest r = new PaginationRequest()
        .withFirst(intOrNull(root.get("first"), "first"))
        .withAfter(textOrNull(root.get("after")))
        .withLast(intOrNull(root.get("last"), "last"))
        .withBefore(textOrNull(root.get("before")));

    JsonNode query = root.get("query");
    if (query != null && !query.isNull()) r.withQuery(QueryElementJson.read(query, codec));

    JsonNode sort = root.get("sort");
    if (sort != null && !sort.isNull()) {
      if (!sort.isArray()) throw new IllegalArgumentException("sort must be an array");
      List<SortField> fields = new ArrayList<>();
      for (JsonNode s : sort) {
        String f = textOrNull(s.get("field"));
        if (f == null) throw new IllegalArgumentException("sort entry requires field: " + s);
        String dir = textOrNull(s.get("dir"));
        SortField.Direction d = (dir == null) ? SortField.Direction.ASC : SortField.Direction.valueOf(dir.toUpperCase(Locale.ROOT));
        fields.add(new SortField(f, d));
      }
      r.withSort(fields);
    }

    JsonNode proj = root.get("projection");
    if (proj != null && proj.isArray()) {
      List<String> out = new ArrayList<>();
      for (JsonNode x : proj) if (x.isTextual()) out.add(x.asText());
      r.withProjection(out);
    }
    return r;
  }

  private static Integer intOrNull(JsonNode n, String name) {
    if (n == null || n.isNull()) return null;
    if (n.isInt()) return n.intValue();
    if (n.isTextual()) {
      try {
        return Integer.valueOf(n.asText().trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(name + " must be an integer but was '" + n.asText() + "'", e);
      }
    }
    throw new IllegalArgumentException(name + " must be an integer but was " + n);
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }
}
