package io.intellixity.keyset.paging;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.keyset.query.QueryElementJson;
import io.intellixity.keyset.query.SortField;

import java.io.IOException;

/** Canonical JSON serializer for {@link PaginationRequest}; absent parameters are omitted. */
public final class PaginationRequestJsonSerializer extends JsonSerializer<PaginationRequest> {
  @Override
  public void serialize(PaginationRequest r, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (r == null) {
      g.writeNull();
      return;
    }

    if (r.nativeProjection() != null) {
      throw new IllegalArgumentException("Store-native projections have no JSON form");
    }

    g.writeStartObject();
    if (r.first() != null) g.writeNumberField("first", r.first());
    if (r.after() != null) g.writeStringField("after", r.after());
    if (r.last() != null) g.writeNumberField("last", r.last());
    if (r.before() != null) g.writeStringField("before", r.before());

    if (r.query() != null) {
      g.writeFieldName("query");
      QueryElementJson.write(r.query(), g, serializers);
    }

    if (r.sort() != null) {
      g.writeArrayFieldStart("sort");
      for (SortField sf : r.sort()) {
        g.writeStartObject();
        g.writeStringField("field", sf.field());
        g.writeStringField("dir", sf.direction().name());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (!r.projection().isEmpty()) {
      g.writeArrayFieldStart("projection");
      for (String p : r.projection()) g.writeString(p);
      g.writeEndArray();
    }

    g.writeEndObject();
  }
}
