package io.intellixity.keyset.cursor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.keyset.InvalidCursorException;
import io.intellixity.keyset.InvalidPaginationParametersException;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

/**
 * Cursor codec writing a compact JSON document, base64url-encoded without padding.\n
 *
 * <pre>
 * {"v":1,"p":[{"f":"createdAt","t":"date","v":1583020800000},{"f":"_id","t":"objectId","v":"5e7..."}]}
 * </pre>
 *
 * Every value carries the id of the {@link CursorValueType} that wrote it, so decoding restores the exact Java type.
 */
public final class JsonCursorCodec implements CursorCodec {
  static final int VERSION = 1;

  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

  private final ObjectMapper json;
  private final CursorValueTypeRegistry types;

  public JsonCursorCodec() {
    this(new ObjectMapper(), new CursorValueTypeRegistry());
  }

  public JsonCursorCodec(CursorValueTypeRegistry types) {
    this(new ObjectMapper(), types);
  }

  public JsonCursorCodec(ObjectMapper json, CursorValueTypeRegistry types) {
    this.json = Objects.requireNonNull(json, "json");
    this.types = Objects.requireNonNull(types, "types");
  }

  @Override
  public String encode(Position position) {
    Objects.requireNonNull(position, "position");
    ObjectNode root = json.createObjectNode();
    root.put("v", VERSION);
    ArrayNode entries = root.putArray("p");
    for (Position.Entry e : position.entries()) {
      ObjectNode n = entries.addObject();
      n.put("f", e.field());
      Object value = e.value();
      if (value == null) {
        n.put("t", CursorValueTypeRegistry.NULL_ID);
        continue;
      }
      CursorValueType<?> type = types.forValue(value);
      if (type == null) {
        throw new InvalidPaginationParametersException("Sort field '" + e.field() + "' holds a value of type "
            + value.getClass().getName() + " that cannot be written to a cursor");
      }
      n.put("t", type.id());
      n.set("v", encodeValue(type, value));
    }

    try {
      byte[] bytes = json.writeValueAsBytes(root);
      return ENCODER.encodeToString(bytes);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to write cursor", e);
    }
  }

  @Override
  public Position decode(String token) {
    if (token == null || token.isEmpty()) throw new InvalidCursorException("Cursor is empty");

    JsonNode root;
    try {
      byte[] raw = DECODER.decode(token);
      root = json.readTree(new String(raw, StandardCharsets.UTF_8));
    } catch (IllegalArgumentException e) {
      throw new InvalidCursorException("Cursor is not valid base64url", e);
    } catch (JsonProcessingException e) {
      throw new InvalidCursorException("Cursor payload is not valid JSON", e);
    }

    if (root == null || !root.isObject()) throw new InvalidCursorException("Cursor payload must be a JSON object");
    JsonNode version = root.get("v");
    if (version == null || !version.isInt() || version.intValue() != VERSION) {
      throw new InvalidCursorException("Unsupported cursor version: " + version);
    }
    JsonNode entries = root.get("p");
    if (entries == null || !entries.isArray() || entries.isEmpty()) {
      throw new InvalidCursorException("Cursor carries no position");
    }

    Position.Builder b = Position.builder();
    for (JsonNode n : entries) {
      if (!n.isObject()) throw new InvalidCursorException("Cursor position entry must be an object");
      String field = text(n.get("f"), "field");
      String typeId = text(n.get("t"), "type");
      if (CursorValueTypeRegistry.NULL_ID.equals(typeId)) {
        b.add(field, null);
        continue;
      }
      CursorValueType<?> type = types.forId(typeId);
      if (type == null) throw new InvalidCursorException("Unknown cursor value type '" + typeId + "' for field '" + field + "'");
      JsonNode payload = n.get("v");
      if (payload == null || payload.isNull()) {
        throw new InvalidCursorException("Cursor value for field '" + field + "' is missing");
      }
      try {
        b.add(field, type.decode(payload));
      } catch (RuntimeException e) {
        throw new InvalidCursorException("Malformed " + typeId + " value for field '" + field + "' in cursor", e);
      }
    }
    return b.build();
  }

  @SuppressWarnings("unchecked")
  private static <T> JsonNode encodeValue(CursorValueType<T> type, Object value) {
    return type.encode((T) value);
  }

  private static String text(JsonNode n, String label) {
    if (n == null || !n.isTextual() || n.textValue().isEmpty()) {
      throw new InvalidCursorException("Cursor position entry is missing its " + label);
    }
    return n.textValue();
  }
}
