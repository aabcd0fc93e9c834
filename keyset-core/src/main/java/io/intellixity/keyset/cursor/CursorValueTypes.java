package io.intellixity.keyset.cursor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Objects;
import java.util.function.Function;

/** Factories for the common shapes of {@link CursorValueType}. */
public final class CursorValueTypes {
  private CursorValueTypes() {}

  /** Payload is the string form of the value. */
  public static <T> CursorValueType<T> text(String id, Class<T> type,
                                            Function<T, String> format, Function<String, T> parse) {
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(parse, "parse");
    return new Simple<>(id, type,
        v -> JsonNodeFactory.instance.textNode(format.apply(v)),
        n -> parse.apply(requireText(id, n)));
  }

  public static <T> CursorValueType<T> of(String id, Class<T> type,
                                          Function<T, JsonNode> encode, Function<JsonNode, T> decode) {
    return new Simple<>(id, type, encode, decode);
  }

  static String requireText(String id, JsonNode n) {
    if (n == null || !n.isTextual()) throw new IllegalArgumentException(id + " payload must be a string");
    return n.textValue();
  }

  private static final class Simple<T> implements CursorValueType<T> {
    private final String id;
    private final Class<T> type;
    private final Function<T, JsonNode> encode;
    private final Function<JsonNode, T> decode;

    private Simple(String id, Class<T> type, Function<T, JsonNode> encode, Function<JsonNode, T> decode) {
      this.id = Objects.requireNonNull(id, "id");
      this.type = Objects.requireNonNull(type, "type");
      this.encode = Objects.requireNonNull(encode, "encode");
      this.decode = Objects.requireNonNull(decode, "decode");
    }

    @Override public String id() { return id; }
    @Override public Class<T> javaType() { return type; }
    @Override public JsonNode encode(T value) { return encode.apply(value); }
    @Override public T decode(JsonNode payload) { return decode.apply(payload); }
  }
}
