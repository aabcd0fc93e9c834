package io.intellixity.keyset.cursor;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Encodes values of one Java type into a cursor payload, tagged with {@link #id()} so that decoding restores
 * exactly the same type.
 */
public interface CursorValueType<T> {
  /** Tag written next to the payload; unique across all registered types. */
  String id();

  Class<T> javaType();

  JsonNode encode(T value);

  /** May throw any runtime exception on a malformed payload; the codec reports it as an invalid cursor. */
  T decode(JsonNode payload);
}
