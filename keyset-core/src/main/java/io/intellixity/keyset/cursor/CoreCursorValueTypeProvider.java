package io.intellixity.keyset.cursor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.*;
import java.util.*;

/** JDK value types (dialect-neutral). Number and date types keep their exact Java class across a round trip. */
public final class CoreCursorValueTypeProvider implements CursorValueTypeProvider {
  private static final JsonNodeFactory F = JsonNodeFactory.instance;

  @Override
  public Collection<CursorValueType<?>> valueTypes() {
    return List.of(
        CursorValueTypes.of("string", String.class, F::textNode, n -> CursorValueTypes.requireText("string", n)),
        CursorValueTypes.of("boolean", Boolean.class, F::booleanNode, CoreCursorValueTypeProvider::bool),
        CursorValueTypes.of("int", Integer.class, F::numberNode, CoreCursorValueTypeProvider::intValue),
        CursorValueTypes.of("long", Long.class, F::numberNode, CoreCursorValueTypeProvider::longValue),
        // Text keeps NaN/Infinity and the exact bits of the double.
        CursorValueTypes.text("double", Double.class, String::valueOf, Double::valueOf),
        CursorValueTypes.text("float", Float.class, String::valueOf, Float::valueOf),
        CursorValueTypes.text("decimal", BigDecimal.class, BigDecimal::toString, BigDecimal::new),
        CursorValueTypes.text("bigint", BigInteger.class, BigInteger::toString, BigInteger::new),
        CursorValueTypes.of("date", Date.class, d -> F.numberNode(d.getTime()), n -> new Date(longValue(n))),
        CursorValueTypes.text("instant", Instant.class, Instant::toString, Instant::parse),
        CursorValueTypes.text("localDate", LocalDate.class, LocalDate::toString, LocalDate::parse),
        CursorValueTypes.text("localDateTime", LocalDateTime.class, LocalDateTime::toString, LocalDateTime::parse),
        CursorValueTypes.text("offsetDateTime", OffsetDateTime.class, OffsetDateTime::toString, OffsetDateTime::parse),
        CursorValueTypes.text("uuid", UUID.class, UUID::toString, UUID::fromString)
    );
  }

  private static Boolean bool(JsonNode n) {
    if (n == null || !n.isBoolean()) throw new IllegalArgumentException("boolean payload must be true/false");
    return n.booleanValue();
  }

  private static Integer intValue(JsonNode n) {
    if (n == null || !n.isInt()) throw new IllegalArgumentException("int payload must be a 32-bit integer");
    return n.intValue();
  }

  private static Long longValue(JsonNode n) {
    if (n == null || !n.isIntegralNumber() || !n.canConvertToLong()) {
      throw new IllegalArgumentException("long payload must be a 64-bit integer");
    }
    return n.longValue();
  }
}
