package io.intellixity.keyset.spi;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class MapFieldReaderTest {
  private final MapFieldReader<Map<String, Object>> reader = MapFieldReader.instance();

  @Test
  void readsTopLevelAndNestedPaths() {
    Map<String, Object> doc = Map.of("_id", 1, "customer", Map.of("address", Map.of("city", "Pune")));
    assertEquals(1, reader.read(doc, "_id"));
    assertEquals("Pune", reader.read(doc, "customer.address.city"));
  }

  @Test
  void literalDottedKey_winsOverNesting() {
    Map<String, Object> doc = Map.of("a.b", "flat", "a", Map.of("b", "nested"));
    assertEquals("flat", reader.read(doc, "a.b"));
  }

  @Test
  void missingOrNonMapSegments_readAsNull() {
    Map<String, Object> doc = Map.of("a", "scalar");
    assertNull(reader.read(doc, "a.b"));
    assertNull(reader.read(doc, "x"));
    assertNull(reader.read(doc, ""));
    assertNull(reader.read(null, "a"));
  }
}
