package io.intellixity.keyset.spi;

import java.util.Map;

/**
 * {@link FieldReader} over {@link Map}-shaped documents (plain maps, BSON documents).
 * {@code "a.b.c"} walks nested maps; anything that is not a map along the way reads as null.
 */
public final class MapFieldReader<D extends Map<String, ?>> implements FieldReader<D> {
  private static final MapFieldReader<Map<String, ?>> INSTANCE = new MapFieldReader<>();

  @SuppressWarnings("unchecked")
  public static <D extends Map<String, ?>> MapFieldReader<D> instance() {
    return (MapFieldReader<D>) INSTANCE;
  }

  @Override
  public Object read(D document, String path) {
    return getByPath(document, path);
  }

  static Object getByPath(Map<String, ?> root, String path) {
    if (root == null || path == null || path.isBlank()) return null;
    if (root.containsKey(path)) return root.get(path);
    Object cur = root;
    for (String p : path.split("\\.")) {
      if (!(cur instanceof Map<?, ?> m)) return null;
      cur = m.get(p);
    }
    return cur;
  }
}
