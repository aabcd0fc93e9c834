package io.intellixity.keyset.cursor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Cursor value types, by id and by Java class.\n
 *
 * The no-arg constructor discovers {@link CursorValueTypeProvider}s from every
 * {@value #FACTORIES_RESOURCE} on the classpath (Java properties, comma-separated class names):\n
 *
 * <pre>
 * io.intellixity.keyset.cursor.CursorValueTypeProvider=com.acme.MoneyValueTypes
 * </pre>
 *
 * Resolution semantics:\n
 * - Decoding looks types up by id; the first provider registering an id wins.\n
 * - Encoding prefers a type whose javaType is exactly the value's class, then the first assignable one.\n
 */
public final class CursorValueTypeRegistry {
  private static final Logger log = LoggerFactory.getLogger(CursorValueTypeRegistry.class);

  public static final String FACTORIES_RESOURCE = "META-INF/keyset.factories";

  /** Tag used for null values; no type may claim it. */
  public static final String NULL_ID = "null";

  private final Map<String, CursorValueType<?>> byId;
  private final Map<Class<?>, CursorValueType<?>> byExactType;
  private final List<CursorValueType<?>> ordered;

  public CursorValueTypeRegistry() {
    this(Thread.currentThread().getContextClassLoader());
  }

  public CursorValueTypeRegistry(ClassLoader cl) {
    this(discoverProviders(cl == null ? CursorValueTypeRegistry.class.getClassLoader() : cl));
  }

  public CursorValueTypeRegistry(List<? extends CursorValueTypeProvider> providers) {
    Map<String, CursorValueType<?>> ids = new LinkedHashMap<>();
    Map<Class<?>, CursorValueType<?>> exact = new LinkedHashMap<>();
    for (CursorValueTypeProvider p : providers) {
      if (p == null) continue;
      Collection<CursorValueType<?>> types = p.valueTypes();
      if (types == null) continue;
      for (CursorValueType<?> t : types) {
        if (t == null) continue;
        if (NULL_ID.equals(t.id())) throw new IllegalArgumentException("Cursor value type id '" + NULL_ID + "' is reserved");
        ids.putIfAbsent(t.id(), t);
        exact.putIfAbsent(t.javaType(), t);
      }
    }
    this.byId = Map.copyOf(ids);
    this.byExactType = Map.copyOf(exact);
    this.ordered = List.copyOf(ids.values());
  }

  public CursorValueType<?> forId(String id) {
    return (id == null) ? null : byId.get(id);
  }

  public CursorValueType<?> forValue(Object value) {
    if (value == null) return null;
    CursorValueType<?> t = byExactType.get(value.getClass());
    if (t != null) return t;
    for (CursorValueType<?> candidate : ordered) {
      if (candidate.javaType().isInstance(value)) return candidate;
    }
    return null;
  }

  public Set<String> ids() {
    return byId.keySet();
  }

  /** Providers listed in all factories files visible to {@code cl}, in classpath order, each class once. */
  static List<CursorValueTypeProvider> discoverProviders(ClassLoader cl) {
    Map<String, URL> listed = new LinkedHashMap<>();
    for (URL source : factoriesFiles(cl)) {
      String names = readEntry(source);
      if (names == null) continue;
      for (String name : names.split(",")) {
        String className = name.trim();
        if (!className.isEmpty()) listed.putIfAbsent(className, source);
      }
    }

    List<CursorValueTypeProvider> providers = new ArrayList<>(listed.size());
    listed.forEach((className, source) -> {
      providers.add(instantiate(className, source, cl));
      log.debug("keyset.cursor_types provider={} source={}", className, source);
    });
    return providers;
  }

  private static List<URL> factoriesFiles(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(FACTORIES_RESOURCE));
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + FACTORIES_RESOURCE, e);
    }
  }

  private static String readEntry(URL source) {
    Properties p = new Properties();
    try (InputStream in = source.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + source, e);
    }
    String v = p.getProperty(CursorValueTypeProvider.class.getName());
    return (v == null || v.isBlank()) ? null : v;
  }

  private static CursorValueTypeProvider instantiate(String className, URL source, ClassLoader cl) {
    try {
      Class<?> raw = Class.forName(className, true, cl);
      if (!CursorValueTypeProvider.class.isAssignableFrom(raw)) {
        throw new IllegalStateException(className + " (listed in " + source + ") is not a CursorValueTypeProvider");
      }
      return (CursorValueTypeProvider) raw.getDeclaredConstructor().newInstance();
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot create cursor value type provider " + className + " listed in " + source, e);
    }
  }
}
