package io.intellixity.keyset.paging;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Process-wide pagination configuration. Immutable; pass it to the components that need it.
 *
 * @param defaultLimit page size used when a request gives no (or, under {@link CountPolicy#FALLBACK_TO_DEFAULT},
 *                     a non-positive) count
 * @param maxLimit     upper bound applied to every resolved page size
 * @param uniqueKey    field whose value is unique per document; appended to every sort as the tie-breaker
 * @param countPolicy  handling of non-positive counts
 */
public record PaginationSettings(int defaultLimit, int maxLimit, String uniqueKey, CountPolicy countPolicy) {
  public static final String RESOURCE = "keyset.properties";

  public static final String DEFAULT_LIMIT_KEY = "keyset.default-limit";
  public static final String MAX_LIMIT_KEY = "keyset.max-limit";
  public static final String UNIQUE_KEY_KEY = "keyset.unique-key";
  public static final String COUNT_POLICY_KEY = "keyset.count-policy";

  public static final PaginationSettings DEFAULTS =
      new PaginationSettings(20, Integer.MAX_VALUE, "_id", CountPolicy.FALLBACK_TO_DEFAULT);

  public PaginationSettings {
    if (defaultLimit <= 0) throw new IllegalArgumentException("defaultLimit must be > 0");
    if (maxLimit <= 0) throw new IllegalArgumentException("maxLimit must be > 0");
    if (defaultLimit > maxLimit) throw new IllegalArgumentException("defaultLimit must be <= maxLimit");
    Objects.requireNonNull(uniqueKey, "uniqueKey");
    if (uniqueKey.isBlank()) throw new IllegalArgumentException("uniqueKey must not be blank");
    countPolicy = (countPolicy == null) ? CountPolicy.FALLBACK_TO_DEFAULT : countPolicy;
  }

  public PaginationSettings withDefaultLimit(int v) { return new PaginationSettings(v, maxLimit, uniqueKey, countPolicy); }
  public PaginationSettings withMaxLimit(int v) { return new PaginationSettings(defaultLimit, v, uniqueKey, countPolicy); }
  public PaginationSettings withUniqueKey(String v) { return new PaginationSettings(defaultLimit, maxLimit, v, countPolicy); }
  public PaginationSettings withCountPolicy(CountPolicy v) { return new PaginationSettings(defaultLimit, maxLimit, uniqueKey, v); }

  /** Reads {@code keyset.*} keys; absent keys keep their {@link #DEFAULTS} value. */
  public static PaginationSettings fromProperties(Properties p) {
    Objects.requireNonNull(p, "properties");
    int defaultLimit = intOrDefault(p, DEFAULT_LIMIT_KEY, DEFAULTS.defaultLimit());
    int maxLimit = intOrDefault(p, MAX_LIMIT_KEY, DEFAULTS.maxLimit());
    String uniqueKey = p.getProperty(UNIQUE_KEY_KEY, DEFAULTS.uniqueKey()).trim();
    String policy = p.getProperty(COUNT_POLICY_KEY);
    CountPolicy countPolicy = (policy == null || policy.isBlank())
        ? DEFAULTS.countPolicy()
        : CountPolicy.valueOf(policy.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    return new PaginationSettings(defaultLimit, maxLimit, uniqueKey, countPolicy);
  }

  /** {@value #RESOURCE} from the classpath when present, else {@link #DEFAULTS}. */
  public static PaginationSettings load() {
    return load(Thread.currentThread().getContextClassLoader());
  }

  public static PaginationSettings load(ClassLoader cl) {
    if (cl == null) cl = PaginationSettings.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(RESOURCE)) {
      if (in == null) return DEFAULTS;
      Properties p = new Properties();
      p.load(in);
      return fromProperties(p);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load " + RESOURCE, e);
    }
  }

  private static int intOrDefault(Properties p, String key, int def) {
    String v = p.getProperty(key);
    if (v == null || v.isBlank()) return def;
    try {
      return Integer.parseInt(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Property " + key + " must be an integer but was '" + v + "'", e);
    }
  }
}
