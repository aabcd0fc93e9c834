package io.intellixity.keyset.paging;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

final class PaginationSettingsTest {
  @Test
  void defaults() {
    PaginationSettings s = PaginationSettings.fromProperties(new Properties());
    assertEquals(PaginationSettings.DEFAULTS, s);
    assertEquals(20, s.defaultLimit());
    assertEquals("_id", s.uniqueKey());
    assertEquals(CountPolicy.FALLBACK_TO_DEFAULT, s.countPolicy());
  }

  @Test
  void loadsClasspathResource() {
    PaginationSettings s = PaginationSettings.load(PaginationSettingsTest.class.getClassLoader());
    assertEquals(10, s.defaultLimit());
    assertEquals(50, s.maxLimit());
    assertEquals("id", s.uniqueKey());
    assertEquals(CountPolicy.REJECT, s.countPolicy());
  }

  @Test
  void policyAcceptsKebabCase() {
    Properties p = new Properties();
    p.setProperty(PaginationSettings.COUNT_POLICY_KEY, "fallback-to-default");
    assertEquals(CountPolicy.FALLBACK_TO_DEFAULT, PaginationSettings.fromProperties(p).countPolicy());
  }

  @Test
  void invalidValues_rejected() {
    Properties p = new Properties();
    p.setProperty(PaginationSettings.DEFAULT_LIMIT_KEY, "many");
    assertThrows(IllegalArgumentException.class, () -> PaginationSettings.fromProperties(p));

    assertThrows(IllegalArgumentException.class, () -> PaginationSettings.DEFAULTS.withDefaultLimit(0));
    assertThrows(IllegalArgumentException.class, () -> PaginationSettings.DEFAULTS.withMaxLimit(5));
    assertThrows(IllegalArgumentException.class, () -> PaginationSettings.DEFAULTS.withUniqueKey(" "));
  }
}
