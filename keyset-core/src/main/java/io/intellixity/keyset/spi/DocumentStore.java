package io.intellixity.keyset.spi;

import java.util.List;

/**
 * External document store. Executes one filtered, sorted, limited and projected read.
 * <p>
 * Implementations throw their own exceptions on failure; pagination propagates them unchanged and never retries.
 */
public interface DocumentStore<D> {
  List<D> find(FindSpec spec);
}
