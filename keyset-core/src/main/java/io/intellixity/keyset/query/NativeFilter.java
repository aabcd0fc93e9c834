package io.intellixity.keyset.query;

import java.util.Objects;

/**
 * Store-native predicate carried through the filter tree untouched.
 *
 * <p>Each store binding accepts its own native type (for MongoDB a BSON document) and rejects others.</p>
 */
public record NativeFilter(Object nativeFilter) implements QueryElement {
  public NativeFilter {
    Objects.requireNonNull(nativeFilter, "nativeFilter");
  }
}
