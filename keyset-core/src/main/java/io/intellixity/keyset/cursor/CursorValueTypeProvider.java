package io.intellixity.keyset.cursor;

import java.util.Collection;

/** Discovers {@link CursorValueType}s; registered in {@code META-INF/keyset.factories}. */
public interface CursorValueTypeProvider {
  Collection<CursorValueType<?>> valueTypes();
}
