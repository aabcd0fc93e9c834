package io.intellixity.keyset.spi;

/** Reads a (dot-addressed) field value out of a store document. Missing fields read as null. */
@FunctionalInterface
public interface FieldReader<D> {
  Object read(D document, String path);
}
