package io.intellixity.keyset.paging;

import java.util.Objects;

/** A document and the cursor pointing at its position. The node is the store's document, unmodified. */
public record Edge<D>(String cursor, D node) {
  public Edge {
    Objects.requireNonNull(cursor, "cursor");
  }
}
