package io.intellixity.keyset.paging;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Relay connection: the page's edges, in the declared sort order, plus {@link PageInfo}. */
public record Connection<D>(List<Edge<D>> edges, PageInfo pageInfo) {
  public Connection {
    edges = List.copyOf(edges == null ? List.of() : edges);
    Objects.requireNonNull(pageInfo, "pageInfo");
  }

  public List<D> nodes() {
    List<D> out = new ArrayList<>(edges.size());
    for (Edge<D> e : edges) out.add(e.node());
    return out;
  }
}
