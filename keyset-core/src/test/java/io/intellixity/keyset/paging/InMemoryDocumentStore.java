package io.intellixity.keyset.paging;

import io.intellixity.keyset.query.*;
import io.intellixity.keyset.spi.DocumentStore;
import io.intellixity.keyset.spi.FindSpec;
import io.intellixity.keyset.spi.MapFieldReader;

import java.util.*;

/**
 * List-backed store evaluating the filter tree in memory. Records every {@link FindSpec} it receives.
 * A non-empty projection keeps only the listed top-level fields, nothing implicit.
 */
final class InMemoryDocumentStore implements DocumentStore<Map<String, Object>> {
  private final List<Map<String, Object>> docs;
  final List<FindSpec> calls = new ArrayList<>();

  InMemoryDocumentStore(List<Map<String, Object>> docs) {
    this.docs = List.copyOf(docs);
  }

  FindSpec lastCall() {
    return calls.get(calls.size() - 1);
  }

  @Override
  public List<Map<String, Object>> find(FindSpec spec) {
    calls.add(spec);
    List<Map<String, Object>> out = new ArrayList<>();
    for (Map<String, Object> d : docs) {
      if (spec.filter() == null || matches(spec.filter(), d)) out.add(d);
    }
    out.sort(comparator(spec.sort()));
    List<Map<String, Object>> page = out.size() > spec.limit() ? new ArrayList<>(out.subList(0, spec.limit())) : out;
    if (spec.projection().isEmpty()) return page;

    List<Map<String, Object>> projected = new ArrayList<>(page.size());
    for (Map<String, Object> d : page) {
      Map<String, Object> p = new LinkedHashMap<>();
      for (String f : spec.projection()) {
        if (d.containsKey(f)) p.put(f, d.get(f));
      }
      projected.add(p);
    }
    return projected;
  }

  private static Comparator<Map<String, Object>> comparator(SortSpec sort) {
    return (a, b) -> {
      for (SortField sf : sort.fields()) {
        int c = compare(read(a, sf.field()), read(b, sf.field()));
        if (c != 0) return sf.direction() == SortField.Direction.DESC ? -c : c;
      }
      return 0;
    };
  }

  private static boolean matches(QueryElement el, Map<String, Object> d) {
    if (el instanceof LogicalGroup g) {
      if (g.clause() == Clause.AND) {
        for (QueryElement e : g.elements()) if (!matches(e, d)) return false;
        return true;
      }
      for (QueryElement e : g.elements()) if (matches(e, d)) return true;
      return false;
    }
    if (el instanceof NotElement n) return !matches(n.element(), d);
    if (el instanceof Condition c) return c.not() != test(c, read(d, c.property()));
    throw new IllegalArgumentException("Unsupported element " + el);
  }

  private static boolean test(Condition c, Object v) {
    switch (c.operator()) {
      case EQ: return Objects.equals(v, c.value());
      case NE: return !Objects.equals(v, c.value());
      case GT: return v != null && compare(v, c.value()) > 0;
      case GE: return v != null && compare(v, c.value()) >= 0;
      case LT: return v != null && compare(v, c.value()) < 0;
      case LE: return v != null && compare(v, c.value()) <= 0;
      case IN: return ((Collection<?>) c.value()).contains(v);
      case NIN: return !((Collection<?>) c.value()).contains(v);
      case RANGE: return v != null && compare(v, c.lower()) >= 0 && compare(v, c.upper()) <= 0;
      case EXISTS: return (v != null) == Boolean.TRUE.equals(c.value());
      default: throw new IllegalArgumentException("Unsupported operator " + c.operator());
    }
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private static int compare(Object a, Object b) {
    return ((Comparable) a).compareTo(b);
  }

  private static Object read(Map<String, Object> d, String path) {
    return MapFieldReader.<Map<String, Object>>instance().read(d, path);
  }
}
