package io.intellixity.keyset.query;

import io.intellixity.keyset.InvalidPaginationParametersException;

import java.util.*;

/**
 * Ordered, non-empty list of {@link SortField}s, most significant first.
 *
 * <p>Keyset pagination needs a total order, so specs are normally completed with a unique tie-breaker
 * via {@link #withTieBreaker(String)} before they reach a store.</p>
 */
public final class SortSpec {
  private final List<SortField> fields;

  private SortSpec(List<SortField> fields) {
    this.fields = fields;
  }

  public static SortSpec of(List<SortField> fields) {
    if (fields == null || fields.isEmpty()) {
      throw new InvalidPaginationParametersException("Sort specification must contain at least one field");
    }
    Set<String> seen = new HashSet<>();
    for (SortField sf : fields) {
      if (sf == null) throw new InvalidPaginationParametersException("Sort specification contains a null entry");
      if (sf.field().isBlank()) throw new InvalidPaginationParametersException("Blank field path in sort specification");
      if (!seen.add(sf.field())) {
        throw new InvalidPaginationParametersException("Duplicate field path '" + sf.field() + "' in sort specification");
      }
    }
    return new SortSpec(List.copyOf(fields));
  }

  public static SortSpec of(SortField... fields) {
    return of(fields == null ? null : Arrays.asList(fields));
  }

  public static SortSpec by(String field, SortField.Direction direction) {
    return of(new SortField(field, direction));
  }

  public static SortSpec ascending(String field) {
    return of(SortField.asc(field));
  }

  public List<SortField> fields() { return fields; }
  public int size() { return fields.size(); }
  public SortField get(int i) { return fields.get(i); }

  public List<String> fieldNames() {
    List<String> out = new ArrayList<>(fields.size());
    for (SortField sf : fields) out.add(sf.field());
    return out;
  }

  public boolean contains(String field) {
    for (SortField sf : fields) {
      if (sf.field().equals(field)) return true;
    }
    return false;
  }

  /** Appends {@code (uniqueKey, ASC)} unless the key is already part of the spec. */
  public SortSpec withTieBreaker(String uniqueKey) {
    Objects.requireNonNull(uniqueKey, "uniqueKey");
    if (contains(uniqueKey)) return this;
    List<SortField> out = new ArrayList<>(fields);
    out.add(SortField.asc(uniqueKey));
    return new SortSpec(List.copyOf(out));
  }

  /** Same fields, every direction flipped. */
  public SortSpec inverse() {
    List<SortField> out = new ArrayList<>(fields.size());
    for (SortField sf : fields) out.add(sf.inverse());
    return new SortSpec(List.copyOf(out));
  }

  @Override
  public boolean equals(Object o) {
    return (o instanceof SortSpec s) && fields.equals(s.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    StringJoiner j = new StringJoiner(", ", "[", "]");
    for (SortField sf : fields) j.add(sf.field() + " " + sf.direction());
    return j.toString();
  }
}
