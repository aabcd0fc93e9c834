package io.intellixity.keyset.cursor;

import io.intellixity.keyset.InvalidCursorException;
import io.intellixity.keyset.query.SortSpec;

import java.util.*;

/**
 * Where a document sits in a given sort order: one {@code (field, value)} entry per sort field, in sort order.
 */
public record Position(List<Entry> entries) {
  public Position {
    Objects.requireNonNull(entries, "entries");
    if (entries.isEmpty()) throw new IllegalArgumentException("position must have at least one entry");
    entries = List.copyOf(entries);
  }

  public record Entry(String field, Object value) {
    public Entry {
      Objects.requireNonNull(field, "field");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public int size() { return entries.size(); }
  public Object value(int i) { return entries.get(i).value(); }

  public List<String> fields() {
    List<String> out = new ArrayList<>(entries.size());
    for (Entry e : entries) out.add(e.field());
    return out;
  }

  /** Values in sort order; may contain nulls. */
  public List<Object> values() {
    List<Object> out = new ArrayList<>(entries.size());
    for (Entry e : entries) out.add(e.value());
    return Collections.unmodifiableList(out);
  }

  public boolean matches(SortSpec sort) {
    return sort != null && fields().equals(sort.fieldNames());
  }

  public Position requireMatches(SortSpec sort) {
    if (!matches(sort)) {
      throw new InvalidCursorException("Cursor fields " + fields() + " do not match sort fields "
          + (sort == null ? "[]" : sort.fieldNames()));
    }
    return this;
  }

  public static final class Builder {
    private final List<Entry> entries = new ArrayList<>();

    private Builder() {}

    public Builder add(String field, Object value) {
      entries.add(new Entry(field, value));
      return this;
    }

    public Position build() {
      return new Position(entries);
    }
  }
}
