package io.intellixity.keyset.paging;

import io.intellixity.keyset.InvalidCursorException;
import io.intellixity.keyset.cursor.Position;
import io.intellixity.keyset.query.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the seek predicate "strictly after this position in this sort order".\n
 *
 * For sort {@code [(f1,d1) .. (fn,dn)]} and position {@code [v1 .. vn]}:\n
 * <pre>
 * (f1 &gt; v1) OR (f1 = v1 AND f2 &gt; v2) OR ... OR (f1 = v1 AND ... AND fn &gt; vn)
 * </pre>
 * with {@code <} in place of {@code >} for DESC keys. The last key is the unique tie-breaker, so documents that
 * tie on every other key are still strictly ordered.\n
 */
public final class KeysetQueryBuilder {

  /** Base filter AND the seek predicate; the base filter alone when there is no cursor. */
  public QueryElement augment(QueryElement baseFilter, SortSpec executionSort, Position cursor) {
    if (cursor == null) return baseFilter;
    QueryElement boundary = boundary(executionSort, cursor);
    if (baseFilter == null) return boundary;
    return QueryFilters.and(baseFilter, boundary);
  }

  public QueryElement boundary(SortSpec executionSort, Position cursor) {
    if (executionSort == null) throw new IllegalArgumentException("executionSort is required");
    if (cursor == null) throw new IllegalArgumentException("cursor is required");
    cursor.requireMatches(executionSort);
    for (int i = 0; i < cursor.size(); i++) {
      if (cursor.value(i) == null) {
        throw new InvalidCursorException("Cursor has no value for sort field '" + executionSort.get(i).field() + "'");
      }
    }

    if (executionSort.size() == 1) return strictlyAfter(executionSort.get(0), cursor.value(0));

    // (a > v1) OR (a = v1 AND b > v2) OR ...
    List<QueryElement> orTerms = new ArrayList<>(executionSort.size());
    for (int i = 0; i < executionSort.size(); i++) {
      List<QueryElement> andTerms = new ArrayList<>(i + 1);

      // equalities for 0..i-1
      for (int j = 0; j < i; j++) {
        andTerms.add(QueryFilters.eq(executionSort.get(j).field(), cursor.value(j)));
      }

      // comparison for i
      andTerms.add(strictlyAfter(executionSort.get(i), cursor.value(i)));

      orTerms.add(andTerms.size() == 1 ? andTerms.get(0) : new LogicalGroup(Clause.AND, andTerms));
    }
    return new LogicalGroup(Clause.OR, orTerms);
  }

  private static Condition strictlyAfter(SortField sf, Object value) {
    return Condition.of(sf.field(), Operator.strictlyAfter(sf.direction()), value);
  }
}
