package io.intellixity.keyset.paging;

import io.intellixity.keyset.InvalidCursorException;
import io.intellixity.keyset.cursor.Position;
import io.intellixity.keyset.query.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.keyset.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class KeysetQueryBuilderTest {
  private final KeysetQueryBuilder builder = new KeysetQueryBuilder();

  @Test
  void singleKey_isOneComparison() {
    QueryElement q = builder.boundary(SortSpec.ascending("_id"), Position.builder().add("_id", 7).build());
    assertEquals(gt("_id", 7), q);

    QueryElement d = builder.boundary(SortSpec.by("_id", SortField.Direction.DESC), Position.builder().add("_id", 7).build());
    assertEquals(lt("_id", 7), d);
  }

  @Test
  void twoKeys_orOfPrefixEqualities() {
    SortSpec sort = SortSpec.of(SortField.desc("createdAt"), SortField.asc("_id"));
    Position p = Position.builder().add("createdAt", 100L).add("_id", "a").build();

    QueryElement q = builder.boundary(sort, p);
    assertEquals(or(
        lt("createdAt", 100L),
        and(eq("createdAt", 100L), gt("_id", "a"))
    ), q);
  }

  @Test
  void threeKeys_buildsEveryPrefix() {
    SortSpec sort = SortSpec.of(SortField.asc("a"), SortField.desc("b"), SortField.asc("c"));
    Position p = Position.builder().add("a", 1).add("b", 2).add("c", 3).build();

    LogicalGroup q = (LogicalGroup) builder.boundary(sort, p);
    assertEquals(Clause.OR, q.clause());
    assertEquals(List.of(
        gt("a", 1),
        and(eq("a", 1), lt("b", 2)),
        and(eq("a", 1), eq("b", 2), gt("c", 3))
    ), q.elements());
  }

  @Test
  void augment_withoutCursor_keepsBaseFilter() {
    Condition base = eq("status", "OPEN");
    assertSame(base, builder.augment(base, SortSpec.ascending("_id"), null));
    assertNull(builder.augment(null, SortSpec.ascending("_id"), null));
  }

  @Test
  void augment_andsBaseWithBoundary() {
    Condition base = eq("status", "OPEN");
    QueryElement q = builder.augment(base, SortSpec.ascending("_id"), Position.builder().add("_id", 3).build());
    assertEquals(and(base, gt("_id", 3)), q);

    assertEquals(gt("_id", 3), builder.augment(null, SortSpec.ascending("_id"), Position.builder().add("_id", 3).build()));
  }

  @Test
  void mismatchedPosition_isInvalidCursor() {
    SortSpec sort = SortSpec.of(SortField.asc("createdAt"), SortField.asc("_id"));
    assertThrows(InvalidCursorException.class,
        () -> builder.boundary(sort, Position.builder().add("_id", 1).build()));
    assertThrows(InvalidCursorException.class,
        () -> builder.boundary(sort, Position.builder().add("_id", 1).add("createdAt", 2).build()));
  }

  @Test
  void nullCursorValue_isInvalidCursor() {
    assertThrows(InvalidCursorException.class,
        () -> builder.boundary(SortSpec.ascending("_id"), Position.builder().add("_id", null).build()));
  }
}
