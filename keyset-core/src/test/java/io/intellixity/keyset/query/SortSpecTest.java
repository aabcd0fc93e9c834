package io.intellixity.keyset.query;

import io.intellixity.keyset.InvalidPaginationParametersException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SortSpecTest {
  @Test
  void tieBreaker_appendedOnce() {
    SortSpec s = SortSpec.of(SortField.desc("createdAt")).withTieBreaker("_id");
    assertEquals(List.of("createdAt", "_id"), s.fieldNames());
    assertEquals(SortField.Direction.ASC, s.get(1).direction());
    assertSame(s, s.withTieBreaker("_id"));
  }

  @Test
  void inverse_flipsEveryDirection() {
    SortSpec s = SortSpec.of(SortField.desc("a"), SortField.asc("b"));
    assertEquals(SortSpec.of(SortField.asc("a"), SortField.desc("b")), s.inverse());
    assertEquals(s, s.inverse().inverse());
  }

  @Test
  void nullDirection_defaultsToAsc() {
    assertEquals(SortField.Direction.ASC, new SortField("a", null).direction());
  }

  @Test
  void invalidSpecs_rejected() {
    assertThrows(InvalidPaginationParametersException.class, () -> SortSpec.of(List.of()));
    assertThrows(InvalidPaginationParametersException.class, () -> SortSpec.of(SortField.asc("a"), SortField.desc("a")));
    assertThrows(InvalidPaginationParametersException.class, () -> SortSpec.of(SortField.asc(" ")));
    assertThrows(InvalidPaginationParametersException.class, () -> SortSpec.of(Arrays.asList(SortField.asc("a"), null)));
  }

  @Test
  void fieldsAreImmutableCopy() {
    List<SortField> src = new ArrayList<>(List.of(SortField.asc("a")));
    SortSpec s = SortSpec.of(src);
    src.add(SortField.asc("b"));
    assertEquals(1, s.size());
    assertThrows(UnsupportedOperationException.class, () -> s.fields().add(SortField.asc("c")));
  }

  @Test
  void strictlyAfter_followsDirection() {
    assertEquals(Operator.GT, Operator.strictlyAfter(SortField.Direction.ASC));
    assertEquals(Operator.LT, Operator.strictlyAfter(SortField.Direction.DESC));
  }
}
