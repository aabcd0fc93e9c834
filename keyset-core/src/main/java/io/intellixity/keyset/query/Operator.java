package io.intellixity.keyset.query;

public enum Operator {
  EQ,
  NE,
  GT,
  GE,
  LT,
  LE,

  IN,
  NIN,

  RANGE,
  LIKE,
  EXISTS;

  /** Strict comparison that moves past a value in the given sort direction. */
  public static Operator strictlyAfter(SortField.Direction direction) {
    return direction == SortField.Direction.DESC ? LT : GT;
  }
}
