package io.intellixity.keyset.query;

import java.util.Objects;

public final class Condition implements QueryElement {
  private final String property;
  private final Operator operator;
  private final Object value;
  private final Object lower;
  private final Object upper;
  private final boolean not;

  public Condition(String property, Operator operator, Object value, Object lower, Object upper, boolean not) {
    this.property = Objects.requireNonNull(property, "property");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.value = value;
    this.lower = lower;
    this.upper = upper;
    this.not = not;
  }

  public String property() { return property; }
  public Operator operator() { return operator; }
  public Object value() { return value; }
  public Object lower() { return lower; }
  public Object upper() { return upper; }
  public boolean not() { return not; }

  public Condition negate() {
    return new Condition(property, operator, value, lower, upper, !not);
  }

  public static Condition of(String property, Operator operator, Object value) {
    return new Condition(property, operator, value, null, null, false);
  }

  public static Condition range(String property, Object lower, Object upper) {
    return new Condition(property, Operator.RANGE, null, lower, upper, false);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Condition c)) return false;
    return not == c.not && property.equals(c.property) && operator == c.operator
        && Objects.equals(value, c.value) && Objects.equals(lower, c.lower) && Objects.equals(upper, c.upper);
  }

  @Override
  public int hashCode() {
    return Objects.hash(property, operator, value, lower, upper, not);
  }

  @Override
  public String toString() {
    String body = (operator == Operator.RANGE) ? "[" + lower + ", " + upper + "]" : String.valueOf(value);
    return (not ? "NOT " : "") + property + " " + operator + " " + body;
  }
}
