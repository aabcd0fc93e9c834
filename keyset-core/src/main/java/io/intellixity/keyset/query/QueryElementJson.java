package io.intellixity.keyset.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.util.*;

/**
 * Canonical JSON form of a filter tree.\n
 *
 * <pre>
 * {"and": [ {"eq": {"field": "status", "value": "OPEN"}}, {"not": {"in": {"field": "tag", "values": ["x"]}}} ]}
 * </pre>
 *
 * Groups are {@code and}/{@code or} arrays, negation is {@code not}, conditions are keyed by lower-case operator
 * name. {@code range} carries {@code lower}/{@code upper}, {@code in}/{@code nin} carry {@code values}.\n
 */
public final class QueryElementJson {
  private QueryElementJson() {}

  public static void write(QueryElement el, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (el == null) {
      g.writeNull();
      return;
    }

    if (el instanceof LogicalGroup lg) {
      g.writeStartObject();
      g.writeArrayFieldStart(lg.clause() == Clause.OR ? "or" : "and");
      for (QueryElement child : lg.elements()) {
        write(child, g, serializers);
      }
      g.writeEndArray();
      g.writeEndObject();
      return;
    }

    if (el instanceof NotElement n) {
      g.writeStartObject();
      g.writeFieldName("not");
      write(n.element(), g, serializers);
      g.writeEndObject();
      return;
    }

    if (el instanceof Condition c) {
      g.writeStartObject();
      g.writeObjectFieldStart(c.operator().name().toLowerCase(Locale.ROOT));
      g.writeStringField("field", c.property());
      if (c.not()) g.writeBooleanField("not", true);
      if (c.operator() == Operator.RANGE) {
        g.writeFieldName("lower");
        serializers.defaultSerializeValue(c.lower(), g);
        g.writeFieldName("upper");
        serializers.defaultSerializeValue(c.upper(), g);
      } else if (c.operator() == Operator.IN || c.operator() == Operator.NIN) {
        g.writeFieldName("values");
        serializers.defaultSerializeValue(c.value(), g);
      } else {
        g.writeFieldName("value");
        serializers.defaultSerializeValue(c.value(), g);
      }
      g.writeEndObject();
      g.writeEndObject();
      return;
    }

    if (el instanceof NativeFilter) {
      throw new IllegalArgumentException("Store-native filters have no JSON form");
    }
    throw new IllegalArgumentException("Unsupported QueryElement: " + el.getClass().getName());
  }

  public static QueryElement read(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || n.isNull()) return null;
    if (!n.isObject()) throw new IllegalArgumentException("Filter element must be an object: " + n);

    if (n.has("and")) return new LogicalGroup(Clause.AND, readChildren(n.get("and"), codec));
    if (n.has("or")) return new LogicalGroup(Clause.OR, readChildren(n.get("or"), codec));

    if (n.has("not")) {
      QueryElement child = read(n.get("not"), codec);
      return (child == null) ? null : new NotElement(child);
    }

    Iterator<String> it = n.fieldNames();
    while (it.hasNext()) {
      String k = it.next();
      Operator op = tryOp(k);
      if (op == null) continue;
      JsonNode body = n.get(k);
      if (body == null || !body.isObject()) throw new IllegalArgumentException(k + " must be an object");
      return readCondition(op, body, codec);
    }

    throw new IllegalArgumentException("Unsupported filter element: " + n);
  }

  private static List<QueryElement> readChildren(JsonNode arr, ObjectCodec codec) throws IOException {
    if (arr == null || !arr.isArray()) throw new IllegalArgumentException("and/or expects an array");
    List<QueryElement> out = new ArrayList<>();
    for (JsonNode x : arr) {
      QueryElement e = read(x, codec);
      if (e != null) out.add(e);
    }
    return out;
  }

  private static Condition readCondition(Operator op, JsonNode body, ObjectCodec codec) throws IOException {
    JsonNode f = body.get("field");
    if (f == null || !f.isTextual() || f.asText().isBlank()) throw new IllegalArgumentException(op + " requires field");
    String field = f.asText();
    JsonNode notNode = body.get("not");
    boolean not = notNode != null && notNode.asBoolean(false);

    if (op == Operator.RANGE) {
      return new Condition(field, op, null, value(body.get("lower"), codec), value(body.get("upper"), codec), not);
    }
    if (op == Operator.IN || op == Operator.NIN) {
      JsonNode values = body.get("values");
      if (values == null || !values.isArray()) throw new IllegalArgumentException(op + " requires a values array");
      return new Condition(field, op, value(values, codec), null, null, not);
    }
    if (op == Operator.EXISTS && !body.has("value")) {
      return new Condition(field, op, Boolean.TRUE, null, null, not);
    }
    return new Condition(field, op, value(body.get("value"), codec), null, null, not);
  }

  private static Object value(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return null;
    return codec.treeToValue(v, Object.class);
  }

  private static Operator tryOp(String key) {
    if (key == null) return null;
    for (Operator op : Operator.values()) {
      if (op.name().equalsIgnoreCase(key)) return op;
    }
    return null;
  }
}
