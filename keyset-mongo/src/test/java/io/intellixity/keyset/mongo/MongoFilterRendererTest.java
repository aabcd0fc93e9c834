package io.intellixity.keyset.mongo;

import com.mongodb.client.model.Filters;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.intellixity.keyset.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class MongoFilterRendererTest {
  @Test
  void nullFilter_isEmptyDocument() {
    assertTrue(MongoFilterRenderer.toBson(null).isEmpty());
  }

  @Test
  void comparisons() {
    assertEquals(new Document("a", 1), MongoFilterRenderer.toBson(eq("a", 1)));
    assertEquals(new Document("a", new Document("$gt", 1)), MongoFilterRenderer.toBson(gt("a", 1)));
    assertEquals(new Document("a", new Document("$lte", 1)), MongoFilterRenderer.toBson(le("a", 1)));
    assertEquals(new Document("a", new Document("$in", List.of(1, 2))), MongoFilterRenderer.toBson(in("a", List.of(1, 2))));
    assertEquals(new Document("a", new Document("$gte", 1).append("$lte", 5)), MongoFilterRenderer.toBson(range("a", 1, 5)));
    assertEquals(new Document("a", new Document("$exists", true)), MongoFilterRenderer.toBson(exists("a")));
  }

  @Test
  void nullEquality_matchesMissingOrNull() {
    assertEquals(new Document("deletedAt", null), MongoFilterRenderer.toBson(eq("deletedAt", null)));
    assertEquals(new Document("deletedAt", new Document("$ne", null)), MongoFilterRenderer.toBson(ne("deletedAt", null)));
  }

  @Test
  void seekPredicate_shape() {
    Document d = MongoFilterRenderer.toBson(or(
        gt("createdAt", 5L),
        and(eq("createdAt", 5L), gt("_id", "x"))));

    List<?> or = (List<?>) d.get("$or");
    assertEquals(2, or.size());
    assertEquals(new Document("createdAt", new Document("$gt", 5L)), or.get(0));
    assertEquals(new Document("$and", List.of(
        new Document("createdAt", 5L),
        new Document("_id", new Document("$gt", "x")))), or.get(1));
  }

  @Test
  void notGroup_appliesDeMorgan() {
    Document d = MongoFilterRenderer.toBson(not(and(eq("a", 1), eq("b", 2))));
    assertEquals(new Document("$or", List.of(
        new Document("$nor", List.of(new Document("a", 1))),
        new Document("$nor", List.of(new Document("b", 2))))), d);
  }

  @Test
  void like_becomesAnchoredRegex() {
    Document d = MongoFilterRenderer.toBson(like("name", "Jo%"));
    String re = ((Document) d.get("name")).getString("$regex");
    assertTrue("John".matches(re));
    assertFalse("AJohn".matches(re));
  }

  @Test
  void nativeFilters_areEmbedded() {
    Document fromBson = MongoFilterRenderer.toBson(and(
        nativeFilter(Filters.eq("status", "OPEN")),
        gt("_id", 3)));
    List<?> parts = (List<?>) fromBson.get("$and");
    assertEquals(2, parts.size());
    assertTrue(((Document) parts.get(0)).containsKey("status"));

    Document fromMap = MongoFilterRenderer.toBson(nativeFilter(Map.of("tenant", "t1")));
    assertEquals("t1", fromMap.get("tenant"));

    assertThrows(IllegalArgumentException.class, () -> MongoFilterRenderer.toBson(nativeFilter("status = 'OPEN'")));
  }

  @Test
  void comparisonWithNull_rejected() {
    assertThrows(IllegalArgumentException.class, () -> MongoFilterRenderer.toBson(gt("a", null)));
  }
}
