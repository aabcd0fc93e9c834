package io.intellixity.keyset.mongo.cursor;

import io.intellixity.keyset.cursor.CursorValueTypeRegistry;
import io.intellixity.keyset.cursor.JsonCursorCodec;
import io.intellixity.keyset.cursor.Position;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

final class MongoCursorValueTypeProviderTest {
  @Test
  void discoveredAlongsideCoreTypes() {
    CursorValueTypeRegistry r = new CursorValueTypeRegistry();
    assertEquals("objectId", r.forValue(new ObjectId()).id());
    assertEquals("decimal128", r.forValue(Decimal128.parse("1.5")).id());
    assertEquals("date", r.forValue(new Date()).id());
  }

  @Test
  void objectIdCursor_roundTrips() {
    JsonCursorCodec codec = new JsonCursorCodec();
    ObjectId id = new ObjectId("5e7b8c1d2f3a4b5c6d7e8f90");
    Position p = Position.builder()
        .add("createdAt", new Date(1583020800000L))
        .add("price", Decimal128.parse("19.99"))
        .add("_id", id)
        .build();

    Position back = codec.decode(codec.encode(p));
    assertEquals(p, back);
    assertEquals(ObjectId.class, back.value(2).getClass());
  }
}
