package io.intellixity.keyset.mongo.cursor;

import io.intellixity.keyset.cursor.CursorValueType;
import io.intellixity.keyset.cursor.CursorValueTypeProvider;
import io.intellixity.keyset.cursor.CursorValueTypes;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.util.Collection;
import java.util.List;

/** BSON value types that commonly appear in sort keys. */
public final class MongoCursorValueTypeProvider implements CursorValueTypeProvider {
  @Override
  public Collection<CursorValueType<?>> valueTypes() {
    return List.of(
        CursorValueTypes.text("objectId", ObjectId.class, ObjectId::toHexString, ObjectId::new),
        CursorValueTypes.text("decimal128", Decimal128.class, Decimal128::toString, Decimal128::parse)
    );
  }
}
