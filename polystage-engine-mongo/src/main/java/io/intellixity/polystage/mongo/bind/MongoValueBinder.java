package io.intellixity.polystage.mongo.bind;

import io.intellixity.polystage.schema.FieldType;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.UUID;

/**
 * Converts coerced placeholder values into BSON-native values.\n
 *
 * - OBJECT_ID: 24-hex String -> ObjectId\n
 * - UUID -> String (collections store UUIDs as text)\n
 * - Instant / LocalDate -> java.util.Date (UTC)\n
 * - DECIMAL: BigDecimal -> Decimal128\n
 */
public final class MongoValueBinder {
  private MongoValueBinder() {}

  public static Object toNative(Object value, FieldType targetType) {
    if (value == null) return null;
    if (targetType == FieldType.OBJECT_ID && value instanceof String s && ObjectId.isValid(s)) return new ObjectId(s);
    if (value instanceof UUID u) return u.toString();
    if (value instanceof Instant i) return Date.from(i);
    if (value instanceof LocalDate d) return Date.from(d.atStartOfDay(ZoneOffset.UTC).toInstant());
    if (value instanceof BigDecimal bd) {
      try {
        return new Decimal128(bd);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Decimal out of Decimal128 range: " + bd.toPlainString(), e);
      }
    }
    return value;
  }
}
