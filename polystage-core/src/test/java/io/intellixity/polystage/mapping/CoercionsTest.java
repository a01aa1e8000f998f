package io.intellixity.polystage.mapping;

import io.intellixity.polystage.error.CoercionException;
import io.intellixity.polystage.schema.FieldType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class CoercionsTest {

  @Test
  void integerAcceptsLosslessSources() {
    assertEquals(42L, Coercions.coerce(42, FieldType.INTEGER));
    assertEquals(42L, Coercions.coerce("42", FieldType.INTEGER));
    assertEquals(42L, Coercions.coerce(42.0d, FieldType.INTEGER));
    assertEquals(42L, Coercions.coerce(new BigDecimal("42.000"), FieldType.INTEGER));
  }

  @Test
  void integerRejectsLossyOrGarbage() {
    assertThrows(CoercionException.class, () -> Coercions.coerce(42.5d, FieldType.INTEGER));
    assertThrows(CoercionException.class, () -> Coercions.coerce("forty-two", FieldType.INTEGER));
    assertThrows(CoercionException.class, () -> Coercions.coerce(true, FieldType.INTEGER));
  }

  @Test
  void stringFromScalars() {
    assertEquals("7", Coercions.coerce(7L, FieldType.STRING));
    assertEquals("1.50", Coercions.coerce(new BigDecimal("1.50"), FieldType.STRING));
    assertThrows(CoercionException.class, () -> Coercions.coerce(Map.of("a", 1), FieldType.STRING));
  }

  @Test
  void floatAndDecimal() {
    assertEquals(1.5d, Coercions.coerce("1.5", FieldType.FLOAT));
    assertEquals(3.0d, Coercions.coerce(3, FieldType.FLOAT));
    assertEquals(new BigDecimal("2.25"), Coercions.coerce("2.25", FieldType.DECIMAL));
    assertEquals(BigDecimal.valueOf(5L), Coercions.coerce(5, FieldType.DECIMAL));
  }

  @Test
  void floatRejectsValuesADoubleCannotHold() {
    assertEquals(0.1d, Coercions.coerce("0.1", FieldType.FLOAT));
    assertEquals(2.5d, Coercions.coerce(new BigDecimal("2.50"), FieldType.FLOAT));
    assertEquals(1.0e6d, Coercions.coerce(BigInteger.valueOf(1_000_000L), FieldType.FLOAT));
    assertThrows(CoercionException.class,
        () -> Coercions.coerce(new BigDecimal("12345678901234567890.123"), FieldType.FLOAT));
    assertThrows(CoercionException.class, () -> Coercions.coerce("12345678901234567891", FieldType.FLOAT));
    assertThrows(CoercionException.class, () -> Coercions.coerce("NaN", FieldType.FLOAT));
    assertThrows(CoercionException.class, () -> Coercions.coerce(Long.MAX_VALUE - 1, FieldType.FLOAT));
  }

  @Test
  void booleanIsStrict() {
    assertEquals(Boolean.TRUE, Coercions.coerce("TRUE", FieldType.BOOLEAN));
    assertEquals(Boolean.FALSE, Coercions.coerce(0, FieldType.BOOLEAN));
    assertThrows(CoercionException.class, () -> Coercions.coerce("yes", FieldType.BOOLEAN));
    assertThrows(CoercionException.class, () -> Coercions.coerce(2, FieldType.BOOLEAN));
  }

  @Test
  void temporalValues() {
    Instant i = Instant.parse("2024-01-02T03:04:05Z");
    assertEquals(i, Coercions.coerce("2024-01-02T03:04:05Z", FieldType.TIMESTAMP));
    assertEquals(i, Coercions.coerce("2024-01-02T05:04:05+02:00", FieldType.TIMESTAMP));
    assertEquals(LocalDate.of(2024, 1, 2), Coercions.coerce("2024-01-02", FieldType.DATE));
    assertEquals(LocalDate.of(2024, 1, 2), Coercions.coerce(Instant.parse("2024-01-02T00:00:00Z"), FieldType.DATE));
    assertThrows(CoercionException.class, () -> Coercions.coerce(i, FieldType.DATE));
    assertThrows(CoercionException.class, () -> Coercions.coerce("yesterday", FieldType.TIMESTAMP));
  }

  @Test
  void timestampRejectsBareNumbers() {
    assertThrows(CoercionException.class, () -> Coercions.coerce(2019, FieldType.TIMESTAMP));
    assertThrows(CoercionException.class, () -> Coercions.coerce(1_700_000_000_000L, FieldType.TIMESTAMP));
  }

  @Test
  void uuidAndObjectId() {
    UUID u = UUID.randomUUID();
    assertEquals(u, Coercions.coerce(u.toString(), FieldType.UUID));
    assertEquals("65a1f0c2e4b0a1b2c3d4e5f6", Coercions.coerce("65A1F0C2E4B0A1B2C3D4E5F6", FieldType.OBJECT_ID));
    assertThrows(CoercionException.class, () -> Coercions.coerce("not-an-id", FieldType.OBJECT_ID));
  }

  @Test
  void passThroughAndNull() {
    Map<String, Object> doc = Map.of("k", 1);
    assertSame(doc, Coercions.coerce(doc, FieldType.JSON));
    assertSame(doc, Coercions.coerce(doc, FieldType.ANY));
    assertNull(Coercions.coerce(null, FieldType.INTEGER));
  }

  @Test
  void collectionsCoerceElementWise() {
    assertEquals(List.of(1L, 2L), Coercions.coerceAll(List.of("1", 2), FieldType.INTEGER));
    assertThrows(CoercionException.class, () -> Coercions.coerceAll(List.of("1", "x"), FieldType.INTEGER));
  }
}
