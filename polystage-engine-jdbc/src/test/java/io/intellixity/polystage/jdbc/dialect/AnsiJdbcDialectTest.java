package io.intellixity.polystage.jdbc.dialect;

import io.intellixity.polystage.schema.FieldType;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class AnsiJdbcDialectTest {
  private final AnsiJdbcDialect d = new AnsiJdbcDialect();

  @Test
  void classifiesTransientErrors() {
    assertTrue(d.isTransient(new SQLException("conn", "08006")));
    assertTrue(d.isTransient(new SQLException("serialization", "40001")));
    assertTrue(d.isTransient(new SQLTransientConnectionException("pool")));
    assertFalse(d.isTransient(new SQLException("syntax", "42601")));
    assertFalse(d.isTransient(new SQLException("no state")));

    SQLException chained = new SQLException("batch", "22000");
    chained.setNextException(new SQLException("conn", "08003"));
    assertTrue(d.isTransient(chained));
  }

  @Test
  void instantsBindAsUtcOffsetDateTime() {
    Instant i = Instant.parse("2024-05-06T07:08:09Z");
    assertEquals(OffsetDateTime.of(2024, 5, 6, 7, 8, 9, 0, ZoneOffset.UTC), d.toNative(i, FieldType.TIMESTAMP));
    assertEquals("x", d.toNative("x", FieldType.STRING));
  }

  @Test
  void driverValuesBecomePlainJava() throws SQLException {
    Instant i = Instant.parse("2024-05-06T07:08:09Z");
    assertEquals(i, d.fromDriver(Timestamp.from(i)));
    assertEquals(LocalDate.of(2024, 5, 6), d.fromDriver(java.sql.Date.valueOf("2024-05-06")));
    assertEquals(List.of(1, 2), d.fromDriver(new Integer[] {1, 2}));
    assertNull(d.fromDriver(null));
  }
}
