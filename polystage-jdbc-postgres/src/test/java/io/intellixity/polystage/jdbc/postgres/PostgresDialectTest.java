package io.intellixity.polystage.jdbc.postgres;

import io.intellixity.polystage.jdbc.JdbcBackendAdapter;
import io.intellixity.polystage.jdbc.JdbcBackendAdapterFactory;
import io.intellixity.polystage.jdbc.JdbcHandle;
import io.intellixity.polystage.schema.FieldType;
import org.junit.jupiter.api.Test;
import org.postgresql.ds.PGSimpleDataSource;
import org.postgresql.util.PGobject;

import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresDialectTest {
  private final PostgresDialect d = new PostgresDialect();

  @Test
  void postgresTransientStates() {
    for (String state : List.of("08006", "40001", "40P01", "57P01", "57P02", "57P03", "53300")) {
      assertTrue(d.isTransient(new SQLException("x", state)), state);
    }
    assertFalse(d.isTransient(new SQLException("syntax", "42601")));
    assertFalse(d.isTransient(new SQLException("unique", "23505")));
  }

  @Test
  void jsonBindsAsJsonb() {
    Object v = d.toNative(Map.of("a", 1), FieldType.JSON);
    PGobject pg = assertInstanceOf(PGobject.class, v);
    assertEquals("jsonb", pg.getType());
    assertEquals("{\"a\":1}", pg.getValue());
  }

  @Test
  void nonJsonValuesUseDefaults() {
    assertInstanceOf(OffsetDateTime.class, d.toNative(Instant.EPOCH, FieldType.TIMESTAMP));
    assertEquals(7L, d.toNative(7L, FieldType.INTEGER));
  }

  @Test
  void jsonColumnsDecode() throws SQLException {
    PGobject pg = new PGobject();
    pg.setType("json");
    pg.setValue("{\"tags\": [\"a\", \"b\"]}");
    assertEquals(Map.of("tags", List.of("a", "b")), d.fromDriver(pg));

    PGobject interval = new PGobject();
    interval.setType("interval");
    interval.setValue("1 day");
    assertEquals("1 day", d.fromDriver(interval));
  }

  @Test
  void discoveredByJdbcFactory() {
    JdbcBackendAdapterFactory f = new JdbcBackendAdapterFactory();
    JdbcBackendAdapter a = (JdbcBackendAdapter) f.create(
        new JdbcHandle("pg", new PGSimpleDataSource(), "public", "postgres"));
    assertEquals("postgres", a.dialect().id());
  }
}
