package io.intellixity.polystage.mapping;

import io.intellixity.polystage.error.CoercionException;
import io.intellixity.polystage.schema.FieldType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Lossless value coercion to a {@link FieldType}.\n
 *
 * Canonical results: INTEGER -> Long, FLOAT -> Double, DECIMAL -> BigDecimal, STRING -> String,
 * BOOLEAN -> Boolean, TIMESTAMP -> Instant, DATE -> LocalDate, UUID -> UUID, OBJECT_ID -> 24-hex String.
 * JSON and ANY pass values through. null stays null.\n
 */
public final class Coercions {
  private static final Pattern OBJECT_ID = Pattern.compile("[0-9a-fA-F]{24}");
  private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
  private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

  private Coercions() {}

  public static Object coerce(Object value, FieldType type) {
    if (value == null || type == FieldType.ANY) return value;
    return switch (type) {
      case INTEGER -> toLong(value);
      case FLOAT -> toDouble(value);
      case DECIMAL -> toDecimal(value);
      case STRING -> toText(value);
      case BOOLEAN -> toBoolean(value);
      case TIMESTAMP -> toInstant(value);
      case DATE -> toDate(value);
      case UUID -> toUuid(value);
      case OBJECT_ID -> toObjectId(value);
      case JSON, ANY -> value;
    };
  }

  /** Element-wise coercion; any element failing fails the whole collection. */
  public static List<Object> coerceAll(Collection<?> values, FieldType type) {
    List<Object> out = new ArrayList<>(values.size());
    for (Object v : values) out.add(coerce(v, type));
    return out;
  }

  static Long toLong(Object v) {
    if (v instanceof Long l) return l;
    if (v instanceof Integer || v instanceof Short || v instanceof Byte) return ((Number) v).longValue();
    try {
      if (v instanceof BigInteger bi) return bi.longValueExact();
      if (v instanceof BigDecimal bd) return bd.longValueExact();
      if (v instanceof Double || v instanceof Float) {
        double d = ((Number) v).doubleValue();
        BigDecimal bd = BigDecimal.valueOf(d);
        if (Double.isFinite(d) && bd.compareTo(LONG_MIN) >= 0 && bd.compareTo(LONG_MAX) <= 0) {
          return bd.longValueExact();
        }
      }
      if (v instanceof CharSequence cs) return new BigDecimal(cs.toString().trim()).longValueExact();
    } catch (ArithmeticException | NumberFormatException e) {
      throw mismatch(v, FieldType.INTEGER, e);
    }
    throw mismatch(v, FieldType.INTEGER, null);
  }

  static Double toDouble(Object v) {
    if (v instanceof Double d) return d;
    if (v instanceof Float || v instanceof Integer || v instanceof Short || v instanceof Byte) {
      return ((Number) v).doubleValue();
    }
    if (v instanceof Long l) {
      if ((long) (double) l == l) return (double) l;
      throw mismatch(v, FieldType.FLOAT, null);
    }
    if (v instanceof BigDecimal bd) return exactDouble(v, bd);
    if (v instanceof BigInteger bi) return exactDouble(v, new BigDecimal(bi));
    if (v instanceof CharSequence cs) {
      try {
        return exactDouble(v, new BigDecimal(cs.toString().trim()));
      } catch (NumberFormatException e) {
        throw mismatch(v, FieldType.FLOAT, e);
      }
    }
    throw mismatch(v, FieldType.FLOAT, null);
  }

  /** Accepts the double only when its shortest decimal form equals the source value. */
  private static Double exactDouble(Object source, BigDecimal exact) {
    double d = exact.doubleValue();
    if (Double.isFinite(d) && BigDecimal.valueOf(d).compareTo(exact) == 0) return d;
    throw mismatch(source, FieldType.FLOAT, null);
  }

  static BigDecimal toDecimal(Object v) {
    if (v instanceof BigDecimal bd) return bd;
    if (v instanceof BigInteger bi) return new BigDecimal(bi);
    if (v instanceof Double || v instanceof Float) {
      double d = ((Number) v).doubleValue();
      if (!Double.isFinite(d)) throw mismatch(v, FieldType.DECIMAL, null);
      return BigDecimal.valueOf(d);
    }
    if (v instanceof Number n) return BigDecimal.valueOf(n.longValue());
    if (v instanceof CharSequence cs) {
      try {
        return new BigDecimal(cs.toString().trim());
      } catch (NumberFormatException e) {
        throw mismatch(v, FieldType.DECIMAL, e);
      }
    }
    throw mismatch(v, FieldType.DECIMAL, null);
  }

  static String toText(Object v) {
    if (v instanceof CharSequence cs) return cs.toString();
    if (v instanceof BigDecimal bd) return bd.toPlainString();
    if (v instanceof Number || v instanceof Boolean || v instanceof UUID || v instanceof Character) return String.valueOf(v);
    if (v instanceof Instant || v instanceof LocalDate || v instanceof LocalDateTime
        || v instanceof OffsetDateTime || v instanceof ZonedDateTime) {
      return v.toString();
    }
    throw mismatch(v, FieldType.STRING, null);
  }

  static Boolean toBoolean(Object v) {
    if (v instanceof Boolean b) return b;
    if (v instanceof CharSequence cs) {
      String s = cs.toString().trim().toLowerCase(Locale.ROOT);
      if (s.equals("true")) return Boolean.TRUE;
      if (s.equals("false")) return Boolean.FALSE;
    }
    if (v instanceof Number n && (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte)) {
      if (n.longValue() == 0) return Boolean.FALSE;
      if (n.longValue() == 1) return Boolean.TRUE;
    }
    throw mismatch(v, FieldType.BOOLEAN, null);
  }

  static Instant toInstant(Object v) {
    if (v instanceof Instant i) return i;
    if (v instanceof java.util.Date d) return d.toInstant();
    if (v instanceof OffsetDateTime o) return o.toInstant();
    if (v instanceof ZonedDateTime z) return z.toInstant();
    if (v instanceof LocalDateTime l) return l.toInstant(ZoneOffset.UTC);
    if (v instanceof LocalDate d) return d.atStartOfDay(ZoneOffset.UTC).toInstant();
    if (v instanceof CharSequence cs) {
      String s = cs.toString().trim();
      try {
        return Instant.parse(s);
      } catch (DateTimeParseException ignored) {
        // try the wider ISO forms below
      }
      try {
        return OffsetDateTime.parse(s).toInstant();
      } catch (DateTimeParseException ignored) {
        // no offset
      }
      try {
        return LocalDateTime.parse(s).toInstant(ZoneOffset.UTC);
      } catch (DateTimeParseException ignored) {
        // date only
      }
      try {
        return LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant();
      } catch (DateTimeParseException e) {
        throw mismatch(v, FieldType.TIMESTAMP, e);
      }
    }
    throw mismatch(v, FieldType.TIMESTAMP, null);
  }

  static LocalDate toDate(Object v) {
    if (v instanceof LocalDate d) return d;
    if (v instanceof LocalDateTime l && l.toLocalTime().toSecondOfDay() == 0 && l.getNano() == 0) return l.toLocalDate();
    if (v instanceof Instant i) {
      LocalDateTime l = LocalDateTime.ofInstant(i, ZoneOffset.UTC);
      if (l.toLocalTime().toNanoOfDay() == 0) return l.toLocalDate();
    }
    if (v instanceof CharSequence cs) {
      try {
        return LocalDate.parse(cs.toString().trim());
      } catch (DateTimeParseException e) {
        throw mismatch(v, FieldType.DATE, e);
      }
    }
    throw mismatch(v, FieldType.DATE, null);
  }

  static UUID toUuid(Object v) {
    if (v instanceof UUID u) return u;
    if (v instanceof CharSequence cs) {
      try {
        return UUID.fromString(cs.toString().trim());
      } catch (IllegalArgumentException e) {
        throw mismatch(v, FieldType.UUID, e);
      }
    }
    throw mismatch(v, FieldType.UUID, null);
  }

  static String toObjectId(Object v) {
    if (v instanceof Map<?, ?> || v instanceof Collection<?>) throw mismatch(v, FieldType.OBJECT_ID, null);
    String s = String.valueOf(v).trim();
    if (OBJECT_ID.matcher(s).matches()) return s.toLowerCase(Locale.ROOT);
    throw mismatch(v, FieldType.OBJECT_ID, null);
  }

  private static CoercionException mismatch(Object v, FieldType target, Throwable cause) {
    String shown = (v instanceof CharSequence cs && cs.length() > 64) ? cs.subSequence(0, 64) + "..." : String.valueOf(v);
    return new CoercionException("Cannot coerce " + v.getClass().getSimpleName() + " '" + shown + "' to " + target, cause);
  }
}
