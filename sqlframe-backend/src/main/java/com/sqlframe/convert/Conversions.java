package com.sqlframe.convert;

import com.sqlframe.frame.FieldType;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.Date;
import java.util.Locale;

/**
 * Null-free conversion functions from driver objects to frame field values.
 */
final class Conversions {

    private Conversions() {
    }

    static ValueConverter forFieldType(FieldType type) {
        switch (type) {
            case TIME:
                return Conversions::toInstant;
            case INT32:
                return v -> Math.toIntExact(toLong(v));
            case INT64:
                return Conversions::toLong;
            case FLOAT64:
                return Conversions::toDouble;
            case BOOL:
                return Conversions::toBoolean;
            case STRING:
            default:
                return Conversions::toText;
        }
    }

    static Instant toInstant(Object v) {
        if (v instanceof Instant i) {
            return i;
        }
        // a Timestamp already holds the instant; naive columns arrive as LocalDateTime
        if (v instanceof java.sql.Timestamp ts) {
            return ts.toInstant();
        }
        // java.sql.Date and java.sql.Time do not support toInstant()
        if (v instanceof java.sql.Date d) {
            return d.toLocalDate().atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (v instanceof java.sql.Time t) {
            return LocalDate.EPOCH.atTime(t.toLocalTime()).toInstant(ZoneOffset.UTC);
        }
        if (v instanceof Date d) {
            return d.toInstant();
        }
        if (v instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (v instanceof ZonedDateTime zdt) {
            return zdt.toInstant();
        }
        if (v instanceof LocalDateTime ldt) {
            return ldt.toInstant(ZoneOffset.UTC);
        }
        if (v instanceof LocalDate ld) {
            return ld.atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (v instanceof LocalTime lt) {
            return LocalDate.EPOCH.atTime(lt).toInstant(ZoneOffset.UTC);
        }
        if (v instanceof Number n) {
            return Instant.ofEpochMilli(n.longValue());
        }
        if (v instanceof CharSequence cs) {
            return parseInstant(cs.toString().trim());
        }
        throw new IllegalArgumentException("cannot convert " + v.getClass().getName() + " to time");
    }

    private static Instant parseInstant(String s) {
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException ignored) {
            // fall through to offset and local forms
        }
        try {
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        String iso = s.replace(' ', 'T');
        if (iso.length() == 10) {
            return LocalDate.parse(iso).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        return LocalDateTime.parse(iso).toInstant(ZoneOffset.UTC);
    }

    static Long toLong(Object v) {
        if (v instanceof Long l) {
            return l;
        }
        if (v instanceof BigDecimal bd) {
            return bd.longValueExact();
        }
        if (v instanceof Number n) {
            return n.longValue();
        }
        if (v instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        if (v instanceof CharSequence cs) {
            return Long.parseLong(cs.toString().trim());
        }
        throw new IllegalArgumentException("cannot convert " + v.getClass().getName() + " to int64");
    }

    static Double toDouble(Object v) {
        if (v instanceof Double d) {
            return d;
        }
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        if (v instanceof CharSequence cs) {
            return Double.parseDouble(cs.toString().trim());
        }
        throw new IllegalArgumentException("cannot convert " + v.getClass().getName() + " to float64");
    }

    static Boolean toBoolean(Object v) {
        if (v instanceof Boolean b) {
            return b;
        }
        if (v instanceof Number n) {
            return n.doubleValue() != 0;
        }
        if (v instanceof CharSequence cs) {
            switch (cs.toString().trim().toLowerCase(Locale.ROOT)) {
                case "true":
                case "t":
                case "1":
                    return Boolean.TRUE;
                case "false":
                case "f":
                case "0":
                    return Boolean.FALSE;
                default:
                    break;
            }
        }
        throw new IllegalArgumentException("cannot convert '" + v + "' to bool");
    }

    static String toText(Object v) {
        if (v instanceof String s) {
            return s;
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        return String.valueOf(v);
    }
}
