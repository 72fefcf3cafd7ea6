package com.sqlframe.source;

import com.sqlframe.convert.NativeKind;
import com.sqlframe.convert.NativeValue;

import java.io.Reader;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.sql.Types;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.Locale;

/**
 * Reads JDBC column values into tagged {@link NativeValue}s.
 *
 * <p>Driver-specific objects (PostgreSQL {@code PGobject}, Oracle {@code TIMESTAMP}) are unwrapped here
 * so they never reach the conversion core.
 */
public final class JdbcValues {
    private static final int MAX_LOB_CHARS = 1_000_000;
    private static final int MAX_BLOB_BYTES = 1_000_000;

    private JdbcValues() {
    }

    /**
     * Suggested scan kind for a {@link java.sql.Types} code.
     */
    public static NativeKind scanKindFor(int sqlType) {
        switch (sqlType) {
            case Types.BIT:
            case Types.BOOLEAN:
                return NativeKind.BOOLEAN;
            case Types.TINYINT:
            case Types.SMALLINT:
            case Types.INTEGER:
            case Types.BIGINT:
                return NativeKind.INTEGER;
            case Types.REAL:
            case Types.FLOAT:
            case Types.DOUBLE:
            case Types.DECIMAL:
            case Types.NUMERIC:
                return NativeKind.FLOATING;
            case Types.CHAR:
            case Types.VARCHAR:
            case Types.LONGVARCHAR:
            case Types.NCHAR:
            case Types.NVARCHAR:
            case Types.LONGNVARCHAR:
            case Types.CLOB:
            case Types.NCLOB:
                return NativeKind.TEXT;
            case Types.DATE:
            case Types.TIME:
            case Types.TIMESTAMP:
            case Types.TIME_WITH_TIMEZONE:
            case Types.TIMESTAMP_WITH_TIMEZONE:
                return NativeKind.TEMPORAL;
            case Types.BINARY:
            case Types.VARBINARY:
            case Types.LONGVARBINARY:
            case Types.BLOB:
                return NativeKind.BYTES;
            default:
                return NativeKind.OTHER;
        }
    }

    /**
     * Reads one column of the current row.
     *
     * @param rs result set positioned on a row
     * @param columnIndex 1-based column index
     * @param kind requested scan kind
     * @param sqlType declared {@link java.sql.Types} code of the column
     * @param typeName declared database type name, may be null
     * @return tagged value, absent for SQL NULL
     */
    public static NativeValue read(ResultSet rs, int columnIndex, NativeKind kind, int sqlType, String typeName)
            throws SQLException {
        switch (kind) {
            case INTEGER: {
                long v = rs.getLong(columnIndex);
                return rs.wasNull() ? NativeValue.absent(kind) : NativeValue.present(kind, v);
            }
            case FLOATING: {
                double v = rs.getDouble(columnIndex);
                return rs.wasNull() ? NativeValue.absent(kind) : NativeValue.present(kind, v);
            }
            case BOOLEAN: {
                boolean v = rs.getBoolean(columnIndex);
                return rs.wasNull() ? NativeValue.absent(kind) : NativeValue.present(kind, v);
            }
            case TEXT: {
                Object v = rs.getObject(columnIndex);
                if (v == null) {
                    return NativeValue.absent(kind);
                }
                if (v instanceof Clob clob) {
                    return NativeValue.present(kind, readClob(clob));
                }
                String s = v instanceof String str ? str : rs.getString(columnIndex);
                return s == null ? NativeValue.absent(kind) : NativeValue.present(kind, s);
            }
            case BYTES: {
                Object v = rs.getObject(columnIndex);
                if (v == null) {
                    return NativeValue.absent(kind);
                }
                if (v instanceof Blob blob) {
                    return NativeValue.present(kind, readBlob(blob));
                }
                byte[] bytes = rs.getBytes(columnIndex);
                return bytes == null ? NativeValue.absent(kind) : NativeValue.present(kind, bytes);
            }
            case TEMPORAL: {
                Object v = readTemporal(rs, columnIndex, sqlType, typeName);
                return v == null ? NativeValue.absent(kind) : NativeValue.present(kind, v);
            }
            case OTHER:
            default:
                return NativeValue.of(toPlainObject(rs.getObject(columnIndex)));
        }
    }

    private static Object readTemporal(ResultSet rs, int columnIndex, int sqlType, String typeName)
            throws SQLException {
        if (isZonedTimestamp(sqlType, typeName)) {
            return rs.getObject(columnIndex, OffsetDateTime.class);
        }
        if (sqlType == Types.TIMESTAMP) {
            return rs.getObject(columnIndex, LocalDateTime.class);
        }
        return unwrapDriverSpecific(rs.getObject(columnIndex));
    }

    /**
     * PostgreSQL reports {@code timestamptz} as {@link Types#TIMESTAMP}, so the type name decides.
     */
    static boolean isZonedTimestamp(int sqlType, String typeName) {
        if (sqlType == Types.TIMESTAMP_WITH_TIMEZONE) {
            return true;
        }
        if (sqlType != Types.TIMESTAMP || typeName == null) {
            return false;
        }
        String t = typeName.toLowerCase(Locale.ROOT);
        return t.equals("timestamptz") || t.contains("with time zone");
    }

    private static Object toPlainObject(Object v) throws SQLException {
        if (v == null) {
            return null;
        }
        Object unwrapped = unwrapDriverSpecific(v);
        if (unwrapped != v) {
            return unwrapped;
        }
        if (v instanceof Clob clob) {
            return readClob(clob);
        }
        if (v instanceof Blob blob) {
            return readBlob(blob);
        }
        if (v instanceof SQLXML xml) {
            return xml.getString();
        }
        return v;
    }

    private static Object unwrapDriverSpecific(Object v) {
        if (v == null) {
            return null;
        }

        String className = v.getClass().getName();

        // PostgreSQL: JSON/JSONB/custom types may return org.postgresql.util.PGobject
        if ("org.postgresql.util.PGobject".equals(className)) {
            try {
                var m = v.getClass().getMethod("getValue");
                Object value = m.invoke(v);
                return value != null ? value : "";
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Cannot read PGobject value", e);
            }
        }

        // Oracle: oracle.sql.TIMESTAMP/TIMESTAMPTZ may not be a java.sql.Timestamp instance.
        if (className.startsWith("oracle.sql.TIMESTAMP")) {
            try {
                var m = v.getClass().getMethod("timestampValue");
                return m.invoke(v);
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Cannot read Oracle timestamp value", e);
            }
        }

        return v;
    }

    private static String readClob(Clob clob) throws SQLException {
        long length = clob.length();
        int toRead = (int) Math.min(length, MAX_LOB_CHARS);
        if (toRead <= 0) {
            return "";
        }
        try {
            return clob.getSubString(1, toRead);
        } catch (SQLException subStringFailure) {
            try (Reader reader = clob.getCharacterStream()) {
                if (reader == null) {
                    return "";
                }
                char[] buf = new char[Math.min(MAX_LOB_CHARS, 8192)];
                StringBuilder sb = new StringBuilder();
                int n;
                while (sb.length() < MAX_LOB_CHARS
                        && (n = reader.read(buf, 0, Math.min(buf.length, MAX_LOB_CHARS - sb.length()))) > 0) {
                    sb.append(buf, 0, n);
                }
                return sb.toString();
            } catch (java.io.IOException e) {
                throw new SQLException("Failed to read CLOB", e);
            }
        }
    }

    private static byte[] readBlob(Blob blob) throws SQLException {
        long length = blob.length();
        int toRead = (int) Math.min(length, MAX_BLOB_BYTES);
        if (toRead <= 0) {
            return new byte[0];
        }
        return blob.getBytes(1, toRead);
    }
}
