package com.dbexplorer.util;

import java.io.Reader;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;

/**
 * Converts JDBC column values into transport-safe cells.
 *
 * <p>Cells handed to the chat transport are limited to numbers, booleans, strings and lists of
 * those, so driver-specific objects never leak past the pool.
 */
public final class JdbcCells {
    private static final int MAX_LOB_CHARS = 10_000;
    private static final int MAX_BLOB_BYTES = 1_024;
    private static final int MAX_STRING_CHARS = 10_000;
    private static final int MAX_NESTED_DEPTH = 2;
    private static final String UNSUPPORTED_PLACEHOLDER = "[unsupported]";
    private static final HexFormat HEX = HexFormat.of();

    private JdbcCells() {
    }

    /**
     * Read one column of the current row.
     *
     * @param rs result set positioned on a row
     * @param columnIndex 1-based column index
     * @return converted cell, null for SQL NULL
     */
    public static Object read(ResultSet rs, int columnIndex) {
        try {
            return toCell(rs.getObject(columnIndex), 0);
        } catch (SQLException | RuntimeException e) {
            return UNSUPPORTED_PLACEHOLDER;
        }
    }

    private static Object toCell(Object v, int depth) throws SQLException {
        if (v == null) {
            return null;
        }
        if (depth > MAX_NESTED_DEPTH) {
            return UNSUPPORTED_PLACEHOLDER;
        }
        if (v instanceof Number || v instanceof Boolean) {
            return v;
        }
        if (v instanceof String s) {
            return truncate(s, MAX_STRING_CHARS);
        }
        if (v instanceof java.sql.Date || v instanceof java.sql.Time || v instanceof java.sql.Timestamp
                || v instanceof TemporalAccessor || v instanceof UUID) {
            return v.toString();
        }
        if (v instanceof Clob clob) {
            return readClob(clob);
        }
        if (v instanceof Blob blob) {
            long length = blob.length();
            int toRead = (int) Math.min(length, MAX_BLOB_BYTES);
            return "0x" + HEX.formatHex(blob.getBytes(1, toRead)) + (length > toRead ? "..." : "");
        }
        if (v instanceof byte[] bytes) {
            int toRead = Math.min(bytes.length, MAX_BLOB_BYTES);
            return "0x" + HEX.formatHex(bytes, 0, toRead) + (bytes.length > toRead ? "..." : "");
        }
        if (v instanceof SQLXML xml) {
            return truncate(xml.getString(), MAX_STRING_CHARS);
        }
        if (v instanceof java.sql.Array arr) {
            Object arrayValue = arr.getArray();
            if (arrayValue instanceof Object[] objectArray) {
                List<Object> out = new ArrayList<>(objectArray.length);
                for (Object elem : objectArray) {
                    out.add(toCell(elem, depth + 1));
                }
                return out;
            }
            return truncate(String.valueOf(arrayValue), MAX_STRING_CHARS);
        }
        // PGobject (json, interval, ...) and friends render through toString
        return truncate(String.valueOf(v), MAX_STRING_CHARS);
    }

    private static String readClob(Clob clob) throws SQLException {
        StringBuilder sb = new StringBuilder();
        char[] buf = new char[2048];
        try (Reader reader = clob.getCharacterStream()) {
            int n;
            while ((n = reader.read(buf)) != -1) {
                int remaining = MAX_LOB_CHARS - sb.length();
                if (remaining <= 0) {
                    sb.append("...");
                    break;
                }
                sb.append(buf, 0, Math.min(n, remaining));
            }
        } catch (java.io.IOException e) {
            throw new SQLException("Failed to read CLOB", e);
        }
        return sb.toString();
    }

    private static String truncate(String s, int max) {
        if (s == null || s.length() <= max) {
            return s;
        }
        return s.substring(0, max) + "...";
    }
}
