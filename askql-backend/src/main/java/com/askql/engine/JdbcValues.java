package com.askql.engine;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.sql.Struct;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Converts JDBC driver values into JSON-safe values and estimates their size for the byte budget.
 */
final class JdbcValues {
    private static final int MAX_LOB_CHARS = 100_000;
    private static final int MAX_BLOB_BYTES = 100_000;
    private static final int MAX_STRING_CHARS = 100_000;
    private static final int MAX_NESTED_DEPTH = 3;
    private static final String UNSUPPORTED_PLACEHOLDER = "[unsupported]";

    private JdbcValues() {
    }

    /**
     * Reads a column value as a JSON-safe value.
     *
     * @param rs result set positioned on a row
     * @param columnIndex 1-based column index
     * @return json-safe value, or a placeholder when the driver value cannot be converted
     */
    static Object read(ResultSet rs, int columnIndex) {
        try {
            return toJsonSafe(rs.getObject(columnIndex), 0);
        } catch (Exception e) {
            return UNSUPPORTED_PLACEHOLDER;
        }
    }

    /**
     * Approximate number of bytes a converted value occupies.
     *
     * @param value json-safe value
     * @return estimated size in bytes
     */
    static long estimateBytes(Object value) {
        if (value == null) {
            return 1;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return 8;
        }
        if (value instanceof List<?> list) {
            long total = 0;
            for (Object item : list) {
                total += estimateBytes(item);
            }
            return total;
        }
        return String.valueOf(value).getBytes(StandardCharsets.UTF_8).length;
    }

    private static Object toJsonSafe(Object v, int depth) throws SQLException {
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
            return truncate(s);
        }
        if (v instanceof Clob clob) {
            return readClob(clob);
        }
        if (v instanceof Blob blob) {
            long length = blob.length();
            int toRead = (int) Math.min(length, MAX_BLOB_BYTES);
            return toRead <= 0 ? "" : Base64.getEncoder().encodeToString(blob.getBytes(1, toRead));
        }
        if (v instanceof SQLXML xml) {
            return truncate(xml.getString());
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof Struct struct) {
            Object[] attrs = struct.getAttributes();
            List<Object> out = new ArrayList<>();
            for (Object attr : attrs != null ? attrs : new Object[0]) {
                out.add(toJsonSafe(attr, depth + 1));
            }
            return out;
        }
        if (v instanceof java.sql.Array arr) {
            Object arrayValue = arr.getArray();
            if (arrayValue instanceof Object[] objectArray) {
                List<Object> out = new ArrayList<>(objectArray.length);
                for (Object elem : objectArray) {
                    out.add(toJsonSafe(elem, depth + 1));
                }
                return out;
            }
            return truncate(String.valueOf(arrayValue));
        }
        if (v instanceof Object[] objectArray) {
            List<Object> out = new ArrayList<>(objectArray.length);
            for (Object elem : objectArray) {
                out.add(toJsonSafe(elem, depth + 1));
            }
            return out;
        }
        // dates, times, UUIDs and driver-specific types
        return truncate(String.valueOf(v));
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_STRING_CHARS) {
            return s;
        }
        return s.substring(0, MAX_STRING_CHARS);
    }

    private static String readClob(Clob clob) throws SQLException {
        long length = clob.length();
        int toRead = (int) Math.min(length, MAX_LOB_CHARS);
        if (toRead <= 0) {
            return "";
        }
        try {
            return clob.getSubString(1, toRead);
        } catch (SQLException e) {
            try (Reader reader = clob.getCharacterStream()) {
                if (reader == null) {
                    return "";
                }
                char[] buf = new char[Math.min(MAX_LOB_CHARS, 8192)];
                StringBuilder sb = new StringBuilder();
                int n;
                while (sb.length() < MAX_LOB_CHARS && (n = reader.read(buf, 0, Math.min(buf.length, MAX_LOB_CHARS - sb.length()))) > 0) {
                    sb.append(buf, 0, n);
                }
                return sb.toString();
            } catch (Exception readError) {
                return UNSUPPORTED_PLACEHOLDER;
            }
        }
    }
}
