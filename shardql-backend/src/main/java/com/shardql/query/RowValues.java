package com.shardql.query;

import java.sql.Array;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.sql.Struct;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.UUID;

/**
 * Converts JDBC column values into values Jackson can write without driver classes on the
 * serialization path.
 */
public final class RowValues {
    static final int MAX_STRING_CHARS = 100_000;
    static final int MAX_LOB_BYTES = 100_000;
    static final int MAX_NESTED_DEPTH = 3;
    static final String UNSUPPORTED = "[unsupported]";

    private RowValues() {
    }

    /**
     * Reads column {@code columnIndex} (1-based) of the current row.
     */
    public static Object read(ResultSet rs, int columnIndex) {
        try {
            return convert(rs.getObject(columnIndex), 0);
        } catch (SQLException | RuntimeException e) {
            return UNSUPPORTED;
        }
    }

    static Object convert(Object v, int depth) throws SQLException {
        if (v == null) {
            return null;
        }
        if (depth > MAX_NESTED_DEPTH) {
            return UNSUPPORTED;
        }
        if (v instanceof Number || v instanceof Boolean) {
            return v;
        }
        if (v instanceof String s) {
            return truncate(s);
        }
        if (v instanceof java.util.Date || v instanceof TemporalAccessor || v instanceof UUID) {
            return v.toString();
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof Clob clob) {
            long length = clob.length();
            return length <= 0 ? "" : clob.getSubString(1, (int) Math.min(length, MAX_STRING_CHARS));
        }
        if (v instanceof Blob blob) {
            long length = blob.length();
            return length <= 0 ? "" : Base64.getEncoder().encodeToString(blob.getBytes(1, (int) Math.min(length, MAX_LOB_BYTES)));
        }
        if (v instanceof SQLXML xml) {
            return truncate(xml.getString());
        }
        if (v instanceof Array array) {
            return convertArray(array.getArray(), depth);
        }
        if (v instanceof Struct struct) {
            return convertArray(struct.getAttributes(), depth);
        }
        // PGobject (json/jsonb) and other driver wrappers render their value through toString
        return truncate(String.valueOf(v));
    }

    private static Object convertArray(Object arrayValue, int depth) throws SQLException {
        if (!(arrayValue instanceof Object[] elements)) {
            return truncate(String.valueOf(arrayValue));
        }
        List<Object> out = new ArrayList<>(elements.length);
        for (Object element : elements) {
            out.add(convert(element, depth + 1));
        }
        return out;
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_STRING_CHARS) {
            return s;
        }
        return s.substring(0, MAX_STRING_CHARS);
    }
}
