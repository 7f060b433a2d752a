package com.askdata.util;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Utility to convert dataset cells and computed values into JSON-safe primitives.
 *
 * <p>Used wherever dataset content leaves the process (result tables, sample rows, history) so
 * that NaN and infinite doubles never reach the JSON writer and oversized strings are cut.
 */
public final class JsonSafe {
    private static final int MAX_STRING_CHARS = 10_000;
    private static final int MAX_NESTED_DEPTH = 3;
    private static final String UNSUPPORTED_PLACEHOLDER = "[unsupported]";

    private JsonSafe() {
    }

    /**
     * Converts a value into a JSON-safe equivalent.
     *
     * @param v value to convert
     * @return json-safe value; non-finite numbers become {@code null}
     */
    public static Object toJsonSafe(Object v) {
        return sanitize(v, 0);
    }

    /**
     * Converts a double, mapping NaN and infinities to {@code null}.
     *
     * @param v number
     * @return boxed finite value or null
     */
    public static Double finiteOrNull(double v) {
        return Double.isFinite(v) ? v : null;
    }

    private static Object sanitize(Object v, int depth) {
        if (v == null) {
            return null;
        }
        if (depth > MAX_NESTED_DEPTH) {
            return UNSUPPORTED_PLACEHOLDER;
        }
        if (v instanceof Double d) {
            return finiteOrNull(d);
        }
        if (v instanceof Float f) {
            return Float.isFinite(f) ? f : null;
        }
        if (v instanceof Number || v instanceof Boolean) {
            return v;
        }
        if (v instanceof String s) {
            return truncateString(s);
        }
        if (v instanceof TemporalAccessor) {
            return v.toString();
        }
        if (v instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                out.put(String.valueOf(e.getKey()), sanitize(e.getValue(), depth + 1));
            }
            return out;
        }
        if (v instanceof Collection<?> items) {
            List<Object> out = new ArrayList<>(items.size());
            for (Object item : items) {
                out.add(sanitize(item, depth + 1));
            }
            return out;
        }
        return truncateString(String.valueOf(v));
    }

    private static String truncateString(String s) {
        if (s.length() <= MAX_STRING_CHARS) {
            return s;
        }
        return s.substring(0, MAX_STRING_CHARS);
    }
}
