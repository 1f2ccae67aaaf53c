package com.bot.persistence;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizes a data tree to the value types a {@link PersistenceEngine} reads back, so that a
 * saved tree compares equal to the tree loaded from the same file.
 * <p>
 * Supported values: {@code null}, {@link String}, {@link Boolean}, integral numbers, finite
 * floating-point numbers, lists (also any collection or array) and string-keyed maps.
 * Integral numbers come back as {@link Integer} when they fit, else {@link Long}, else
 * {@link BigInteger}. Floating-point numbers come back as {@link Double}; a {@link Float} is
 * widened through its decimal form so {@code 0.1f} becomes {@code 0.1}. Characters and other
 * char sequences become strings. Anything else is rejected.
 */
public final class DataTree {

    private DataTree() {
    }

    /**
     * Returns a normalized deep copy of {@code data} as an insertion-ordered map.
     *
     * @throws IllegalArgumentException if a value has an unsupported type or is not finite
     */
    public static Map<String, Object> copyOf(Map<String, ?> data) {
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>();
        if (data == null) return copy;
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            copy.put(entry.getKey(), normalize(entry.getValue(), entry.getKey()));
        }
        return copy;
    }

    private static Object normalize(Object value, String path) {
        if (value == null || value instanceof String || value instanceof Boolean || value instanceof Integer) {
            return value;
        }
        if (value instanceof Long l) {
            return l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE ? Integer.valueOf(l.intValue()) : l;
        }
        if (value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof BigInteger big) {
            if (big.bitLength() < Integer.SIZE) return big.intValue();
            if (big.bitLength() < Long.SIZE) return big.longValue();
            return big;
        }
        if (value instanceof Double d) {
            return finite(d, path);
        }
        if (value instanceof Float f) {
            return finite(Double.valueOf(Float.toString(f)), path);
        }
        if (value instanceof BigDecimal dec) {
            return finite(dec.doubleValue(), path);
        }
        if (value instanceof Character || value instanceof CharSequence) {
            return value.toString();
        }
        if (value instanceof Map<?, ?> map) {
            LinkedHashMap<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException("Non-string key " + entry.getKey() + " at " + path);
                }
                copy.put(key, normalize(entry.getValue(), path + "." + key));
            }
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            int i = 0;
            for (Object item : collection) {
                copy.add(normalize(item, path + "[" + i++ + "]"));
            }
            return copy;
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> copy = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                copy.add(normalize(Array.get(value, i), path + "[" + i + "]"));
            }
            return copy;
        }
        throw new IllegalArgumentException("Unsupported value type " + value.getClass().getName() + " at " + path);
    }

    private static Double finite(double d, String path) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new IllegalArgumentException("Non-finite number " + d + " at " + path);
        }
        return d;
    }
}
