package com.phillippitts.tsaugment.service.augment;

import com.phillippitts.tsaugment.exception.ConfigurationException;
import com.phillippitts.tsaugment.exception.ConfigurationExceptionBuilder;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Typed, strict view over the keyword arguments of one configured augmenter.
 *
 * <p>Keys are matched after {@link ConfigNames#normalize(String) normalization}. Values may be
 * strings (as bound from properties files) or already typed numbers, booleans and lists. Every
 * key read through a getter is marked as used so {@link #rejectUnknown()} can report leftovers.
 *
 * <p>Ranges are given either as a two-element list or as a string {@code "low,high"}.
 */
public final class AugmenterParameters {

    private final String augmenterName;
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Map<String, String> originalKeys = new LinkedHashMap<>();
    private final Set<String> consumed = new HashSet<>();

    public AugmenterParameters(String augmenterName, Map<String, ?> raw) {
        this.augmenterName = augmenterName;
        if (raw == null) {
            return;
        }
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            String key = ConfigNames.normalize(entry.getKey());
            if (values.containsKey(key)) {
                throw error("Duplicate parameter", entry.getKey()).build();
            }
            values.put(key, entry.getValue());
            originalKeys.put(key, entry.getKey());
        }
    }

    public int requireInt(String key) {
        return toInt(key, require(key));
    }

    public int optInt(String key, int defaultValue) {
        Object v = lookup(key);
        return v == null ? defaultValue : toInt(key, v);
    }

    public double requireDouble(String key) {
        return toDouble(key, require(key));
    }

    public double optDouble(String key, double defaultValue) {
        Object v = lookup(key);
        return v == null ? defaultValue : toDouble(key, v);
    }

    public boolean optBoolean(String key, boolean defaultValue) {
        Object v = lookup(key);
        if (v == null) {
            return defaultValue;
        }
        if (v instanceof Boolean b) {
            return b;
        }
        String s = v.toString().trim();
        if ("true".equalsIgnoreCase(s)) {
            return true;
        }
        if ("false".equalsIgnoreCase(s)) {
            return false;
        }
        throw error("Not a boolean", key).metadata("value", v).build();
    }

    public String requireString(String key) {
        return require(key).toString();
    }

    /**
     * Reads a {@code [low, high]} pair.
     *
     * @return two-element array {@code {low, high}}
     */
    public double[] requireRange(String key) {
        Object v = require(key);
        Object[] parts;
        if (v instanceof Collection<?> c) {
            parts = c.toArray();
        } else if (v instanceof double[] d) {
            parts = new Object[d.length];
            for (int i = 0; i < d.length; i++) {
                parts[i] = d[i];
            }
        } else {
            parts = v.toString().replace("[", "").replace("]", "").replace("(", "").replace(")", "").split(",");
        }
        if (parts.length != 2) {
            throw error("Range must have exactly two values", key).metadata("value", v).build();
        }
        return new double[] {toDouble(key, parts[0]), toDouble(key, parts[1])};
    }

    /**
     * Fails if any parameter was supplied that no getter asked for.
     *
     * @throws ConfigurationException naming the first unknown parameter
     */
    public void rejectUnknown() {
        for (String key : values.keySet()) {
            if (!consumed.contains(key)) {
                throw error("Unknown parameter", originalKeys.get(key)).build();
            }
        }
    }

    private Object lookup(String key) {
        String normalized = ConfigNames.normalize(key);
        consumed.add(normalized);
        return values.get(normalized);
    }

    private Object require(String key) {
        Object v = lookup(key);
        if (v == null || v.toString().isBlank()) {
            throw error("Missing required parameter", key).build();
        }
        return v;
    }

    private int toInt(String key, Object v) {
        if (v instanceof Integer i) {
            return i;
        }
        if (v instanceof Long || v instanceof Short || v instanceof Byte) {
            long l = ((Number) v).longValue();
            if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
                throw error("Integer out of range", key).metadata("value", v).build();
            }
            return (int) l;
        }
        try {
            return Integer.parseInt(v.toString().trim());
        } catch (NumberFormatException e) {
            throw error("Not an integer", key).metadata("value", v).cause(e).build();
        }
    }

    private double toDouble(String key, Object v) {
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(v.toString().trim());
        } catch (NumberFormatException e) {
            throw error("Not a number", key).metadata("value", v).cause(e).build();
        }
    }

    private ConfigurationExceptionBuilder error(String message, String key) {
        return ConfigurationExceptionBuilder.create(message).augmenter(augmenterName).parameter(key);
    }
}
