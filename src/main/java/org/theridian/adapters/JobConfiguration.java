package org.theridian.adapters;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed view over a job's free-form configuration map. Values are checked when read, so a
 * malformed entry only fails the job that uses it.
 */
public final class JobConfiguration {

    private final Map<String, Object> values;

    private JobConfiguration(Map<String, Object> values) {
        this.values = values;
    }

    public static JobConfiguration of(Map<String, Object> values) {
        return new JobConfiguration(values == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    /**
     * Reads a non-negative whole number, falling back to {@code defaultValue} when the key is
     * absent or null.
     *
     * @throws IllegalArgumentException when the value is negative, fractional or not a number
     */
    public long getLong(String key, long defaultValue) {
        Object raw = values.get(key);
        if (raw == null) {
            return defaultValue;
        }
        long value = toLong(key, raw);
        if (value < 0) {
            throw new IllegalArgumentException("Configuration value '" + key + "' must not be negative, got " + value);
        }
        return value;
    }

    private static long toLong(String key, Object raw) {
        BigDecimal decimal;
        if (raw instanceof Number number) {
            decimal = new BigDecimal(number.toString());
        } else if (raw instanceof String text) {
            try {
                decimal = new BigDecimal(text.trim());
            } catch (NumberFormatException exception) {
                throw new IllegalArgumentException("Configuration value '" + key + "' is not a number: " + text);
            }
        } else {
            throw new IllegalArgumentException("Configuration value '" + key + "' is not a number: " + raw);
        }
        try {
            return decimal.longValueExact();
        } catch (ArithmeticException exception) {
            throw new IllegalArgumentException("Configuration value '" + key + "' must be a whole number, got " + raw);
        }
    }
}
