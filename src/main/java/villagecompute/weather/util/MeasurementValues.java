/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.util;

import java.math.BigDecimal;

/**
 * Coerces raw measurement values from JDBC, BSON or JSON into the {@code Double}-or-null shape the API exposes.
 *
 * <p>
 * ClickHouse {@code Float32} columns arrive as {@link Float}; widening them directly would turn 10.1 into
 * 10.100000381469727, so floats go through their decimal string form. NaN and infinities become null so they never
 * reach clients as {@code "NaN"}.
 */
public final class MeasurementValues {

    private MeasurementValues() {
        // Utility class, no instantiation
    }

    /**
     * Converts a numeric or numeric-string value to a finite double.
     *
     * @param value
     *            Float, Double, Integer, Long, BigDecimal, numeric String, or null
     * @return finite double, or null when the value is absent, non-numeric or not finite
     */
    public static Double toDoubleOrNull(Object value) {
        if (value == null) {
            return null;
        }

        double result;
        if (value instanceof Float f) {
            result = Double.parseDouble(Float.toString(f));
        } else if (value instanceof BigDecimal decimal) {
            result = decimal.doubleValue();
        } else if (value instanceof Number number) {
            result = number.doubleValue();
        } else if (value instanceof String text) {
            if (text.isBlank()) {
                return null;
            }
            try {
                result = Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }

        return Double.isFinite(result) ? result : null;
    }

    /**
     * Converts Celsius to Fahrenheit.
     *
     * @param celsius
     *            temperature in Celsius, may be null
     * @return temperature in Fahrenheit, or null when celsius is null
     */
    public static Double celsiusToFahrenheit(Double celsius) {
        if (celsius == null) {
            return null;
        }
        return celsius * (9.0 / 5.0) + 32.0;
    }
}
