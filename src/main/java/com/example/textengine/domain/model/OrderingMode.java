package com.example.textengine.domain.model;

import java.util.Locale;

/**
 * Reading-order strategy applied to the runs of a page.
 */
public enum OrderingMode {
    /**
     * Row-major ordering: rows top to bottom, runs left to right. Assumes one reading column.
     */
    SIMPLE,
    /**
     * Column-aware ordering: detects column gaps first and reads each column top to bottom.
     */
    SMART;

	/**
	 * Parses a caller supplied value, falling back to the given default for blank or unknown input.
	 *
	 * @param rawValue value coming from configuration or the HTTP layer
	 * @param fallback mode returned when the value cannot be parsed
	 * @return parsed mode or {@code fallback}
	 */
    public static OrderingMode fromString(String rawValue, OrderingMode fallback) {
        if (rawValue == null || rawValue.isBlank()) {
            return fallback;
        }
        try {
            return OrderingMode.valueOf(rawValue.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return fallback;
        }
    }
}
