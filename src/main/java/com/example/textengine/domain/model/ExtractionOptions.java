package com.example.textengine.domain.model;

import java.util.Objects;

/**
 * Per-page extraction settings.
 *
 * @param ordering          reading-order strategy
 * @param rowSeparator      text placed between rows of plain-text output
 * @param insertWordSpacing whether a space is inserted between runs separated by a visible gap
 */
public record ExtractionOptions(
        OrderingMode ordering,
        String rowSeparator,
        boolean insertWordSpacing
) {

    public static final String DEFAULT_ROW_SEPARATOR = "\n";

    public ExtractionOptions {
        ordering = Objects.requireNonNullElse(ordering, OrderingMode.SIMPLE);
        rowSeparator = Objects.requireNonNullElse(rowSeparator, DEFAULT_ROW_SEPARATOR);
    }

    public static ExtractionOptions defaults() {
        return new ExtractionOptions(OrderingMode.SIMPLE, DEFAULT_ROW_SEPARATOR, false);
    }

    public static ExtractionOptions of(OrderingMode ordering) {
        return new ExtractionOptions(ordering, DEFAULT_ROW_SEPARATOR, false);
    }

    public ExtractionOptions withOrdering(OrderingMode newOrdering) {
        return new ExtractionOptions(newOrdering, rowSeparator, insertWordSpacing);
    }
}
