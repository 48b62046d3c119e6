package com.example.textengine.domain.model;

import java.util.List;

/**
 * Caller choices for a document extraction. {@code null} fields fall back to the configured defaults.
 *
 * @param pages    1-based pages to extract, {@code null} or empty for every page
 * @param ordering reading-order strategy
 * @param workers  batch worker count
 * @param tolerant report page failures per page instead of failing the whole request
 */
public record ExtractionRequest(List<Integer> pages, OrderingMode ordering, Integer workers, boolean tolerant) {

    public ExtractionRequest {
        pages = pages == null ? List.of() : List.copyOf(pages);
    }

    public static ExtractionRequest allPages() {
        return new ExtractionRequest(List.of(), null, null, false);
    }
}
