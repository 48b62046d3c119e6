package com.example.textengine.domain.exception;

/**
 * Implemented by failures that concern a single page so callers can report the offending page.
 */
public interface PageScoped {

    /**
     * Marker for failures that were raised before a specific page was known.
     */
    int NO_PAGE = 0;

    /**
     * @return page number the failure relates to, or {@link #NO_PAGE}
     */
    int pageNumber();
}
