package com.example.textengine.application.exception;

import com.example.textengine.domain.exception.PageScoped;

/**
 * Raised when cooperative cancellation is observed. Carries the page being processed when the
 * token fired, or {@link PageScoped#NO_PAGE} when no page had started.
 */
public class ExtractionCancelledException extends ApplicationException implements PageScoped {

    private final int pageNumber;

    public ExtractionCancelledException() {
        this(NO_PAGE);
    }

    public ExtractionCancelledException(int pageNumber) {
        super(pageNumber == NO_PAGE ? "Extraction cancelled" : "Extraction cancelled on page " + pageNumber);
        this.pageNumber = pageNumber;
    }

    public ExtractionCancelledException(String message, Throwable cause) {
        super(message, cause);
        this.pageNumber = NO_PAGE;
    }

    @Override
    public int pageNumber() {
        return pageNumber;
    }
}
