package com.example.textengine.application.exception;

import com.example.textengine.domain.exception.PageScoped;

/**
 * Wraps an unexpected collaborator failure with the page it occurred on.
 */
public class PageExtractionException extends ApplicationException implements PageScoped {

    private final int pageNumber;

    public PageExtractionException(int pageNumber, Throwable cause) {
        super("Extraction failed on page " + pageNumber + ": " + cause.getMessage(), cause);
        this.pageNumber = pageNumber;
    }

    @Override
    public int pageNumber() {
        return pageNumber;
    }
}
