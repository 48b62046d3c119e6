package com.example.textengine.infrastructure.exception;

import com.example.textengine.domain.exception.PageScoped;

/**
 * The run source could not produce runs for a page: the page is missing or its content is corrupt.
 * Never retried by the engine.
 */
public class SourceUnavailableException extends InfrastructureException implements PageScoped {

    private final int pageNumber;

    public SourceUnavailableException(int pageNumber, String message) {
        super(message);
        this.pageNumber = pageNumber;
    }

    public SourceUnavailableException(int pageNumber, String message, Throwable cause) {
        super(message, cause);
        this.pageNumber = pageNumber;
    }

    @Override
    public int pageNumber() {
        return pageNumber;
    }
}
