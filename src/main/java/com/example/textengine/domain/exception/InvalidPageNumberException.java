package com.example.textengine.domain.exception;

/**
 * Raised when a caller requests a page number that can never exist (zero or negative).
 * Pages beyond the end of a document are reported by the run source instead.
 */
public class InvalidPageNumberException extends DomainException implements PageScoped {

    private final int pageNumber;

    public InvalidPageNumberException(int pageNumber) {
        super("Page numbers start at 1 but got " + pageNumber);
        this.pageNumber = pageNumber;
    }

    @Override
    public int pageNumber() {
        return pageNumber;
    }
}
