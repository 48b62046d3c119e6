package com.example.textengine.infrastructure.exception;

import com.example.textengine.domain.exception.PageScoped;

/**
 * A font or object reference could not be resolved by the run source.
 */
public class ResolutionException extends InfrastructureException implements PageScoped {

    private final String reference;
    private final int pageNumber;

    public ResolutionException(String reference, String message) {
        this(reference, NO_PAGE, message, null);
    }

    public ResolutionException(String reference, String message, Throwable cause) {
        this(reference, NO_PAGE, message, cause);
    }

    private ResolutionException(String reference, int pageNumber, String message, Throwable cause) {
        super(message, cause);
        this.reference = reference;
        this.pageNumber = pageNumber;
    }

    /**
     * Returns a copy of this failure attributed to the page whose extraction needed the reference.
     *
     * @param page page being extracted
     * @return page-tagged exception
     */
    public ResolutionException onPage(int page) {
        return new ResolutionException(reference, page, getMessage() + " (page " + page + ")", getCause());
    }

    public String reference() {
        return reference;
    }

    @Override
    public int pageNumber() {
        return pageNumber;
    }
}
