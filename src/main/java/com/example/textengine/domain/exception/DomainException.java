package com.example.textengine.domain.exception;

/**
 * Base type for invariant violations of the extraction domain, such as invalid page numbers or
 * documents that cannot be accepted at all.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * @param message which domain rule was broken
	 */
    protected DomainException(String message) {
        super(message);
    }

	/**
	 * @param message which domain rule was broken
	 * @param cause   exception that exposed the violation
	 */
    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
