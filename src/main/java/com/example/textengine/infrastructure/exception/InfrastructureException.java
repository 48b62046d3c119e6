package com.example.textengine.infrastructure.exception;

/**
 * Base unchecked exception for failures of the document collaborators (PDF loading, run decoding,
 * font or object resolution). Keeps adapter failures isolated from the domain language.
 */
public abstract class InfrastructureException extends RuntimeException {

    protected InfrastructureException(String message) {
        super(message);
    }

	/**
	 * @param message context about the failure
	 * @param cause   exception bubbling up from lower level libraries
	 */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
