package com.example.textengine.application.exception;

/**
 * Base unchecked exception for failures raised while running an extraction use case:
 * invalid options, cancellation, exhausted streams, or collaborator errors tagged with their page.
 */
public abstract class ApplicationException extends RuntimeException {

	/**
	 * @param message human readable error description suitable for surfacing to the caller
	 */
    protected ApplicationException(String message) {
        super(message);
    }

	/**
	 * @param message human readable error description suitable for surfacing to the caller
	 * @param cause   underlying exception coming from deeper layers
	 */
    protected ApplicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
