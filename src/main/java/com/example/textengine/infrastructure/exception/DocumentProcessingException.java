package com.example.textengine.infrastructure.exception;

/**
 * Signals that a document could not be opened or read as a whole.
 */
public class DocumentProcessingException extends InfrastructureException {

	/**
	 * @param message description shared with the application layer
	 * @param cause   low-level PDFBox exception
	 */
    public DocumentProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
