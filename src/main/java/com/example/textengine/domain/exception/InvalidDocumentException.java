package com.example.textengine.domain.exception;

/**
 * Raised when a submitted document is missing, empty, or does not look like a PDF.
 */
public class InvalidDocumentException extends DomainException {

    public InvalidDocumentException(String message) {
        super(message);
    }

	/**
	 * Builds the rejection for a file that is not a PDF.
	 *
	 * @param fileName name supplied by the client, may be {@code null}
	 * @return exception naming the offending file
	 */
    public static InvalidDocumentException unsupportedFormat(String fileName) {
        return new InvalidDocumentException("Only PDF documents are supported" + (fileName != null ? ": " + fileName : "."));
    }
}
