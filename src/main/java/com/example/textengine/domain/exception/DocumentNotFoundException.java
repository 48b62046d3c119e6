package com.example.textengine.domain.exception;

/**
 * Raised when a document path does not resolve to an existing file.
 */
public class DocumentNotFoundException extends DomainException {

	/**
	 * @param path path that could not be resolved
	 */
    public DocumentNotFoundException(String path) {
        super("Document not found: " + path);
    }
}
