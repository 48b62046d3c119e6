package com.example.textengine.application.exception;

/**
 * Raised when a streaming extractor is asked for a page after it reached its terminal state.
 */
public class StreamExhaustedException extends ApplicationException {

    public StreamExhaustedException(int totalPages) {
        super("Stream exhausted after " + totalPages + " page(s)");
    }
}
