package com.example.textengine.application.exception;

/**
 * Signals invalid extraction options, for example a negative worker count.
 */
public class UseCaseValidationException extends ApplicationException {

    public UseCaseValidationException(String message) {
        super(message);
    }
}
