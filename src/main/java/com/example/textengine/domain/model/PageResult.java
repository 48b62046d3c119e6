package com.example.textengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of extracting one requested page. Produced exactly once per requested page.
 *
 * @param pageNumber requested page number
 * @param text       extracted text, {@code null} when the page failed
 * @param error      failure of the page, {@code null} on success
 */
public record PageResult(
        int pageNumber,
        String text,
        @JsonIgnore RuntimeException error
) {

    public static PageResult success(int pageNumber, String text) {
        return new PageResult(pageNumber, text, null);
    }

    public static PageResult failure(int pageNumber, RuntimeException error) {
        return new PageResult(pageNumber, null, error);
    }

    @JsonIgnore
    public boolean succeeded() {
        return error == null;
    }

    /**
     * @return message of the failure, exposed to API clients instead of the exception itself
     */
    @JsonProperty("error")
    public String errorMessage() {
        return error == null ? null : error.getMessage();
    }
}
