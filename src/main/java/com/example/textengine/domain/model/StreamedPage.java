package com.example.textengine.domain.model;

/**
 * One step of a streaming extraction.
 *
 * @param pageNumber emitted page
 * @param text       text of the page
 * @param hasMore    {@code false} on the last page of the stream
 */
public record StreamedPage(int pageNumber, String text, boolean hasMore) {
}
