package com.example.textengine.domain.model;

import java.util.List;

/**
 * Decoded page as held by the lazy page manager: ordered rows plus the rendered plain text.
 *
 * @param pageNumber page number
 * @param rows       rows in reading order
 * @param text       plain text built from {@code rows}
 */
public record ExtractedPage(int pageNumber, List<Row> rows, String text) {

    public ExtractedPage {
        rows = List.copyOf(rows);
    }
}
