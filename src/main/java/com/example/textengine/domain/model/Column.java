package com.example.textengine.domain.model;

import java.util.List;

/**
 * Horizontal band of a page read as one stream. Rows are ordered top to bottom.
 *
 * @param minX left bound of the band
 * @param maxX right bound of the band
 * @param rows rows assigned to the band
 */
public record Column(float minX, float maxX, List<Row> rows) {

    public Column {
        rows = List.copyOf(rows);
    }
}
