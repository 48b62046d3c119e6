package com.example.textengine.domain.model;

import java.util.List;

/**
 * Runs judged to share a baseline, ordered left to right.
 * Recomputed for every extraction and never persisted.
 *
 * @param y    baseline of the first run that opened the row
 * @param runs runs of the row in reading order
 */
public record Row(float y, List<TextRun> runs) {

    public Row {
        runs = List.copyOf(runs);
    }

    /**
     * @return row position rounded to whole units, used as the grouping key of row-based output
     */
    public long positionKey() {
        return Math.round(y);
    }
}
