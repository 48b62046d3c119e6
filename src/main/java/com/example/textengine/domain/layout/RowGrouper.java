package com.example.textengine.domain.layout;

import com.example.textengine.domain.model.Row;
import com.example.textengine.domain.model.TextRun;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups runs into baseline rows. Rows come out top to bottom, runs inside a row left to right.
 */
final class RowGrouper {

    static final float MIN_ROW_TOLERANCE = 1.5f;
    private static final float TOLERANCE_FACTOR = 0.5f;

    private RowGrouper() {
    }

    /**
     * Half of the modal font size of the page, never below {@link #MIN_ROW_TOLERANCE}.
     * Sizes are bucketed to a tenth of a point; equal counts prefer the smaller size.
     *
     * @param runs runs of the page
     * @return vertical distance within which two runs share a row
     */
    static float rowTolerance(List<IndexedRun> runs) {
        Map<Integer, Integer> histogram = new TreeMap<>();
        for (IndexedRun indexed : runs) {
            float size = indexed.run().fontSize();
            if (size > 0f && Float.isFinite(size)) {
                histogram.merge(Math.round(size * 10f), 1, Integer::sum);
            }
        }
        int modalBucket = 0;
        int modalCount = 0;
        for (Map.Entry<Integer, Integer> entry : histogram.entrySet()) {
            if (entry.getValue() > modalCount) {
                modalBucket = entry.getKey();
                modalCount = entry.getValue();
            }
        }
        float modalSize = modalBucket / 10f;
        return Math.max(MIN_ROW_TOLERANCE, modalSize * TOLERANCE_FACTOR);
    }

    /**
     * Sweeps the runs from the top of the page down, opening a new row whenever a run sits further than
     * {@code tolerance} from the baseline that opened the current row.
     *
     * @param runs      runs to group
     * @param tolerance vertical row tolerance
     * @return rows in reading order
     */
    static List<Row> group(List<IndexedRun> runs, float tolerance) {
        List<IndexedRun> sorted = new ArrayList<>(runs);
        sorted.sort(IndexedRun.TOP_TO_BOTTOM);

        List<PendingRow> pending = new ArrayList<>();
        PendingRow current = null;
        for (IndexedRun indexed : sorted) {
            if (current == null || !current.accepts(indexed, tolerance)) {
                current = new PendingRow(indexed.y());
                pending.add(current);
            }
            current.add(indexed);
        }

        List<Row> rows = new ArrayList<>(pending.size());
        for (PendingRow row : pending) {
            rows.add(row.toRow());
        }
        return rows;
    }

    /**
     * Row under construction, anchored at the baseline of its first run.
     */
    private static final class PendingRow {
        private final float y;
        private final List<IndexedRun> runs = new ArrayList<>();

        PendingRow(float y) {
            this.y = y;
        }

        boolean accepts(IndexedRun indexed, float tolerance) {
            return Math.abs(indexed.y() - y) <= tolerance;
        }

        void add(IndexedRun indexed) {
            runs.add(indexed);
        }

        Row toRow() {
            runs.sort(IndexedRun.LEFT_TO_RIGHT);
            List<TextRun> ordered = new ArrayList<>(runs.size());
            for (IndexedRun indexed : runs) {
                ordered.add(indexed.run());
            }
            return new Row(y, ordered);
        }
    }
}
