package com.example.textengine.domain.layout;

import com.example.textengine.domain.model.TextRun;

import java.util.Comparator;

/**
 * Text run paired with its position in the source list. The index is the final tie-breaker of every
 * comparison so that ordering never depends on sort stability or hash iteration.
 */
record IndexedRun(int index, TextRun run) {

    /**
     * Top of the page first, then source order.
     */
    static final Comparator<IndexedRun> TOP_TO_BOTTOM = Comparator
            .comparing((IndexedRun indexed) -> indexed.run().y(), Comparator.reverseOrder())
            .thenComparingInt(IndexedRun::index);

    /**
     * Left to right, then source order.
     */
    static final Comparator<IndexedRun> LEFT_TO_RIGHT = Comparator
            .comparing((IndexedRun indexed) -> indexed.run().x())
            .thenComparingInt(IndexedRun::index);

    float x() {
        return run.x();
    }

    float endX() {
        return run.endX();
    }

    float y() {
        return run.y();
    }
}
