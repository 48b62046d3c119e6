package com.example.textengine.domain.layout;

import com.example.textengine.domain.model.Column;
import com.example.textengine.domain.model.OrderingMode;
import com.example.textengine.domain.model.PageLayout;
import com.example.textengine.domain.model.Row;
import com.example.textengine.domain.model.TextRun;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns an unordered set of positioned runs into human reading order.
 * <p>
 * {@link OrderingMode#SIMPLE} groups runs into baseline rows and reads them top to bottom, left to right;
 * multi-column pages interleave. {@link OrderingMode#SMART} first splits the page at vertical gutters found
 * by {@link ColumnDetector} and reads each column completely before the next one. When no gutter exists the
 * smart path delegates to the simple one, so both modes agree on single-column pages.
 * <p>
 * Stateless and thread-safe. It never fails: {@code null} or empty input yields an empty layout and runs
 * without text are ignored. Equal coordinates are ordered by the run's position in the input list.
 */
public class ReadingOrderReconstructor {

    private static final Logger log = LoggerFactory.getLogger(ReadingOrderReconstructor.class);

    /**
     * @param runs runs of one page in any order
     * @param mode ordering strategy
     * @return runs in reading order
     */
    public List<TextRun> order(List<TextRun> runs, OrderingMode mode) {
        return layout(runs, mode).runs();
    }

    /**
     * @param runs runs of one page in any order
     * @param mode ordering strategy
     * @return rows in reading order; for smart ordering the rows of the first column come first
     */
    public List<Row> orderRows(List<TextRun> runs, OrderingMode mode) {
        return layout(runs, mode).rows();
    }

    /**
     * Computes the full column and row structure of a page.
     *
     * @param runs runs of one page in any order
     * @param mode ordering strategy, {@code null} means simple
     * @return page layout
     */
    public PageLayout layout(List<TextRun> runs, OrderingMode mode) {
        List<IndexedRun> indexed = index(runs);
        if (indexed.isEmpty()) {
            return PageLayout.empty();
        }
        float tolerance = RowGrouper.rowTolerance(indexed);
        if (mode != OrderingMode.SMART) {
            return simpleLayout(indexed, tolerance);
        }

        List<ColumnBoundary> boundaries = ColumnDetector.detect(indexed);
        if (boundaries.size() < 2) {
            return simpleLayout(indexed, tolerance);
        }

        List<List<IndexedRun>> buckets = new ArrayList<>(boundaries.size());
        for (int i = 0; i < boundaries.size(); i++) {
            buckets.add(new ArrayList<>());
        }
        for (IndexedRun run : indexed) {
            buckets.get(ColumnDetector.assign(run, boundaries)).add(run);
        }

        List<Column> columns = new ArrayList<>(boundaries.size());
        for (int i = 0; i < boundaries.size(); i++) {
            List<IndexedRun> bucket = buckets.get(i);
            if (bucket.isEmpty()) {
                continue;
            }
            ColumnBoundary boundary = boundaries.get(i);
            columns.add(new Column(boundary.start(), boundary.end(), RowGrouper.group(bucket, tolerance)));
        }
        if (columns.size() < 2) {
            return simpleLayout(indexed, tolerance);
        }
        log.debug("Detected {} columns across {} runs", columns.size(), indexed.size());
        return new PageLayout(columns);
    }

    private PageLayout simpleLayout(List<IndexedRun> indexed, float tolerance) {
        float minX = Float.MAX_VALUE;
        float maxX = -Float.MAX_VALUE;
        for (IndexedRun run : indexed) {
            minX = Math.min(minX, run.x());
            maxX = Math.max(maxX, Math.max(run.x(), run.endX()));
        }
        return new PageLayout(List.of(new Column(minX, maxX, RowGrouper.group(indexed, tolerance))));
    }

    private static List<IndexedRun> index(List<TextRun> runs) {
        if (runs == null || runs.isEmpty()) {
            return List.of();
        }
        List<IndexedRun> indexed = new ArrayList<>(runs.size());
        for (int i = 0; i < runs.size(); i++) {
            TextRun run = runs.get(i);
            if (run != null && !run.isEmpty()) {
                indexed.add(new IndexedRun(i, run));
            }
        }
        return indexed;
    }
}
