package com.example.textengine.domain.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds column boundaries from a coverage histogram of run extents.
 * <p>
 * The content width is split into {@link #BIN_COUNT} bins and every run increments the bins its extent
 * covers. A gap is an interior stretch of bins whose coverage does not exceed a small noise level
 * (so a heading spanning two columns does not hide the gutter) and which is wider than
 * {@link #GAP_FRACTION} of the content width. Columns are the ranges between gaps.
 */
final class ColumnDetector {

    static final int BIN_COUNT = 400;
    static final float GAP_FRACTION = 0.05f;
    static final float NOISE_FRACTION = 0.05f;
    static final int MIN_RUNS_FOR_NOISE_FLOOR = 6;

    private ColumnDetector() {
    }

    /**
     * @param runs runs of one page
     * @return column boundaries left to right; a single boundary when no gap exists
     */
    static List<ColumnBoundary> detect(List<IndexedRun> runs) {
        if (runs.isEmpty()) {
            return List.of();
        }
        float left = Float.MAX_VALUE;
        float right = -Float.MAX_VALUE;
        for (IndexedRun indexed : runs) {
            left = Math.min(left, indexed.x());
            right = Math.max(right, Math.max(indexed.x(), indexed.endX()));
        }
        float width = right - left;
        if (runs.size() < 2 || !(width > 0f) || !Float.isFinite(width)) {
            return List.of(new ColumnBoundary(left, right));
        }

        float binWidth = width / BIN_COUNT;
        int[] coverage = new int[BIN_COUNT];
        for (IndexedRun indexed : runs) {
            int first = binOf(indexed.x(), left, binWidth);
            int last = Math.max(first, lastBinOf(indexed.endX(), left, binWidth));
            for (int bin = first; bin <= last; bin++) {
                coverage[bin]++;
            }
        }

        int noiseLimit = noiseLimit(runs.size());
        float minGapWidth = width * GAP_FRACTION;
        List<ColumnBoundary> boundaries = new ArrayList<>();
        float columnStart = left;
        int bin = firstCovered(coverage, noiseLimit);
        int lastCovered = lastCovered(coverage, noiseLimit);
        while (bin >= 0 && bin < lastCovered) {
            if (coverage[bin] > noiseLimit) {
                bin++;
                continue;
            }
            int gapStart = bin;
            while (bin < lastCovered && coverage[bin] <= noiseLimit) {
                bin++;
            }
            int gapEnd = bin - 1;
            if ((gapEnd - gapStart + 1) * binWidth > minGapWidth) {
                float gapStartX = left + gapStart * binWidth;
                float gapEndX = left + (gapEnd + 1) * binWidth;
                boundaries.add(new ColumnBoundary(columnStart, gapStartX));
                columnStart = gapEndX;
            }
        }
        boundaries.add(new ColumnBoundary(columnStart, right));
        return boundaries;
    }

    /**
     * Picks the column holding the larger portion of the run's span. Equal portions go to the leftmost
     * column; a run that overlaps no column at all (it sits inside a gap) goes to the column containing its
     * {@code x}, or the nearest one.
     *
     * @param indexed    run to place
     * @param boundaries detected columns
     * @return index into {@code boundaries}
     */
    static int assign(IndexedRun indexed, List<ColumnBoundary> boundaries) {
        int best = -1;
        float bestOverlap = 0f;
        for (int i = 0; i < boundaries.size(); i++) {
            float overlap = boundaries.get(i).overlap(indexed.x(), indexed.endX());
            if (overlap > bestOverlap) {
                best = i;
                bestOverlap = overlap;
            }
        }
        if (best >= 0) {
            return best;
        }
        int nearest = 0;
        float nearestDistance = Float.MAX_VALUE;
        for (int i = 0; i < boundaries.size(); i++) {
            ColumnBoundary boundary = boundaries.get(i);
            if (boundary.contains(indexed.x())) {
                return i;
            }
            float distance = boundary.distanceTo(indexed.x());
            if (distance < nearestDistance) {
                nearest = i;
                nearestDistance = distance;
            }
        }
        return nearest;
    }

    private static int binOf(float value, float left, float binWidth) {
        int bin = (int) ((value - left) / binWidth);
        return clamp(bin);
    }

    private static int lastBinOf(float end, float left, float binWidth) {
        int bin = (int) Math.ceil((end - left) / binWidth) - 1;
        return clamp(bin);
    }

    private static int clamp(int bin) {
        return Math.max(0, Math.min(BIN_COUNT - 1, bin));
    }

    /**
     * Coverage a gutter may still carry: {@code floor(runs * 0.05)}, but at least one run once the page holds
     * {@value #MIN_RUNS_FOR_NOISE_FLOOR} runs, so a lone spanning heading on a short page is tolerated.
     */
    static int noiseLimit(int runCount) {
        int limit = (int) Math.floor(runCount * NOISE_FRACTION);
        return runCount >= MIN_RUNS_FOR_NOISE_FLOOR ? Math.max(1, limit) : limit;
    }

    private static int firstCovered(int[] coverage, int noiseLimit) {
        for (int i = 0; i < coverage.length; i++) {
            if (coverage[i] > noiseLimit) {
                return i;
            }
        }
        return -1;
    }

    private static int lastCovered(int[] coverage, int noiseLimit) {
        for (int i = coverage.length - 1; i >= 0; i--) {
            if (coverage[i] > noiseLimit) {
                return i;
            }
        }
        return -1;
    }
}
