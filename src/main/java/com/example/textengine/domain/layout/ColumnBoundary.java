package com.example.textengine.domain.layout;

/**
 * Closed x-interval of one detected column.
 */
final class ColumnBoundary {

    private final float start;
    private final float end;

    ColumnBoundary(float start, float end) {
        this.start = Math.min(start, end);
        this.end = Math.max(start, end);
    }

    float start() {
        return start;
    }

    float end() {
        return end;
    }

    boolean contains(float value) {
        return value >= start && value <= end;
    }

    /**
     * @return length of the part of {@code [from, to]} that lies inside this column
     */
    float overlap(float from, float to) {
        return Math.max(0f, Math.min(end, to) - Math.max(start, from));
    }

    /**
     * @return horizontal distance from {@code value} to the nearest edge, {@code 0} when inside
     */
    float distanceTo(float value) {
        if (value < start) {
            return start - value;
        }
        if (value > end) {
            return value - end;
        }
        return 0f;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
