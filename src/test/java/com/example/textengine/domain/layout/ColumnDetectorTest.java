package com.example.textengine.domain.layout;

import com.example.textengine.domain.model.TextRun;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ColumnDetectorTest {

    @Test
    void continuousCoverageYieldsOneColumn() {
        List<IndexedRun> runs = List.of(
                indexed(0, 0f, 60f),
                indexed(1, 50f, 60f)
        );

        List<ColumnBoundary> boundaries = ColumnDetector.detect(runs);

        assertThat(boundaries).hasSize(1);
        assertThat(boundaries.get(0).start()).isEqualTo(0f);
        assertThat(boundaries.get(0).end()).isEqualTo(110f);
    }

    @Test
    void narrowGapIsNotAGutter() {
        List<IndexedRun> runs = List.of(
                indexed(0, 0f, 99f),
                indexed(1, 100f, 100f)
        );

        assertThat(ColumnDetector.detect(runs)).hasSize(1);
    }

    @Test
    void wideGapSplitsColumns() {
        List<IndexedRun> runs = List.of(
                indexed(0, 0f, 40f),
                indexed(1, 60f, 40f)
        );

        List<ColumnBoundary> boundaries = ColumnDetector.detect(runs);

        assertThat(boundaries).hasSize(2);
        assertThat(boundaries.get(0).start()).isEqualTo(0f);
        assertThat(boundaries.get(0).end()).isBetween(40f, 41f);
        assertThat(boundaries.get(1).start()).isBetween(59f, 60f);
        assertThat(boundaries.get(1).end()).isEqualTo(100f);
    }

    @Test
    void runInsideGapGoesToNearestColumn() {
        List<ColumnBoundary> boundaries = List.of(new ColumnBoundary(0f, 40f), new ColumnBoundary(60f, 100f));

        assertThat(ColumnDetector.assign(indexed(0, 55f, 3f), boundaries)).isEqualTo(1);
        assertThat(ColumnDetector.assign(indexed(0, 42f, 3f), boundaries)).isEqualTo(0);
    }

    @Test
    void runOverlappingBothColumnsGoesToLargerShare() {
        List<ColumnBoundary> boundaries = List.of(new ColumnBoundary(0f, 40f), new ColumnBoundary(60f, 100f));

        assertThat(ColumnDetector.assign(indexed(0, 30f, 60f), boundaries)).isEqualTo(1);
        assertThat(ColumnDetector.assign(indexed(0, 10f, 60f), boundaries)).isEqualTo(0);
    }

    @Test
    void noiseLimitHasAFloorOnceAPageHasSeveralRuns() {
        assertThat(ColumnDetector.noiseLimit(2)).isZero();
        assertThat(ColumnDetector.noiseLimit(6)).isEqualTo(1);
        assertThat(ColumnDetector.noiseLimit(19)).isEqualTo(1);
        assertThat(ColumnDetector.noiseLimit(60)).isEqualTo(3);
    }

    private static IndexedRun indexed(int index, float x, float width) {
        return new IndexedRun(index, new TextRun(x, 100f, 10f, "F1", "text", width));
    }
}
