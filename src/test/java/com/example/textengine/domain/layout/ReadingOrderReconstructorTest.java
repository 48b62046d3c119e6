package com.example.textengine.domain.layout;

import com.example.textengine.domain.model.OrderingMode;
import com.example.textengine.domain.model.PageLayout;
import com.example.textengine.domain.model.Row;
import com.example.textengine.domain.model.TextRun;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for simple and column-aware reading order.
 */
class ReadingOrderReconstructorTest {

    private final ReadingOrderReconstructor reconstructor = new ReadingOrderReconstructor();

    @Test
    void simpleOrderingReadsRowsTopToBottomAndRunsLeftToRight() {
        List<TextRun> runs = List.of(
                new TextRun(0f, 10f, 0f, "F1", "A"),
                new TextRun(5f, 10f, 0f, "F1", "B"),
                new TextRun(0f, 0f, 0f, "F1", "C")
        );

        List<Row> rows = reconstructor.orderRows(runs, OrderingMode.SIMPLE);

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).y()).isEqualTo(10f);
        assertThat(texts(rows.get(0))).isEqualTo("AB");
        assertThat(rows.get(1).y()).isEqualTo(0f);
        assertThat(texts(rows.get(1))).isEqualTo("C");
    }

    @Test
    void smartOrderingReadsLeftColumnBeforeRightColumn() {
        List<TextRun> runs = List.of(
                run(50f, 100f, "R1"), run(0f, 100f, "L1"),
                run(50f, 80f, "R2"), run(0f, 80f, "L2"),
                run(50f, 60f, "R3"), run(0f, 60f, "L3")
        );

        List<String> smart = rowTexts(reconstructor.orderRows(runs, OrderingMode.SMART));
        List<String> simple = rowTexts(reconstructor.orderRows(runs, OrderingMode.SIMPLE));

        assertThat(smart).containsExactly("L1", "L2", "L3", "R1", "R2", "R3");
        assertThat(simple).containsExactly("L1R1", "L2R2", "L3R3");
    }

    @Test
    void smartLayoutExposesDetectedColumns() {
        List<TextRun> runs = List.of(
                run(0f, 100f, "L1"), run(0f, 80f, "L2"),
                run(50f, 100f, "R1"), run(50f, 80f, "R2")
        );

        PageLayout layout = reconstructor.layout(runs, OrderingMode.SMART);

        assertThat(layout.columns()).hasSize(2);
        assertThat(layout.columns().get(0).maxX()).isLessThan(layout.columns().get(1).minX());
        assertThat(layout.columns().get(1).rows()).extracting(ReadingOrderReconstructorTest::texts)
                .containsExactly("R1", "R2");
    }

    @Test
    void headingSpanningBothColumnsDoesNotHideTheGutter() {
        List<TextRun> runs = new ArrayList<>();
        runs.add(new TextRun(0f, 400f, 10f, "F1", "Heading", 40f));
        for (int i = 0; i < 20; i++) {
            runs.add(run(0f, 380f - i * 12f, "L" + i));
            runs.add(run(50f, 380f - i * 12f, "R" + i));
        }

        List<TextRun> ordered = reconstructor.order(runs, OrderingMode.SMART);

        assertThat(ordered.get(0).text()).isEqualTo("Heading");
        assertThat(ordered.get(1).text()).isEqualTo("L0");
        assertThat(ordered.get(20).text()).isEqualTo("L19");
        assertThat(ordered.get(21).text()).isEqualTo("R0");
        assertThat(ordered).hasSize(41);
    }

    @Test
    void spanningHeadingOnShortPageKeepsColumns() {
        List<TextRun> runs = new ArrayList<>();
        runs.add(new TextRun(0f, 400f, 10f, "F1", "Heading", 40f));
        for (int i = 0; i < 3; i++) {
            runs.add(run(0f, 380f - i * 12f, "L" + i));
            runs.add(run(50f, 380f - i * 12f, "R" + i));
        }

        List<TextRun> ordered = reconstructor.order(runs, OrderingMode.SMART);

        assertThat(ordered).extracting(TextRun::text)
                .containsExactly("Heading", "L0", "L1", "L2", "R0", "R1", "R2");
    }

    @Test
    void singleColumnSmartLayoutMatchesSimpleLayout() {
        List<TextRun> runs = List.of(
                new TextRun(0f, 100f, 10f, "F1", "one", 30f),
                new TextRun(30f, 100f, 10f, "F1", "two", 30f),
                new TextRun(0f, 85f, 10f, "F1", "three", 40f),
                new TextRun(12f, 70f, 10f, "F1", "four", 40f)
        );

        assertThat(reconstructor.layout(runs, OrderingMode.SMART))
                .isEqualTo(reconstructor.layout(runs, OrderingMode.SIMPLE));
    }

    @Test
    void orderingIsIdempotent() {
        List<TextRun> runs = List.of(
                run(50f, 100f, "R1"), run(0f, 100f, "L1"),
                run(50f, 80f, "R2"), run(0f, 80f, "L2")
        );

        for (OrderingMode mode : OrderingMode.values()) {
            List<TextRun> once = reconstructor.order(runs, mode);
            List<TextRun> twice = reconstructor.order(once, mode);
            assertThat(twice).containsExactlyElementsOf(once);
        }
    }

    @Test
    void outputIsAPermutationOfTheNonEmptyInput() {
        Random random = new Random(42);
        List<TextRun> runs = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            runs.add(run(random.nextInt(300), random.nextInt(700), "t" + i));
        }
        runs.add(run(10f, 10f, ""));

        for (OrderingMode mode : OrderingMode.values()) {
            List<TextRun> ordered = reconstructor.order(runs, mode);
            assertThat(ordered).hasSize(60);
            assertThat(ordered).containsExactlyInAnyOrderElementsOf(runs.subList(0, 60));
        }
    }

    @Test
    void equalCoordinatesKeepInputOrder() {
        TextRun first = run(10f, 50f, "first");
        TextRun second = run(10f, 50f, "second");

        assertThat(reconstructor.order(List.of(first, second), OrderingMode.SIMPLE)).containsExactly(first, second);
        assertThat(reconstructor.order(List.of(second, first), OrderingMode.SIMPLE)).containsExactly(second, first);
    }

    @Test
    void shuffledInputYieldsSameRows() {
        List<TextRun> runs = new ArrayList<>(List.of(
                run(0f, 100f, "a"), run(20f, 100f, "b"), run(0f, 80f, "c"), run(20f, 80f, "d")
        ));
        List<String> expected = rowTexts(reconstructor.orderRows(runs, OrderingMode.SIMPLE));

        Collections.shuffle(runs, new Random(7));

        assertThat(rowTexts(reconstructor.orderRows(runs, OrderingMode.SIMPLE))).isEqualTo(expected);
    }

    @Test
    void runsWithinToleranceShareARow() {
        List<TextRun> runs = List.of(
                new TextRun(0f, 100f, 12f, "F1", "base"),
                new TextRun(40f, 102.5f, 12f, "F1", "raised"),
                new TextRun(0f, 90f, 12f, "F1", "next")
        );

        assertThat(rowTexts(reconstructor.orderRows(runs, OrderingMode.SIMPLE))).containsExactly("baseraised", "next");
    }

    @Test
    void emptyOrNullInputYieldsEmptyLayout() {
        assertThat(reconstructor.order(null, OrderingMode.SMART)).isEmpty();
        assertThat(reconstructor.order(List.of(), OrderingMode.SIMPLE)).isEmpty();
        assertThat(reconstructor.layout(List.of(run(0f, 0f, "")), OrderingMode.SMART).columns()).isEmpty();
    }

    private static TextRun run(float x, float y, String text) {
        return new TextRun(x, y, 10f, "F1", text, 5f);
    }

    private static String texts(Row row) {
        return row.runs().stream().map(TextRun::text).collect(Collectors.joining());
    }

    private static List<String> rowTexts(List<Row> rows) {
        return rows.stream().map(ReadingOrderReconstructorTest::texts).collect(Collectors.toList());
    }
}
