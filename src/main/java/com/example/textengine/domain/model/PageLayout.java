package com.example.textengine.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of reading-order reconstruction for one page: columns left to right, each holding its rows.
 * Simple ordering always yields a single column.
 *
 * @param columns detected columns in reading order
 */
public record PageLayout(List<Column> columns) {

    public PageLayout {
        columns = List.copyOf(columns);
    }

    public static PageLayout empty() {
        return new PageLayout(List.of());
    }

    /**
     * @return every row of the page in reading order
     */
    public List<Row> rows() {
        List<Row> rows = new ArrayList<>();
        for (Column column : columns) {
            rows.addAll(column.rows());
        }
        return rows;
    }

    /**
     * @return every run of the page in reading order
     */
    public List<TextRun> runs() {
        List<TextRun> runs = new ArrayList<>();
        for (Column column : columns) {
            for (Row row : column.rows()) {
                runs.addAll(row.runs());
            }
        }
        return runs;
    }
}
