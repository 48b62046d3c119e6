package com.example.textengine.domain.model;

import java.util.List;

/**
 * Reading-order result for caller supplied runs.
 *
 * @param ordering strategy that was applied
 * @param text     rows joined by the row separator
 * @param rows     styled segments grouped by row
 */
public record OrderedRuns(OrderingMode ordering, String text, List<RowGroup> rows) {
}
