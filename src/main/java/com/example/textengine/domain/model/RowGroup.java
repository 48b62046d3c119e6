package com.example.textengine.domain.model;

import java.util.List;

/**
 * Row-based output: the styled segments sharing one rounded baseline position.
 */
public record RowGroup(long positionKey, List<StyledSegment> segments) {

    public RowGroup {
        segments = List.copyOf(segments);
    }
}
