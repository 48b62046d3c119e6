package com.example.textengine.domain.model;

import java.util.List;

/**
 * Styled extraction output of one page.
 */
public record StyledPage(int pageNumber, List<StyledSegment> segments) {

    public StyledPage {
        segments = List.copyOf(segments);
    }
}
