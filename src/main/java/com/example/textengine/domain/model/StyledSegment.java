package com.example.textengine.domain.model;

/**
 * One ordered piece of text with its font styling preserved.
 */
public record StyledSegment(
        String fontName,
        float fontSize,
        String text,
        boolean bold,
        boolean italic
) {
}
