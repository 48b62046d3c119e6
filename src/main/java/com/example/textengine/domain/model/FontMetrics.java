package com.example.textengine.domain.model;

import java.util.Locale;

/**
 * Font information resolved by reference and memoized in the font cache.
 *
 * @param name         font name as referenced by text runs
 * @param ascent       ascent from the font descriptor (glyph space units)
 * @param descent      descent from the font descriptor (glyph space units)
 * @param averageWidth average glyph width (glyph space units)
 * @param bold         whether the font renders bold
 * @param italic       whether the font renders italic or oblique
 */
public record FontMetrics(
        String name,
        float ascent,
        float descent,
        float averageWidth,
        boolean bold,
        boolean italic
) {

    /**
     * Builds metrics from a font name alone, inferring the style from common name tokens
     * such as {@code Helvetica-BoldOblique} or {@code ABCDEF+Times-Italic}.
     *
     * @param name font name
     * @return metrics with zeroed dimensions
     */
    public static FontMetrics fromName(String name) {
        return new FontMetrics(name == null ? "" : name, 0f, 0f, 0f, nameLooksBold(name), nameLooksItalic(name));
    }

    /**
     * @param name font name
     * @return {@code true} when the name denotes a bold face
     */
    public static boolean nameLooksBold(String name) {
        if (name == null) {
            return false;
        }
        String normalized = name.toLowerCase(Locale.ROOT);
        return normalized.contains("bold") || normalized.contains("black") || normalized.contains("heavy");
    }

    /**
     * @param name font name
     * @return {@code true} when the name denotes an italic or oblique face
     */
    public static boolean nameLooksItalic(String name) {
        if (name == null) {
            return false;
        }
        String normalized = name.toLowerCase(Locale.ROOT);
        return normalized.contains("italic") || normalized.contains("oblique");
    }
}
