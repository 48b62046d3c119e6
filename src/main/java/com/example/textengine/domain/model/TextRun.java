package com.example.textengine.domain.model;

/**
 * Immutable positioned glyph run produced by a {@code PositionedRunSource}.
 * Coordinates are in page space where {@code y} grows upward, so text higher on the page has a larger {@code y}.
 *
 * @param x        left edge of the run
 * @param y        baseline of the run
 * @param fontSize font size in points
 * @param fontName font reference used to resolve metrics
 * @param text     decoded text of the run
 * @param width    horizontal extent; estimated from the text when not supplied
 */
public record TextRun(
        float x,
        float y,
        float fontSize,
        String fontName,
        String text,
        float width
) {

    private static final float AVERAGE_GLYPH_WIDTH = 0.5f;

    public TextRun {
        text = text == null ? "" : text;
        fontName = fontName == null ? "" : fontName;
        if (!(width > 0f)) {
            width = estimateWidth(text, fontSize);
        }
    }

    /**
     * Creates a run whose width is estimated from its text and font size.
     */
    public TextRun(float x, float y, float fontSize, String fontName, String text) {
        this(x, y, fontSize, fontName, text, 0f);
    }

    /**
     * @return right edge of the run
     */
    public float endX() {
        return x + width;
    }

    /**
     * @return {@code true} when the run carries no text and must be ignored by ordering
     */
    public boolean isEmpty() {
        return text.isEmpty();
    }

    /**
     * Returns a copy with different text, keeping position and font.
     *
     * @param newText replacement text
     * @return new run
     */
    public TextRun withText(String newText) {
        return new TextRun(x, y, fontSize, fontName, newText, width);
    }

    private static float estimateWidth(String text, float fontSize) {
        if (text.isEmpty() || !(fontSize > 0f)) {
            return 0f;
        }
        return text.codePointCount(0, text.length()) * fontSize * AVERAGE_GLYPH_WIDTH;
    }
}
