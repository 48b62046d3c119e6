package com.example.textengine.infrastructure.pdf;

import com.example.textengine.domain.model.TextRun;

import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Captures every word PDFBox emits as a positioned {@link TextRun} instead of writing text.
 * <p>
 * Positions are converted to a y-up page space. A word separator emitted by PDFBox is kept as a
 * trailing space on the previous run so that downstream rendering does not need to guess spacing.
 * Runs are captured in content-stream order; ordering is left to the reading-order reconstructor.
 */
final class RunCapturingStripper extends PDFTextStripper {

    private static final float MIN_RUN_WIDTH = 0.5f;

    private final List<TextRun> runs = new ArrayList<>();
    private final Map<PDFont, Boolean> fonts = new IdentityHashMap<>();

    RunCapturingStripper() throws IOException {
        setSortByPosition(false);
    }

    List<TextRun> runs() {
        return List.copyOf(runs);
    }

    Collection<PDFont> fonts() {
        return fonts.keySet();
    }

    static String fontKey(PDFont font) {
        String name = font.getName();
        return name != null ? name : font.getClass().getSimpleName() + "@" + Integer.toHexString(System.identityHashCode(font));
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        if (textPositions == null || textPositions.isEmpty()) {
            return;
        }
        StringBuilder builder = new StringBuilder();
        float x = Float.MAX_VALUE;
        float width = 0f;
        for (TextPosition position : textPositions) {
            builder.append(position.getUnicode());
            x = Math.min(x, position.getXDirAdj());
            width += position.getWidthDirAdj();
        }
        String runText = builder.toString();
        if (runText.isEmpty()) {
            return;
        }
        TextPosition first = textPositions.get(0);
        PDFont font = first.getFont();
        String fontName = "";
        if (font != null) {
            fonts.put(font, Boolean.TRUE);
            fontName = fontKey(font);
        }
        float y = first.getPageHeight() - first.getYDirAdj();
        runs.add(new TextRun(x, y, first.getFontSizeInPt(), fontName, runText, Math.max(width, MIN_RUN_WIDTH)));
    }

    @Override
    protected void writeWordSeparator() throws IOException {
        if (runs.isEmpty()) {
            return;
        }
        int last = runs.size() - 1;
        TextRun previous = runs.get(last);
        runs.set(last, previous.withText(previous.text() + getWordSeparator()));
    }
}
