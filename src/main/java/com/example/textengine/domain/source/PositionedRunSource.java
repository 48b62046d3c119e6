package com.example.textengine.domain.source;

import com.example.textengine.domain.model.FontMetrics;
import com.example.textengine.domain.model.TextRun;

import java.util.List;

/**
 * Collaborator that decodes a document into positioned text runs.
 * The engine never parses document bytes itself; everything it knows about a page comes through this contract.
 * Implementations must tolerate concurrent calls from several extraction workers.
 */
public interface PositionedRunSource {

    /**
     * @return number of pages of the document
     */
    int pageCount();

    /**
     * Returns the runs of a page in document-native order.
     *
     * @param pageNumber 1-based page number
     * @return runs of the page, possibly empty
     * @throws com.example.textengine.infrastructure.exception.SourceUnavailableException when the page is
     *         missing or cannot be decoded
     */
    List<TextRun> getRuns(int pageNumber);

    /**
     * Resolves a font reference as carried by {@link TextRun#fontName()}.
     *
     * @param fontRef font reference
     * @return resolved metrics
     * @throws com.example.textengine.infrastructure.exception.ResolutionException when the font is unknown
     */
    FontMetrics resolveFont(String fontRef);

    /**
     * Resolves an object reference to its decoded value.
     *
     * @param ref object reference in the source's own notation
     * @return decoded value
     * @throws com.example.textengine.infrastructure.exception.ResolutionException when the object is unknown
     */
    Object resolveObject(String ref);
}
