package com.example.pdfoutline.source;

import com.example.pdfoutline.model.BoundingBox;
import com.example.pdfoutline.model.PageLayout;

import java.io.Closeable;
import java.io.IOException;

/**
 * Supplies per-page text geometry: blocks of lines of spans with font size, weight and position.
 * Pages are numbered from 1.
 */
public interface SpanSource extends Closeable {

    int getPageCount();

    /**
     * Full page rectangle, origin at the top-left corner.
     */
    BoundingBox getPageBounds(int pageNumber) throws IOException;

    /**
     * Extract one page.
     *
     * @param clip           only text inside this region is returned, {@code null} for the whole page
     * @param sortByPosition deliver blocks in reading order instead of content order
     */
    PageLayout readPage(int pageNumber, BoundingBox clip, boolean sortByPosition) throws IOException;

    default PageLayout readPage(int pageNumber) throws IOException {
        return readPage(pageNumber, null, true);
    }

    @Override
    default void close() throws IOException {
    }
}
