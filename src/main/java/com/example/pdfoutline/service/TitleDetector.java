package com.example.pdfoutline.service;

import com.example.pdfoutline.model.PageLayout;
import com.example.pdfoutline.model.Span;
import com.example.pdfoutline.model.TextBlock;
import com.example.pdfoutline.model.TextLine;
import com.example.pdfoutline.util.HeadingTextNormalizer;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Title = the largest-font text in the upper part of page one.
 */
@Component
public class TitleDetector {

    public static final String UNTITLED = "Untitled Document";

    // Blocks must end above this fraction of the page height
    static final float TITLE_AREA_RATIO = 0.7f;
    // Sub-point variance between spans of the same visual size
    static final float SIZE_TOLERANCE = 1.0f;

    /**
     * @param firstPage page one in reading order, unclipped
     */
    public String detectTitle(PageLayout firstPage) {
        float maxFontSize = 0;
        for (Span span : firstPage.spans()) {
            if (span.getSize() > maxFontSize) {
                maxFontSize = span.getSize();
            }
        }

        float limit = firstPage.getHeight() * TITLE_AREA_RATIO;
        Set<String> candidates = new LinkedHashSet<>();
        for (TextBlock block : firstPage.getBlocks()) {
            if (block.getBbox() == null || block.getBbox().getY1() >= limit) continue;
            for (TextLine line : block.getLines()) {
                for (Span span : line.getSpans()) {
                    if (Math.abs(span.getSize() - maxFontSize) < SIZE_TOLERANCE) {
                        candidates.add(HeadingTextNormalizer.trim(span.getText()));
                    }
                }
            }
        }

        if (candidates.isEmpty()) {
            return UNTITLED;
        }
        return HeadingTextNormalizer.collapseWhitespace(String.join(" ", candidates));
    }
}
