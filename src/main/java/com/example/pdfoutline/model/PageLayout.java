package com.example.pdfoutline.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Text geometry of one page: blocks of lines of spans, in the order the span source delivered them.
 */
public class PageLayout {
    private final int pageNumber;
    private final float width;
    private final float height;
    private final List<TextBlock> blocks;

    public PageLayout(int pageNumber, float width, float height, List<TextBlock> blocks) {
        this.pageNumber = pageNumber;
        this.width = width;
        this.height = height;
        this.blocks = List.copyOf(blocks);
    }

    /** 1-based. */
    public int getPageNumber() {
        return pageNumber;
    }

    public float getWidth() {
        return width;
    }

    public float getHeight() {
        return height;
    }

    public List<TextBlock> getBlocks() {
        return blocks;
    }

    public List<Span> spans() {
        List<Span> spans = new ArrayList<>();
        for (TextBlock block : blocks) {
            for (TextLine line : block.getLines()) {
                spans.addAll(line.getSpans());
            }
        }
        return spans;
    }

    /**
     * Restricts the page to a region. A span is kept when the centre of its box lies inside the region;
     * lines and blocks left without spans are dropped.
     */
    public PageLayout clip(BoundingBox region) {
        if (region == null) return this;
        List<TextBlock> kept = new ArrayList<>();
        for (TextBlock block : blocks) {
            List<TextLine> lines = new ArrayList<>();
            for (TextLine line : block.getLines()) {
                List<Span> spans = new ArrayList<>();
                for (Span span : line.getSpans()) {
                    BoundingBox box = span.getBbox();
                    if (region.contains(box.getCenterX(), box.getCenterY())) {
                        spans.add(span);
                    }
                }
                if (!spans.isEmpty()) lines.add(new TextLine(spans));
            }
            if (!lines.isEmpty()) kept.add(new TextBlock(lines));
        }
        return new PageLayout(pageNumber, width, height, kept);
    }
}
