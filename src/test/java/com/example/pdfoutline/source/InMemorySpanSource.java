package com.example.pdfoutline.source;

import com.example.pdfoutline.model.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Span source over hand-built pages. Reading order sorts blocks by bottom edge, then left edge.
 */
public class InMemorySpanSource implements SpanSource {
    public static final float PAGE_WIDTH = 612f;
    public static final float PAGE_HEIGHT = 792f;

    private final List<PageLayout> pages;

    public InMemorySpanSource(List<PageLayout> pages) {
        this.pages = pages;
    }

    public static InMemorySpanSource of(PageLayout... pages) {
        return new InMemorySpanSource(Arrays.asList(pages));
    }

    @Override
    public int getPageCount() {
        return pages.size();
    }

    @Override
    public BoundingBox getPageBounds(int pageNumber) {
        PageLayout page = pages.get(pageNumber - 1);
        return new BoundingBox(0, 0, page.getWidth(), page.getHeight());
    }

    @Override
    public PageLayout readPage(int pageNumber, BoundingBox clip, boolean sortByPosition) {
        PageLayout page = pages.get(pageNumber - 1).clip(clip);
        if (!sortByPosition) {
            return page;
        }
        List<TextBlock> blocks = new ArrayList<>(page.getBlocks());
        blocks.sort(Comparator.comparing((TextBlock b) -> b.getBbox().getY1())
                .thenComparing(b -> b.getBbox().getX0()));
        return new PageLayout(page.getPageNumber(), page.getWidth(), page.getHeight(), blocks);
    }

    /* ---------- builders ---------- */

    public static PageLayout page(int number, TextBlock... blocks) {
        return new PageLayout(number, PAGE_WIDTH, PAGE_HEIGHT, Arrays.asList(blocks));
    }

    public static TextBlock block(TextLine... lines) {
        return new TextBlock(Arrays.asList(lines));
    }

    public static TextLine line(Span... spans) {
        return new TextLine(Arrays.asList(spans));
    }

    /**
     * Single-span line starting at the left margin with its top edge at {@code top}.
     */
    public static TextLine line(String text, float size, boolean bold, float top) {
        return line(span(text, size, bold, 72f, top));
    }

    /**
     * Block holding one single-span line.
     */
    public static TextBlock textBlock(String text, float size, boolean bold, float top) {
        return block(line(text, size, bold, top));
    }

    public static Span span(String text, float size, boolean bold, float x, float top) {
        float width = text.length() * size * 0.5f;
        String font = bold ? "Helvetica-Bold" : "Helvetica";
        return new Span(text, size, font, bold, new BoundingBox(x, top, x + width, top + size));
    }
}
