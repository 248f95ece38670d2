package com.example.pdfoutline.model;

/**
 * A run of text sharing one font and size inside a line.
 */
public class Span {
    private final String text;
    private final float size;
    private final String fontName;
    private final boolean bold;
    private final BoundingBox bbox;

    public Span(String text, float size, String fontName, boolean bold, BoundingBox bbox) {
        this.text = text;
        this.size = size;
        this.fontName = fontName;
        this.bold = bold;
        this.bbox = bbox;
    }

    public String getText() {
        return text;
    }

    public float getSize() {
        return size;
    }

    public String getFontName() {
        return fontName;
    }

    /**
     * Whether the span renders as bold. Decided by the span source that produced it.
     */
    public boolean isBold() {
        return bold;
    }

    public BoundingBox getBbox() {
        return bbox;
    }

    @Override
    public String toString() {
        return String.format("Size=%.2f, Bold=%b, Font=%s: \"%s\"", size, bold, fontName, text);
    }
}
