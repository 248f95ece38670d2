package com.example.pdfoutline.model;

import java.util.List;
import java.util.stream.Collectors;

public class TextLine {
    private final List<Span> spans;

    public TextLine(List<Span> spans) {
        this.spans = List.copyOf(spans);
    }

    public List<Span> getSpans() {
        return spans;
    }

    public boolean isEmpty() {
        return spans.isEmpty();
    }

    /**
     * Span texts joined with single spaces, untrimmed.
     */
    public String getText() {
        return spans.stream().map(Span::getText).collect(Collectors.joining(" "));
    }

    // Size and weight of a line are those of its first span
    public float getFontSize() {
        return spans.isEmpty() ? 0f : spans.get(0).getSize();
    }

    public boolean isBold() {
        return !spans.isEmpty() && spans.get(0).isBold();
    }

    public BoundingBox getBbox() {
        BoundingBox box = null;
        for (Span span : spans) {
            box = span.getBbox().union(box);
        }
        return box;
    }
}
