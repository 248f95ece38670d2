package com.example.pdfoutline.model;

import java.util.List;

public class TextBlock {
    private final List<TextLine> lines;

    public TextBlock(List<TextLine> lines) {
        this.lines = List.copyOf(lines);
    }

    public List<TextLine> getLines() {
        return lines;
    }

    public BoundingBox getBbox() {
        BoundingBox box = null;
        for (TextLine line : lines) {
            BoundingBox lineBox = line.getBbox();
            if (lineBox != null) {
                box = lineBox.union(box);
            }
        }
        return box;
    }
}
