package com.example.pdfoutline.model;

public enum HeadingLevel {
    H1, H2, H3, H4;

    public int getDepth() {
        return ordinal() + 1;
    }

    /**
     * Level for a nesting depth, clamped to H1..H4.
     */
    public static HeadingLevel ofDepth(int depth) {
        int clamped = Math.min(Math.max(depth, 1), values().length);
        return values()[clamped - 1];
    }
}
