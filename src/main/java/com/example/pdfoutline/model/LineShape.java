package com.example.pdfoutline.model;

/**
 * What a line looks like to the heading classifier before any size rule is applied.
 */
public final class LineShape {

    public enum Kind {
        /** Bold line opening with a numbering prefix such as "1.2", "Chapter 3" or "Appendix B". */
        NUMBERED_HEADING,
        /** Bold line without a numbering prefix. */
        PLAIN_BOLD,
        /** Not bold, never a heading. */
        NO_MATCH
    }

    private static final LineShape PLAIN_BOLD = new LineShape(Kind.PLAIN_BOLD, 0);
    private static final LineShape NO_MATCH = new LineShape(Kind.NO_MATCH, 0);

    private final Kind kind;
    private final int dotCount;

    private LineShape(Kind kind, int dotCount) {
        this.kind = kind;
        this.dotCount = dotCount;
    }

    public static LineShape numbered(int dotCount) {
        return new LineShape(Kind.NUMBERED_HEADING, dotCount);
    }

    public static LineShape plainBold() {
        return PLAIN_BOLD;
    }

    public static LineShape noMatch() {
        return NO_MATCH;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Number of '.' characters in the whole line, not only in its prefix.
     */
    public int getDotCount() {
        return dotCount;
    }

    @Override
    public String toString() {
        return kind == Kind.NUMBERED_HEADING ? kind + "{dots=" + dotCount + "}" : kind.toString();
    }
}
