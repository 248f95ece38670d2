package com.example.pdfoutline.model;

import java.util.List;
import java.util.Optional;

/**
 * Rounded font sizes of a document: the body size and up to three larger heading sizes,
 * largest first. Heading sizes map to H1, H2, H3 by rank.
 */
public class FontSizeProfile {
    public static final int MAX_RANKED_SIZES = 3;

    private final int bodySize;
    private final List<Integer> headingSizes;

    public FontSizeProfile(int bodySize, List<Integer> headingSizes) {
        if (headingSizes.size() > MAX_RANKED_SIZES) {
            throw new IllegalArgumentException("At most " + MAX_RANKED_SIZES + " heading sizes, got " + headingSizes);
        }
        this.bodySize = bodySize;
        this.headingSizes = List.copyOf(headingSizes);
    }

    public int getBodySize() {
        return bodySize;
    }

    public List<Integer> getHeadingSizes() {
        return headingSizes;
    }

    public Optional<HeadingLevel> levelFor(int roundedSize) {
        int rank = headingSizes.indexOf(roundedSize);
        return rank < 0 ? Optional.empty() : Optional.of(HeadingLevel.values()[rank]);
    }

    /**
     * Rounds half to even, so 12.5 becomes 12 and 13.5 becomes 14.
     */
    public static int round(float size) {
        return (int) Math.rint(size);
    }

    @Override
    public String toString() {
        return "body=" + bodySize + ", headings=" + headingSizes;
    }
}
