package com.example.pdfoutline.util;

import java.util.regex.Pattern;

public final class HeadingTextNormalizer {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern OUTER_WHITESPACE = Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);

    private HeadingTextNormalizer() {
    }

    /**
     * Display text of a heading: numbering prefix and its separators removed, whitespace collapsed.
     */
    public static String normalize(String lineText) {
        return collapseWhitespace(HeadingPrefixRecognizer.stripPrefix(lineText));
    }

    /**
     * Removes leading and trailing Unicode whitespace, no-break spaces included.
     */
    public static String trim(String text) {
        return OUTER_WHITESPACE.matcher(text).replaceAll("");
    }

    public static String collapseWhitespace(String text) {
        return WHITESPACE_RUN.matcher(text).replaceAll(" ").strip();
    }

    /**
     * Whitespace-separated word count.
     */
    public static int wordCount(String text) {
        String collapsed = collapseWhitespace(text);
        return collapsed.isEmpty() ? 0 : collapsed.split(" ").length;
    }
}
