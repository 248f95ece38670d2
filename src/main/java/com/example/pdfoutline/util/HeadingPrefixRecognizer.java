package com.example.pdfoutline.util;

import com.example.pdfoutline.model.LineShape;

/**
 * Recognizes numbering prefixes at the start of a line:
 * <ul>
 *   <li>a dotted digit sequence: {@code 1}, {@code 1.2}, {@code 1.2.3} ...</li>
 *   <li>{@code Chapter} followed by one whitespace character and digits</li>
 *   <li>{@code Appendix} followed by one whitespace character and one word character</li>
 * </ul>
 * Leading whitespace is skipped. The same scanner drives classification and prefix stripping.
 */
public final class HeadingPrefixRecognizer {

    private static final String CHAPTER = "Chapter";
    private static final String APPENDIX = "Appendix";

    private HeadingPrefixRecognizer() {
    }

    public static LineShape recognize(String text, boolean bold) {
        if (!bold) {
            return LineShape.noMatch();
        }
        if (prefixEnd(text, true) < 0) {
            return LineShape.plainBold();
        }
        return LineShape.numbered(countDots(text));
    }

    /**
     * Removes a leading numbering prefix together with the run of '.', whitespace and '-'
     * right after it. Text without a prefix is returned unchanged. No separator is required here,
     * so "2024Report" loses "2024".
     */
    public static String stripPrefix(String text) {
        int end = prefixEnd(text, false);
        if (end < 0) {
            return text;
        }
        while (end < text.length() && isSeparator(text.charAt(end))) {
            end++;
        }
        return text.substring(end);
    }

    /**
     * Index just past the numbering token, or -1 when there is none.
     * With {@code requireSeparator} a dotted sequence falls back to a shorter sequence
     * when the longest one is not followed by a separator, e.g. "1" in "1.2a".
     */
    static int prefixEnd(String text, boolean requireSeparator) {
        int i = 0;
        while (i < text.length() && isSpace(text.charAt(i))) {
            i++;
        }
        if (i >= text.length()) {
            return -1;
        }

        if (Character.isDigit(text.charAt(i))) {
            return dottedNumberEnd(text, i, requireSeparator);
        }
        if (text.startsWith(CHAPTER, i)) {
            int j = i + CHAPTER.length();
            if (j < text.length() && isSpace(text.charAt(j))) {
                int digitsEnd = digitRunEnd(text, j + 1);
                if (digitsEnd > j + 1) {
                    return accept(text, digitsEnd, requireSeparator);
                }
            }
            return -1;
        }
        if (text.startsWith(APPENDIX, i)) {
            int j = i + APPENDIX.length();
            if (j + 1 < text.length() && isSpace(text.charAt(j)) && isWordChar(text.charAt(j + 1))) {
                return accept(text, j + 2, requireSeparator);
            }
            return -1;
        }
        return -1;
    }

    private static int dottedNumberEnd(String text, int start, boolean requireSeparator) {
        int end = digitRunEnd(text, start);
        int best = accept(text, end, requireSeparator);
        while (end + 1 < text.length() && text.charAt(end) == '.' && Character.isDigit(text.charAt(end + 1))) {
            end = digitRunEnd(text, end + 1);
            int candidate = accept(text, end, requireSeparator);
            if (candidate >= 0) {
                best = candidate;
            }
        }
        return best;
    }

    private static int accept(String text, int end, boolean requireSeparator) {
        if (!requireSeparator) {
            return end;
        }
        return end < text.length() && isSeparator(text.charAt(end)) ? end : -1;
    }

    private static int digitRunEnd(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isDigit(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isSeparator(char c) {
        return c == '.' || c == '-' || isSpace(c);
    }

    // Includes no-break spaces
    private static boolean isSpace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    static int countDots(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '.') count++;
        }
        return count;
    }
}
