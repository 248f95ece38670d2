package com.example.pdfoutline.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HeadingTextNormalizerTest {

    @Test
    void normalize_ShouldStripPrefixAndCollapseWhitespace() {
        assertEquals("Market Analysis", HeadingTextNormalizer.normalize("2.1   Market \t Analysis  "));
    }

    @Test
    void normalize_ShouldReturnEmpty_WhenLineIsOnlyNumbering() {
        assertEquals("", HeadingTextNormalizer.normalize("3.1."));
    }

    @Test
    void collapseWhitespace_ShouldTreatNoBreakSpaceAsWhitespace() {
        assertEquals("Annual Report", HeadingTextNormalizer.collapseWhitespace("\u00A0Annual\u00A0 Report\u00A0"));
    }

    @Test
    void trim_ShouldRemoveOuterNoBreakSpacesOnly() {
        assertEquals("Field\u00A0Guide", HeadingTextNormalizer.trim("\u202F Field\u00A0Guide\u2007\u00A0"));
        assertEquals("", HeadingTextNormalizer.trim("\u00A0 "));
    }

    @Test
    void wordCount_ShouldIgnoreRepeatedWhitespace() {
        assertEquals(3, HeadingTextNormalizer.wordCount("  one   two three "));
        assertEquals(0, HeadingTextNormalizer.wordCount("   "));
    }
}
