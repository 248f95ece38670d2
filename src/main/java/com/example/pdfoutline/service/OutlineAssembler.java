package com.example.pdfoutline.service;

import com.example.pdfoutline.model.DocumentOutline;
import com.example.pdfoutline.model.HeadingLevel;
import com.example.pdfoutline.model.OutlineEntry;

import java.util.*;

/**
 * Per-document outline state: accepted entries in encounter order and the lowercase texts
 * already used as title or heading. One instance per document, never shared.
 */
public class OutlineAssembler {
    private final String title;
    private final Set<String> knownTexts = new HashSet<>();
    private final List<OutlineEntry> entries = new ArrayList<>();

    public OutlineAssembler(String title) {
        this.title = title;
        knownTexts.add(key(title));
    }

    public boolean isKnown(String lineText) {
        return knownTexts.contains(key(lineText));
    }

    /**
     * @param lineText the raw line the entry came from; a verbatim repeat of it is never accepted again
     */
    public OutlineEntry accept(HeadingLevel level, String text, int page, String lineText) {
        OutlineEntry entry = new OutlineEntry(level, text, page);
        entries.add(entry);
        knownTexts.add(key(lineText));
        return entry;
    }

    public List<OutlineEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public DocumentOutline build() {
        return new DocumentOutline(title, entries);
    }

    private static String key(String text) {
        return text.toLowerCase(Locale.ROOT);
    }
}
