package com.example.pdfoutline.service;

import com.example.pdfoutline.model.FontSizeProfile;
import com.example.pdfoutline.model.Span;
import com.example.pdfoutline.source.SpanSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Builds the frequency table of rounded font sizes over a whole document.
 */
@Component
public class FontSizeProfiler {

    private static final Logger logger = LoggerFactory.getLogger(FontSizeProfiler.class);

    /**
     * Profiles every span of every page, unclipped and in content order.
     *
     * @return empty when the document has no spans at all
     */
    public Optional<FontSizeProfile> profile(SpanSource source) throws IOException {
        List<Span> spans = new ArrayList<>();
        for (int p = 1; p <= source.getPageCount(); p++) {
            spans.addAll(source.readPage(p, null, false).spans());
        }
        return profile(spans);
    }

    public Optional<FontSizeProfile> profile(List<Span> spans) {
        // Insertion order decides ties: the size seen first wins
        Map<Integer, Integer> freq = new LinkedHashMap<>();
        for (Span span : spans) {
            freq.merge(FontSizeProfile.round(span.getSize()), 1, Integer::sum);
        }
        if (freq.isEmpty()) {
            return Optional.empty();
        }

        int bodySize = 0;
        int bestCount = -1;
        for (Map.Entry<Integer, Integer> e : freq.entrySet()) {
            if (e.getValue() > bestCount) {
                bodySize = e.getKey();
                bestCount = e.getValue();
            }
        }

        final int body = bodySize;
        List<Integer> headingSizes = freq.keySet().stream()
                .filter(size -> size > body)
                .sorted(Comparator.reverseOrder())
                .limit(FontSizeProfile.MAX_RANKED_SIZES)
                .collect(Collectors.toList());

        FontSizeProfile profile = new FontSizeProfile(bodySize, headingSizes);
        logger.debug("Font size histogram {} -> {}", freq, profile);
        return Optional.of(profile);
    }
}
