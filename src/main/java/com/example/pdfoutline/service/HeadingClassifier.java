package com.example.pdfoutline.service;

import com.example.pdfoutline.model.FontSizeProfile;
import com.example.pdfoutline.model.HeadingLevel;
import com.example.pdfoutline.model.LineShape;
import com.example.pdfoutline.model.TextLine;
import com.example.pdfoutline.util.HeadingPrefixRecognizer;
import com.example.pdfoutline.util.HeadingTextNormalizer;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Decides whether a line is a heading and at which level.
 * <p>
 * Rules, first match wins:
 * <ol>
 *   <li>bold and numbered: H(dots + 2), clamped to H2..H4, where dots counts every '.' of the line</li>
 *   <li>bold at one of the ranked heading sizes: the level of that rank</li>
 *   <li>bold, larger than body text and under 10 words: H3</li>
 * </ol>
 * Lines shorter than 3 characters or already accepted as title or heading are rejected first.
 * The classifier only reads the assembler; recording an accepted line is up to the caller.
 */
@Component
public class HeadingClassifier {

    static final int MIN_TEXT_LENGTH = 3;
    static final int MAX_FALLBACK_WORDS = 10;

    public Optional<HeadingLevel> classify(TextLine line, FontSizeProfile profile, OutlineAssembler assembler) {
        return classify(line.getText(), line.getFontSize(), line.isBold(), profile, assembler);
    }

    public Optional<HeadingLevel> classify(String rawText, float fontSize, boolean bold,
                                           FontSizeProfile profile, OutlineAssembler assembler) {
        String lineText = HeadingTextNormalizer.trim(rawText);
        if (lineText.isEmpty()
                || lineText.codePointCount(0, lineText.length()) < MIN_TEXT_LENGTH
                || assembler.isKnown(lineText)) {
            return Optional.empty();
        }

        LineShape shape = HeadingPrefixRecognizer.recognize(lineText, bold);
        if (shape.getKind() == LineShape.Kind.NO_MATCH) {
            return Optional.empty();
        }
        if (shape.getKind() == LineShape.Kind.NUMBERED_HEADING) {
            int depth = Math.min(Math.max(2, shape.getDotCount() + 2), 4);
            return Optional.of(HeadingLevel.ofDepth(depth));
        }

        int roundedSize = FontSizeProfile.round(fontSize);
        Optional<HeadingLevel> ranked = profile.levelFor(roundedSize);
        if (ranked.isPresent()) {
            return ranked;
        }

        if (roundedSize > profile.getBodySize()
                && HeadingTextNormalizer.wordCount(lineText) < MAX_FALLBACK_WORDS) {
            return Optional.of(HeadingLevel.H3);
        }
        return Optional.empty();
    }
}
