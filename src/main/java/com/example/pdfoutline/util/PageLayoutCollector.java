package com.example.pdfoutline.util;

import com.example.pdfoutline.model.BoundingBox;
import com.example.pdfoutline.model.Span;
import com.example.pdfoutline.model.TextBlock;
import com.example.pdfoutline.model.TextLine;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.util.*;

/**
 * Collects text with font size, boldness and position into blocks, lines and spans.
 * Consecutive glyphs sharing a font and size form one span, a line separator closes the line
 * and a paragraph boundary closes the block.
 */
public class PageLayoutCollector extends PDFTextStripper {
    private final BoundingBox clip;
    private final List<TextBlock> blocks = new ArrayList<>();
    private final List<TextLine> currentBlock = new ArrayList<>();
    private final List<Span> currentLine = new ArrayList<>();

    private StringBuilder spanText = new StringBuilder();
    private String spanFont;
    private float spanSize;
    private BoundingBox spanBox;
    private boolean pendingSpace = false;

    /**
     * @param clip glyphs whose centre falls outside this region are ignored, {@code null} keeps all
     */
    public PageLayoutCollector(BoundingBox clip) throws IOException {
        super();
        this.clip = clip;
    }

    /**
     * Bold when the font name carries a "bold" marker, case-insensitive.
     */
    public static boolean isBoldFont(String fontName) {
        return fontName != null && fontName.toLowerCase(Locale.ROOT).contains("bold");
    }

    @Override
    protected void processTextPosition(TextPosition text) {
        if (clip != null) {
            float centerX = text.getXDirAdj() + text.getWidthDirAdj() / 2f;
            float centerY = text.getYDirAdj() - text.getHeightDir() / 2f;
            if (!clip.contains(centerX, centerY)) return;
        }
        super.processTextPosition(text);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) {
        for (TextPosition position : textPositions) {
            String unicode = position.getUnicode();
            if (unicode == null || unicode.isEmpty()) continue;

            PDFont font = position.getFont();
            String fontName = font != null ? font.getName() : null;
            float size = position.getFontSizeInPt();

            // Style change starts a new span
            if (spanText.length() > 0 && (!Objects.equals(fontName, spanFont) || Float.compare(size, spanSize) != 0)) {
                flushSpan();
            }
            if (spanText.length() == 0) {
                spanFont = fontName;
                spanSize = size;
            } else if (pendingSpace) {
                spanText.append(' ');
            }
            pendingSpace = false;
            spanText.append(unicode);

            float top = position.getYDirAdj() - position.getHeightDir();
            BoundingBox glyph = new BoundingBox(position.getXDirAdj(), top,
                    position.getXDirAdj() + position.getWidthDirAdj(), position.getYDirAdj());
            spanBox = glyph.union(spanBox);
        }
    }

    @Override
    protected void writeWordSeparator() {
        pendingSpace = true;
    }

    @Override
    protected void writeLineSeparator() {
        flushLine();
    }

    @Override
    protected void writeParagraphStart() {
        flushBlock();
    }

    @Override
    protected void writeParagraphEnd() {
        flushBlock();
    }

    @Override
    protected void writePageEnd() {
        flushBlock();
    }

    private void flushSpan() {
        if (spanText.length() > 0) {
            currentLine.add(new Span(spanText.toString(), spanSize, spanFont, isBoldFont(spanFont), spanBox));
        }
        spanText = new StringBuilder();
        spanFont = null;
        spanSize = 0;
        spanBox = null;
        pendingSpace = false;
    }

    private void flushLine() {
        flushSpan();
        if (!currentLine.isEmpty()) {
            currentBlock.add(new TextLine(currentLine));
            currentLine.clear();
        }
    }

    private void flushBlock() {
        flushLine();
        if (!currentBlock.isEmpty()) {
            blocks.add(new TextBlock(currentBlock));
            currentBlock.clear();
        }
    }

    public List<TextBlock> getBlocks() {
        flushBlock();
        return blocks;
    }
}
