package com.example.pdfoutline.service;

import com.example.pdfoutline.exception.OutlineExtractionException;
import com.example.pdfoutline.model.*;
import com.example.pdfoutline.source.PdfBoxSpanSource;
import com.example.pdfoutline.source.SpanSource;
import com.example.pdfoutline.util.HeadingTextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Builds the title and heading outline of a document.
 * <p>
 * Pipeline: title from page one, font size profile over all pages, then every line inside the
 * 10%..90% band of each page through the heading classifier.
 */
@Service
public class OutlineExtractionService {

    private static final Logger logger = LoggerFactory.getLogger(OutlineExtractionService.class);

    public static final String EMPTY_DOCUMENT = "Empty Document";

    // Vertical band considered for headings, as fractions of the page height
    static final float BAND_TOP = 0.1f;
    static final float BAND_BOTTOM = 0.9f;

    private final FontSizeProfiler fontSizeProfiler;
    private final TitleDetector titleDetector;
    private final HeadingClassifier headingClassifier;

    public OutlineExtractionService(FontSizeProfiler fontSizeProfiler,
                                    TitleDetector titleDetector,
                                    HeadingClassifier headingClassifier) {
        this.fontSizeProfiler = fontSizeProfiler;
        this.titleDetector = titleDetector;
        this.headingClassifier = headingClassifier;
    }

    /* ======================= PDF entry points ======================= */

    public DocumentOutline extract(MultipartFile file) {
        String name = file.getOriginalFilename();
        try (InputStream in = file.getInputStream();
             SpanSource source = PdfBoxSpanSource.load(in)) {
            return extract(source);
        } catch (IOException e) {
            throw new OutlineExtractionException(name, "Failed to read PDF " + name + ": " + e.getMessage(), e);
        }
    }

    public DocumentOutline extract(Path pdfPath) {
        String name = String.valueOf(pdfPath.getFileName());
        try (SpanSource source = PdfBoxSpanSource.load(pdfPath.toFile())) {
            return extract(source);
        } catch (IOException e) {
            throw new OutlineExtractionException(name, "Failed to read PDF " + name + ": " + e.getMessage(), e);
        }
    }

    public DocumentOutline extract(byte[] pdfBytes, String name) {
        try (SpanSource source = PdfBoxSpanSource.load(pdfBytes)) {
            return extract(source);
        } catch (IOException e) {
            throw new OutlineExtractionException(name, "Failed to read PDF " + name + ": " + e.getMessage(), e);
        }
    }

    /* ======================= Core pipeline ======================= */

    /**
     * Runs the whole pipeline over one document. The source is not closed.
     */
    public DocumentOutline extract(SpanSource source) throws IOException {
        int pageCount = source.getPageCount();
        if (pageCount == 0) {
            return DocumentOutline.withoutHeadings(EMPTY_DOCUMENT);
        }

        String title = titleDetector.detectTitle(source.readPage(1));

        Optional<FontSizeProfile> profile = fontSizeProfiler.profile(source);
        if (profile.isEmpty()) {
            logger.debug("No text spans in document, outline left empty");
            return DocumentOutline.withoutHeadings(title);
        }

        OutlineAssembler assembler = new OutlineAssembler(title);
        for (int p = 1; p <= pageCount; p++) {
            collectHeadings(source, p, profile.get(), assembler);
        }

        logger.debug("Title \"{}\", {} headings over {} pages", title, assembler.getEntries().size(), pageCount);
        return assembler.build();
    }

    private void collectHeadings(SpanSource source, int pageNumber, FontSizeProfile profile,
                                 OutlineAssembler assembler) throws IOException {
        BoundingBox bounds = source.getPageBounds(pageNumber);
        float height = bounds.getY1();
        BoundingBox band = new BoundingBox(0, height * BAND_TOP, bounds.getX1(), height * BAND_BOTTOM);

        PageLayout page = source.readPage(pageNumber, band, true);
        for (TextBlock block : page.getBlocks()) {
            for (TextLine line : block.getLines()) {
                if (line.isEmpty()) continue;
                String lineText = HeadingTextNormalizer.trim(line.getText());

                Optional<HeadingLevel> level = headingClassifier.classify(line, profile, assembler);
                if (level.isPresent()) {
                    String text = HeadingTextNormalizer.normalize(lineText);
                    OutlineEntry entry = assembler.accept(level.get(), text, pageNumber, lineText);
                    logger.debug("Heading {}", entry);
                }
            }
        }
    }
}
