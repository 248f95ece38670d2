package com.example.pdfoutline.service;

import com.example.pdfoutline.model.DocumentOutline;
import com.example.pdfoutline.model.OutlineEntry;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfOutline;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.kernel.pdf.navigation.PdfExplicitDestination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Writes a detected outline into a PDF as nested bookmarks.
 */
@Service
public class PdfBookmarkWriterService {

    private static final Logger logger = LoggerFactory.getLogger(PdfBookmarkWriterService.class);

    public byte[] addBookmarks(byte[] pdfBytes, DocumentOutline outline) throws IOException {
        if (outline.getOutline().isEmpty()) {
            return pdfBytes;
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (PdfDocument pdf = new PdfDocument(new PdfReader(new ByteArrayInputStream(pdfBytes)), new PdfWriter(out))) {
            PdfOutline root = pdf.getOutlines(false);

            // Open bookmark per depth; depth 0 is the root
            Map<Integer, PdfOutline> levelMap = new HashMap<>();
            levelMap.put(0, root);

            for (OutlineEntry entry : outline.getOutline()) {
                if (entry.getPage() < 1 || entry.getPage() > pdf.getNumberOfPages()) {
                    logger.warn("Skipping bookmark \"{}\": page {} out of range", entry.getText(), entry.getPage());
                    continue;
                }
                int depth = entry.getLevel().getDepth();

                // Attach to the closest shallower open bookmark
                PdfOutline parent = root;
                for (int l = depth - 1; l >= 0; l--) {
                    if (levelMap.containsKey(l)) {
                        parent = levelMap.get(l);
                        break;
                    }
                }

                PdfOutline current = parent.addOutline(entry.getText());
                PdfPage page = pdf.getPage(entry.getPage());
                current.addDestination(PdfExplicitDestination.createFitH(page, page.getPageSize().getTop()));

                levelMap.put(depth, current);
                levelMap.keySet().removeIf(k -> k > depth);
            }
        }
        return out.toByteArray();
    }
}
