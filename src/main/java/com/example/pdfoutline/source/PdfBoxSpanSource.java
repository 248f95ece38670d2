package com.example.pdfoutline.source;

import com.example.pdfoutline.model.BoundingBox;
import com.example.pdfoutline.model.PageLayout;
import com.example.pdfoutline.util.PageLayoutCollector;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * {@link SpanSource} backed by a PDFBox document. Closing the source closes the document.
 */
public class PdfBoxSpanSource implements SpanSource {

    private final PDDocument document;

    public PdfBoxSpanSource(PDDocument document) {
        this.document = document;
    }

    public static PdfBoxSpanSource load(InputStream in) throws IOException {
        return new PdfBoxSpanSource(PDDocument.load(in));
    }

    public static PdfBoxSpanSource load(File file) throws IOException {
        return new PdfBoxSpanSource(PDDocument.load(file));
    }

    public static PdfBoxSpanSource load(byte[] bytes) throws IOException {
        return new PdfBoxSpanSource(PDDocument.load(bytes));
    }

    @Override
    public int getPageCount() {
        return document.getNumberOfPages();
    }

    @Override
    public BoundingBox getPageBounds(int pageNumber) {
        return pageBounds(document.getPage(pageNumber - 1));
    }

    @Override
    public PageLayout readPage(int pageNumber, BoundingBox clip, boolean sortByPosition) throws IOException {
        PageLayoutCollector collector = new PageLayoutCollector(clip);
        collector.setSortByPosition(sortByPosition);
        collector.setStartPage(pageNumber);
        collector.setEndPage(pageNumber);
        collector.getText(document);

        BoundingBox bounds = getPageBounds(pageNumber);
        return new PageLayout(pageNumber, bounds.getX1(), bounds.getY1(), collector.getBlocks());
    }

    @Override
    public void close() throws IOException {
        document.close();
    }

    static BoundingBox pageBounds(PDPage page) {
        PDRectangle box = page.getCropBox();
        int rotation = page.getRotation();
        if (rotation == 90 || rotation == 270) {
            return new BoundingBox(0, 0, box.getHeight(), box.getWidth());
        }
        return new BoundingBox(0, 0, box.getWidth(), box.getHeight());
    }
}
