package com.example.pdfoutline.exception;

/**
 * A document could not be read or processed.
 */
public class OutlineExtractionException extends RuntimeException {

    private final String sourceName;

    public OutlineExtractionException(String sourceName, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
