package com.example.pdfoutline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Title and headings of one document, headings in page-then-reading order.
 */
@JsonPropertyOrder({"title", "outline"})
public class DocumentOutline {
    private final String title;
    private final List<OutlineEntry> outline;

    @JsonCreator
    public DocumentOutline(@JsonProperty("title") String title,
                           @JsonProperty("outline") List<OutlineEntry> outline) {
        this.title = title;
        this.outline = outline == null ? List.of() : List.copyOf(outline);
    }

    public static DocumentOutline withoutHeadings(String title) {
        return new DocumentOutline(title, List.of());
    }

    public String getTitle() {
        return title;
    }

    public List<OutlineEntry> getOutline() {
        return outline;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DocumentOutline)) return false;
        DocumentOutline that = (DocumentOutline) o;
        return Objects.equals(title, that.title) && outline.equals(that.outline);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, outline);
    }
}
