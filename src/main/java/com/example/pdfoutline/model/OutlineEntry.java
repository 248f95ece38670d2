package com.example.pdfoutline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"level", "text", "page"})
public class OutlineEntry {
    private final HeadingLevel level;
    private final String text;
    private final int page;

    @JsonCreator
    public OutlineEntry(@JsonProperty("level") HeadingLevel level,
                        @JsonProperty("text") String text,
                        @JsonProperty("page") int page) {
        this.level = level;
        this.text = text;
        this.page = page;
    }

    public HeadingLevel getLevel() {
        return level;
    }

    public String getText() {
        return text;
    }

    public int getPage() {
        return page;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OutlineEntry)) return false;
        OutlineEntry that = (OutlineEntry) o;
        return page == that.page && level == that.level && Objects.equals(text, that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, text, page);
    }

    @Override
    public String toString() {
        return level + " \"" + text + "\" p." + page;
    }
}
