package com.williamcallahan.latexpreview.domain.latex;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Accepts raw LaTeX input for server-side conversion.
 */
public record LatexRenderRequest(String content) {

    /**
     * Creates a request while normalizing null content to an empty string.
     *
     * @param content LaTeX input text
     * @return normalized render request
     */
    @JsonCreator
    public static LatexRenderRequest create(@JsonProperty("content") String content) {
        return new LatexRenderRequest(content == null ? "" : content);
    }

    public LatexRenderRequest {
        Objects.requireNonNull(content, "LaTeX content cannot be null");
    }

    /**
     * Indicates whether the request contains any non-blank LaTeX.
     *
     * @return true when the content is blank
     */
    public boolean isBlank() {
        return content.isBlank();
    }
}
