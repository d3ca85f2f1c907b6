package com.williamcallahan.latexpreview.service.latex;

import java.util.Objects;

/**
 * Output of the citation stage.
 *
 * @param text buffer with citations replaced by numeric markers
 * @param bibliographyHtml rendered reference list, empty when none was produced
 * @param hasBibliography whether a reference list was produced
 */
public record CitationResult(String text, String bibliographyHtml, boolean hasBibliography) {
    public CitationResult {
        Objects.requireNonNull(text, "Citation text cannot be null");
        bibliographyHtml = bibliographyHtml == null ? "" : bibliographyHtml;
        if (hasBibliography && bibliographyHtml.isEmpty()) {
            throw new IllegalArgumentException("Bibliography flag set without bibliography HTML");
        }
    }
}
