package com.williamcallahan.latexpreview.domain.latex;

import java.util.Objects;

/**
 * Fully resolved preview HTML, ready to display.
 */
public record LatexPreviewOutcome(String html, DocumentMetadata metadata) implements LatexPreviewResponse {
    public LatexPreviewOutcome {
        Objects.requireNonNull(html, "Preview HTML cannot be null");
        Objects.requireNonNull(metadata, "Metadata cannot be null");
    }
}
