package com.williamcallahan.latexpreview.domain.latex;

import java.util.Map;
import java.util.Objects;

/**
 * Structured conversion result: tokenized HTML plus the fragments its tokens stand for.
 */
public record LatexRenderOutcome(
    String html,
    Map<String, String> blocks,
    String bibliographyHtml,
    boolean hasBibliography,
    DocumentMetadata metadata,
    long processingTimeMs,
    boolean truncated
) implements LatexRenderResponse {

    public LatexRenderOutcome {
        Objects.requireNonNull(html, "Rendered HTML cannot be null");
        Objects.requireNonNull(blocks, "Blocks cannot be null");
        Objects.requireNonNull(bibliographyHtml, "Bibliography HTML cannot be null");
        Objects.requireNonNull(metadata, "Metadata cannot be null");
        if (processingTimeMs < 0) {
            throw new IllegalArgumentException("Processing time must be non-negative");
        }
    }

    public static LatexRenderOutcome from(RenderedDocument document) {
        return new LatexRenderOutcome(document.html(), document.blocks(), document.bibliographyHtml(),
            document.hasBibliography(), document.metadata(), document.processingTimeMs(), document.truncated());
    }
}
