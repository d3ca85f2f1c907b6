package com.williamcallahan.latexpreview.domain.latex;

import java.util.Map;
import java.util.Objects;

/**
 * Result of converting one LaTeX document.
 *
 * <p>{@code html} still contains placeholder tokens; every token is a key of {@code blocks} and must be
 * substituted before display.</p>
 *
 * @param html converted body with placeholder tokens
 * @param blocks token to rendered fragment
 * @param bibliographyHtml reference list fragment, empty when none was produced
 * @param hasBibliography whether a reference list was produced
 * @param metadata title block fields
 * @param processingTimeMs conversion time
 * @param truncated whether the input was cut to the configured maximum length
 */
public record RenderedDocument(
    String html,
    Map<String, String> blocks,
    String bibliographyHtml,
    boolean hasBibliography,
    DocumentMetadata metadata,
    long processingTimeMs,
    boolean truncated
) {

    public RenderedDocument {
        Objects.requireNonNull(html, "HTML content cannot be null");
        blocks = blocks == null ? Map.of() : Map.copyOf(blocks);
        bibliographyHtml = bibliographyHtml == null ? "" : bibliographyHtml;
        metadata = metadata == null ? DocumentMetadata.none() : metadata;
        if (processingTimeMs < 0) {
            throw new IllegalArgumentException("Processing time must be non-negative");
        }
    }

    /**
     * Creates the result for empty input.
     *
     * @return document with no content
     */
    public static RenderedDocument empty() {
        return new RenderedDocument("", Map.of(), "", false, DocumentMetadata.none(), 0L, false);
    }

    /**
     * Returns a copy flagged as produced from truncated input.
     *
     * @return truncated copy
     */
    public RenderedDocument asTruncated() {
        return new RenderedDocument(html, blocks, bibliographyHtml, hasBibliography, metadata, processingTimeMs, true);
    }
}
