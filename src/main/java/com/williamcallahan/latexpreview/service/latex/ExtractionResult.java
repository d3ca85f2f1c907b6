package com.williamcallahan.latexpreview.service.latex;

import java.util.Map;
import java.util.Objects;

/**
 * Output of one extraction stage: the rewritten buffer and the fragments the stage registered.
 *
 * @param text buffer with extracted regions replaced by tokens
 * @param blocks token to fragment entries added by this stage
 */
public record ExtractionResult(String text, Map<String, String> blocks) {
    public ExtractionResult {
        Objects.requireNonNull(text, "Extraction text cannot be null");
        blocks = blocks == null ? Map.of() : Map.copyOf(blocks);
    }
}
