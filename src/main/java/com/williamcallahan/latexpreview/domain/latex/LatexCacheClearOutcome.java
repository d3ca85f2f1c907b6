package com.williamcallahan.latexpreview.domain.latex;

import java.util.Objects;

/**
 * Result of clearing the render cache.
 */
public record LatexCacheClearOutcome(String status, String message, long evicted) implements LatexCacheClearResponse {
    public LatexCacheClearOutcome {
        Objects.requireNonNull(status, "Cache clear status cannot be null");
        Objects.requireNonNull(message, "Cache clear message cannot be null");
        if (evicted < 0) {
            throw new IllegalArgumentException("Evicted entry count must be non-negative");
        }
    }
}
