package com.williamcallahan.latexpreview.domain.latex;

import java.util.Objects;

/**
 * Captures render cache statistics.
 */
public record LatexCacheStatsSnapshot(
    long hitCount,
    long missCount,
    long evictionCount,
    long size,
    String hitRate
) implements LatexCacheStatsResponse {
    public LatexCacheStatsSnapshot {
        Objects.requireNonNull(hitRate, "Hit rate string cannot be null");
        if (hitCount < 0 || missCount < 0 || evictionCount < 0 || size < 0) {
            throw new IllegalArgumentException("Cache stats must be non-negative");
        }
    }
}
