package com.williamcallahan.latexpreview.config;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Render cache sizing for the preview service.
 */
public class RenderCache {

    private static final long SIZE_DEF = 500L;
    private static final Duration TTL_DEF = Duration.ofMinutes(30);
    private static final String SIZE_KEY = "app.preview.cache.size";
    private static final String TTL_KEY = "app.preview.cache.ttl";
    private static final String NON_NEG_FMT = "%s must be 0 or greater.";
    private static final String POSITIVE_FMT = "%s must be a positive duration.";

    private long size = SIZE_DEF;
    private Duration ttl = TTL_DEF;

    /**
     * Creates render cache configuration.
     */
    public RenderCache() {
    }

    /**
     * Validates cache settings.
     */
    public void validateConfiguration() {
        if (size < 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NON_NEG_FMT, SIZE_KEY));
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, TTL_KEY));
        }
    }

    /**
     * Returns the maximum number of cached renders.
     *
     * @return maximum cache entries
     */
    public long getSize() {
        return size;
    }

    public void setSize(long size) {
        this.size = size;
    }

    /**
     * Returns how long a cached render stays valid after being written.
     *
     * @return time to live
     */
    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = Objects.requireNonNull(ttl, "Cache TTL cannot be null");
    }
}
