package com.williamcallahan.latexpreview.domain.latex;

import java.util.Locale;
import java.util.Optional;

/**
 * Layout category inferred for a diagram, which drives the scale and spacing options synthesized for it.
 */
public enum DiagramIntent {
    /** Many small nodes that must be shrunk to fit the page width. */
    COMPACT,
    /** Default layout; options are left close to what the source asked for. */
    MEDIUM,
    /** Sparse or text-heavy layout that needs its grid and node spacing inflated. */
    LARGE,
    /** Timeline-style layout whose aspect ratio must be rebalanced. */
    FLAT,
    /** Wide horizontal pipeline scaled down uniformly to the page width. */
    WIDE;

    /**
     * Resolves an intent from a configuration token.
     *
     * @param token intent name, case-insensitive
     * @return matching intent when recognized
     */
    public static Optional<DiagramIntent> fromToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String normalized = token.trim().toUpperCase(Locale.ROOT);
        for (DiagramIntent intent : values()) {
            if (intent.name().equals(normalized)) {
                return Optional.of(intent);
            }
        }
        return Optional.empty();
    }
}
