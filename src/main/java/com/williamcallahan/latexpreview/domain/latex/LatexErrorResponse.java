package com.williamcallahan.latexpreview.domain.latex;

import java.util.Objects;

/**
 * Describes a LaTeX conversion or cache operation failure.
 */
public record LatexErrorResponse(String error, String details)
    implements LatexRenderResponse, LatexPreviewResponse, LatexCacheStatsResponse, LatexCacheClearResponse {
    public LatexErrorResponse {
        Objects.requireNonNull(error, "Error message cannot be null");
        details = details == null ? "" : details;
    }
}
