package com.williamcallahan.latexpreview.domain.latex;

/**
 * Response variants for render cache clear requests.
 */
public sealed interface LatexCacheClearResponse
    permits LatexCacheClearOutcome, LatexErrorResponse {
}
