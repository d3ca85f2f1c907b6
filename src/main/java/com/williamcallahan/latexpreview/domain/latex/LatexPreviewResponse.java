package com.williamcallahan.latexpreview.domain.latex;

/**
 * Response variants for the resolved preview endpoint.
 */
public sealed interface LatexPreviewResponse
    permits LatexPreviewOutcome, LatexErrorResponse {
}
