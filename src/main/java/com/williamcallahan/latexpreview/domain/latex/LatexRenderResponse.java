package com.williamcallahan.latexpreview.domain.latex;

/**
 * Response variants for the structured render endpoint.
 */
public sealed interface LatexRenderResponse
    permits LatexRenderOutcome, LatexErrorResponse {
}
