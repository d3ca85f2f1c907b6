package com.williamcallahan.latexpreview.domain.latex;

/**
 * Response variants for render cache statistics requests.
 */
public sealed interface LatexCacheStatsResponse permits LatexCacheStatsSnapshot, LatexErrorResponse {}
