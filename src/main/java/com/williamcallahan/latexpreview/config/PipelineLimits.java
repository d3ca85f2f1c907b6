package com.williamcallahan.latexpreview.config;

import java.util.Locale;

/**
 * Safety limits applied to every scan-extract-repeat loop in the conversion pipeline.
 */
public class PipelineLimits {

    private static final int MAX_INPUT_DEF = 100_000;
    private static final int MAX_ITERATIONS_DEF = 100;
    private static final int MAX_RESOLVE_DEF = 16;
    private static final int MAX_LIST_DEPTH_DEF = 16;
    private static final int MIN_POSITIVE = 1;
    private static final String MAX_INPUT_KEY = "app.preview.limits.max-input-length";
    private static final String MAX_ITERATIONS_KEY = "app.preview.limits.max-extraction-iterations";
    private static final String MAX_RESOLVE_KEY = "app.preview.limits.max-resolve-passes";
    private static final String MAX_LIST_DEPTH_KEY = "app.preview.limits.max-list-depth";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private int maxInputLength = MAX_INPUT_DEF;
    private int maxExtractionIterations = MAX_ITERATIONS_DEF;
    private int maxResolvePasses = MAX_RESOLVE_DEF;
    private int maxListDepth = MAX_LIST_DEPTH_DEF;

    /**
     * Creates pipeline limits with default values.
     */
    public PipelineLimits() {
    }

    /**
     * Validates pipeline limits.
     */
    public void validateConfiguration() {
        requirePositive(MAX_INPUT_KEY, maxInputLength);
        requirePositive(MAX_ITERATIONS_KEY, maxExtractionIterations);
        requirePositive(MAX_RESOLVE_KEY, maxResolvePasses);
        requirePositive(MAX_LIST_DEPTH_KEY, maxListDepth);
    }

    private static void requirePositive(String key, int value) {
        if (value < MIN_POSITIVE) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, key));
        }
    }

    public int getMaxInputLength() { return maxInputLength; }
    public void setMaxInputLength(int maxInputLength) { this.maxInputLength = maxInputLength; }

    public int getMaxExtractionIterations() { return maxExtractionIterations; }
    public void setMaxExtractionIterations(int maxExtractionIterations) { this.maxExtractionIterations = maxExtractionIterations; }

    public int getMaxResolvePasses() { return maxResolvePasses; }
    public void setMaxResolvePasses(int maxResolvePasses) { this.maxResolvePasses = maxResolvePasses; }

    public int getMaxListDepth() { return maxListDepth; }
    public void setMaxListDepth(int maxListDepth) { this.maxListDepth = maxListDepth; }
}
