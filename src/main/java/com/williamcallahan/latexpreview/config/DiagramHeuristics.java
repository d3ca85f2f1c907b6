package com.williamcallahan.latexpreview.config;

import com.williamcallahan.latexpreview.domain.latex.DiagramIntent;

import java.util.Locale;
import java.util.Objects;

/**
 * Thresholds for diagram intent classification and option synthesis.
 *
 * <p>All defaults were tuned empirically against TikZJax output for AI-generated diagrams
 * (A4 content width of about 14cm, a 25cm zoomable width budget). They are exposed so a
 * deployment can adjust them without code changes, not so they can be re-derived.</p>
 */
public class DiagramHeuristics {

    private static final String PREFIX = "app.preview.diagram.";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String ORDER_FMT = "%s must not be greater than %s.";

    // classification
    private double textHeavyLabelLength = 30.0;
    private int compactNodeCount = 8;
    private double compactNodeDistance = 2.0;
    private double largeNodeDistance = 2.5;
    private double flatAspectRatio = 3.0;
    private DiagramIntent absoluteLayoutIntent = DiagramIntent.LARGE;

    // LARGE
    private double widthBudgetCm = 25.0;
    private double maxUnitCm = 2.5;
    private double adaptiveClampSplitSpan = 7.0;
    private double narrowUnitClampCm = 1.3;
    private double wideUnitClampCm = 1.8;
    private double targetHeightCm = 8.0;
    private double minYUnitCm = 1.0;
    private double maxYUnitCm = 1.8;
    private double relativeYUnitCm = 0.5;
    private double textHeavyNodeDistanceCm = 8.4;
    private double lightNodeDistanceCm = 5.0;
    private double legibleNodeDistanceCm = 0.5;

    // COMPACT
    private double compactDenseScale = 0.75;
    private double compactScale = 0.85;
    private double compactDefaultDistanceCm = 1.5;

    // MEDIUM
    private double safeWidthCm = 14.0;
    private int mediumDenseNodeCount = 6;
    private double mediumFitScale = 1.0;
    private double mediumScale = 0.9;
    private double mediumDenseScale = 0.8;
    private double mediumDefaultDistanceCm = 2.5;

    // FLAT
    private double flatXMultiplier = 1.5;
    private double flatTargetRatio = 2.0;
    private double flatMinYMultiplier = 1.5;
    private double flatMaxYMultiplier = 3.0;
    private int flatSmallFontNodeCount = 5;

    // WIDE
    private double wideTargetWidthCm = 14.0;
    private double wideMinScale = 0.5;
    private double wideBuffer = 0.9;

    // text-heavy boost for relative layouts
    private double boostXUnitCm = 2.2;
    private double boostYUnitCm = 1.5;

    /**
     * Creates diagram heuristics with default values.
     */
    public DiagramHeuristics() {
    }

    /**
     * Validates diagram heuristics.
     */
    public void validateConfiguration() {
        requirePositive("text-heavy-label-length", textHeavyLabelLength);
        requirePositive("compact-node-count", compactNodeCount);
        requirePositive("compact-node-distance", compactNodeDistance);
        requirePositive("large-node-distance", largeNodeDistance);
        requirePositive("flat-aspect-ratio", flatAspectRatio);
        requirePositive("width-budget-cm", widthBudgetCm);
        requirePositive("max-unit-cm", maxUnitCm);
        requirePositive("target-height-cm", targetHeightCm);
        requirePositive("min-y-unit-cm", minYUnitCm);
        requirePositive("safe-width-cm", safeWidthCm);
        requirePositive("wide-target-width-cm", wideTargetWidthCm);
        requirePositive("wide-min-scale", wideMinScale);
        requirePositive("flat-target-ratio", flatTargetRatio);
        requirePositive("flat-min-y-multiplier", flatMinYMultiplier);
        requireOrdered("compact-node-distance", compactNodeDistance, "large-node-distance", largeNodeDistance);
        requireOrdered("min-y-unit-cm", minYUnitCm, "max-y-unit-cm", maxYUnitCm);
        requireOrdered("flat-min-y-multiplier", flatMinYMultiplier, "flat-max-y-multiplier", flatMaxYMultiplier);
        Objects.requireNonNull(absoluteLayoutIntent, PREFIX + "absolute-layout-intent must not be null.");
    }

    private static void requirePositive(String key, double value) {
        if (value <= 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, PREFIX + key));
        }
    }

    private static void requireOrdered(String lowKey, double low, String highKey, double high) {
        if (low > high) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, ORDER_FMT, PREFIX + lowKey, PREFIX + highKey));
        }
    }

    public double getTextHeavyLabelLength() { return textHeavyLabelLength; }
    public void setTextHeavyLabelLength(double textHeavyLabelLength) { this.textHeavyLabelLength = textHeavyLabelLength; }

    public int getCompactNodeCount() { return compactNodeCount; }
    public void setCompactNodeCount(int compactNodeCount) { this.compactNodeCount = compactNodeCount; }

    public double getCompactNodeDistance() { return compactNodeDistance; }
    public void setCompactNodeDistance(double compactNodeDistance) { this.compactNodeDistance = compactNodeDistance; }

    public double getLargeNodeDistance() { return largeNodeDistance; }
    public void setLargeNodeDistance(double largeNodeDistance) { this.largeNodeDistance = largeNodeDistance; }

    public double getFlatAspectRatio() { return flatAspectRatio; }
    public void setFlatAspectRatio(double flatAspectRatio) { this.flatAspectRatio = flatAspectRatio; }

    /**
     * Returns the intent assigned to non-flat diagrams drawn with absolute coordinates.
     *
     * @return LARGE by default, WIDE to scale such diagrams down uniformly instead
     */
    public DiagramIntent getAbsoluteLayoutIntent() { return absoluteLayoutIntent; }
    public void setAbsoluteLayoutIntent(DiagramIntent absoluteLayoutIntent) { this.absoluteLayoutIntent = absoluteLayoutIntent; }

    public double getWidthBudgetCm() { return widthBudgetCm; }
    public void setWidthBudgetCm(double widthBudgetCm) { this.widthBudgetCm = widthBudgetCm; }

    public double getMaxUnitCm() { return maxUnitCm; }
    public void setMaxUnitCm(double maxUnitCm) { this.maxUnitCm = maxUnitCm; }

    public double getAdaptiveClampSplitSpan() { return adaptiveClampSplitSpan; }
    public void setAdaptiveClampSplitSpan(double adaptiveClampSplitSpan) { this.adaptiveClampSplitSpan = adaptiveClampSplitSpan; }

    public double getNarrowUnitClampCm() { return narrowUnitClampCm; }
    public void setNarrowUnitClampCm(double narrowUnitClampCm) { this.narrowUnitClampCm = narrowUnitClampCm; }

    public double getWideUnitClampCm() { return wideUnitClampCm; }
    public void setWideUnitClampCm(double wideUnitClampCm) { this.wideUnitClampCm = wideUnitClampCm; }

    public double getTargetHeightCm() { return targetHeightCm; }
    public void setTargetHeightCm(double targetHeightCm) { this.targetHeightCm = targetHeightCm; }

    public double getMinYUnitCm() { return minYUnitCm; }
    public void setMinYUnitCm(double minYUnitCm) { this.minYUnitCm = minYUnitCm; }

    public double getMaxYUnitCm() { return maxYUnitCm; }
    public void setMaxYUnitCm(double maxYUnitCm) { this.maxYUnitCm = maxYUnitCm; }

    public double getRelativeYUnitCm() { return relativeYUnitCm; }
    public void setRelativeYUnitCm(double relativeYUnitCm) { this.relativeYUnitCm = relativeYUnitCm; }

    public double getTextHeavyNodeDistanceCm() { return textHeavyNodeDistanceCm; }
    public void setTextHeavyNodeDistanceCm(double textHeavyNodeDistanceCm) { this.textHeavyNodeDistanceCm = textHeavyNodeDistanceCm; }

    public double getLightNodeDistanceCm() { return lightNodeDistanceCm; }
    public void setLightNodeDistanceCm(double lightNodeDistanceCm) { this.lightNodeDistanceCm = lightNodeDistanceCm; }

    public double getLegibleNodeDistanceCm() { return legibleNodeDistanceCm; }
    public void setLegibleNodeDistanceCm(double legibleNodeDistanceCm) { this.legibleNodeDistanceCm = legibleNodeDistanceCm; }

    public double getCompactDenseScale() { return compactDenseScale; }
    public void setCompactDenseScale(double compactDenseScale) { this.compactDenseScale = compactDenseScale; }

    public double getCompactScale() { return compactScale; }
    public void setCompactScale(double compactScale) { this.compactScale = compactScale; }

    public double getCompactDefaultDistanceCm() { return compactDefaultDistanceCm; }
    public void setCompactDefaultDistanceCm(double compactDefaultDistanceCm) { this.compactDefaultDistanceCm = compactDefaultDistanceCm; }

    public double getSafeWidthCm() { return safeWidthCm; }
    public void setSafeWidthCm(double safeWidthCm) { this.safeWidthCm = safeWidthCm; }

    public int getMediumDenseNodeCount() { return mediumDenseNodeCount; }
    public void setMediumDenseNodeCount(int mediumDenseNodeCount) { this.mediumDenseNodeCount = mediumDenseNodeCount; }

    public double getMediumFitScale() { return mediumFitScale; }
    public void setMediumFitScale(double mediumFitScale) { this.mediumFitScale = mediumFitScale; }

    public double getMediumScale() { return mediumScale; }
    public void setMediumScale(double mediumScale) { this.mediumScale = mediumScale; }

    public double getMediumDenseScale() { return mediumDenseScale; }
    public void setMediumDenseScale(double mediumDenseScale) { this.mediumDenseScale = mediumDenseScale; }

    public double getMediumDefaultDistanceCm() { return mediumDefaultDistanceCm; }
    public void setMediumDefaultDistanceCm(double mediumDefaultDistanceCm) { this.mediumDefaultDistanceCm = mediumDefaultDistanceCm; }

    public double getFlatXMultiplier() { return flatXMultiplier; }
    public void setFlatXMultiplier(double flatXMultiplier) { this.flatXMultiplier = flatXMultiplier; }

    public double getFlatTargetRatio() { return flatTargetRatio; }
    public void setFlatTargetRatio(double flatTargetRatio) { this.flatTargetRatio = flatTargetRatio; }

    public double getFlatMinYMultiplier() { return flatMinYMultiplier; }
    public void setFlatMinYMultiplier(double flatMinYMultiplier) { this.flatMinYMultiplier = flatMinYMultiplier; }

    public double getFlatMaxYMultiplier() { return flatMaxYMultiplier; }
    public void setFlatMaxYMultiplier(double flatMaxYMultiplier) { this.flatMaxYMultiplier = flatMaxYMultiplier; }

    public int getFlatSmallFontNodeCount() { return flatSmallFontNodeCount; }
    public void setFlatSmallFontNodeCount(int flatSmallFontNodeCount) { this.flatSmallFontNodeCount = flatSmallFontNodeCount; }

    public double getWideTargetWidthCm() { return wideTargetWidthCm; }
    public void setWideTargetWidthCm(double wideTargetWidthCm) { this.wideTargetWidthCm = wideTargetWidthCm; }

    public double getWideMinScale() { return wideMinScale; }
    public void setWideMinScale(double wideMinScale) { this.wideMinScale = wideMinScale; }

    public double getWideBuffer() { return wideBuffer; }
    public void setWideBuffer(double wideBuffer) { this.wideBuffer = wideBuffer; }

    public double getBoostXUnitCm() { return boostXUnitCm; }
    public void setBoostXUnitCm(double boostXUnitCm) { this.boostXUnitCm = boostXUnitCm; }

    public double getBoostYUnitCm() { return boostYUnitCm; }
    public void setBoostYUnitCm(double boostYUnitCm) { this.boostYUnitCm = boostYUnitCm; }
}
