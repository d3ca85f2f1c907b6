package com.williamcallahan.latexpreview.config;

import java.util.Locale;

/**
 * Math backend mode and display-equation autoscale constants.
 *
 * <p>The width factor, budget and minimum scale were tuned by eye against rendered KaTeX output
 * in a 50em preview column. Changing them changes the rendering of existing documents.</p>
 */
public class MathAutoscale {

    private static final double WIDTH_FACTOR_DEF = 0.45;
    private static final double BUDGET_DEF = 50.0;
    private static final double MIN_SCALE_DEF = 0.55;
    private static final String WIDTH_FACTOR_KEY = "app.preview.math.width-factor-em";
    private static final String BUDGET_KEY = "app.preview.math.budget-em";
    private static final String MIN_SCALE_KEY = "app.preview.math.min-scale";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String SCALE_FMT = "%s must be in (0, 1].";

    private boolean throwOnError;
    private double widthFactorEm = WIDTH_FACTOR_DEF;
    private double budgetEm = BUDGET_DEF;
    private double minScale = MIN_SCALE_DEF;

    /**
     * Creates math configuration with default values.
     */
    public MathAutoscale() {
    }

    /**
     * Validates math settings.
     */
    public void validateConfiguration() {
        if (widthFactorEm <= 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, WIDTH_FACTOR_KEY));
        }
        if (budgetEm <= 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, BUDGET_KEY));
        }
        if (minScale <= 0 || minScale > 1) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, SCALE_FMT, MIN_SCALE_KEY));
        }
    }

    /**
     * Returns whether the math backend raises on malformed input instead of emitting an error span.
     *
     * @return whether render failures are raised
     */
    public boolean isThrowOnError() { return throwOnError; }
    public void setThrowOnError(boolean throwOnError) { this.throwOnError = throwOnError; }

    public double getWidthFactorEm() { return widthFactorEm; }
    public void setWidthFactorEm(double widthFactorEm) { this.widthFactorEm = widthFactorEm; }

    public double getBudgetEm() { return budgetEm; }
    public void setBudgetEm(double budgetEm) { this.budgetEm = budgetEm; }

    public double getMinScale() { return minScale; }
    public void setMinScale(double minScale) { this.minScale = minScale; }
}
