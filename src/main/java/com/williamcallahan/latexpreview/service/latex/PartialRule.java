package com.williamcallahan.latexpreview.service.latex;

/**
 * Column-restricted horizontal rule from {@code \cline{a-b}} or {@code \cmidrule{a-b}}.
 *
 * @param firstColumn first covered column, 1-based
 * @param lastColumn last covered column, 1-based and inclusive
 */
public record PartialRule(int firstColumn, int lastColumn) {
    public PartialRule {
        if (firstColumn < 1 || lastColumn < firstColumn) {
            throw new IllegalArgumentException("Partial rule range is invalid: " + firstColumn + "-" + lastColumn);
        }
    }

    /**
     * Reports whether a cell starting at 0-based {@code column} and spanning {@code colspan} columns lies
     * under this rule.
     */
    public boolean overlaps(int column, int colspan) {
        int first = column + 1;
        int last = column + Math.max(1, colspan);
        return first <= lastColumn && last >= firstColumn;
    }
}
