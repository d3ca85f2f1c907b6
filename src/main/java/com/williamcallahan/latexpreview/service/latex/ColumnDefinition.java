package com.williamcallahan.latexpreview.service.latex;

import java.util.Objects;
import java.util.Optional;

/**
 * One column from a tabular column specification.
 *
 * @param alignment CSS text alignment
 * @param width CSS width for fixed-width columns, empty otherwise
 * @param leftRule whether a vertical rule precedes the column
 * @param rightRule whether a vertical rule follows the column
 */
public record ColumnDefinition(String alignment, Optional<String> width, boolean leftRule, boolean rightRule) {
    public ColumnDefinition {
        Objects.requireNonNull(alignment, "Column alignment cannot be null");
        width = width == null ? Optional.empty() : width;
    }

    static ColumnDefinition aligned(String alignment) {
        return new ColumnDefinition(alignment, Optional.empty(), false, false);
    }

    ColumnDefinition withLeftRule() {
        return new ColumnDefinition(alignment, width, true, rightRule);
    }

    ColumnDefinition withRightRule() {
        return new ColumnDefinition(alignment, width, leftRule, true);
    }
}
