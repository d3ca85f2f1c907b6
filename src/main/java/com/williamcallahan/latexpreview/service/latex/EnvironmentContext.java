package com.williamcallahan.latexpreview.service.latex;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Per-document collaborators handed to the environment normalizer.
 *
 * @param macros document macros, for {@code \newtheorem} labels
 * @param registry placeholder registry receiving rendered environments
 * @param bodyFormatter converts an environment body to block HTML (lists, nested environments, paragraphs)
 * @param inlineFormatter converts a short run of LaTeX text to inline HTML
 * @param numbering figure and algorithm counters
 */
record EnvironmentContext(
    MacroTable macros,
    PlaceholderRegistry registry,
    UnaryOperator<String> bodyFormatter,
    UnaryOperator<String> inlineFormatter,
    FloatNumbering numbering
) {
    EnvironmentContext {
        Objects.requireNonNull(macros, "Macros cannot be null");
        Objects.requireNonNull(registry, "Registry cannot be null");
        Objects.requireNonNull(bodyFormatter, "Body formatter cannot be null");
        Objects.requireNonNull(inlineFormatter, "Inline formatter cannot be null");
        Objects.requireNonNull(numbering, "Numbering cannot be null");
    }
}
