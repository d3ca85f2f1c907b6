package com.williamcallahan.latexpreview.service.latex;

import java.util.Objects;

/**
 * Location of one {@code \begin{name}...\end{name}} occurrence.
 *
 * @param name environment name, including any star
 * @param start index of the begin marker
 * @param bodyStart index just after the begin marker
 * @param bodyEnd index of the matching end marker
 * @param end index just after the matching end marker
 */
public record EnvironmentSpan(String name, int start, int bodyStart, int bodyEnd, int end) {
    public EnvironmentSpan {
        Objects.requireNonNull(name, "Environment name cannot be null");
        if (start < 0 || bodyStart < start || bodyEnd < bodyStart || end < bodyEnd) {
            throw new IllegalArgumentException("Environment span indices are out of order");
        }
    }

    /**
     * Returns the raw text between the markers.
     */
    public String body(String text) {
        return text.substring(bodyStart, bodyEnd);
    }
}
