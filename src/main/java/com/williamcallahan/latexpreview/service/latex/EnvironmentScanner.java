package com.williamcallahan.latexpreview.service.latex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Depth-aware locator for LaTeX environments.
 *
 * <p>Nested occurrences of the same environment are counted, so the returned span always ends at the
 * marker that balances the opening one. An occurrence without a balancing end marker is left alone and
 * scanning carries on after its begin marker.</p>
 */
public final class EnvironmentScanner {

    private static final Logger logger = LoggerFactory.getLogger(EnvironmentScanner.class);

    private EnvironmentScanner() {
    }

    public static String beginMarker(String name) {
        return "\\begin{" + name + "}";
    }

    public static String endMarker(String name) {
        return "\\end{" + name + "}";
    }

    /**
     * Finds the first balanced occurrence of {@code name} at or after {@code from}. An unterminated
     * occurrence is skipped and the search continues after its begin marker.
     *
     * @param text document buffer
     * @param name environment name
     * @param from search start
     * @return the span, or empty when no balanced occurrence remains
     */
    public static Optional<EnvironmentSpan> find(String text, String name, int from) {
        return findFirst(text, List.of(name), from);
    }

    /**
     * Finds the balanced occurrence of any of {@code names} that begins first at or after {@code from},
     * skipping unterminated occurrences.
     */
    public static Optional<EnvironmentSpan> findFirst(String text, Collection<String> names, int from) {
        int searchFrom = Math.max(0, from);
        Optional<BeginMarker> begin = nextBegin(text, names, searchFrom);
        while (begin.isPresent()) {
            Optional<EnvironmentSpan> span = matchFrom(text, begin.get().name(), begin.get().start());
            if (span.isPresent()) {
                return span;
            }
            begin = nextBegin(text, names, begin.get().markerEnd());
        }
        return Optional.empty();
    }

    /**
     * Locates the earliest begin marker of any of {@code names}, balanced or not.
     */
    static Optional<BeginMarker> nextBegin(String text, Collection<String> names, int from) {
        int bestStart = -1;
        String bestName = null;
        for (String name : names) {
            int idx = text.indexOf(beginMarker(name), from);
            if (idx >= 0 && (bestStart < 0 || idx < bestStart)) {
                bestStart = idx;
                bestName = name;
            }
        }
        return bestName == null ? Optional.empty() : Optional.of(new BeginMarker(bestName, bestStart));
    }

    /**
     * Matches the environment whose begin marker sits at {@code start}.
     */
    public static Optional<EnvironmentSpan> matchFrom(String text, String name, int start) {
        String begin = beginMarker(name);
        String end = endMarker(name);
        int depth = 1;
        int cursor = start + begin.length();
        while (cursor < text.length()) {
            if (text.startsWith(begin, cursor)) {
                depth++;
                cursor += begin.length();
            } else if (text.startsWith(end, cursor)) {
                depth--;
                if (depth == 0) {
                    return Optional.of(new EnvironmentSpan(name, start, start + begin.length(), cursor, cursor + end.length()));
                }
                cursor += end.length();
            } else {
                cursor++;
            }
        }
        logger.debug("Unterminated environment '{}' at offset {}; leaving it in place", name, start);
        return Optional.empty();
    }

    /**
     * Replaces every balanced occurrence of the named environments, scanning left to right and never
     * rescanning replacement text. An unterminated occurrence is copied through unchanged and scanning
     * resumes after its begin marker; it counts toward the cap like an extraction.
     *
     * @param text document buffer
     * @param names environment names to extract
     * @param maxIterations safety cap on attempted extractions
     * @param renderer produces the replacement for one span
     * @return rewritten buffer
     */
    public static String replaceAll(String text, Collection<String> names, int maxIterations,
                                    Function<EnvironmentSpan, String> renderer) {
        StringBuilder out = new StringBuilder(text.length());
        int cursor = 0;
        int iterations = 0;
        Optional<BeginMarker> begin = nextBegin(text, names, 0);
        while (begin.isPresent()) {
            if (iterations++ >= maxIterations) {
                logger.warn("Extraction cap of {} reached for {}; remaining occurrences left as text",
                    maxIterations, names);
                break;
            }
            BeginMarker marker = begin.get();
            Optional<EnvironmentSpan> span = matchFrom(text, marker.name(), marker.start());
            if (span.isEmpty()) {
                begin = nextBegin(text, names, marker.markerEnd());
                continue;
            }
            out.append(text, cursor, span.get().start());
            out.append(renderer.apply(span.get()));
            cursor = span.get().end();
            begin = nextBegin(text, names, cursor);
        }
        out.append(text, cursor, text.length());
        return out.toString();
    }

    /**
     * A begin marker found in the buffer.
     *
     * @param name environment name
     * @param start index of the marker
     */
    record BeginMarker(String name, int start) {

        int markerEnd() {
            return start + beginMarker(name).length();
        }
    }
}
