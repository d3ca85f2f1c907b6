package com.williamcallahan.latexpreview.service.latex;

import com.williamcallahan.latexpreview.config.PipelineLimits;
import com.williamcallahan.latexpreview.support.HtmlEscaper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts math regions into rendered fragments.
 *
 * <p>Extraction order is fixed so an earlier form can never be shadowed by a later one: structured
 * environments, {@code \[..\]}, {@code \(..\)}, {@code $$..$$}, then {@code $..$}. Display results
 * become block tokens, inline results bare tokens. A single-dollar span never crosses a blank line, so a
 * stray dollar cannot swallow the following paragraphs.</p>
 */
public class MathEngine {

    private static final Logger logger = LoggerFactory.getLogger(MathEngine.class);

    static final List<String> STRUCTURED_ENVIRONMENTS = List.of(
        "equation", "equation*", "align", "align*", "gather", "gather*", "multline", "multline*");

    private static final Pattern BRACKET_DISPLAY = Pattern.compile("(?<!\\\\)\\\\\\[([\\s\\S]*?)(?<!\\\\)\\\\\\]");
    private static final Pattern PAREN_INLINE = Pattern.compile("(?<!\\\\)\\\\\\(([\\s\\S]*?)(?<!\\\\)\\\\\\)");
    private static final Pattern DOUBLE_DOLLAR = Pattern.compile("(?<!\\\\)\\$\\$([\\s\\S]*?)(?<!\\\\)\\$\\$");

    private final MathRenderer renderer;
    private final MathAutoscaler autoscaler;
    private final int maxIterations;

    public MathEngine(MathRenderer renderer, MathAutoscaler autoscaler, PipelineLimits limits) {
        this.renderer = Objects.requireNonNull(renderer, "Math renderer cannot be null");
        this.autoscaler = Objects.requireNonNull(autoscaler, "Math autoscaler cannot be null");
        this.maxIterations = Objects.requireNonNull(limits, "Pipeline limits cannot be null").getMaxExtractionIterations();
    }

    /**
     * Replaces every math region with a token.
     *
     * @param text document buffer
     * @param macros macro definitions passed to the backend
     * @param registry placeholder registry for this document
     * @return rewritten buffer and the math fragments registered
     */
    public ExtractionResult processMath(String text, MacroTable macros, PlaceholderRegistry registry) {
        if (text == null || text.isEmpty()) {
            return new ExtractionResult("", null);
        }
        MacroTable table = macros == null ? MacroTable.empty() : macros;
        int mark = registry.size();

        String content = MathFragmentRepair.stripNestedDelimiters(text);
        content = MathFragmentRepair.mergeOperatorSpans(content);

        String structuredSource = content;
        content = EnvironmentScanner.replaceAll(structuredSource, STRUCTURED_ENVIRONMENTS, maxIterations,
            span -> registry.registerBlock(PlaceholderCategory.MATH,
                renderExpression(structuredSource.substring(span.start(), span.end()), true, table)));
        content = replace(content, BRACKET_DISPLAY, true, table, registry);
        content = replace(content, PAREN_INLINE, false, table, registry);
        content = replace(content, DOUBLE_DOLLAR, true, table, registry);
        content = replaceSingleDollar(content, table, registry);

        return new ExtractionResult(content, registry.entriesSince(mark));
    }

    private String replace(String text, Pattern pattern, boolean displayMode, MacroTable macros,
                           PlaceholderRegistry registry) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            String html = renderExpression(matcher.group(1), displayMode, macros);
            String token = displayMode
                ? registry.registerBlock(PlaceholderCategory.MATH, html)
                : registry.register(PlaceholderCategory.MATH, html);
            matcher.appendReplacement(out, Matcher.quoteReplacement(token));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Walks the buffer for {@code $..$} spans. An opening dollar is unescaped and not part of {@code $$};
     * the span closes at the next unescaped dollar and is abandoned at a blank line or the end of input.
     */
    private String replaceSingleDollar(String text, MacroTable macros, PlaceholderRegistry registry) {
        StringBuilder out = new StringBuilder(text.length());
        int cursor = 0;
        int open = nextOpeningDollar(text, 0);
        while (open >= 0) {
            int close = closingDollar(text, open + 1);
            if (close < 0) {
                open = nextOpeningDollar(text, open + 1);
                continue;
            }
            String html = renderExpression(text.substring(open + 1, close), false, macros);
            out.append(text, cursor, open).append(registry.register(PlaceholderCategory.MATH, html));
            cursor = close + 1;
            open = nextOpeningDollar(text, cursor);
        }
        return out.append(text, cursor, text.length()).toString();
    }

    static int nextOpeningDollar(String text, int from) {
        for (int i = text.indexOf('$', from); i >= 0; i = text.indexOf('$', i + 1)) {
            boolean escaped = i > 0 && (text.charAt(i - 1) == '\\' || text.charAt(i - 1) == '$');
            boolean doubled = i + 1 < text.length() && text.charAt(i + 1) == '$';
            if (!escaped && !doubled && i + 1 < text.length()) {
                return i;
            }
        }
        return -1;
    }

    static int closingDollar(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '$' && text.charAt(i - 1) != '\\') {
                return i > from ? i : -1;
            }
            if (c == '\n' && startsBlankLine(text, i + 1)) {
                return -1;
            }
        }
        return -1;
    }

    private static boolean startsBlankLine(String text, int from) {
        int i = from;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t' || text.charAt(i) == '\r')) {
            i++;
        }
        return i < text.length() && text.charAt(i) == '\n';
    }

    /**
     * Renders one expression, never throwing; display results are autoscaled when eligible.
     */
    String renderExpression(String source, boolean displayMode, MacroTable macros) {
        try {
            String html = renderer.render(source, displayMode, macros);
            return displayMode ? autoscaler.apply(source, html) : html;
        } catch (MathRenderException renderFailure) {
            logger.debug("Math render failed for '{}': {}", abbreviate(source), renderFailure.getMessage());
            return errorMarker(source, renderFailure.getMessage());
        } catch (RuntimeException unexpected) {
            logger.warn("Math backend failed unexpectedly", unexpected);
            return errorMarker(source, "Math Error");
        }
    }

    static String errorMarker(String source, String message) {
        return "<span class=\"math-error\" title=\"" + HtmlEscaper.escape(message) + "\">"
            + HtmlEscaper.escape(source) + "</span>";
    }

    private static String abbreviate(String source) {
        return source.length() <= 60 ? source : source.substring(0, 60) + "...";
    }
}
