package com.williamcallahan.latexpreview.service.latex;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.latexpreview.support.HtmlEscaper;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Emits KaTeX hydration markup: the escaped source plus display mode and the macro table as data
 * attributes, typeset in the browser by {@code katex.render}.
 *
 * <p>The source is checked for the structural errors KaTeX rejects outright (unbalanced groups,
 * {@code \left} without {@code \right}, mismatched environments). With {@code throwOnError} off such
 * input becomes a {@code katex-error} span carrying the source, as KaTeX itself does.</p>
 */
public class KatexMarkupMathRenderer implements MathRenderer {

    private static final Pattern ENVIRONMENT_MARKER = Pattern.compile("\\\\(begin|end)\\s*\\{([^{}]*)\\}");
    private static final Pattern LEFT = Pattern.compile("\\\\left(?![a-zA-Z])");
    private static final Pattern RIGHT = Pattern.compile("\\\\right(?![a-zA-Z])");

    private final ObjectMapper objectMapper;
    private final boolean throwOnError;

    public KatexMarkupMathRenderer(ObjectMapper objectMapper, boolean throwOnError) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "Object mapper cannot be null");
        this.throwOnError = throwOnError;
    }

    @Override
    public String render(String source, boolean displayMode, MacroTable macros) {
        String expression = source == null ? "" : source.strip();
        String problem = structuralProblem(expression);
        if (problem != null) {
            if (throwOnError) {
                throw new MathRenderException(problem);
            }
            return "<span class=\"katex-error\" title=\"" + HtmlEscaper.escape("ParseError: " + problem) + "\">"
                + HtmlEscaper.escape(expression) + "</span>";
        }
        String macroJson = macroJson(macros == null ? MacroTable.empty() : macros);
        String element = displayMode ? "div" : "span";
        String classes = displayMode ? "katex-pending katex-block" : "katex-pending";
        return "<" + element + " class=\"" + classes + "\" data-display=\"" + displayMode + "\""
            + " data-macros=\"" + HtmlEscaper.escape(macroJson) + "\">"
            + HtmlEscaper.escape(expression) + "</" + element + ">";
    }

    private String macroJson(MacroTable macros) {
        try {
            return objectMapper.writeValueAsString(macros.withDefaults());
        } catch (JsonProcessingException serializationFailure) {
            throw new MathRenderException("Macro table could not be serialized", serializationFailure);
        }
    }

    /**
     * Returns a description of the first structural error, or null when the source is well formed.
     */
    static String structuralProblem(String source) {
        int depth = 0;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth < 0) {
                    return "Unexpected '}' at position " + i;
                }
            }
        }
        if (depth > 0) {
            return "Expected '}' before end of input";
        }
        if (count(LEFT, source) != count(RIGHT, source)) {
            return "Unbalanced \\left and \\right";
        }
        Deque<String> open = new ArrayDeque<>();
        Matcher marker = ENVIRONMENT_MARKER.matcher(source);
        while (marker.find()) {
            String name = marker.group(2).strip();
            if ("begin".equals(marker.group(1))) {
                open.push(name);
            } else if (open.isEmpty() || !open.pop().equals(name)) {
                return "Mismatched \\end{" + name + "}";
            }
        }
        if (!open.isEmpty()) {
            return "Missing \\end{" + open.peek() + "}";
        }
        return null;
    }

    private static int count(Pattern pattern, String source) {
        int count = 0;
        Matcher matcher = pattern.matcher(source);
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
