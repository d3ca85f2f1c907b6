package com.williamcallahan.latexpreview.service.latex;

import com.williamcallahan.latexpreview.support.DecimalText;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders {@code algorithmic} pseudo-code as numbered, indented lines.
 *
 * <p>Both the {@code algorithmic} ({@code \STATE}, {@code \IF}) and {@code algpseudocode}
 * ({@code \State}, {@code \If}) spellings are accepted. Block-opening keywords indent the lines after
 * them, closing keywords outdent themselves, and {@code \ELSE}/{@code \ELSIF} sit one level out.</p>
 */
public class AlgorithmFormatter {

    static final List<String> ENVIRONMENTS = List.of("algorithmic");

    private static final double INDENT_EM = 1.5;
    private static final Pattern LINE_START = Pattern.compile(
        "(?=\\\\(?:STATE|IF|ELSIF|ELSEIF|ELSE|ENDIF|FOR|FORALL|ENDFOR|WHILE|ENDWHILE|REPEAT|UNTIL|LOOP|ENDLOOP"
            + "|RETURN|REQUIRE|ENSURE|PROCEDURE|ENDPROCEDURE|FUNCTION|ENDFUNCTION|PRINT)(?![a-zA-Z]))",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern KEYWORD = Pattern.compile("^\\\\([a-zA-Z]+)");
    private static final String COMMENT = "\\Comment";

    private final int maxIterations;

    public AlgorithmFormatter(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    /**
     * Replaces each {@code algorithmic} environment with a block token.
     *
     * @param text document buffer
     * @param registry placeholder registry for this document
     * @param inlineFormatter formatter for statement text
     * @return rewritten buffer
     */
    public String format(String text, PlaceholderRegistry registry, UnaryOperator<String> inlineFormatter) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String source = text;
        return EnvironmentScanner.replaceAll(source, ENVIRONMENTS, maxIterations,
            span -> registry.registerBlock(PlaceholderCategory.BLOCK, render(span.body(source), inlineFormatter)));
    }

    /**
     * Renders one environment body.
     */
    String render(String body, UnaryOperator<String> inlineFormatter) {
        String steps = body;
        int optionAt = LatexArguments.skipWhitespace(steps, 0);
        Optional<LatexArguments.Argument> options = LatexArguments.readBracketed(steps, optionAt);
        if (options.isPresent()) {
            steps = steps.substring(options.get().end());
        }

        StringBuilder html = new StringBuilder("<div class=\"latex-algorithm\">");
        int level = 0;
        int lineNumber = 1;
        for (String rawLine : LINE_START.split(steps)) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            Matcher keywordMatch = KEYWORD.matcher(line);
            String keyword = keywordMatch.find() ? keywordMatch.group(1).toUpperCase(Locale.ROOT) : "";
            String rest = keyword.isEmpty() ? line : line.substring(keywordMatch.end());

            int lineLevel = level;
            String content;
            boolean numbered = true;
            switch (keyword) {
                case "IF" -> {
                    content = block("if", condition(rest, inlineFormatter), "then");
                    level++;
                }
                case "ELSIF", "ELSEIF" -> {
                    lineLevel = Math.max(0, level - 1);
                    content = block("else if", condition(rest, inlineFormatter), "then");
                }
                case "ELSE" -> {
                    lineLevel = Math.max(0, level - 1);
                    content = keyword("else") + tail(rest, inlineFormatter);
                }
                case "FOR", "FORALL" -> {
                    content = block("FORALL".equals(keyword) ? "for all" : "for", condition(rest, inlineFormatter), "do");
                    level++;
                }
                case "WHILE" -> {
                    content = block("while", condition(rest, inlineFormatter), "do");
                    level++;
                }
                case "REPEAT", "LOOP" -> {
                    content = keyword(keyword.toLowerCase(Locale.ROOT)) + tail(rest, inlineFormatter);
                    level++;
                }
                case "PROCEDURE", "FUNCTION" -> {
                    content = procedure(keyword.toLowerCase(Locale.ROOT), rest, inlineFormatter);
                    level++;
                }
                case "UNTIL" -> {
                    level = Math.max(0, level - 1);
                    lineLevel = level;
                    content = keyword("until") + " " + condition(rest, inlineFormatter);
                }
                case "ENDIF", "ENDFOR", "ENDWHILE", "ENDLOOP", "ENDPROCEDURE", "ENDFUNCTION" -> {
                    level = Math.max(0, level - 1);
                    lineLevel = level;
                    content = keyword("end " + keyword.substring(3).toLowerCase(Locale.ROOT)) + tail(rest, inlineFormatter);
                }
                case "RETURN" -> content = keyword("return") + tail(rest, inlineFormatter);
                case "PRINT" -> content = keyword("print") + tail(rest, inlineFormatter);
                case "REQUIRE", "ENSURE" -> {
                    numbered = false;
                    String label = "REQUIRE".equals(keyword) ? "Require:" : "Ensure:";
                    content = "<strong>" + label + "</strong>" + tail(rest, inlineFormatter);
                }
                case "STATE" -> content = statement(rest, inlineFormatter);
                default -> content = statement(line, inlineFormatter);
            }

            html.append("<div class=\"latex-alg-line\" style=\"padding-left: ")
                .append(DecimalText.plain(lineLevel * INDENT_EM)).append("em\">");
            if (numbered) {
                html.append("<span class=\"latex-alg-lineno\">").append(lineNumber++).append(".</span> ");
            }
            html.append("<span class=\"latex-alg-content\">").append(content).append("</span></div>");
        }
        return html.append("</div>").toString();
    }

    private static String keyword(String word) {
        return "<span class=\"latex-alg-keyword\">" + word + "</span>";
    }

    private static String block(String open, String condition, String close) {
        return keyword(open) + " " + condition + " " + keyword(close);
    }

    private static String condition(String rest, UnaryOperator<String> inlineFormatter) {
        Optional<LatexArguments.Argument> argument = LatexArguments.readBracedAfterWhitespace(rest, 0);
        if (argument.isEmpty()) {
            return statement(rest, inlineFormatter);
        }
        String trailing = rest.substring(argument.get().end());
        return inlineFormatter.apply(argument.get().content().strip()) + tail(trailing, inlineFormatter);
    }

    private static String procedure(String word, String rest, UnaryOperator<String> inlineFormatter) {
        Optional<LatexArguments.Argument> name = LatexArguments.readBracedAfterWhitespace(rest, 0);
        if (name.isEmpty()) {
            return keyword(word) + tail(rest, inlineFormatter);
        }
        Optional<LatexArguments.Argument> parameters = LatexArguments.readBracedAfterWhitespace(rest, name.get().end());
        String signature = "<span style=\"font-variant: small-caps;\">" + inlineFormatter.apply(name.get().content()) + "</span>"
            + "(" + parameters.map(p -> inlineFormatter.apply(p.content())).orElse("") + ")";
        int end = parameters.map(LatexArguments.Argument::end).orElse(name.get().end());
        return keyword(word) + " " + signature + tail(rest.substring(end), inlineFormatter);
    }

    private static String tail(String rest, UnaryOperator<String> inlineFormatter) {
        String formatted = statement(rest, inlineFormatter);
        return formatted.isEmpty() ? "" : " " + formatted;
    }

    private static String statement(String text, UnaryOperator<String> inlineFormatter) {
        int commentAt = text.indexOf(COMMENT);
        if (commentAt < 0) {
            return inlineFormatter.apply(text.strip());
        }
        String before = inlineFormatter.apply(text.substring(0, commentAt).strip());
        Optional<LatexArguments.Argument> comment =
            LatexArguments.readBracedAfterWhitespace(text, commentAt + COMMENT.length());
        String remark = comment.map(c -> inlineFormatter.apply(c.content().strip())).orElse("");
        List<String> parts = new ArrayList<>();
        if (!before.isEmpty()) {
            parts.add(before);
        }
        parts.add("<span class=\"latex-alg-comment\">▷ " + remark + "</span>");
        return String.join(" ", parts);
    }
}
