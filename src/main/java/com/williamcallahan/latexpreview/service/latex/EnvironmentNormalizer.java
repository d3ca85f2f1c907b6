package com.williamcallahan.latexpreview.service.latex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the remaining named environments into block HTML.
 *
 * <p>Environments are visited left to right. Each is classified by {@link EnvironmentKind}; known kinds
 * are rendered and registered as block tokens, pass-through kinds are skipped untouched, and unknown
 * kinds lose their markers so their body flows into the surrounding text. Bodies go through the
 * context's body formatter, which recurses back into this normalizer for nested environments.</p>
 */
public class EnvironmentNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(EnvironmentNormalizer.class);

    private static final Pattern BEGIN = Pattern.compile("\\\\begin\\{([A-Za-z]+\\*?)\\}");
    private static final Pattern LABEL = Pattern.compile("\\\\label\\{[^}]*\\}");
    private static final Pattern CENTERING = Pattern.compile("\\\\centering(?![a-zA-Z])");
    private static final String CAPTION = "\\caption";
    private static final String KEYWORDS = "\\keywords";
    private static final String END_OF_PROOF = "<span class=\"latex-qed\" style=\"float: right;\">∎</span>";

    private final int maxIterations;

    public EnvironmentNormalizer(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    /**
     * Normalizes every environment and {@code \keywords} block in {@code text}.
     *
     * @param text document buffer
     * @param context per-document collaborators
     * @return rewritten buffer
     */
    public String normalize(String text, EnvironmentContext context) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String buffer = text;
        int cursor = 0;
        int replacements = 0;
        Matcher begin = BEGIN.matcher(buffer);
        while (cursor < buffer.length() && begin.find(cursor)) {
            String name = begin.group(1);
            EnvironmentKind kind = EnvironmentKind.of(name, context.macros());
            if (kind == EnvironmentKind.PASS_THROUGH) {
                cursor = begin.end();
                continue;
            }
            Optional<EnvironmentSpan> found = EnvironmentScanner.matchFrom(buffer, name, begin.start());
            if (found.isEmpty()) {
                cursor = begin.end();
                continue;
            }
            if (replacements++ >= maxIterations) {
                logger.warn("Environment normalization cap of {} reached; remaining environments left as text",
                    maxIterations);
                break;
            }
            EnvironmentSpan span = found.get();
            String body = span.body(buffer);
            String replacement;
            int resume;
            if (kind == EnvironmentKind.UNKNOWN) {
                logger.debug("Unwrapping unrecognized environment '{}'", name);
                replacement = body;
                resume = span.start();
            } else {
                replacement = context.registry().registerBlock(PlaceholderCategory.BLOCK,
                    render(kind, name, body, context));
                resume = span.start() + replacement.length();
            }
            buffer = buffer.substring(0, span.start()) + replacement + buffer.substring(span.end());
            begin = BEGIN.matcher(buffer);
            cursor = resume;
        }
        return replaceKeywords(buffer, context);
    }

    String render(EnvironmentKind kind, String name, String body, EnvironmentContext context) {
        return switch (kind) {
            case THEOREM_LIKE -> theorem(name, body, context);
            case PROOF -> proof(body, context);
            case ABSTRACT -> "<div class=\"latex-abstract\"><div class=\"latex-abstract-title\">Abstract</div>"
                + context.bodyFormatter().apply(body) + "</div>";
            case QUOTE -> "<blockquote class=\"latex-quote\">" + context.bodyFormatter().apply(body) + "</blockquote>";
            case CENTER -> aligned("center", body, context);
            case FLUSH_LEFT -> aligned("left", body, context);
            case FLUSH_RIGHT -> aligned("right", body, context);
            case FIGURE -> figure(body, context);
            case ALGORITHM_FLOAT -> algorithmFloat(body, context);
            case MINIPAGE -> minipage(body, context);
            case PASS_THROUGH, UNKNOWN -> throw new LatexProcessingException(
                "Environment kind " + kind + " has no block rendering (" + name + ")");
        };
    }

    private static String theorem(String name, String body, EnvironmentContext context) {
        String base = name.endsWith("*") ? name.substring(0, name.length() - 1) : name;
        String label = context.macros().theoremLabel(base).orElseGet(() -> capitalize(base));
        String content = body;
        String heading = label;
        Optional<LatexArguments.Argument> subtitle =
            LatexArguments.readBracketed(content, LatexArguments.skipWhitespace(content, 0));
        if (subtitle.isPresent()) {
            heading = label + " (" + context.inlineFormatter().apply(subtitle.get().content().strip()) + ")";
            content = content.substring(subtitle.get().end());
        }
        String lead = "<strong>" + heading + ".</strong>";
        return "<div class=\"latex-theorem latex-env-" + base.toLowerCase(Locale.ROOT) + "\">"
            + leadInto(lead, context.bodyFormatter().apply(content)) + "</div>";
    }

    private static String proof(String body, EnvironmentContext context) {
        String content = body;
        String title = "Proof";
        Optional<LatexArguments.Argument> custom =
            LatexArguments.readBracketed(content, LatexArguments.skipWhitespace(content, 0));
        if (custom.isPresent()) {
            title = context.inlineFormatter().apply(custom.get().content().strip());
            content = content.substring(custom.get().end());
        }
        String html = leadInto("<em>" + title + ".</em>", context.bodyFormatter().apply(content));
        if (html.endsWith("</p>")) {
            html = html.substring(0, html.length() - "</p>".length()) + " " + END_OF_PROOF + "</p>";
        } else {
            html = html + " " + END_OF_PROOF;
        }
        return "<div class=\"latex-proof\">" + html + "</div>";
    }

    private static String aligned(String alignment, String body, EnvironmentContext context) {
        return "<div class=\"latex-" + alignment + "\" style=\"text-align: " + alignment + ";\">"
            + context.bodyFormatter().apply(body) + "</div>";
    }

    private static String figure(String body, EnvironmentContext context) {
        Captioned captioned = Captioned.from(skipPlacement(body));
        StringBuilder html = new StringBuilder("<figure class=\"latex-figure\">")
            .append(context.bodyFormatter().apply(captioned.body()));
        captioned.caption().ifPresent(caption -> html
            .append("<figcaption><strong>Figure ").append(context.numbering().nextFigure()).append(":</strong> ")
            .append(context.inlineFormatter().apply(caption)).append("</figcaption>"));
        return html.append("</figure>").toString();
    }

    private static String algorithmFloat(String body, EnvironmentContext context) {
        Captioned captioned = Captioned.from(skipPlacement(body));
        StringBuilder html = new StringBuilder("<div class=\"latex-algorithm-float\">");
        captioned.caption().ifPresent(caption -> html
            .append("<div class=\"latex-algorithm-caption\"><strong>Algorithm ")
            .append(context.numbering().nextAlgorithm()).append(":</strong> ")
            .append(context.inlineFormatter().apply(caption)).append("</div>"));
        return html.append(context.bodyFormatter().apply(captioned.body())).append("</div>").toString();
    }

    private static String minipage(String body, EnvironmentContext context) {
        String content = skipPlacement(body);
        Optional<LatexArguments.Argument> width = LatexArguments.readBracedAfterWhitespace(content, 0);
        String style = "display: inline-block; vertical-align: top;";
        if (width.isPresent()) {
            Optional<String> css = ColumnSpec.cssWidth(width.get().content().strip());
            if (css.isPresent()) {
                style = style + " width: " + css.get() + ";";
            }
            content = content.substring(width.get().end());
        }
        return "<div class=\"latex-minipage\" style=\"" + style + "\">"
            + context.bodyFormatter().apply(content) + "</div>";
    }

    private String replaceKeywords(String text, EnvironmentContext context) {
        StringBuilder out = new StringBuilder(text.length());
        int cursor = 0;
        int at = text.indexOf(KEYWORDS);
        while (at >= 0) {
            int after = at + KEYWORDS.length();
            boolean wholeWord = after >= text.length() || !Character.isLetter(text.charAt(after));
            Optional<LatexArguments.Argument> argument = wholeWord
                ? LatexArguments.readBracedAfterWhitespace(text, after)
                : Optional.empty();
            if (argument.isPresent()) {
                out.append(text, cursor, at);
                out.append(context.registry().registerBlock(PlaceholderCategory.BLOCK,
                    "<div class=\"latex-keywords\"><strong>Keywords:</strong> "
                        + context.inlineFormatter().apply(argument.get().content().strip()) + "</div>"));
                cursor = argument.get().end();
                at = text.indexOf(KEYWORDS, cursor);
            } else {
                at = text.indexOf(KEYWORDS, after);
            }
        }
        return out.append(text.substring(cursor)).toString();
    }

    private static String skipPlacement(String body) {
        Optional<LatexArguments.Argument> placement =
            LatexArguments.readBracketed(body, LatexArguments.skipWhitespace(body, 0));
        return placement.map(p -> body.substring(p.end())).orElse(body);
    }

    private static String leadInto(String lead, String html) {
        if (html.startsWith("<p>")) {
            return "<p>" + lead + " " + html.substring("<p>".length());
        }
        return html.isEmpty() ? lead : lead + " " + html;
    }

    private static String capitalize(String name) {
        if (name.isEmpty()) {
            return name;
        }
        return name.substring(0, 1).toUpperCase(Locale.ROOT) + name.substring(1);
    }

    /**
     * Float body with its caption lifted out and labels and {@code \centering} removed.
     */
    private record Captioned(String body, Optional<String> caption) {

        static Captioned from(String body) {
            String remaining = LABEL.matcher(body).replaceAll("");
            remaining = CENTERING.matcher(remaining).replaceAll("");
            int at = remaining.indexOf(CAPTION);
            while (at >= 0) {
                int argumentAt = LatexArguments.skipWhitespace(remaining, at + CAPTION.length());
                Optional<LatexArguments.Argument> shortForm = LatexArguments.readBracketed(remaining, argumentAt);
                if (shortForm.isPresent()) {
                    argumentAt = LatexArguments.skipWhitespace(remaining, shortForm.get().end());
                }
                Optional<LatexArguments.Argument> text = LatexArguments.readBraced(remaining, argumentAt);
                if (text.isPresent()) {
                    String rest = remaining.substring(0, at) + remaining.substring(text.get().end());
                    return new Captioned(rest, Optional.of(text.get().content().strip()));
                }
                at = remaining.indexOf(CAPTION, at + CAPTION.length());
            }
            return new Captioned(remaining, Optional.empty());
        }
    }
}
