package com.williamcallahan.latexpreview.service.latex;

import com.williamcallahan.latexpreview.support.HtmlEscaper;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts running LaTeX text (paragraphs, cells, list items, captions) into inline HTML.
 *
 * <p>Fragments that must survive escaping untouched (special-character escapes, line breaks, inline
 * math, link targets) are swapped for private-use sentinels first and restored last. Formatting
 * commands are matched with brace balancing, so arguments may nest to any depth. Unknown commands are
 * dropped and their arguments kept as text. Placeholder tokens pass through unchanged.</p>
 */
public class LatexInlineFormatter {

    private static final char SENTINEL_OPEN = (char) 0xE000;
    private static final char SENTINEL_CLOSE = (char) 0xE001;
    private static final Pattern SENTINEL = Pattern.compile(SENTINEL_OPEN + "(\\d+)" + SENTINEL_CLOSE);
    private static final int MAX_COMMAND_PASSES = 8;

    private static final Pattern LINE_BREAK = Pattern.compile("\\\\\\\\\\*?(?:\\s*\\[[^\\]]*\\])?|\\\\newline(?![a-zA-Z])");
    private static final Pattern TEXT_BACKSLASH = Pattern.compile("\\\\textbackslash(?![a-zA-Z])(?:\\{\\})?");
    private static final Pattern ESCAPED_CHARACTER = Pattern.compile("\\\\([&%$#_{}])");
    private static final Pattern INLINE_MATH = Pattern.compile("(?<!\\\\)\\$([^$]+?)(?<!\\\\)\\$");
    private static final Pattern LEFTOVER_COMMAND = Pattern.compile("\\\\[a-zA-Z]+\\*?(?:\\[[^\\]]*\\])?\\s?");
    private static final Pattern SAFE_COLOR = Pattern.compile("[a-zA-Z]+|#[0-9a-fA-F]{3,6}");
    private static final Pattern SYMBOL_COMMAND = Pattern.compile("\\\\([a-zA-Z]+)(?![a-zA-Z])(?:\\{\\})?");
    private static final Pattern UNSAFE_SCHEME = Pattern.compile("^\\s*(?:javascript|data|vbscript):", Pattern.CASE_INSENSITIVE);

    private static final Map<String, String> SYMBOLS = Map.ofEntries(
        Map.entry("ldots", "…"),
        Map.entry("dots", "…"),
        Map.entry("textellipsis", "…"),
        Map.entry("LaTeX", "LaTeX"),
        Map.entry("TeX", "TeX"),
        Map.entry("S", "§"),
        Map.entry("P", "¶"),
        Map.entry("copyright", "©"),
        Map.entry("textregistered", "®"),
        Map.entry("texttrademark", "™"),
        Map.entry("textdegree", "°"),
        Map.entry("pounds", "£"),
        Map.entry("euro", "€"),
        Map.entry("textendash", "–"),
        Map.entry("textemdash", "—"),
        Map.entry("textbullet", "•"),
        Map.entry("quad", "\u2003"),
        Map.entry("qquad", "\u2003\u2003"));

    private static final Map<String, String[]> WRAPPERS = Map.ofEntries(
        Map.entry("textbf", new String[] {"<strong>", "</strong>"}),
        Map.entry("textit", new String[] {"<em>", "</em>"}),
        Map.entry("emph", new String[] {"<em>", "</em>"}),
        Map.entry("textsl", new String[] {"<em>", "</em>"}),
        Map.entry("underline", new String[] {"<u>", "</u>"}),
        Map.entry("uline", new String[] {"<u>", "</u>"}),
        Map.entry("texttt", new String[] {"<code>", "</code>"}),
        Map.entry("textsc", new String[] {"<span style=\"font-variant: small-caps;\">", "</span>"}),
        Map.entry("textsuperscript", new String[] {"<sup>", "</sup>"}),
        Map.entry("textsubscript", new String[] {"<sub>", "</sub>"}),
        Map.entry("footnote", new String[] {"<span class=\"latex-footnote\">(", ")</span>"}),
        Map.entry("fbox", new String[] {"<span class=\"latex-fbox\">", "</span>"}),
        Map.entry("mbox", new String[] {"", ""}),
        Map.entry("text", new String[] {"", ""}),
        Map.entry("textrm", new String[] {"", ""}),
        Map.entry("textnormal", new String[] {"", ""}),
        Map.entry("textsf", new String[] {"", ""}),
        Map.entry("textup", new String[] {"", ""}),
        Map.entry("ref", new String[] {"<span class=\"latex-ref\">[", "]</span>"}),
        Map.entry("autoref", new String[] {"<span class=\"latex-ref\">[", "]</span>"}),
        Map.entry("cref", new String[] {"<span class=\"latex-ref\">[", "]</span>"}),
        Map.entry("eqref", new String[] {"<span class=\"latex-ref\">(", ")</span>"}));

    private final UnaryOperator<String> inlineMath;

    public LatexInlineFormatter() {
        this(source -> "<span class=\"math-inline\">" + HtmlEscaper.escape(source) + "</span>");
    }

    /**
     * Creates a formatter that renders {@code $..$} spans through {@code inlineMath}.
     *
     * @param inlineMath maps a math source to the HTML (or token) that replaces it
     */
    public LatexInlineFormatter(UnaryOperator<String> inlineMath) {
        this.inlineMath = Objects.requireNonNull(inlineMath, "Inline math renderer cannot be null");
    }

    /**
     * Formats a fragment of running text.
     *
     * @param latex LaTeX text, may contain placeholder tokens
     * @return inline HTML
     */
    public String format(String latex) {
        if (latex == null || latex.isBlank()) {
            return "";
        }
        List<String> protectedFragments = new ArrayList<>();
        String text = protectLinks(latex, protectedFragments);
        text = replace(text, LINE_BREAK, match -> protect("<br>", protectedFragments));
        text = replace(text, TEXT_BACKSLASH, match -> protect("\\", protectedFragments));
        text = replace(text, INLINE_MATH, match -> protect(inlineMath.apply(match.group(1)), protectedFragments));
        text = replace(text, ESCAPED_CHARACTER, match -> protect(HtmlEscaper.escape(match.group(1)), protectedFragments));

        text = typography(text);
        text = HtmlEscaper.escape(text);
        text = applyCommands(text);
        text = replaceSymbols(text);
        text = LEFTOVER_COMMAND.matcher(text).replaceAll("");
        text = text.replace("{", "").replace("}", "");
        return restore(text, protectedFragments).strip();
    }

    private static String protect(String html, List<String> fragments) {
        fragments.add(html);
        return SENTINEL_OPEN + Integer.toString(fragments.size() - 1) + SENTINEL_CLOSE;
    }

    private static String restore(String text, List<String> fragments) {
        return replace(text, SENTINEL, match -> fragments.get(Integer.parseInt(match.group(1))));
    }

    private static String replace(String text, Pattern pattern, Function<Matcher, String> replacement) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement.apply(matcher)));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String protectLinks(String text, List<String> fragments) {
        StringBuilder out = new StringBuilder(text.length());
        int cursor = 0;
        while (cursor < text.length()) {
            int at = nextCommand(text, cursor, "url", "href");
            if (at < 0) {
                break;
            }
            out.append(text, cursor, at);
            boolean href = text.startsWith("\\href", at);
            int argumentAt = at + (href ? "\\href".length() : "\\url".length());
            Optional<LatexArguments.Argument> target = LatexArguments.readBracedAfterWhitespace(text, argumentAt);
            if (target.isEmpty()) {
                out.append(text.charAt(at));
                cursor = at + 1;
                continue;
            }
            String url = target.get().content().strip();
            String open = UNSAFE_SCHEME.matcher(url).find()
                ? "<span class=\"latex-link\">"
                : "<a href=\"" + HtmlEscaper.escape(url) + "\" rel=\"noopener noreferrer\">";
            String close = open.startsWith("<a") ? "</a>" : "</span>";
            if (href) {
                Optional<LatexArguments.Argument> label = LatexArguments.readBracedAfterWhitespace(text, target.get().end());
                if (label.isPresent()) {
                    out.append(protect(open, fragments)).append('{').append(label.get().content()).append('}')
                        .append(protect(close, fragments));
                    cursor = label.get().end();
                    continue;
                }
            }
            out.append(protect(open + HtmlEscaper.escape(url) + close, fragments));
            cursor = target.get().end();
        }
        out.append(text.substring(Math.min(cursor, text.length())));
        return out.toString();
    }

    private static int nextCommand(String text, int from, String... names) {
        int best = -1;
        for (String name : names) {
            int index = from;
            while ((index = text.indexOf("\\" + name, index)) >= 0) {
                int after = index + name.length() + 1;
                boolean escaped = index > 0 && text.charAt(index - 1) == '\\';
                if (!escaped && (after >= text.length() || !Character.isLetter(text.charAt(after)))) {
                    break;
                }
                index = after;
            }
            if (index >= 0 && (best < 0 || index < best)) {
                best = index;
            }
        }
        return best;
    }

    private static String typography(String text) {
        return text
            .replace("---", "—")
            .replace("--", "–")
            .replace("``", "“")
            .replace("''", "”")
            .replace("`", "‘")
            .replace("~", "\u00A0")
            .replace("\\,", "\u2009")
            .replace("\\;", " ")
            .replace("\\ ", " ")
            .replace("\\@", "");
    }

    private static String applyCommands(String text) {
        String current = text;
        for (int pass = 0; pass < MAX_COMMAND_PASSES; pass++) {
            String next = applyCommandsOnce(current);
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
        return current;
    }

    private static String applyCommandsOnce(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c != '\\') {
                out.append(c);
                i++;
                continue;
            }
            String name = LatexArguments.controlWordAt(text, i);
            int afterName = i + 1 + name.length();
            if (afterName < text.length() && text.charAt(afterName) == '*') {
                afterName++;
            }
            Optional<String> rendered = Optional.empty();
            int end = afterName;
            if (WRAPPERS.containsKey(name)) {
                int argumentAt = skipOptionalArgument(text, afterName);
                Optional<LatexArguments.Argument> argument = LatexArguments.readBracedAfterWhitespace(text, argumentAt);
                if (argument.isPresent()) {
                    String[] tags = WRAPPERS.get(name);
                    rendered = Optional.of(tags[0] + argument.get().content() + tags[1]);
                    end = argument.get().end();
                }
            } else if ("textcolor".equals(name) || "colorbox".equals(name)) {
                Optional<LatexArguments.Argument> color = LatexArguments.readBracedAfterWhitespace(text, afterName);
                Optional<LatexArguments.Argument> body = color.flatMap(
                    value -> LatexArguments.readBracedAfterWhitespace(text, value.end()));
                if (body.isPresent()) {
                    String property = "textcolor".equals(name) ? "color" : "background-color";
                    String value = color.get().content().strip();
                    rendered = Optional.of(SAFE_COLOR.matcher(value).matches()
                        ? "<span style=\"" + property + ": " + value.toLowerCase(Locale.ROOT) + ";\">" + body.get().content() + "</span>"
                        : body.get().content());
                    end = body.get().end();
                }
            } else if ("label".equals(name)) {
                Optional<LatexArguments.Argument> argument = LatexArguments.readBracedAfterWhitespace(text, afterName);
                if (argument.isPresent()) {
                    rendered = Optional.of("");
                    end = argument.get().end();
                }
            } else if ("includegraphics".equals(name)) {
                int argumentAt = skipOptionalArgument(text, afterName);
                Optional<LatexArguments.Argument> path = LatexArguments.readBracedAfterWhitespace(text, argumentAt);
                if (path.isPresent()) {
                    rendered = Optional.of("<span class=\"latex-placeholder-box\">[Image: " + path.get().content().strip() + "]</span>");
                    end = path.get().end();
                }
            }
            if (rendered.isPresent()) {
                out.append(rendered.get());
                i = end;
            } else {
                out.append(text, i, Math.max(afterName, i + 1));
                i = Math.max(afterName, i + 1);
            }
        }
        return out.toString();
    }

    private static int skipOptionalArgument(String text, int index) {
        int start = LatexArguments.skipWhitespace(text, index);
        return LatexArguments.readBracketed(text, start).map(LatexArguments.Argument::end).orElse(index);
    }

    private static String replaceSymbols(String text) {
        Matcher matcher = SYMBOL_COMMAND.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            String symbol = SYMBOLS.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(symbol != null ? symbol : matcher.group()));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
