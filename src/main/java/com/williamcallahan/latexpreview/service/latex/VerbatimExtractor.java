package com.williamcallahan.latexpreview.service.latex;

import com.williamcallahan.latexpreview.support.HtmlEscaper;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts code regions before math runs, so dollars and braces inside code are never interpreted.
 */
public class VerbatimExtractor {

    static final List<String> BLOCK_ENVIRONMENTS = List.of("verbatim", "verbatim*", "lstlisting", "minted", "Verbatim");

    private static final Pattern INLINE_VERB = Pattern.compile("\\\\(?:verb\\*?|lstinline)([^a-zA-Z\\s*{\\[])(.*?)\\1");
    private static final Pattern LANGUAGE_OPTION = Pattern.compile("language\\s*=\\s*\\{?([A-Za-z0-9+#-]+)\\}?");

    private final int maxIterations;

    public VerbatimExtractor(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    /**
     * Replaces code environments with block tokens and inline verbatim with inline tokens.
     *
     * @param text document buffer
     * @param registry placeholder registry for this document
     * @return rewritten buffer
     */
    public String extract(String text, PlaceholderRegistry registry) {
        Objects.requireNonNull(registry, "Placeholder registry cannot be null");
        if (text == null || text.isEmpty()) {
            return "";
        }
        String source = text;
        String content = EnvironmentScanner.replaceAll(source, BLOCK_ENVIRONMENTS, maxIterations,
            span -> registry.registerBlock(PlaceholderCategory.BLOCK, renderBlock(span.name(), span.body(source))));

        Matcher inline = INLINE_VERB.matcher(content);
        StringBuilder out = new StringBuilder(content.length());
        while (inline.find()) {
            String token = registry.register(PlaceholderCategory.BLOCK,
                "<code class=\"latex-verb\">" + HtmlEscaper.escape(inline.group(2)) + "</code>");
            inline.appendReplacement(out, Matcher.quoteReplacement(token));
        }
        inline.appendTail(out);
        return out.toString();
    }

    private static String renderBlock(String environment, String body) {
        String code = body;
        Optional<String> language = Optional.empty();
        if ("lstlisting".equals(environment) || "Verbatim".equals(environment)) {
            int optionAt = LatexArguments.skipWhitespace(code, 0);
            Optional<LatexArguments.Argument> options = code.startsWith("[", optionAt)
                ? LatexArguments.readBracketed(code, optionAt)
                : Optional.empty();
            if (options.isPresent()) {
                Matcher languageOption = LANGUAGE_OPTION.matcher(options.get().content());
                if (languageOption.find()) {
                    language = Optional.of(languageOption.group(1));
                }
                code = code.substring(options.get().end());
            }
        } else if ("minted".equals(environment)) {
            int index = LatexArguments.skipWhitespace(code, 0);
            Optional<LatexArguments.Argument> options = LatexArguments.readBracketed(code, index);
            if (options.isPresent()) {
                index = LatexArguments.skipWhitespace(code, options.get().end());
            }
            Optional<LatexArguments.Argument> lang = LatexArguments.readBraced(code, index);
            if (lang.isPresent()) {
                language = Optional.of(lang.get().content().strip());
                code = code.substring(lang.get().end());
            }
        }
        code = stripBoundaryNewlines(code);
        String classAttribute = language
            .map(lang -> " class=\"language-" + HtmlEscaper.escape(lang.toLowerCase(Locale.ROOT)) + "\"")
            .orElse("");
        return "<pre class=\"latex-verbatim\"><code" + classAttribute + ">" + HtmlEscaper.escape(code) + "</code></pre>";
    }

    private static String stripBoundaryNewlines(String code) {
        int start = 0;
        int end = code.length();
        while (start < end && (code.charAt(start) == '\n' || code.charAt(start) == '\r')) {
            start++;
        }
        while (end > start && Character.isWhitespace(code.charAt(end - 1))) {
            end--;
        }
        return code.substring(start, end);
    }
}
