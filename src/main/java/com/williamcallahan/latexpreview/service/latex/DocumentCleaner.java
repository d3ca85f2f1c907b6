package com.williamcallahan.latexpreview.service.latex;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Final structural cleanup: preamble and trailer removal, comments, definitions and residual no-op
 * commands.
 */
public class DocumentCleaner {

    private static final String BODY_BEGIN = "\\begin{document}";
    private static final String BODY_END = "\\end{document}";

    /** Commands removed with their optional and mandatory arguments when there is no body marker. */
    private static final List<String> PREAMBLE_COMMANDS = List.of(
        "\\documentclass", "\\usepackage", "\\usetikzlibrary", "\\title", "\\author", "\\date",
        "\\pagestyle", "\\geometry", "\\hypersetup");
    /** Commands removed together with one braced argument anywhere in the body. */
    private static final List<String> ARGUMENT_NO_OPS = List.of(
        "\\bibliography", "\\bibliographystyle", "\\vspace", "\\vspace*", "\\hspace", "\\hspace*",
        "\\label", "\\input", "\\include", "\\thispagestyle", "\\pagestyle");

    private static final Pattern COMMENT_LINE = Pattern.compile("(?m)^[ \\t]*%.*(?:\\r?\\n|$)");
    private static final Pattern BARE_NO_OP = Pattern.compile(
        "\\\\(?:maketitle|tableofcontents|listoffigures|listoftables|newpage|clearpage|pagebreak|noindent"
            + "|centering|smallskip|medskip|bigskip|hfill|vfill|appendix)(?![a-zA-Z])\\s?");
    private static final Pattern STRAY_ENVIRONMENT_MARKER = Pattern.compile("\\\\(?:begin|end)\\{[A-Za-z]+\\*?\\}");
    private static final Pattern STRAY_ITEM = Pattern.compile("\\\\item(?![a-zA-Z])\\s*");

    private final MacroExtractor macroExtractor;

    public DocumentCleaner(MacroExtractor macroExtractor) {
        this.macroExtractor = macroExtractor;
    }

    /**
     * Cleans the buffer after every extraction stage has run.
     *
     * @param text document buffer
     * @return cleaned buffer
     */
    public String clean(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String cleaned = stripOutsideBody(text);
        cleaned = COMMENT_LINE.matcher(cleaned).replaceAll("");
        cleaned = macroExtractor.stripDefinitions(cleaned);
        for (String command : ARGUMENT_NO_OPS) {
            cleaned = stripCommand(cleaned, command);
        }
        cleaned = BARE_NO_OP.matcher(cleaned).replaceAll("");
        cleaned = STRAY_ENVIRONMENT_MARKER.matcher(cleaned).replaceAll("");
        return STRAY_ITEM.matcher(cleaned).replaceAll("• ");
    }

    static String stripOutsideBody(String text) {
        String body = text;
        int start = body.indexOf(BODY_BEGIN);
        if (start >= 0) {
            body = body.substring(start + BODY_BEGIN.length());
        } else {
            for (String command : PREAMBLE_COMMANDS) {
                body = stripCommand(body, command);
            }
        }
        int end = body.indexOf(BODY_END);
        return end >= 0 ? body.substring(0, end) : body;
    }

    /**
     * Removes every whole-word occurrence of {@code command}, its optional bracket argument and its
     * first braced argument. Occurrences without a balanced argument are left alone.
     */
    static String stripCommand(String text, String command) {
        StringBuilder out = new StringBuilder(text.length());
        int cursor = 0;
        int at = text.indexOf(command);
        while (at >= 0) {
            int after = at + command.length();
            boolean wholeWord = after >= text.length()
                || !(Character.isLetter(text.charAt(after)) || (!command.endsWith("*") && text.charAt(after) == '*'));
            if (!wholeWord) {
                at = text.indexOf(command, after);
                continue;
            }
            int argumentAt = LatexArguments.skipWhitespace(text, after);
            Optional<LatexArguments.Argument> options = LatexArguments.readBracketed(text, argumentAt);
            if (options.isPresent()) {
                argumentAt = LatexArguments.skipWhitespace(text, options.get().end());
            }
            Optional<LatexArguments.Argument> argument = LatexArguments.readBraced(text, argumentAt);
            if (argument.isEmpty()) {
                at = text.indexOf(command, after);
                continue;
            }
            out.append(text, cursor, at);
            cursor = argument.get().end();
            at = text.indexOf(command, cursor);
        }
        return out.append(text.substring(cursor)).toString();
    }
}
