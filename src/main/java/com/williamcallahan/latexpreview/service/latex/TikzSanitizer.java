package com.williamcallahan.latexpreview.service.latex;

import java.util.regex.Pattern;

/**
 * Rewrites a diagram body into the subset the browser TikZ backend accepts.
 *
 * <p>The backend base64-encodes its input and fails on non-ASCII code points, cannot typeset list
 * environments inside nodes, and treats a bare {@code &} as a field separator. Comments are removed
 * before line breaks are flattened so a trailing comment cannot swallow the command after it.</p>
 */
final class TikzSanitizer {

    private static final Pattern NON_ASCII = Pattern.compile("[^\\x00-\\x7F]");
    private static final Pattern COMMENT = Pattern.compile("(?<!\\\\)%.*$", Pattern.MULTILINE);
    private static final Pattern BOLD = Pattern.compile("\\\\textbf\\s*\\{");
    private static final Pattern ITALIC = Pattern.compile("\\\\textit\\s*\\{");
    private static final Pattern FONT_FAMILY = Pattern.compile("\\\\(?:sffamily|rmfamily|ttfamily)");
    private static final Pattern LITERAL_NEWLINE = Pattern.compile("\\\\n(?![a-zA-Z])");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");
    private static final Pattern ITEMIZE_OPTIONS = Pattern.compile("\\\\begin\\{itemize\\}\\[[^\\]]*\\]");
    private static final Pattern ITEMIZE_MARKER = Pattern.compile("\\\\(?:begin|end)\\{itemize\\}");
    private static final Pattern ITEM = Pattern.compile("\\\\item\\s+");
    private static final Pattern BREAK_THEN_SEPARATOR = Pattern.compile("\\\\\\\\&");
    private static final Pattern BARE_SEPARATOR = Pattern.compile("(?<!\\\\)&");

    private TikzSanitizer() {
    }

    static String sanitize(String body) {
        if (body == null || body.isEmpty()) {
            return "";
        }
        String safe = NON_ASCII.matcher(body).replaceAll("");
        safe = COMMENT.matcher(safe).replaceAll("");
        safe = BOLD.matcher(safe).replaceAll("{\\\\bfseries ");
        safe = ITALIC.matcher(safe).replaceAll("{\\\\itshape ");
        safe = FONT_FAMILY.matcher(safe).replaceAll("");
        safe = LITERAL_NEWLINE.matcher(safe).replaceAll(" ");
        safe = LINE_BREAK.matcher(safe).replaceAll(" ");

        safe = ITEMIZE_OPTIONS.matcher(safe).replaceAll("\\\\begin{itemize}");
        if (safe.contains("\\begin{itemize}")) {
            safe = ITEMIZE_MARKER.matcher(safe).replaceAll("");
            safe = ITEM.matcher(safe).replaceAll("\\\\par \\$\\\\bullet\\$ ");
        }

        safe = BREAK_THEN_SEPARATOR.matcher(safe).replaceAll("\\\\\\\\ \\\\&");
        return BARE_SEPARATOR.matcher(safe).replaceAll("\\\\&");
    }
}
