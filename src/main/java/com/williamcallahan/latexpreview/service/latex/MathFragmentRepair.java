package com.williamcallahan.latexpreview.service.latex;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Repairs for math that generated text commonly fragments or double-wraps.
 *
 * <p>Each repair is idempotent once run to its fixpoint.</p>
 */
final class MathFragmentRepair {

    private static final int MAX_MERGE_PASSES = 16;

    private static final Pattern BRACKET_DISPLAY = Pattern.compile("(?<!\\\\)\\\\\\[([\\s\\S]*?)(?<!\\\\)\\\\\\]");
    private static final Pattern PAREN_INLINE = Pattern.compile("(?<!\\\\)\\\\\\(([\\s\\S]*?)(?<!\\\\)\\\\\\)");
    private static final Pattern MATH_ENVIRONMENT = Pattern.compile(
        "\\\\begin\\s*\\{(equation|align|gather|multline)(\\*?)\\}([\\s\\S]*?)\\\\end\\s*\\{\\1\\2\\}");
    private static final Pattern UNESCAPED_DOLLAR = Pattern.compile("(?<!\\\\)\\$");

    // $A$ = $B$ + rest-of-line
    private static final Pattern EQUATION_WITH_TAIL =
        Pattern.compile("(?<!\\$)\\$([^$\\n]+)\\$[ \\t]*=[ \\t]*\\$([^$\\n]+)\\$[ \\t]*\\+[ \\t]*([^$\\n]*?)[ \\t]*$", Pattern.MULTILINE);
    // $a$ op $b$
    private static final Pattern OPERATOR_JOINED =
        Pattern.compile("(?<!\\$)\\$([^$\\n]+)\\$[ \\t]*([=+\\-])[ \\t]*\\$([^$\\n]+)\\$(?!\\$)");
    private static final Pattern ORPHAN_SUBSCRIPT = Pattern.compile("(?<!\\$)\\$([^$\\n]+)\\$_([a-zA-Z0-9]+)");
    private static final Pattern ORPHAN_BRACED_SUBSCRIPT = Pattern.compile("(?<!\\$)\\$([^$\\n]+)\\$_\\s*\\{([^{}]+)\\}");

    private MathFragmentRepair() {
    }

    /**
     * Removes unescaped dollar signs nested inside {@code \[..\]}, {@code \(..\)} and display
     * environments.
     */
    static String stripNestedDelimiters(String text) {
        String result = stripInside(text, BRACKET_DISPLAY, "\\[", "\\]", 1);
        result = stripInside(result, PAREN_INLINE, "\\(", "\\)", 1);
        Matcher matcher = MATH_ENVIRONMENT.matcher(result);
        StringBuilder out = new StringBuilder(result.length());
        while (matcher.find()) {
            String env = matcher.group(1) + matcher.group(2);
            String inner = UNESCAPED_DOLLAR.matcher(matcher.group(3)).replaceAll("");
            matcher.appendReplacement(out, Matcher.quoteReplacement(
                "\\begin{" + env + "}" + inner + "\\end{" + env + "}"));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String stripInside(String text, Pattern pattern, String open, String close, int group) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            String inner = UNESCAPED_DOLLAR.matcher(matcher.group(group)).replaceAll("");
            matcher.appendReplacement(out, Matcher.quoteReplacement(open + inner + close));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Collapses operator-joined single-dollar spans into one span, promotes {@code $A$ = $B$ + tail}
     * lines whose tail looks like math into display math, and pulls orphaned subscripts back inside the
     * preceding span. Runs until nothing changes.
     */
    static String mergeOperatorSpans(String text) {
        String current = text;
        for (int pass = 0; pass < MAX_MERGE_PASSES; pass++) {
            String next = mergeOnce(current);
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
        return current;
    }

    private static String mergeOnce(String text) {
        Matcher tail = EQUATION_WITH_TAIL.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (tail.find()) {
            String rest = tail.group(3);
            String replacement = tail.group();
            if (rest.contains("\\") || rest.contains("_") || rest.contains("^")) {
                replacement = "$$ " + tail.group(1).strip() + " = " + tail.group(2).strip() + " + " + rest + " $$";
            }
            tail.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        tail.appendTail(out);
        String result = out.toString();

        result = OPERATOR_JOINED.matcher(result).replaceAll(m -> Matcher.quoteReplacement(
            "$" + m.group(1) + " " + m.group(2) + " " + m.group(3) + "$"));
        result = ORPHAN_SUBSCRIPT.matcher(result).replaceAll(m -> Matcher.quoteReplacement(
            "$" + m.group(1) + "_{" + m.group(2) + "}$"));
        result = ORPHAN_BRACED_SUBSCRIPT.matcher(result).replaceAll(m -> Matcher.quoteReplacement(
            "$" + m.group(1) + "_{" + m.group(2) + "}$"));
        return result;
    }
}
