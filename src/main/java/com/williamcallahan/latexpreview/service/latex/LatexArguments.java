package com.williamcallahan.latexpreview.service.latex;

import java.util.Optional;

/**
 * Index-walking readers for LaTeX command arguments.
 *
 * <p>Escaped delimiters ({@code \{}, {@code \}}, {@code \[}, {@code \]}) never change depth.</p>
 */
public final class LatexArguments {

    private LatexArguments() {
    }

    /**
     * A captured argument: its inner text and the index just past its closing delimiter.
     *
     * @param content text between the delimiters
     * @param end index after the closing delimiter
     */
    public record Argument(String content, int end) {
    }

    /**
     * Returns the first index at or after {@code index} that is not whitespace.
     */
    public static int skipWhitespace(String text, int index) {
        int i = index;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * Reads a brace-balanced group starting exactly at {@code index}.
     *
     * @param text source text
     * @param index position of the opening brace
     * @return the group, or empty when no group starts there or it is unterminated
     */
    public static Optional<Argument> readBraced(String text, int index) {
        if (index < 0 || index >= text.length() || text.charAt(index) != '{') {
            return Optional.empty();
        }
        int close = matchingBrace(text, index);
        if (close < 0) {
            return Optional.empty();
        }
        return Optional.of(new Argument(text.substring(index + 1, close), close + 1));
    }

    /**
     * Reads a brace group after optional whitespace.
     */
    public static Optional<Argument> readBracedAfterWhitespace(String text, int index) {
        return readBraced(text, skipWhitespace(text, index));
    }

    /**
     * Reads a square-bracket option group starting exactly at {@code index}. Brackets inside braces are
     * ignored, so {@code [label={[a]}]} is read whole.
     *
     * @param text source text
     * @param index position of the opening bracket
     * @return the group, or empty when absent or unterminated
     */
    public static Optional<Argument> readBracketed(String text, int index) {
        if (index < 0 || index >= text.length() || text.charAt(index) != '[') {
            return Optional.empty();
        }
        int braceDepth = 0;
        int bracketDepth = 0;
        for (int i = index; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
                continue;
            }
            if (c == '{') {
                braceDepth++;
            } else if (c == '}') {
                braceDepth = Math.max(0, braceDepth - 1);
            } else if (braceDepth == 0 && c == '[') {
                bracketDepth++;
            } else if (braceDepth == 0 && c == ']') {
                bracketDepth--;
                if (bracketDepth == 0) {
                    return Optional.of(new Argument(text.substring(index + 1, i), i + 1));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Finds the brace that closes the one at {@code openIndex}.
     *
     * @return index of the closing brace, or -1 when unbalanced
     */
    public static int matchingBrace(String text, int openIndex) {
        int depth = 0;
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Reads the control word starting at {@code index} (which must hold a backslash).
     *
     * @return the letters after the backslash, empty when none follow
     */
    public static String controlWordAt(String text, int index) {
        if (index < 0 || index >= text.length() || text.charAt(index) != '\\') {
            return "";
        }
        int i = index + 1;
        while (i < text.length() && Character.isLetter(text.charAt(i)) && text.charAt(i) < 128) {
            i++;
        }
        return text.substring(index + 1, i);
    }
}
