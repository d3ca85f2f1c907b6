package com.williamcallahan.latexpreview.service.latex;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A parsed table cell with its spans.
 *
 * <p>{@code \multicolumn{n}{spec}{content}} and {@code \multirow[pos]{n}{width}{content}} are unwrapped
 * in either nesting order. A {@code \multicolumn} spec overrides the column's alignment and rules.</p>
 *
 * @param content raw LaTeX content
 * @param colspan spanned columns, at least 1
 * @param rowspan spanned rows, at least 1
 * @param columnOverride alignment and rules from a {@code \multicolumn} spec
 */
record TableCell(String content, int colspan, int rowspan, Optional<ColumnDefinition> columnOverride) {

    private static final int MAX_SPAN = 64;
    private static final Pattern SPAN_COUNT = Pattern.compile("-?\\d{1,3}");
    private static final String MULTICOLUMN = "\\multicolumn";
    private static final String MULTIROW = "\\multirow";

    TableCell {
        Objects.requireNonNull(content, "Cell content cannot be null");
        columnOverride = columnOverride == null ? Optional.empty() : columnOverride;
    }

    /**
     * Parses one raw cell as split from a row.
     */
    static TableCell parse(String raw) {
        String text = raw == null ? "" : raw.strip();
        int colspan = 1;
        int rowspan = 1;
        Optional<ColumnDefinition> override = Optional.empty();
        for (int unwrap = 0; unwrap < 4; unwrap++) {
            if (text.startsWith(MULTICOLUMN) && !continuesWord(text, MULTICOLUMN.length())) {
                Optional<SpanCommand> command = readMulticolumn(text);
                if (command.isEmpty()) {
                    break;
                }
                colspan = command.get().count();
                override = ColumnSpec.parse(command.get().spec()).column(0);
                text = command.get().content();
            } else if (text.startsWith(MULTIROW) && !continuesWord(text, MULTIROW.length())) {
                Optional<SpanCommand> command = readMultirow(text);
                if (command.isEmpty()) {
                    break;
                }
                rowspan = command.get().count();
                text = command.get().content();
            } else {
                break;
            }
        }
        return new TableCell(text, colspan, rowspan, override);
    }

    /**
     * Reports whether the cell is empty and spans a single row, the shape of a row-span shadow.
     */
    boolean isShadowCandidate() {
        return rowspan == 1 && content.isBlank();
    }

    private static Optional<SpanCommand> readMulticolumn(String text) {
        Optional<LatexArguments.Argument> count = LatexArguments.readBracedAfterWhitespace(text, MULTICOLUMN.length());
        if (count.isEmpty()) {
            return Optional.empty();
        }
        Optional<LatexArguments.Argument> spec = LatexArguments.readBracedAfterWhitespace(text, count.get().end());
        if (spec.isEmpty()) {
            return Optional.empty();
        }
        Optional<LatexArguments.Argument> content = LatexArguments.readBracedAfterWhitespace(text, spec.get().end());
        if (content.isEmpty()) {
            return Optional.empty();
        }
        return spanCount(count.get().content()).map(n -> new SpanCommand(n, spec.get().content(),
            (content.get().content() + " " + text.substring(content.get().end())).strip()));
    }

    private static Optional<SpanCommand> readMultirow(String text) {
        int index = LatexArguments.skipWhitespace(text, MULTIROW.length());
        index = skipOptional(text, index);
        Optional<LatexArguments.Argument> count = LatexArguments.readBraced(text, index);
        if (count.isEmpty()) {
            return Optional.empty();
        }
        index = skipOptional(text, LatexArguments.skipWhitespace(text, count.get().end()));
        if (index < text.length() && text.charAt(index) == '*') {
            index++;
        } else {
            Optional<LatexArguments.Argument> width = LatexArguments.readBraced(text, index);
            if (width.isEmpty()) {
                return Optional.empty();
            }
            index = width.get().end();
        }
        index = skipOptional(text, LatexArguments.skipWhitespace(text, index));
        Optional<LatexArguments.Argument> content = LatexArguments.readBraced(text, index);
        if (content.isEmpty()) {
            return Optional.empty();
        }
        String remainder = text.substring(content.get().end());
        return spanCount(count.get().content()).map(n -> new SpanCommand(n, "",
            (content.get().content() + " " + remainder).strip()));
    }

    private static int skipOptional(String text, int index) {
        int start = LatexArguments.skipWhitespace(text, index);
        return LatexArguments.readBracketed(text, start)
            .map(argument -> LatexArguments.skipWhitespace(text, argument.end()))
            .orElse(start);
    }

    private static Optional<Integer> spanCount(String raw) {
        String value = raw.strip();
        if (!SPAN_COUNT.matcher(value).matches()) {
            return Optional.empty();
        }
        int count = Math.abs(Integer.parseInt(value));
        return Optional.of(Math.max(1, Math.min(MAX_SPAN, count)));
    }

    private static boolean continuesWord(String text, int index) {
        return index < text.length() && Character.isLetter(text.charAt(index));
    }

    private record SpanCommand(int count, String spec, String content) {
    }
}
