package com.williamcallahan.latexpreview.service.latex;

import com.williamcallahan.latexpreview.support.DecimalText;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed tabular column specification such as {@code |l|c|p{3cm}|} or {@code *{3}{c}}.
 *
 * <p>Letter columns {@code l c r X} and width columns {@code p m b} are counted; {@code |} becomes a rule
 * on the adjacent column; {@code @ ! > <} arguments carry no layout and are skipped. Widths are kept as
 * CSS lengths, with {@code \textwidth}-style fractions converted to percentages.</p>
 *
 * @param columns column definitions in order
 */
public record ColumnSpec(List<ColumnDefinition> columns) {

    private static final int MAX_REPEAT = 64;
    private static final Pattern RELATIVE_WIDTH = Pattern.compile(
        "^\\s*(\\d*\\.?\\d+)?\\s*\\\\(?:textwidth|linewidth|columnwidth|hsize)\\s*$");
    private static final Pattern ABSOLUTE_WIDTH = Pattern.compile("^\\s*(\\d*\\.?\\d+)\\s*(cm|mm|in|pt|em|ex|px)\\s*$");

    public ColumnSpec {
        columns = List.copyOf(columns);
    }

    public static ColumnSpec empty() {
        return new ColumnSpec(List.of());
    }

    /**
     * Parses a column specification; unknown letters count as left-aligned columns.
     *
     * @param spec specification text without the outer braces
     * @return parsed columns, empty for blank input
     */
    public static ColumnSpec parse(String spec) {
        if (spec == null || spec.isBlank()) {
            return empty();
        }
        List<ColumnDefinition> columns = new ArrayList<>();
        boolean pendingLeftRule = false;
        String text = expandRepeats(spec);
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '|') {
                if (columns.isEmpty()) {
                    pendingLeftRule = true;
                } else {
                    int last = columns.size() - 1;
                    columns.set(last, columns.get(last).withRightRule());
                }
                i++;
            } else if (c == '@' || c == '!' || c == '>' || c == '<') {
                i = skipArgument(text, i + 1);
            } else if (c == 'p' || c == 'm' || c == 'b') {
                Optional<LatexArguments.Argument> width = LatexArguments.readBracedAfterWhitespace(text, i + 1);
                columns.add(new ColumnDefinition("left", width.flatMap(w -> cssWidth(w.content())), false, false));
                i = width.map(LatexArguments.Argument::end).orElse(i + 1);
            } else if (Character.isLetter(c)) {
                columns.add(ColumnDefinition.aligned(alignmentOf(c)));
                i++;
            } else if (c == '{') {
                i = skipArgument(text, i);
            } else {
                i++;
            }
            if (pendingLeftRule && !columns.isEmpty()) {
                columns.set(0, columns.get(0).withLeftRule());
                pendingLeftRule = false;
            }
        }
        return new ColumnSpec(columns);
    }

    private static String alignmentOf(char letter) {
        return switch (letter) {
            case 'c' -> "center";
            case 'r' -> "right";
            default -> "left";
        };
    }

    private static int skipArgument(String text, int index) {
        return LatexArguments.readBracedAfterWhitespace(text, index)
            .map(LatexArguments.Argument::end)
            .orElse(index);
    }

    private static String expandRepeats(String spec) {
        StringBuilder out = new StringBuilder(spec.length());
        int i = 0;
        while (i < spec.length()) {
            char c = spec.charAt(i);
            if (c == '*') {
                Optional<LatexArguments.Argument> count = LatexArguments.readBracedAfterWhitespace(spec, i + 1);
                Optional<LatexArguments.Argument> body = count.flatMap(n -> LatexArguments.readBracedAfterWhitespace(spec, n.end()));
                if (count.isPresent() && body.isPresent() && count.get().content().strip().matches("\\d{1,3}")) {
                    int times = Math.min(MAX_REPEAT, Integer.parseInt(count.get().content().strip()));
                    out.append(expandRepeats(body.get().content()).repeat(times));
                    i = body.get().end();
                    continue;
                }
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    /**
     * Converts a LaTeX length into a CSS width.
     *
     * @param length length text such as {@code 3cm} or {@code 0.3\textwidth}
     * @return CSS width, empty when the length is not understood
     */
    static Optional<String> cssWidth(String length) {
        if (length == null) {
            return Optional.empty();
        }
        Matcher relative = RELATIVE_WIDTH.matcher(length);
        if (relative.matches()) {
            double fraction = relative.group(1) == null ? 1.0 : Double.parseDouble(relative.group(1));
            return Optional.of(DecimalText.plain(fraction * 100) + "%");
        }
        Matcher absolute = ABSOLUTE_WIDTH.matcher(length);
        if (absolute.matches()) {
            return Optional.of(absolute.group(1) + absolute.group(2).toLowerCase(Locale.ROOT));
        }
        return Optional.empty();
    }

    public int size() {
        return columns.size();
    }

    public Optional<ColumnDefinition> column(int index) {
        return index >= 0 && index < columns.size() ? Optional.of(columns.get(index)) : Optional.empty();
    }

    public boolean hasWidths() {
        return columns.stream().anyMatch(column -> column.width().isPresent());
    }
}
