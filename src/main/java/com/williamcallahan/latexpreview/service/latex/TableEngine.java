package com.williamcallahan.latexpreview.service.latex;

import com.williamcallahan.latexpreview.config.PipelineLimits;
import com.williamcallahan.latexpreview.support.HtmlEscaper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts tabular environments and table floats into HTML tables.
 *
 * <p>Rows split on {@code \\} (or {@code \tabularnewline}) and cells on {@code &}, both only at brace
 * depth 0, so a break inside {@code \makecell{..}} and an escaped {@code \&} never split. A rule at the
 * start of a row belongs to the bottom of the row before it. Row spans are carried per column across
 * the following rows, whose empty shadow cells are dropped.</p>
 */
public class TableEngine {

    private static final Logger logger = LoggerFactory.getLogger(TableEngine.class);

    static final List<String> TABULAR_ENVIRONMENTS = List.of("tabular", "tabular*", "tabularx", "longtable");
    static final List<String> FLOAT_ENVIRONMENTS = List.of("table", "table*");

    private static final Pattern COMMENT = Pattern.compile("(?<!\\\\)%[^\\n]*");
    private static final Pattern SINGLE_BACKSLASH_BEFORE_RULE = Pattern.compile(
        "(?<!\\\\)\\\\\\s+\\\\(hline|toprule|midrule|bottomrule|cline|cmidrule)(?![a-zA-Z])");
    private static final Pattern RULE = Pattern.compile(
        "\\\\(?:(hline|toprule|midrule|bottomrule)(?![a-zA-Z])(?:\\s*\\[[^\\]]*\\])?"
            + "|(hhline)\\s*\\{[^{}]*\\}"
            + "|cline\\s*\\{\\s*(\\d{1,3})\\s*-\\s*(\\d{1,3})\\s*\\}"
            + "|cmidrule\\s*(?:\\[[^\\]]*\\])?\\s*(?:\\([^)]*\\))?\\s*\\{\\s*(\\d{1,3})\\s*-\\s*(\\d{1,3})\\s*\\})");
    private static final Pattern LAYOUT_NOISE = Pattern.compile(
        "\\\\(?:addlinespace(?:\\s*\\[[^\\]]*\\])?|endfirsthead|endhead|endfoot|endlastfoot"
            + "|rowcolor\\s*(?:\\[[^\\]]*\\])?\\s*\\{[^{}]*\\})(?![a-zA-Z])");
    private static final Pattern ROW_SPACING = Pattern.compile("\\s*-?\\d*\\.?\\d+\\s*[a-zA-Z]{2}\\s*|\\s*\\\\[a-zA-Z]+\\s*");
    private static final Pattern FLOAT_NOISE = Pattern.compile(
        "\\\\(?:centering|label\\s*\\{[^{}]*\\}|small|footnotesize|scriptsize|normalsize)(?![a-zA-Z])");
    private static final String TABULAR_NEWLINE = "\\tabularnewline";

    private final int maxIterations;

    public TableEngine(PipelineLimits limits) {
        this.maxIterations = Objects.requireNonNull(limits, "Pipeline limits cannot be null").getMaxExtractionIterations();
    }

    /**
     * Replaces table floats and standalone tabulars with block tokens.
     *
     * @param text document buffer
     * @param formatCell LaTeX-to-HTML formatter applied to cell and caption text
     * @param registry placeholder registry for this document
     * @return rewritten buffer and the table fragments registered
     */
    public ExtractionResult processTables(String text, UnaryOperator<String> formatCell, PlaceholderRegistry registry) {
        if (text == null || text.isEmpty()) {
            return new ExtractionResult("", null);
        }
        Objects.requireNonNull(formatCell, "Cell formatter cannot be null");
        int mark = registry.size();
        AtomicInteger tableNumber = new AtomicInteger();

        String source = text;
        String content = EnvironmentScanner.replaceAll(source, FLOAT_ENVIRONMENTS, maxIterations,
            span -> registry.registerBlock(PlaceholderCategory.TABLE,
                renderFloat(span.body(source), formatCell, registry, tableNumber)));
        content = renderTabulars(content, formatCell, registry, false);
        return new ExtractionResult(content, registry.entriesSince(mark));
    }

    private String renderTabulars(String text, UnaryOperator<String> formatCell, PlaceholderRegistry registry,
                                  boolean inline) {
        return EnvironmentScanner.replaceAll(text, TABULAR_ENVIRONMENTS, maxIterations, span -> {
            String html = renderTabularSafely(span, text, formatCell, registry);
            return inline
                ? registry.register(PlaceholderCategory.TABLE, html)
                : registry.registerBlock(PlaceholderCategory.TABLE, html);
        });
    }

    private String renderFloat(String body, UnaryOperator<String> formatCell, PlaceholderRegistry registry,
                               AtomicInteger tableNumber) {
        String inner = body;
        int optionStart = LatexArguments.skipWhitespace(inner, 0);
        Optional<LatexArguments.Argument> placement = LatexArguments.readBracketed(inner, optionStart);
        if (placement.isPresent()) {
            inner = inner.substring(placement.get().end());
        }

        String caption = null;
        int captionAt = inner.indexOf("\\caption");
        if (captionAt >= 0) {
            int argumentAt = LatexArguments.skipWhitespace(inner, captionAt + "\\caption".length());
            Optional<LatexArguments.Argument> shortCaption = LatexArguments.readBracketed(inner, argumentAt);
            if (shortCaption.isPresent()) {
                argumentAt = LatexArguments.skipWhitespace(inner, shortCaption.get().end());
            }
            Optional<LatexArguments.Argument> captionText = LatexArguments.readBraced(inner, argumentAt);
            if (captionText.isPresent()) {
                caption = captionText.get().content();
                inner = inner.substring(0, captionAt) + inner.substring(captionText.get().end());
            }
        }

        inner = FLOAT_NOISE.matcher(inner).replaceAll("");
        String tables = renderTabulars(inner, formatCell, registry, true).strip();

        StringBuilder html = new StringBuilder("<figure class=\"latex-table-float\">");
        if (caption != null) {
            html.append("<figcaption><strong>Table ").append(tableNumber.incrementAndGet()).append(":</strong> ")
                .append(formatCell.apply(caption.strip())).append("</figcaption>");
        }
        if (!tables.isEmpty()) {
            html.append(formatCell.apply(tables));
        }
        return html.append("</figure>").toString();
    }

    private String renderTabularSafely(EnvironmentSpan span, String text, UnaryOperator<String> formatCell,
                                       PlaceholderRegistry registry) {
        try {
            return renderTabular(span.name(), span.body(text), formatCell, registry);
        } catch (RuntimeException tableFailure) {
            logger.warn("Table rendering failed; emitting source as preformatted text", tableFailure);
            return "<pre class=\"latex-fallback\">" + HtmlEscaper.escape(text.substring(span.start(), span.end())) + "</pre>";
        }
    }

    /**
     * Renders one tabular environment given the text after its begin marker.
     */
    String renderTabular(String environment, String rawBody, UnaryOperator<String> formatCell,
                         PlaceholderRegistry registry) {
        int index = LatexArguments.skipWhitespace(rawBody, 0);
        if ("tabular*".equals(environment) || "tabularx".equals(environment)) {
            Optional<LatexArguments.Argument> width = LatexArguments.readBraced(rawBody, index);
            if (width.isPresent()) {
                index = LatexArguments.skipWhitespace(rawBody, width.get().end());
            }
        }
        Optional<LatexArguments.Argument> position = LatexArguments.readBracketed(rawBody, index);
        if (position.isPresent()) {
            index = LatexArguments.skipWhitespace(rawBody, position.get().end());
        }
        ColumnSpec columns = ColumnSpec.empty();
        Optional<LatexArguments.Argument> spec = LatexArguments.readBraced(rawBody, index);
        if (spec.isPresent()) {
            columns = ColumnSpec.parse(spec.get().content());
            index = spec.get().end();
        }

        String body = COMMENT.matcher(rawBody.substring(index)).replaceAll("");
        body = renderTabulars(body, formatCell, registry, true);
        body = SINGLE_BACKSLASH_BEFORE_RULE.matcher(body).replaceAll("\\\\\\\\ \\\\$1");
        List<TableRow> rows = parseRows(body);
        return renderHtml(rows, columns, formatCell);
    }

    List<TableRow> parseRows(String body) {
        List<TableRow> rows = new ArrayList<>();
        List<Rule> pendingTop = new ArrayList<>();
        for (String segment : splitRows(body)) {
            String cleaned = LAYOUT_NOISE.matcher(segment).replaceAll("");

            List<Rule> leading = new ArrayList<>();
            int position = LatexArguments.skipWhitespace(cleaned, 0);
            Matcher rule = RULE.matcher(cleaned);
            while (position < cleaned.length()) {
                rule.region(position, cleaned.length());
                if (!rule.lookingAt()) {
                    break;
                }
                leading.add(Rule.from(rule));
                position = LatexArguments.skipWhitespace(cleaned, rule.end());
            }

            List<Rule> inner = new ArrayList<>();
            Matcher innerRule = RULE.matcher(cleaned.substring(position));
            StringBuilder rest = new StringBuilder();
            while (innerRule.find()) {
                inner.add(Rule.from(innerRule));
                innerRule.appendReplacement(rest, "");
            }
            innerRule.appendTail(rest);

            TableRow previous = rows.isEmpty() ? null : rows.get(rows.size() - 1);
            for (Rule leadingRule : leading) {
                applyAfter(previous, leadingRule, pendingTop);
            }
            if (rest.toString().isBlank()) {
                for (Rule innerAfter : inner) {
                    applyAfter(previous, innerAfter, pendingTop);
                }
                continue;
            }

            TableRow row = new TableRow(splitCells(rest.toString()));
            if (rows.isEmpty()) {
                pendingTop.forEach(row::applyTop);
                pendingTop.clear();
            }
            inner.forEach(row::applyBottom);
            rows.add(row);
        }
        return rows;
    }

    private static void applyAfter(TableRow previous, Rule rule, List<Rule> pendingTop) {
        if (previous != null) {
            previous.applyBottom(rule);
        } else {
            pendingTop.add(rule);
        }
    }

    /**
     * Splits a tabular body into raw row segments on depth-0 row breaks, dropping {@code [len]} spacing.
     */
    static List<String> splitRows(String body) {
        List<String> rows = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c == '\\') {
                boolean doubleBackslash = i + 1 < body.length() && body.charAt(i + 1) == '\\';
                boolean tabularNewline = body.startsWith(TABULAR_NEWLINE, i)
                    && !continuesWord(body, i + TABULAR_NEWLINE.length());
                if (depth == 0 && (doubleBackslash || tabularNewline)) {
                    rows.add(current.toString());
                    current = new StringBuilder();
                    i = skipRowSpacing(body, i + (doubleBackslash ? 2 : TABULAR_NEWLINE.length()));
                    continue;
                }
                current.append(c);
                if (i + 1 < body.length()) {
                    current.append(body.charAt(i + 1));
                }
                i += 2;
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth = Math.max(0, depth - 1);
            }
            current.append(c);
            i++;
        }
        if (!current.toString().isBlank()) {
            rows.add(current.toString());
        }
        return rows;
    }

    private static int skipRowSpacing(String body, int index) {
        int i = index;
        if (i < body.length() && body.charAt(i) == '*') {
            i++;
        }
        int optionAt = LatexArguments.skipWhitespace(body, i);
        Optional<LatexArguments.Argument> spacing = LatexArguments.readBracketed(body, optionAt);
        if (spacing.isPresent() && ROW_SPACING.matcher(spacing.get().content()).matches()) {
            return spacing.get().end();
        }
        return i;
    }

    /**
     * Splits a row into raw cells on depth-0 {@code &}; escaped characters, {@code \&} included, stay in
     * the cell.
     */
    static List<String> splitCells(String row) {
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < row.length(); i++) {
            char c = row.charAt(i);
            if (c == '\\') {
                current.append(c);
                if (i + 1 < row.length()) {
                    current.append(row.charAt(++i));
                }
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (c == '&' && depth == 0) {
                cells.add(current.toString());
                current = new StringBuilder();
                continue;
            }
            current.append(c);
        }
        cells.add(current.toString());
        return cells;
    }

    private String renderHtml(List<TableRow> rows, ColumnSpec columns, UnaryOperator<String> formatCell) {
        StringBuilder html = new StringBuilder("<div class=\"table-wrapper\"><table class=\"latex-table\">");
        if (columns.hasWidths()) {
            html.append("<colgroup>");
            for (ColumnDefinition column : columns.columns()) {
                html.append(column.width().map(width -> "<col style=\"min-width: " + width + "\">").orElse("<col>"));
            }
            html.append("</colgroup>");
        }
        html.append("<tbody>");

        Map<Integer, Integer> activeSpans = new TreeMap<>();
        for (TableRow row : rows) {
            Set<Integer> owned = new HashSet<>(activeSpans.keySet());
            List<PlacedCell> placed = new ArrayList<>();
            int column = 0;
            for (String raw : row.cells()) {
                TableCell cell = TableCell.parse(raw);
                if (owned.contains(column) && cell.isShadowCandidate()) {
                    column += cell.colspan();
                    continue;
                }
                while (owned.contains(column)) {
                    column++;
                }
                placed.add(new PlacedCell(cell, column));
                column += cell.colspan();
            }

            activeSpans.replaceAll((key, remaining) -> remaining - 1);
            activeSpans.values().removeIf(remaining -> remaining <= 0);
            for (PlacedCell cell : placed) {
                if (cell.cell().rowspan() > 1) {
                    for (int spanned = 0; spanned < cell.cell().colspan(); spanned++) {
                        activeSpans.put(cell.column() + spanned, cell.cell().rowspan() - 1);
                    }
                }
            }

            html.append("<tr>");
            for (PlacedCell cell : placed) {
                html.append(renderCell(cell, row, columns, formatCell));
            }
            html.append("</tr>");
        }
        return html.append("</tbody></table></div>").toString();
    }

    private static String renderCell(PlacedCell placed, TableRow row, ColumnSpec columns,
                                     UnaryOperator<String> formatCell) {
        TableCell cell = placed.cell();
        int first = placed.column();
        int last = first + cell.colspan() - 1;
        Optional<ColumnDefinition> firstColumn = cell.columnOverride().or(() -> columns.column(first));
        Optional<ColumnDefinition> lastColumn = cell.columnOverride().or(() -> columns.column(last));

        List<String> style = new ArrayList<>();
        firstColumn.map(ColumnDefinition::alignment)
            .filter(alignment -> !"left".equals(alignment))
            .ifPresent(alignment -> style.add("text-align: " + alignment));
        if (row.hasTopRule(first, cell.colspan())) {
            style.add("border-top: 1px solid currentColor");
        }
        if (row.hasBottomRule(first, cell.colspan())) {
            style.add("border-bottom: 1px solid currentColor");
        }
        if (firstColumn.map(ColumnDefinition::leftRule).orElse(false)) {
            style.add("border-left: 1px solid currentColor");
        }
        if (lastColumn.map(ColumnDefinition::rightRule).orElse(false)) {
            style.add("border-right: 1px solid currentColor");
        }

        StringBuilder html = new StringBuilder("<td");
        if (cell.colspan() > 1) {
            html.append(" colspan=\"").append(cell.colspan()).append('"');
        }
        if (cell.rowspan() > 1) {
            html.append(" rowspan=\"").append(cell.rowspan()).append('"');
        }
        if (!style.isEmpty()) {
            html.append(" style=\"").append(String.join("; ", style)).append(";\"");
        }
        String content = cell.content().strip();
        html.append('>').append(content.isEmpty() ? "" : formatCell.apply(content)).append("</td>");
        return html.toString();
    }

    private static boolean continuesWord(String text, int index) {
        return index < text.length() && Character.isLetter(text.charAt(index));
    }

    private record PlacedCell(TableCell cell, int column) {
    }

    /**
     * A horizontal rule parsed from a row segment: full width when {@code partial} is empty.
     */
    record Rule(Optional<PartialRule> partial) {

        static Rule from(Matcher matcher) {
            if (matcher.group(1) != null || matcher.group(2) != null) {
                return new Rule(Optional.empty());
            }
            String first = matcher.group(3) != null ? matcher.group(3) : matcher.group(5);
            String last = matcher.group(4) != null ? matcher.group(4) : matcher.group(6);
            int from = Integer.parseInt(first);
            int to = Integer.parseInt(last);
            if (from < 1 || to < from) {
                return new Rule(Optional.empty());
            }
            return new Rule(Optional.of(new PartialRule(from, to)));
        }
    }

    /**
     * Raw cells of one row plus the rules drawn above and below it.
     */
    static final class TableRow {
        private final List<String> cells;
        private boolean topRule;
        private boolean bottomRule;
        private final List<PartialRule> topPartials = new ArrayList<>();
        private final List<PartialRule> bottomPartials = new ArrayList<>();

        TableRow(List<String> cells) {
            this.cells = List.copyOf(cells);
        }

        List<String> cells() {
            return cells;
        }

        void applyTop(Rule rule) {
            rule.partial().ifPresentOrElse(topPartials::add, () -> topRule = true);
        }

        void applyBottom(Rule rule) {
            rule.partial().ifPresentOrElse(bottomPartials::add, () -> bottomRule = true);
        }

        boolean hasTopRule(int column, int colspan) {
            return topRule || topPartials.stream().anyMatch(rule -> rule.overlaps(column, colspan));
        }

        boolean hasBottomRule(int column, int colspan) {
            return bottomRule || bottomPartials.stream().anyMatch(rule -> rule.overlaps(column, colspan));
        }
    }
}
