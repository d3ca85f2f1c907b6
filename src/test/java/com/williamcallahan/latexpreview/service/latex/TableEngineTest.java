package com.williamcallahan.latexpreview.service.latex;

import com.williamcallahan.latexpreview.config.PipelineLimits;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Verifies row and cell splitting, spans, rules and table floats.
 */
class TableEngineTest {

    private static final String BORDER = "1px solid currentColor";

    private final TableEngine engine = new TableEngine(new PipelineLimits());

    @Test
    void plainRowsProduceOneCellPerEntry() {
        Document table = render("\\begin{tabular}{ll}A & B \\\\ C & D \\\\\\end{tabular}", UnaryOperator.identity());

        Elements cells = table.select("td");
        assertEquals(List.of("A", "B", "C", "D"), cells.eachText());
        assertTrue(table.select("td[colspan], td[rowspan]").isEmpty());
        assertEquals(2, table.select("tr").size());
    }

    @Test
    void escapedAmpersandStaysInsideItsCell() {
        Document table = render("\\begin{tabular}{ll}R\\&D & x \\\\\\end{tabular}", new LatexInlineFormatter()::format);

        assertEquals(List.of("R&D", "x"), table.select("td").eachText());
    }

    @Test
    void rulesAndColumnBordersBecomeCellStyles() {
        Document table = render("\\begin{tabular}{|l|c|}\n\\hline\nA & B \\\\\n\\hline\nC & D \\\\\n\\hline\n\\end{tabular}",
            UnaryOperator.identity());

        Elements cells = table.select("td");
        assertEquals(4, cells.size());
        String first = cells.get(0).attr("style");
        assertTrue(first.contains("border-top: " + BORDER));
        assertTrue(first.contains("border-bottom: " + BORDER));
        assertTrue(first.contains("border-left: " + BORDER));
        assertTrue(first.contains("border-right: " + BORDER));
        assertTrue(cells.get(1).attr("style").startsWith("text-align: center"));
        assertFalse(cells.get(2).attr("style").contains("border-top"));
        assertTrue(cells.get(3).attr("style").contains("border-bottom: " + BORDER));
    }

    @Test
    void partialRuleOnlyUnderlinesItsColumns() {
        Document table = render("\\begin{tabular}{lll}a & b & c \\\\ \\cline{2-3} d & e & f \\\\\\end{tabular}",
            UnaryOperator.identity());

        Elements firstRow = table.select("tr").get(0).select("td");
        assertFalse(firstRow.get(0).attr("style").contains("border-bottom"));
        assertTrue(firstRow.get(1).attr("style").contains("border-bottom"));
        assertTrue(firstRow.get(2).attr("style").contains("border-bottom"));
    }

    @Test
    void multicolumnSetsColspanAndAlignment() {
        Document table = render("\\begin{tabular}{lll}\\multicolumn{2}{c}{Head} & X \\\\ a & b & c \\\\\\end{tabular}",
            UnaryOperator.identity());

        Elements header = table.select("tr").get(0).select("td");
        assertEquals(2, header.size());
        assertEquals("2", header.get(0).attr("colspan"));
        assertEquals("text-align: center;", header.get(0).attr("style"));
        assertEquals("Head", header.get(0).text());
    }

    @Test
    void multirowShadowCellsAreDropped() {
        Document table = render("\\begin{tabular}{ll}\\multirow{2}{*}{M} & a \\\\ & b \\\\ c & d \\\\\\end{tabular}",
            UnaryOperator.identity());

        Elements rows = table.select("tr");
        assertEquals(3, rows.size());
        assertEquals("2", rows.get(0).selectFirst("td").attr("rowspan"));
        assertEquals(List.of("b"), rows.get(1).select("td").eachText());
        assertEquals(List.of("c", "d"), rows.get(2).select("td").eachText());
    }

    @Test
    void fixedWidthColumnsEmitColgroup() {
        Document table = render("\\begin{tabular}{p{3cm}l}x & y \\\\\\end{tabular}", UnaryOperator.identity());

        Elements cols = table.select("colgroup col");
        assertEquals(2, cols.size());
        assertEquals("min-width: 3cm", cols.get(0).attr("style"));
        assertFalse(cols.get(1).hasAttr("style"));
    }

    @Test
    void tableFloatIsNumberedAndCaptioned() {
        PlaceholderRegistry registry = new PlaceholderRegistry();
        String source = "\\begin{table}[h]\\centering\\caption{Results}\\label{tab:r}"
            + "\\begin{tabular}{l}x \\\\\\end{tabular}\\end{table}";

        ExtractionResult result = engine.processTables(source, UnaryOperator.identity(), registry);

        Document html = Jsoup.parseBodyFragment(registry.resolve(result.text(), 8));
        Element figure = html.selectFirst("figure.latex-table-float");
        assertNotNull(figure);
        assertEquals("Table 1: Results", figure.selectFirst("figcaption").text());
        assertEquals("x", figure.selectFirst("table.latex-table td").text());
        assertFalse(html.text().contains("tab:r"));
    }

    @Test
    void splitRowsIgnoresBreaksInsideGroups() {
        List<String> rows = TableEngine.splitRows("\\makecell{a \\\\ b} & c \\\\[2pt] d & e");

        assertEquals(2, rows.size());
        assertEquals(" d & e", rows.get(1));
    }

    @Test
    void unterminatedTabularDoesNotHideFollowingTable() {
        Document table = render("\\begin{tabular}{ll}A & B \\\\\n\n\\begin{tabularx}{\\linewidth}{XX}C & D \\\\\\end{tabularx}",
            UnaryOperator.identity());

        assertEquals(List.of("C", "D"), table.select("td").eachText());
        assertTrue(table.body().text().startsWith("\\begin{tabular}{ll}A & B"));
    }

    private Document render(String source, UnaryOperator<String> formatter) {
        PlaceholderRegistry registry = new PlaceholderRegistry();
        ExtractionResult result = engine.processTables(source, formatter, registry);
        return Jsoup.parseBodyFragment(registry.resolve(result.text(), 8));
    }
}
