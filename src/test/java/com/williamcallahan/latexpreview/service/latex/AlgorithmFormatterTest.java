package com.williamcallahan.latexpreview.service.latex;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.select.Elements;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Verifies numbering and indentation of pseudo-code lines.
 */
class AlgorithmFormatterTest {

    private final AlgorithmFormatter formatter = new AlgorithmFormatter(100);

    @Test
    void blocksIndentTheirBodyAndClosersOutdent() {
        String body = "\\Require $n$\n"
            + "\\State $s \\gets 0$\n"
            + "\\For{$i = 1$ to $n$}\n"
            + "\\State $s \\gets s + i$ \\Comment{accumulate}\n"
            + "\\EndFor\n"
            + "\\If{$s > 10$}\n"
            + "\\Return $s$\n"
            + "\\Else\n"
            + "\\Return 0\n"
            + "\\EndIf";

        Document html = Jsoup.parseBodyFragment(formatter.render(body, UnaryOperator.identity()));
        Elements lines = html.select("div.latex-alg-line");

        assertEquals(10, lines.size());
        assertEquals(List.of("1.", "2.", "3.", "4.", "5.", "6.", "7.", "8.", "9."),
            html.select(".latex-alg-lineno").eachText());
        assertEquals("Require: $n$", lines.get(0).text());
        assertEquals("padding-left: 1.5em", lines.get(3).attr("style"));
        assertEquals("▷ accumulate", lines.get(3).selectFirst(".latex-alg-comment").text());
        assertEquals("padding-left: 0em", lines.get(4).attr("style"));
        assertEquals("end for", lines.get(4).selectFirst(".latex-alg-keyword").text());
        assertEquals("padding-left: 1.5em", lines.get(6).attr("style"));
        assertEquals("padding-left: 0em", lines.get(7).attr("style"));
        assertEquals("else", lines.get(7).selectFirst(".latex-alg-keyword").text());
        assertEquals("padding-left: 0em", lines.get(9).attr("style"));
    }

    @Test
    void conditionsSitBetweenKeywords() {
        Document html = Jsoup.parseBodyFragment(formatter.render("\\WHILE{x}\\STATE y\\ENDWHILE", UnaryOperator.identity()));

        assertEquals("while x do", html.select(".latex-alg-content").get(0).text());
        assertEquals(List.of("while", "do"), html.select(".latex-alg-content").get(0).select(".latex-alg-keyword").eachText());
    }

    @Test
    void procedureSignatureUsesSmallCaps() {
        Document html = Jsoup.parseBodyFragment(formatter.render(
            "\\Procedure{Euclid}{$a,b$}\n\\State r\n\\EndProcedure", UnaryOperator.identity()));

        assertEquals("procedure Euclid($a,b$)", html.select(".latex-alg-content").get(0).text());
        assertEquals("end procedure", html.select(".latex-alg-content").get(2).text());
    }

    @Test
    void environmentBecomesBlockTokenAndLineNumberOptionIsSkipped() {
        PlaceholderRegistry registry = new PlaceholderRegistry();

        String text = formatter.format("Before\\begin{algorithmic}[1]\\State x\\end{algorithmic}", registry,
            UnaryOperator.identity());

        assertTrue(text.startsWith("Before\n\nLATEXPREVIEWBLOCK_0_"));
        String html = registry.lookup("LATEXPREVIEWBLOCK_0_").orElseThrow();
        assertFalse(html.contains("[1]"));
        assertTrue(html.contains("<span class=\"latex-alg-content\">x</span>"));
    }
}
