package com.williamcallahan.latexpreview.service.latex;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LatexInlineFormatterTest {

    private final LatexInlineFormatter formatter = new LatexInlineFormatter();

    @Test
    void wrapsTextCommandsIncludingNestedOnes() {
        assertEquals("<strong>Bold</strong> and <em>it</em>", formatter.format("\\textbf{Bold} and \\emph{it}"));
        assertEquals("<strong><em>x</em></strong>", formatter.format("\\textbf{\\emph{x}}"));
    }

    @Test
    void escapesHtmlAndKeepsEscapedLatexCharacters() {
        assertEquals("R&amp;D costs 5% &lt;b&gt;", formatter.format("R\\&D costs 5\\% <b>"));
    }

    @Test
    void appliesTypographicReplacements() {
        assertEquals("A–B—C “q”", formatter.format("A--B---C ``q''"));
        assertEquals("a<br>b", formatter.format("a\\\\b"));
    }

    @Test
    void rendersInlineMathThroughHook() {
        assertEquals("<span class=\"math-inline\">a&lt;b</span>", formatter.format("$a<b$"));
        assertEquals("x M(y)", new LatexInlineFormatter(source -> "M(" + source + ")").format("x $y$"));
    }

    @Test
    void linksAreSafe() {
        assertEquals("<a href=\"https://x.org/a_b\" rel=\"noopener noreferrer\">https://x.org/a_b</a>",
            formatter.format("\\url{https://x.org/a_b}"));
        assertEquals("<span class=\"latex-link\">click</span>", formatter.format("\\href{javascript:alert(1)}{click}"));
    }

    @Test
    void colorsAreAcceptedOnlyWhenSafe() {
        assertEquals("<span style=\"color: red;\">hot</span>", formatter.format("\\textcolor{Red}{hot}"));
        assertEquals("hot", formatter.format("\\textcolor{red;x}{hot}"));
    }

    @Test
    void imagesReferencesAndFootnotesRenderPlaceholders() {
        assertEquals("<span class=\"latex-placeholder-box\">[Image: fig.png]</span>",
            formatter.format("\\includegraphics[width=3cm]{fig.png}"));
        assertEquals("see <span class=\"latex-ref\">[fig:x]</span>", formatter.format("see \\ref{fig:x}"));
        assertEquals("x<span class=\"latex-footnote\">(n)</span>", formatter.format("x\\footnote{n}"));
    }

    @Test
    void symbolsResolveAndUnknownCommandsKeepTheirText() {
        assertEquals("… and § 3", formatter.format("\\ldots{} and \\S 3"));
        assertEquals("bar baz", formatter.format("\\foo{bar} baz"));
        assertEquals("", formatter.format("  "));
    }
}
