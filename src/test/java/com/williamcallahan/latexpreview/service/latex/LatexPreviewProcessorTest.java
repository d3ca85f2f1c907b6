package com.williamcallahan.latexpreview.service.latex;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.latexpreview.config.PreviewProperties;
import com.williamcallahan.latexpreview.domain.latex.DocumentMetadata;
import com.williamcallahan.latexpreview.domain.latex.RenderedDocument;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs complete documents through every stage.
 */
class LatexPreviewProcessorTest {

    private static final String PAPER = """
        \\documentclass{article}
        \\usepackage{amsmath}
        \\newcommand{\\R}{\\mathbb{R}}
        \\newtheorem{thm}{Theorem}
        \\title{On \\textbf{Previews}}
        \\author{Ann \\and Bob}
        \\date{\\today}
        \\begin{document}
        \\maketitle
        \\begin{abstract}
        We study $x \\in \\R$.
        \\end{abstract}
        \\section{Introduction}
        As shown in \\cite{ref_1}, tables help.

        \\begin{tabular}{|l|r|}
        \\hline
        A & B \\\\
        \\hline
        \\end{tabular}

        \\begin{itemize}
        \\item First $a$
        \\item Second
        \\end{itemize}

        \\begin{thm}[Main]
        Every $f$ is nice.
        \\end{thm}

        \\begin{proof}
        Obvious.
        \\end{proof}
        \\end{document}
        """;

    private final LatexPreviewProcessor processor = new LatexPreviewProcessor(new PreviewProperties(),
        Clock.fixed(Instant.parse("2024-03-05T12:00:00Z"), ZoneOffset.UTC), new ObjectMapper());

    @Test
    @DisplayName("Complete paper converts every construct and leaves no LaTeX or tokens behind")
    void convertsCompletePaper() {
        RenderedDocument document = processor.process(PAPER);
        String resolved = resolve(document);
        Document html = Jsoup.parseBodyFragment(resolved);

        assertEquals(new DocumentMetadata("On Previews", "Ann, Bob", "March 5, 2024"), document.metadata());
        assertEquals("On Previews", html.select("header.latex-title-block h1.title").text());
        assertEquals("Ann, Bob", html.select("header.latex-title-block .author").text());

        Element abstractBlock = html.selectFirst("div.latex-abstract");
        assertNotNull(abstractBlock);
        assertEquals("x \\in \\R", abstractBlock.select(".katex-pending").text());

        assertEquals("Introduction", html.select("h2").text());
        assertTrue(html.text().contains("As shown in [1], tables help."));
        assertTrue(document.hasBibliography());

        assertEquals(List.of("A", "B"), html.select("table.latex-table td").eachText());
        assertEquals(2, html.select("ul.latex-itemize > li").size());
        assertEquals(1, html.select("ul.latex-itemize > li").get(0).select(".katex-pending").size());

        Element theorem = html.selectFirst("div.latex-theorem.latex-env-thm");
        assertNotNull(theorem);
        assertEquals("Theorem (Main).", theorem.selectFirst("strong").text());
        assertNotNull(html.selectFirst("div.latex-proof span.latex-qed"));

        assertFalse(resolved.contains("\\begin"));
        assertFalse(resolved.contains("\\end{"));
        assertFalse(resolved.contains("\\maketitle"));
        assertFalse(resolved.contains(PlaceholderRegistry.TOKEN_PREFIX));
    }

    @Test
    void codeRegionsAreNeverReadAsMath() {
        Document html = Jsoup.parseBodyFragment(resolve(processor.process(
            "Before\n\n\\begin{verbatim}\ncost = $5 + $6\n\\end{verbatim}\n\nAfter $y$")));

        assertEquals("cost = $5 + $6", html.select("pre.latex-verbatim code").text());
        assertEquals(1, html.select(".katex-pending").size());
        assertEquals("y", html.select(".katex-pending").text());
    }

    @Test
    void malformedInputStillProducesOutput() {
        RenderedDocument document = processor.process(
            "Unclosed $x and \\begin{itemize}\\item a\n\n\\section{Next}\nText");
        String resolved = resolve(document);

        assertFalse(resolved.isBlank());
        assertTrue(Jsoup.parseBodyFragment(resolved).text().contains("Text"));
        assertEquals("Next", Jsoup.parseBodyFragment(resolved).select("h2").text());
    }

    @Test
    void plottingDiagramBecomesNotice() {
        String resolved = resolve(processor.process(
            "\\begin{tikzpicture}\\begin{axis}\\addplot {x};\\end{axis}\\end{tikzpicture}"));

        assertTrue(resolved.contains(TikzEngine.PGFPLOTS_NOTICE));
    }

    @Test
    void blankInputYieldsEmptyDocument() {
        assertEquals(RenderedDocument.empty(), processor.process("   "));
        assertEquals(RenderedDocument.empty(), processor.process(null));
    }

    private static String resolve(RenderedDocument document) {
        return PlaceholderRegistry.resolve(document.html(), document.blocks(), 16);
    }
}
