package com.williamcallahan.latexpreview.service.latex;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Verifies environment classification and the block HTML of each known kind.
 */
class EnvironmentNormalizerTest {

    private static final UnaryOperator<String> PARAGRAPH = body -> "<p>" + body.strip() + "</p>";

    private final EnvironmentNormalizer normalizer = new EnvironmentNormalizer(100);

    @Test
    void theoremCarriesLabelAndSubtitle() {
        assertEquals("<div class=\"latex-theorem latex-env-theorem\"><p><strong>Theorem (Main).</strong> All good.</p></div>",
            normalize("\\begin{theorem}[Main] All good.\\end{theorem}", MacroTable.empty()));
    }

    @Test
    void declaredTheoremUsesItsDeclaredLabel() {
        MacroTable macros = new MacroTable(Map.of(), Map.of("thm", "Theorem"));

        assertEquals("<div class=\"latex-theorem latex-env-thm\"><p><strong>Theorem.</strong> x</p></div>",
            normalize("\\begin{thm}x\\end{thm}", macros));
    }

    @Test
    void proofEndsWithTombstoneInsideLastParagraph() {
        assertEquals("<div class=\"latex-proof\"><p><em>Proof.</em> Trivial. "
                + "<span class=\"latex-qed\" style=\"float: right;\">∎</span></p></div>",
            normalize("\\begin{proof}Trivial.\\end{proof}", MacroTable.empty()));
    }

    @Test
    void unknownEnvironmentIsUnwrappedAndItsBodyRescanned() {
        assertEquals("A inner B", normalize("A \\begin{mybox}inner\\end{mybox} B", MacroTable.empty()));
        assertTrue(normalize("\\begin{wrapper}\\begin{lemma}L\\end{lemma}\\end{wrapper}", MacroTable.empty())
            .contains("latex-env-lemma"));
    }

    @Test
    void passThroughEnvironmentsAreLeftForTheirStage() {
        String source = "\\begin{itemize}\\item x\\end{itemize}";

        assertEquals(source, normalize(source, MacroTable.empty()));
    }

    @Test
    void onlyCaptionedFiguresAreNumbered() {
        Document html = Jsoup.parseBodyFragment(normalize(
            "\\begin{figure}[h]\\centering X\\caption{First}\\label{f}\\end{figure}"
                + "\\begin{figure}Y\\end{figure}"
                + "\\begin{figure}Z\\caption{Second}\\end{figure}", MacroTable.empty()));

        assertEquals(3, html.select("figure.latex-figure").size());
        assertEquals(List.of("Figure 1: First", "Figure 2: Second"), html.select("figcaption").eachText());
        assertEquals("X", html.select("figure.latex-figure > p").get(0).text());
    }

    @Test
    void algorithmFloatPutsCaptionAboveBody() {
        assertEquals("<div class=\"latex-algorithm-float\"><div class=\"latex-algorithm-caption\">"
                + "<strong>Algorithm 1:</strong> Sort</div><p>steps</p></div>",
            normalize("\\begin{algorithm}\\caption{Sort}steps\\end{algorithm}", MacroTable.empty()));
    }

    @Test
    void layoutEnvironmentsCarryInlineStyles() {
        assertEquals("<div class=\"latex-center\" style=\"text-align: center;\"><p>c</p></div>",
            normalize("\\begin{center}c\\end{center}", MacroTable.empty()));
        assertEquals("<div class=\"latex-minipage\" style=\"display: inline-block; vertical-align: top; width: 50%;\">"
                + "<p>Hi</p></div>",
            normalize("\\begin{minipage}{0.5\\textwidth}Hi\\end{minipage}", MacroTable.empty()));
        assertEquals("<blockquote class=\"latex-quote\"><p>q</p></blockquote>",
            normalize("\\begin{quotation}q\\end{quotation}", MacroTable.empty()));
    }

    @Test
    void keywordsBecomeBlock() {
        assertEquals("<div class=\"latex-keywords\"><strong>Keywords:</strong> LaTeX, HTML</div>",
            normalize("\\keywords{LaTeX, HTML}", MacroTable.empty()));
    }

    private String normalize(String source, MacroTable macros) {
        PlaceholderRegistry registry = new PlaceholderRegistry();
        EnvironmentContext context = new EnvironmentContext(macros, registry, PARAGRAPH, UnaryOperator.identity(),
            new FloatNumbering());
        return registry.resolve(normalizer.normalize(source, context), 8).strip();
    }
}
