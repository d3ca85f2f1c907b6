package com.williamcallahan.latexpreview.service.latex;

import org.jsoup.Jsoup;
import org.jsoup.select.Elements;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Verifies IEEE grouping, explicit numbering and bibliography production.
 */
class CitationEngineTest {

    private final CitationEngine engine = new CitationEngine();

    @Test
    void consecutiveIdsCollapseIntoARangeAndBibliographyListsEachKey() {
        CitationResult result = engine.processCitations("\\cite{ref_1, ref_2, ref_3}");

        assertEquals("[1]–[3]", result.text());
        assertTrue(result.hasBibliography());
        Elements labels = Jsoup.parseBodyFragment(result.bibliographyHtml()).select("li .bib-label");
        assertEquals(List.of("[1]", "[2]", "[3]"), labels.eachText());
    }

    @Test
    void nonConsecutiveIdsStaySeparate() {
        assertEquals("[1], [3], [5]", engine.processCitations("\\cite{ref_1,ref_3,ref_5}").text());
    }

    @Test
    void explicitNumberIsKeptAndCursorResumesAboveIt() {
        CitationResult result = engine.processCitations("First \\cite{ref_5} then \\citep{smith2020}.");

        assertEquals("First [5] then [6].", result.text());
    }

    @Test
    void parenthesizedFormsAreCanonicalized() {
        CitationResult result = engine.processCitations("A (ref_1)(ref_2). B (ref_1, ref 3; ref5). C (ref\\_4). D \\ref{ref_4}.");

        assertEquals("A [1]–[2]. B [1], [3], [5]. C [4]. D [4].", result.text());
    }

    @Test
    void manualBibliographyNumbersEntriesInOrderAndMarksMissingKeys() {
        String text = """
            See \\cite{knuth} and \\cite{missing}.
            \\begin{thebibliography}{9}
            \\bibitem{lamport} Lamport, \\emph{LaTeX}.
            \\bibitem{knuth} Knuth, TeX.
            \\end{thebibliography}
            """;

        CitationResult result = engine.processCitations(text, new LatexInlineFormatter()::format);

        assertTrue(result.text().startsWith("See [2] and [?]."));
        assertFalse(result.text().contains("thebibliography"));
        Elements items = Jsoup.parseBodyFragment(result.bibliographyHtml()).select("li");
        assertEquals(2, items.size());
        assertEquals("[1] Lamport, LaTeX.", items.get(0).text());
        assertEquals(1, items.get(0).select("em").size());
    }

    @Test
    void postNoteJoinsASingleMarker() {
        assertEquals("[2, p. 5]", engine.processCitations("\\cite[p. 5]{ref_2}").text());
    }

    @Test
    void citeWithoutKeysIsKeptAsLiteralText() {
        CitationResult result = engine.processCitations("x \\cite{} y");

        assertTrue(result.text().contains("\\textbackslash{}cite"));
        assertFalse(result.hasBibliography());
    }

    @Test
    void groupIdsSortsAndGroupsRuns() {
        assertEquals("[1]–[3], [5]", CitationEngine.groupIds(List.of(5, 3, 1, 2, 2)));
        assertEquals("", CitationEngine.groupIds(List.of()));
    }

    @Test
    void keyNormalizationAcceptsCommonSpellings() {
        assertEquals("ref_3", CitationRegistry.normalizeKey("ref\\_3"));
        assertEquals("ref_3", CitationRegistry.normalizeKey("REF_03"));
        assertEquals("ref_3", CitationRegistry.normalizeKey("ref3"));
        assertEquals("smith2020", CitationRegistry.normalizeKey(" smith2020 "));
    }
}
