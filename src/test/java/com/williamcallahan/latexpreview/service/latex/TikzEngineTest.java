package com.williamcallahan.latexpreview.service.latex;

import com.williamcallahan.latexpreview.config.DiagramHeuristics;
import com.williamcallahan.latexpreview.config.PipelineLimits;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TikzEngineTest {

    private final TikzEngine engine = new TikzEngine(new DiagramHeuristics(), new PipelineLimits());

    @Test
    void pictureBecomesSandboxedFrame() {
        PlaceholderRegistry registry = new PlaceholderRegistry();
        String source = "Before\n\\begin{tikzpicture}[node distance=3cm]\n\\node (a) {A};\n\\end{tikzpicture}\nAfter";

        ExtractionResult result = engine.processDiagrams(source, registry);

        assertEquals(1, result.blocks().size());
        assertTrue(result.text().startsWith("Before"));
        assertTrue(result.text().endsWith("After"));
        assertFalse(result.text().contains("tikzpicture"));

        String fragment = result.blocks().values().iterator().next();
        Element frame = Jsoup.parseBodyFragment(fragment).selectFirst("iframe.latex-diagram-frame");
        assertNotNull(frame);
        assertEquals("allow-scripts", frame.attr("sandbox"));
        String page = frame.attr("srcdoc");
        assertTrue(page.contains("\\begin{tikzpicture}[x=1.30cm, y=0.50cm, font=\\small, "
            + "every node/.append style={align=center}, node distance=3cm]"));
        assertTrue(page.contains("\\node (a) {A};"));
    }

    @Test
    void plottingAxesBecomeNotice() {
        PlaceholderRegistry registry = new PlaceholderRegistry();
        String source = "\\begin{tikzpicture}\\begin{axis}\\addplot {x};\\end{axis}\\end{tikzpicture}";

        ExtractionResult result = engine.processDiagrams(source, registry);

        String fragment = result.blocks().values().iterator().next();
        assertTrue(fragment.contains("latex-placeholder-box warning"));
        assertTrue(fragment.contains(TikzEngine.PGFPLOTS_NOTICE));
        assertFalse(fragment.contains("iframe"));
    }

    @Test
    void textWithoutPicturesIsUntouched() {
        ExtractionResult result = engine.processDiagrams("plain $x$", new PlaceholderRegistry());

        assertEquals("plain $x$", result.text());
        assertTrue(result.blocks().isEmpty());
    }

    @Test
    void unterminatedPictureIsLeftInPlace() {
        String source = "\\begin{tikzpicture}\\node {A};";

        ExtractionResult result = engine.processDiagrams(source, new PlaceholderRegistry());

        assertEquals(source, result.text());
    }

    @Test
    void sanitizerRewritesFontCommandsAndEscapesSeparators() {
        String safe = TikzSanitizer.sanitize("\\node {\\textbf{A} & B}; % note\n\\sffamily");

        assertTrue(safe.contains("{\\bfseries A}"));
        assertTrue(safe.contains("\\& B"));
        assertFalse(safe.contains("note"));
        assertFalse(safe.contains("sffamily"));
        assertFalse(safe.contains("\n"));
    }

    @Test
    void extractionStopsAtTheIterationCap() {
        PipelineLimits limits = new PipelineLimits();
        limits.setMaxExtractionIterations(1);
        TikzEngine capped = new TikzEngine(new DiagramHeuristics(), limits);
        String source = "\\begin{tikzpicture}\\node {A};\\end{tikzpicture}\n\n"
            + "\\begin{tikzpicture}\\node {B};\\end{tikzpicture}";

        ExtractionResult result = capped.processDiagrams(source, new PlaceholderRegistry());

        assertEquals(1, result.blocks().size());
        assertTrue(result.text().endsWith("\\begin{tikzpicture}\\node {B};\\end{tikzpicture}"));
    }
}
