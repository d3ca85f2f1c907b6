package com.williamcallahan.latexpreview.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.latexpreview.config.PreviewProperties;
import com.williamcallahan.latexpreview.domain.latex.DocumentMetadata;
import com.williamcallahan.latexpreview.domain.latex.LatexCacheStatsSnapshot;
import com.williamcallahan.latexpreview.domain.latex.RenderedDocument;
import com.williamcallahan.latexpreview.service.latex.LatexPreviewProcessor;
import com.williamcallahan.latexpreview.service.latex.LatexProcessingException;
import java.time.Clock;
import java.util.Map;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

/**
 * Verifies caching, truncation, failure fallback and final HTML assembly.
 */
class LatexPreviewServiceTest {

    private static LatexPreviewService serviceWith(PreviewProperties previewProperties) {
        LatexPreviewProcessor processor =
                new LatexPreviewProcessor(previewProperties, Clock.systemUTC(), new ObjectMapper());
        return new LatexPreviewService(processor, previewProperties);
    }

    @Test
    void truncatesOversizedInputAndFlagsResult() {
        PreviewProperties previewProperties = new PreviewProperties();
        previewProperties.getLimits().setMaxInputLength(20);
        LatexPreviewService previewService = serviceWith(previewProperties);

        RenderedDocument first = previewService.render("word ".repeat(10));
        RenderedDocument cached = previewService.render("word ".repeat(10));

        assertTrue(first.truncated());
        assertTrue(cached.truncated());
        assertFalse(previewService.render("short").truncated());
    }

    @Test
    void secondRenderOfSameSourceIsServedFromCache() {
        LatexPreviewService previewService = serviceWith(new PreviewProperties());

        previewService.render("Hello \\textbf{world}");
        previewService.render("Hello \\textbf{world}");
        LatexCacheStatsSnapshot stats = previewService.cacheStats();

        assertEquals(1, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(1, stats.size());
        assertEquals("50.00%", stats.hitRate());
        assertEquals(1, previewService.clearCache());
        assertEquals(0, previewService.cacheStats().size());
    }

    @Test
    void processorFailureFallsBackToEscapedSource() {
        LatexPreviewProcessor processor = mock(LatexPreviewProcessor.class);
        when(processor.process(anyString())).thenThrow(new LatexProcessingException("stage failed"));
        LatexPreviewService previewService = new LatexPreviewService(processor, new PreviewProperties());

        RenderedDocument document = previewService.render("a < b & \\oops");

        assertEquals("<pre class=\"latex-fallback\">a &lt; b &amp; \\oops</pre>", document.html());
        assertTrue(document.blocks().isEmpty());

        previewService.render("a < b & \\oops");
        verify(processor, times(2)).process(anyString());
    }

    @Test
    void resolveSubstitutesFragmentsAndHardensOutput() {
        LatexPreviewService previewService = serviceWith(new PreviewProperties());
        RenderedDocument document = new RenderedDocument(
                "<p>See <a href=\"https://example.com\">site</a> and <a href=\"#sec\">here</a>.</p>\n"
                        + "LATEXPREVIEWTIKZ_0_",
                Map.of("LATEXPREVIEWTIKZ_0_", "<iframe class=\"latex-diagram-frame\" srcdoc=\"x\"></iframe>"),
                "<div class=\"bibliography\"><h2>References</h2></div>",
                true,
                DocumentMetadata.none(),
                1L,
                false);

        String resolved = previewService.resolve(document);
        Document html = Jsoup.parseBodyFragment(resolved);

        Element external = html.selectFirst("a[href=\"https://example.com\"]");
        assertNotNull(external);
        assertEquals("_blank", external.attr("target"));
        assertEquals("noopener noreferrer", external.attr("rel"));
        assertFalse(html.selectFirst("a[href=\"#sec\"]").hasAttr("target"));
        assertEquals("lazy", html.selectFirst("iframe.latex-diagram-frame").attr("loading"));
        assertTrue(resolved.indexOf("bibliography") > resolved.indexOf("iframe"));
        assertFalse(resolved.contains("LATEXPREVIEW"));
    }

    @Test
    void renderResolvedProducesDisplayReadyHtml() {
        LatexPreviewService previewService = serviceWith(new PreviewProperties());

        Document html = Jsoup.parseBodyFragment(
                previewService.renderResolved("\\section{Intro}\nSee \\cite{knuth} for $n$ steps."));

        assertEquals("Intro", html.select("h2").first().text());
        assertEquals(1, html.select(".katex-pending").size());
        assertNotNull(html.selectFirst("div.bibliography"));
    }

    @Test
    void blankInputRendersEmpty() {
        LatexPreviewService previewService = serviceWith(new PreviewProperties());

        assertEquals(RenderedDocument.empty(), previewService.render(" \n "));
        assertEquals("", previewService.renderResolved(null));
    }

    @Test
    void tokenShapedSourceTextSurvivesAsWritten() {
        LatexPreviewService previewService = serviceWith(new PreviewProperties());

        Document html = Jsoup.parseBodyFragment(
                previewService.renderResolved("We write $x$ and LATEXPREVIEWMATH_0_ literally."));

        assertEquals("We write x and LATEXPREVIEWMATH_0_ literally.", html.select("p").first().text());
        assertEquals(1, html.select(".katex-pending").size());
    }

    @Test
    void longParagraphWithUnmatchedDollarRenders() {
        LatexPreviewService previewService = serviceWith(new PreviewProperties());

        String resolved = previewService.renderResolved("Price is $5 and " + "word ".repeat(8000) + "end.");

        assertTrue(resolved.contains("Price is $5 and word"));
        assertTrue(resolved.contains("word end."));
    }
}
