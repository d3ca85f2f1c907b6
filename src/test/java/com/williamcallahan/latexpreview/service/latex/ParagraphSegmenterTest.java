package com.williamcallahan.latexpreview.service.latex;

import org.junit.jupiter.api.Test;

import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ParagraphSegmenterTest {

    private final ParagraphSegmenter segmenter = new ParagraphSegmenter();

    @Test
    void blankLinesSeparateParagraphsAndBlockTokensStayUnwrapped() {
        PlaceholderRegistry registry = new PlaceholderRegistry();
        String block = registry.registerBlock(PlaceholderCategory.BLOCK, "<h2>T</h2>");

        String html = segmenter.segment("First line\nsecond" + block + "Last\n \n", registry, UnaryOperator.identity());

        assertEquals("<p>First line\nsecond</p>\nLATEXPREVIEWBLOCK_0_\n<p>Last</p>", html);
    }

    @Test
    void loneInlineTokenIsWrapped() {
        PlaceholderRegistry registry = new PlaceholderRegistry();
        String token = registry.register(PlaceholderCategory.MATH, "<span>x</span>");

        assertEquals("<p>" + token + "</p>", segmenter.segment(token, registry, UnaryOperator.identity()));
    }

    @Test
    void blankInputProducesNothing() {
        assertEquals("", segmenter.segment(" \n\n ", new PlaceholderRegistry(), UnaryOperator.identity()));
    }
}
