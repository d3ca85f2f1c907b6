package com.williamcallahan.latexpreview.service.latex;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Verifies the Bezier replacement for decorated braces.
 */
class BracePolyfillTest {

    @Test
    void horizontalBraceBulgesUpward() {
        String drawn = BracePolyfill.apply(
            "\\draw[decorate,decoration={brace}] (0,0) -- (4,0) node[above] {$n$};");

        assertEquals("\\draw[thick] (0,0) .. controls (0,0.15) and (2,0.15) .. (2,0.35)"
            + " .. controls (2,0.15) and (4,0.15) .. (4,0); \\node[above] at (2,0.95) {$n$};", drawn);
    }

    @Test
    void mirroredHorizontalBraceBulgesDownward() {
        String drawn = BracePolyfill.apply(
            "\\draw[decorate, decoration={brace,mirror}] (0,0) -- (4,0) node[below] {gap};");

        assertEquals("\\draw[thick] (0,0) .. controls (0,-0.15) and (2,-0.15) .. (2,-0.35)"
            + " .. controls (2,-0.15) and (4,-0.15) .. (4,0); \\node[below] at (2,-0.95) {gap};", drawn);
    }

    @Test
    void verticalBraceBulgesLeft() {
        String drawn = BracePolyfill.apply(
            "\\draw[decorate,decoration={brace}] (0,0) -- (0,2) node[left] {h};");

        assertEquals("\\draw[thick] (0,0) .. controls (-0.15,0) and (-0.15,1) .. (-0.35,1)"
            + " .. controls (-0.15,1) and (-0.15,2) .. (0,2); \\node[left] at (-0.95,1) {h};", drawn);
    }

    @Test
    void bodyWithoutBracesIsReturnedUnchanged() {
        String body = "\\draw (0,0) -- (1,1);";

        assertEquals(body, BracePolyfill.apply(body));
    }
}
