package com.williamcallahan.latexpreview.service.latex;

import com.williamcallahan.latexpreview.config.DiagramHeuristics;
import com.williamcallahan.latexpreview.domain.latex.DiagramIntent;
import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Covers option synthesis per intent and the rules for keeping or replacing author options.
 */
class DiagramOptionSynthesizerTest {

    private final DiagramOptionSynthesizer synthesizer = new DiagramOptionSynthesizer(new DiagramHeuristics());

    @Test
    void compactShrinksAndAddsDefaultDistance() {
        DiagramMetrics metrics = new DiagramMetrics(3, 5, 0, 0, OptionalDouble.empty());

        assertEquals("scale=0.85, transform shape, node distance=1.5cm",
            synthesizer.synthesize(DiagramIntent.COMPACT, metrics, ""));
    }

    @Test
    void largeReplacesIllegibleDistanceForTextHeavyDiagrams() {
        DiagramMetrics metrics = new DiagramMetrics(2, 40, 0, 0, OptionalDouble.of(1));

        String options = synthesizer.synthesize(DiagramIntent.LARGE, metrics, "node distance=1cm, thick");

        assertEquals("x=1.30cm, y=0.50cm, font=\\small, node distance=8.4cm, "
            + "every node/.append style={align=center}, thick", options);
    }

    @Test
    void largeKeepsLegibleAuthorDistance() {
        DiagramMetrics metrics = new DiagramMetrics(3, 4, 0, 0, OptionalDouble.of(2));

        String options = synthesizer.synthesize(DiagramIntent.LARGE, metrics, "node distance=2cm");

        assertTrue(options.endsWith("node distance=2cm"));
        assertFalse(options.contains("node distance=5cm"));
    }

    @Test
    void flatStretchesVerticalUnitAndDropsAuthorUnits() {
        DiagramMetrics metrics = new DiagramMetrics(6, 3, 12, 2, OptionalDouble.empty());

        assertEquals("x=1.5cm, y=3.0cm, scale=1.0, font=\\small",
            synthesizer.synthesize(DiagramIntent.FLAT, metrics, "x=1cm, y=1cm"));
    }

    @Test
    void wideFitsSpanWithinMinimumScale() {
        DiagramMetrics metrics = new DiagramMetrics(4, 3, 28, 5, OptionalDouble.empty());

        assertEquals("scale=0.50, transform shape", synthesizer.synthesize(DiagramIntent.WIDE, metrics, ""));
    }

    @Test
    void textHeavyMediumDiagramsGetBoostedUnits() {
        DiagramMetrics light = new DiagramMetrics(3, 3, 0, 0, OptionalDouble.empty());
        DiagramMetrics heavy = new DiagramMetrics(2, 40, 0, 0, OptionalDouble.empty());

        assertEquals("scale=0.9, node distance=2.5cm", synthesizer.synthesize(DiagramIntent.MEDIUM, light, ""));
        assertEquals("scale=0.9, node distance=2.5cm, x=2.2cm, y=1.5cm",
            synthesizer.synthesize(DiagramIntent.MEDIUM, heavy, ""));
    }

    @Test
    void authorScaleIsNeverDuplicated() {
        DiagramMetrics metrics = new DiagramMetrics(3, 5, 0, 0, OptionalDouble.empty());

        String options = synthesizer.synthesize(DiagramIntent.COMPACT, metrics, "scale=2");

        assertEquals("transform shape, node distance=1.5cm, scale=2", options);
    }
}
