package com.williamcallahan.latexpreview.service.latex;

import com.williamcallahan.latexpreview.config.DiagramHeuristics;
import com.williamcallahan.latexpreview.domain.latex.DiagramIntent;
import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DiagramIntentClassifierTest {

    private final DiagramIntentClassifier classifier = new DiagramIntentClassifier(new DiagramHeuristics());

    @Test
    void extremeAbsoluteAspectRatioReadsAsTimeline() {
        DiagramMetrics metrics = DiagramMetrics.measure("\\draw (0,0) -- (10,1);", "");
        assertEquals(DiagramIntent.FLAT, classifier.classify(metrics));
    }

    @Test
    void balancedAbsoluteLayoutUsesConfiguredIntent() {
        DiagramMetrics metrics = DiagramMetrics.measure("\\draw (0,0) -- (4,4);", "");
        assertEquals(DiagramIntent.LARGE, classifier.classify(metrics));

        DiagramHeuristics wide = new DiagramHeuristics();
        wide.setAbsoluteLayoutIntent(DiagramIntent.WIDE);
        assertEquals(DiagramIntent.WIDE, new DiagramIntentClassifier(wide).classify(metrics));
    }

    @Test
    void explicitNodeDistanceDecidesRelativeLayouts() {
        assertEquals(DiagramIntent.COMPACT, classifier.classify(relative(3, 2, 1.5)));
        assertEquals(DiagramIntent.MEDIUM, classifier.classify(relative(3, 2, 2.2)));
        assertEquals(DiagramIntent.LARGE, classifier.classify(relative(3, 2, 2.5)));
    }

    @Test
    void labelDensityAndNodeCountDecideWithoutDistance() {
        assertEquals(DiagramIntent.LARGE, classifier.classify(new DiagramMetrics(2, 40, 0, 0, OptionalDouble.empty())));
        assertEquals(DiagramIntent.COMPACT, classifier.classify(new DiagramMetrics(8, 3, 0, 0, OptionalDouble.empty())));
        assertEquals(DiagramIntent.MEDIUM, classifier.classify(new DiagramMetrics(3, 3, 0, 0, OptionalDouble.empty())));
    }

    @Test
    void measurementCountsNodesAndLabelText() {
        DiagramMetrics metrics = DiagramMetrics.measure(
            "\\node (a) {\\textbf{Input}}; \\node (b) [right of=a] {Out};", "node distance=3cm, thick");

        assertEquals(2, metrics.nodeCount());
        assertEquals(4.0, metrics.averageLabelLength(), 1e-9);
        assertEquals(0.0, metrics.horizontalSpan(), 1e-9);
        assertEquals(3.0, metrics.nodeDistance().getAsDouble(), 1e-9);
    }

    private static DiagramMetrics relative(int nodes, double label, double distance) {
        return new DiagramMetrics(nodes, label, 0, 0, OptionalDouble.of(distance));
    }
}
