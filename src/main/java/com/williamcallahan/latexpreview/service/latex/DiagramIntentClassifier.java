package com.williamcallahan.latexpreview.service.latex;

import com.williamcallahan.latexpreview.config.DiagramHeuristics;
import com.williamcallahan.latexpreview.domain.latex.DiagramIntent;

import java.util.Objects;

/**
 * Decides a diagram's layout intent from its measurements.
 *
 * <p>Absolute coordinates win over everything: an extreme aspect ratio reads as a timeline (FLAT),
 * any other absolute layout takes the configured absolute intent. Relative layouts follow an explicit
 * {@code node distance} when the author gave one, otherwise label density and node count decide.</p>
 */
public class DiagramIntentClassifier {

    private final DiagramHeuristics heuristics;

    public DiagramIntentClassifier(DiagramHeuristics heuristics) {
        this.heuristics = Objects.requireNonNull(heuristics, "Diagram heuristics cannot be null");
    }

    public DiagramIntent classify(DiagramMetrics metrics) {
        if (metrics.usesAbsoluteLayout()) {
            boolean flat = metrics.verticalSpan() > 0 && metrics.aspectRatio() > heuristics.getFlatAspectRatio();
            return flat ? DiagramIntent.FLAT : heuristics.getAbsoluteLayoutIntent();
        }
        if (metrics.nodeDistance().isPresent()) {
            double distance = metrics.nodeDistance().getAsDouble();
            if (distance < heuristics.getCompactNodeDistance()) {
                return DiagramIntent.COMPACT;
            }
            if (distance >= heuristics.getLargeNodeDistance()) {
                return DiagramIntent.LARGE;
            }
            return DiagramIntent.MEDIUM;
        }
        if (metrics.isTextHeavy(heuristics.getTextHeavyLabelLength())) {
            return DiagramIntent.LARGE;
        }
        if (metrics.nodeCount() >= heuristics.getCompactNodeCount()) {
            return DiagramIntent.COMPACT;
        }
        return DiagramIntent.MEDIUM;
    }
}
