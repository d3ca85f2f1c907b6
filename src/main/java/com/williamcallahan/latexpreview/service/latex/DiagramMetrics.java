package com.williamcallahan.latexpreview.service.latex;

import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Layout measurements taken from a sanitized diagram body and its picture options.
 *
 * @param nodeCount number of {@code \node} statements
 * @param averageLabelLength mean label length per node, control sequences and braces excluded
 * @param horizontalSpan extent of absolute x coordinates, 0 when none are used
 * @param verticalSpan extent of absolute y coordinates
 * @param nodeDistance explicit {@code node distance} option value, when present
 */
public record DiagramMetrics(
    int nodeCount,
    double averageLabelLength,
    double horizontalSpan,
    double verticalSpan,
    OptionalDouble nodeDistance
) {

    private static final String NUMBER = "-?(?:\\d+\\.?\\d*|\\.\\d+)";
    private static final Pattern NODE = Pattern.compile("\\\\node(?![a-zA-Z])");
    private static final Pattern NODE_LABEL = Pattern.compile("\\\\node(?![a-zA-Z])[^;]*\\{([^}]*)\\}");
    private static final Pattern CONTROL_WORD = Pattern.compile("\\\\[a-zA-Z]+");
    private static final Pattern COORDINATE = Pattern.compile("\\(\\s*(" + NUMBER + ")\\s*,\\s*(" + NUMBER + ")\\s*\\)");
    private static final Pattern NODE_DISTANCE = Pattern.compile("node distance\\s*=\\s*(" + NUMBER + ")");

    public DiagramMetrics {
        if (nodeDistance == null) {
            nodeDistance = OptionalDouble.empty();
        }
    }

    /**
     * Measures a diagram.
     *
     * @param body sanitized diagram body
     * @param options picture options without the surrounding brackets
     * @return measurements
     */
    public static DiagramMetrics measure(String body, String options) {
        String source = body == null ? "" : body;
        int nodes = 0;
        Matcher node = NODE.matcher(source);
        while (node.find()) {
            nodes++;
        }

        int labelChars = 0;
        Matcher label = NODE_LABEL.matcher(source);
        while (label.find()) {
            String text = CONTROL_WORD.matcher(label.group(1)).replaceAll("").replace("{", "").replace("}", "");
            labelChars += text.length();
        }
        double averageLabel = nodes > 0 ? (double) labelChars / nodes : 0;

        double minX = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        Matcher coordinate = COORDINATE.matcher(source);
        while (coordinate.find()) {
            double x = Double.parseDouble(coordinate.group(1));
            double y = Double.parseDouble(coordinate.group(2));
            minX = Math.min(minX, x);
            maxX = Math.max(maxX, x);
            minY = Math.min(minY, y);
            maxY = Math.max(maxY, y);
        }
        double horizontal = Double.isInfinite(minX) ? 0 : maxX - minX;
        double vertical = Double.isInfinite(minY) ? 0 : maxY - minY;

        OptionalDouble distance = OptionalDouble.empty();
        Matcher distanceMatch = NODE_DISTANCE.matcher(options == null ? "" : options);
        if (distanceMatch.find()) {
            distance = OptionalDouble.of(Double.parseDouble(distanceMatch.group(1)));
        }
        return new DiagramMetrics(nodes, averageLabel, horizontal, vertical, distance);
    }

    /**
     * Width over height of the absolute coordinate extent, 0 when the diagram has no height.
     */
    public double aspectRatio() {
        return verticalSpan > 0 ? horizontalSpan / verticalSpan : 0;
    }

    public boolean usesAbsoluteLayout() {
        return horizontalSpan > 0;
    }

    public boolean isTextHeavy(double labelLengthThreshold) {
        return averageLabelLength > labelLengthThreshold;
    }
}
