package com.williamcallahan.latexpreview.service.latex;

import com.williamcallahan.latexpreview.config.DiagramHeuristics;
import com.williamcallahan.latexpreview.domain.latex.DiagramIntent;
import com.williamcallahan.latexpreview.support.DecimalText;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes rendering options for a classified diagram and merges them with the author's options.
 *
 * <p>Synthesized options come first and the author's follow, so an author value is kept wherever the
 * rules below do not strip it. Author values are only replaced when they would make the diagram
 * illegible: a too-small {@code node distance} under LARGE, or the x/y units of a FLAT timeline.</p>
 */
public class DiagramOptionSynthesizer {

    private static final String NUMBER = "(?:\\d+\\.?\\d*|\\.\\d+)";
    private static final Pattern X_UNIT = Pattern.compile("(?<![a-zA-Z])x\\s*=\\s*(" + NUMBER + ")");
    private static final Pattern Y_UNIT = Pattern.compile("(?<![a-zA-Z])y\\s*=\\s*(" + NUMBER + ")");
    private static final Pattern SCALE = Pattern.compile("(?<![a-zA-Z])scale\\s*=");
    private static final Pattern FONT = Pattern.compile("(?<![a-zA-Z])font\\s*=");
    private static final Pattern STRIP_X_UNIT = Pattern.compile(
        ",?\\s*(?<![a-zA-Z])x\\s*=\\s*" + NUMBER + "\\s*(?:cm)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern STRIP_Y_UNIT = Pattern.compile(
        ",?\\s*(?<![a-zA-Z])y\\s*=\\s*" + NUMBER + "\\s*(?:cm)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern STRIP_NODE_DISTANCE = Pattern.compile(
        ",?\\s*node distance\\s*=\\s*" + NUMBER + "\\s*(?:cm)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern EMPTY_SLOT = Pattern.compile(",\\s*,");
    private static final Pattern EDGE_COMMA = Pattern.compile("^\\s*,|,\\s*$");

    private final DiagramHeuristics heuristics;

    public DiagramOptionSynthesizer(DiagramHeuristics heuristics) {
        this.heuristics = Objects.requireNonNull(heuristics, "Diagram heuristics cannot be null");
    }

    /**
     * Builds the final option list for {@code \begin{tikzpicture}[...]}.
     *
     * @param intent classified intent
     * @param metrics diagram measurements
     * @param options author options without brackets, may be empty
     * @return merged options without brackets
     */
    public String synthesize(DiagramIntent intent, DiagramMetrics metrics, String options) {
        String source = options == null ? "" : options.strip();
        boolean textHeavy = metrics.isTextHeavy(heuristics.getTextHeavyLabelLength());
        List<String> extra = new ArrayList<>();

        switch (intent) {
            case COMPACT -> compact(metrics, source, extra);
            case LARGE -> source = large(metrics, textHeavy, source, extra);
            case WIDE -> wide(metrics, source, extra);
            case FLAT -> source = flat(metrics, source, extra);
            case MEDIUM -> medium(metrics, source, extra);
        }

        if (textHeavy && intent != DiagramIntent.LARGE && !metrics.usesAbsoluteLayout()
            && !X_UNIT.matcher(source).find()) {
            extra.add("x=" + DecimalText.plain(heuristics.getBoostXUnitCm()) + "cm");
            extra.add("y=" + DecimalText.plain(heuristics.getBoostYUnitCm()) + "cm");
        }
        return merge(extra, source);
    }

    private void compact(DiagramMetrics metrics, String source, List<String> extra) {
        double scale = metrics.nodeCount() >= heuristics.getCompactNodeCount()
            ? heuristics.getCompactDenseScale()
            : heuristics.getCompactScale();
        if (!SCALE.matcher(source).find()) {
            extra.add("scale=" + DecimalText.plain(scale));
        }
        if (!source.contains("transform shape")) {
            extra.add("transform shape");
        }
        if (!source.contains("node distance")) {
            extra.add("node distance=" + DecimalText.plain(heuristics.getCompactDefaultDistanceCm()) + "cm");
        }
    }

    private String large(DiagramMetrics metrics, boolean textHeavy, String source, List<String> extra) {
        double span = metrics.horizontalSpan();
        double optimal = Math.min(heuristics.getMaxUnitCm(), heuristics.getWidthBudgetCm() / (span > 0 ? span : 1));
        double clamp = span > heuristics.getAdaptiveClampSplitSpan()
            ? heuristics.getWideUnitClampCm()
            : heuristics.getNarrowUnitClampCm();
        double xUnit = Math.min(clamp, optimal);
        double yUnit = metrics.verticalSpan() > 0
            ? clamp(heuristics.getTargetHeightCm() / metrics.verticalSpan(), heuristics.getMinYUnitCm(), heuristics.getMaxYUnitCm())
            : heuristics.getRelativeYUnitCm();
        extra.add("x=" + DecimalText.fixed(xUnit, 2) + "cm");
        extra.add("y=" + DecimalText.fixed(yUnit, 2) + "cm");
        if (!FONT.matcher(source).find()) {
            extra.add("font=\\small");
        }

        double target = textHeavy ? heuristics.getTextHeavyNodeDistanceCm() : heuristics.getLightNodeDistanceCm();
        String targetOption = "node distance=" + DecimalText.plain(target) + "cm";
        String result = source;
        if (metrics.nodeDistance().isEmpty()) {
            extra.add(targetOption);
        } else {
            double existing = metrics.nodeDistance().getAsDouble();
            boolean override = textHeavy ? existing < target : existing < heuristics.getLegibleNodeDistanceCm();
            if (override) {
                extra.add(targetOption);
                result = strip(result, STRIP_NODE_DISTANCE);
            }
        }
        if (!source.contains("text width")) {
            extra.add("every node/.append style={align=center}");
        }
        return result;
    }

    private void wide(DiagramMetrics metrics, String source, List<String> extra) {
        double span = metrics.horizontalSpan();
        double fit = span > 0 ? Math.min(1.0, heuristics.getWideTargetWidthCm() / span) : 1.0;
        double scale = Math.max(heuristics.getWideMinScale(), fit * heuristics.getWideBuffer());
        if (!SCALE.matcher(source).find()) {
            extra.add("scale=" + DecimalText.fixed(scale, 2));
        }
        if (!source.contains("transform shape")) {
            extra.add("transform shape");
        }
    }

    private String flat(DiagramMetrics metrics, String source, List<String> extra) {
        double yMultiplier = clamp(metrics.aspectRatio() / heuristics.getFlatTargetRatio(),
            heuristics.getFlatMinYMultiplier(), heuristics.getFlatMaxYMultiplier());
        double baseX = unitOf(X_UNIT, source);
        double baseY = unitOf(Y_UNIT, source);
        String result = strip(strip(source, STRIP_X_UNIT), STRIP_Y_UNIT);
        extra.add("x=" + DecimalText.fixed(baseX * heuristics.getFlatXMultiplier(), 1) + "cm");
        extra.add("y=" + DecimalText.fixed(baseY * yMultiplier, 1) + "cm");
        extra.add("scale=1.0");
        if (metrics.nodeCount() >= heuristics.getFlatSmallFontNodeCount() && !FONT.matcher(source).find()) {
            extra.add("font=\\small");
        }
        return result;
    }

    private void medium(DiagramMetrics metrics, String source, List<String> extra) {
        double span = metrics.horizontalSpan();
        double scale;
        if (span > 0 && span <= heuristics.getSafeWidthCm()) {
            scale = heuristics.getMediumFitScale();
        } else {
            scale = metrics.nodeCount() >= heuristics.getMediumDenseNodeCount()
                ? heuristics.getMediumDenseScale()
                : heuristics.getMediumScale();
        }
        boolean explicitUnits = X_UNIT.matcher(source).find() || Y_UNIT.matcher(source).find();
        if (!SCALE.matcher(source).find() && !explicitUnits) {
            extra.add("scale=" + DecimalText.plain(scale));
        }
        if (explicitUnits && !source.contains("transform shape")) {
            extra.add("transform shape");
        }
        if (!source.contains("node distance")) {
            extra.add("node distance=" + DecimalText.plain(heuristics.getMediumDefaultDistanceCm()) + "cm");
        }
    }

    private static double unitOf(Pattern pattern, String source) {
        Matcher matcher = pattern.matcher(source);
        return matcher.find() ? Double.parseDouble(matcher.group(1)) : 1.0;
    }

    private static double clamp(double value, double min, double max) {
        return Math.min(max, Math.max(min, value));
    }

    private static String strip(String options, Pattern pattern) {
        return cleanCommas(pattern.matcher(options).replaceAll(""));
    }

    private static String cleanCommas(String options) {
        String cleaned = options;
        Matcher slot = EMPTY_SLOT.matcher(cleaned);
        while (slot.find()) {
            cleaned = slot.replaceAll(",");
            slot = EMPTY_SLOT.matcher(cleaned);
        }
        return EDGE_COMMA.matcher(cleaned).replaceAll("").strip();
    }

    private static String merge(List<String> extra, String source) {
        String combined = String.join(", ", extra);
        if (!source.isEmpty()) {
            combined = combined.isEmpty() ? source : combined + ", " + source;
        }
        return cleanCommas(combined);
    }
}
