package com.williamcallahan.latexpreview.service.latex;

import com.williamcallahan.latexpreview.support.DecimalText;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces decorated brace strokes with explicit Bezier curves.
 *
 * <p>The browser TikZ backend cannot draw {@code decoration={brace}}, so a
 * {@code \draw[decorate,decoration={brace}] (a) -- (b) node[..] {label};} statement becomes two cubic
 * segments meeting at a tip halfway between the endpoints, plus a node placed beyond the tip. Horizontal
 * braces bulge upward and vertical braces to the left; {@code mirror} flips the side.</p>
 */
final class BracePolyfill {

    private static final Pattern DECORATED_BRACE = Pattern.compile(
        "\\\\draw\\[\\s*decorate\\s*,\\s*decoration\\s*=\\s*\\{\\s*brace([^}]*)\\}[^\\]]*\\]"
            + "\\s*\\(([^)]+)\\)\\s*--\\s*\\(([^)]+)\\)\\s*node\\s*\\[([^\\]]*)\\]\\s*\\{([^}]*)\\}\\s*;");
    private static final Pattern NUMBER = Pattern.compile("-?(?:\\d+\\.?\\d*|\\.\\d+)");

    // empirically tuned against TikZJax output
    private static final double AMPLITUDE = 0.15;
    private static final double TIP_AMPLITUDE = 0.35;
    private static final double LABEL_GAP = 0.6;

    private BracePolyfill() {
    }

    static String apply(String body) {
        if (body == null || !body.contains("brace")) {
            return body;
        }
        Matcher matcher = DECORATED_BRACE.matcher(body);
        StringBuilder out = new StringBuilder(body.length());
        while (matcher.find()) {
            boolean mirror = matcher.group(1).contains("mirror");
            Point start = Point.parse(matcher.group(2));
            Point end = Point.parse(matcher.group(3));
            String replacement = curve(start, end, mirror, matcher.group(4), matcher.group(5));
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String curve(Point p1, Point p2, boolean mirror, String nodeOptions, String label) {
        double direction = mirror ? -1 : 1;
        boolean vertical = Math.abs(p2.y() - p1.y()) > Math.abs(p2.x() - p1.x());
        double midX = (p1.x() + p2.x()) / 2;
        double midY = (p1.y() + p2.y()) / 2;

        Point c1;
        Point c2;
        Point tip;
        Point c3;
        Point labelAt;
        if (vertical) {
            double sign = -direction;
            c1 = new Point(p1.x() + sign * AMPLITUDE, p1.y());
            c2 = new Point(midX + sign * AMPLITUDE, midY);
            tip = new Point(midX + sign * TIP_AMPLITUDE, midY);
            c3 = new Point(p2.x() + sign * AMPLITUDE, p2.y());
            labelAt = new Point(midX + sign * (TIP_AMPLITUDE + LABEL_GAP), midY);
        } else {
            double sign = direction;
            c1 = new Point(p1.x(), p1.y() + sign * AMPLITUDE);
            c2 = new Point(midX, midY + sign * AMPLITUDE);
            tip = new Point(midX, midY + sign * TIP_AMPLITUDE);
            c3 = new Point(p2.x(), p2.y() + sign * AMPLITUDE);
            labelAt = new Point(midX, midY + sign * (TIP_AMPLITUDE + LABEL_GAP));
        }
        return "\\draw[thick] " + p1 + " .. controls " + c1 + " and " + c2 + " .. " + tip
            + " .. controls " + c2 + " and " + c3 + " .. " + p2 + "; "
            + "\\node[" + nodeOptions + "] at " + labelAt + " {" + label + "};";
    }

    private record Point(double x, double y) {

        static Point parse(String coordinate) {
            String[] parts = coordinate.split(",", -1);
            return new Point(component(parts, 0), component(parts, 1));
        }

        private static double component(String[] parts, int index) {
            if (index >= parts.length) {
                return 0;
            }
            Matcher number = NUMBER.matcher(parts[index].strip());
            return number.lookingAt() ? Double.parseDouble(number.group()) : 0;
        }

        @Override
        public String toString() {
            return "(" + DecimalText.plain(x) + "," + DecimalText.plain(y) + ")";
        }
    }
}
