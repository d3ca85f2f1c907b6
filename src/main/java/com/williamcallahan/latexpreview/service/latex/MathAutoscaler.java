package com.williamcallahan.latexpreview.service.latex;

import com.williamcallahan.latexpreview.config.MathAutoscale;
import com.williamcallahan.latexpreview.support.DecimalText;

import java.util.Objects;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Shrinks long single-line display equations to the preview column.
 *
 * <p>Width is estimated from a proxy of the source in which text wrappers are unwrapped, sizing
 * delimiters dropped and every other control word counted as one character. Sources with row breaks or
 * a structured environment grow vertically and are never scaled.</p>
 */
public class MathAutoscaler {

    private static final Pattern STRUCTURED = Pattern.compile("\\\\begin\\s*\\{(?:equation|align|gather|multline)");
    private static final Pattern TEXT_WRAPPER = Pattern.compile("\\\\(?:mathrm|text|textbf)\\{([^}]+)\\}");
    private static final Pattern SIZING = Pattern.compile("\\\\(?:left|right|big|Big|bigg|Bigg)[lrv]?(?![a-zA-Z])");
    private static final Pattern CONTROL_WORD = Pattern.compile("\\\\[a-zA-Z]+");

    private final MathAutoscale settings;

    public MathAutoscaler(MathAutoscale settings) {
        this.settings = Objects.requireNonNull(settings, "Math settings cannot be null");
    }

    /**
     * Computes the scale for a display expression.
     *
     * @param source expression source
     * @return scale factor below 1, or empty when the expression fits or must not be scaled
     */
    public OptionalDouble scaleFor(String source) {
        if (source == null || source.contains("\\\\") || STRUCTURED.matcher(source).find()) {
            return OptionalDouble.empty();
        }
        String proxy = TEXT_WRAPPER.matcher(source).replaceAll("$1");
        proxy = SIZING.matcher(proxy).replaceAll("");
        proxy = CONTROL_WORD.matcher(proxy).replaceAll("C");
        double estimatedEm = proxy.length() * settings.getWidthFactorEm();
        if (estimatedEm <= settings.getBudgetEm()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.max(settings.getMinScale(), settings.getBudgetEm() / estimatedEm));
    }

    /**
     * Wraps rendered display markup in a scale transform when {@link #scaleFor} asks for one.
     */
    public String apply(String source, String html) {
        OptionalDouble scale = scaleFor(source);
        if (scale.isEmpty()) {
            return html;
        }
        double factor = scale.getAsDouble();
        return "<div class=\"katex-autoscale\" style=\"transform: scale(" + DecimalText.fixed(factor, 2)
            + "); transform-origin: left center; width: " + DecimalText.fixed(100 / factor, 1) + "%;\">"
            + html + "</div>";
    }
}
