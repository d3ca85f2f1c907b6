package com.williamcallahan.latexpreview.service.latex;

/**
 * Typesetting backend for one math expression.
 */
public interface MathRenderer {

    /**
     * Renders an expression.
     *
     * @param source expression source; for structured environments the full environment text
     * @param displayMode whether the expression is display math
     * @param macros macro definitions in effect for the document
     * @return rendered markup
     * @throws MathRenderException when the backend cannot render the expression
     */
    String render(String source, boolean displayMode, MacroTable macros);
}
