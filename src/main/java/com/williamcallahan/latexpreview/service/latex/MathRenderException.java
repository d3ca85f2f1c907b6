package com.williamcallahan.latexpreview.service.latex;

/**
 * Raised by a {@link MathRenderer} that cannot typeset an expression.
 */
public class MathRenderException extends RuntimeException {

    public MathRenderException(String message) {
        super(message);
    }

    public MathRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
