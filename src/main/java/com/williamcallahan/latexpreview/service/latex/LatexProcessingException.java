package com.williamcallahan.latexpreview.service.latex;

/**
 * Signals an internal defect while converting LaTeX, as opposed to malformed input, which the
 * pipeline always degrades around.
 */
public class LatexProcessingException extends IllegalStateException {

    /**
     * Creates a processing exception with context.
     *
     * @param message failure summary
     */
    public LatexProcessingException(String message) {
        super(message);
    }

    /**
     * Creates a processing exception with context and root cause.
     *
     * @param message failure summary
     * @param cause the underlying failure
     */
    public LatexProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
