package com.williamcallahan.latexpreview.service.latex;

/**
 * Per-document counters for captioned floats.
 */
final class FloatNumbering {

    private int figures;
    private int algorithms;

    int nextFigure() {
        return ++figures;
    }

    int nextAlgorithm() {
        return ++algorithms;
    }
}
