package com.williamcallahan.latexpreview.service.latex;

/**
 * Namespaces for placeholder tokens. Each category keeps its own counter.
 */
public enum PlaceholderCategory {
    TIKZ("TIKZ"),
    MATH("MATH"),
    TABLE("TABLE"),
    BLOCK("BLOCK");

    private final String tag;

    PlaceholderCategory(String tag) {
        this.tag = tag;
    }

    /**
     * Returns the tag embedded in tokens of this category.
     *
     * @return uppercase tag
     */
    public String tag() {
        return tag;
    }
}
