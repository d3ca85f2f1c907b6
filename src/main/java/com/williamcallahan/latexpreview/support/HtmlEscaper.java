package com.williamcallahan.latexpreview.support;

/**
 * Minimal HTML escaping for text and attribute values.
 */
public final class HtmlEscaper {

    private HtmlEscaper() {
    }

    /**
     * Escapes the five HTML-significant characters.
     *
     * @param text raw text, may be null
     * @return escaped text, empty for null input
     */
    public static String escape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder escaped = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&#39;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }

    /**
     * Encodes a complete HTML document for use inside a double-quoted {@code srcdoc} attribute.
     * Only ampersands and double quotes need encoding there.
     *
     * @param document HTML document
     * @return attribute-safe document text
     */
    public static String encodeSrcdoc(String document) {
        if (document == null) {
            return "";
        }
        return document.replace("&", "&amp;").replace("\"", "&quot;");
    }
}
