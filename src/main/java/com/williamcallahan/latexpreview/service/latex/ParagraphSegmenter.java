package com.williamcallahan.latexpreview.service.latex;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Splits text on blank-line runs and wraps each text segment in a paragraph. A segment that is a lone
 * block-level placeholder token passes through unwrapped.
 */
public class ParagraphSegmenter {

    private static final Pattern BLANK_LINES = Pattern.compile("\\r?\\n[ \\t]*(?:\\r?\\n[ \\t]*)+");

    /**
     * Segments {@code text} into paragraphs.
     *
     * @param text cleaned buffer
     * @param registry registry that knows which tokens are block-level
     * @param inlineFormatter formatter applied to each text segment
     * @return HTML with paragraphs and untouched block tokens
     */
    public String segment(String text, PlaceholderRegistry registry, UnaryOperator<String> inlineFormatter) {
        if (text == null || text.isBlank()) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        for (String segment : BLANK_LINES.split(text)) {
            String trimmed = segment.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (PlaceholderRegistry.isToken(trimmed) && registry.isBlock(trimmed)) {
                parts.add(trimmed);
                continue;
            }
            String formatted = inlineFormatter.apply(trimmed).strip();
            if (!formatted.isEmpty()) {
                parts.add("<p>" + formatted + "</p>");
            }
        }
        return String.join("\n", parts);
    }
}
