package com.williamcallahan.latexpreview.service.latex;

import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts sectioning commands to headings. Section levels become block tokens; {@code \paragraph} is a
 * run-in heading kept inline with the text that follows it.
 */
public class SectionHeadings {

    private static final Pattern SECTIONING = Pattern.compile(
        "\\\\(section|subsection|subsubsection|paragraph)\\*?(?![a-zA-Z])");

    /**
     * Replaces every sectioning command that has a braced title.
     *
     * @param text document buffer
     * @param registry placeholder registry for this document
     * @param inlineFormatter formatter for heading text
     * @return rewritten buffer
     */
    public String apply(String text, PlaceholderRegistry registry, UnaryOperator<String> inlineFormatter) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(text.length());
        Matcher matcher = SECTIONING.matcher(text);
        int cursor = 0;
        while (cursor < text.length() && matcher.find(cursor)) {
            int argumentAt = LatexArguments.skipWhitespace(text, matcher.end());
            Optional<LatexArguments.Argument> shortForm = LatexArguments.readBracketed(text, argumentAt);
            if (shortForm.isPresent()) {
                argumentAt = LatexArguments.skipWhitespace(text, shortForm.get().end());
            }
            Optional<LatexArguments.Argument> title = LatexArguments.readBraced(text, argumentAt);
            if (title.isEmpty()) {
                out.append(text, cursor, matcher.end());
                cursor = matcher.end();
                continue;
            }
            out.append(text, cursor, matcher.start());
            String heading = inlineFormatter.apply(title.get().content().strip());
            out.append(switch (matcher.group(1)) {
                case "section" -> registry.registerBlock(PlaceholderCategory.BLOCK, "<h2>" + heading + "</h2>");
                case "subsection" -> registry.registerBlock(PlaceholderCategory.BLOCK, "<h3>" + heading + "</h3>");
                case "subsubsection" -> registry.registerBlock(PlaceholderCategory.BLOCK, "<h4>" + heading + "</h4>");
                default -> registry.register(PlaceholderCategory.BLOCK,
                    "<strong class=\"latex-paragraph-heading\">" + heading + "</strong>") + " ";
            });
            cursor = title.get().end();
        }
        return out.append(text.substring(Math.min(cursor, text.length()))).toString();
    }
}
