package com.williamcallahan.latexpreview.service.latex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Recursive-descent converter for {@code itemize}, {@code enumerate} and {@code description} lists.
 *
 * <p>The buffer is walked by index: a list's extent comes from the depth-aware environment scanner, its
 * body is split into items at {@code \item} markers that are not inside a nested list, and each item is
 * processed recursively before it is formatted. Every rendered list becomes a block token. An item label
 * is only read when {@code [} directly follows {@code \item}.</p>
 */
public class ListProcessor {

    private static final Logger logger = LoggerFactory.getLogger(ListProcessor.class);

    private static final List<String> LIST_ENVIRONMENTS = List.of("itemize", "enumerate", "description");
    private static final String ITEM = "\\item";

    private final int maxDepth;

    public ListProcessor(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * Replaces every list in {@code text} with a block token.
     *
     * @param text document buffer
     * @param registry placeholder registry for this document
     * @param itemFormatter formatter for item and label text
     * @return rewritten buffer
     */
    public String process(String text, PlaceholderRegistry registry, UnaryOperator<String> itemFormatter) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return process(text, registry, itemFormatter, 0);
    }

    private String process(String text, PlaceholderRegistry registry, UnaryOperator<String> itemFormatter, int depth) {
        if (depth >= maxDepth) {
            logger.warn("List nesting deeper than {} levels left as text", maxDepth);
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            Optional<EnvironmentSpan> list = listAt(text, i);
            if (list.isEmpty()) {
                out.append(text.charAt(i));
                i++;
                continue;
            }
            EnvironmentSpan span = list.get();
            String html = renderList(span.name(), span.body(text), registry, itemFormatter, depth);
            out.append(registry.registerBlock(PlaceholderCategory.BLOCK, html));
            i = span.end();
        }
        return out.toString();
    }

    private static Optional<EnvironmentSpan> listAt(String text, int index) {
        if (text.charAt(index) != '\\') {
            return Optional.empty();
        }
        for (String name : LIST_ENVIRONMENTS) {
            if (text.startsWith(EnvironmentScanner.beginMarker(name), index)) {
                return EnvironmentScanner.matchFrom(text, name, index);
            }
        }
        return Optional.empty();
    }

    private String renderList(String name, String body, PlaceholderRegistry registry,
                              UnaryOperator<String> itemFormatter, int depth) {
        String items = body;
        String options = "";
        int optionAt = LatexArguments.skipWhitespace(items, 0);
        if (items.startsWith("[", optionAt)) {
            Optional<LatexArguments.Argument> listOptions = LatexArguments.readBracketed(items, optionAt);
            if (listOptions.isPresent()) {
                options = listOptions.get().content();
                items = items.substring(listOptions.get().end());
            }
        }

        StringBuilder html = new StringBuilder();
        switch (name) {
            case "enumerate" -> html.append("<ol class=\"latex-enumerate\"")
                .append(enumerationType(options).map(type -> " type=\"" + type + "\"").orElse(""))
                .append('>');
            case "description" -> html.append("<dl class=\"latex-description\">");
            default -> html.append("<ul class=\"latex-itemize\">");
        }

        for (ListItem item : splitItems(items)) {
            String content = itemFormatter.apply(process(item.content(), registry, itemFormatter, depth + 1).strip());
            String label = item.label().map(raw -> itemFormatter.apply(raw.strip())).orElse(null);
            if ("description".equals(name)) {
                html.append("<dt>").append(label == null ? "" : label).append("</dt><dd>").append(content).append("</dd>");
            } else if (label != null) {
                html.append("<li class=\"latex-labeled-item\" style=\"list-style: none;\"><strong>")
                    .append(label).append("</strong> ").append(content).append("</li>");
            } else {
                html.append("<li>").append(content).append("</li>");
            }
        }

        switch (name) {
            case "enumerate" -> html.append("</ol>");
            case "description" -> html.append("</dl>");
            default -> html.append("</ul>");
        }
        return html.toString();
    }

    /**
     * Splits a list body at top-level {@code \item} markers; text before the first item is dropped.
     */
    static List<ListItem> splitItems(String body) {
        List<ListItem> items = new ArrayList<>();
        int i = 0;
        int itemStart = -1;
        Optional<String> label = Optional.empty();
        while (i < body.length()) {
            Optional<EnvironmentSpan> nested = listAt(body, i);
            if (nested.isPresent()) {
                i = nested.get().end();
                continue;
            }
            if (body.startsWith(ITEM, i) && !continuesWord(body, i + ITEM.length())) {
                if (itemStart >= 0) {
                    items.add(new ListItem(label, body.substring(itemStart, i)));
                }
                int next = i + ITEM.length();
                label = Optional.empty();
                if (next < body.length() && body.charAt(next) == '[') {
                    Optional<LatexArguments.Argument> itemLabel = LatexArguments.readBracketed(body, next);
                    if (itemLabel.isPresent()) {
                        label = Optional.of(itemLabel.get().content());
                        next = itemLabel.get().end();
                    }
                }
                itemStart = next;
                i = next;
                continue;
            }
            i++;
        }
        if (itemStart >= 0) {
            items.add(new ListItem(label, body.substring(itemStart)));
        }
        return items;
    }

    /**
     * Derives an HTML list type from enumerate options such as {@code label=(\alph*)} or {@code (a)}.
     */
    static Optional<String> enumerationType(String options) {
        if (options == null || options.isBlank()) {
            return Optional.empty();
        }
        if (options.contains("\\alph")) {
            return Optional.of("a");
        }
        if (options.contains("\\Alph")) {
            return Optional.of("A");
        }
        if (options.contains("\\roman")) {
            return Optional.of("i");
        }
        if (options.contains("\\Roman")) {
            return Optional.of("I");
        }
        if (options.contains("\\arabic")) {
            return Optional.of("1");
        }
        String label = options.replaceFirst("^\\s*label\\s*=\\s*", "").replaceAll("[^A-Za-z0-9]", "");
        return switch (label) {
            case "a", "A", "i", "I", "1" -> Optional.of(label);
            default -> Optional.empty();
        };
    }

    private static boolean continuesWord(String text, int index) {
        return index < text.length() && Character.isLetter(text.charAt(index));
    }

    /**
     * One list item: optional label and raw content.
     */
    record ListItem(Optional<String> label, String content) {
        ListItem {
            label = label == null ? Optional.empty() : label;
            content = content == null ? "" : content;
        }
    }
}
