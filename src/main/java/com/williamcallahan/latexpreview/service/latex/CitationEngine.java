package com.williamcallahan.latexpreview.service.latex;

import com.williamcallahan.latexpreview.support.HtmlEscaper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeSet;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonicalizes citations into IEEE-style numeric markers and produces the reference list.
 *
 * <p>Recognized forms, applied in this order: {@code \cite}-family commands with a key list,
 * consecutive {@code (ref_1)(ref_2)} groups, a parenthesized key list separated by commas, semicolons
 * or spaces, a single {@code (ref_3)}, and {@code \ref{ref_4}} cross-references that really mean a
 * citation. A manual {@code thebibliography} environment takes precedence over synthesis: its entries
 * are numbered in entry order and a cited key missing from it renders as {@code [?]}.</p>
 */
public class CitationEngine {

    private static final Logger logger = LoggerFactory.getLogger(CitationEngine.class);

    private static final String MANUAL_BIBLIOGRAPHY = "thebibliography";
    private static final String RANGE_DASH = "–";
    private static final String UNKNOWN_MARKER = "[?]";

    private static final String REF_KEY = "ref(?:\\\\?_|[ \\t])?\\d{1,6}";
    private static final Pattern CITE_COMMAND = Pattern.compile(
        "\\\\(?:cite|citep|citet|parencite|textcite|autocite)\\*?((?:\\s*\\[[^\\[\\]]*\\]){0,2})\\s*\\{([^{}]*)\\}");
    private static final Pattern CONSECUTIVE_GROUPS = Pattern.compile(
        "(?:\\(\\s*" + REF_KEY + "\\s*\\)){2,}", Pattern.CASE_INSENSITIVE);
    private static final Pattern PARENTHESIZED_LIST = Pattern.compile(
        "\\(\\s*(" + REF_KEY + "(?:\\s*[,;]?\\s*" + REF_KEY + ")+)\\s*\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SINGLE_PARENTHESIZED = Pattern.compile(
        "\\(\\s*(" + REF_KEY + ")\\s*\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern CROSS_REFERENCE = Pattern.compile(
        "\\\\ref\\s*\\{\\s*(" + REF_KEY + ")\\s*\\}", Pattern.CASE_INSENSITIVE);
    private static final Pattern KEY_IN_GROUP = Pattern.compile(REF_KEY, Pattern.CASE_INSENSITIVE);
    private static final Pattern KEY_SEPARATORS = Pattern.compile("[,;\\s]+");
    private static final Pattern VALID_KEY = Pattern.compile("[^\\s{}\\\\%#$&]+");
    private static final Pattern BRACKET_ARGUMENT = Pattern.compile("\\[([^\\[\\]]*)\\]");
    private static final Pattern BIBITEM = Pattern.compile("\\\\bibitem\\s*(?:\\[[^\\]]*\\])?\\s*\\{([^{}]+)\\}");

    /**
     * Processes citations with entries rendered as escaped plain text.
     */
    public CitationResult processCitations(String text) {
        return processCitations(text, HtmlEscaper::escape);
    }

    /**
     * Processes citations, formatting manual bibliography entries through {@code entryFormatter}.
     *
     * @param text healed document buffer
     * @param entryFormatter LaTeX-to-HTML formatter for bibliography entry text
     * @return rewritten buffer and reference list
     */
    public CitationResult processCitations(String text, UnaryOperator<String> entryFormatter) {
        if (text == null || text.isEmpty()) {
            return new CitationResult("", "", false);
        }
        String content = text;
        List<BibliographyEntry> manualEntries = List.of();
        Optional<EnvironmentSpan> manual = EnvironmentScanner.find(content, MANUAL_BIBLIOGRAPHY, 0);
        if (manual.isPresent()) {
            EnvironmentSpan span = manual.get();
            manualEntries = parseEntries(span.body(content));
            content = content.substring(0, span.start()) + content.substring(span.end());
            logger.debug("Manual bibliography with {} entries", manualEntries.size());
        }

        CitationRegistry registry = manual.isPresent()
            ? CitationRegistry.fromBibliography(manualEntries.stream().map(BibliographyEntry::key).toList())
            : CitationRegistry.sequential();

        content = replaceCiteCommands(content, registry);
        content = replaceGroups(content, CONSECUTIVE_GROUPS, 0, registry);
        content = replaceGroups(content, PARENTHESIZED_LIST, 1, registry);
        content = replaceGroups(content, SINGLE_PARENTHESIZED, 1, registry);
        content = replaceGroups(content, CROSS_REFERENCE, 1, registry);

        if (manual.isPresent()) {
            return new CitationResult(content, renderManual(manualEntries, registry, entryFormatter), true);
        }
        if (registry.isEmpty()) {
            return new CitationResult(content, "", false);
        }
        return new CitationResult(content, renderSynthesized(registry), true);
    }

    private String replaceCiteCommands(String text, CitationRegistry registry) {
        Matcher matcher = CITE_COMMAND.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            List<String> keys = List.of(KEY_SEPARATORS.split(matcher.group(2).strip()));
            Optional<String> marker = formatGroup(keys, registry);
            String replacement;
            if (marker.isPresent()) {
                replacement = withNotes(marker.get(), matcher.group(1));
            } else {
                logger.debug("Citation without valid keys kept as literal text: {}", matcher.group());
                replacement = "\\textbackslash{}cite\\{" + matcher.group(2) + "\\}";
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private String replaceGroups(String text, Pattern pattern, int group, CitationRegistry registry) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            List<String> keys = new ArrayList<>();
            Matcher key = KEY_IN_GROUP.matcher(matcher.group(group));
            while (key.find()) {
                keys.add(key.group());
            }
            String replacement = formatGroup(keys, registry).orElse(matcher.group());
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Registers a group of raw keys and renders the IEEE marker.
     *
     * @return the marker, or empty when the group has no valid key
     */
    Optional<String> formatGroup(List<String> rawKeys, CitationRegistry registry) {
        TreeSet<Integer> ids = new TreeSet<>();
        boolean unknown = false;
        boolean anyValid = false;
        for (String raw : rawKeys) {
            String key = CitationRegistry.normalizeKey(raw);
            if (key.isEmpty() || !VALID_KEY.matcher(key).matches()) {
                continue;
            }
            anyValid = true;
            OptionalInt id = registry.register(key);
            if (id.isPresent()) {
                ids.add(id.getAsInt());
            } else {
                unknown = true;
            }
        }
        if (!anyValid) {
            return Optional.empty();
        }
        if (ids.isEmpty()) {
            return Optional.of(UNKNOWN_MARKER);
        }
        String marker = groupIds(ids);
        return Optional.of(unknown ? marker + ", " + UNKNOWN_MARKER : marker);
    }

    /**
     * Renders ids as sorted, de-duplicated IEEE groups: {@code [1]–[3], [5]}.
     *
     * @param ids citation ids in any order
     * @return grouped marker, empty for no ids
     */
    public static String groupIds(Collection<Integer> ids) {
        List<Integer> sorted = new ArrayList<>(new TreeSet<>(ids));
        if (sorted.isEmpty()) {
            return "";
        }
        List<String> groups = new ArrayList<>();
        int start = sorted.get(0);
        int end = start;
        for (int i = 1; i < sorted.size(); i++) {
            int id = sorted.get(i);
            if (id == end + 1) {
                end = id;
            } else {
                groups.add(range(start, end));
                start = id;
                end = id;
            }
        }
        groups.add(range(start, end));
        return String.join(", ", groups);
    }

    private static String range(int start, int end) {
        return start == end ? "[" + start + "]" : "[" + start + "]" + RANGE_DASH + "[" + end + "]";
    }

    private static String withNotes(String marker, String optionalArguments) {
        if (optionalArguments == null || optionalArguments.isBlank()) {
            return marker;
        }
        List<String> notes = new ArrayList<>();
        Matcher note = BRACKET_ARGUMENT.matcher(optionalArguments);
        while (note.find()) {
            notes.add(note.group(1).strip());
        }
        String pre = notes.size() == 2 ? notes.get(0) : "";
        String post = notes.isEmpty() ? "" : notes.get(notes.size() - 1);
        String result = marker;
        if (!post.isEmpty()) {
            boolean single = marker.indexOf('[') == marker.lastIndexOf('[');
            result = single
                ? marker.substring(0, marker.length() - 1) + ", " + post + "]"
                : marker + " (" + post + ")";
        }
        return pre.isEmpty() ? result : pre + " " + result;
    }

    private List<BibliographyEntry> parseEntries(String body) {
        List<BibliographyEntry> entries = new ArrayList<>();
        Matcher matcher = BIBITEM.matcher(body);
        String pendingKey = null;
        int pendingStart = 0;
        while (matcher.find()) {
            if (pendingKey != null) {
                entries.add(new BibliographyEntry(pendingKey, body.substring(pendingStart, matcher.start()).strip()));
            }
            pendingKey = matcher.group(1).strip();
            pendingStart = matcher.end();
        }
        if (pendingKey != null) {
            entries.add(new BibliographyEntry(pendingKey, body.substring(pendingStart).strip()));
        }
        return entries;
    }

    private String renderManual(List<BibliographyEntry> entries, CitationRegistry registry,
                                UnaryOperator<String> entryFormatter) {
        StringBuilder html = new StringBuilder("<div class=\"bibliography\"><h2>References</h2><ul class=\"bib-list\">");
        for (BibliographyEntry entry : entries) {
            OptionalInt id = registry.idOf(CitationRegistry.normalizeKey(entry.key()));
            String label = id.isPresent() ? "[" + id.getAsInt() + "]" : UNKNOWN_MARKER;
            html.append("<li><span class=\"bib-label\">").append(label).append("</span> ")
                .append(entryFormatter.apply(entry.text())).append("</li>");
        }
        return html.append("</ul></div>").toString();
    }

    private String renderSynthesized(CitationRegistry registry) {
        StringBuilder html = new StringBuilder("<div class=\"bibliography\"><h2>References</h2><ul class=\"bib-list\">");
        for (String key : registry.discoveryOrder()) {
            int id = registry.idOf(key).orElse(0);
            html.append("<li><span class=\"bib-label\">[").append(id).append("]</span> ")
                .append(HtmlEscaper.escape(key.replace('_', ' '))).append("</li>");
        }
        return html.append("</ul></div>").toString();
    }

    private record BibliographyEntry(String key, String text) {
    }
}
