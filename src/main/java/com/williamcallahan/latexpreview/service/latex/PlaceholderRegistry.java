package com.williamcallahan.latexpreview.service.latex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-document mapping from opaque placeholder tokens to rendered HTML fragments.
 *
 * <p>Tokens look like {@code LATEXPREVIEWMATH_3_}. The trailing underscore terminates the counter so
 * {@code ..._1_} can never be a prefix of {@code ..._12_}, and the category tag keeps counters from
 * different categories from ever producing the same text. Entries are append-only; a registry is created
 * for one document and discarded afterwards.</p>
 */
public final class PlaceholderRegistry {

    private static final Logger logger = LoggerFactory.getLogger(PlaceholderRegistry.class);

    public static final String TOKEN_PREFIX = "LATEXPREVIEW";
    private static final Pattern TOKEN_PATTERN =
        Pattern.compile(TOKEN_PREFIX + "(?:TIKZ|MATH|TABLE|BLOCK)_\\d+_");
    private static final String BLOCK_PADDING = "\n\n";
    // same text once parsed as HTML, but never token-shaped
    private static final String DISARMED_PREFIX = "LATEX&#80;REVIEW";

    private final Map<String, String> entries = new LinkedHashMap<>();
    private final Map<PlaceholderCategory, Integer> counters = new EnumMap<>(PlaceholderCategory.class);
    private final Set<String> blockTokens = new HashSet<>();

    /**
     * Registers an inline fragment and returns its bare token.
     *
     * @param category token namespace
     * @param html rendered fragment
     * @return token to insert into the document buffer
     */
    public String register(PlaceholderCategory category, String html) {
        Objects.requireNonNull(category, "Placeholder category cannot be null");
        Objects.requireNonNull(html, "Placeholder HTML cannot be null");
        int next = counters.getOrDefault(category, 0);
        counters.put(category, next + 1);
        String token = TOKEN_PREFIX + category.tag() + "_" + next + "_";
        entries.put(token, html);
        return token;
    }

    /**
     * Registers a block-level fragment; the returned token is padded with blank lines so paragraph
     * segmentation keeps it on its own.
     *
     * @param category token namespace
     * @param html rendered fragment
     * @return padded token
     */
    public String registerBlock(PlaceholderCategory category, String html) {
        String token = register(category, html);
        blockTokens.add(token);
        return BLOCK_PADDING + token + BLOCK_PADDING;
    }

    /**
     * Replaces every occurrence of the token prefix already present in source text with an inline token
     * whose fragment renders the same characters, so resolution never substitutes into author text.
     *
     * @param text raw source
     * @return source in which only registered tokens carry the prefix
     */
    public String protectLiterals(String text) {
        if (text == null || !text.contains(TOKEN_PREFIX)) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length() + 16);
        int cursor = 0;
        int protectedCount = 0;
        int at = text.indexOf(TOKEN_PREFIX);
        while (at >= 0) {
            out.append(text, cursor, at).append(register(PlaceholderCategory.BLOCK, DISARMED_PREFIX));
            protectedCount++;
            cursor = at + TOKEN_PREFIX.length();
            at = text.indexOf(TOKEN_PREFIX, cursor);
        }
        logger.debug("Protected {} literal token prefix occurrence(s) in source", protectedCount);
        return out.append(text, cursor, text.length()).toString();
    }

    /**
     * Reports whether {@code token} was registered as a block-level fragment.
     *
     * @param token bare token, surrounding whitespace ignored
     * @return whether the token stands for block HTML
     */
    public boolean isBlock(String token) {
        return token != null && blockTokens.contains(token.strip());
    }

    /**
     * Looks up the fragment registered for a token.
     *
     * @param token placeholder token
     * @return fragment when the token belongs to this registry
     */
    public Optional<String> lookup(String token) {
        return Optional.ofNullable(entries.get(token));
    }

    public int size() {
        return entries.size();
    }

    /**
     * Returns a read-only view of every entry in registration order.
     *
     * @return token to fragment map
     */
    public Map<String, String> entries() {
        return Collections.unmodifiableMap(entries);
    }

    /**
     * Returns the entries registered after {@code mark}, a value previously obtained from {@link #size()}.
     *
     * @param mark entry count before a stage ran
     * @return entries added since the mark, in registration order
     */
    public Map<String, String> entriesSince(int mark) {
        Map<String, String> added = new LinkedHashMap<>();
        int index = 0;
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            if (index++ >= mark) {
                added.put(entry.getKey(), entry.getValue());
            }
        }
        return added;
    }

    /**
     * Substitutes every known token in {@code text}, repeating while substituted fragments themselves
     * contain tokens. Unknown token-shaped text is left untouched.
     *
     * @param text text containing tokens
     * @param maxPasses upper bound on substitution passes
     * @return resolved text
     */
    public String resolve(String text, int maxPasses) {
        return resolve(text, entries, maxPasses);
    }

    /**
     * Substitutes tokens using a detached token-to-fragment map, such as the blocks of a finished
     * conversion result.
     *
     * @param text text containing tokens
     * @param fragments token to fragment map
     * @param maxPasses upper bound on substitution passes
     * @return resolved text
     */
    public static String resolve(String text, Map<String, String> fragments, int maxPasses) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String current = text;
        for (int pass = 0; pass < maxPasses; pass++) {
            Matcher matcher = TOKEN_PATTERN.matcher(current);
            StringBuilder out = new StringBuilder(current.length());
            boolean replaced = false;
            while (matcher.find()) {
                String fragment = fragments.get(matcher.group());
                if (fragment != null) {
                    replaced = true;
                    matcher.appendReplacement(out, Matcher.quoteReplacement(fragment));
                } else {
                    matcher.appendReplacement(out, Matcher.quoteReplacement(matcher.group()));
                }
            }
            matcher.appendTail(out);
            current = out.toString();
            if (!replaced) {
                return current;
            }
        }
        if (containsKnownToken(current, fragments)) {
            logger.warn("Placeholder resolution stopped after {} passes with tokens remaining", maxPasses);
        }
        return current;
    }

    private static boolean containsKnownToken(String text, Map<String, String> fragments) {
        Matcher matcher = TOKEN_PATTERN.matcher(text);
        while (matcher.find()) {
            if (fragments.containsKey(matcher.group())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Reports whether {@code text}, ignoring surrounding whitespace, is exactly one token.
     *
     * @param text candidate text
     * @return whether the text is a lone token
     */
    public static boolean isToken(String text) {
        return text != null && TOKEN_PATTERN.matcher(text.strip()).matches();
    }

    /**
     * Reports whether {@code text} contains any token-shaped substring.
     *
     * @param text candidate text
     * @return whether a token occurs
     */
    public static boolean containsToken(String text) {
        return text != null && TOKEN_PATTERN.matcher(text).find();
    }
}
