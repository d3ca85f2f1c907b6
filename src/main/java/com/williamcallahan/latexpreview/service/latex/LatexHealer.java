package com.williamcallahan.latexpreview.service.latex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pre-normalizes malformed or machine-generated LaTeX before any structural parsing.
 *
 * <p>Rules run in a fixed order and the whole chain is repeated until the text stops changing, so
 * healing already-healed text is a no-op.</p>
 */
public class LatexHealer {

    private static final Logger logger = LoggerFactory.getLogger(LatexHealer.class);
    private static final int MAX_HEAL_PASSES = 8;

    /** Prose phrases that legitimately contain an ampersand which generated LaTeX tends to leave unescaped. */
    public static final List<String> KNOWN_LITERAL_PHRASES = List.of(
        "Built-in & Comprehensive",
        "Research & Development",
        "Terms & Conditions",
        "R&D",
        "Q&A");

    // control words starting with "n" that must survive the literal "\n" fix
    private static final Set<String> PROTECTED_N_COMMANDS = Set.of(
        "node", "nodepart", "newline", "newpage", "noindent", "newcommand", "newtheorem", "newenvironment",
        "newcolumntype", "newlength", "newcounter", "newif", "nocite", "nolinebreak", "nopagebreak", "nobreak",
        "normalsize", "normalfont", "numberwithin", "nabla", "natural", "neq", "ne", "neg", "nu", "not", "notin",
        "ni", "nonumber", "nolimits", "nmid", "nleq", "ngeq", "nless", "ngtr", "nsubseteq", "nsupseteq",
        "nparallel", "nsim", "ncong", "nequiv", "nexists", "nearrow", "nwarrow", "nLeftarrow", "nRightarrow",
        "nleftarrow", "nrightarrow", "nleftrightarrow", "nLeftrightarrow", "notag");

    private static final Pattern LEADING_FENCE = Pattern.compile("\\A\\s*```(?:latex|tex)?[ \\t]*\\r?\\n?", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\r?\\n?```\\s*\\z");
    private static final Pattern GHOST_HEADING = Pattern.compile(
        "\\\\(?:sub)?section\\*?\\s*\\{\\s*(?:References|Bibliography|Works\\s+Cited)\\s*\\}", Pattern.CASE_INSENSITIVE);
    private static final Pattern NO_OP_COMMANDS = Pattern.compile(
        "(?<!\\\\)\\\\(?:tableofcontents|listoffigures|listoftables|newpage|clearpage|cleardoublepage|pagebreak"
            + "|noindent|smallskip|medskip|bigskip)(?![a-zA-Z])[ \\t]*");
    private static final Pattern NO_OP_WITH_ARGUMENT = Pattern.compile(
        "(?<!\\\\)\\\\(?:input|include|vspace\\*?|hspace\\*?)\\s*\\{[^{}]*\\}");

    private final List<PhraseRule> phraseRules;

    public LatexHealer() {
        this(KNOWN_LITERAL_PHRASES);
    }

    /**
     * Creates a healer that escapes separators inside the given literal phrases.
     *
     * @param literalPhrases phrases containing exactly one {@code &}
     */
    public LatexHealer(List<String> literalPhrases) {
        Objects.requireNonNull(literalPhrases, "Literal phrases cannot be null");
        List<PhraseRule> rules = new ArrayList<>();
        for (String phrase : literalPhrases) {
            PhraseRule.of(phrase).ifPresent(rules::add);
        }
        this.phraseRules = List.copyOf(rules);
    }

    /**
     * Heals the given text. Never fails; null becomes the empty string.
     *
     * @param text raw source
     * @return healed source
     */
    public String heal(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String current = text;
        for (int pass = 0; pass < MAX_HEAL_PASSES; pass++) {
            String next = applyRules(current);
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
        logger.debug("Healer did not settle within {} passes", MAX_HEAL_PASSES);
        return current;
    }

    private String applyRules(String text) {
        String healed = stripCodeFence(text);
        healed = normalizeLiteralNewlines(healed);
        healed = GHOST_HEADING.matcher(healed).replaceAll("");
        healed = MathFragmentRepair.mergeOperatorSpans(healed);
        healed = MathFragmentRepair.stripNestedDelimiters(healed);
        healed = escapeKnownPhrases(healed);
        healed = NO_OP_COMMANDS.matcher(healed).replaceAll("");
        healed = NO_OP_WITH_ARGUMENT.matcher(healed).replaceAll("");
        return healed;
    }

    static String stripCodeFence(String text) {
        String stripped = LEADING_FENCE.matcher(text).replaceFirst("");
        return TRAILING_FENCE.matcher(stripped).replaceFirst("");
    }

    /**
     * Converts the two-character sequence backslash-n into a newline unless it starts a known control
     * word. A {@code \\} line break is never split.
     */
    static String normalizeLiteralNewlines(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c != '\\' || i + 1 >= text.length()) {
                out.append(c);
                i++;
                continue;
            }
            char next = text.charAt(i + 1);
            if (next == '\\') {
                out.append("\\\\");
                i += 2;
                continue;
            }
            if (next != 'n') {
                out.append(c).append(next);
                i += 2;
                continue;
            }
            String word = LatexArguments.controlWordAt(text, i);
            if (PROTECTED_N_COMMANDS.contains(word)) {
                out.append('\\').append(word);
                i += 1 + word.length();
            } else {
                out.append('\n');
                i += 2;
            }
        }
        return out.toString();
    }

    private String escapeKnownPhrases(String text) {
        String result = text;
        for (PhraseRule rule : phraseRules) {
            result = rule.apply(result);
        }
        return result;
    }

    private record PhraseRule(Pattern pattern, String replacement) {

        static Optional<PhraseRule> of(String phrase) {
            int amp = phrase == null ? -1 : phrase.indexOf('&');
            if (amp < 0 || phrase.indexOf('&', amp + 1) >= 0) {
                logger.warn("Ignoring literal phrase without exactly one separator: {}", phrase);
                return Optional.empty();
            }
            String left = phrase.substring(0, amp).strip();
            String right = phrase.substring(amp + 1).strip();
            Pattern pattern = Pattern.compile("(?<![\\w\\\\])(" + Pattern.quote(left) + ")(\\s*)&(\\s*)("
                + Pattern.quote(right) + ")(?!\\w)");
            return Optional.of(new PhraseRule(pattern, "$1$2\\\\&$3$4"));
        }

        String apply(String text) {
            return pattern.matcher(text).replaceAll(replacement);
        }
    }
}
