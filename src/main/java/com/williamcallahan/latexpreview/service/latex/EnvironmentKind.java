package com.williamcallahan.latexpreview.service.latex;

import java.util.Locale;
import java.util.Set;

/**
 * Closed set of environment behaviors the normalizer knows about.
 */
public enum EnvironmentKind {
    THEOREM_LIKE,
    PROOF,
    ABSTRACT,
    QUOTE,
    CENTER,
    FLUSH_LEFT,
    FLUSH_RIGHT,
    FIGURE,
    ALGORITHM_FLOAT,
    MINIPAGE,
    /** Claimed by another stage, or structural; left exactly as found. */
    PASS_THROUGH,
    /** Anything else; the markers are dropped and the body kept. */
    UNKNOWN;

    private static final Set<String> THEOREM_NAMES = Set.of(
        "theorem", "lemma", "proposition", "corollary", "definition", "remark", "hypothesis",
        "example", "conjecture", "claim", "assumption", "observation", "note");

    private static final Set<String> PASS_THROUGH_NAMES = Set.of(
        "document", "thebibliography",
        "tabular", "tabular*", "tabularx", "longtable", "table", "table*",
        "itemize", "enumerate", "description", "algorithmic", "tikzpicture",
        "verbatim", "verbatim*", "lstlisting", "minted", "Verbatim",
        "equation", "equation*", "align", "align*", "gather", "gather*", "multline", "multline*",
        "cases", "matrix", "pmatrix", "bmatrix", "vmatrix", "array", "split", "aligned");

    /**
     * Classifies an environment name.
     *
     * @param name environment name as written, possibly starred
     * @param macros document macros, consulted for {@code \newtheorem} declarations
     * @return the kind
     */
    public static EnvironmentKind of(String name, MacroTable macros) {
        if (name == null || name.isBlank()) {
            return UNKNOWN;
        }
        if (PASS_THROUGH_NAMES.contains(name)) {
            return PASS_THROUGH;
        }
        String base = name.endsWith("*") ? name.substring(0, name.length() - 1) : name;
        if (macros.theoremLabel(base).isPresent()) {
            return THEOREM_LIKE;
        }
        String lower = base.toLowerCase(Locale.ROOT);
        if (THEOREM_NAMES.contains(lower)) {
            return THEOREM_LIKE;
        }
        return switch (lower) {
            case "proof" -> PROOF;
            case "abstract" -> ABSTRACT;
            case "quote", "quotation" -> QUOTE;
            case "center" -> CENTER;
            case "flushleft" -> FLUSH_LEFT;
            case "flushright" -> FLUSH_RIGHT;
            case "figure" -> FIGURE;
            case "algorithm" -> ALGORITHM_FLOAT;
            case "minipage" -> MINIPAGE;
            default -> UNKNOWN;
        };
    }
}
