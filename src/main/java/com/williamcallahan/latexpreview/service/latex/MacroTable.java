package com.williamcallahan.latexpreview.service.latex;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Single-level macro definitions harvested from a document, plus labels of theorem-like environments
 * declared with {@code \newtheorem}.
 *
 * @param macros macro name (with leading backslash) to expansion text
 * @param theoremLabels environment name to display label
 */
public record MacroTable(Map<String, String> macros, Map<String, String> theoremLabels) {

    /** Macros every document gets underneath its own definitions. */
    public static final Map<String, String> DEFAULT_MACROS = Map.of(
        "\\eqref", "\\href{#1}{#1}",
        "\\label", "");

    public MacroTable {
        macros = Map.copyOf(Objects.requireNonNull(macros, "Macros cannot be null"));
        theoremLabels = Map.copyOf(Objects.requireNonNull(theoremLabels, "Theorem labels cannot be null"));
    }

    public static MacroTable empty() {
        return new MacroTable(Map.of(), Map.of());
    }

    /**
     * Returns the macros to hand to the math backend: defaults first, document definitions on top.
     *
     * @return ordered macro map
     */
    public Map<String, String> withDefaults() {
        Map<String, String> merged = new LinkedHashMap<>(DEFAULT_MACROS);
        merged.putAll(macros);
        return merged;
    }

    public Optional<String> theoremLabel(String environment) {
        return Optional.ofNullable(theoremLabels.get(environment));
    }

    public int size() {
        return macros.size();
    }
}
