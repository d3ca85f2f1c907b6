package com.williamcallahan.latexpreview.service.latex;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies macro harvesting from the preamble and definition stripping.
 */
class MacroExtractorTest {

    private final MacroExtractor extractor = new MacroExtractor();

    @Test
    void harvestsCommandDefinitionsInAllSpellings() {
        String preamble = """
            \\newcommand{\\R}{\\mathbb{R}}
            \\renewcommand\\vec[1]{\\mathbf{#1}}
            \\def\\eps{\\varepsilon}
            \\DeclareMathOperator{\\Tr}{Tr}
            \\begin{document}
            \\newcommand{\\ignored}{body}
            \\end{document}
            """;

        MacroTable table = extractor.extractMacros(preamble);

        assertThat(table.macros())
            .containsEntry("\\R", "\\mathbb{R}")
            .containsEntry("\\vec", "\\mathbf{#1}")
            .containsEntry("\\eps", "\\varepsilon")
            .containsEntry("\\Tr", "\\operatorname{Tr}")
            .doesNotContainKey("\\ignored");
    }

    @Test
    void lastDefinitionOfANameWins() {
        MacroTable table = extractor.extractMacros("\\newcommand{\\x}{1}\\renewcommand{\\x}{2}");

        assertThat(table.macros()).containsOnly(Map.entry("\\x", "2"));
    }

    @Test
    void recordsTheoremDeclarations() {
        MacroTable table = extractor.extractMacros("\\newtheorem{thm}{Theorem}[section]\\newtheorem{lem}[thm]{Lemma}");

        assertThat(table.theoremLabel("thm")).contains("Theorem");
        assertThat(table.theoremLabel("lem")).contains("Lemma");
        assertThat(table.size()).isZero();
    }

    @Test
    void defaultsSitUnderneathDocumentMacros() {
        MacroTable table = extractor.extractMacros("\\newcommand{\\label}{X}");

        assertThat(table.withDefaults())
            .containsEntry("\\label", "X")
            .containsKey("\\eqref");
    }

    @Test
    void stripDefinitionsRemovesOnlyDefinitions() {
        String stripped = extractor.stripDefinitions("a\\newcommand{\\R}{\\mathbb{R}}b\\def\\x{y}c");

        assertThat(stripped).isEqualTo("abc");
    }

    @Test
    void malformedDefinitionIsIgnored() {
        assertThat(extractor.extractMacros("\\newcommand{\\broken}{unterminated").macros()).isEmpty();
    }
}
