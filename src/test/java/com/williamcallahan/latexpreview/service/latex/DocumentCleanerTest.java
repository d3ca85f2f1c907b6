package com.williamcallahan.latexpreview.service.latex;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DocumentCleanerTest {

    private final DocumentCleaner cleaner = new DocumentCleaner(new MacroExtractor());

    @Test
    void keepsOnlyTheDocumentBody() {
        assertEquals("\nHi\n", DocumentCleaner.stripOutsideBody(
            "\\documentclass{article}\n\\begin{document}\nHi\n\\end{document}\ntrailer"));
    }

    @Test
    void stripsPreambleCommandsWithoutBodyMarker() {
        assertEquals("Text", DocumentCleaner.stripOutsideBody("\\documentclass[11pt]{article}\\usepackage{amsmath}Text"));
    }

    @Test
    void removesCommentsNoOpsAndStrayMarkers() {
        String cleaned = cleaner.clean(
            "% full line\nA\\vspace{2em} B\\label{x} \\maketitle C\n\\item stray\n\\begin{foo}");

        assertEquals("A B C\n• stray\n", cleaned);
    }

    @Test
    void commandWithoutArgumentIsLeftAlone() {
        assertEquals("\\label no arg", DocumentCleaner.stripCommand("\\label no arg", "\\label"));
        assertEquals("\\labelled{x}", DocumentCleaner.stripCommand("\\labelled{x}", "\\label"));
    }
}
