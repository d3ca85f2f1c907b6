package com.williamcallahan.latexpreview.service.latex;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class VerbatimExtractorTest {

    private final VerbatimExtractor extractor = new VerbatimExtractor(100);

    @Test
    void verbatimBodyIsEscapedAndNeverInterpreted() {
        PlaceholderRegistry registry = new PlaceholderRegistry();

        String text = extractor.extract("\\begin{verbatim}\n$x$ & {y}\n\\end{verbatim}", registry);

        assertEquals("<pre class=\"latex-verbatim\"><code>$x$ &amp; {y}</code></pre>", registry.resolve(text, 4).strip());
    }

    @Test
    void listingLanguageBecomesCodeClass() {
        PlaceholderRegistry registry = new PlaceholderRegistry();

        String listing = extractor.extract("\\begin{lstlisting}[language=Java]\nint x;\n\\end{lstlisting}", registry);
        String minted = extractor.extract("\\begin{minted}{python}\nprint(1)\n\\end{minted}", registry);

        assertEquals("<pre class=\"latex-verbatim\"><code class=\"language-java\">int x;</code></pre>",
            registry.resolve(listing, 4).strip());
        assertEquals("<pre class=\"latex-verbatim\"><code class=\"language-python\">print(1)</code></pre>",
            registry.resolve(minted, 4).strip());
    }

    @Test
    void inlineVerbBecomesInlineToken() {
        PlaceholderRegistry registry = new PlaceholderRegistry();

        String text = extractor.extract("Use \\verb|a<b| now", registry);

        assertEquals("Use LATEXPREVIEWBLOCK_0_ now", text);
        assertEquals("<code class=\"latex-verb\">a&lt;b</code>", registry.lookup("LATEXPREVIEWBLOCK_0_").orElseThrow());
    }
}
