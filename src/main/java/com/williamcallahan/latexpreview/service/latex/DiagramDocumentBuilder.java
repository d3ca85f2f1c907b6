package com.williamcallahan.latexpreview.service.latex;

import com.williamcallahan.latexpreview.support.HtmlEscaper;

/**
 * Wraps a diagram into a self-contained TikZJax page embedded through a sandboxed frame.
 *
 * <p>The page carries its own loading notice and grows the hosting frame to the rendered SVG height.
 * The whole page is entity-encoded into {@code srcdoc} so nothing inside it reaches the host document.</p>
 */
final class DiagramDocumentBuilder {

    static final String TIKZ_LIBRARIES = "\\usetikzlibrary{arrows,shapes,calc,positioning,decorations.pathreplacing}";

    private static final String PAGE_HEAD = """
        <!DOCTYPE html>
        <html>
        <head>
          <link rel="stylesheet" href="https://tikzjax.com/v1/fonts.css">
          <script src="https://tikzjax.com/v1/tikzjax.js"></script>
          <style>
            body { margin: 0; padding: 0; display: flex; flex-direction: column; align-items: center; overflow: hidden; width: 100%; }
            svg { width: auto !important; height: auto !important; max-width: 100% !important; display: block; margin: 0 auto; }
            .tikzjax-container { width: 100%; display: flex; justify-content: center; }
            .tikz-loading { width: 100%; display: flex; align-items: center; justify-content: center; padding: 40px 20px; box-sizing: border-box; color: #666; font-family: -apple-system, BlinkMacSystemFont, 'Segoe UI', Roboto, sans-serif; font-size: 14px; white-space: nowrap; }
            .tikz-loading.hidden { display: none; }
          </style>
        </head>
        <body>
          <div id="tikz-loading" class="tikz-loading"><div>[ Generating diagram... ]</div></div>
          <div class="tikzjax-container">
            <script type="text/tikz">
        """;

    private static final String PAGE_TAIL = """
            </script>
          </div>
          <script>
            const observer = new MutationObserver(() => {
              const svg = document.querySelector('svg');
              if (svg && window.frameElement) {
                const loading = document.getElementById('tikz-loading');
                if (loading) loading.classList.add('hidden');
                const rect = svg.getBoundingClientRect();
                window.frameElement.style.height = Math.max(rect.height + 25, 100) + 'px';
              }
            });
            observer.observe(document.body, { childList: true, subtree: true });
          </script>
        </body>
        </html>
        """;

    private DiagramDocumentBuilder() {
    }

    /**
     * Builds the standalone page for one picture.
     *
     * @param options final picture options without brackets
     * @param body sanitized picture body
     * @return complete HTML page
     */
    static String page(String options, String body) {
        return PAGE_HEAD
            + TIKZ_LIBRARIES + "\n"
            + "\\begin{tikzpicture}[" + options + "]\n"
            + body + "\n"
            + "\\end{tikzpicture}\n"
            + PAGE_TAIL;
    }

    /**
     * Embeds a page as a sandboxed frame.
     */
    static String frame(String page) {
        return "<div class=\"latex-diagram\" style=\"display: flex; justify-content: center; width: 100%; margin: 1em 0;\">"
            + "<iframe class=\"latex-diagram-frame\" sandbox=\"allow-scripts\" srcdoc=\"" + HtmlEscaper.encodeSrcdoc(page)
            + "\" style=\"border: none; width: 100%; overflow: hidden;\"></iframe></div>";
    }

    static String unsupportedNotice(String reason) {
        return "<div class=\"latex-placeholder-box warning\">⚠️ " + HtmlEscaper.escape(reason) + "</div>";
    }
}
