package com.williamcallahan.latexpreview.service.latex;

import com.williamcallahan.latexpreview.config.DiagramHeuristics;
import com.williamcallahan.latexpreview.config.PipelineLimits;
import com.williamcallahan.latexpreview.domain.latex.DiagramIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Extracts {@code tikzpicture} environments into sandboxed diagram frames.
 *
 * <p>Each picture is sanitized, its decorated braces are polyfilled, its layout intent is classified
 * and its options are synthesized before it is wrapped into a standalone TikZJax page. Plotting axes
 * ({@code \begin{axis}}, {@code \addplot}) are not supported in the browser and become a notice.</p>
 */
public class TikzEngine {

    private static final Logger logger = LoggerFactory.getLogger(TikzEngine.class);

    static final String ENVIRONMENT = "tikzpicture";
    static final String PGFPLOTS_NOTICE = "Complex diagram (pgfplots) - not supported in browser preview";
    static final String FAILURE_NOTICE = "Diagram could not be prepared for browser preview";

    private final DiagramIntentClassifier classifier;
    private final DiagramOptionSynthesizer synthesizer;
    private final int maxIterations;

    public TikzEngine(DiagramHeuristics heuristics, PipelineLimits limits) {
        Objects.requireNonNull(heuristics, "Diagram heuristics cannot be null");
        Objects.requireNonNull(limits, "Pipeline limits cannot be null");
        this.classifier = new DiagramIntentClassifier(heuristics);
        this.synthesizer = new DiagramOptionSynthesizer(heuristics);
        this.maxIterations = limits.getMaxExtractionIterations();
    }

    /**
     * Replaces every balanced picture with a block token.
     *
     * @param text document buffer
     * @param registry placeholder registry for this document
     * @return rewritten buffer and the diagram fragments registered
     */
    public ExtractionResult processDiagrams(String text, PlaceholderRegistry registry) {
        if (text == null || !text.contains(EnvironmentScanner.beginMarker(ENVIRONMENT))) {
            return new ExtractionResult(text == null ? "" : text, null);
        }
        int mark = registry.size();
        String rewritten = EnvironmentScanner.replaceAll(text, List.of(ENVIRONMENT), maxIterations,
            span -> registry.registerBlock(PlaceholderCategory.TIKZ, renderSafely(span.body(text))));
        return new ExtractionResult(rewritten, registry.entriesSince(mark));
    }

    private String renderSafely(String rawBody) {
        try {
            return render(rawBody);
        } catch (RuntimeException renderFailure) {
            logger.warn("Diagram rendering failed; emitting notice", renderFailure);
            return DiagramDocumentBuilder.unsupportedNotice(FAILURE_NOTICE);
        }
    }

    /**
     * Renders one picture given the text after its begin marker.
     */
    String render(String rawBody) {
        String options = "";
        String body = rawBody;
        int optionStart = LatexArguments.skipWhitespace(rawBody, 0);
        var optionGroup = LatexArguments.readBracketed(rawBody, optionStart);
        if (optionGroup.isPresent()) {
            options = optionGroup.get().content();
            body = rawBody.substring(optionGroup.get().end());
        }

        if (body.contains("\\begin{axis}") || body.contains("\\addplot")) {
            logger.debug("Diagram uses pgfplots; emitting unsupported notice");
            return DiagramDocumentBuilder.unsupportedNotice(PGFPLOTS_NOTICE);
        }

        String safe = BracePolyfill.apply(TikzSanitizer.sanitize(body));
        DiagramMetrics metrics = DiagramMetrics.measure(safe, options);
        DiagramIntent intent = classifier.classify(metrics);
        String finalOptions = synthesizer.synthesize(intent, metrics, options);
        logger.debug("Diagram intent {} (nodes={}, span={}x{}), options [{}]",
            intent, metrics.nodeCount(), metrics.horizontalSpan(), metrics.verticalSpan(), finalOptions);
        return DiagramDocumentBuilder.frame(DiagramDocumentBuilder.page(finalOptions, safe.strip()));
    }
}
