package com.williamcallahan.latexpreview.config;

import com.williamcallahan.latexpreview.domain.latex.LatexCacheStatsSnapshot;
import com.williamcallahan.latexpreview.domain.latex.RenderedDocument;
import com.williamcallahan.latexpreview.service.LatexPreviewService;
import com.williamcallahan.latexpreview.service.latex.LatexPreviewProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Spring Actuator health indicator for the conversion pipeline.
 *
 * <p>Converts a small sample document on every check, bypassing the render cache, and reports the cache
 * statistics alongside.
 */
@Component
public class LatexPipelineHealthIndicator implements HealthIndicator {

    private static final Logger logger = LoggerFactory.getLogger(LatexPipelineHealthIndicator.class);

    /** Sample touching the math, list and environment stages. */
    static final String SAMPLE_DOCUMENT =
        "\\section{Health}\n\\begin{itemize}\\item $x^2$\\end{itemize}\n\\begin{theorem}Holds.\\end{theorem}";

    /** Health detail key for human-readable status message. */
    private static final String DETAIL_KEY_STATUS = "status";
    /** Health detail key for the sample conversion time. */
    private static final String DETAIL_KEY_SAMPLE_MS = "sampleMs";
    private static final String DETAIL_KEY_CACHE_SIZE = "cacheSize";
    private static final String DETAIL_KEY_HIT_RATE = "cacheHitRate";

    private final LatexPreviewProcessor processor;
    private final LatexPreviewService previewService;

    public LatexPipelineHealthIndicator(LatexPreviewProcessor processor, LatexPreviewService previewService) {
        this.processor = processor;
        this.previewService = previewService;
    }

    /**
     * Runs the sample conversion.
     *
     * @return UP when the sample converts into fragments, DOWN when a stage fails
     */
    @Override
    public Health health() {
        LatexCacheStatsSnapshot stats = previewService.cacheStats();
        Health.Builder builder;
        try {
            RenderedDocument sample = processor.process(SAMPLE_DOCUMENT);
            builder = sample.blocks().isEmpty()
                ? Health.down().withDetail(DETAIL_KEY_STATUS, "Sample produced no fragments")
                : Health.up().withDetail(DETAIL_KEY_STATUS, "Pipeline converting");
            builder.withDetail(DETAIL_KEY_SAMPLE_MS, sample.processingTimeMs());
        } catch (RuntimeException sampleFailure) {
            logger.warn("Pipeline health sample conversion failed", sampleFailure);
            builder = Health.down().withDetail(DETAIL_KEY_STATUS, "Sample conversion failed: " + sampleFailure.getMessage());
        }
        return builder
            .withDetail(DETAIL_KEY_CACHE_SIZE, stats.size())
            .withDetail(DETAIL_KEY_HIT_RATE, stats.hitRate())
            .build();
    }
}
