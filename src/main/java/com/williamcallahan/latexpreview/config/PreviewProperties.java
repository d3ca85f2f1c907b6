package com.williamcallahan.latexpreview.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Root of the {@code app.preview.*} configuration tree.
 */
@ConfigurationProperties(prefix = "app.preview")
public class PreviewProperties {

    private DiagramHeuristics diagram = new DiagramHeuristics();
    private MathAutoscale math = new MathAutoscale();
    private PipelineLimits limits = new PipelineLimits();
    private RenderCache cache = new RenderCache();

    /**
     * Validates every nested group; fails startup on the first invalid value.
     */
    @PostConstruct
    public void validateConfiguration() {
        diagram.validateConfiguration();
        math.validateConfiguration();
        limits.validateConfiguration();
        cache.validateConfiguration();
    }

    public DiagramHeuristics getDiagram() {
        return diagram;
    }

    public void setDiagram(DiagramHeuristics diagram) {
        this.diagram = diagram;
    }

    public MathAutoscale getMath() {
        return math;
    }

    public void setMath(MathAutoscale math) {
        this.math = math;
    }

    public PipelineLimits getLimits() {
        return limits;
    }

    public void setLimits(PipelineLimits limits) {
        this.limits = limits;
    }

    public RenderCache getCache() {
        return cache;
    }

    public void setCache(RenderCache cache) {
        this.cache = cache;
    }
}
