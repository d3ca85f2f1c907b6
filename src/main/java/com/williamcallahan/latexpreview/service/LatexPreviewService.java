package com.williamcallahan.latexpreview.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.williamcallahan.latexpreview.config.PreviewProperties;
import com.williamcallahan.latexpreview.domain.latex.DocumentMetadata;
import com.williamcallahan.latexpreview.domain.latex.LatexCacheStatsSnapshot;
import com.williamcallahan.latexpreview.domain.latex.RenderedDocument;
import com.williamcallahan.latexpreview.service.latex.LatexPreviewProcessor;
import com.williamcallahan.latexpreview.service.latex.PlaceholderRegistry;
import com.williamcallahan.latexpreview.support.HtmlEscaper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;

/**
 * Caching front door to the LaTeX conversion pipeline.
 *
 * <p>Input longer than the configured limit is truncated before conversion. A conversion failure never
 * reaches the caller: the escaped source is returned in a {@code <pre>} instead.</p>
 */
@Service
public class LatexPreviewService {

    private static final Logger logger = LoggerFactory.getLogger(LatexPreviewService.class);

    private final LatexPreviewProcessor processor;
    private final int maxInputLength;
    private final int maxResolvePasses;
    private final Cache<String, RenderedDocument> renderCache;

    public LatexPreviewService(LatexPreviewProcessor processor, PreviewProperties properties) {
        this.processor = processor;
        this.maxInputLength = properties.getLimits().getMaxInputLength();
        this.maxResolvePasses = properties.getLimits().getMaxResolvePasses();
        this.renderCache = Caffeine.newBuilder()
            .maximumSize(properties.getCache().getSize())
            .expireAfterWrite(properties.getCache().getTtl())
            .recordStats()
            .build();
        logger.info("LatexPreviewService initialized (cache size {}, ttl {})",
            properties.getCache().getSize(), properties.getCache().getTtl());
    }

    /**
     * Converts a document, consulting the render cache first.
     *
     * @param source LaTeX input
     * @return structured result with placeholder tokens still in place
     */
    public RenderedDocument render(String source) {
        if (source == null || source.isBlank()) {
            return RenderedDocument.empty();
        }
        boolean truncated = false;
        String input = source;
        if (input.length() > maxInputLength) {
            logger.warn("LaTeX input exceeds maximum length: {} > {}", input.length(), maxInputLength);
            input = input.substring(0, maxInputLength);
            truncated = true;
        }

        RenderedDocument cached = renderCache.getIfPresent(input);
        if (cached != null) {
            logger.debug("Cache hit for LaTeX render");
            return truncated ? cached.asTruncated() : cached;
        }

        long startTime = System.currentTimeMillis();
        RenderedDocument document;
        try {
            document = processor.process(input);
        } catch (RuntimeException processingFailure) {
            logger.error("LaTeX conversion failed; falling back to escaped source", processingFailure);
            String fallback = "<pre class=\"latex-fallback\">" + HtmlEscaper.escape(input) + "</pre>";
            return new RenderedDocument(fallback, Map.of(), "", false, DocumentMetadata.none(),
                System.currentTimeMillis() - startTime, truncated);
        }
        renderCache.put(input, document);
        return truncated ? document.asTruncated() : document;
    }

    /**
     * Converts a document and produces display-ready HTML: every token substituted, the bibliography
     * appended, diagram frames lazy-loaded and external links hardened.
     *
     * @param source LaTeX input
     * @return resolved HTML
     */
    public String renderResolved(String source) {
        return resolve(render(source));
    }

    /**
     * Substitutes the tokens of an already converted document.
     *
     * @param document conversion result
     * @return resolved HTML
     */
    public String resolve(RenderedDocument document) {
        String html = substitute(document.html(), document.blocks());
        if (document.hasBibliography() && !document.bibliographyHtml().isEmpty()) {
            html = html + "\n" + substitute(document.bibliographyHtml(), document.blocks());
        }
        return postProcessHtml(html);
    }

    private String substitute(String html, Map<String, String> blocks) {
        return PlaceholderRegistry.resolve(html, blocks, maxResolvePasses);
    }

    private String postProcessHtml(String html) {
        if (html.isEmpty()) {
            return "";
        }
        try {
            Document doc = Jsoup.parseBodyFragment(html);
            doc.outputSettings().prettyPrint(false);
            for (Element frame : doc.select("iframe.latex-diagram-frame")) {
                frame.attr("loading", "lazy");
            }
            for (Element link : doc.select("a[href]")) {
                String href = link.attr("href").toLowerCase(Locale.ROOT);
                if (href.startsWith("http://") || href.startsWith("https://")) {
                    link.attr("target", "_blank");
                    link.attr("rel", "noopener noreferrer");
                }
            }
            return doc.body().html().trim();
        } catch (RuntimeException postProcessFailure) {
            logger.warn("postProcessHtml failed; returning unprocessed HTML: {}", postProcessFailure.getMessage());
            return html.trim();
        }
    }

    /**
     * Gets render cache statistics for monitoring.
     *
     * @return cache statistics snapshot
     */
    public LatexCacheStatsSnapshot cacheStats() {
        CacheStats stats = renderCache.stats();
        return new LatexCacheStatsSnapshot(
            stats.hitCount(),
            stats.missCount(),
            stats.evictionCount(),
            renderCache.estimatedSize(),
            String.format(Locale.ROOT, "%.2f%%", stats.hitRate() * 100));
    }

    /**
     * Clears the render cache.
     *
     * @return number of entries present before clearing
     */
    public long clearCache() {
        long size = renderCache.estimatedSize();
        renderCache.invalidateAll();
        logger.info("LaTeX render cache cleared ({} entries)", size);
        return size;
    }
}
