package com.williamcallahan.latexpreview.web;

import com.williamcallahan.latexpreview.domain.latex.LatexCacheClearOutcome;
import com.williamcallahan.latexpreview.domain.latex.LatexCacheClearResponse;
import com.williamcallahan.latexpreview.domain.latex.LatexCacheStatsResponse;
import com.williamcallahan.latexpreview.domain.latex.LatexErrorResponse;
import com.williamcallahan.latexpreview.domain.latex.LatexPreviewOutcome;
import com.williamcallahan.latexpreview.domain.latex.LatexPreviewResponse;
import com.williamcallahan.latexpreview.domain.latex.LatexRenderOutcome;
import com.williamcallahan.latexpreview.domain.latex.LatexRenderRequest;
import com.williamcallahan.latexpreview.domain.latex.LatexRenderResponse;
import com.williamcallahan.latexpreview.domain.latex.RenderedDocument;
import com.williamcallahan.latexpreview.service.LatexPreviewService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for LaTeX preview rendering.
 */
@RestController
@RequestMapping("/api/latex")
@CrossOrigin(origins = "*")
public class LatexPreviewController {

    private static final Logger logger = LoggerFactory.getLogger(LatexPreviewController.class);

    private final LatexPreviewService previewService;

    public LatexPreviewController(LatexPreviewService previewService) {
        this.previewService = previewService;
    }

    /**
     * Converts LaTeX and returns the structured result: tokenized HTML, the fragment for each token,
     * bibliography and title block metadata.
     *
     * @param request JSON body of the form {@code {"content": "..."}}
     * @return structured render outcome, or an error description with status 500
     */
    @PostMapping(value = "/render",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<LatexRenderResponse> render(@RequestBody(required = false) LatexRenderRequest request) {
        try {
            if (request == null || request.isBlank()) {
                return ResponseEntity.ok(LatexRenderOutcome.from(RenderedDocument.empty()));
            }
            logger.debug("Rendering LaTeX of length: {}", request.content().length());
            RenderedDocument document = previewService.render(request.content());
            return ResponseEntity.ok(LatexRenderOutcome.from(document));
        } catch (RuntimeException renderFailure) {
            logger.error("Error rendering LaTeX", renderFailure);
            return ResponseEntity.status(500).body(new LatexErrorResponse("Failed to render LaTeX", renderFailure.getMessage()));
        }
    }

    /**
     * Converts LaTeX and returns display-ready HTML with every placeholder substituted.
     *
     * @param request JSON body of the form {@code {"content": "..."}}
     * @return resolved preview, or an error description with status 500
     */
    @PostMapping(value = "/preview",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<LatexPreviewResponse> preview(@RequestBody(required = false) LatexRenderRequest request) {
        try {
            if (request == null || request.isBlank()) {
                return ResponseEntity.ok(new LatexPreviewOutcome("", RenderedDocument.empty().metadata()));
            }
            RenderedDocument document = previewService.render(request.content());
            return ResponseEntity.ok(new LatexPreviewOutcome(previewService.resolve(document), document.metadata()));
        } catch (RuntimeException previewFailure) {
            logger.error("Error rendering LaTeX preview", previewFailure);
            return ResponseEntity.status(500).body(new LatexErrorResponse("Failed to render preview", previewFailure.getMessage()));
        }
    }

    /**
     * Retrieves render cache statistics.
     *
     * @return hit, miss and eviction counts, size and hit rate
     */
    @GetMapping(value = "/cache/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<LatexCacheStatsResponse> cacheStats() {
        try {
            return ResponseEntity.ok(previewService.cacheStats());
        } catch (RuntimeException statsFailure) {
            logger.error("Error getting cache stats", statsFailure);
            return ResponseEntity.status(500).body(new LatexErrorResponse("Failed to get cache stats", statsFailure.getMessage()));
        }
    }

    /**
     * Clears the render cache.
     *
     * @return status message with the number of entries dropped
     */
    @PostMapping(value = "/cache/clear", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<LatexCacheClearResponse> clearCache() {
        try {
            long evicted = previewService.clearCache();
            logger.info("LaTeX render cache cleared via API");
            return ResponseEntity.ok(new LatexCacheClearOutcome("success", "Cache cleared successfully", evicted));
        } catch (RuntimeException clearFailure) {
            logger.error("Error clearing cache", clearFailure);
            return ResponseEntity.status(500).body(new LatexErrorResponse("Failed to clear cache", clearFailure.getMessage()));
        }
    }

    /**
     * Answers an unreadable request body with an empty render.
     *
     * @param unreadable the parse failure
     * @return empty render outcome
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<LatexRenderResponse> handleUnreadableBody(HttpMessageNotReadableException unreadable) {
        logger.debug("Unreadable LaTeX request body: {}", unreadable.getMessage());
        return ResponseEntity.ok(LatexRenderOutcome.from(RenderedDocument.empty()));
    }
}
