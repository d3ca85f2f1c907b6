package com.williamcallahan.latexpreview.service.latex;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.latexpreview.config.PipelineLimits;
import com.williamcallahan.latexpreview.config.PreviewProperties;
import com.williamcallahan.latexpreview.domain.latex.DocumentMetadata;
import com.williamcallahan.latexpreview.domain.latex.RenderedDocument;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Runs the conversion stages over one document in their fixed order.
 *
 * <p>Order: heal, read macros and title block, drop the preamble, verbatim, citations, diagrams, math,
 * tables, lists, algorithms, named environments, cleanup, headings, paragraphs. Every extraction stage
 * replaces what it claims with a placeholder token, so later stages never see it. All per-document state
 * lives in a {@link PlaceholderRegistry} and a {@link MacroTable} created for the call.</p>
 */
@Component
public class LatexPreviewProcessor {

    private static final Logger logger = LoggerFactory.getLogger(LatexPreviewProcessor.class);

    private final LatexHealer healer;
    private final MacroExtractor macroExtractor;
    private final MetadataExtractor metadataExtractor;
    private final VerbatimExtractor verbatimExtractor;
    private final CitationEngine citationEngine;
    private final TikzEngine tikzEngine;
    private final MathEngine mathEngine;
    private final TableEngine tableEngine;
    private final ListProcessor listProcessor;
    private final AlgorithmFormatter algorithmFormatter;
    private final EnvironmentNormalizer environmentNormalizer;
    private final DocumentCleaner documentCleaner;
    private final SectionHeadings sectionHeadings;
    private final ParagraphSegmenter paragraphSegmenter;
    private final int maxResolvePasses;

    public LatexPreviewProcessor(PreviewProperties properties, Clock clock, ObjectMapper objectMapper) {
        PipelineLimits limits = properties.getLimits();
        int maxIterations = limits.getMaxExtractionIterations();
        this.healer = new LatexHealer();
        this.macroExtractor = new MacroExtractor();
        this.metadataExtractor = new MetadataExtractor(clock);
        this.verbatimExtractor = new VerbatimExtractor(maxIterations);
        this.citationEngine = new CitationEngine();
        this.tikzEngine = new TikzEngine(properties.getDiagram(), limits);
        this.mathEngine = new MathEngine(
            new KatexMarkupMathRenderer(objectMapper, properties.getMath().isThrowOnError()),
            new MathAutoscaler(properties.getMath()),
            limits);
        this.tableEngine = new TableEngine(limits);
        this.listProcessor = new ListProcessor(limits.getMaxListDepth());
        this.algorithmFormatter = new AlgorithmFormatter(maxIterations);
        this.environmentNormalizer = new EnvironmentNormalizer(maxIterations);
        this.documentCleaner = new DocumentCleaner(macroExtractor);
        this.sectionHeadings = new SectionHeadings();
        this.paragraphSegmenter = new ParagraphSegmenter();
        this.maxResolvePasses = limits.getMaxResolvePasses();
        logger.info("LaTeX preview processor initialized (extraction cap {}, list depth {})",
            maxIterations, limits.getMaxListDepth());
    }

    /**
     * Converts one document.
     *
     * @param source LaTeX-like text, possibly malformed or truncated
     * @return tokenized HTML with its fragments, bibliography and metadata
     * @throws LatexProcessingException when a stage fails unexpectedly
     */
    public RenderedDocument process(String source) {
        if (source == null || source.isBlank()) {
            return RenderedDocument.empty();
        }
        long startTime = System.currentTimeMillis();
        try {
            return new DocumentRun(source, startTime).run();
        } catch (LatexProcessingException processingFailure) {
            throw processingFailure;
        } catch (RuntimeException stageFailure) {
            throw new LatexProcessingException("LaTeX conversion failed", stageFailure);
        }
    }

    /**
     * State for converting a single document.
     */
    private final class DocumentRun {

        private final String source;
        private final long startTime;
        private final PlaceholderRegistry registry = new PlaceholderRegistry();
        private MacroTable macros = MacroTable.empty();
        private LatexInlineFormatter inline = new LatexInlineFormatter();
        private EnvironmentContext environments;

        private DocumentRun(String source, long startTime) {
            this.source = source;
            this.startTime = startTime;
        }

        RenderedDocument run() {
            String text = registry.protectLiterals(healer.heal(source));
            macros = macroExtractor.extractMacros(text);
            TitleBlock titleBlock = metadataExtractor.extract(text);
            MacroTable documentMacros = macros;
            inline = new LatexInlineFormatter(math -> mathEngine.renderExpression(math, false, documentMacros));
            environments = new EnvironmentContext(macros, registry, this::formatBody, inline::format,
                new FloatNumbering());

            text = DocumentCleaner.stripOutsideBody(text);
            text = verbatimExtractor.extract(text, registry);
            CitationResult citations = citationEngine.processCitations(text, inline::format);
            text = citations.text();
            text = tikzEngine.processDiagrams(text, registry).text();
            text = mathEngine.processMath(text, macros, registry).text();
            text = tableEngine.processTables(text, inline::format, registry).text();
            text = listProcessor.process(text, registry, this::formatItem);
            text = algorithmFormatter.format(text, registry, inline::format);
            text = environmentNormalizer.normalize(text, environments);
            text = documentCleaner.clean(text);
            text = sectionHeadings.apply(text, registry, inline::format);
            String html = paragraphSegmenter.segment(text, registry, inline::format);

            Optional<String> header = header(titleBlock);
            if (header.isPresent()) {
                html = header.get() + "\n" + html;
            }
            long processingTime = System.currentTimeMillis() - startTime;
            logger.debug("Converted LaTeX document of {} chars in {}ms: {} fragments, bibliography={}",
                source.length(), processingTime, registry.size(), citations.hasBibliography());
            return new RenderedDocument(html, registry.entries(), citations.bibliographyHtml(),
                citations.hasBibliography(), metadata(titleBlock), processingTime, false);
        }

        private String formatItem(String content) {
            return inline.format(environmentNormalizer.normalize(content, environments)).strip();
        }

        private String formatBody(String body) {
            String text = listProcessor.process(body, registry, this::formatItem);
            text = algorithmFormatter.format(text, registry, inline::format);
            text = environmentNormalizer.normalize(text, environments);
            return paragraphSegmenter.segment(text, registry, inline::format);
        }

        private Optional<String> header(TitleBlock titleBlock) {
            if (titleBlock.isEmpty()) {
                return Optional.empty();
            }
            StringBuilder html = new StringBuilder("<header class=\"latex-title-block\">");
            titleBlock.title().ifPresent(title ->
                html.append("<h1 class=\"title\">").append(inline.format(title)).append("</h1>"));
            titleBlock.author().ifPresent(author ->
                html.append("<div class=\"author\">").append(inline.format(author)).append("</div>"));
            titleBlock.date().ifPresent(date ->
                html.append("<div class=\"date\">").append(inline.format(date)).append("</div>"));
            return Optional.of(html.append("</header>").toString());
        }

        private DocumentMetadata metadata(TitleBlock titleBlock) {
            return new DocumentMetadata(
                titleBlock.title().map(this::plainText).orElse(""),
                titleBlock.author().map(this::plainText).orElse(""),
                titleBlock.date().map(this::plainText).orElse(""));
        }

        private String plainText(String latex) {
            String html = registry.resolve(new LatexInlineFormatter().format(latex), maxResolvePasses);
            return Jsoup.parseBodyFragment(html).text();
        }
    }
}
