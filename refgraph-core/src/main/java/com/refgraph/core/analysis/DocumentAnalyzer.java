package com.refgraph.core.analysis;

import com.refgraph.core.activity.ActivityClassifier;
import com.refgraph.core.activity.InactiveGroupBuilder;
import com.refgraph.core.model.ClassifiedOccurrence;
import com.refgraph.core.model.Diagnostic;
import com.refgraph.core.model.Document;
import com.refgraph.core.model.InactiveGroup;
import com.refgraph.core.reference.DefaultPatterns;
import com.refgraph.core.reference.ReferenceExtractor;
import com.refgraph.core.scanner.LexicalScanner;
import com.refgraph.core.scanner.RegionMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the per-document pipeline: scan, extract, classify, group.
 *
 * <p>Analysis is a pure function of the document text and the configured scanner and
 * patterns, so analyzers are safe to share between threads.
 */
public final class DocumentAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(DocumentAnalyzer.class);

    private final LexicalScanner scanner;
    private final ReferenceExtractor extractor;
    private final ActivityClassifier classifier = new ActivityClassifier();
    private final InactiveGroupBuilder groupBuilder = new InactiveGroupBuilder();

    public DocumentAnalyzer(LexicalScanner scanner, ReferenceExtractor extractor) {
        this.scanner = Objects.requireNonNull(scanner, "scanner must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
    }

    /**
     * Creates an analyzer with the markup scanner and the default pattern set.
     *
     * @return default analyzer
     */
    public static DocumentAnalyzer defaults() {
        return new DocumentAnalyzer(LexicalScanner.forMarkup(), new ReferenceExtractor(DefaultPatterns.defaults()));
    }

    public LexicalScanner scanner() {
        return scanner;
    }

    public ReferenceExtractor extractor() {
        return extractor;
    }

    /**
     * Analyzes one document.
     *
     * @param document document to analyze
     * @return analysis
     */
    public DocumentAnalysis analyze(Document document) {
        RegionMap regions = scanner.scan(document);
        ReferenceExtractor.Extraction extraction = extractor.extract(regions);
        List<ClassifiedOccurrence> occurrences = classifier.classifyAll(extraction.occurrences(), regions);
        List<InactiveGroup> groups = groupBuilder.build(regions, occurrences);

        List<Diagnostic> diagnostics = new ArrayList<>(regions.diagnostics());
        diagnostics.addAll(extraction.diagnostics());

        log.debug("Analyzed {}: {} regions, {} occurrences ({} active), {} inactive groups",
            document.key(),
            regions.regions().size(),
            occurrences.size(),
            occurrences.stream().filter(ClassifiedOccurrence::isActive).count(),
            groups.size());
        return new DocumentAnalysis(document, regions, occurrences, groups, diagnostics);
    }
}
