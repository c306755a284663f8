package com.shlawgathon.featuretracker.backend.service;

import com.shlawgathon.featuretracker.backend.dto.TaggingReport;
import com.shlawgathon.featuretracker.backend.exception.ProductDataCorruptedException;
import com.shlawgathon.featuretracker.backend.exception.ResourceNotFoundException;
import com.shlawgathon.featuretracker.backend.model.Feature;
import com.shlawgathon.featuretracker.backend.model.ProductDataset;
import com.shlawgathon.featuretracker.backend.oracle.ClassificationOracle;
import com.shlawgathon.featuretracker.backend.oracle.OracleResult;
import com.shlawgathon.featuretracker.backend.repository.ProductDatasetRepository;
import com.shlawgathon.featuretracker.backend.taxonomy.TagResolution;
import com.shlawgathon.featuretracker.backend.taxonomy.TagResolver;
import com.shlawgathon.featuretracker.backend.taxonomy.TaxonomyIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies pending features through the {@link ClassificationOracle}.
 * <p>
 * Every classified feature is persisted before the next oracle call (taxonomy first when it grew), so an
 * interrupted batch resumes with exactly the features that are still {@code UNTAGGED}. Callers hold the
 * {@link WorkspaceLock}.
 */
@Service
public class FeatureTaggingService {

    private static final Logger log = LoggerFactory.getLogger(FeatureTaggingService.class);

    /**
     * Result of classifying a single feature.
     */
    public enum FeatureOutcome {
        TAGGED,
        NOT_APPLICABLE,
        FAILED
    }

    private final ProductDatasetRepository productDatasetRepository;
    private final TaxonomyService taxonomyService;
    private final ClassificationOracle oracle;

    public FeatureTaggingService(ProductDatasetRepository productDatasetRepository,
            TaxonomyService taxonomyService,
            ClassificationOracle oracle) {
        this.productDatasetRepository = productDatasetRepository;
        this.taxonomyService = taxonomyService;
        this.oracle = oracle;
    }

    /**
     * Tags up to {@code limit} pending features of one product ({@code limit <= 0} means all of them).
     *
     * @throws ResourceNotFoundException     if the product has no stored dataset
     * @throws ProductDataCorruptedException if the stored dataset has no feature array
     */
    public TaggingReport tagPending(String productName, int limit) {
        ProductDataset dataset = productDatasetRepository.findById(productName)
                .orElseThrow(() -> new ResourceNotFoundException("Product not found: " + productName));
        if (dataset.getFeatures() == null) {
            throw new ProductDataCorruptedException(productName, "features array is missing");
        }

        TaxonomyIndex index = taxonomyService.openIndex();
        TagResolver resolver = taxonomyService.newResolver(index);
        TaggingReport report = TaggingReport.builder().productName(productName).build();

        List<Feature> pending = dataset.getFeatures().stream().filter(Feature::isPending).toList();
        int batchSize = limit > 0 ? Math.min(limit, pending.size()) : pending.size();
        log.info("[TAGGING] {}: {} pending, processing {}", productName, pending.size(), batchSize);

        for (int i = 0; i < batchSize; i++) {
            Feature feature = pending.get(i);
            int createdBefore = report.getNewSubtags().size();
            FeatureOutcome outcome = tagFeature(feature, resolver, report.getNewSubtags());
            report.setProcessed(report.getProcessed() + 1);

            switch (outcome) {
                case TAGGED -> report.setClassified(report.getClassified() + 1);
                case NOT_APPLICABLE -> report.setSkipped(report.getSkipped() + 1);
                case FAILED -> {
                    report.setPending(report.getPending() + 1);
                    continue;
                }
            }

            if (report.getNewSubtags().size() > createdBefore) {
                taxonomyService.save(index);
            }
            productDatasetRepository.save(dataset);
        }

        log.info("[TAGGING] {}: processed={}, classified={}, skipped={}, pending={}, newSubtags={}",
                productName, report.getProcessed(), report.getClassified(), report.getSkipped(),
                report.getPending(), report.getNewSubtags().size());
        return report;
    }

    /**
     * Runs {@link #tagPending} for every stored product. A product that fails is reported and the run goes on.
     */
    public List<TaggingReport> tagAll(int limit) {
        List<TaggingReport> reports = new ArrayList<>();
        for (ProductDataset dataset : productDatasetRepository.findAllByOrderByNameAsc()) {
            try {
                reports.add(tagPending(dataset.getName(), limit));
            } catch (ProductDataCorruptedException e) {
                log.error("[TAGGING] Skipping {}: {}", dataset.getName(), e.getMessage());
                reports.add(failedReport(dataset.getName(), e.getMessage()));
            } catch (RuntimeException e) {
                log.error("[TAGGING] Tagging {} failed: {}", dataset.getName(), e.getMessage(), e);
                reports.add(failedReport(dataset.getName(), e.getMessage()));
            }
        }
        return reports;
    }

    private static TaggingReport failedReport(String productName, String error) {
        return TaggingReport.builder()
                .productName(productName)
                .error(error)
                .build();
    }

    /**
     * Classifies one feature in place. The caller persists the feature and, when {@code createdSubtags} grew,
     * the taxonomy.
     */
    public FeatureOutcome tagFeature(Feature feature, TagResolver resolver, List<String> createdSubtags) {
        OracleResult result = oracle.classify(feature.getTitle(), feature.getDescription(),
                resolver.getIndex().getTaxonomy());

        switch (result.outcome()) {
            case FAILED -> {
                log.warn("[TAGGING] Oracle failed for '{}', leaving it pending: {}",
                        feature.getTitle(), result.failureReason());
                return FeatureOutcome.FAILED;
            }
            case NOT_CLASSIFIABLE -> {
                feature.markNotApplicable();
                log.debug("[TAGGING] '{}' -> not applicable", feature.getTitle());
                return FeatureOutcome.NOT_APPLICABLE;
            }
            default -> {
                TagResolution resolution = resolver.resolve(result.proposedNames(), result.primaryHint());
                createdSubtags.addAll(resolution.newlyCreated());
                if (!resolution.droppedAsInvalid().isEmpty()) {
                    log.info("[TAGGING] Dropped invalid proposals for '{}': {}",
                            feature.getTitle(), resolution.droppedAsInvalid());
                }
                if (resolution.isEmpty()) {
                    feature.markNotApplicable();
                    return FeatureOutcome.NOT_APPLICABLE;
                }
                feature.markTagged(resolution.assignments());
                log.debug("[TAGGING] '{}' -> {}", feature.getTitle(), resolution.assignments());
                return FeatureOutcome.TAGGED;
            }
        }
    }
}
