package com.shlawgathon.featuretracker.backend.service;

import com.shlawgathon.featuretracker.backend.config.TrackerProperties;
import com.shlawgathon.featuretracker.backend.crawler.ChangelogCrawler;
import com.shlawgathon.featuretracker.backend.crawler.CrawlException;
import com.shlawgathon.featuretracker.backend.crawler.ScrapedFeature;
import com.shlawgathon.featuretracker.backend.dto.MonitorResult;
import com.shlawgathon.featuretracker.backend.dto.TaggingReport;
import com.shlawgathon.featuretracker.backend.exception.ProductDataCorruptedException;
import com.shlawgathon.featuretracker.backend.exception.ResourceNotFoundException;
import com.shlawgathon.featuretracker.backend.merge.FeatureMergeEngine;
import com.shlawgathon.featuretracker.backend.merge.MergeResult;
import com.shlawgathon.featuretracker.backend.model.Feature;
import com.shlawgathon.featuretracker.backend.model.MonitorOutcome;
import com.shlawgathon.featuretracker.backend.model.ProductDataset;
import com.shlawgathon.featuretracker.backend.model.SyncStatus;
import com.shlawgathon.featuretracker.backend.model.UpdateLog;
import com.shlawgathon.featuretracker.backend.repository.ProductDatasetRepository;
import com.shlawgathon.featuretracker.backend.repository.SyncStatusRepository;
import com.shlawgathon.featuretracker.backend.repository.UpdateLogRepository;
import com.shlawgathon.featuretracker.backend.util.FeatureTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Crawl, merge and tag cycle over the configured products.
 * <p>
 * A crawl that fails or returns nothing leaves the stored dataset untouched. Callers hold the
 * {@link WorkspaceLock}.
 */
@Service
public class MonitorService {

    private static final Logger log = LoggerFactory.getLogger(MonitorService.class);

    private final TrackerProperties trackerProperties;
    private final List<ChangelogCrawler> crawlers;
    private final FeatureMergeEngine mergeEngine;
    private final ProductDatasetService productDatasetService;
    private final ProductDatasetRepository productDatasetRepository;
    private final FeatureTaggingService featureTaggingService;
    private final SyncStatusRepository syncStatusRepository;
    private final UpdateLogRepository updateLogRepository;

    public MonitorService(TrackerProperties trackerProperties,
            List<ChangelogCrawler> crawlers,
            FeatureMergeEngine mergeEngine,
            ProductDatasetService productDatasetService,
            ProductDatasetRepository productDatasetRepository,
            FeatureTaggingService featureTaggingService,
            SyncStatusRepository syncStatusRepository,
            UpdateLogRepository updateLogRepository) {
        this.trackerProperties = trackerProperties;
        this.crawlers = crawlers;
        this.mergeEngine = mergeEngine;
        this.productDatasetService = productDatasetService;
        this.productDatasetRepository = productDatasetRepository;
        this.featureTaggingService = featureTaggingService;
        this.syncStatusRepository = syncStatusRepository;
        this.updateLogRepository = updateLogRepository;
    }

    public TrackerProperties.Product requireProduct(String productName) {
        return trackerProperties.products().stream()
                .filter(p -> p.name().equals(productName))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Product is not tracked: " + productName));
    }

    public Optional<TrackerProperties.Product> selfProduct() {
        return trackerProperties.products().stream().filter(TrackerProperties.Product::self).findFirst();
    }

    /**
     * Monitors every configured product and writes an update log when any of them has new features.
     */
    public List<MonitorResult> monitorAll() {
        log.info("[MONITOR] Starting run over {} products", trackerProperties.products().size());
        List<MonitorResult> results = new ArrayList<>();
        for (TrackerProperties.Product product : trackerProperties.products()) {
            results.add(monitorProduct(product.name()));
        }
        recordUpdates(results);
        return results;
    }

    public MonitorResult monitorProduct(String productName) {
        TrackerProperties.Product product = requireProduct(productName);
        try {
            MonitorResult result = crawlAndMerge(product);
            recordSync(productName, result.getOutcome());
            return result;
        } catch (ProductDataCorruptedException e) {
            log.error("[MONITOR] {}: {}", productName, e.getMessage());
            return failed(productName, e);
        } catch (RuntimeException e) {
            log.error("[MONITOR] {}: run failed: {}", productName, e.getMessage(), e);
            return failed(productName, e);
        }
    }

    private MonitorResult failed(String productName, RuntimeException cause) {
        try {
            recordSync(productName, MonitorOutcome.FAILED);
        } catch (RuntimeException e) {
            log.error("[MONITOR] {}: could not record sync status: {}", productName, e.getMessage());
        }
        return failure(productName, MonitorOutcome.FAILED, cause.getMessage());
    }

    private MonitorResult crawlAndMerge(TrackerProperties.Product product) {
        String name = product.name();
        Optional<ChangelogCrawler> crawler = crawlers.stream().filter(c -> c.supports(name)).findFirst();
        if (crawler.isEmpty()) {
            log.warn("[MONITOR] {}: no crawler available", name);
            return failure(name, MonitorOutcome.NO_CRAWLER, "No crawler available");
        }

        List<ScrapedFeature> scraped;
        try {
            scraped = crawler.get().crawl(name);
        } catch (CrawlException e) {
            log.warn("[MONITOR] {}: crawl failed, keeping stored data: {}", name, e.getMessage());
            return failure(name, MonitorOutcome.CRAWLER_FAILED, e.getMessage());
        }

        List<Feature> fresh = new ArrayList<>();
        for (ScrapedFeature entry : scraped != null ? scraped : List.<ScrapedFeature>of()) {
            if (entry.isValid()) {
                fresh.add(entry.toFeature());
            }
        }
        if (fresh.isEmpty()) {
            log.warn("[MONITOR] {}: crawl returned no entries, keeping stored data", name);
            return failure(name, MonitorOutcome.EMPTY_RESULT, "Crawl returned no entries");
        }

        ProductDataset dataset = productDatasetService.findOrCreate(product);
        if (dataset.getFeatures() == null) {
            throw new ProductDataCorruptedException(name, "features array is missing");
        }

        MergeResult merge = mergeEngine.merge(FeatureMergeEngine.indexByKey(dataset.getFeatures()), fresh);
        dataset.setFeatures(merge.merged());
        productDatasetRepository.save(dataset);
        log.info("[MONITOR] {}: {} features, {} new", name, merge.merged().size(), merge.newKeys().size());

        TaggingReport tagging = null;
        if (merge.merged().stream().anyMatch(Feature::isPending)) {
            tagging = featureTaggingService.tagPending(name, 0);
        }

        return MonitorResult.builder()
                .productName(name)
                .outcome(MonitorOutcome.SUCCESS)
                .totalFeatures(merge.merged().size())
                .newCount(merge.newKeys().size())
                .newTitles(merge.newFeatures().stream().map(Feature::getTitle).toList())
                .tagging(tagging)
                .build();
    }

    private void recordSync(String productName, MonitorOutcome outcome) {
        SyncStatus status = syncStatusRepository.findById(productName)
                .orElseGet(() -> SyncStatus.builder().productName(productName).build());
        status.setLastSync(Instant.now());
        status.setLastOutcome(outcome);
        productDatasetRepository.findById(productName)
                .filter(dataset -> dataset.getFeatures() != null)
                .flatMap(dataset -> FeatureTime.latest(dataset.getFeatures().stream().map(Feature::getTime).toList()))
                .ifPresent(status::setLatestDate);
        syncStatusRepository.save(status);
    }

    private void recordUpdates(List<MonitorResult> results) {
        Map<String, MonitorResult> updates = new LinkedHashMap<>();
        int totalNew = 0;
        for (MonitorResult result : results) {
            if (result.getNewCount() > 0) {
                updates.put(result.getProductName(), result);
                totalNew += result.getNewCount();
            }
        }
        if (totalNew == 0) {
            log.info("[MONITOR] Run finished, nothing new");
            return;
        }
        updateLogRepository.save(UpdateLog.builder()
                .timestamp(Instant.now())
                .totalNew(totalNew)
                .updates(updates)
                .build());
        log.info("[MONITOR] Run finished, {} new features in {} products", totalNew, updates.size());
    }

    public List<SyncStatus> syncStatuses() {
        return syncStatusRepository.findAll();
    }

    public List<UpdateLog> recentUpdates() {
        return updateLogRepository.findTop20ByOrderByTimestampDesc();
    }

    private static MonitorResult failure(String productName, MonitorOutcome outcome, String message) {
        return MonitorResult.builder()
                .productName(productName)
                .outcome(outcome)
                .message(message)
                .build();
    }
}
