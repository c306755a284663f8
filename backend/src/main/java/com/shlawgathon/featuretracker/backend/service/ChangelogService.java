package com.shlawgathon.featuretracker.backend.service;

import com.shlawgathon.featuretracker.backend.config.TrackerProperties;
import com.shlawgathon.featuretracker.backend.dto.RunResponse;
import com.shlawgathon.featuretracker.backend.exception.ResourceNotFoundException;
import com.shlawgathon.featuretracker.backend.model.RawChangelog;
import com.shlawgathon.featuretracker.backend.repository.RawChangelogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Hand-maintained markdown changelog of the self product.
 */
@Service
public class ChangelogService {

    private static final Logger log = LoggerFactory.getLogger(ChangelogService.class);

    private final RawChangelogRepository rawChangelogRepository;
    private final MonitorService monitorService;
    private final RunCoordinator runCoordinator;

    public ChangelogService(RawChangelogRepository rawChangelogRepository,
            MonitorService monitorService,
            RunCoordinator runCoordinator) {
        this.rawChangelogRepository = rawChangelogRepository;
        this.monitorService = monitorService;
        this.runCoordinator = runCoordinator;
    }

    public String getChangelog() {
        return rawChangelogRepository.findById(selfProductName())
                .map(RawChangelog::getContent)
                .orElse("");
    }

    /**
     * Stores the changelog and starts a monitor run of the self product so new entries get merged and tagged.
     */
    public RunResponse saveChangelog(String content) {
        String productName = selfProductName();
        rawChangelogRepository.save(RawChangelog.builder()
                .productName(productName)
                .content(content != null ? content : "")
                .build());
        log.info("[CHANGELOG] Saved {} chars for {}", content != null ? content.length() : 0, productName);
        return runCoordinator.triggerCrawl(productName);
    }

    private String selfProductName() {
        return monitorService.selfProduct()
                .map(TrackerProperties.Product::name)
                .orElseThrow(() -> new ResourceNotFoundException("No self product configured (tracker.products[].self)"));
    }
}
