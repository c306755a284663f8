package com.shlawgathon.featuretracker.backend.service;

import com.shlawgathon.featuretracker.backend.BaseE2ETest;
import com.shlawgathon.featuretracker.backend.dto.MonitorResult;
import com.shlawgathon.featuretracker.backend.model.Feature;
import com.shlawgathon.featuretracker.backend.model.MonitorOutcome;
import com.shlawgathon.featuretracker.backend.model.ProductDataset;
import com.shlawgathon.featuretracker.backend.model.RawChangelog;
import com.shlawgathon.featuretracker.backend.model.TagStatus;
import com.shlawgathon.featuretracker.backend.model.Taxonomy;
import com.shlawgathon.featuretracker.backend.oracle.ClassificationOracle;
import com.shlawgathon.featuretracker.backend.oracle.OracleResult;
import com.shlawgathon.featuretracker.backend.repository.ProductDatasetRepository;
import com.shlawgathon.featuretracker.backend.repository.RawChangelogRepository;
import com.shlawgathon.featuretracker.backend.repository.SyncStatusRepository;
import com.shlawgathon.featuretracker.backend.repository.TaxonomyRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class MonitorServiceE2ETest extends BaseE2ETest {

    private static final String CHANGELOG = """
            ## v2.7.4 – January 12, 2026
            #### Next.js Export
            Export any project as a Next.js app.
            #### Bug bash
            Stability fixes.
            """;

    @Autowired
    private MonitorService monitorService;

    @Autowired
    private RawChangelogRepository rawChangelogRepository;

    @Autowired
    private ProductDatasetRepository productDatasetRepository;

    @Autowired
    private TaxonomyRepository taxonomyRepository;

    @Autowired
    private SyncStatusRepository syncStatusRepository;

    @MockBean
    private ClassificationOracle classificationOracle;

    @BeforeEach
    void setUp() {
        rawChangelogRepository.deleteAll();
        productDatasetRepository.deleteAll();
        taxonomyRepository.deleteAll();
        syncStatusRepository.deleteAll();

        when(classificationOracle.classify(eq("Next.js Export"), any(), any()))
                .thenReturn(OracleResult.proposed(List.of("Next.js"), "Integration"));
        when(classificationOracle.classify(eq("Bug bash"), any(), any()))
                .thenReturn(OracleResult.notClassifiable());
    }

    @Test
    void shouldCrawlMergeAndTagSelfProduct() {
        // Given
        rawChangelogRepository.save(RawChangelog.builder().productName("youware").content(CHANGELOG).build());

        // When
        MonitorResult result = monitorService.monitorProduct("youware");

        // Then
        assertEquals(MonitorOutcome.SUCCESS, result.getOutcome());
        assertEquals(2, result.getNewCount());

        ProductDataset stored = productDatasetRepository.findById("youware").orElseThrow();
        assertTrue(stored.isSelf());
        Feature export = stored.getFeatures().get(0);
        assertEquals("2026-01-12", export.getTime());
        assertEquals(TagStatus.TAGGED, export.getTagStatus());
        assertEquals(TagStatus.NOT_APPLICABLE, stored.getFeatures().get(1).getTagStatus());

        // dotted subtag names survive the round trip through Mongo
        Taxonomy taxonomy = taxonomyRepository.findById(Taxonomy.DEFAULT_ID).orElseThrow();
        assertTrue(taxonomy.getSubtagToPrimary().containsKey("Next.js"));
        assertEquals(MonitorOutcome.SUCCESS,
                syncStatusRepository.findById("youware").orElseThrow().getLastOutcome());
    }

    @Test
    void shouldNotReclassifyOnSecondRun() {
        // Given
        rawChangelogRepository.save(RawChangelog.builder().productName("youware").content(CHANGELOG).build());
        monitorService.monitorProduct("youware");
        clearInvocations(classificationOracle);

        // When
        MonitorResult second = monitorService.monitorProduct("youware");

        // Then
        assertEquals(0, second.getNewCount());
        verify(classificationOracle, never()).classify(eq("Next.js Export"), any(), any());
    }

    @Test
    void shouldReportMissingChangelogAsNoCrawler() {
        MonitorResult result = monitorService.monitorProduct("youware");

        assertEquals(MonitorOutcome.NO_CRAWLER, result.getOutcome());
        assertTrue(productDatasetRepository.findById("youware").isEmpty());
    }
}
