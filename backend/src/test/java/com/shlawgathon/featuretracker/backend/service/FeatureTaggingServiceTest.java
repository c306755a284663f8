package com.shlawgathon.featuretracker.backend.service;

import com.shlawgathon.featuretracker.backend.dto.TaggingReport;
import com.shlawgathon.featuretracker.backend.exception.ProductDataCorruptedException;
import com.shlawgathon.featuretracker.backend.model.Feature;
import com.shlawgathon.featuretracker.backend.model.PrimaryTag;
import com.shlawgathon.featuretracker.backend.model.ProductDataset;
import com.shlawgathon.featuretracker.backend.model.Subtag;
import com.shlawgathon.featuretracker.backend.model.TagAssignment;
import com.shlawgathon.featuretracker.backend.model.TagStatus;
import com.shlawgathon.featuretracker.backend.model.Taxonomy;
import com.shlawgathon.featuretracker.backend.oracle.ClassificationOracle;
import com.shlawgathon.featuretracker.backend.oracle.OracleResult;
import com.shlawgathon.featuretracker.backend.repository.ProductDatasetRepository;
import com.shlawgathon.featuretracker.backend.repository.TaxonomyRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class FeatureTaggingServiceTest {

    private ProductDatasetRepository productDatasetRepository;
    private TaxonomyRepository taxonomyRepository;
    private ClassificationOracle oracle;
    private FeatureTaggingService service;

    private Taxonomy taxonomy;
    private ProductDataset dataset;

    @BeforeEach
    void setUp() {
        productDatasetRepository = mock(ProductDatasetRepository.class);
        taxonomyRepository = mock(TaxonomyRepository.class);
        oracle = mock(ClassificationOracle.class);

        taxonomy = Taxonomy.empty();
        taxonomy.getPrimaryTags().add(PrimaryTag.builder()
                .name("AI Model")
                .subtags(new ArrayList<>(List.of(new Subtag("OpenAI", "OpenAI"))))
                .build());
        taxonomy.getSubtagToPrimary().put("OpenAI", "AI Model");
        when(taxonomyRepository.findById(Taxonomy.DEFAULT_ID)).thenReturn(Optional.of(taxonomy));

        dataset = ProductDataset.builder().name("lovable").build();
        for (int i = 1; i <= 5; i++) {
            dataset.getFeatures().add(Feature.builder().title("Feature " + i).description("d").time("2026-01-0" + i).build());
        }
        when(productDatasetRepository.findById("lovable")).thenReturn(Optional.of(dataset));

        service = new FeatureTaggingService(productDatasetRepository,
                new TaxonomyService(taxonomyRepository, "Others"), oracle);
    }

    @Test
    void shouldTagPendingFeaturesAndPersistEachOne() {
        // Given
        when(oracle.classify(anyString(), anyString(), any())).thenReturn(OracleResult.proposed(List.of("Open AI"), null));

        // When
        TaggingReport report = service.tagPending("lovable", 0);

        // Then
        assertEquals(5, report.getProcessed());
        assertEquals(5, report.getClassified());
        verify(productDatasetRepository, times(5)).save(dataset);
        verify(taxonomyRepository, never()).save(any());
        assertTrue(dataset.getFeatures().stream()
                .allMatch(f -> f.getTags().equals(List.of(TagAssignment.of("AI Model", "OpenAI")))));
    }

    @Test
    void shouldResumeWithOnlyTheUnprocessedFeatures() {
        // Given
        when(oracle.classify(anyString(), anyString(), any())).thenReturn(OracleResult.proposed(List.of("OpenAI"), null));
        service.tagPending("lovable", 2);
        clearInvocations(oracle);

        // When
        TaggingReport resumed = service.tagPending("lovable", 0);

        // Then
        assertEquals(3, resumed.getProcessed());
        verify(oracle, never()).classify(eq("Feature 1"), anyString(), any());
        verify(oracle, never()).classify(eq("Feature 2"), anyString(), any());
        verify(oracle).classify(eq("Feature 5"), anyString(), any());
    }

    @Test
    void shouldResumeAfterCrashMidBatch() {
        // Given
        when(oracle.classify(anyString(), anyString(), any())).thenReturn(OracleResult.proposed(List.of("OpenAI"), null));
        when(oracle.classify(eq("Feature 3"), anyString(), any()))
                .thenThrow(new IllegalStateException("worker killed"))
                .thenReturn(OracleResult.proposed(List.of("OpenAI"), null));

        // When
        assertThrows(IllegalStateException.class, () -> service.tagPending("lovable", 0));
        TaggingReport resumed = service.tagPending("lovable", 0);

        // Then
        assertEquals(3, resumed.getProcessed());
        assertTrue(dataset.getFeatures().stream().noneMatch(Feature::isPending));
    }

    @Test
    void shouldLeaveFeaturePendingWhenOracleFails() {
        when(oracle.classify(anyString(), anyString(), any())).thenReturn(OracleResult.failed("timeout"));

        TaggingReport report = service.tagPending("lovable", 1);

        assertEquals(1, report.getPending());
        assertEquals(TagStatus.UNTAGGED, dataset.getFeatures().get(0).getTagStatus());
        verify(productDatasetRepository, never()).save(any());
    }

    @Test
    void shouldMarkNotApplicableWhenOracleProposesNothingUsable() {
        when(oracle.classify(eq("Feature 1"), anyString(), any())).thenReturn(OracleResult.notClassifiable());
        when(oracle.classify(eq("Feature 2"), anyString(), any()))
                .thenReturn(OracleResult.proposed(List.of("AI Model"), null));

        TaggingReport report = service.tagPending("lovable", 2);

        assertEquals(2, report.getSkipped());
        assertEquals(TagStatus.NOT_APPLICABLE, dataset.getFeatures().get(0).getTagStatus());
        assertEquals(TagStatus.NOT_APPLICABLE, dataset.getFeatures().get(1).getTagStatus());
        assertTrue(dataset.getFeatures().get(1).getTags().isEmpty());
    }

    @Test
    void shouldSaveGrownTaxonomyBeforeProduct() {
        when(oracle.classify(anyString(), anyString(), any()))
                .thenReturn(OracleResult.proposed(List.of("Gemini"), "AI Model"));

        TaggingReport report = service.tagPending("lovable", 1);

        assertEquals(List.of("Gemini"), report.getNewSubtags());
        InOrder inOrder = inOrder(taxonomyRepository, productDatasetRepository);
        inOrder.verify(taxonomyRepository).save(taxonomy);
        inOrder.verify(productDatasetRepository).save(dataset);
        assertEquals("AI Model", taxonomy.getSubtagToPrimary().get("Gemini"));
    }

    @Test
    void shouldRejectDatasetWithoutFeatureArray() {
        dataset.setFeatures(null);

        assertThrows(ProductDataCorruptedException.class, () -> service.tagPending("lovable", 0));
    }

    @Test
    void shouldContinuePastCorruptedProductWhenTaggingAll() {
        // Given
        ProductDataset broken = ProductDataset.builder().name("bolt").features(null).build();
        when(productDatasetRepository.findById("bolt")).thenReturn(Optional.of(broken));
        when(productDatasetRepository.findAllByOrderByNameAsc()).thenReturn(List.of(broken, dataset));
        when(oracle.classify(anyString(), anyString(), any())).thenReturn(OracleResult.proposed(List.of("OpenAI"), null));

        // When
        List<TaggingReport> reports = service.tagAll(0);

        // Then
        assertEquals(2, reports.size());
        assertNotNull(reports.get(0).getError());
        assertEquals(5, reports.get(1).getClassified());
    }

    @Test
    void shouldDropCatchAllNameAndKeepTaggingTheBatch() {
        // Given
        when(oracle.classify(eq("Feature 1"), anyString(), any())).thenReturn(OracleResult.proposed(List.of("others"), null));
        when(oracle.classify(eq("Feature 2"), anyString(), any())).thenReturn(OracleResult.proposed(List.of("agent mode"), null));

        // When
        TaggingReport report = assertDoesNotThrow(() -> service.tagPending("lovable", 2));

        // Then
        assertEquals(2, report.getProcessed());
        assertEquals(TagStatus.NOT_APPLICABLE, dataset.getFeatures().get(0).getTagStatus());
        assertEquals(TagStatus.TAGGED, dataset.getFeatures().get(1).getTagStatus());
        assertEquals(List.of(TagAssignment.of("Others", "agent mode")), dataset.getFeatures().get(1).getTags());
    }

    @Test
    void shouldContinueWithNextProductWhenOneFailsUnexpectedly() {
        // Given
        ProductDataset bolt = ProductDataset.builder().name("bolt")
                .features(new ArrayList<>(List.of(Feature.builder().title("Bolt feature").description("d").time("2026-01-01").build())))
                .build();
        when(productDatasetRepository.findById("bolt")).thenReturn(Optional.of(bolt));
        when(productDatasetRepository.findAllByOrderByNameAsc()).thenReturn(List.of(bolt, dataset));
        when(productDatasetRepository.save(bolt)).thenThrow(new IllegalStateException("write failed"));
        when(oracle.classify(anyString(), anyString(), any())).thenReturn(OracleResult.proposed(List.of("OpenAI"), null));

        // When
        List<TaggingReport> reports = service.tagAll(0);

        // Then
        assertEquals(2, reports.size());
        assertEquals("write failed", reports.get(0).getError());
        assertEquals(5, reports.get(1).getClassified());
    }
}
