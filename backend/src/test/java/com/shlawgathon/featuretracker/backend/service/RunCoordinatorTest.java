package com.shlawgathon.featuretracker.backend.service;

import com.shlawgathon.featuretracker.backend.dto.RunResponse;
import com.shlawgathon.featuretracker.backend.dto.TaggingReport;
import com.shlawgathon.featuretracker.backend.exception.ResourceNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RunCoordinatorTest {

    private MonitorService monitorService;
    private FeatureTaggingService featureTaggingService;
    private WorkspaceLock workspaceLock;
    private RunCoordinator coordinator;

    @BeforeEach
    void setUp() {
        monitorService = mock(MonitorService.class);
        featureTaggingService = mock(FeatureTaggingService.class);
        workspaceLock = new WorkspaceLock(Duration.ofMillis(50));
        coordinator = new RunCoordinator(monitorService, featureTaggingService, workspaceLock);
    }

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
    }

    @Test
    void shouldRejectSecondRunWhileFirstIsActive() throws Exception {
        // Given
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(featureTaggingService.tagAll(0)).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return List.<TaggingReport>of();
        });

        // When
        RunResponse first = coordinator.triggerTagging(null, 0);
        assertTrue(started.await(5, TimeUnit.SECONDS));
        RunResponse second = coordinator.triggerCrawl(null);

        // Then
        assertEquals(RunResponse.STARTED, first.getStatus());
        assertEquals(RunResponse.ALREADY_RUNNING, second.getStatus());
        assertEquals(RunCoordinator.TASK_TAGGING, second.getTask());
        assertTrue(coordinator.isRunning());
        assertTrue(workspaceLock.isLocked());

        release.countDown();
        waitUntilIdle();
        assertFalse(workspaceLock.isLocked());
        verify(monitorService, never()).monitorAll();
    }

    @Test
    void shouldAcceptNewRunAfterFailure() throws Exception {
        // Given
        when(featureTaggingService.tagPending("lovable", 3)).thenThrow(new IllegalStateException("boom"));

        // When
        coordinator.triggerTagging("lovable", 3);
        waitUntilIdle();
        RunResponse next = coordinator.triggerCrawl(null);

        // Then
        assertEquals(RunResponse.STARTED, next.getStatus());
        waitUntilIdle();
        verify(monitorService).monitorAll();
    }

    @Test
    void shouldValidateProductBeforeStartingCrawl() {
        when(monitorService.requireProduct("cursor")).thenThrow(new ResourceNotFoundException("Product is not tracked: cursor"));

        assertThrows(ResourceNotFoundException.class, () -> coordinator.triggerCrawl("cursor"));
        assertFalse(coordinator.isRunning());
    }

    @Test
    void shouldReportRunningTaskInStatus() {
        when(monitorService.syncStatuses()).thenReturn(List.of());
        when(monitorService.recentUpdates()).thenReturn(List.of());

        var status = coordinator.status();

        assertFalse(status.isCrawlRunning());
        assertFalse(status.isTaggingRunning());
    }

    private void waitUntilIdle() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (coordinator.isRunning() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(coordinator.isRunning());
    }
}
