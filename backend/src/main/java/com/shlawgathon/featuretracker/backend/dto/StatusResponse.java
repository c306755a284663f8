package com.shlawgathon.featuretracker.backend.dto;

import com.shlawgathon.featuretracker.backend.model.SyncStatus;
import com.shlawgathon.featuretracker.backend.model.UpdateLog;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Background batch state and recent monitor history")
public class StatusResponse {

    private boolean crawlRunning;
    private boolean taggingRunning;

    private Instant lastCrawlStarted;
    private Instant lastTaggingStarted;

    @Builder.Default
    private List<SyncStatus> products = new ArrayList<>();

    @Builder.Default
    private List<UpdateLog> recentUpdates = new ArrayList<>();
}
