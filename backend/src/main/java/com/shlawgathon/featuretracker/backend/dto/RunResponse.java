package com.shlawgathon.featuretracker.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Answer to a batch trigger")
public class RunResponse {

    public static final String STARTED = "started";
    public static final String ALREADY_RUNNING = "already_running";

    @Schema(description = "started or already_running", example = "started")
    private String status;

    @Schema(description = "Batch kind", example = "crawl")
    private String task;
}
