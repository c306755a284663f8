package com.shlawgathon.featuretracker.backend.controller;

import com.shlawgathon.featuretracker.backend.dto.RunResponse;
import com.shlawgathon.featuretracker.backend.dto.StatusResponse;
import com.shlawgathon.featuretracker.backend.service.RunCoordinator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Background batch triggers and their status.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Runs", description = "Monitor and tagging batches")
public class RunController {

    private final RunCoordinator runCoordinator;

    public RunController(RunCoordinator runCoordinator) {
        this.runCoordinator = runCoordinator;
    }

    @PostMapping("/run-crawl")
    @Operation(summary = "Start monitor run", description = "Crawl, merge and tag one product or all of them",
            security = @SecurityRequirement(name = "adminToken"))
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "started or already_running"),
            @ApiResponse(responseCode = "401", description = "Missing or invalid admin token"),
            @ApiResponse(responseCode = "404", description = "Product is not tracked")
    })
    public ResponseEntity<RunResponse> runCrawl(
            @Parameter(description = "Product name, all products when omitted") @RequestParam(required = false) String product) {
        return ResponseEntity.ok(runCoordinator.triggerCrawl(product));
    }

    @PostMapping("/run-tagging")
    @Operation(summary = "Start tagging run", description = "Classify pending features",
            security = @SecurityRequirement(name = "adminToken"))
    public ResponseEntity<RunResponse> runTagging(
            @Parameter(description = "Product name, all products when omitted") @RequestParam(required = false) String product,
            @Parameter(description = "Maximum features per product, 0 for all") @RequestParam(defaultValue = "0") int limit) {
        return ResponseEntity.ok(runCoordinator.triggerTagging(product, limit));
    }

    @GetMapping("/status")
    @Operation(summary = "Batch status", description = "Running batches, last sync per product and recent update logs")
    public ResponseEntity<StatusResponse> status() {
        return ResponseEntity.ok(runCoordinator.status());
    }
}
