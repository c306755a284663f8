package com.shlawgathon.featuretracker.backend.controller;

import com.shlawgathon.featuretracker.backend.dto.AddFeatureRequest;
import com.shlawgathon.featuretracker.backend.dto.ChangelogRequest;
import com.shlawgathon.featuretracker.backend.dto.EditFeatureRequest;
import com.shlawgathon.featuretracker.backend.dto.FeaturePage;
import com.shlawgathon.featuretracker.backend.dto.FeatureRefRequest;
import com.shlawgathon.featuretracker.backend.dto.FeatureSearchRequest;
import com.shlawgathon.featuretracker.backend.dto.FeatureView;
import com.shlawgathon.featuretracker.backend.dto.RunResponse;
import com.shlawgathon.featuretracker.backend.dto.UpdateTagsRequest;
import com.shlawgathon.featuretracker.backend.service.ChangelogService;
import com.shlawgathon.featuretracker.backend.service.ProductDatasetService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Hand edits of product features and the self product's changelog. All routes require the admin token.
 */
@RestController
@RequestMapping("/api/admin")
@Tag(name = "Admin: Features", description = "Feature editing")
@SecurityRequirement(name = "adminToken")
public class AdminFeatureController {

    private final ProductDatasetService productDatasetService;
    private final ChangelogService changelogService;

    public AdminFeatureController(ProductDatasetService productDatasetService, ChangelogService changelogService) {
        this.productDatasetService = productDatasetService;
        this.changelogService = changelogService;
    }

    @PostMapping("/features")
    @Operation(summary = "Search features", description = "Paged search by product, text, tag and status")
    public ResponseEntity<FeaturePage> searchFeatures(@RequestBody FeatureSearchRequest request) {
        return ResponseEntity.ok(productDatasetService.search(request));
    }

    @PostMapping("/feature/add")
    @Operation(summary = "Add feature", description = "Adds a feature at the top of the list, optionally tagging it")
    public ResponseEntity<FeatureView> addFeature(@Valid @RequestBody AddFeatureRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(productDatasetService.addFeature(request));
    }

    @PostMapping("/feature/edit")
    @Operation(summary = "Edit feature", description = "Updates title, description or time; tags are kept")
    public ResponseEntity<FeatureView> editFeature(@Valid @RequestBody EditFeatureRequest request) {
        return ResponseEntity.ok(productDatasetService.editFeature(request));
    }

    @PostMapping("/feature/delete")
    @Operation(summary = "Delete feature")
    public ResponseEntity<FeatureView> deleteFeature(@Valid @RequestBody FeatureRefRequest request) {
        return ResponseEntity.ok(productDatasetService.deleteFeature(request));
    }

    @PostMapping("/feature/update-tags")
    @Operation(summary = "Set feature tags", description = "Replaces the tags; an empty list re-queues the feature")
    public ResponseEntity<FeatureView> updateTags(@Valid @RequestBody UpdateTagsRequest request) {
        return ResponseEntity.ok(productDatasetService.updateTags(request));
    }

    @GetMapping("/changelog")
    @Operation(summary = "Get self changelog", description = "Markdown changelog of the self product")
    public ResponseEntity<Map<String, String>> getChangelog() {
        return ResponseEntity.ok(Map.of("content", changelogService.getChangelog()));
    }

    @PostMapping("/changelog")
    @Operation(summary = "Save self changelog", description = "Stores the markdown and starts a monitor run of the self product")
    public ResponseEntity<Map<String, String>> saveChangelog(@RequestBody ChangelogRequest request) {
        RunResponse run = changelogService.saveChangelog(request.getContent());
        return ResponseEntity.ok(Map.of("status", "saved", "run", run.getStatus()));
    }
}
