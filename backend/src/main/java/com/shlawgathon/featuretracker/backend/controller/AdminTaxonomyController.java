package com.shlawgathon.featuretracker.backend.controller;

import com.shlawgathon.featuretracker.backend.dto.CreatePrimaryRequest;
import com.shlawgathon.featuretracker.backend.dto.FeatureView;
import com.shlawgathon.featuretracker.backend.dto.MoveSubtagRequest;
import com.shlawgathon.featuretracker.backend.dto.ReassignOthersRequest;
import com.shlawgathon.featuretracker.backend.dto.RenameTagRequest;
import com.shlawgathon.featuretracker.backend.dto.TagChangeResult;
import com.shlawgathon.featuretracker.backend.model.PrimaryTag;
import com.shlawgathon.featuretracker.backend.model.Taxonomy;
import com.shlawgathon.featuretracker.backend.service.TaxonomyAdminService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Taxonomy maintenance. All routes require the admin token.
 */
@RestController
@RequestMapping("/api/admin")
@Tag(name = "Admin: Taxonomy", description = "Tag taxonomy maintenance")
@SecurityRequirement(name = "adminToken")
public class AdminTaxonomyController {

    private final TaxonomyAdminService taxonomyAdminService;

    public AdminTaxonomyController(TaxonomyAdminService taxonomyAdminService) {
        this.taxonomyAdminService = taxonomyAdminService;
    }

    @GetMapping("/tags")
    @Operation(summary = "Get taxonomy", description = "Primary tags with their subtags and the subtag reverse index")
    public ResponseEntity<Taxonomy> getTags() {
        return ResponseEntity.ok(taxonomyAdminService.getTaxonomy());
    }

    @PostMapping("/tags/primary")
    @Operation(summary = "Create primary tag")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Primary tag created"),
            @ApiResponse(responseCode = "409", description = "Name already used by a tag")
    })
    public ResponseEntity<PrimaryTag> createPrimary(@Valid @RequestBody CreatePrimaryRequest request) {
        PrimaryTag primary = taxonomyAdminService.createPrimary(
                request.getName(), request.getDescription(), request.getSubtags());
        return ResponseEntity.status(HttpStatus.CREATED).body(primary);
    }

    @PostMapping("/tag/rename")
    @Operation(summary = "Rename or merge a tag",
            description = "Renames a primary tag or subtag; when the new name already exists the two are merged. "
                    + "Every product's stored tags are rewritten.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Renamed or merged"),
            @ApiResponse(responseCode = "400", description = "Blank or unchanged name"),
            @ApiResponse(responseCode = "404", description = "Old name not found"),
            @ApiResponse(responseCode = "409", description = "Namespace conflict or a batch is running")
    })
    public ResponseEntity<TagChangeResult> renameTag(@Valid @RequestBody RenameTagRequest request) {
        return ResponseEntity.ok(taxonomyAdminService.renameOrMerge(
                request.getOldName(), request.getNewName(), request.getType()));
    }

    @PostMapping("/tag/move")
    @Operation(summary = "Move subtag", description = "Re-parents a subtag under another primary tag")
    public ResponseEntity<TagChangeResult> moveSubtag(@Valid @RequestBody MoveSubtagRequest request) {
        return ResponseEntity.ok(taxonomyAdminService.moveSubtag(request.getSubtag(), request.getTargetPrimary()));
    }

    @GetMapping("/others")
    @Operation(summary = "List uncategorized features", description = "Features filed under the catch-all primary tag")
    public ResponseEntity<Map<String, List<FeatureView>>> listOthers() {
        return ResponseEntity.ok(Map.of("features", taxonomyAdminService.listOthersFeatures()));
    }

    @PostMapping("/others/update")
    @Operation(summary = "Re-tag uncategorized feature",
            description = "Replaces a feature's catch-all tags with a primary tag and subtag")
    public ResponseEntity<FeatureView> reassignOthers(@Valid @RequestBody ReassignOthersRequest request) {
        return ResponseEntity.ok(taxonomyAdminService.reassignOthers(request));
    }
}
