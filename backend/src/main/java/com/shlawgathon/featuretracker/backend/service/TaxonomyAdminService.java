package com.shlawgathon.featuretracker.backend.service;

import com.shlawgathon.featuretracker.backend.dto.FeatureView;
import com.shlawgathon.featuretracker.backend.dto.ReassignOthersRequest;
import com.shlawgathon.featuretracker.backend.dto.TagChangeResult;
import com.shlawgathon.featuretracker.backend.exception.ResourceNotFoundException;
import com.shlawgathon.featuretracker.backend.exception.TaxonomyConflictException;
import com.shlawgathon.featuretracker.backend.model.Feature;
import com.shlawgathon.featuretracker.backend.model.PrimaryTag;
import com.shlawgathon.featuretracker.backend.model.ProductDataset;
import com.shlawgathon.featuretracker.backend.model.TagAssignment;
import com.shlawgathon.featuretracker.backend.model.TagKind;
import com.shlawgathon.featuretracker.backend.model.Taxonomy;
import com.shlawgathon.featuretracker.backend.repository.ProductDatasetRepository;
import com.shlawgathon.featuretracker.backend.taxonomy.TagAssignments;
import com.shlawgathon.featuretracker.backend.taxonomy.TaxonomyIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.ToIntFunction;

/**
 * Admin changes to the taxonomy, propagated into every product document so that stored tags keep pointing
 * at existing taxonomy nodes.
 */
@Service
public class TaxonomyAdminService {

    private static final Logger log = LoggerFactory.getLogger(TaxonomyAdminService.class);

    private final TaxonomyService taxonomyService;
    private final ProductDatasetRepository productDatasetRepository;
    private final WorkspaceLock workspaceLock;

    public TaxonomyAdminService(TaxonomyService taxonomyService,
            ProductDatasetRepository productDatasetRepository,
            WorkspaceLock workspaceLock) {
        this.taxonomyService = taxonomyService;
        this.productDatasetRepository = productDatasetRepository;
        this.workspaceLock = workspaceLock;
    }

    public Taxonomy getTaxonomy() {
        return taxonomyService.openIndex().getTaxonomy();
    }

    /**
     * Renames a tag, or merges it into {@code newName} when a tag of the same kind already has that name.
     *
     * @throws ResourceNotFoundException if {@code oldName} does not exist
     * @throws TaxonomyConflictException if {@code newName} belongs to the other namespace or fuzzily matches
     *                                   a different tag
     */
    public TagChangeResult renameOrMerge(String oldName, String newName, TagKind kind) {
        String from = requireName(oldName, "old_name");
        String to = requireName(newName, "new_name");
        if (from.equals(to)) {
            throw new IllegalArgumentException("New name is the same as the old name");
        }
        if (kind == null) {
            throw new IllegalArgumentException("type must be primary or subtag");
        }

        return workspaceLock.runAdmin("tag rename", () -> kind == TagKind.PRIMARY
                ? renamePrimary(from, to)
                : renameSubtag(from, to));
    }

    private TagChangeResult renamePrimary(String from, String to) {
        TaxonomyIndex index = taxonomyService.openIndex();
        if (!index.hasPrimary(from)) {
            throw new ResourceNotFoundException("Primary tag not found: " + from);
        }
        index.resolveSubtag(to).ifPresent(existing -> {
            throw new TaxonomyConflictException("'" + to + "' is already a subtag ('" + existing + "')");
        });

        TagChangeResult.Mode mode;
        if (index.hasPrimary(to)) {
            mode = TagChangeResult.Mode.MERGED;
            index.mergePrimary(from, to);
        } else {
            Optional<String> similar = index.resolvePrimary(to);
            if (similar.isPresent() && !similar.get().equals(from)) {
                throw new TaxonomyConflictException("'" + to + "' matches existing primary tag '" + similar.get()
                        + "', use that exact name to merge");
            }
            mode = TagChangeResult.Mode.RENAMED;
            index.renamePrimary(from, to);
        }
        taxonomyService.save(index);

        Propagation propagation = rewriteProducts(tags -> {
            int touched = 0;
            for (TagAssignment assignment : tags) {
                if (from.equals(assignment.getName())) {
                    assignment.setName(to);
                    touched++;
                }
            }
            return touched;
        });
        return result(mode, TagKind.PRIMARY, from, to, propagation);
    }

    private TagChangeResult renameSubtag(String from, String to) {
        TaxonomyIndex index = taxonomyService.openIndex();
        if (!index.hasSubtag(from)) {
            throw new ResourceNotFoundException("Subtag not found: " + from);
        }
        if (index.isPrimaryName(to)) {
            throw new TaxonomyConflictException("'" + to + "' is already a primary tag");
        }

        TagChangeResult.Mode mode;
        ToIntFunction<List<TagAssignment>> rewrite;
        if (index.hasSubtag(to)) {
            mode = TagChangeResult.Mode.MERGED;
            String owner = index.ownerOf(to).orElseThrow();
            index.mergeSubtag(from, to);
            rewrite = tags -> {
                int touched = TagAssignments.removeSubtag(tags, from);
                if (touched > 0) {
                    TagAssignments.addTo(tags, owner, to);
                }
                return touched;
            };
        } else {
            Optional<String> similar = index.resolveSubtag(to);
            if (similar.isPresent() && !similar.get().equals(from)) {
                throw new TaxonomyConflictException("'" + to + "' matches existing subtag '" + similar.get()
                        + "', use that exact name to merge");
            }
            mode = TagChangeResult.Mode.RENAMED;
            index.renameSubtag(from, to);
            rewrite = tags -> {
                int touched = 0;
                for (TagAssignment assignment : tags) {
                    if (assignment.containsSubtag(from)) {
                        assignment.getSubtags().forEach(ref -> {
                            if (from.equals(ref.getName())) {
                                ref.setName(to);
                            }
                        });
                        touched++;
                    }
                }
                return touched;
            };
        }
        taxonomyService.save(index);

        return result(mode, TagKind.SUBTAG, from, to, rewriteProducts(rewrite));
    }

    /**
     * Re-parents a subtag, typically to promote an auto-created catch-all subtag into a real category.
     */
    public TagChangeResult moveSubtag(String subtag, String targetPrimary) {
        String name = requireName(subtag, "subtag");
        String target = requireName(targetPrimary, "target_primary");
        return workspaceLock.runAdmin("subtag move", () -> {
            TaxonomyIndex index = taxonomyService.openIndex();
            String resolved = index.resolveSubtag(name)
                    .orElseThrow(() -> new ResourceNotFoundException("Subtag not found: " + name));
            String primary = index.resolvePrimary(target)
                    .orElseThrow(() -> new ResourceNotFoundException("Primary tag not found: " + target));
            return move(index, resolved, primary);
        });
    }

    private TagChangeResult move(TaxonomyIndex index, String subtag, String primary) {
        String owner = index.ownerOf(subtag).orElseThrow();
        if (owner.equals(primary)) {
            return TagChangeResult.builder()
                    .mode(TagChangeResult.Mode.UNCHANGED)
                    .kind(TagKind.SUBTAG)
                    .oldName(subtag)
                    .newName(subtag)
                    .build();
        }
        index.moveSubtag(subtag, primary);
        taxonomyService.save(index);

        Propagation propagation = rewriteProducts(tags -> {
            int touched = TagAssignments.removeSubtag(tags, subtag);
            if (touched > 0) {
                TagAssignments.addTo(tags, primary, subtag);
            }
            return touched;
        });
        return result(TagChangeResult.Mode.MOVED, TagKind.SUBTAG, subtag, subtag, propagation);
    }

    public PrimaryTag createPrimary(String name, String description, List<String> subtags) {
        String primaryName = requireName(name, "name");
        return workspaceLock.runAdmin("primary create", () -> {
            TaxonomyIndex index = taxonomyService.openIndex();
            PrimaryTag primary = index.registerNewPrimary(primaryName, description, subtags);
            taxonomyService.save(index);
            return primary;
        });
    }

    /**
     * Features that carry at least one catch-all subtag, for review.
     */
    public List<FeatureView> listOthersFeatures() {
        String others = taxonomyService.getOthersPrimary();
        List<FeatureView> views = new ArrayList<>();
        for (ProductDataset dataset : productDatasetRepository.findAllByOrderByNameAsc()) {
            List<Feature> features = dataset.getFeatures();
            if (features == null) {
                continue;
            }
            for (int i = 0; i < features.size(); i++) {
                Feature feature = features.get(i);
                boolean filedUnderOthers = feature.tagsOrEmpty().stream()
                        .anyMatch(tag -> others.equals(tag.getName()));
                if (filedUnderOthers) {
                    views.add(FeatureView.of(dataset.getName(), i, feature));
                }
            }
        }
        return views;
    }

    /**
     * Replaces the catch-all assignment of one feature with {@code primaryTag > subtag}. A catch-all subtag with
     * the same name is promoted into {@code primaryTag} everywhere; an unknown subtag is registered.
     */
    public FeatureView reassignOthers(ReassignOthersRequest request) {
        String subtagName = requireName(request.getSubtag(), "subtag");
        return workspaceLock.runAdmin("others reassign", () -> {
            TaxonomyIndex index = taxonomyService.openIndex();
            String others = taxonomyService.getOthersPrimary();
            String primary = index.resolvePrimary(request.getPrimaryTag())
                    .orElseThrow(() -> new ResourceNotFoundException("Primary tag not found: " + request.getPrimaryTag()));
            if (primary.equals(others)) {
                throw new IllegalArgumentException("Target primary must not be " + others);
            }

            String subtag;
            Optional<String> existing = index.resolveSubtag(subtagName);
            if (existing.isPresent()) {
                subtag = existing.get();
                String owner = index.ownerOf(subtag).orElseThrow();
                if (owner.equals(others)) {
                    move(index, subtag, primary);
                } else if (!owner.equals(primary)) {
                    throw new TaxonomyConflictException("Subtag '" + subtag + "' belongs to '" + owner + "'");
                }
            } else {
                subtag = index.registerNewSubtag(primary, subtagName);
                taxonomyService.save(index);
            }

            ProductDataset dataset = requireDataset(request.getProduct());
            Feature feature = requireFeature(dataset, request.getFeatureIndex());
            List<TagAssignment> tags = new ArrayList<>(feature.tagsOrEmpty());
            tags.removeIf(tag -> others.equals(tag.getName()));
            TagAssignments.addTo(tags, primary, subtag);
            feature.markTagged(TagAssignments.coalesce(tags));
            productDatasetRepository.save(dataset);

            log.info("[ADMIN] Reassigned {}#{} to {} > {}", dataset.getName(), request.getFeatureIndex(),
                    primary, subtag);
            return FeatureView.of(dataset.getName(), request.getFeatureIndex(), feature);
        });
    }

    // ==================== Propagation ====================

    private record Propagation(int products, int assignments) {
    }

    private Propagation rewriteProducts(ToIntFunction<List<TagAssignment>> rewrite) {
        int products = 0;
        int assignments = 0;
        for (ProductDataset dataset : productDatasetRepository.findAll()) {
            if (dataset.getFeatures() == null) {
                log.warn("[ADMIN] Skipping product {} without a features array", dataset.getName());
                continue;
            }
            int touchedInProduct = 0;
            for (Feature feature : dataset.getFeatures()) {
                if (feature.tagsOrEmpty().isEmpty()) {
                    continue;
                }
                int touched = rewrite.applyAsInt(feature.getTags());
                if (touched > 0) {
                    List<TagAssignment> coalesced = TagAssignments.coalesce(feature.getTags());
                    if (coalesced.isEmpty()) {
                        feature.resetToPending();
                    } else {
                        feature.setTags(coalesced);
                    }
                    touchedInProduct += touched;
                }
            }
            if (touchedInProduct > 0) {
                productDatasetRepository.save(dataset);
                products++;
                assignments += touchedInProduct;
            }
        }
        return new Propagation(products, assignments);
    }

    private TagChangeResult result(TagChangeResult.Mode mode, TagKind kind, String from, String to,
            Propagation propagation) {
        log.info("[ADMIN] {} {} '{}' -> '{}': {} products, {} assignments", mode, kind, from, to,
                propagation.products(), propagation.assignments());
        return TagChangeResult.builder()
                .mode(mode)
                .kind(kind)
                .oldName(from)
                .newName(to)
                .affectedProductCount(propagation.products())
                .affectedAssignmentCount(propagation.assignments())
                .build();
    }

    private ProductDataset requireDataset(String productName) {
        return productDatasetRepository.findById(productName)
                .orElseThrow(() -> new ResourceNotFoundException("Product not found: " + productName));
    }

    static Feature requireFeature(ProductDataset dataset, Integer featureIndex) {
        List<Feature> features = dataset.getFeatures();
        if (featureIndex == null || features == null || featureIndex < 0 || featureIndex >= features.size()) {
            throw new ResourceNotFoundException("Feature " + featureIndex + " not found in " + dataset.getName());
        }
        return features.get(featureIndex);
    }

    static String requireName(String name, String field) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return name.trim();
    }
}
