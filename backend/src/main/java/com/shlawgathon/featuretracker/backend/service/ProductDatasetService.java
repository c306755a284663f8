package com.shlawgathon.featuretracker.backend.service;

import com.shlawgathon.featuretracker.backend.config.TrackerProperties;
import com.shlawgathon.featuretracker.backend.dto.AddFeatureRequest;
import com.shlawgathon.featuretracker.backend.dto.EditFeatureRequest;
import com.shlawgathon.featuretracker.backend.dto.FeaturePage;
import com.shlawgathon.featuretracker.backend.dto.FeatureRefRequest;
import com.shlawgathon.featuretracker.backend.dto.FeatureSearchRequest;
import com.shlawgathon.featuretracker.backend.dto.FeatureView;
import com.shlawgathon.featuretracker.backend.dto.ProductSummary;
import com.shlawgathon.featuretracker.backend.dto.UpdateTagsRequest;
import com.shlawgathon.featuretracker.backend.exception.ResourceNotFoundException;
import com.shlawgathon.featuretracker.backend.merge.FeatureKey;
import com.shlawgathon.featuretracker.backend.model.Feature;
import com.shlawgathon.featuretracker.backend.model.ProductDataset;
import com.shlawgathon.featuretracker.backend.model.SubtagRef;
import com.shlawgathon.featuretracker.backend.model.TagAssignment;
import com.shlawgathon.featuretracker.backend.model.TagStatus;
import com.shlawgathon.featuretracker.backend.repository.ProductDatasetRepository;
import com.shlawgathon.featuretracker.backend.taxonomy.NameNormalizer;
import com.shlawgathon.featuretracker.backend.taxonomy.TagAssignments;
import com.shlawgathon.featuretracker.backend.taxonomy.TagResolver;
import com.shlawgathon.featuretracker.backend.taxonomy.TaxonomyIndex;
import com.shlawgathon.featuretracker.backend.util.FeatureTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads and hand-edits stored product datasets.
 */
@Service
public class ProductDatasetService {

    private static final Logger log = LoggerFactory.getLogger(ProductDatasetService.class);

    static final int MAX_PAGE_SIZE = 200;

    private final ProductDatasetRepository productDatasetRepository;
    private final TaxonomyService taxonomyService;
    private final FeatureTaggingService featureTaggingService;
    private final WorkspaceLock workspaceLock;

    public ProductDatasetService(ProductDatasetRepository productDatasetRepository,
            TaxonomyService taxonomyService,
            FeatureTaggingService featureTaggingService,
            WorkspaceLock workspaceLock) {
        this.productDatasetRepository = productDatasetRepository;
        this.taxonomyService = taxonomyService;
        this.featureTaggingService = featureTaggingService;
        this.workspaceLock = workspaceLock;
    }

    public List<ProductSummary> listProducts() {
        return productDatasetRepository.findAllByOrderByNameAsc().stream()
                .map(ProductDatasetService::toSummary)
                .toList();
    }

    public ProductDataset getProduct(String productName) {
        return productDatasetRepository.findById(productName)
                .orElseThrow(() -> new ResourceNotFoundException("Product not found: " + productName));
    }

    /**
     * Returns the stored dataset of a configured product, creating an empty one on first use.
     */
    public ProductDataset findOrCreate(TrackerProperties.Product product) {
        return productDatasetRepository.findById(product.name())
                .map(existing -> {
                    existing.setUrl(product.url());
                    existing.setSelf(product.self());
                    return existing;
                })
                .orElseGet(() -> ProductDataset.builder()
                        .name(product.name())
                        .url(product.url())
                        .self(product.self())
                        .build());
    }

    public FeaturePage search(FeatureSearchRequest request) {
        int page = Math.max(1, request.getPage());
        int pageSize = Math.min(MAX_PAGE_SIZE, Math.max(1, request.getPageSize()));
        String text = request.getSearch() != null ? request.getSearch().trim().toLowerCase(Locale.ROOT) : "";

        List<ProductDataset> datasets = request.getProduct() != null && !request.getProduct().isBlank()
                ? List.of(getProduct(request.getProduct()))
                : productDatasetRepository.findAllByOrderByNameAsc();

        List<FeatureView> matches = new ArrayList<>();
        for (ProductDataset dataset : datasets) {
            List<Feature> features = dataset.getFeatures();
            if (features == null) {
                continue;
            }
            for (int i = 0; i < features.size(); i++) {
                Feature feature = features.get(i);
                if (matchesText(feature, text) && matchesTag(feature, request.getTag())
                        && (request.getStatus() == null || request.getStatus() == feature.effectiveStatus())) {
                    matches.add(FeatureView.of(dataset.getName(), i, feature));
                }
            }
        }

        int from = (int) Math.min((long) (page - 1) * pageSize, matches.size());
        int to = Math.min(from + pageSize, matches.size());
        return FeaturePage.builder()
                .features(new ArrayList<>(matches.subList(from, to)))
                .total(matches.size())
                .page(page)
                .pageSize(pageSize)
                .build();
    }

    /**
     * Adds a feature at the top of a product's list, optionally classifying it right away.
     */
    public FeatureView addFeature(AddFeatureRequest request) {
        String title = TaxonomyAdminService.requireName(request.getTitle(), "title");
        String time = request.getTime() == null || request.getTime().isBlank()
                ? LocalDate.now().toString()
                : FeatureTime.normalizeDate(request.getTime());

        return workspaceLock.runAdmin("feature add", () -> {
            ProductDataset dataset = getProduct(request.getProduct());
            List<Feature> features = requireFeatures(dataset);

            requireUniqueIdentity(features, null, title, time);

            Feature feature = Feature.builder()
                    .title(title)
                    .description(request.getDescription() != null ? request.getDescription().trim() : "")
                    .time(time)
                    .build();
            features.add(0, feature);

            if (request.isAutoTag()) {
                TaxonomyIndex index = taxonomyService.openIndex();
                TagResolver resolver = taxonomyService.newResolver(index);
                List<String> created = new ArrayList<>();
                featureTaggingService.tagFeature(feature, resolver, created);
                if (!created.isEmpty()) {
                    taxonomyService.save(index);
                }
            }
            productDatasetRepository.save(dataset);
            log.info("[ADMIN] Added '{}' to {} ({})", title, dataset.getName(), feature.effectiveStatus());
            return FeatureView.of(dataset.getName(), 0, feature);
        });
    }

    public FeatureView editFeature(EditFeatureRequest request) {
        return workspaceLock.runAdmin("feature edit", () -> {
            ProductDataset dataset = getProduct(request.getProduct());
            Feature feature = TaxonomyAdminService.requireFeature(dataset, request.getFeatureIndex());
            String title = request.getTitle() != null
                    ? TaxonomyAdminService.requireName(request.getTitle(), "title")
                    : feature.getTitle();
            String time = request.getTime() != null ? FeatureTime.normalizeDate(request.getTime()) : feature.getTime();
            requireUniqueIdentity(dataset.getFeatures(), feature, title, time);

            feature.setTitle(title);
            feature.setTime(time);
            if (request.getDescription() != null) {
                feature.setDescription(request.getDescription().trim());
            }
            productDatasetRepository.save(dataset);
            return FeatureView.of(dataset.getName(), request.getFeatureIndex(), feature);
        });
    }

    public FeatureView deleteFeature(FeatureRefRequest request) {
        return workspaceLock.runAdmin("feature delete", () -> {
            ProductDataset dataset = getProduct(request.getProduct());
            Feature feature = TaxonomyAdminService.requireFeature(dataset, request.getFeatureIndex());
            dataset.getFeatures().remove(request.getFeatureIndex().intValue());
            productDatasetRepository.save(dataset);
            log.info("[ADMIN] Deleted '{}' from {}", feature.getTitle(), dataset.getName());
            return FeatureView.of(dataset.getName(), request.getFeatureIndex(), feature);
        });
    }

    /**
     * Replaces the tags of a feature. Every name must already exist in the taxonomy (matched fuzzily and stored
     * under its registered spelling). An empty list puts the feature back in the tagging queue.
     */
    public FeatureView updateTags(UpdateTagsRequest request) {
        return workspaceLock.runAdmin("tag update", () -> {
            ProductDataset dataset = getProduct(request.getProduct());
            Feature feature = TaxonomyAdminService.requireFeature(dataset, request.getFeatureIndex());
            TaxonomyIndex index = taxonomyService.openIndex();

            List<TagAssignment> validated = new ArrayList<>();
            for (TagAssignment assignment : request.getTags() != null ? request.getTags() : List.<TagAssignment>of()) {
                String primary = index.resolvePrimary(assignment.getName())
                        .orElseThrow(() -> new IllegalArgumentException("Unknown primary tag: " + assignment.getName()));
                TagAssignment canonical = new TagAssignment(primary, new ArrayList<>());
                for (SubtagRef ref : assignment.subtagsOrEmpty()) {
                    String subtag = index.resolveSubtagUnderPrimary(primary, ref.getName())
                            .orElseThrow(() -> new IllegalArgumentException(
                                    "Subtag '" + ref.getName() + "' is not under '" + primary + "'"));
                    canonical.addSubtagIfAbsent(subtag);
                }
                validated.add(canonical);
            }

            List<TagAssignment> coalesced = TagAssignments.coalesce(validated);
            if (coalesced.isEmpty()) {
                feature.resetToPending();
            } else {
                feature.markTagged(coalesced);
            }
            productDatasetRepository.save(dataset);
            return FeatureView.of(dataset.getName(), request.getFeatureIndex(), feature);
        });
    }

    /**
     * Rejects a title and time whose identity is already taken by a feature other than {@code self}.
     */
    private static void requireUniqueIdentity(List<Feature> features, Feature self, String title, String time) {
        FeatureKey key = FeatureKey.of(title, time);
        boolean duplicate = features.stream().anyMatch(f -> f != self && FeatureKey.of(f).equals(key));
        if (duplicate) {
            throw new IllegalArgumentException("Feature '" + title + "' at " + time + " already exists");
        }
    }

    private static List<Feature> requireFeatures(ProductDataset dataset) {
        if (dataset.getFeatures() == null) {
            dataset.setFeatures(new ArrayList<>());
        }
        return dataset.getFeatures();
    }

    private static boolean matchesText(Feature feature, String text) {
        if (text.isEmpty()) {
            return true;
        }
        return contains(feature.getTitle(), text) || contains(feature.getDescription(), text);
    }

    private static boolean contains(String value, String lowerText) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(lowerText);
    }

    private static boolean matchesTag(Feature feature, String tag) {
        if (tag == null || tag.isBlank()) {
            return true;
        }
        for (TagAssignment assignment : feature.tagsOrEmpty()) {
            if (NameNormalizer.sameName(assignment.getName(), tag)) {
                return true;
            }
            for (SubtagRef ref : assignment.subtagsOrEmpty()) {
                if (NameNormalizer.sameName(ref.getName(), tag)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static ProductSummary toSummary(ProductDataset dataset) {
        List<Feature> features = dataset.getFeatures() != null ? dataset.getFeatures() : List.of();
        int untagged = 0;
        int notApplicable = 0;
        int tagged = 0;
        for (Feature feature : features) {
            TagStatus status = feature.effectiveStatus();
            if (status == TagStatus.TAGGED) {
                tagged++;
            } else if (status == TagStatus.NOT_APPLICABLE) {
                notApplicable++;
            } else {
                untagged++;
            }
        }
        return ProductSummary.builder()
                .name(dataset.getName())
                .url(dataset.getUrl())
                .self(dataset.isSelf())
                .featureCount(features.size())
                .untagged(untagged)
                .notApplicable(notApplicable)
                .tagged(tagged)
                .latestDate(FeatureTime.latest(features.stream().map(Feature::getTime).toList()).orElse(null))
                .updatedAt(dataset.getUpdatedAt())
                .build();
    }
}
