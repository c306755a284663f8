package com.shlawgathon.featuretracker.backend.taxonomy;

import com.shlawgathon.featuretracker.backend.exception.TaxonomyConflictException;
import com.shlawgathon.featuretracker.backend.model.TagAssignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw subtag proposals from the classification oracle into validated {@link TagAssignment}s.
 * <p>
 * Proposals are matched against the global subtag index (case and spacing insensitive). Names equal to a
 * primary tag, or to the catch-all primary even before it exists, are dropped. Unknown names grow the
 * taxonomy: they are registered under the hinted primary when it exists, otherwise under the catch-all primary.
 * A proposal that would break the taxonomy is dropped, never thrown.
 */
public class TagResolver {

    private static final Logger log = LoggerFactory.getLogger(TagResolver.class);

    public static final String DEFAULT_FALLBACK_PRIMARY = "Others";
    static final String FALLBACK_DESCRIPTION = "Uncategorized subtags awaiting review";

    private final TaxonomyIndex index;
    private final String fallbackPrimary;

    public TagResolver(TaxonomyIndex index) {
        this(index, DEFAULT_FALLBACK_PRIMARY);
    }

    public TagResolver(TaxonomyIndex index, String fallbackPrimary) {
        this.index = index;
        this.fallbackPrimary = fallbackPrimary;
    }

    public TaxonomyIndex getIndex() {
        return index;
    }

    public TagResolution resolve(List<String> proposedNames, String defaultPrimaryHint) {
        Map<String, TagAssignment> byPrimary = new LinkedHashMap<>();
        List<String> dropped = new ArrayList<>();
        List<String> created = new ArrayList<>();

        if (proposedNames == null) {
            return new TagResolution(List.of(), dropped, created);
        }

        for (String proposed : proposedNames) {
            if (proposed == null || proposed.isBlank()) {
                dropped.add(proposed == null ? "" : proposed);
                continue;
            }
            String name = proposed.trim();

            if (index.isPrimaryName(name) || NameNormalizer.sameName(name, fallbackPrimary)) {
                log.debug("[RESOLVER] Ignoring primary tag name proposed as subtag: {}", name);
                dropped.add(name);
                continue;
            }

            String subtag;
            String primary;
            var known = index.resolveSubtag(name);
            if (known.isPresent()) {
                subtag = known.get();
                primary = index.ownerOf(subtag).orElseThrow();
            } else {
                try {
                    primary = targetPrimaryFor(defaultPrimaryHint);
                    subtag = index.registerNewSubtag(primary, name);
                    created.add(subtag);
                } catch (SubtagCollisionException e) {
                    subtag = e.getExistingName();
                    primary = e.getExistingPrimary();
                } catch (TaxonomyConflictException e) {
                    log.info("[RESOLVER] Dropping proposal '{}': {}", name, e.getMessage());
                    dropped.add(name);
                    continue;
                }
            }

            byPrimary.computeIfAbsent(primary, p -> new TagAssignment(p, new ArrayList<>()))
                    .addSubtagIfAbsent(subtag);
        }

        return new TagResolution(new ArrayList<>(byPrimary.values()), dropped, created);
    }

    private String targetPrimaryFor(String hint) {
        if (hint != null && !hint.isBlank()) {
            var hinted = index.resolvePrimary(hint);
            if (hinted.isPresent()) {
                return hinted.get();
            }
            log.debug("[RESOLVER] Primary hint '{}' does not exist, using '{}'", hint, fallbackPrimary);
        }
        return index.ensurePrimary(fallbackPrimary, FALLBACK_DESCRIPTION);
    }
}
