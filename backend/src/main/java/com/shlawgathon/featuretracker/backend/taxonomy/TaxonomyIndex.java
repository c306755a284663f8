package com.shlawgathon.featuretracker.backend.taxonomy;

import com.shlawgathon.featuretracker.backend.exception.ResourceNotFoundException;
import com.shlawgathon.featuretracker.backend.exception.TaxonomyConflictException;
import com.shlawgathon.featuretracker.backend.model.PrimaryTag;
import com.shlawgathon.featuretracker.backend.model.Subtag;
import com.shlawgathon.featuretracker.backend.model.Taxonomy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory view of a {@link Taxonomy} document with O(1) exact and fuzzy lookups.
 * <p>
 * The index owns the document it wraps: every mutation goes through this class and is applied to the
 * document and to the lookup maps together. Not thread-safe; one index is built per batch or admin operation.
 * <p>
 * Lookup maps:
 * <ul>
 *   <li>primary name and normalized key to the registered primary name</li>
 *   <li>per primary, normalized subtag key to the registered subtag name</li>
 *   <li>global normalized subtag key to the registered subtag name (reverse index companion)</li>
 * </ul>
 */
public class TaxonomyIndex {

    private static final Logger log = LoggerFactory.getLogger(TaxonomyIndex.class);

    private final Taxonomy taxonomy;

    private final Map<String, PrimaryTag> primariesByName = new LinkedHashMap<>();
    private final Map<String, String> primaryNamesByKey = new HashMap<>();
    private final Map<String, Map<String, String>> subtagKeysByPrimary = new HashMap<>();
    private final Map<String, String> subtagNamesByKey = new HashMap<>();

    private int mutationCount;
    private int repairCount;

    public TaxonomyIndex(Taxonomy taxonomy) {
        this.taxonomy = taxonomy != null ? taxonomy : Taxonomy.empty();
        rebuild();
    }

    public Taxonomy getTaxonomy() {
        return taxonomy;
    }

    /**
     * Number of successful mutations since this index was built. Load-time repairs are not counted.
     */
    public int mutationCount() {
        return mutationCount;
    }

    public int repairCount() {
        return repairCount;
    }

    // ==================== Lookups ====================

    public Optional<String> resolvePrimary(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        if (primariesByName.containsKey(name)) {
            return Optional.of(name);
        }
        return Optional.ofNullable(primaryNamesByKey.get(NameNormalizer.normalize(name)));
    }

    public Optional<String> resolveSubtagUnderPrimary(String primaryName, String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        Map<String, String> local = subtagKeysByPrimary.get(primaryName);
        if (local == null) {
            return Optional.empty();
        }
        if (primaryName.equals(taxonomy.subtagToPrimaryOrEmpty().get(name))) {
            return Optional.of(name);
        }
        return Optional.ofNullable(local.get(NameNormalizer.normalize(name)));
    }

    /**
     * Resolves a subtag name against the global reverse index, exact match first.
     */
    public Optional<String> resolveSubtag(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        if (taxonomy.subtagToPrimaryOrEmpty().containsKey(name)) {
            return Optional.of(name);
        }
        return Optional.ofNullable(subtagNamesByKey.get(NameNormalizer.normalize(name)));
    }

    public Optional<String> ownerOf(String subtagName) {
        return Optional.ofNullable(taxonomy.subtagToPrimaryOrEmpty().get(subtagName));
    }

    public boolean isPrimaryName(String name) {
        return resolvePrimary(name).isPresent();
    }

    public boolean hasPrimary(String exactName) {
        return primariesByName.containsKey(exactName);
    }

    public boolean hasSubtag(String exactName) {
        return taxonomy.subtagToPrimaryOrEmpty().containsKey(exactName);
    }

    public Collection<String> primaryNames() {
        return List.copyOf(primariesByName.keySet());
    }

    public List<String> subtagNames(String primaryName) {
        PrimaryTag primary = primariesByName.get(primaryName);
        if (primary == null) {
            return List.of();
        }
        return primary.subtagsOrEmpty().stream().map(Subtag::getName).toList();
    }

    // ==================== Growth ====================

    /**
     * Registers a new subtag under an existing primary.
     *
     * @return the registered name; the existing name when an equivalent subtag is already under {@code primaryName}
     * @throws SubtagCollisionException when an equivalent subtag belongs to a different primary
     */
    public String registerNewSubtag(String primaryName, String subtagName) {
        PrimaryTag primary = requirePrimary(primaryName);
        String name = requireName(subtagName, "Subtag name");

        if (isPrimaryName(name)) {
            throw new TaxonomyConflictException("Subtag '" + name + "' collides with a primary tag name");
        }

        Optional<String> existing = resolveSubtag(name);
        if (existing.isPresent()) {
            String owner = taxonomy.subtagToPrimaryOrEmpty().get(existing.get());
            if (primaryName.equals(owner)) {
                return existing.get();
            }
            throw new SubtagCollisionException(name, existing.get(), owner, primaryName);
        }

        primary.subtagsOrEmpty().add(new Subtag(name, name));
        taxonomy.subtagToPrimaryOrEmpty().put(name, primaryName);
        indexSubtag(primaryName, name);
        mutationCount++;
        log.info("[TAXONOMY] Registered subtag '{}' under '{}'", name, primaryName);
        return name;
    }

    /**
     * Registers a primary tag that does not exist yet, optionally with initial subtags.
     */
    public PrimaryTag registerNewPrimary(String name, String description, List<String> initialSubtags) {
        String primaryName = requireName(name, "Primary tag name");
        resolvePrimary(primaryName).ifPresent(existing -> {
            throw new TaxonomyConflictException("Primary tag '" + existing + "' already exists");
        });
        resolveSubtag(primaryName).ifPresent(existing -> {
            throw new TaxonomyConflictException("'" + primaryName + "' is already a subtag name ('" + existing + "')");
        });

        PrimaryTag primary = PrimaryTag.builder()
                .name(primaryName)
                .description(description != null ? description : primaryName)
                .build();
        taxonomy.primaryTagsOrEmpty().add(primary);
        indexPrimary(primary);
        mutationCount++;
        log.info("[TAXONOMY] Registered primary tag '{}'", primaryName);

        if (initialSubtags != null) {
            for (String subtag : initialSubtags) {
                registerNewSubtag(primaryName, subtag);
            }
        }
        return primary;
    }

    /**
     * Returns the registered name of {@code name}, registering it as a new primary when absent.
     */
    public String ensurePrimary(String name, String description) {
        return resolvePrimary(name)
                .orElseGet(() -> registerNewPrimary(name, description, List.of()).getName());
    }

    // ==================== Admin mutations (exact names, validated by the caller) ====================

    public void renamePrimary(String oldName, String newName) {
        PrimaryTag primary = requirePrimary(oldName);
        primary.setName(newName);
        repointOwner(oldName, newName);
        mutated("Renamed primary '{}' to '{}'", oldName, newName);
    }

    /**
     * Moves every subtag of {@code oldName} under {@code targetName} (dedup by name) and deletes {@code oldName}.
     */
    public void mergePrimary(String oldName, String targetName) {
        PrimaryTag source = requirePrimary(oldName);
        PrimaryTag target = requirePrimary(targetName);

        for (Subtag subtag : source.subtagsOrEmpty()) {
            boolean present = target.subtagsOrEmpty().stream()
                    .anyMatch(s -> s.getName().equals(subtag.getName()));
            if (!present) {
                target.subtagsOrEmpty().add(subtag);
            }
        }
        taxonomy.primaryTagsOrEmpty().remove(source);
        repointOwner(oldName, targetName);
        mutated("Merged primary '{}' into '{}'", oldName, targetName);
    }

    public void renameSubtag(String oldName, String newName) {
        String owner = requireOwner(oldName);
        Subtag subtag = findSubtag(owner, oldName);
        subtag.setName(newName);
        if (oldName.equals(subtag.getDescription())) {
            subtag.setDescription(newName);
        }
        Map<String, String> reverse = taxonomy.subtagToPrimaryOrEmpty();
        reverse.remove(oldName);
        reverse.put(newName, owner);
        mutated("Renamed subtag '{}' to '{}'", oldName, newName);
    }

    /**
     * Deletes {@code oldName}; the surviving subtag {@code targetName} is left as it is.
     */
    public void mergeSubtag(String oldName, String targetName) {
        String owner = requireOwner(oldName);
        requireOwner(targetName);
        requirePrimary(owner).subtagsOrEmpty().removeIf(s -> s.getName().equals(oldName));
        taxonomy.subtagToPrimaryOrEmpty().remove(oldName);
        mutated("Merged subtag '{}' into '{}'", oldName, targetName);
    }

    public void moveSubtag(String subtagName, String targetPrimary) {
        String owner = requireOwner(subtagName);
        PrimaryTag target = requirePrimary(targetPrimary);
        Subtag subtag = findSubtag(owner, subtagName);

        requirePrimary(owner).subtagsOrEmpty().remove(subtag);
        target.subtagsOrEmpty().add(subtag);
        taxonomy.subtagToPrimaryOrEmpty().put(subtagName, targetPrimary);
        mutated("Moved subtag '{}' from '{}' to '{}'", subtagName, owner, targetPrimary);
    }

    // ==================== Internals ====================

    private void rebuild() {
        primariesByName.clear();
        primaryNamesByKey.clear();
        subtagKeysByPrimary.clear();
        subtagNamesByKey.clear();

        for (PrimaryTag primary : taxonomy.primaryTagsOrEmpty()) {
            if (primariesByName.containsKey(primary.getName())) {
                log.warn("[TAXONOMY] Duplicate primary tag '{}' ignored by the index", primary.getName());
                continue;
            }
            indexPrimary(primary);
        }

        Map<String, String> reverse = taxonomy.subtagToPrimaryOrEmpty();

        // Listed subtags are the source of truth, the reverse index follows them
        Map<String, String> listed = new LinkedHashMap<>();
        for (PrimaryTag primary : primariesByName.values()) {
            for (Subtag subtag : primary.subtagsOrEmpty()) {
                String previous = listed.putIfAbsent(subtag.getName(), primary.getName());
                if (previous != null && !previous.equals(primary.getName())) {
                    log.warn("[TAXONOMY] Subtag '{}' listed under both '{}' and '{}', keeping '{}'",
                            subtag.getName(), previous, primary.getName(), previous);
                }
            }
        }

        Iterator<Map.Entry<String, String>> it = reverse.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, String> entry = it.next();
            String owner = listed.get(entry.getKey());
            if (owner == null) {
                log.warn("[TAXONOMY] Dropping stale reverse index entry '{}' -> '{}'", entry.getKey(), entry.getValue());
                it.remove();
                repairCount++;
            } else if (!owner.equals(entry.getValue())) {
                log.warn("[TAXONOMY] Repointing reverse index entry '{}' from '{}' to '{}'",
                        entry.getKey(), entry.getValue(), owner);
                entry.setValue(owner);
                repairCount++;
            }
        }
        for (Map.Entry<String, String> entry : listed.entrySet()) {
            if (!reverse.containsKey(entry.getKey())) {
                reverse.put(entry.getKey(), entry.getValue());
                repairCount++;
            }
            indexSubtag(entry.getValue(), entry.getKey());
        }
    }

    private void indexPrimary(PrimaryTag primary) {
        primariesByName.put(primary.getName(), primary);
        primaryNamesByKey.putIfAbsent(NameNormalizer.normalize(primary.getName()), primary.getName());
        subtagKeysByPrimary.computeIfAbsent(primary.getName(), k -> new HashMap<>());
    }

    private void indexSubtag(String primaryName, String subtagName) {
        String key = NameNormalizer.normalize(subtagName);
        subtagKeysByPrimary.computeIfAbsent(primaryName, k -> new HashMap<>()).putIfAbsent(key, subtagName);
        subtagNamesByKey.putIfAbsent(key, subtagName);
    }

    private void repointOwner(String oldOwner, String newOwner) {
        for (Map.Entry<String, String> entry : taxonomy.subtagToPrimaryOrEmpty().entrySet()) {
            if (oldOwner.equals(entry.getValue())) {
                entry.setValue(newOwner);
            }
        }
    }

    private void mutated(String message, Object... args) {
        rebuild();
        mutationCount++;
        log.info("[TAXONOMY] " + message, args);
    }

    private PrimaryTag requirePrimary(String name) {
        PrimaryTag primary = primariesByName.get(name);
        if (primary == null) {
            throw new ResourceNotFoundException("Primary tag not found: " + name);
        }
        return primary;
    }

    private String requireOwner(String subtagName) {
        String owner = taxonomy.subtagToPrimaryOrEmpty().get(subtagName);
        if (owner == null) {
            throw new ResourceNotFoundException("Subtag not found: " + subtagName);
        }
        return owner;
    }

    private Subtag findSubtag(String primaryName, String subtagName) {
        return requirePrimary(primaryName).subtagsOrEmpty().stream()
                .filter(s -> s.getName().equals(subtagName))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Subtag not found: " + subtagName));
    }

    private static String requireName(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(what + " must not be blank");
        }
        return name.trim();
    }

    /**
     * Flat copy of the reverse index, for callers that must not mutate it.
     */
    public Map<String, String> reverseIndexSnapshot() {
        return new LinkedHashMap<>(taxonomy.subtagToPrimaryOrEmpty());
    }

    /**
     * Names of all registered subtags in listing order.
     */
    public List<String> allSubtagNames() {
        List<String> names = new ArrayList<>();
        for (PrimaryTag primary : primariesByName.values()) {
            for (Subtag subtag : primary.subtagsOrEmpty()) {
                names.add(subtag.getName());
            }
        }
        return names;
    }
}
