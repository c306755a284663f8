package com.shlawgathon.featuretracker.backend.service;

import com.shlawgathon.featuretracker.backend.model.Taxonomy;
import com.shlawgathon.featuretracker.backend.repository.TaxonomyRepository;
import com.shlawgathon.featuretracker.backend.taxonomy.TagResolver;
import com.shlawgathon.featuretracker.backend.taxonomy.TaxonomyIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Loads and stores the single taxonomy document.
 */
@Service
public class TaxonomyService {

    private static final Logger log = LoggerFactory.getLogger(TaxonomyService.class);

    private final TaxonomyRepository taxonomyRepository;
    private final String othersPrimary;

    public TaxonomyService(TaxonomyRepository taxonomyRepository,
            @Value("${tracker.others-primary:" + TagResolver.DEFAULT_FALLBACK_PRIMARY + "}") String othersPrimary) {
        this.taxonomyRepository = taxonomyRepository;
        this.othersPrimary = othersPrimary;
    }

    public Taxonomy load() {
        return taxonomyRepository.findById(Taxonomy.DEFAULT_ID).orElseGet(Taxonomy::empty);
    }

    /**
     * Builds a fresh index over the stored taxonomy. Reverse-index drift found while loading is repaired in memory
     * and written back with the next save.
     */
    public TaxonomyIndex openIndex() {
        TaxonomyIndex index = new TaxonomyIndex(load());
        if (index.repairCount() > 0) {
            log.warn("[TAXONOMY] Repaired {} reverse index entries while loading", index.repairCount());
        }
        return index;
    }

    public Taxonomy save(TaxonomyIndex index) {
        Taxonomy taxonomy = index.getTaxonomy();
        taxonomy.setId(Taxonomy.DEFAULT_ID);
        return taxonomyRepository.save(taxonomy);
    }

    public TagResolver newResolver(TaxonomyIndex index) {
        return new TagResolver(index, othersPrimary);
    }

    public String getOthersPrimary() {
        return othersPrimary;
    }
}
