package com.shlawgathon.featuretracker.backend.crawler;

import java.util.List;

/**
 * Source of fresh changelog entries for a product.
 * <p>
 * An empty list is treated by callers as a failed crawl, never as "the product has no features".
 */
public interface ChangelogCrawler {

    boolean supports(String productName);

    List<ScrapedFeature> crawl(String productName) throws CrawlException;
}
