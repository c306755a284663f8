package com.shlawgathon.featuretracker.backend.crawler;

import com.shlawgathon.featuretracker.backend.model.RawChangelog;
import com.shlawgathon.featuretracker.backend.repository.RawChangelogRepository;
import com.shlawgathon.featuretracker.backend.util.FeatureTime;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Crawler for products whose changelog is pasted in by an admin as markdown.
 */
@Component
public class RawChangelogCrawler implements ChangelogCrawler {

    private final RawChangelogRepository rawChangelogRepository;
    private final ChangelogMarkdownParser parser = new ChangelogMarkdownParser();

    public RawChangelogCrawler(RawChangelogRepository rawChangelogRepository) {
        this.rawChangelogRepository = rawChangelogRepository;
    }

    @Override
    public boolean supports(String productName) {
        return rawChangelogRepository.existsById(productName);
    }

    @Override
    public List<ScrapedFeature> crawl(String productName) throws CrawlException {
        RawChangelog raw = rawChangelogRepository.findById(productName)
                .orElseThrow(() -> new CrawlException("No raw changelog stored for " + productName));

        return parser.parse(raw.getContent()).stream()
                .sorted(Comparator.comparing(ScrapedFeature::time, FeatureTime.NEWEST_FIRST))
                .toList();
    }
}
