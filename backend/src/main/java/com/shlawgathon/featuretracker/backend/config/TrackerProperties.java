package com.shlawgathon.featuretracker.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Products tracked by the monitor.
 *
 * @param products tracked products, in display order
 */
@ConfigurationProperties(prefix = "tracker")
public record TrackerProperties(List<Product> products) {

    public TrackerProperties {
        products = products != null ? List.copyOf(products) : List.of();
    }

    /**
     * @param name changelog owner, also the product document id
     * @param url  public changelog page
     * @param self true for our own product, whose changelog is submitted by an admin as markdown
     */
    public record Product(String name, String url, boolean self) {}
}
