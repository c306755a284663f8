package com.shlawgathon.featuretracker.backend.crawler;

/**
 * A crawl could not produce a result (network error, missing source, broken page).
 */
public class CrawlException extends Exception {

    public CrawlException(String message) {
        super(message);
    }

    public CrawlException(String message, Throwable cause) {
        super(message, cause);
    }
}
