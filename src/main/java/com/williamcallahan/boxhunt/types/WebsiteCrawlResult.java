package com.williamcallahan.boxhunt.types;

/**
 * Counts for one website crawl
 */
public record WebsiteCrawlResult(String seedUrl, String collection, int found, int processed, int saved) {
}
