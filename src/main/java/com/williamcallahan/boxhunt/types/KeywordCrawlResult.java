package com.williamcallahan.boxhunt.types;

/**
 * Counts for one keyword: candidates found, records produced by the processor, records saved
 */
public record KeywordCrawlResult(String keyword, int found, int processed, int saved) {
}
