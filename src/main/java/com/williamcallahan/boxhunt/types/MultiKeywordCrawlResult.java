package com.williamcallahan.boxhunt.types;

import java.util.List;

/**
 * Totals across a sequential multi-keyword run, with the per-keyword breakdown and any errors
 */
public record MultiKeywordCrawlResult(int keywordsProcessed, int totalFound, int totalProcessed, int totalSaved,
                                      List<KeywordCrawlResult> results, List<String> errors) {

    public static MultiKeywordCrawlResult from(List<KeywordCrawlResult> results, List<String> errors) {
        int found = results.stream().mapToInt(KeywordCrawlResult::found).sum();
        int processed = results.stream().mapToInt(KeywordCrawlResult::processed).sum();
        int saved = results.stream().mapToInt(KeywordCrawlResult::saved).sum();
        return new MultiKeywordCrawlResult(results.size(), found, processed, saved, List.copyOf(results), List.copyOf(errors));
    }
}
