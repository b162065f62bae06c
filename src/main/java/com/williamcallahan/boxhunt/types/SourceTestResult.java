package com.williamcallahan.boxhunt.types;

import java.util.List;

/**
 * Outcome of probing one source with a small query
 *
 * @param source source name
 * @param working true when the test query returned at least one candidate
 * @param resultCount number of candidates returned
 * @param sampleUrls up to three candidate URLs
 * @param error failure message, empty when none
 */
public record SourceTestResult(String source, boolean working, int resultCount, List<String> sampleUrls, String error) {
}
