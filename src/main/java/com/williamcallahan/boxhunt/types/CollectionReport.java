package com.williamcallahan.boxhunt.types;

import java.util.List;

/**
 * Store statistics plus the in-process state of a collection
 */
public record CollectionReport(String collection, StoreStatistics store, List<String> availableSources,
                               int failedUrlsCount, int uniqueHashesCount) {
}
