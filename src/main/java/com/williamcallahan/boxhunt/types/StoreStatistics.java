package com.williamcallahan.boxhunt.types;

import java.util.Map;

/**
 * Aggregates over one metadata store
 *
 * @param totalImages number of records
 * @param totalSize sum of file_size in bytes
 * @param sources record count per source tag
 * @param avgWidth mean width, truncated
 * @param avgHeight mean height, truncated
 * @param fileFormats record count per filename extension
 */
public record StoreStatistics(long totalImages, long totalSize, Map<String, Long> sources,
                              int avgWidth, int avgHeight, Map<String, Long> fileFormats) {

    public static StoreStatistics empty() {
        return new StoreStatistics(0L, 0L, Map.of(), 0, 0, Map.of());
    }
}
