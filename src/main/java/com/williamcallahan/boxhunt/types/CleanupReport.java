package com.williamcallahan.boxhunt.types;

/**
 * What a cleanup pass removed
 */
public record CleanupReport(int orphanedFilesRemoved, int failedUrlsCleared) {
}
