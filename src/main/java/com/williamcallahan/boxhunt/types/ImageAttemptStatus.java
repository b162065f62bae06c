/**
 * Status codes for image download and processing attempts
 *
 * @author William Callahan
 *
 * Features:
 * - Categorizes image retrieval results
 * - Distinguishes fetch failures from content rejections
 * - Decides which outcomes are remembered in the failed-URL set
 * - Supports detailed logging of the processing pipeline
 */
package com.williamcallahan.boxhunt.types;

public enum ImageAttemptStatus {
    /**
     * Image downloaded, validated and unique
     */
    SUCCESS,

    /**
     * Attempt skipped because the URL already failed during this run
     */
    SKIPPED_FAILED_URL,

    /**
     * Non-200 HTTP response
     */
    FAILURE_HTTP_STATUS,

    /**
     * Declared or actual body size above the configured limit
     */
    FAILURE_OVERSIZED,

    /**
     * Timeout, connection failure or other transport error
     */
    FAILURE_TRANSPORT,

    /**
     * Download completed with an empty body
     */
    FAILURE_EMPTY_CONTENT,

    /**
     * Bytes could not be decoded as an image
     */
    REJECTED_UNDECODABLE,

    /**
     * Decoded image is below the minimum width or height
     */
    REJECTED_TOO_SMALL,

    /**
     * Perceptual hash within the threshold of an accepted image
     */
    REJECTED_DUPLICATE;

    /**
     * Fetch failures are cached so the URL is not retried during the run;
     * content rejections are not, since the URL itself was fetchable
     */
    public boolean marksUrlAsFailed() {
        return this == FAILURE_HTTP_STATUS || this == FAILURE_OVERSIZED
            || this == FAILURE_TRANSPORT || this == FAILURE_EMPTY_CONTENT;
    }
}
