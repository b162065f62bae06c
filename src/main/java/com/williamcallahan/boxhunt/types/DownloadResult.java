package com.williamcallahan.boxhunt.types;

/**
 * Outcome of a single image download
 *
 * @param url requested URL
 * @param status SUCCESS or the failure kind
 * @param bytes body, empty unless status is SUCCESS
 * @param detail short reason for logs, empty on success
 */
public record DownloadResult(String url, ImageAttemptStatus status, byte[] bytes, String detail) {

    private static final byte[] NO_BYTES = new byte[0];

    public static DownloadResult success(String url, byte[] bytes) {
        return new DownloadResult(url, ImageAttemptStatus.SUCCESS, bytes, "");
    }

    public static DownloadResult failure(String url, ImageAttemptStatus status, String detail) {
        return new DownloadResult(url, status, NO_BYTES, detail == null ? "" : detail);
    }

    public boolean isSuccess() {
        return status == ImageAttemptStatus.SUCCESS;
    }
}
