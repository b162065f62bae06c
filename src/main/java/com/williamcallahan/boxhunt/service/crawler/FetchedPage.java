package com.williamcallahan.boxhunt.service.crawler;

/**
 * Raw HTTP response for a crawled resource
 *
 * @param url requested URL
 * @param status HTTP status code
 * @param contentType Content-Type header, empty when absent
 * @param body response bytes; empty for non-200 responses
 */
public record FetchedPage(String url, int status, String contentType, byte[] body) {

    public boolean isOk() {
        return status == 200;
    }

    public boolean isHtml() {
        if (contentType == null || contentType.isBlank()) {
            return true;
        }
        String lower = contentType.toLowerCase(java.util.Locale.ROOT);
        return lower.contains("html") || lower.contains("xml");
    }
}
