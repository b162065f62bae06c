package com.williamcallahan.boxhunt.util;

import org.slf4j.Logger;

/**
 * Centralized logging for outbound calls to keyword search providers and crawled sites.
 * <p>
 * Every line carries the {@code [EXTERNAL-API]} prefix so a run's network activity
 * can be grepped out of boxhunt.log.
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log an external API call attempt
     */
    public static void logApiCallAttempt(Logger log, String apiName, String operation, String query, boolean authenticated) {
        String authType = authenticated ? "AUTHENTICATED" : "UNAUTHENTICATED";
        log.info("{} [{}] {} ATTEMPT: {} for query='{}'", PREFIX, apiName, authType, operation, query);
    }

    /**
     * Log an external API call success
     */
    public static void logApiCallSuccess(Logger log, String apiName, String operation, String query, int resultCount) {
        log.info("{} [{}] SUCCESS: {} returned {} result(s) for query='{}'", PREFIX, apiName, operation, resultCount, query);
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String operation, String query, String reason) {
        log.warn("{} [{}] FAILURE: {} failed for query='{}' - {}", PREFIX, apiName, operation, query, reason);
    }

    /**
     * Log a call skipped because no credential is configured
     */
    public static void logMissingCredential(Logger log, String apiName, String query) {
        log.warn("{} [{}] SKIPPED: no API key configured, returning no results for query='{}'", PREFIX, apiName, query);
    }

    /**
     * Log HTTP response details
     */
    public static void logHttpResponse(Logger log, int statusCode, String url, int bodySize) {
        log.debug("{} [HTTP] Response: status={}, url={}, bodySize={} bytes", PREFIX, statusCode, url, bodySize);
    }
}
