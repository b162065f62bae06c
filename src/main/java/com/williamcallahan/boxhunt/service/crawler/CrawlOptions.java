package com.williamcallahan.boxhunt.service.crawler;

import com.williamcallahan.boxhunt.config.HarvestProperties;

import java.time.Duration;

/**
 * Per-crawl settings
 *
 * @param maxDepth deepest frontier depth that is fetched; the seed is depth 0
 * @param respectRobots consult robots.txt before every page fetch
 * @param delay pause after each page fetch
 */
public record CrawlOptions(int maxDepth, boolean respectRobots, Duration delay) {

    public CrawlOptions {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0, got " + maxDepth);
        }
        delay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
    }

    public static CrawlOptions defaults(HarvestProperties properties) {
        return new CrawlOptions(properties.getCrawler().getMaxDepth(),
            properties.getCrawler().isRespectRobots(),
            properties.getHttp().getRequestDelay());
    }

    public CrawlOptions withMaxDepth(int newMaxDepth) {
        return new CrawlOptions(newMaxDepth, respectRobots, delay);
    }

    public CrawlOptions withRespectRobots(boolean newRespectRobots) {
        return new CrawlOptions(maxDepth, newRespectRobots, delay);
    }
}
