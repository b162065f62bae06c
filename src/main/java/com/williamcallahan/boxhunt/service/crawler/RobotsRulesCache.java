/**
 * Per-site robots.txt rules with lazy fetching
 *
 * @author William Callahan
 *
 * Features:
 * - One robots.txt fetch per scheme, host and port, cached with Caffeine
 * - Parses with crawler-commons for the boxhunt agent
 * - Absent, unreachable or non-200 robots.txt means everything is allowed
 */
package com.williamcallahan.boxhunt.service.crawler;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.boxhunt.config.HarvestProperties;
import com.williamcallahan.boxhunt.util.UrlUtils;
import crawlercommons.robots.BaseRobotRules;
import crawlercommons.robots.SimpleRobotRules;
import crawlercommons.robots.SimpleRobotRulesParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Component
@Slf4j
public class RobotsRulesCache {

    static final String ROBOT_NAME = "boxhunt";
    private static final int MAX_CACHED_SITES = 500;

    private final PageFetcher pageFetcher;
    private final Duration robotsTimeout;
    private final SimpleRobotRulesParser parser = new SimpleRobotRulesParser();
    private final Cache<String, BaseRobotRules> rulesByOrigin;

    public RobotsRulesCache(PageFetcher pageFetcher, HarvestProperties properties) {
        this.pageFetcher = pageFetcher;
        this.robotsTimeout = properties.getHttp().getRobotsTimeout();
        this.rulesByOrigin = Caffeine.newBuilder()
            .maximumSize(MAX_CACHED_SITES)
            .expireAfterWrite(24, TimeUnit.HOURS)
            .build();
    }

    /**
     * Blocks on the first call for a site while its robots.txt is fetched
     */
    public boolean isAllowed(String url) {
        String origin = UrlUtils.origin(url);
        if (origin == null) {
            return true;
        }
        return rulesByOrigin.get(origin, this::loadRules).isAllowed(url);
    }

    private BaseRobotRules loadRules(String origin) {
        String robotsUrl = origin + "/robots.txt";
        try {
            FetchedPage page = pageFetcher.fetch(robotsUrl, robotsTimeout).block();
            if (page == null || !page.isOk()) {
                log.debug("No usable robots.txt at {} (status {}); allowing all", robotsUrl, page == null ? "none" : page.status());
                return allowAll();
            }
            String contentType = page.contentType().isBlank() ? "text/plain" : page.contentType();
            BaseRobotRules rules = parser.parseContent(robotsUrl, page.body(), contentType, List.of(ROBOT_NAME));
            log.info("Loaded robots.txt for {}", origin);
            return rules;
        } catch (RuntimeException e) {
            log.warn("Could not fetch robots.txt at {}: {}; allowing all", robotsUrl, e.getMessage());
            return allowAll();
        }
    }

    private static BaseRobotRules allowAll() {
        return new SimpleRobotRules(SimpleRobotRules.RobotRulesMode.ALLOW_ALL);
    }
}
