package com.williamcallahan.boxhunt.service.crawler;

import com.williamcallahan.boxhunt.config.HarvestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RobotsRulesCacheTest {

    private PageFetcher fetcher;
    private RobotsRulesCache cache;

    @BeforeEach
    void setUp() {
        fetcher = mock(PageFetcher.class);
        cache = new RobotsRulesCache(fetcher, new HarvestProperties());
    }

    private void serveRobots(String origin, int status, String body) {
        when(fetcher.fetch(eq(origin + "/robots.txt"), any(Duration.class))).thenReturn(Mono.just(
            new FetchedPage(origin + "/robots.txt", status, "text/plain", body.getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void appliesDisallowRulesForOurAgent() {
        serveRobots("https://example.test", 200, """
            User-agent: *
            Disallow: /private/

            User-agent: boxhunt
            Disallow: /no-boxes/
            """);

        assertThat(cache.isAllowed("https://example.test/gallery")).isTrue();
        assertThat(cache.isAllowed("https://example.test/no-boxes/page")).isFalse();
    }

    @Test
    void wildcardRulesApplyWhenNoSpecificGroup() {
        serveRobots("https://example.test", 200, """
            User-agent: *
            Disallow: /private/
            """);

        assertThat(cache.isAllowed("https://example.test/private/photos")).isFalse();
        assertThat(cache.isAllowed("https://example.test/public/photos")).isTrue();
    }

    @Test
    void fetchesRobotsOncePerOrigin() {
        serveRobots("https://example.test", 200, "User-agent: *\nDisallow: /private/\n");

        cache.isAllowed("https://example.test/a");
        cache.isAllowed("https://example.test/b");
        cache.isAllowed("https://example.test/private/c");

        verify(fetcher, times(1)).fetch(anyString(), any(Duration.class));
    }

    @Test
    void missingRobotsAllowsEverything() {
        serveRobots("https://example.test", 404, "");

        assertThat(cache.isAllowed("https://example.test/private/anything")).isTrue();
    }

    @Test
    void unreachableRobotsAllowsEverything() {
        when(fetcher.fetch(anyString(), any(Duration.class))).thenReturn(Mono.error(new IllegalStateException("timeout")));

        assertThat(cache.isAllowed("https://example.test/anything")).isTrue();
    }

    @Test
    void originsAreCachedSeparately() {
        serveRobots("https://example.test", 200, "User-agent: *\nDisallow: /\n");
        serveRobots("https://example.test:8443", 404, "");

        assertThat(cache.isAllowed("https://example.test/x")).isFalse();
        assertThat(cache.isAllowed("https://example.test:8443/x")).isTrue();
    }
}
