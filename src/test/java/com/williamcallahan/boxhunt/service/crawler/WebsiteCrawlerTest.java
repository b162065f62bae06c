package com.williamcallahan.boxhunt.service.crawler;

import com.williamcallahan.boxhunt.config.HarvestProperties;
import com.williamcallahan.boxhunt.model.Candidate;
import com.williamcallahan.boxhunt.types.SourceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebsiteCrawlerTest {

    private static final String SEED = "https://example.test/gallery";
    private static final CrawlOptions ONE_LEVEL = new CrawlOptions(1, true, Duration.ZERO);

    private PageFetcher fetcher;
    private RobotsRulesCache robots;
    private WebsiteCrawler crawler;

    @BeforeEach
    void setUp() {
        fetcher = mock(PageFetcher.class);
        robots = mock(RobotsRulesCache.class);
        when(robots.isAllowed(anyString())).thenReturn(true);
        HarvestProperties properties = new HarvestProperties();
        properties.getHttp().setRequestDelay(Duration.ZERO);
        crawler = new WebsiteCrawler(fetcher, robots, new HtmlCharsetDecoder(), new ImageReferenceExtractor(), properties);

        servePage(SEED, """
            <html><body>
              <a href="/page-a">A</a>
              <a href="/page-b">B</a>
              <a href="https://elsewhere.test/boxes">external</a>
            </body></html>
            """);
        servePage("https://example.test/page-a", """
            <html><body>
              <img src="/images/a1.jpg"><img src="/images/a2.jpg"><img src="/images/shared.jpg">
              <a href="/page-c">deeper</a>
            </body></html>
            """);
        servePage("https://example.test/page-b", """
            <html><body>
              <img src="/images/b1.jpg"><img src="/images/shared.jpg"><img src="/images/b2.jpg">
            </body></html>
            """);
    }

    private void servePage(String url, String html) {
        when(fetcher.fetch(eq(url), any(Duration.class))).thenReturn(Mono.just(
            new FetchedPage(url, 200, "text/html; charset=UTF-8", html.getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void crawlsBreadthFirstOnSameSiteAndDeduplicatesCandidates() {
        List<Candidate> candidates = crawler.crawlBlocking(SEED, 100, ONE_LEVEL);

        assertThat(candidates).extracting(Candidate::url).containsExactly(
            "https://example.test/images/a1.jpg",
            "https://example.test/images/a2.jpg",
            "https://example.test/images/shared.jpg",
            "https://example.test/images/b1.jpg",
            "https://example.test/images/b2.jpg");
        assertThat(candidates).allSatisfy(candidate -> assertThat(candidate.source()).isEqualTo("example"));
        verify(fetcher, times(3)).fetch(anyString(), any(Duration.class));
        verify(fetcher, never()).fetch(eq("https://elsewhere.test/boxes"), any(Duration.class));
        verify(fetcher, never()).fetch(eq("https://example.test/page-c"), any(Duration.class));
    }

    @Test
    void depthZeroFetchesOnlyTheSeed() {
        List<Candidate> candidates = crawler.crawlBlocking(SEED, 100, ONE_LEVEL.withMaxDepth(0));

        assertThat(candidates).isEmpty();
        verify(fetcher, times(1)).fetch(anyString(), any(Duration.class));
    }

    @Test
    void stopsOnceEnoughImagesAreCollected() {
        List<Candidate> candidates = crawler.crawlBlocking(SEED, 2, ONE_LEVEL);

        assertThat(candidates).hasSize(2);
        verify(fetcher, never()).fetch(eq("https://example.test/page-b"), any(Duration.class));
    }

    @Test
    void robotsDisallowedPagesAreNotFetched() {
        when(robots.isAllowed("https://example.test/page-a")).thenReturn(false);

        List<Candidate> candidates = crawler.crawlBlocking(SEED, 100, ONE_LEVEL);

        assertThat(candidates).extracting(Candidate::url).containsExactly(
            "https://example.test/images/b1.jpg",
            "https://example.test/images/shared.jpg",
            "https://example.test/images/b2.jpg");
        verify(fetcher, never()).fetch(eq("https://example.test/page-a"), any(Duration.class));
    }

    @Test
    void robotsAreIgnoredWhenDisabled() {
        when(robots.isAllowed(anyString())).thenReturn(false);

        List<Candidate> candidates = crawler.crawlBlocking(SEED, 100, ONE_LEVEL.withRespectRobots(false));

        assertThat(candidates).hasSize(5);
        verify(robots, never()).isAllowed(anyString());
    }

    @Test
    void failingPagesAreSkipped() {
        when(fetcher.fetch(eq("https://example.test/page-a"), any(Duration.class)))
            .thenReturn(Mono.error(new IllegalStateException("connection reset")));
        when(fetcher.fetch(eq("https://example.test/page-b"), any(Duration.class)))
            .thenReturn(Mono.just(new FetchedPage("https://example.test/page-b", 500, "text/html", new byte[0])));

        List<Candidate> candidates = crawler.crawlBlocking(SEED, 100, ONE_LEVEL);

        assertThat(candidates).isEmpty();
        verify(fetcher, times(3)).fetch(anyString(), any(Duration.class));
    }

    @Test
    void invalidSeedYieldsNothing() {
        StepVerifier.create(crawler.crawl("ftp://example.test/", 10, ONE_LEVEL))
            .assertNext(candidates -> assertThat(candidates).isEmpty())
            .verifyComplete();
        verify(fetcher, never()).fetch(anyString(), any(Duration.class));
    }

    @Test
    void actsAsWebsiteSourceClient() {
        StepVerifier.create(crawler.search(SEED, 1))
            .assertNext(candidates -> assertThat(candidates).hasSize(1))
            .verifyComplete();
        assertThat(crawler.name()).isEqualTo(WebsiteCrawler.NAME);
        assertThat(crawler.type()).isEqualTo(SourceType.WEBSITE);
    }
}
