/**
 * Breadth-first website crawler that collects image candidates
 *
 * @author William Callahan
 *
 * Features:
 * - FIFO frontier scoped to the seed's host, bounded by a maximum depth
 * - Optional robots.txt compliance checked before every page fetch
 * - One fetch per page feeds both image extraction and link discovery
 * - Candidates unique by URL across the whole crawl
 * - Politeness delay after every page; page failures are logged and skipped
 */
package com.williamcallahan.boxhunt.service.crawler;

import com.williamcallahan.boxhunt.config.HarvestProperties;
import com.williamcallahan.boxhunt.model.Candidate;
import com.williamcallahan.boxhunt.service.source.SourceClient;
import com.williamcallahan.boxhunt.types.SourceType;
import com.williamcallahan.boxhunt.util.UrlUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Service
@Slf4j
public class WebsiteCrawler implements SourceClient {

    public static final String NAME = "website";

    private final PageFetcher pageFetcher;
    private final RobotsRulesCache robotsRules;
    private final HtmlCharsetDecoder charsetDecoder;
    private final ImageReferenceExtractor extractor;
    private final HarvestProperties properties;

    public WebsiteCrawler(PageFetcher pageFetcher,
                          RobotsRulesCache robotsRules,
                          HtmlCharsetDecoder charsetDecoder,
                          ImageReferenceExtractor extractor,
                          HarvestProperties properties) {
        this.pageFetcher = pageFetcher;
        this.robotsRules = robotsRules;
        this.charsetDecoder = charsetDecoder;
        this.extractor = extractor;
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public SourceType type() {
        return SourceType.WEBSITE;
    }

    /**
     * Treats the query as a seed URL and crawls with the configured defaults
     */
    @Override
    public Mono<List<Candidate>> search(String query, int limit) {
        return crawl(query, limit);
    }

    public Mono<List<Candidate>> crawl(String seedUrl, int maxImages) {
        return crawl(seedUrl, maxImages, CrawlOptions.defaults(properties));
    }

    /**
     * Crawls on a bounded-elastic worker; never signals an error.
     *
     * @param seedUrl absolute http(s) URL, depth 0
     * @param maxImages stop once this many candidates are collected
     * @param options depth, robots and delay settings
     */
    public Mono<List<Candidate>> crawl(String seedUrl, int maxImages, CrawlOptions options) {
        return Mono.fromCallable(() -> crawlBlocking(seedUrl, maxImages, options))
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorResume(e -> {
                log.error("Crawl of {} aborted: {}", seedUrl, e.getMessage(), e);
                return Mono.just(List.of());
            });
    }

    List<Candidate> crawlBlocking(String seedUrl, int maxImages, CrawlOptions options) {
        if (!UrlUtils.isHttpUrl(seedUrl)) {
            log.error("Invalid seed URL '{}'; crawl not started", seedUrl);
            return List.of();
        }
        if (maxImages < 1) {
            log.error("maxImages must be positive, got {}; crawl not started", maxImages);
            return List.of();
        }
        String seed = UrlUtils.stripFragment(seedUrl.trim());
        String sourceTag = UrlUtils.domainLabel(seed);
        CrawlFrontier frontier = new CrawlFrontier(options.maxDepth());
        frontier.offer(seed, 0);

        Set<String> seenUrls = new LinkedHashSet<>();
        List<Candidate> results = new ArrayList<>();
        log.info("Starting crawl of {} (maxDepth={}, maxImages={}, robots={})",
            seed, options.maxDepth(), maxImages, options.respectRobots());

        while (!frontier.isEmpty() && results.size() < maxImages) {
            CrawlFrontier.Entry entry = frontier.poll();
            if (entry == null) {
                break;
            }
            if (options.respectRobots() && !robotsRules.isAllowed(entry.url())) {
                log.info("Disallowed by robots.txt: {}", entry.url());
                continue;
            }

            Document document = fetchDocument(entry.url());
            if (document != null) {
                int before = results.size();
                for (Candidate candidate : extractor.extractImages(document, entry.url(), sourceTag)) {
                    if (results.size() >= maxImages) {
                        break;
                    }
                    if (seenUrls.add(candidate.url())) {
                        results.add(candidate);
                    }
                }
                log.debug("Page {} (depth {}) yielded {} new image(s)", entry.url(), entry.depth(), results.size() - before);

                if (results.size() < maxImages && entry.depth() < options.maxDepth()) {
                    int queued = 0;
                    for (String link : extractor.extractLinks(document, entry.url(), seed)) {
                        if (frontier.offer(link, entry.depth() + 1)) {
                            queued++;
                        }
                    }
                    log.debug("Queued {} link(s) from {} at depth {}", queued, entry.url(), entry.depth() + 1);
                }
            }

            if (!pause(options.delay())) {
                log.warn("Crawl of {} interrupted", seed);
                break;
            }
        }

        log.info("Crawl of {} finished: {} page(s) visited, {} candidate(s) found",
            seed, frontier.visited().size(), results.size());
        return results;
    }

    private Document fetchDocument(String url) {
        FetchedPage page;
        try {
            page = pageFetcher.fetch(url, properties.getHttp().getPageTimeout()).block();
        } catch (RuntimeException e) {
            log.warn("Failed to fetch {}: {}", url, e.getMessage());
            return null;
        }
        if (page == null || !page.isOk()) {
            log.warn("Skipping {}: HTTP {}", url, page == null ? "no response" : page.status());
            return null;
        }
        if (!page.isHtml()) {
            log.debug("Skipping {}: content type {} is not HTML", url, page.contentType());
            return null;
        }
        String html = charsetDecoder.decode(page.body(), page.contentType());
        return Jsoup.parse(html, url);
    }

    private static boolean pause(Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
