/**
 * Coordinates searches, processing and persistence for keyword and website harvests
 *
 * @author William Callahan
 *
 * Features:
 * - Keyword harvests: search every source, process in batches, append each batch to the store
 * - Sequential multi-keyword runs with a politeness delay and per-keyword error collection
 * - Resume by reloading the dedup index from the store before crawling
 * - Website harvests into a collection named after the seed's domain
 * - Statistics, cleanup, export and source probing for the command line
 */
package com.williamcallahan.boxhunt.service;

import com.williamcallahan.boxhunt.config.HarvestProperties;
import com.williamcallahan.boxhunt.model.Candidate;
import com.williamcallahan.boxhunt.model.MetadataRecord;
import com.williamcallahan.boxhunt.service.crawler.CrawlOptions;
import com.williamcallahan.boxhunt.service.crawler.WebsiteCrawler;
import com.williamcallahan.boxhunt.service.source.SourceClient;
import com.williamcallahan.boxhunt.service.source.SourceManager;
import com.williamcallahan.boxhunt.types.CleanupReport;
import com.williamcallahan.boxhunt.types.CollectionReport;
import com.williamcallahan.boxhunt.types.ExportFormat;
import com.williamcallahan.boxhunt.types.KeywordCrawlResult;
import com.williamcallahan.boxhunt.types.MultiKeywordCrawlResult;
import com.williamcallahan.boxhunt.types.SourceTestResult;
import com.williamcallahan.boxhunt.types.WebsiteCrawlResult;
import com.williamcallahan.boxhunt.util.UrlUtils;
import com.williamcallahan.boxhunt.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
@Slf4j
public class HarvestOrchestrator {

    static final String PROBE_QUERY = "cardboard box";
    static final int PROBE_LIMIT = 5;
    private static final int PROBE_SAMPLE_URLS = 3;
    private static final DateTimeFormatter EXPORT_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final HarvestProperties properties;
    private final CollectionWorkspaceFactory workspaceFactory;
    private final WebsiteCrawler websiteCrawler;

    public HarvestOrchestrator(HarvestProperties properties,
                               CollectionWorkspaceFactory workspaceFactory,
                               WebsiteCrawler websiteCrawler) {
        this.properties = properties;
        this.workspaceFactory = workspaceFactory;
        this.websiteCrawler = websiteCrawler;
    }

    /**
     * Searches every source in the manager for one keyword and persists accepted images
     *
     * @param maxPerSource per-source result limit
     */
    public Mono<KeywordCrawlResult> crawlKeyword(CollectionWorkspace workspace, SourceManager sources,
                                                 String keyword, int maxPerSource) {
        log.info("Crawling keyword '{}' into collection '{}' ({} per source)", keyword, workspace.getName(), maxPerSource);
        return sources.search(keyword, maxPerSource)
            .flatMap(candidates -> processAndSave(workspace, candidates)
                .map(counts -> new KeywordCrawlResult(keyword, candidates.size(), counts[0], counts[1])))
            .doOnNext(result -> log.info("Keyword '{}': found {}, processed {}, saved {}",
                keyword, result.found(), result.processed(), result.saved()));
    }

    /**
     * Crawls keywords one after another, pausing between them; a failing keyword is recorded and skipped
     */
    public Mono<MultiKeywordCrawlResult> crawlKeywords(CollectionWorkspace workspace, SourceManager sources,
                                                       List<String> keywords, int maxPerSource, Duration delay) {
        List<String> usable = keywords == null ? List.of() : keywords.stream()
            .filter(ValidationUtils::hasText)
            .map(String::trim)
            .collect(Collectors.toList());
        if (usable.isEmpty()) {
            log.error("No keywords given; nothing to crawl");
            return Mono.just(MultiKeywordCrawlResult.from(List.of(), List.of()));
        }
        Duration pause = delay == null || delay.isNegative() ? Duration.ZERO : delay;
        List<String> errors = Collections.synchronizedList(new ArrayList<>());

        return Flux.fromIterable(usable)
            .index()
            .concatMap(indexed -> {
                String keyword = indexed.getT2();
                Mono<Long> wait = indexed.getT1() > 0 && !pause.isZero() ? Mono.delay(pause) : Mono.empty();
                return wait.then(Mono.defer(() -> crawlKeyword(workspace, sources, keyword, maxPerSource))
                    .onErrorResume(e -> {
                        log.error("Keyword '{}' failed: {}", keyword, e.getMessage(), e);
                        errors.add(keyword + ": " + e.getMessage());
                        return Mono.empty();
                    }));
            })
            .collectList()
            .map(results -> MultiKeywordCrawlResult.from(results, errors))
            .doOnNext(total -> log.info("Crawled {} keyword(s): found {}, processed {}, saved {}, {} error(s)",
                total.keywordsProcessed(), total.totalFound(), total.totalProcessed(), total.totalSaved(), total.errors().size()));
    }

    /**
     * Reloads the dedup index from the store so nothing accepted earlier is accepted again, then crawls
     */
    public Mono<MultiKeywordCrawlResult> resume(CollectionWorkspace workspace, SourceManager sources,
                                                List<String> keywords, int maxPerSource, Duration delay) {
        return Mono.fromCallable(workspace::reloadDedupIndex)
            .doOnNext(loaded -> log.info("Resuming collection '{}' with {} known hash(es)", workspace.getName(), loaded))
            .then(crawlKeywords(workspace, sources, keywords, maxPerSource, delay));
    }

    /**
     * Crawls a site and persists accepted images.
     *
     * @param collection target collection; blank uses the seed's domain label
     */
    public Mono<WebsiteCrawlResult> crawlWebsite(String seedUrl, String collection, int maxImages, CrawlOptions options) {
        if (!UrlUtils.isHttpUrl(seedUrl)) {
            log.error("Invalid seed URL '{}'; website crawl not started", seedUrl);
            return Mono.just(new WebsiteCrawlResult(seedUrl, collection, 0, 0, 0));
        }
        String collectionName = ValidationUtils.hasText(collection) ? collection : UrlUtils.domainLabel(seedUrl);
        CollectionWorkspace workspace = workspaceFactory.open(collectionName);
        return websiteCrawler.crawl(seedUrl, maxImages, options)
            .flatMap(candidates -> processAndSave(workspace, candidates)
                .map(counts -> new WebsiteCrawlResult(seedUrl, workspace.getName(), candidates.size(), counts[0], counts[1])))
            .doOnNext(result -> log.info("Website {}: found {}, processed {}, saved {} into '{}'",
                seedUrl, result.found(), result.processed(), result.saved(), result.collection()));
    }

    public CollectionReport statistics(CollectionWorkspace workspace, SourceManager sources) {
        return new CollectionReport(workspace.getName(),
            workspace.getStore().statistics(),
            sources.availableSources(),
            workspace.getFailedUrls().size(),
            workspace.getDedupIndex().size());
    }

    /**
     * Removes orphaned image files and clears the failed-URL set
     */
    public CleanupReport cleanup(CollectionWorkspace workspace) {
        int orphans = workspace.getStore().cleanupOrphans();
        int cleared = workspace.getFailedUrls().clear();
        log.info("Cleanup of '{}': {} orphaned file(s) removed, {} failed URL(s) cleared", workspace.getName(), orphans, cleared);
        return new CleanupReport(orphans, cleared);
    }

    /**
     * @param output target path; null writes a timestamped file into the data directory
     */
    public Optional<Path> export(CollectionWorkspace workspace, ExportFormat format, Path output) {
        Path target = output != null ? output : workspaceFactory.getDataDir()
            .resolve("metadata_export_" + LocalDateTime.now().format(EXPORT_TIMESTAMP) + "." + format.getExtension());
        return workspace.getStore().export(format, target);
    }

    /**
     * Runs a small test query against every source in the manager
     */
    public Mono<List<SourceTestResult>> testSources(SourceManager sources) {
        return Flux.fromIterable(sources.getClients())
            .flatMapSequential(client -> testSource(client))
            .collectList();
    }

    private Mono<SourceTestResult> testSource(SourceClient client) {
        return Mono.defer(() -> client.search(PROBE_QUERY, PROBE_LIMIT))
            .defaultIfEmpty(List.of())
            .map(found -> new SourceTestResult(client.name(), !found.isEmpty(), found.size(),
                found.stream().limit(PROBE_SAMPLE_URLS).map(Candidate::url).collect(Collectors.toList()), ""))
            .onErrorResume(e -> Mono.just(new SourceTestResult(client.name(), false, 0, List.of(),
                String.valueOf(e.getMessage()))));
    }

    /**
     * Processes candidates in configured batch sizes, saving each batch before the next starts
     *
     * @return {processed, saved}
     */
    private Mono<int[]> processAndSave(CollectionWorkspace workspace, List<Candidate> candidates) {
        if (candidates.isEmpty()) {
            return Mono.just(new int[]{0, 0});
        }
        return Flux.fromIterable(partition(candidates, Math.max(1, properties.getBatchSize())))
            .concatMap(batch -> workspace.getProcessor().processBatch(batch)
                .map(records -> {
                    List<MetadataRecord> saved = workspace.getStore().save(records);
                    return new int[]{records.size(), saved.size()};
                }))
            .reduce(new int[]{0, 0}, (total, batch) -> new int[]{total[0] + batch[0], total[1] + batch[1]});
    }

    static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> batches = new ArrayList<>();
        for (int start = 0; start < items.size(); start += size) {
            batches.add(items.subList(start, Math.min(items.size(), start + size)));
        }
        return batches;
    }
}
