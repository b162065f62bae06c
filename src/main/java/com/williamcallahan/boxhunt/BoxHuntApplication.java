/**
 * Main application class for BoxHunt
 *
 * @author William Callahan
 *
 * Features:
 * - Command-line entry point for keyword and website harvests
 * - Loads a local .env file so API keys need not be exported
 * - Statistics, cleanup, export and source probing per collection
 * - Runs without an embedded web server
 */

package com.williamcallahan.boxhunt;

import com.williamcallahan.boxhunt.config.HarvestProperties;
import com.williamcallahan.boxhunt.service.CollectionWorkspace;
import com.williamcallahan.boxhunt.service.CollectionWorkspaceFactory;
import com.williamcallahan.boxhunt.service.HarvestOrchestrator;
import com.williamcallahan.boxhunt.service.crawler.CrawlOptions;
import com.williamcallahan.boxhunt.service.source.SourceManager;
import com.williamcallahan.boxhunt.types.CleanupReport;
import com.williamcallahan.boxhunt.types.CollectionReport;
import com.williamcallahan.boxhunt.types.ExportFormat;
import com.williamcallahan.boxhunt.types.MultiKeywordCrawlResult;
import com.williamcallahan.boxhunt.types.SourceTestResult;
import com.williamcallahan.boxhunt.types.WebsiteCrawlResult;
import com.williamcallahan.boxhunt.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.stream.Collectors;

@SpringBootApplication
public class BoxHuntApplication implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BoxHuntApplication.class);

    private final HarvestOrchestrator orchestrator;
    private final CollectionWorkspaceFactory workspaceFactory;
    private final SourceManager keywordSources;
    private final HarvestProperties properties;

    public BoxHuntApplication(HarvestOrchestrator orchestrator,
                              CollectionWorkspaceFactory workspaceFactory,
                              SourceManager keywordSources,
                              HarvestProperties properties) {
        this.orchestrator = orchestrator;
        this.workspaceFactory = workspaceFactory;
        this.keywordSources = keywordSources;
        this.properties = properties;
    }

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        loadDotEnvFile();
        SpringApplication.run(BoxHuntApplication.class, args);
    }

    private static void loadDotEnvFile() {
        Path envFile = Paths.get(".env");
        if (!Files.exists(envFile)) {
            return;
        }
        Properties props = new Properties();
        try (InputStream is = Files.newInputStream(envFile)) {
            props.load(is);
        } catch (IOException | SecurityException e) {
            System.err.println("[ENV] Could not read .env: " + e.getMessage());
            return;
        }
        // Real environment variables win over .env entries
        for (String key : props.stringPropertyNames()) {
            if (System.getenv(key) == null) {
                System.setProperty(key, props.getProperty(key));
            }
        }
    }

    @Override
    public void run(ApplicationArguments args) {
        String collection = firstOptionValue(args, "collection");
        boolean handled = false;

        if (args.containsOption("test-sources")) {
            handled = true;
            reportSourceTests(orchestrator.testSources(selectSources(args)).block());
        }

        if (args.containsOption("crawl") || args.containsOption("resume")) {
            handled = true;
            SourceManager sources = selectSources(args);
            CollectionWorkspace workspace = workspaceFactory.open(collection);
            List<String> keywords = parseList(firstOptionValue(args, "keywords"));
            if (keywords.isEmpty()) {
                keywords = properties.getKeywords();
            }
            int maxPerSource = parseIntArg(args, "max-images", properties.getMaxImagesPerSource());
            Duration delay = parseSecondsArg(args, "delay", properties.getHttp().getRequestDelay());
            MultiKeywordCrawlResult result = args.containsOption("resume")
                ? orchestrator.resume(workspace, sources, keywords, maxPerSource, delay).block()
                : orchestrator.crawlKeywords(workspace, sources, keywords, maxPerSource, delay).block();
            reportKeywordCrawl(result);
        }

        String website = firstOptionValue(args, "website");
        if (ValidationUtils.hasText(website)) {
            handled = true;
            CrawlOptions options = CrawlOptions.defaults(properties)
                .withMaxDepth(parseIntArg(args, "max-depth", properties.getCrawler().getMaxDepth()));
            if (args.containsOption("ignore-robots")) {
                options = options.withRespectRobots(false);
            }
            int maxImages = parseIntArg(args, "max-images", properties.getCrawler().getMaxImages());
            WebsiteCrawlResult result = orchestrator.crawlWebsite(website, collection, maxImages, options).block();
            if (result != null) {
                log.info("Website crawl of {} into '{}': found {}, processed {}, saved {}",
                    result.seedUrl(), result.collection(), result.found(), result.processed(), result.saved());
            }
        }

        if (args.containsOption("stats")) {
            handled = true;
            reportStatistics(orchestrator.statistics(workspaceFactory.open(collection), keywordSources));
        }

        if (args.containsOption("cleanup")) {
            handled = true;
            CleanupReport report = orchestrator.cleanup(workspaceFactory.open(collection));
            log.info("Cleanup complete: {} orphaned file(s) removed, {} failed URL(s) cleared",
                report.orphanedFilesRemoved(), report.failedUrlsCleared());
        }

        String export = firstOptionValue(args, "export");
        if (args.containsOption("export")) {
            handled = true;
            ExportFormat format = ValidationUtils.hasText(export) ? ExportFormat.fromName(export) : ExportFormat.CSV;
            String output = firstOptionValue(args, "output");
            Optional<Path> written = orchestrator.export(workspaceFactory.open(collection), format,
                ValidationUtils.hasText(output) ? Paths.get(output) : null);
            written.ifPresentOrElse(path -> log.info("Exported metadata to {}", path.toAbsolutePath()),
                () -> log.warn("Nothing exported: collection has no metadata yet"));
        }

        if (!handled) {
            logUsage();
        }
    }

    private SourceManager selectSources(ApplicationArguments args) {
        List<String> requested = parseList(firstOptionValue(args, "sources"));
        return requested.isEmpty() ? keywordSources : keywordSources.withSources(requested);
    }

    private void reportKeywordCrawl(MultiKeywordCrawlResult result) {
        if (result == null) {
            return;
        }
        result.results().forEach(keyword -> log.info("  '{}': found {}, processed {}, saved {}",
            keyword.keyword(), keyword.found(), keyword.processed(), keyword.saved()));
        log.info("Keyword crawl complete: {} keyword(s), found {}, processed {}, saved {}",
            result.keywordsProcessed(), result.totalFound(), result.totalProcessed(), result.totalSaved());
        result.errors().forEach(error -> log.warn("  error: {}", error));
    }

    private void reportSourceTests(List<SourceTestResult> results) {
        if (results == null || results.isEmpty()) {
            log.warn("No sources configured to test");
            return;
        }
        for (SourceTestResult result : results) {
            if (result.working()) {
                log.info("Source '{}': OK, {} result(s), e.g. {}", result.source(), result.resultCount(), result.sampleUrls());
            } else {
                log.warn("Source '{}': FAILED {}", result.source(), result.error());
            }
        }
    }

    private void reportStatistics(CollectionReport report) {
        log.info("Collection '{}': {} image(s), {} bytes, avg {}x{}",
            report.collection(), report.store().totalImages(), report.store().totalSize(),
            report.store().avgWidth(), report.store().avgHeight());
        log.info("  sources: {}", report.store().sources());
        log.info("  formats: {}", report.store().fileFormats());
        log.info("  available keyword sources: {}", report.availableSources());
        log.info("  failed URLs this run: {}, unique hashes: {}", report.failedUrlsCount(), report.uniqueHashesCount());
    }

    private static void logUsage() {
        log.info("Usage: boxhunt [--collection=NAME] <command>\n"
            + "  --crawl [--keywords=a,b] [--sources=pexels,unsplash] [--max-images=N] [--delay=SECONDS]\n"
            + "  --resume [same options as --crawl]\n"
            + "  --website=URL [--max-images=N] [--max-depth=D] [--ignore-robots]\n"
            + "  --stats\n"
            + "  --cleanup\n"
            + "  --export=csv|json|xlsx [--output=PATH]\n"
            + "  --test-sources [--sources=...]");
    }

    static List<String> parseList(String value) {
        if (ValidationUtils.isNullOrBlank(value)) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(ValidationUtils::hasText)
            .collect(Collectors.toList());
    }

    private static String firstOptionValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(0);
    }

    private static int parseIntArg(ApplicationArguments args, String name, int defaultValue) {
        String raw = firstOptionValue(args, name);
        if (ValidationUtils.isNullOrBlank(raw)) {
            return defaultValue;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < 0) {
                throw new IllegalArgumentException("--" + name + " must be >= 0, got " + value);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " expects an integer, got '" + raw + "'", e);
        }
    }

    private static Duration parseSecondsArg(ApplicationArguments args, String name, Duration defaultValue) {
        String raw = firstOptionValue(args, name);
        if (ValidationUtils.isNullOrBlank(raw)) {
            return defaultValue;
        }
        try {
            double seconds = Double.parseDouble(raw.trim());
            if (seconds < 0) {
                throw new IllegalArgumentException("--" + name + " must be >= 0, got " + raw);
            }
            return Duration.ofMillis(Math.round(seconds * 1000));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " expects seconds, got '" + raw + "'", e);
        }
    }
}
