/**
 * Turns batches of candidates into metadata records for one collection
 *
 * @author William Callahan
 *
 * Features:
 * - Bounds in-flight downloads to the configured maximum; later stages are not limited by it
 * - Skips URLs already in the failed-URL set and records new fetch failures there
 * - Validates, fingerprints and deduplicates on the image processing scheduler
 * - Writes accepted images as JPEG into the collection's images directory
 * - Isolates failures per candidate so one bad image never aborts a batch
 */
package com.williamcallahan.boxhunt.service.image;

import com.williamcallahan.boxhunt.model.Candidate;
import com.williamcallahan.boxhunt.model.MetadataRecord;
import com.williamcallahan.boxhunt.model.PerceptualHash;
import com.williamcallahan.boxhunt.types.DownloadResult;
import com.williamcallahan.boxhunt.types.ImageAttemptStatus;
import com.williamcallahan.boxhunt.types.ProcessedImage;
import com.williamcallahan.boxhunt.util.ImageFileNames;
import com.williamcallahan.boxhunt.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Slf4j
public class ImageProcessor {

    private final ImageDownloader downloader;
    private final ImageProcessingService imageProcessingService;
    private final PerceptualHasher hasher;
    private final DedupIndex dedupIndex;
    private final FailedUrlRegistry failedUrls;
    private final Path imagesDir;
    private final int maxConcurrentDownloads;
    private final Scheduler imageScheduler;
    private final Clock clock;

    public ImageProcessor(ImageDownloader downloader,
                          ImageProcessingService imageProcessingService,
                          PerceptualHasher hasher,
                          DedupIndex dedupIndex,
                          FailedUrlRegistry failedUrls,
                          Path imagesDir,
                          int maxConcurrentDownloads,
                          Scheduler imageScheduler,
                          Clock clock) {
        if (maxConcurrentDownloads < 1) {
            throw new IllegalArgumentException("maxConcurrentDownloads must be >= 1, got " + maxConcurrentDownloads);
        }
        this.downloader = downloader;
        this.imageProcessingService = imageProcessingService;
        this.hasher = hasher;
        this.dedupIndex = dedupIndex;
        this.failedUrls = failedUrls;
        this.imagesDir = imagesDir;
        this.maxConcurrentDownloads = maxConcurrentDownloads;
        this.imageScheduler = imageScheduler;
        this.clock = clock;
    }

    /**
     * Processes a batch; the resulting records carry id 0 until the metadata store assigns one.
     *
     * @param candidates candidates in any order
     * @return records for accepted images, in completion order
     */
    public Mono<List<MetadataRecord>> processBatch(List<Candidate> candidates) {
        if (ValidationUtils.isNullOrEmpty(candidates)) {
            return Mono.just(List.of());
        }
        log.info("Processing batch of {} candidate(s) with up to {} concurrent download(s)",
            candidates.size(), maxConcurrentDownloads);

        return Flux.fromIterable(candidates)
            .flatMap(candidate -> download(candidate)
                .map(result -> new Downloaded(candidate, result)), maxConcurrentDownloads)
            // fromCallable completes empty on a null result
            .flatMap(downloaded -> Mono.fromCallable(() -> accept(downloaded.candidate(), downloaded.result()).orElse(null))
                .subscribeOn(imageScheduler)
                .onErrorResume(e -> {
                    log.error("Failed to process {}: {}", downloaded.candidate().url(), e.getMessage(), e);
                    return Mono.empty();
                }))
            .collectList()
            .doOnNext(records -> log.info("Batch complete: {} of {} candidate(s) accepted", records.size(), candidates.size()));
    }

    private Mono<DownloadResult> download(Candidate candidate) {
        String url = candidate.url();
        return Mono.defer(() -> {
            if (failedUrls.contains(url)) {
                log.debug("Skipping previously failed URL {}", url);
                return Mono.just(DownloadResult.failure(url, ImageAttemptStatus.SKIPPED_FAILED_URL, "previously failed"));
            }
            return downloader.download(url)
                .onErrorResume(e -> Mono.just(DownloadResult.failure(url, ImageAttemptStatus.FAILURE_TRANSPORT, e.getMessage())))
                // Recorded before the download slot is released
                .doOnNext(result -> {
                    if (!result.isSuccess() && result.status().marksUrlAsFailed()) {
                        failedUrls.add(url);
                        log.debug("Marked {} as failed ({}: {})", url, result.status(), result.detail());
                    }
                });
        });
    }

    private Optional<MetadataRecord> accept(Candidate candidate, DownloadResult result) {
        if (!result.isSuccess()) {
            return Optional.empty();
        }
        Instant downloadedAt = clock.instant();

        ProcessedImage processed = imageProcessingService.validate(result.bytes(), candidate.url());
        if (!processed.isProcessingSuccessful()) {
            log.debug("Rejected {} ({}): {}", candidate.url(), processed.getStatus(), processed.getProcessingError());
            return Optional.empty();
        }

        PerceptualHash hash = hasher.hash(processed.getImage());
        if (!dedupIndex.tryAdd(hash)) {
            log.debug("Rejected {} ({}): hash {}", candidate.url(), ImageAttemptStatus.REJECTED_DUPLICATE, hash);
            return Optional.empty();
        }

        String filename = ImageFileNames.generate(candidate.source(), downloadedAt.getEpochSecond(), candidate.url());
        long fileSize;
        try {
            byte[] jpeg = imageProcessingService.encodeJpeg(processed.getImage());
            Files.createDirectories(imagesDir);
            Files.write(imagesDir.resolve(filename), jpeg);
            fileSize = jpeg.length;
        } catch (IOException e) {
            dedupIndex.remove(hash);
            throw new UncheckedIOException("Failed to write " + filename, e);
        }

        log.debug("Accepted {} as {} ({}x{}, {} bytes)", candidate.url(), filename,
            processed.getWidth(), processed.getHeight(), fileSize);
        return Optional.of(MetadataRecord.accepted(filename, candidate, processed.getWidth(), processed.getHeight(),
            fileSize, hash, downloadedAt));
    }

    public DedupIndex getDedupIndex() {
        return dedupIndex;
    }

    public FailedUrlRegistry getFailedUrls() {
        return failedUrls;
    }

    private record Downloaded(Candidate candidate, DownloadResult result) {
    }
}
