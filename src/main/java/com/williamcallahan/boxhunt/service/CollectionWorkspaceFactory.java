/**
 * Opens per-collection workspaces under the data directory
 *
 * @author William Callahan
 *
 * Features:
 * - One directory per collection holding images/ and metadata.csv
 * - Fresh dedup index seeded from the collection's store, and a fresh failed-URL set
 * - Workspaces are reused for the lifetime of the process, so a collection's state is never duplicated
 */
package com.williamcallahan.boxhunt.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.boxhunt.config.HarvestProperties;
import com.williamcallahan.boxhunt.repository.MetadataStore;
import com.williamcallahan.boxhunt.service.image.DedupIndex;
import com.williamcallahan.boxhunt.service.image.FailedUrlRegistry;
import com.williamcallahan.boxhunt.service.image.ImageDownloader;
import com.williamcallahan.boxhunt.service.image.ImageProcessingService;
import com.williamcallahan.boxhunt.service.image.ImageProcessor;
import com.williamcallahan.boxhunt.service.image.PerceptualHasher;
import com.williamcallahan.boxhunt.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.scheduler.Scheduler;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
@Slf4j
public class CollectionWorkspaceFactory {

    private final HarvestProperties properties;
    private final ImageDownloader downloader;
    private final ImageProcessingService imageProcessingService;
    private final PerceptualHasher hasher;
    private final ObjectMapper objectMapper;
    private final Scheduler imageScheduler;
    private final Map<String, CollectionWorkspace> workspaces = new ConcurrentHashMap<>();

    public CollectionWorkspaceFactory(HarvestProperties properties,
                                      ImageDownloader downloader,
                                      ImageProcessingService imageProcessingService,
                                      PerceptualHasher hasher,
                                      ObjectMapper objectMapper,
                                      @Qualifier("imageProcessingScheduler") Scheduler imageScheduler) {
        this.properties = properties;
        this.downloader = downloader;
        this.imageProcessingService = imageProcessingService;
        this.hasher = hasher;
        this.objectMapper = objectMapper;
        this.imageScheduler = imageScheduler;
    }

    /**
     * @param collection collection name; blank selects the default collection
     * @throws IllegalArgumentException if the name is not a plain directory name
     */
    public CollectionWorkspace open(String collection) {
        String name = ValidationUtils.hasText(collection) ? collection.trim() : properties.getDefaultCollection();
        validateName(name);
        return workspaces.computeIfAbsent(name, this::create);
    }

    public Path getDataDir() {
        return Paths.get(properties.getDataDir());
    }

    private CollectionWorkspace create(String name) {
        Path collectionDir = getDataDir().resolve(name);
        MetadataStore store = new MetadataStore(collectionDir, properties.getImages(), objectMapper);
        DedupIndex dedupIndex = new DedupIndex(properties.getImages().getDedupThreshold());
        int seeded = dedupIndex.seed(store.loadExistingHashes());
        FailedUrlRegistry failedUrls = new FailedUrlRegistry();
        ImageProcessor processor = new ImageProcessor(downloader, imageProcessingService, hasher, dedupIndex, failedUrls,
            store.getImagesDir(), properties.getHttp().getMaxConcurrentRequests(), imageScheduler, Clock.systemUTC());
        log.info("Opened collection '{}' at {} with {} known hash(es)", name, collectionDir.toAbsolutePath(), seeded);
        return new CollectionWorkspace(name, store, processor, dedupIndex, failedUrls);
    }

    static void validateName(String name) {
        if (ValidationUtils.isNullOrBlank(name) || !name.matches("[\\p{L}\\p{N}._-]+") || name.startsWith(".")) {
            throw new IllegalArgumentException("Invalid collection name: '" + name + "'");
        }
    }
}
