package com.williamcallahan.boxhunt.service;

import com.williamcallahan.boxhunt.repository.MetadataStore;
import com.williamcallahan.boxhunt.service.image.DedupIndex;
import com.williamcallahan.boxhunt.service.image.FailedUrlRegistry;
import com.williamcallahan.boxhunt.service.image.ImageProcessor;

/**
 * The store, processor and in-memory dedup state belonging to one named collection
 */
public class CollectionWorkspace {

    private final String name;
    private final MetadataStore store;
    private final ImageProcessor processor;
    private final DedupIndex dedupIndex;
    private final FailedUrlRegistry failedUrls;

    public CollectionWorkspace(String name, MetadataStore store, ImageProcessor processor,
                               DedupIndex dedupIndex, FailedUrlRegistry failedUrls) {
        this.name = name;
        this.store = store;
        this.processor = processor;
        this.dedupIndex = dedupIndex;
        this.failedUrls = failedUrls;
    }

    public String getName() {
        return name;
    }

    public MetadataStore getStore() {
        return store;
    }

    public ImageProcessor getProcessor() {
        return processor;
    }

    public DedupIndex getDedupIndex() {
        return dedupIndex;
    }

    public FailedUrlRegistry getFailedUrls() {
        return failedUrls;
    }

    /**
     * Re-reads persisted hashes into the dedup index
     *
     * @return number of hashes loaded
     */
    public int reloadDedupIndex() {
        return dedupIndex.reload(store.loadExistingHashes());
    }
}
