/**
 * In-memory index of accepted perceptual hashes for one collection
 *
 * @author William Callahan
 *
 * Features:
 * - Seeded from the metadata store so resumed runs recognise earlier images
 * - Atomic check-then-insert, so two near-duplicates in one batch cannot both be accepted
 * - Rollback of a reservation when the image could not be persisted
 */
package com.williamcallahan.boxhunt.service.image;

import com.williamcallahan.boxhunt.model.PerceptualHash;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

@Slf4j
public class DedupIndex {

    private final int threshold;
    // Linear scan; a prefix-bucketed structure would be needed for very large collections
    private final List<PerceptualHash> hashes = new ArrayList<>();

    public DedupIndex(int threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("Dedup threshold must be >= 0, got " + threshold);
        }
        this.threshold = threshold;
    }

    /**
     * Loads persisted hashes; unparseable values are logged and skipped
     *
     * @return number of hashes added
     */
    public synchronized int seed(Collection<String> hexHashes) {
        int added = 0;
        for (String hex : hexHashes) {
            try {
                hashes.add(PerceptualHash.fromHex(hex));
                added++;
            } catch (IllegalArgumentException e) {
                log.warn("Skipping invalid perceptual hash '{}' from metadata store: {}", hex, e.getMessage());
            }
        }
        return added;
    }

    /**
     * Replaces the index contents with the given hashes
     *
     * @return number of hashes loaded
     */
    public synchronized int reload(Collection<String> hexHashes) {
        hashes.clear();
        return seed(hexHashes);
    }

    /**
     * Adds the hash unless an existing entry lies within the threshold.
     *
     * @return true if added, false if the hash is a near-duplicate
     */
    public synchronized boolean tryAdd(PerceptualHash candidate) {
        PerceptualHash existing = findNearest(candidate);
        if (existing != null) {
            log.debug("Hash {} is within {} bits of existing {}", candidate, threshold, existing);
            return false;
        }
        hashes.add(candidate);
        return true;
    }

    /**
     * Removes one occurrence of a previously added hash
     */
    public synchronized boolean remove(PerceptualHash hash) {
        return hashes.remove(hash);
    }

    public synchronized int size() {
        return hashes.size();
    }

    private PerceptualHash findNearest(PerceptualHash candidate) {
        for (PerceptualHash existing : hashes) {
            if (existing.isNearDuplicateOf(candidate, threshold)) {
                return existing;
            }
        }
        return null;
    }
}
