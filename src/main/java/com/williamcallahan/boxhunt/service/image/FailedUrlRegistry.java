package com.williamcallahan.boxhunt.service.image;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * URLs that failed to download during this process, skipped until explicitly cleared.
 * Entries never expire on their own.
 */
public class FailedUrlRegistry {

    private final Set<String> failedUrls = ConcurrentHashMap.newKeySet();

    public void add(String url) {
        if (url != null) {
            failedUrls.add(url);
        }
    }

    public boolean contains(String url) {
        return url != null && failedUrls.contains(url);
    }

    public int size() {
        return failedUrls.size();
    }

    /**
     * @return number of entries removed
     */
    public synchronized int clear() {
        int count = failedUrls.size();
        failedUrls.clear();
        return count;
    }
}
