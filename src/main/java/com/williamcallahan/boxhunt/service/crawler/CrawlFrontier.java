package com.williamcallahan.boxhunt.service.crawler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * FIFO frontier for one breadth-first crawl.
 * <p>
 * A URL is handed out by {@link #poll()} at most once, and never at a depth above the maximum.
 * Not thread-safe; owned by a single crawl invocation.
 */
public class CrawlFrontier {

    private final int maxDepth;
    private final Deque<Entry> queue = new ArrayDeque<>();
    private final Set<String> enqueued = new LinkedHashSet<>();
    private final Set<String> visited = new LinkedHashSet<>();

    public CrawlFrontier(int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * @return true if the URL was queued; false if too deep, already queued or already visited
     */
    public boolean offer(String url, int depth) {
        if (url == null || depth > maxDepth || visited.contains(url) || enqueued.contains(url)) {
            return false;
        }
        enqueued.add(url);
        queue.addLast(new Entry(url, depth));
        return true;
    }

    /**
     * Next unvisited entry in FIFO order, marked visited; null when exhausted
     */
    public Entry poll() {
        while (!queue.isEmpty()) {
            Entry next = queue.pollFirst();
            if (next.depth() > maxDepth || !visited.add(next.url())) {
                continue;
            }
            return next;
        }
        return null;
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    /**
     * Visited URLs in visitation order
     */
    public List<String> visited() {
        return new ArrayList<>(visited);
    }

    public record Entry(String url, int depth) {
    }
}
