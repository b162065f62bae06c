/**
 * Concurrent fan-out of a query to every configured source client
 *
 * @author William Callahan
 *
 * Features:
 * - Runs all client searches concurrently and waits for all of them
 * - Concatenates results in client registration order
 * - Isolates client failures: an erroring or empty client contributes nothing
 * - Reports zero candidates immediately when no clients are configured
 */
package com.williamcallahan.boxhunt.service.source;

import com.williamcallahan.boxhunt.model.Candidate;
import com.williamcallahan.boxhunt.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
public class SourceManager {

    private final List<SourceClient> clients;

    public SourceManager(List<? extends SourceClient> clients) {
        this.clients = List.copyOf(clients);
    }

    /**
     * @param query non-empty query string
     * @param limitPerSource positive per-client limit
     * @return union of all clients' candidates, never an error
     */
    public Mono<List<Candidate>> search(String query, int limitPerSource) {
        if (clients.isEmpty()) {
            log.error("No source clients configured; returning no candidates for '{}'", query);
            return Mono.just(List.of());
        }
        if (ValidationUtils.isNullOrBlank(query) || limitPerSource < 1) {
            log.error("Invalid search: query='{}', limitPerSource={}", query, limitPerSource);
            return Mono.just(List.of());
        }

        return Flux.fromIterable(clients)
            .flatMapSequential(client -> Mono.defer(() -> client.search(query, limitPerSource))
                .onErrorResume(e -> {
                    log.error("Source '{}' failed for '{}': {}", client.name(), query, e.getMessage(), e);
                    return Mono.just(List.of());
                })
                .defaultIfEmpty(List.of())
                .doOnNext(found -> log.info("Source '{}' returned {} candidate(s) for '{}'", client.name(), found.size(), query)))
            .collectList()
            .map(perClient -> {
                List<Candidate> merged = new ArrayList<>();
                perClient.forEach(merged::addAll);
                log.info("Found {} candidate(s) across {} source(s) for '{}'", merged.size(), clients.size(), query);
                return merged;
            });
    }

    public List<String> availableSources() {
        return clients.stream().map(SourceClient::name).collect(Collectors.toList());
    }

    public List<SourceClient> getClients() {
        return clients;
    }

    /**
     * Narrows the manager to the named clients, keeping registration order; unknown names are logged and ignored
     */
    public SourceManager withSources(Collection<String> names) {
        if (ValidationUtils.isNullOrEmpty(names)) {
            return this;
        }
        Set<String> wanted = names.stream()
            .filter(ValidationUtils::hasText)
            .map(name -> name.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
        List<SourceClient> selected = clients.stream()
            .filter(client -> wanted.contains(client.name().toLowerCase(Locale.ROOT)))
            .collect(Collectors.toList());
        wanted.stream()
            .filter(name -> selected.stream().noneMatch(client -> client.name().equalsIgnoreCase(name)))
            .forEach(name -> log.warn("Requested source '{}' is not configured; available: {}", name, availableSources()));
        return new SourceManager(selected);
    }
}
