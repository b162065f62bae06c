/**
 * Base class for keyword search providers
 *
 * @author William Callahan
 *
 * Features:
 * - One authenticated GET per query, with the page size clamped to the provider maximum
 * - Missing credential returns no results with a warning instead of failing the run
 * - Non-200 responses and transport errors are logged and return no results
 * - Typed response schema per provider, mapped to candidates by a pure function
 */
package com.williamcallahan.boxhunt.service.source;

import com.williamcallahan.boxhunt.config.HarvestProperties;
import com.williamcallahan.boxhunt.model.Candidate;
import com.williamcallahan.boxhunt.types.SourceType;
import com.williamcallahan.boxhunt.util.ExternalApiLogger;
import com.williamcallahan.boxhunt.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.List;

public abstract class KeywordApiClient<R> implements SourceClient {

    private static final int MAX_LOGGED_BODY_CHARS = 300;

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final WebClient webClient;
    private final HarvestProperties.Provider provider;
    private final Duration timeout;
    private final Class<R> responseType;

    protected KeywordApiClient(WebClient.Builder webClientBuilder,
                               HarvestProperties.Provider provider,
                               Duration timeout,
                               Class<R> responseType) {
        this.webClient = webClientBuilder.build();
        this.provider = provider;
        this.timeout = timeout;
        this.responseType = responseType;
    }

    /**
     * Largest page size the provider documents
     */
    protected abstract int maxPageSize();

    protected abstract URI buildSearchUri(String baseUrl, String query, int pageSize);

    protected abstract String authorizationHeader(String apiKey);

    /**
     * Maps a provider response to candidates; missing fields become empty strings or zero
     */
    protected abstract List<Candidate> toCandidates(R response);

    @Override
    public SourceType type() {
        return SourceType.KEYWORD_API;
    }

    public boolean isConfigured() {
        return ValidationUtils.hasText(provider.getApiKey());
    }

    /**
     * Requested count clamped to [1, provider maximum]
     */
    public int clampPageSize(int requested) {
        return Math.max(1, Math.min(requested, maxPageSize()));
    }

    @Override
    public Mono<List<Candidate>> search(String query, int limit) {
        if (ValidationUtils.isNullOrBlank(query) || limit < 1) {
            log.warn("{}: ignoring search with query='{}' and limit={}", name(), query, limit);
            return Mono.just(List.of());
        }
        if (!isConfigured()) {
            ExternalApiLogger.logMissingCredential(log, name(), query);
            return Mono.just(List.of());
        }

        int pageSize = clampPageSize(limit);
        URI uri = buildSearchUri(provider.getBaseUrl(), query, pageSize);
        ExternalApiLogger.logApiCallAttempt(log, name(), "search", query, true);

        return webClient.get()
            .uri(uri)
            .header(HttpHeaders.AUTHORIZATION, authorizationHeader(provider.getApiKey()))
            .accept(MediaType.APPLICATION_JSON)
            .exchangeToMono(response -> readResponse(query, response))
            .timeout(timeout)
            .map(candidates -> candidates.size() > pageSize ? List.copyOf(candidates.subList(0, pageSize)) : candidates)
            .doOnNext(candidates -> ExternalApiLogger.logApiCallSuccess(log, name(), "search", query, candidates.size()))
            .onErrorResume(e -> {
                ExternalApiLogger.logApiCallFailure(log, name(), "search", query,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
                return Mono.just(List.of());
            });
    }

    private Mono<List<Candidate>> readResponse(String query, ClientResponse response) {
        int status = response.statusCode().value();
        if (status != 200) {
            return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> {
                    ExternalApiLogger.logApiCallFailure(log, name(), "search", query,
                        "HTTP " + status + " " + abbreviate(body));
                    return List.<Candidate>of();
                });
        }
        return response.bodyToMono(responseType)
            .map(this::toCandidates)
            .defaultIfEmpty(List.of());
    }

    private static String abbreviate(String body) {
        return body.length() > MAX_LOGGED_BODY_CHARS ? body.substring(0, MAX_LOGGED_BODY_CHARS) + "..." : body;
    }
}
