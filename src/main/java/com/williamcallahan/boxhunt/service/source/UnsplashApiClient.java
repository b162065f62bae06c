package com.williamcallahan.boxhunt.service.source;

import com.williamcallahan.boxhunt.config.HarvestProperties;
import com.williamcallahan.boxhunt.model.Candidate;
import com.williamcallahan.boxhunt.util.ValidationUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Unsplash photo search, authenticated with a Client-ID access key
 */
@Component
public class UnsplashApiClient extends KeywordApiClient<UnsplashSearchResponse> {

    public static final String NAME = "unsplash";
    static final int MAX_PER_PAGE = 30;

    public UnsplashApiClient(WebClient.Builder webClientBuilder, HarvestProperties properties) {
        super(webClientBuilder, properties.getUnsplash(), properties.getHttp().getApiTimeout(), UnsplashSearchResponse.class);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected int maxPageSize() {
        return MAX_PER_PAGE;
    }

    @Override
    protected URI buildSearchUri(String baseUrl, String query, int pageSize) {
        return UriComponentsBuilder.fromUriString(baseUrl)
            .pathSegment("search", "photos")
            .queryParam("query", query)
            .queryParam("per_page", pageSize)
            .encode()
            .build()
            .toUri();
    }

    @Override
    protected String authorizationHeader(String apiKey) {
        return "Client-ID " + apiKey;
    }

    @Override
    protected List<Candidate> toCandidates(UnsplashSearchResponse response) {
        if (response == null || response.results() == null) {
            return List.of();
        }
        List<Candidate> candidates = new ArrayList<>(response.results().size());
        for (UnsplashSearchResponse.Result result : response.results()) {
            if (result == null || result.urls() == null || ValidationUtils.isNullOrBlank(result.urls().regular())) {
                continue;
            }
            String title = ValidationUtils.firstNonBlank(result.description(), result.altDescription());
            candidates.add(new Candidate(result.urls().regular(), result.urls().thumb(), title,
                NAME, result.width(), result.height()));
        }
        return candidates;
    }
}
