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
 * Pexels photo search; the API key is sent as-is in the Authorization header
 */
@Component
public class PexelsApiClient extends KeywordApiClient<PexelsSearchResponse> {

    public static final String NAME = "pexels";
    static final int MAX_PER_PAGE = 80;

    public PexelsApiClient(WebClient.Builder webClientBuilder, HarvestProperties properties) {
        super(webClientBuilder, properties.getPexels(), properties.getHttp().getApiTimeout(), PexelsSearchResponse.class);
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
            .pathSegment("search")
            .queryParam("query", query)
            .queryParam("per_page", pageSize)
            .queryParam("size", "medium")
            .encode()
            .build()
            .toUri();
    }

    @Override
    protected String authorizationHeader(String apiKey) {
        return apiKey;
    }

    @Override
    protected List<Candidate> toCandidates(PexelsSearchResponse response) {
        if (response == null || response.photos() == null) {
            return List.of();
        }
        List<Candidate> candidates = new ArrayList<>(response.photos().size());
        for (PexelsSearchResponse.Photo photo : response.photos()) {
            if (photo == null || photo.src() == null || ValidationUtils.isNullOrBlank(photo.src().original())) {
                continue;
            }
            candidates.add(new Candidate(photo.src().original(), photo.src().medium(), photo.alt(),
                NAME, photo.width(), photo.height()));
        }
        return candidates;
    }
}
