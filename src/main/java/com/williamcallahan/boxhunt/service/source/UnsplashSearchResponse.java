package com.williamcallahan.boxhunt.service.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Subset of the Unsplash /search/photos response used for candidate mapping
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UnsplashSearchResponse(List<Result> results) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Result(int width,
                         int height,
                         String description,
                         @JsonProperty("alt_description") String altDescription,
                         Urls urls) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Urls(String regular, String thumb) {
    }
}
