package com.williamcallahan.boxhunt.service.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Subset of the Pexels /search response used for candidate mapping
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PexelsSearchResponse(List<Photo> photos) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Photo(int width, int height, String alt, Src src) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Src(String original, String medium) {
    }
}
