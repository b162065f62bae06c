package com.williamcallahan.boxhunt.model;

/**
 * An image reference discovered by a source client, not yet downloaded or validated
 *
 * @param url absolute URL of the full-size image
 * @param thumbnailUrl preview URL, empty when the source offers none
 * @param title caption, alt text or description; empty when unknown
 * @param source tag naming the producing source ("pexels", "unsplash", a site label)
 * @param width declared width in pixels, 0 when unknown
 * @param height declared height in pixels, 0 when unknown
 */
public record Candidate(String url, String thumbnailUrl, String title, String source, int width, int height) {

    public Candidate {
        thumbnailUrl = thumbnailUrl == null ? "" : thumbnailUrl;
        title = title == null ? "" : title;
        source = source == null ? "" : source;
    }
}
