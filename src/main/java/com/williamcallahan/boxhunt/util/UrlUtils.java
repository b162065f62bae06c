package com.williamcallahan.boxhunt.util;

import org.springframework.lang.Nullable;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.List;
import java.util.Locale;

/**
 * URL manipulation utilities for crawling and image discovery.
 * <p>
 * Every method is null-safe and returns null (or false) for input that
 * cannot be parsed, so callers can filter without try/catch.
 */
public final class UrlUtils {

    private static final List<String> IMAGE_EXTENSIONS = List.of(".jpg", ".jpeg", ".png", ".gif", ".webp", ".bmp", ".svg");
    private static final List<String> IMAGE_PATH_KEYWORDS = List.of("image", "img", "photo", "picture", "pic");

    private UrlUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Resolves a raw reference found in markup against the page it was found on.
     * <p>
     * Drops the fragment, rejects data: URIs and PDF links, and keeps only http/https results.
     * Characters that are not legal in a URI are percent-encoded, so the result always parses.
     *
     * @param baseUrl absolute URL of the page
     * @param rawReference attribute or CSS value as written in the page
     * @return absolute URL, or null if the reference is unusable
     *
     * @example
     * <pre>
     * UrlUtils.resolveReference("https://a.test/g/", "../img/x.jpg#top") → "https://a.test/img/x.jpg"
     * UrlUtils.resolveReference("https://a.test/", "/img/x.jpg?fit=crop|center") → "https://a.test/img/x.jpg?fit=crop%7Ccenter"
     * UrlUtils.resolveReference("https://a.test/", "data:image/png;base64,AAA") → null
     * </pre>
     */
    @Nullable
    public static String resolveReference(@Nullable String baseUrl, @Nullable String rawReference) {
        if (ValidationUtils.isNullOrBlank(baseUrl) || ValidationUtils.isNullOrBlank(rawReference)) {
            return null;
        }
        String reference = stripFragment(rawReference.trim());
        if (reference.isEmpty()) {
            return null;
        }
        String lower = reference.toLowerCase(Locale.ROOT);
        if (lower.startsWith("data:") || lower.startsWith("javascript:") || lower.startsWith("mailto:")) {
            return null;
        }
        try {
            URL resolved = new URL(new URL(baseUrl), reference);
            String protocol = resolved.getProtocol();
            if (!"http".equalsIgnoreCase(protocol) && !"https".equalsIgnoreCase(protocol)) {
                return null;
            }
            if (resolved.getPath().toLowerCase(Locale.ROOT).endsWith(".pdf")) {
                return null;
            }
            // Quotes characters URI rejects (space, |, {, } ...); existing %XX escapes are kept
            return new URI(resolved.getProtocol(), resolved.getAuthority(), resolved.getPath(), resolved.getQuery(), null)
                .toString();
        } catch (MalformedURLException | URISyntaxException e) {
            return null;
        }
    }

    /**
     * Removes a trailing #fragment
     */
    public static String stripFragment(String url) {
        int hash = url.indexOf('#');
        return hash >= 0 ? url.substring(0, hash) : url;
    }

    /**
     * Heuristic for "this URL probably serves an image": an image extension or an
     * image-ish keyword anywhere in the path
     */
    public static boolean isLikelyImageUrl(@Nullable String url) {
        URI uri = parse(url);
        if (uri == null || uri.getRawPath() == null) {
            return false;
        }
        String path = uri.getRawPath().toLowerCase(Locale.ROOT);
        for (String extension : IMAGE_EXTENSIONS) {
            if (path.contains(extension)) {
                return true;
            }
        }
        for (String keyword : IMAGE_PATH_KEYWORDS) {
            if (path.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Host and port as written, lower-cased; null when the URL has no host
     */
    @Nullable
    public static String authority(@Nullable String url) {
        URI uri = parse(url);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        return uri.getPort() >= 0 ? host + ":" + uri.getPort() : host;
    }

    /**
     * True when both URLs have the same host and port
     */
    public static boolean isSameSite(@Nullable String url, @Nullable String other) {
        String first = authority(url);
        return first != null && first.equals(authority(other));
    }

    /**
     * scheme://host[:port] of an absolute URL, used as the robots.txt cache key
     */
    @Nullable
    public static String origin(@Nullable String url) {
        URI uri = parse(url);
        if (uri == null || uri.getScheme() == null || uri.getHost() == null) {
            return null;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        return uri.getPort() >= 0 ? scheme + "://" + host + ":" + uri.getPort() : scheme + "://" + host;
    }

    /**
     * First label of the host without a leading "www."; used as source tag and collection name
     *
     * @example
     * <pre>
     * UrlUtils.domainLabel("https://www.deprintedbox.com/gallery") → "deprintedbox"
     * UrlUtils.domainLabel("http://shop.example.test:8080/")       → "shop"
     * </pre>
     */
    public static String domainLabel(@Nullable String url) {
        URI uri = parse(url);
        if (uri == null || uri.getHost() == null) {
            return "website";
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        int dot = host.indexOf('.');
        String label = dot > 0 ? host.substring(0, dot) : host;
        return label.isEmpty() ? "website" : label;
    }

    /**
     * True for absolute http/https URLs with a host
     */
    public static boolean isHttpUrl(@Nullable String url) {
        URI uri = parse(url);
        return uri != null
            && uri.getHost() != null
            && ("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()));
    }

    @Nullable
    private static URI parse(@Nullable String url) {
        if (ValidationUtils.isNullOrBlank(url)) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
