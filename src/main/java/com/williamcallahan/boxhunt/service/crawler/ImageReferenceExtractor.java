/**
 * Extracts image references and follow-up links from parsed HTML
 *
 * @author William Callahan
 *
 * Features:
 * - Reads img src, data-src and data-lazy-src attributes
 * - Reads every candidate URL of each picture source srcset
 * - Reads CSS background-image url(...) values from style attributes and style blocks
 * - Resolves every reference to an absolute http(s) URL and keeps plausible image URLs only
 * - Collects anchor links on the crawl's site
 */
package com.williamcallahan.boxhunt.service.crawler;

import com.williamcallahan.boxhunt.model.Candidate;
import com.williamcallahan.boxhunt.util.UrlUtils;
import com.williamcallahan.boxhunt.util.ValidationUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class ImageReferenceExtractor {

    private static final List<String> IMG_SOURCE_ATTRIBUTES = List.of("src", "data-src", "data-lazy-src");
    private static final Pattern BACKGROUND_IMAGE_PATTERN =
        Pattern.compile("background-image\\s*:\\s*url\\(\\s*[\"']?([^\"')\\s]+)[\"']?\\s*\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_DIGITS = Pattern.compile("^\\s*(\\d+)");

    /**
     * @param document parsed page
     * @param pageUrl absolute URL the page was fetched from
     * @param sourceTag source tag for every candidate
     * @return candidates in document order, unique by URL within the page
     */
    public List<Candidate> extractImages(Document document, String pageUrl, String sourceTag) {
        Map<String, Candidate> found = new LinkedHashMap<>();

        for (Element img : document.select("img")) {
            String title = ValidationUtils.firstNonBlank(img.attr("alt"), img.attr("title"));
            int width = parseDimension(img.attr("width"));
            int height = parseDimension(img.attr("height"));
            for (String attribute : IMG_SOURCE_ATTRIBUTES) {
                addIfImage(found, pageUrl, img.attr(attribute), title, sourceTag, width, height);
            }
        }

        for (Element source : document.select("picture > source[srcset]")) {
            Element picture = source.parent();
            Element fallbackImg = picture == null ? null : picture.selectFirst("img");
            String title = fallbackImg == null ? "" : ValidationUtils.firstNonBlank(fallbackImg.attr("alt"), fallbackImg.attr("title"));
            for (String candidateUrl : srcsetUrls(source.attr("srcset"))) {
                addIfImage(found, pageUrl, candidateUrl, title, sourceTag, 0, 0);
            }
        }

        for (Element styled : document.select("[style]")) {
            addBackgroundImages(found, pageUrl, styled.attr("style"), sourceTag);
        }
        for (Element style : document.select("style")) {
            addBackgroundImages(found, pageUrl, style.data(), sourceTag);
        }

        return new ArrayList<>(found.values());
    }

    /**
     * Anchor links resolved against the page and restricted to the seed's host and port
     */
    public List<String> extractLinks(Document document, String pageUrl, String seedUrl) {
        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : document.select("a[href]")) {
            String resolved = UrlUtils.resolveReference(pageUrl, anchor.attr("href"));
            if (resolved != null && UrlUtils.isSameSite(seedUrl, resolved)) {
                links.add(resolved);
            }
        }
        return new ArrayList<>(links);
    }

    /**
     * URLs of a srcset value with their width or density descriptors removed, in declaration order
     */
    static List<String> srcsetUrls(String srcset) {
        if (ValidationUtils.isNullOrBlank(srcset)) {
            return List.of();
        }
        List<String> urls = new ArrayList<>();
        for (String entry : srcset.split(",")) {
            String trimmed = entry.trim();
            if (!trimmed.isEmpty()) {
                urls.add(trimmed.split("\\s+")[0]);
            }
        }
        return urls;
    }

    static int parseDimension(String value) {
        if (ValidationUtils.isNullOrBlank(value)) {
            return 0;
        }
        Matcher matcher = LEADING_DIGITS.matcher(value);
        if (!matcher.find()) {
            return 0;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static void addBackgroundImages(Map<String, Candidate> found, String pageUrl, String css, String sourceTag) {
        if (ValidationUtils.isNullOrBlank(css)) {
            return;
        }
        Matcher matcher = BACKGROUND_IMAGE_PATTERN.matcher(css);
        while (matcher.find()) {
            addIfImage(found, pageUrl, matcher.group(1), "", sourceTag, 0, 0);
        }
    }

    private static void addIfImage(Map<String, Candidate> found, String pageUrl, String rawReference,
                                   String title, String sourceTag, int width, int height) {
        String resolved = UrlUtils.resolveReference(pageUrl, rawReference);
        if (resolved == null || found.containsKey(resolved) || !UrlUtils.isLikelyImageUrl(resolved)) {
            return;
        }
        found.put(resolved, new Candidate(resolved, resolved, title, sourceTag, width, height));
    }
}
