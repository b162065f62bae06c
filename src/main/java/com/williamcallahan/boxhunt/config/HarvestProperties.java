/**
 * Harvest configuration properties
 *
 * @author William Callahan
 *
 * Features:
 * - Binds every tunable under the boxhunt prefix
 * - Groups image acceptance, outbound HTTP, crawler and provider settings
 * - Supplies defaults matching the shipped application.properties
 */

package com.williamcallahan.boxhunt.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
@ConfigurationProperties(prefix = "boxhunt")
public class HarvestProperties {

    private String dataDir = "data";
    private String defaultCollection = "keywords";
    private int batchSize = 20;
    private int maxImagesPerSource = 20;
    private List<String> keywords = new ArrayList<>(List.of("cardboard box", "shipping box", "corrugated box"));

    @NestedConfigurationProperty
    private Images images = new Images();

    @NestedConfigurationProperty
    private Http http = new Http();

    @NestedConfigurationProperty
    private Crawler crawler = new Crawler();

    @NestedConfigurationProperty
    private Provider pexels = new Provider("https://api.pexels.com/v1");

    @NestedConfigurationProperty
    private Provider unsplash = new Provider("https://api.unsplash.com");

    public String getDataDir() { return dataDir; }
    public void setDataDir(String dataDir) { this.dataDir = dataDir; }

    public String getDefaultCollection() { return defaultCollection; }
    public void setDefaultCollection(String defaultCollection) { this.defaultCollection = defaultCollection; }

    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

    public int getMaxImagesPerSource() { return maxImagesPerSource; }
    public void setMaxImagesPerSource(int maxImagesPerSource) { this.maxImagesPerSource = maxImagesPerSource; }

    public List<String> getKeywords() { return keywords; }
    public void setKeywords(List<String> keywords) { this.keywords = keywords; }

    public Images getImages() { return images; }
    public void setImages(Images images) { this.images = images; }

    public Http getHttp() { return http; }
    public void setHttp(Http http) { this.http = http; }

    public Crawler getCrawler() { return crawler; }
    public void setCrawler(Crawler crawler) { this.crawler = crawler; }

    public Provider getPexels() { return pexels; }
    public void setPexels(Provider pexels) { this.pexels = pexels; }

    public Provider getUnsplash() { return unsplash; }
    public void setUnsplash(Provider unsplash) { this.unsplash = unsplash; }

    /**
     * Acceptance rules applied to every downloaded image
     */
    public static class Images {
        private int minWidth = 256;
        private int minHeight = 256;
        private List<String> allowedFormats = new ArrayList<>(List.of("jpg", "jpeg", "png", "webp"));
        private long maxFileSize = 10L * 1024 * 1024;
        private int dedupThreshold = 5;
        private float jpegQuality = 0.95f;

        public int getMinWidth() { return minWidth; }
        public void setMinWidth(int minWidth) { this.minWidth = minWidth; }

        public int getMinHeight() { return minHeight; }
        public void setMinHeight(int minHeight) { this.minHeight = minHeight; }

        public List<String> getAllowedFormats() { return allowedFormats; }
        public void setAllowedFormats(List<String> allowedFormats) { this.allowedFormats = allowedFormats; }

        public long getMaxFileSize() { return maxFileSize; }
        public void setMaxFileSize(long maxFileSize) { this.maxFileSize = maxFileSize; }

        public int getDedupThreshold() { return dedupThreshold; }
        public void setDedupThreshold(int dedupThreshold) { this.dedupThreshold = dedupThreshold; }

        public float getJpegQuality() { return jpegQuality; }
        public void setJpegQuality(float jpegQuality) { this.jpegQuality = jpegQuality; }

        /**
         * Checks a file name against the allowed image extensions, case-insensitively
         */
        public boolean isAllowedFileName(String fileName) {
            if (fileName == null) {
                return false;
            }
            int dot = fileName.lastIndexOf('.');
            if (dot < 0 || dot == fileName.length() - 1) {
                return false;
            }
            String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
            return allowedFormats.stream().anyMatch(format -> format.equalsIgnoreCase(extension));
        }
    }

    /**
     * Outbound HTTP behaviour shared by API clients, the crawler and the downloader
     */
    public static class Http {
        private String userAgent = "BoxHunt/1.0 (Image Scraper for Research Purposes)";
        private Duration requestDelay = Duration.ofSeconds(1);
        private int maxConcurrentRequests = 3;
        private Duration pageTimeout = Duration.ofSeconds(30);
        private Duration imageTimeout = Duration.ofSeconds(30);
        private Duration apiTimeout = Duration.ofSeconds(15);
        private Duration robotsTimeout = Duration.ofSeconds(5);

        public String getUserAgent() { return userAgent; }
        public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

        public Duration getRequestDelay() { return requestDelay; }
        public void setRequestDelay(Duration requestDelay) { this.requestDelay = requestDelay; }

        public int getMaxConcurrentRequests() { return maxConcurrentRequests; }
        public void setMaxConcurrentRequests(int maxConcurrentRequests) { this.maxConcurrentRequests = maxConcurrentRequests; }

        public Duration getPageTimeout() { return pageTimeout; }
        public void setPageTimeout(Duration pageTimeout) { this.pageTimeout = pageTimeout; }

        public Duration getImageTimeout() { return imageTimeout; }
        public void setImageTimeout(Duration imageTimeout) { this.imageTimeout = imageTimeout; }

        public Duration getApiTimeout() { return apiTimeout; }
        public void setApiTimeout(Duration apiTimeout) { this.apiTimeout = apiTimeout; }

        public Duration getRobotsTimeout() { return robotsTimeout; }
        public void setRobotsTimeout(Duration robotsTimeout) { this.robotsTimeout = robotsTimeout; }
    }

    public static class Crawler {
        private int maxDepth = 1;
        private int maxImages = 100;
        private boolean respectRobots = true;

        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }

        public int getMaxImages() { return maxImages; }
        public void setMaxImages(int maxImages) { this.maxImages = maxImages; }

        public boolean isRespectRobots() { return respectRobots; }
        public void setRespectRobots(boolean respectRobots) { this.respectRobots = respectRobots; }
    }

    /**
     * Credentials and endpoint for a keyword search provider
     */
    public static class Provider {
        private String apiKey;
        private String baseUrl;

        public Provider() {
        }

        public Provider(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    }
}
