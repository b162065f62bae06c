/**
 * Durable record describing one accepted image
 *
 * @author William Callahan
 *
 * Features:
 * - One row of the per-collection metadata CSV, columns in schema order
 * - Snake_case property names shared by the CSV and JSON exports
 * - download_time is epoch seconds with millisecond fraction
 * - Immutable; the store assigns id and created_at through withIdentity
 */
package com.williamcallahan.boxhunt.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "filename", "url", "source", "title", "width", "height", "file_size",
    "perceptual_hash", "download_time", "created_at", "status"})
public record MetadataRecord(
    @JsonProperty("id") long id,
    @JsonProperty("filename") String filename,
    @JsonProperty("url") String url,
    @JsonProperty("source") String source,
    @JsonProperty("title") String title,
    @JsonProperty("width") int width,
    @JsonProperty("height") int height,
    @JsonProperty("file_size") long fileSize,
    @JsonProperty("perceptual_hash") String perceptualHash,
    @JsonProperty("download_time") BigDecimal downloadTime,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("status") String status
) {

    public static final String STATUS_DOWNLOADED = "downloaded";

    /**
     * Builds a record as emitted by the image processor, before the store assigns identity
     */
    public static MetadataRecord accepted(String filename, Candidate candidate, int width, int height,
                                          long fileSize, PerceptualHash hash, Instant downloadedAt) {
        BigDecimal downloadTime = BigDecimal.valueOf(downloadedAt.toEpochMilli(), 3);
        return new MetadataRecord(0L, filename, candidate.url(), candidate.source(), candidate.title(),
            width, height, fileSize, hash.toHex(), downloadTime, "", STATUS_DOWNLOADED);
    }

    public MetadataRecord withIdentity(long newId, String newCreatedAt) {
        return new MetadataRecord(newId, filename, url, source, title, width, height, fileSize,
            perceptualHash, downloadTime, newCreatedAt, status);
    }
}
