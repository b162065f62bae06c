/**
 * Downloads candidate images with size limits
 *
 * @author William Callahan
 *
 * Features:
 * - Rejects on a declared Content-Length above the limit without reading the body
 * - Re-checks the actual body length after download
 * - Maps non-200 responses, timeouts and transport errors to failure statuses
 * - Never errors; every outcome is a DownloadResult
 */
package com.williamcallahan.boxhunt.service.image;

import com.williamcallahan.boxhunt.config.HarvestProperties;
import com.williamcallahan.boxhunt.types.DownloadResult;
import com.williamcallahan.boxhunt.types.ImageAttemptStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.TimeoutException;

@Service
@Slf4j
public class ImageDownloader {

    private final WebClient webClient;
    private final long maxFileSize;
    private final Duration timeout;

    public ImageDownloader(WebClient.Builder webClientBuilder, HarvestProperties properties) {
        this.webClient = webClientBuilder.build();
        this.maxFileSize = properties.getImages().getMaxFileSize();
        this.timeout = properties.getHttp().getImageTimeout();
    }

    public Mono<DownloadResult> download(String url) {
        return Mono.defer(() -> webClient.get()
                .uri(URI.create(url))
                .accept(MediaType.ALL)
                .exchangeToMono(response -> readResponse(url, response)))
            .timeout(timeout)
            .onErrorResume(e -> Mono.just(classifyError(url, e)));
    }

    private Mono<DownloadResult> readResponse(String url, ClientResponse response) {
        int status = response.statusCode().value();
        if (status != 200) {
            log.debug("Download of {} returned HTTP {}", url, status);
            return response.releaseBody()
                .thenReturn(DownloadResult.failure(url, ImageAttemptStatus.FAILURE_HTTP_STATUS, "HTTP " + status));
        }
        OptionalLong declaredLength = response.headers().contentLength();
        if (declaredLength.isPresent() && declaredLength.getAsLong() > maxFileSize) {
            log.debug("Skipping {}: declared size {} exceeds limit {}", url, declaredLength.getAsLong(), maxFileSize);
            return response.releaseBody()
                .thenReturn(DownloadResult.failure(url, ImageAttemptStatus.FAILURE_OVERSIZED,
                    "declared size " + declaredLength.getAsLong()));
        }
        return response.bodyToMono(byte[].class)
            .defaultIfEmpty(new byte[0])
            .map(bytes -> {
                if (bytes.length == 0) {
                    return DownloadResult.failure(url, ImageAttemptStatus.FAILURE_EMPTY_CONTENT, "empty body");
                }
                if (bytes.length > maxFileSize) {
                    return DownloadResult.failure(url, ImageAttemptStatus.FAILURE_OVERSIZED, "actual size " + bytes.length);
                }
                return DownloadResult.success(url, bytes);
            });
    }

    private DownloadResult classifyError(String url, Throwable error) {
        if (isBufferLimit(error)) {
            log.debug("Skipping {}: body exceeded buffer limit", url);
            return DownloadResult.failure(url, ImageAttemptStatus.FAILURE_OVERSIZED, "body exceeded buffer limit");
        }
        String reason = error instanceof TimeoutException
            ? "timed out after " + timeout.toMillis() + "ms"
            : error.getClass().getSimpleName() + ": " + error.getMessage();
        log.warn("Download failed for {}: {}", url, reason);
        return DownloadResult.failure(url, ImageAttemptStatus.FAILURE_TRANSPORT, reason);
    }

    // Codecs may wrap the limit exception
    private static boolean isBufferLimit(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof DataBufferLimitException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }
}
