package com.williamcallahan.boxhunt.service.image;

import com.williamcallahan.boxhunt.config.HarvestProperties;
import com.williamcallahan.boxhunt.testutil.WebClientStubs;
import com.williamcallahan.boxhunt.types.ImageAttemptStatus;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.test.StepVerifier;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class ImageDownloaderTest {

    private static final String URL = "https://img.test/box.jpg";

    private final HarvestProperties properties = new HarvestProperties();

    @Test
    void returnsBodyOnSuccess() {
        byte[] body = {1, 2, 3, 4};
        ImageDownloader downloader = new ImageDownloader(
            WebClientStubs.respondingWith(request -> WebClientStubs.bytes(HttpStatus.OK, "image/jpeg", body)), properties);

        StepVerifier.create(downloader.download(URL))
            .assertNext(result -> {
                assertThat(result.isSuccess()).isTrue();
                assertThat(result.bytes()).containsExactly(1, 2, 3, 4);
            })
            .verifyComplete();
    }

    @Test
    void non200IsHttpStatusFailure() {
        ImageDownloader downloader = new ImageDownloader(
            WebClientStubs.respondingWith(request -> WebClientStubs.bytes(HttpStatus.NOT_FOUND, "text/html", new byte[]{1})),
            properties);

        StepVerifier.create(downloader.download(URL))
            .assertNext(result -> {
                assertThat(result.status()).isEqualTo(ImageAttemptStatus.FAILURE_HTTP_STATUS);
                assertThat(result.detail()).contains("404");
            })
            .verifyComplete();
    }

    @Test
    void declaredLengthAboveLimitIsOversized() {
        ClientResponse response = ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, "image/jpeg")
            .header(HttpHeaders.CONTENT_LENGTH, String.valueOf(50L * 1024 * 1024))
            .body("x")
            .build();
        ImageDownloader downloader = new ImageDownloader(WebClientStubs.respondingWith(request -> response), properties);

        StepVerifier.create(downloader.download(URL))
            .assertNext(result -> assertThat(result.status()).isEqualTo(ImageAttemptStatus.FAILURE_OVERSIZED))
            .verifyComplete();
    }

    @Test
    void actualBodyAboveLimitIsOversized() {
        properties.getImages().setMaxFileSize(100);
        byte[] body = new byte[1000];
        Arrays.fill(body, (byte) 7);
        ImageDownloader downloader = new ImageDownloader(
            WebClientStubs.respondingWith(request -> WebClientStubs.bytes(HttpStatus.OK, "image/jpeg", body)), properties);

        StepVerifier.create(downloader.download(URL))
            .assertNext(result -> assertThat(result.status()).isEqualTo(ImageAttemptStatus.FAILURE_OVERSIZED))
            .verifyComplete();
    }

    @Test
    void emptyBodyIsEmptyContentFailure() {
        ImageDownloader downloader = new ImageDownloader(
            WebClientStubs.respondingWith(request -> WebClientStubs.bytes(HttpStatus.OK, "image/jpeg", new byte[0])),
            properties);

        StepVerifier.create(downloader.download(URL))
            .assertNext(result -> assertThat(result.status()).isEqualTo(ImageAttemptStatus.FAILURE_EMPTY_CONTENT))
            .verifyComplete();
    }

    @Test
    void transportErrorIsMappedNotPropagated() {
        ImageDownloader downloader = new ImageDownloader(
            WebClientStubs.failingWith(new IllegalStateException("connection reset")), properties);

        StepVerifier.create(downloader.download(URL))
            .assertNext(result -> {
                assertThat(result.status()).isEqualTo(ImageAttemptStatus.FAILURE_TRANSPORT);
                assertThat(result.detail()).contains("connection reset");
            })
            .verifyComplete();
    }

    @Test
    void bufferLimitErrorIsOversized() {
        ImageDownloader downloader = new ImageDownloader(
            WebClientStubs.failingWith(new IllegalStateException("decode", new DataBufferLimitException("limit"))),
            properties);

        StepVerifier.create(downloader.download(URL))
            .assertNext(result -> assertThat(result.status()).isEqualTo(ImageAttemptStatus.FAILURE_OVERSIZED))
            .verifyComplete();
    }
}
