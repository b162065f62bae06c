package com.williamcallahan.boxhunt.service.crawler;

import com.williamcallahan.boxhunt.util.ExternalApiLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;

/**
 * Fetches pages and robots.txt files as raw bytes, leaving charset decoding to the caller.
 * Errors (timeouts, connection failures) are signalled; non-200 responses are not.
 */
@Component
@Slf4j
public class PageFetcher {

    private final WebClient webClient;

    public PageFetcher(WebClient.Builder webClientBuilder) {
        this.webClient = webClientBuilder.build();
    }

    public Mono<FetchedPage> fetch(String url, Duration timeout) {
        return Mono.defer(() -> webClient.get()
                .uri(URI.create(url))
                .accept(MediaType.TEXT_HTML, MediaType.APPLICATION_XHTML_XML, MediaType.ALL)
                .exchangeToMono(response -> read(url, response)))
            .timeout(timeout);
    }

    private Mono<FetchedPage> read(String url, ClientResponse response) {
        int status = response.statusCode().value();
        String contentType = response.headers().asHttpHeaders().getFirst(HttpHeaders.CONTENT_TYPE);
        String safeContentType = contentType == null ? "" : contentType;
        if (status != 200) {
            ExternalApiLogger.logHttpResponse(log, status, url, 0);
            return response.releaseBody().thenReturn(new FetchedPage(url, status, safeContentType, new byte[0]));
        }
        return response.bodyToMono(byte[].class)
            .defaultIfEmpty(new byte[0])
            .map(body -> {
                ExternalApiLogger.logHttpResponse(log, status, url, body.length);
                return new FetchedPage(url, status, safeContentType, body);
            });
    }
}
