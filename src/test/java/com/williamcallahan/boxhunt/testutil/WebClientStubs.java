package com.williamcallahan.boxhunt.testutil;

import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/** WebClient builders backed by canned responses instead of a network. */
public final class WebClientStubs {
    private WebClientStubs() {}

    /**
     * Builder whose every exchange is answered by {@code responder}; requests are recorded in {@code captured}
     */
    public static WebClient.Builder respondingWith(Function<ClientRequest, ClientResponse> responder,
                                                   List<ClientRequest> captured) {
        ExchangeFunction exchange = request -> {
            captured.add(request);
            return Mono.fromCallable(() -> responder.apply(request));
        };
        return WebClient.builder().exchangeFunction(exchange);
    }

    public static WebClient.Builder respondingWith(Function<ClientRequest, ClientResponse> responder) {
        return respondingWith(responder, new CopyOnWriteArrayList<>());
    }

    public static WebClient.Builder failingWith(RuntimeException error) {
        return WebClient.builder().exchangeFunction(request -> Mono.error(error));
    }

    public static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build();
    }

    public static ClientResponse bytes(HttpStatus status, String contentType, byte[] body) {
        return ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, contentType)
            .body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(body)))
            .build();
    }
}
