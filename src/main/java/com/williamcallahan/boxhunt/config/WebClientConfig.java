/**
 * Configuration for the shared WebClient
 * - Defines the builder every outbound HTTP component starts from
 * - Sets connection timeouts and the in-memory codec limit
 *
 * @author William Callahan
 */
package com.williamcallahan.boxhunt.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.util.concurrent.TimeUnit;

/**
 * Configures the application's WebClient builder
 * - Follows redirects, since image hosts and galleries redirect freely
 * - Sends the configured User-Agent on every request
 * - Sizes the codec buffer above the maximum accepted image size
 */
@Configuration
public class WebClientConfig {

    private static final int CODEC_HEADROOM_BYTES = 1024 * 1024;

    /**
     * Creates a pre-configured WebClient Builder bean
     * - Connection timeout of 10 seconds
     * - Read and write timeouts of 30 seconds; per-request timeouts are applied by callers
     *
     * @param properties harvest configuration
     * @return A WebClient Builder instance
     */
    @Bean
    public WebClient.Builder webClientBuilder(HarvestProperties properties) {
        HttpClient httpClient = HttpClient.create()
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10000)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(30, TimeUnit.SECONDS))
                .addHandlerLast(new WriteTimeoutHandler(30, TimeUnit.SECONDS))
            );

        long maxFileSize = properties.getImages().getMaxFileSize();
        int maxInMemory = (int) Math.min(Integer.MAX_VALUE, maxFileSize + CODEC_HEADROOM_BYTES);

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(maxInMemory))
            .build();

        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, properties.getHttp().getUserAgent())
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
