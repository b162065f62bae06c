/**
 * Wires the keyword source clients into a SourceManager
 *
 * @author William Callahan
 */
package com.williamcallahan.boxhunt.config;

import com.williamcallahan.boxhunt.service.source.KeywordApiClient;
import com.williamcallahan.boxhunt.service.source.PexelsApiClient;
import com.williamcallahan.boxhunt.service.source.SourceManager;
import com.williamcallahan.boxhunt.service.source.UnsplashApiClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.stream.Collectors;

@Configuration
public class SourceClientConfig {

    private static final Logger log = LoggerFactory.getLogger(SourceClientConfig.class);

    /**
     * Registers keyword clients whose API key is present, Pexels first
     */
    @Bean
    public SourceManager keywordSourceManager(PexelsApiClient pexels, UnsplashApiClient unsplash) {
        List<KeywordApiClient<?>> configured = List.<KeywordApiClient<?>>of(pexels, unsplash).stream()
            .filter(KeywordApiClient::isConfigured)
            .collect(Collectors.toList());
        if (configured.isEmpty()) {
            log.warn("No keyword API keys configured; set PEXELS_API_KEY or UNSPLASH_ACCESS_KEY to enable keyword crawling");
        } else {
            log.info("Keyword sources enabled: {}", configured.stream().map(KeywordApiClient::name).collect(Collectors.toList()));
        }
        return new SourceManager(configured);
    }
}
