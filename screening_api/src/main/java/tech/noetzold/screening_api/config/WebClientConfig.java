package tech.noetzold.screening_api.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    // voyage and risk payloads run to several megabytes
    private static final int MAX_IN_MEMORY_BYTES = 16 * 1024 * 1024;

    @Bean
    public WebClient lloydsWebClient(@Value("${screening.lloyds.base-url:https://api.lloydslistintelligence.com/v1}") String baseUrl,
                                     @Value("${screening.lloyds.api-token:}") String token) {
        return WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.AUTHORIZATION, token)
                .exchangeStrategies(largePayloads())
                .build();
    }

    @Bean
    public WebClient kplerWebClient(@Value("${screening.kpler.base-url:https://api.kpler.com/v2}") String baseUrl,
                                    @Value("${screening.kpler.api-token:}") String token) {
        return WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Basic " + token)
                .exchangeStrategies(largePayloads())
                .build();
    }

    private static ExchangeStrategies largePayloads() {
        return ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .build();
    }
}
