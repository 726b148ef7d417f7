package com.whereq.memori.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient configuration for the LLM endpoint, the core API and the chat gateway
 */
@Configuration
public class WebClientConfig {

    @Autowired
    private MemoriProperties properties;

    @Bean
    public WebClient.Builder webClientBuilder() {
        return WebClient.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(16 * 1024 * 1024)); // 16MB, vision requests carry base64 images
    }

    @Bean
    @Qualifier("llmWebClient")
    public WebClient llmWebClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(properties.getLlm().getBaseUrl())
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getLlm().getApiKey())
            .build();
    }

    @Bean
    @Qualifier("coreWebClient")
    public WebClient coreWebClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(properties.getCoreApi().getBaseUrl())
            .build();
    }

    @Bean
    @Qualifier("gatewayWebClient")
    public WebClient gatewayWebClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(properties.getGateway().getBaseUrl())
            .build();
    }
}
