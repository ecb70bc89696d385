package com.deepansh.gateway.llm;

import com.deepansh.gateway.config.GatewayProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.util.concurrent.ExecutorService;

/**
 * Creates the active backend client from gateway.provider.*.
 * Wrapped by ResilientLlmClient with a circuit breaker.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    @Bean("activeLlmClient")
    public ProviderCompleter activeLlmClient(GatewayProperties properties,
                                             ObjectMapper objectMapper,
                                             RestClient.Builder gatewayRestClientBuilder,
                                             @Qualifier("gatewayIoExecutor") ExecutorService ioExecutor) {
        GatewayProperties.Provider provider = properties.getProvider();
        ProviderKind kind = ProviderKind.fromName(provider.getKind());

        String baseUrl = provider.getBaseUrl() == null || provider.getBaseUrl().isBlank()
                ? kind.defaultBaseUrl() : provider.getBaseUrl();

        log.info("================================================================");
        log.info("  Active LLM Provider : {}", kind);
        log.info("  Base URL            : {}", baseUrl);
        log.info("  Model               : {}", provider.getModel());
        logKey(kind, provider.getApiKey());
        log.info("================================================================");

        return new GenericLlmClient(kind, provider, objectMapper, gatewayRestClientBuilder.clone(),
                ioExecutor, properties.getStream().getBufferCapacity());
    }

    private void logKey(ProviderKind kind, String key) {
        if (key == null || key.isBlank()) {
            if (kind.apiKeyRequired()) {
                log.error("  API key not set! Set env var: LLM_API_KEY={your-key}");
                throw new IllegalStateException("API key is required for provider: " + kind.name().toLowerCase());
            }
            log.info("  Key                 : (none)");
        } else {
            log.info("  Key                 : {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
