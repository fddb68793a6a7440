package com.deepansh.trendagent.llm;

import com.deepansh.trendagent.config.LlmProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the raw completion client for the configured provider.
 * The loop receives it wrapped by ResilientCompletionClient.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    @Bean("rawCompletionClient")
    public CompletionClient rawCompletionClient(LlmProperties props,
                                                ObjectMapper objectMapper,
                                                RestClient.Builder restClientBuilder,
                                                CloseableHttpClient pooledHttpClient) {
        log.info("================================================================");
        log.info("  Completion provider : {}", props.getProvider().toUpperCase());
        log.info("  Model               : {}", props.getModel());
        log.info("  Base URL            : {}", props.getBaseUrl());
        logKey(props.getApiKey());
        log.info("================================================================");

        return new OpenAiCompatibleCompletionClient(props, objectMapper, restClientBuilder, pooledHttpClient);
    }

    private void logKey(String key) {
        if (key == null || key.isBlank()) {
            log.error("  API key not set! Set env var: GROQ_API_KEY={your-key}");
        } else {
            log.info("  Key: {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
