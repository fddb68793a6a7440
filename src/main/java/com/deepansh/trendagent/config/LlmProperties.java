package com.deepansh.trendagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * OpenAI-compatible completion provider settings. Defaults target Groq.
 */
@ConfigurationProperties(prefix = "llm")
@Data
public class LlmProperties {

    private String provider = "groq";
    private String apiKey = "";
    private String baseUrl = "https://api.groq.com/openai/v1";
    private String model = "llama-3.3-70b-versatile";
    private int maxTokens = 1024;
    private double temperature = 0.7;
    private Duration readTimeout = Duration.ofSeconds(30);
}
