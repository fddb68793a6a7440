package com.deepansh.trendagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Strongly-typed configuration for all tools.
 * Bound from application.yml under the "tools" prefix.
 */
@ConfigurationProperties(prefix = "tools")
@Data
public class ToolProperties {

    private WebSearch webSearch = new WebSearch();
    private Trends trends = new Trends();

    @Data
    public static class WebSearch {
        private Duration timeout = Duration.ofSeconds(10);
        private Tavily tavily = new Tavily();

        @Data
        public static class Tavily {
            private String apiKey = "";
            private String baseUrl = "https://api.tavily.com";
            private int maxResults = 5;
            private boolean includeAnswer = true;
        }
    }

    @Data
    public static class Trends {
        private Duration timeout = Duration.ofSeconds(10);
        private String mcpUrl = "http://mcp:5000";
        private String defaultGeo = "US";
        private int maxTerms = 10;
    }
}
