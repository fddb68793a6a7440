package com.deepansh.trendagent.tool.impl;

import com.deepansh.trendagent.config.ToolProperties;
import com.deepansh.trendagent.tool.AgentTool;
import com.deepansh.trendagent.tool.ToolOutput;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Trending search terms from the Google News Trends MCP server.
 *
 * Calls the server's HTTP tool endpoint:
 *   POST {mcp-url}/mcp/tools/call
 *   {"name": "get_trending_terms", "arguments": {"geo": "US", "full_data": false}}
 *
 * The response is either {"content": [...]} or a bare array. Entries may be
 * {"keyword", "volume"} objects, MCP text blocks {"type": "text", "text"} or plain strings.
 */
@Component
@Slf4j
public class TrendsTool implements AgentTool {

    public static final String NAME = "Google_Trends_MCP";

    private static final Pattern GEO_CODE = Pattern.compile("^[A-Za-z]{2}$");

    private final ToolProperties toolProperties;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public TrendsTool(ToolProperties toolProperties,
                      ObjectMapper objectMapper,
                      @Qualifier("trendsRestClientBuilder") RestClient.Builder restClientBuilder) {
        this.toolProperties = toolProperties;
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder
                .baseUrl(toolProperties.getTrends().getMcpUrl())
                .defaultHeader("Accept", "application/json")
                .build();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDisplayName() {
        return "Google Trends";
    }

    @Override
    public String getDescription() {
        return "Get trending topics and popular searches right now. "
                + "INPUT may be a two-letter country code (e.g. US, GB); leave it empty for the default region.";
    }

    @Override
    public Duration getTimeout() {
        return toolProperties.getTrends().getTimeout();
    }

    @Override
    public ToolOutput invoke(String input) {
        String geo = resolveGeo(input);
        log.info("Fetching trending terms for geo={}", geo);

        Map<String, Object> payload = Map.of(
                "name", "get_trending_terms",
                "arguments", Map.of("geo", geo, "full_data", false));

        String responseBody;
        try {
            responseBody = restClient.post()
                    .uri("/mcp/tools/call")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            log.error("MCP trends call failed [geo={}, status={}]", geo, e.getStatusCode());
            return ToolOutput.failure("trends service returned HTTP " + e.getStatusCode().value());
        } catch (RestClientException e) {
            log.error("MCP trends call failed [geo={}]", geo, e);
            return ToolOutput.failure("trends service unreachable: " + e.getMessage());
        }

        if (responseBody == null || responseBody.isBlank()) {
            return ToolOutput.failure("trends service returned an empty response");
        }
        try {
            return ToolOutput.ok(formatTrends(geo, objectMapper.readTree(responseBody)));
        } catch (JsonProcessingException e) {
            log.error("MCP trends returned malformed JSON [geo={}]", geo, e);
            return ToolOutput.failure("trends service returned a malformed response");
        }
    }

    @Override
    public boolean isHealthy() {
        try {
            restClient.get().uri("/healthz").retrieve().toBodilessEntity();
            return true;
        } catch (RestClientException e) {
            log.warn("MCP health check failed: {}", e.getMessage());
            return false;
        }
    }

    String formatTrends(String geo, JsonNode root) {
        JsonNode trends = root.isObject() ? root.path("content") : root;
        StringBuilder sb = new StringBuilder("Google Trends (").append(geo).append("):\n\n");

        if (!trends.isArray() || trends.isEmpty()) {
            return sb.append("No trends data available.").toString();
        }

        int limit = toolProperties.getTrends().getMaxTerms();
        int index = 1;
        for (JsonNode trend : trends) {
            if (index > limit) break;
            sb.append(index++).append(". ").append(describe(trend)).append('\n');
        }
        return sb.toString();
    }

    private String describe(JsonNode trend) {
        if (trend.hasNonNull("keyword")) {
            return trend.get("keyword").asText() + " (Volume: " + trend.path("volume").asText("N/A") + ")";
        }
        if (trend.hasNonNull("text")) {
            return trend.get("text").asText();
        }
        return trend.isValueNode() ? trend.asText() : trend.toString();
    }

    private String resolveGeo(String input) {
        if (input != null && GEO_CODE.matcher(input.trim()).matches()) {
            return input.trim().toUpperCase(Locale.ROOT);
        }
        return toolProperties.getTrends().getDefaultGeo();
    }
}
