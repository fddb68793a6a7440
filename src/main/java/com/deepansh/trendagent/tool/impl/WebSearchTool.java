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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Web search tool powered by the Tavily Search API.
 *
 * Output format: optional synthesized answer, then a numbered list of results
 * with title, URL and content snippet. Plain text, ready for the model.
 *
 * Failure behavior:
 * - TAVILY_API_KEY not set: failure, no HTTP call
 * - blank query: failure, no HTTP call
 * - non-2xx or unparseable body: failure carrying the status or parse error
 */
@Component
@Slf4j
public class WebSearchTool implements AgentTool {

    public static final String NAME = "Tavily_Search";

    private final ToolProperties toolProperties;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public WebSearchTool(ToolProperties toolProperties,
                         ObjectMapper objectMapper,
                         @Qualifier("webSearchRestClientBuilder") RestClient.Builder restClientBuilder) {
        this.toolProperties = toolProperties;
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder
                .baseUrl(toolProperties.getWebSearch().getTavily().getBaseUrl())
                .defaultHeader("Accept", "application/json")
                .build();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDisplayName() {
        return "Web Search";
    }

    @Override
    public String getDescription() {
        return "Search the web for current information, news, and recent events. "
                + "INPUT is the search query.";
    }

    @Override
    public Duration getTimeout() {
        return toolProperties.getWebSearch().getTimeout();
    }

    @Override
    public ToolOutput invoke(String input) {
        ToolProperties.WebSearch.Tavily tavily = toolProperties.getWebSearch().getTavily();
        String apiKey = tavily.getApiKey();

        if (apiKey == null || apiKey.isBlank()) {
            return ToolOutput.failure("Tavily API key not configured. Set the TAVILY_API_KEY environment variable");
        }
        if (input == null || input.isBlank()) {
            return ToolOutput.failure("a search query is required");
        }

        String query = input.trim();
        log.info("Tavily search: query='{}' maxResults={}", query, tavily.getMaxResults());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("api_key", apiKey);
        body.put("query", query);
        body.put("max_results", tavily.getMaxResults());
        body.put("include_answer", tavily.isIncludeAnswer());

        String responseBody;
        try {
            responseBody = restClient.post()
                    .uri("/search")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            log.error("Tavily search failed for query='{}' [status={}]", query, e.getStatusCode());
            return ToolOutput.failure("search service returned HTTP " + e.getStatusCode().value());
        } catch (RestClientException e) {
            log.error("Tavily search failed for query='{}'", query, e);
            return ToolOutput.failure("search service unreachable: " + e.getMessage());
        }

        if (responseBody == null || responseBody.isBlank()) {
            return ToolOutput.failure("search service returned an empty response");
        }
        try {
            return ToolOutput.ok(formatResults(query, responseBody));
        } catch (JsonProcessingException e) {
            log.error("Tavily returned malformed JSON for query='{}'", query, e);
            return ToolOutput.failure("search service returned a malformed response");
        }
    }

    String formatResults(String query, String responseBody) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(responseBody);
        StringBuilder sb = new StringBuilder("Search Results for '").append(query).append("':\n\n");

        String answer = root.path("answer").asText("");
        if (!answer.isBlank()) {
            sb.append("Answer: ").append(answer).append("\n\n");
        }

        JsonNode results = root.path("results");
        if (!results.isArray() || results.isEmpty()) {
            return sb.append("No results found.").toString();
        }

        sb.append("Top Results:\n");
        int index = 1;
        for (JsonNode result : results) {
            sb.append('\n').append(index++).append(". ").append(result.path("title").asText("No title")).append('\n');
            sb.append("   URL: ").append(result.path("url").asText("No URL")).append('\n');
            sb.append("   ").append(result.path("content").asText("No content")).append('\n');
        }
        return sb.toString();
    }
}
