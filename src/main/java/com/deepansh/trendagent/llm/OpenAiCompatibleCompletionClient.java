package com.deepansh.trendagent.llm;

import com.deepansh.trendagent.config.LlmProperties;
import com.deepansh.trendagent.exception.CompletionException;
import com.deepansh.trendagent.model.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * OpenAI-compatible chat completion client; works with Groq, OpenAI and other
 * providers exposing /chat/completions.
 *
 * Error handling:
 *
 * | Error               | Result                                         |
 * |---------------------|------------------------------------------------|
 * | 401                 | CompletionException (bad API key)              |
 * | 429                 | CompletionException (quota / rate limit)       |
 * | other 4xx / 5xx     | CompletionException with status                |
 * | network error       | CompletionException wrapping the cause         |
 * | malformed payload   | CompletionException                            |
 *
 * Upstream bodies are logged, never put into exception messages that may reach users.
 */
@Slf4j
public class OpenAiCompatibleCompletionClient implements CompletionClient {

    private static final String SSE_DATA_PREFIX = "data:";
    private static final String SSE_DONE = "[DONE]";
    private static final String TOOL_RESULT_PREFIX = "Tool result:\n";

    private final LlmProperties props;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;
    private final CloseableHttpClient httpClient;

    public OpenAiCompatibleCompletionClient(LlmProperties props,
                                            ObjectMapper objectMapper,
                                            RestClient.Builder restClientBuilder,
                                            CloseableHttpClient httpClient) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .build();
    }

    @Override
    public String complete(List<Message> messages) {
        Map<String, Object> requestBody = buildRequestBody(messages, false);
        log.debug("Sending {} messages to {} [model={}]", messages.size(), props.getProvider(), props.getModel());

        String responseBody;
        try {
            responseBody = restClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        throw statusError(res.getStatusCode().value(), body);
                    })
                    .body(String.class);
        } catch (RestClientException e) {
            throw new CompletionException(props.getProvider() + " unreachable", e);
        }

        return parseCompletion(responseBody);
    }

    /**
     * Streams over the pooled HttpClient directly so an early stop can abort the
     * exchange. A graceful close would read the rest of the upstream body first.
     */
    @Override
    public void stream(List<Message> messages, TokenConsumer consumer) {
        Map<String, Object> requestBody = buildRequestBody(messages, true);
        log.debug("Streaming {} messages from {} [model={}]", messages.size(), props.getProvider(), props.getModel());

        HttpPost post = new HttpPost(props.getBaseUrl() + "/chat/completions");
        post.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getApiKey());
        post.setHeader(HttpHeaders.ACCEPT, MediaType.TEXT_EVENT_STREAM_VALUE);
        try {
            post.setEntity(new StringEntity(objectMapper.writeValueAsString(requestBody), ContentType.APPLICATION_JSON));
        } catch (JsonProcessingException e) {
            throw new CompletionException("Failed to serialize completion request", e);
        }

        AtomicBoolean stoppedEarly = new AtomicBoolean();
        try {
            httpClient.execute(post, response -> {
                int status = response.getCode();
                if (status >= 400) {
                    String body = response.getEntity() != null ? EntityUtils.toString(response.getEntity()) : "";
                    throw statusError(status, body);
                }
                if (response.getEntity() == null) {
                    return null;
                }
                if (!readEventStream(response.getEntity().getContent(), consumer)) {
                    stoppedEarly.set(true);
                    post.cancel();
                }
                return null;
            });
        } catch (IOException e) {
            if (stoppedEarly.get()) {
                log.debug("Aborted stream released with: {}", e.getMessage());
                return;
            }
            throw new CompletionException(props.getProvider() + " stream failed", e);
        }
    }

    /**
     * Reads SSE lines until [DONE] or end of body.
     *
     * @return false if the consumer declined a token; the caller must abort the exchange
     */
    private boolean readEventStream(InputStream body, TokenConsumer consumer) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8));
        String line;
        while ((line = reader.readLine()) != null) {
            if (!line.startsWith(SSE_DATA_PREFIX)) continue;

            String data = line.substring(SSE_DATA_PREFIX.length()).trim();
            if (SSE_DONE.equals(data)) break;
            if (data.isEmpty()) continue;

            String token;
            try {
                JsonNode chunk = objectMapper.readTree(data);
                token = chunk.path("choices").path(0).path("delta").path("content").asText("");
            } catch (JsonProcessingException e) {
                log.warn("{} sent an unparseable stream chunk, skipping: {}", props.getProvider(), data);
                continue;
            }

            if (!token.isEmpty() && !consumer.accept(token)) {
                log.debug("Token consumer stopped the stream early");
                return false;
            }
        }
        return true;
    }

    private CompletionException statusError(int status, String body) {
        log.error("{} returned HTTP {}: {}", props.getProvider(), status, body);
        if (status == 401) {
            return new CompletionException(props.getProvider()
                    + " API key is invalid. Check the GROQ_API_KEY / llm.api-key setting");
        }
        if (status == 429) {
            return new CompletionException(props.getProvider() + " rate limit or quota exceeded");
        }
        return new CompletionException(props.getProvider() + " returned HTTP " + status);
    }

    private String parseCompletion(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            throw new CompletionException(props.getProvider() + " returned an empty response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new CompletionException(props.getProvider() + " returned malformed JSON", e);
        }

        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new CompletionException(props.getProvider() + " returned no choices in response");
        }

        JsonNode usage = root.path("usage");
        if (!usage.isMissingNode()) {
            log.debug("Token usage: prompt={} completion={}",
                    usage.path("prompt_tokens").asInt(), usage.path("completion_tokens").asInt());
        }

        return choices.path(0).path("message").path("content").asText("");
    }

    private Map<String, Object> buildRequestBody(List<Message> messages, boolean stream) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", props.getTemperature());
        body.put("messages", messages.stream().map(this::formatMessage).toList());
        if (stream) {
            body.put("stream", true);
        }
        return body;
    }

    /**
     * The provider has no tool_result role: tool output goes back as a user turn,
     * prefixed so the model can tell it apart from the human.
     */
    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();
        String content = msg.getContent() != null ? msg.getContent() : "";
        if (msg.getRole() == Message.Role.tool_result) {
            m.put("role", "user");
            m.put("content", TOOL_RESULT_PREFIX + content);
        } else {
            m.put("role", msg.getRole().name());
            m.put("content", content);
        }
        return m;
    }
}
