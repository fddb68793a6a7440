package com.deepansh.trendagent.config;

import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.protocol.HttpClientContext;
import org.apache.hc.core5.http.protocol.HttpContext;
import org.apache.hc.core5.util.Timeout;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;

import java.net.URI;
import java.time.Duration;

/**
 * Request factory for tool calls: shares the pooled client but bounds every
 * response read by the tool's own timeout, so a call the dispatcher abandoned
 * gives its worker thread and connection back once that timeout passes.
 */
public class ToolRequestFactory extends HttpComponentsClientHttpRequestFactory {

    private final RequestConfig requestConfig;

    public ToolRequestFactory(CloseableHttpClient httpClient, Duration timeout) {
        super(httpClient);
        Timeout bound = Timeout.ofMilliseconds(timeout.toMillis());
        this.requestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(bound)
                .setResponseTimeout(bound)
                .build();
    }

    @Override
    protected HttpContext createHttpContext(HttpMethod httpMethod, URI uri) {
        HttpClientContext context = HttpClientContext.create();
        context.setRequestConfig(requestConfig);
        return context;
    }
}
