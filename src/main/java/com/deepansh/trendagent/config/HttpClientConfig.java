package com.deepansh.trendagent.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Scope;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * One pooled Apache HttpClient shared by the completion client and every tool.
 *
 * The pool is thread-safe and carries no per-request state, so concurrent loop
 * executions can share it. The default socket timeout covers the completion
 * service; tool builders bound reads by each tool's own timeout instead.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    private static final Timeout CONNECT_TIMEOUT = Timeout.ofSeconds(5);

    @Bean(destroyMethod = "close")
    public CloseableHttpClient pooledHttpClient(LlmProperties llmProperties) {
        Timeout socketTimeout = Timeout.ofMilliseconds(llmProperties.getReadTimeout().toMillis());

        PoolingHttpClientConnectionManager connectionManager =
                PoolingHttpClientConnectionManagerBuilder.create()
                        .setMaxConnTotal(100)
                        .setMaxConnPerRoute(20)
                        .setDefaultConnectionConfig(ConnectionConfig.custom()
                                .setConnectTimeout(CONNECT_TIMEOUT)
                                .setSocketTimeout(socketTimeout)
                                .build())
                        .build();

        log.info("Pooled HttpClient configured [connectTimeout={}, socketTimeout={}]",
                CONNECT_TIMEOUT, socketTimeout);

        // 429 and 503 would otherwise be resent once; failures surface to the caller instead
        return HttpClients.custom()
                .setConnectionManager(connectionManager)
                .disableAutomaticRetries()
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(socketTimeout)
                        .build())
                .build();
    }

    /**
     * Prototype-scoped so each client customizes its own copy (base URL, headers)
     * without leaking settings into the others.
     */
    @Bean
    @Primary
    @Scope("prototype")
    public RestClient.Builder restClientBuilder(CloseableHttpClient pooledHttpClient) {
        return RestClient.builder()
                .requestFactory(new HttpComponentsClientHttpRequestFactory(pooledHttpClient));
    }

    @Bean
    @Scope("prototype")
    public RestClient.Builder webSearchRestClientBuilder(CloseableHttpClient pooledHttpClient,
                                                        ToolProperties toolProperties) {
        return RestClient.builder()
                .requestFactory(new ToolRequestFactory(pooledHttpClient, toolProperties.getWebSearch().getTimeout()));
    }

    @Bean
    @Scope("prototype")
    public RestClient.Builder trendsRestClientBuilder(CloseableHttpClient pooledHttpClient,
                                                     ToolProperties toolProperties) {
        return RestClient.builder()
                .requestFactory(new ToolRequestFactory(pooledHttpClient, toolProperties.getTrends().getTimeout()));
    }
}
