package com.deepansh.trendagent.tool.impl;

import com.deepansh.trendagent.config.ToolProperties;
import com.deepansh.trendagent.tool.ToolOutput;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class TrendsToolTest {

    private static final String CALL_URL = "http://mcp:5000/mcp/tools/call";

    private ToolProperties props;
    private ObjectMapper objectMapper;
    private MockRestServiceServer server;
    private TrendsTool tool;

    @BeforeEach
    void setUp() {
        props = new ToolProperties();
        objectMapper = new ObjectMapper();
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        tool = new TrendsTool(props, objectMapper, builder);
    }

    @Test
    void invoke_emptyInput_usesDefaultGeo() {
        server.expect(requestTo(CALL_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.name").value("get_trending_terms"))
                .andExpect(jsonPath("$.arguments.geo").value("US"))
                .andExpect(jsonPath("$.arguments.full_data").value(false))
                .andRespond(withSuccess("""
                        {"content": [
                          {"keyword": "world series", "volume": "2M+"},
                          {"keyword": "eclipse", "volume": "500K+"}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        ToolOutput output = tool.invoke("");

        server.verify();
        assertThat(output.success()).isTrue();
        assertThat(output.output())
                .startsWith("Google Trends (US):")
                .contains("1. world series (Volume: 2M+)")
                .contains("2. eclipse (Volume: 500K+)");
    }

    @Test
    void invoke_countryCodeInput_overridesGeo() {
        server.expect(requestTo(CALL_URL))
                .andExpect(jsonPath("$.arguments.geo").value("GB"))
                .andRespond(withSuccess("[\"football\", \"budget\"]", MediaType.APPLICATION_JSON));

        ToolOutput output = tool.invoke(" gb ");

        server.verify();
        assertThat(output.output()).contains("Google Trends (GB)").contains("1. football").contains("2. budget");
    }

    @Test
    void invoke_freeTextInput_fallsBackToDefaultGeo() {
        server.expect(requestTo(CALL_URL))
                .andExpect(jsonPath("$.arguments.geo").value("US"))
                .andRespond(withSuccess("{\"content\": []}", MediaType.APPLICATION_JSON));

        ToolOutput output = tool.invoke("what is trending today");

        assertThat(output.output()).endsWith("No trends data available.");
    }

    @Test
    void invoke_serverError_fails() {
        server.expect(requestTo(CALL_URL)).andRespond(withServerError());

        ToolOutput output = tool.invoke("");

        assertThat(output.success()).isFalse();
        assertThat(output.error()).isEqualTo("trends service returned HTTP 500");
    }

    @Test
    void formatTrends_capsAtMaxTermsAndHandlesTextEntries() throws Exception {
        props.getTrends().setMaxTerms(2);

        String text = tool.formatTrends("US", objectMapper.readTree("""
                {"content": [{"type": "text", "text": "alpha"}, {"text": "beta"}, {"text": "gamma"}]}
                """));

        assertThat(text).contains("1. alpha").contains("2. beta").doesNotContain("gamma");
    }

    @Test
    void isHealthy_reflectsHealthEndpoint() {
        server.expect(requestTo("http://mcp:5000/healthz")).andRespond(withSuccess());
        assertThat(tool.isHealthy()).isTrue();

        server.reset();
        server.expect(requestTo("http://mcp:5000/healthz")).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        assertThat(tool.isHealthy()).isFalse();
    }
}
