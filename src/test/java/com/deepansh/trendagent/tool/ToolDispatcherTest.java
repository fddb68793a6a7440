package com.deepansh.trendagent.tool;

import com.deepansh.trendagent.config.AgentProperties;
import com.deepansh.trendagent.config.HttpClientConfig;
import com.deepansh.trendagent.config.LlmProperties;
import com.deepansh.trendagent.config.ToolProperties;
import com.deepansh.trendagent.model.ActionRequest;
import com.deepansh.trendagent.model.ToolResult;
import com.deepansh.trendagent.stream.StreamEvent;
import com.deepansh.trendagent.stream.StreamEventEmitter;
import com.deepansh.trendagent.stream.ToolPhase;
import com.deepansh.trendagent.support.RecordingSink;
import com.deepansh.trendagent.support.StubTool;
import com.deepansh.trendagent.tool.impl.TrendsTool;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.core.task.support.TaskExecutorAdapter;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ToolDispatcherTest {

    private ExecutorService toolThreads;
    private RecordingSink sink;
    private StreamEventEmitter emitter;

    @BeforeEach
    void setUp() {
        toolThreads = Executors.newCachedThreadPool();
        sink = new RecordingSink();
        emitter = new StreamEventEmitter("run-1", sink);
    }

    @AfterEach
    void tearDown() {
        toolThreads.shutdownNow();
    }

    private ToolDispatcher dispatcherFor(AgentTool... tools) {
        ToolRegistry registry = new ToolRegistry(List.of(tools), new AgentProperties());
        return new ToolDispatcher(registry, new TaskExecutorAdapter(toolThreads));
    }

    @Test
    void dispatch_success_returnsOutputAndEmitsStartedThenCompleted() {
        StubTool search = StubTool.returning("Tavily_Search", "Search Results for 'x'");

        ToolResult result = dispatcherFor(search)
                .dispatch(new ActionRequest("Tavily_Search", "x"), Duration.ofSeconds(30), emitter);

        assertThat(result.isSucceeded()).isTrue();
        assertThat(result.getOutput()).isEqualTo("Search Results for 'x'");
        assertThat(result.getDuration()).isNotNull();
        assertThat(search.inputs()).containsExactly("x");

        assertThat(sink.toolPhases()).containsExactly(ToolPhase.started, ToolPhase.completed);
        StreamEvent started = sink.events().get(0);
        assertThat(started.toolName()).isEqualTo("Tavily_Search");
        assertThat(started.message()).isEqualTo("Using Tavily Search...");
    }

    @Test
    void dispatch_toolReportsFailure_returnsFailedResult() {
        StubTool trends = new StubTool("Google_Trends_MCP", input -> ToolOutput.failure("MCP server unreachable"));

        ToolResult result = dispatcherFor(trends)
                .dispatch(new ActionRequest("Google_Trends_MCP", ""), Duration.ofSeconds(30), emitter);

        assertThat(result.isSucceeded()).isFalse();
        assertThat(result.getError()).isEqualTo("MCP server unreachable");
        assertThat(sink.toolPhases()).containsExactly(ToolPhase.started, ToolPhase.failed);
        assertThat(sink.events().get(1).message()).isEqualTo("MCP server unreachable");
    }

    @Test
    void dispatch_failureWithoutMessage_getsGenericReason() {
        StubTool tool = new StubTool("Tavily_Search", input -> ToolOutput.failure(" "));

        ToolResult result = dispatcherFor(tool)
                .dispatch(new ActionRequest("Tavily_Search", "q"), Duration.ofSeconds(30), emitter);

        assertThat(result.getError()).isEqualTo("unknown error");
    }

    @Test
    void dispatch_toolThrows_neverPropagates() {
        StubTool tool = new StubTool("Tavily_Search", input -> {
            throw new IllegalArgumentException("bad json");
        });

        ToolResult result = dispatcherFor(tool)
                .dispatch(new ActionRequest("Tavily_Search", "q"), Duration.ofSeconds(30), emitter);

        assertThat(result.isSucceeded()).isFalse();
        assertThat(result.getError()).isEqualTo("execution failed: bad json");
        assertThat(sink.toolPhases()).containsExactly(ToolPhase.started, ToolPhase.failed);
    }

    @Test
    void dispatch_toolExceedsOwnTimeout_isAbandoned() {
        StubTool slow = StubTool.hanging("Tavily_Search", Duration.ofMillis(150));

        long start = System.nanoTime();
        ToolResult result = dispatcherFor(slow)
                .dispatch(new ActionRequest("Tavily_Search", "q"), Duration.ofSeconds(30), emitter);
        Duration took = Duration.ofNanos(System.nanoTime() - start);

        assertThat(result.isSucceeded()).isFalse();
        assertThat(result.getError()).isEqualTo("timed out after 150ms");
        assertThat(took).isLessThan(Duration.ofSeconds(5));
        assertThat(sink.toolPhases()).containsExactly(ToolPhase.started, ToolPhase.failed);
    }

    @Test
    void dispatch_remainingBudgetShorterThanToolTimeout_boundsTheCall() {
        StubTool slow = StubTool.hanging("Tavily_Search", Duration.ofSeconds(5));

        ToolResult result = dispatcherFor(slow)
                .dispatch(new ActionRequest("Tavily_Search", "q"), Duration.ofMillis(100), emitter);

        assertThat(result.getError()).isEqualTo("timed out after 100ms");
    }

    @Test
    void dispatch_unknownTool_listsAvailableTools() {
        ToolResult result = dispatcherFor(StubTool.returning("Tavily_Search", "r"))
                .dispatch(new ActionRequest("Bing_Search", "q"), Duration.ofSeconds(30), emitter);

        assertThat(result.isSucceeded()).isFalse();
        assertThat(result.getError()).contains("Unknown tool 'Bing_Search'").contains("Tavily_Search");
        assertThat(sink.toolPhases()).containsExactly(ToolPhase.started, ToolPhase.failed);
    }

    @Test
    void dispatch_executorRejects_returnsCapacityFailure() {
        ToolRegistry registry = new ToolRegistry(
                List.of(StubTool.returning("Tavily_Search", "r")), new AgentProperties());
        ToolDispatcher dispatcher = new ToolDispatcher(registry, new TaskExecutorAdapter(task -> {
            throw new TaskRejectedException("full");
        }));

        ToolResult result = dispatcher.dispatch(new ActionRequest("Tavily_Search", "q"), Duration.ofSeconds(30), emitter);

        assertThat(result.getError()).contains("capacity exhausted");
        assertThat(sink.toolPhases()).containsExactly(ToolPhase.started, ToolPhase.failed);
    }

    @Test
    void dispatch_budgetExhausted_failsWithoutInvokingTool() {
        StubTool search = StubTool.returning("Tavily_Search", "r");

        ToolResult result = dispatcherFor(search)
                .dispatch(new ActionRequest("Tavily_Search", "q"), Duration.ZERO, emitter);

        assertThat(result.isSucceeded()).isFalse();
        assertThat(result.getError()).isEqualTo("no time left in the loop budget");
        assertThat(search.inputs()).isEmpty();
        assertThat(sink.toolPhases()).containsExactly(ToolPhase.started, ToolPhase.failed);
    }

    @Test
    void dispatch_budgetOverdrawn_failsWithoutInvokingTool() {
        StubTool search = StubTool.returning("Tavily_Search", "r");

        ToolResult result = dispatcherFor(search)
                .dispatch(new ActionRequest("Tavily_Search", "q"), Duration.ofMillis(-250), emitter);

        assertThat(result.getError()).isEqualTo("no time left in the loop budget");
        assertThat(search.inputs()).isEmpty();
    }

    @Test
    void dispatch_httpToolTimesOut_workerIsFreedForTheNextCall() throws Exception {
        MockWebServer server = new MockWebServer();
        server.start();
        ToolProperties props = new ToolProperties();
        props.getTrends().setTimeout(Duration.ofMillis(500));
        props.getTrends().setMcpUrl(server.url("/").toString().replaceAll("/$", ""));

        CloseableHttpClient httpClient = new HttpClientConfig().pooledHttpClient(new LlmProperties());
        ThreadPoolTaskExecutor singleWorker = new ThreadPoolTaskExecutor();
        singleWorker.setCorePoolSize(1);
        singleWorker.setMaxPoolSize(1);
        singleWorker.setQueueCapacity(10);
        singleWorker.initialize();
        try {
            TrendsTool trends = new TrendsTool(props, new ObjectMapper(),
                    new HttpClientConfig().trendsRestClientBuilder(httpClient, props));
            ToolDispatcher dispatcher = new ToolDispatcher(
                    new ToolRegistry(List.of(trends), new AgentProperties()), singleWorker);

            server.enqueue(new MockResponse()
                    .setHeader("Content-Type", "application/json")
                    .setBody("[]")
                    .setHeadersDelay(3, TimeUnit.SECONDS));
            server.enqueue(new MockResponse()
                    .setHeader("Content-Type", "application/json")
                    .setBody("{\"content\": [{\"keyword\": \"eclipse\", \"volume\": \"500K\"}]}"));

            ToolResult first = dispatcher.dispatch(
                    new ActionRequest(TrendsTool.NAME, "US"), Duration.ofSeconds(30), emitter);
            ToolResult second = dispatcher.dispatch(
                    new ActionRequest(TrendsTool.NAME, "US"), Duration.ofSeconds(30), emitter);

            assertThat(first.isSucceeded()).isFalse();
            assertThat(first.getError()).isEqualTo("timed out after 500ms");
            assertThat(second.isSucceeded()).isTrue();
            assertThat(second.getOutput()).contains("1. eclipse (Volume: 500K)");
            assertThat(server.getRequestCount()).isEqualTo(2);
        } finally {
            singleWorker.shutdown();
            httpClient.close();
            server.shutdown();
        }
    }
}
