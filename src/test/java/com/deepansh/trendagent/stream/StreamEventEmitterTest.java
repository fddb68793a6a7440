package com.deepansh.trendagent.stream;

import com.deepansh.trendagent.support.RecordingSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static com.deepansh.trendagent.stream.StreamEventType.DONE;
import static com.deepansh.trendagent.stream.StreamEventType.TOKEN;
import static com.deepansh.trendagent.stream.StreamEventType.TOOL_ACTIVITY;
import static org.assertj.core.api.Assertions.assertThat;

class StreamEventEmitterTest {

    private RecordingSink sink;
    private StreamEventEmitter emitter;

    @BeforeEach
    void setUp() {
        sink = new RecordingSink();
        emitter = new StreamEventEmitter("run-1", sink);
    }

    @Test
    void emit_deliversEventsInOrder() {
        emitter.toolActivity("Tavily_Search", ToolPhase.started, "Using Web Search...");
        emitter.toolActivity("Tavily_Search", ToolPhase.completed, null);
        emitter.token("Hello");
        emitter.done("msg-1");

        assertThat(sink.types()).containsExactly(TOOL_ACTIVITY, TOOL_ACTIVITY, TOKEN, DONE);
        assertThat(emitter.isTerminated()).isTrue();
    }

    @Test
    void emit_dropsEverythingAfterTerminalEvent() {
        emitter.error("boom");

        assertThat(emitter.token("late")).isFalse();
        assertThat(emitter.done(null)).isFalse();
        assertThat(emitter.error("again")).isFalse();
        assertThat(sink.events()).hasSize(1);
    }

    @Test
    void emit_afterCancel_sendsNothing() {
        emitter.cancel();

        assertThat(emitter.token("x")).isFalse();
        assertThat(sink.events()).isEmpty();
        assertThat(emitter.isCancelled()).isTrue();
    }

    @Test
    void emit_sinkFailure_cancelsRunAndFiresHooksOnce() {
        AtomicInteger hookRuns = new AtomicInteger();
        StreamEventEmitter broken = new StreamEventEmitter("run-2", event -> {
            throw new IOException("Broken pipe");
        });
        broken.onCancel(hookRuns::incrementAndGet);

        assertThat(broken.token("a")).isFalse();
        assertThat(broken.token("b")).isFalse();
        broken.cancel();

        assertThat(broken.isCancelled()).isTrue();
        assertThat(hookRuns).hasValue(1);
    }

    @Test
    void onCancel_registeredAfterCancellation_runsImmediately() {
        AtomicInteger hookRuns = new AtomicInteger();
        emitter.cancel();

        emitter.onCancel(hookRuns::incrementAndGet);

        assertThat(hookRuns).hasValue(1);
    }

    @Test
    void cancel_failingHookDoesNotStopOthers() {
        AtomicInteger hookRuns = new AtomicInteger();
        emitter.onCancel(() -> {
            throw new IllegalStateException("hook failed");
        });
        emitter.onCancel(hookRuns::incrementAndGet);

        emitter.cancel();

        assertThat(hookRuns).hasValue(1);
    }

    @Test
    void payload_matchesWireShapes() {
        assertThat(StreamEvent.token("Hi").payload()).isEqualTo(Map.of("token", "Hi"));
        assertThat(StreamEvent.toolActivity("Google_Trends_MCP", ToolPhase.started, "Using Google Trends...").payload())
                .containsEntry("tool", "Google_Trends_MCP")
                .containsEntry("status", "started")
                .containsEntry("message", "Using Google Trends...");
        assertThat(StreamEvent.toolActivity("Google_Trends_MCP", ToolPhase.completed, null).payload())
                .doesNotContainKey("message");
        assertThat(StreamEvent.done("msg-9").payload()).isEqualTo(Map.of("message_id", "msg-9"));
        assertThat(StreamEvent.error("Try again").payload()).isEqualTo(Map.of("error", "Try again"));
    }

    @Test
    void eventTypes_useWireNames() {
        assertThat(TOKEN.wireName()).isEqualTo("token");
        assertThat(TOOL_ACTIVITY.wireName()).isEqualTo("tool_activity");
        assertThat(DONE.isTerminal()).isTrue();
        assertThat(StreamEventType.ERROR.isTerminal()).isTrue();
        assertThat(TOKEN.isTerminal()).isFalse();
    }
}
