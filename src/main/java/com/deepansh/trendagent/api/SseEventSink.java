package com.deepansh.trendagent.api;

import com.deepansh.trendagent.stream.EventSink;
import com.deepansh.trendagent.stream.StreamEvent;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * Writes stream events as server-sent events:
 * <pre>
 * event: token
 * data: {"token":"Hello"}
 * </pre>
 * The connection is completed right after the terminal event.
 */
public class SseEventSink implements EventSink {

    private final SseEmitter sseEmitter;

    public SseEventSink(SseEmitter sseEmitter) {
        this.sseEmitter = sseEmitter;
    }

    @Override
    public void send(StreamEvent event) throws IOException {
        sseEmitter.send(SseEmitter.event()
                .name(event.type().wireName())
                .data(event.payload(), MediaType.APPLICATION_JSON));
        if (event.type().isTerminal()) {
            sseEmitter.complete();
        }
    }
}
