package com.deepansh.trendagent.stream;

import java.io.IOException;

/**
 * Transport-side receiver of stream events (an SSE connection, a test buffer...).
 * An IOException means the consumer is gone.
 */
@FunctionalInterface
public interface EventSink {

    void send(StreamEvent event) throws IOException;
}
