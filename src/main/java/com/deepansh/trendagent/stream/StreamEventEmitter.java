package com.deepansh.trendagent.stream;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ordered, single-terminal event channel for one loop execution.
 *
 * Guarantees:
 * - events reach the sink in the order they were emitted
 * - at most one terminal event (DONE or ERROR); everything after it is dropped
 * - after cancellation nothing more is sent
 *
 * A failed sink write is treated as a consumer disconnect. Cancellation runs the
 * registered hooks so the runner can abandon in-flight work.
 */
@Slf4j
public class StreamEventEmitter {

    private final String runId;
    private final EventSink sink;
    private final List<Runnable> cancelHooks = new CopyOnWriteArrayList<>();

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private boolean terminated;

    public StreamEventEmitter(String runId, EventSink sink) {
        this.runId = runId;
        this.sink = sink;
    }

    public boolean token(String token) {
        return emit(StreamEvent.token(token));
    }

    public boolean toolActivity(String toolName, ToolPhase phase, String message) {
        return emit(StreamEvent.toolActivity(toolName, phase, message));
    }

    public boolean done(String messageId) {
        return emit(StreamEvent.done(messageId));
    }

    public boolean error(String message) {
        return emit(StreamEvent.error(message));
    }

    /**
     * @return true if the event was delivered to the sink
     */
    public synchronized boolean emit(StreamEvent event) {
        if (cancelled.get() || terminated) {
            log.debug("Dropping {} event [run={}, cancelled={}, terminated={}]",
                    event.type(), runId, cancelled.get(), terminated);
            return false;
        }
        if (event.type().isTerminal()) {
            terminated = true;
        }
        try {
            sink.send(event);
            return true;
        } catch (IOException | IllegalStateException e) {
            log.info("Consumer disconnected while sending {} [run={}]: {}",
                    event.type(), runId, e.getMessage());
            cancel();
            return false;
        }
    }

    /** Registers work to abandon when the consumer goes away. Runs immediately if already cancelled. */
    public void onCancel(Runnable hook) {
        cancelHooks.add(hook);
        if (cancelled.get()) {
            hook.run();
        }
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        log.info("Run cancelled [run={}]", runId);
        for (Runnable hook : cancelHooks) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                log.warn("Cancel hook failed [run={}]", runId, e);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public synchronized boolean isTerminated() {
        return terminated;
    }

    public String getRunId() {
        return runId;
    }
}
