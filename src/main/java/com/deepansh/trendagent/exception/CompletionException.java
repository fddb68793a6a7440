package com.deepansh.trendagent.exception;

/**
 * The completion service could not produce a response (unreachable, quota, bad payload).
 * Fatal to the current loop execution.
 */
public class CompletionException extends AgentException {

    public CompletionException(String message) {
        super(message);
    }

    public CompletionException(String message, Throwable cause) {
        super(message, cause);
    }
}
