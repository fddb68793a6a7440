package com.deepansh.trendagent.exception;

/**
 * Base unchecked exception for failures the agent cannot recover from on its own.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
