package com.deepansh.trendagent.core;

/**
 * Receives the fully streamed answer before the done event is sent.
 */
@FunctionalInterface
public interface FinalAnswerHandler {

    /**
     * @return identifier the storage collaborator assigned to the persisted answer, or null
     */
    String onFinalAnswer(String answer);
}
