package com.deepansh.trendagent.model;

/**
 * A tool invocation requested by one completion turn.
 * {@code toolName} is always the registry's canonical name.
 */
public record ActionRequest(String toolName, String toolInput) {
}
