package com.deepansh.trendagent.llm;

/**
 * Receives streamed tokens. Returning false asks the client to stop reading and
 * release the upstream stream.
 */
@FunctionalInterface
public interface TokenConsumer {

    boolean accept(String token);
}
