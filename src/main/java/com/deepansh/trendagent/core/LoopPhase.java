package com.deepansh.trendagent.core;

/**
 * REASONING → ACTING → REASONING … → FINALIZING → DONE
 */
public enum LoopPhase {
    REASONING,
    ACTING,
    FINALIZING,
    DONE
}
